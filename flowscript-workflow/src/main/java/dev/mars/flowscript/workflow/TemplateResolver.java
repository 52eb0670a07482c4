/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.flowscript.workflow;

import dev.mars.flowscript.core.Literals;
import dev.mars.flowscript.core.VariableInfo;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code name := "text with {{other}} placeholders"} assignments against the flow's
 * variable table.
 *
 * <p>Substitution is a single pass: inserted text is never scanned again, and a placeholder whose
 * variable does not exist is left exactly as written.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class TemplateResolver {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{\\{([^}]+)\\}\\}");
    private static final Pattern ASSIGNMENT = Pattern.compile("^\\s*([\\p{L}\\p{N}_]+)\\s*:=\\s*(.+?)\\s*;?\\s*$");

    /**
     * Replaces every resolvable placeholder with the variable's text form.
     */
    public String resolve(String template, Map<String, VariableInfo> variables) {
        if (template == null) {
            return null;
        }

        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            VariableInfo variable = variables.get(matcher.group(1).trim());
            String replacement = variable != null ? variable.getValue().asText() : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Splits assignment text into its target name and unquoted value.
     */
    public Optional<Assignment> parseAssignment(String content) {
        if (content == null) {
            return Optional.empty();
        }
        Matcher matcher = ASSIGNMENT.matcher(content);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new Assignment(matcher.group(1), Literals.unquote(matcher.group(2))));
    }

    public boolean hasPlaceholders(String template) {
        return template != null && VARIABLE_PATTERN.matcher(template).find();
    }

    public Set<String> getPlaceholderNames(String template) {
        Set<String> names = new LinkedHashSet<>();
        if (template == null) {
            return names;
        }
        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1).trim());
        }
        return names;
    }

    public record Assignment(String name, String value) {
    }
}
