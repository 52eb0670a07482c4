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

import dev.mars.flowscript.core.FlowValue;
import dev.mars.flowscript.core.Literals;
import dev.mars.flowscript.core.ParameterInfo;
import dev.mars.flowscript.core.StepDefinition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses step declarations:
 *
 * <pre>
 * alias = fq.function.name(p1: type "desc", ...) -> (r1: type "desc", ...) {err_continue: true};
 * alias = fq.function.name[caseID] -> (...);
 * </pre>
 *
 * <p>Parameters may be written {@code name: type "desc"}, {@code name: type} or in the legacy
 * {@code type name} order. Complex types such as {@code map[string]interface{}} are split
 * correctly. A malformed declaration is skipped with a warning.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
class StepDeclarationParser {

    private static final Pattern IDENTIFIER = Pattern.compile("^[\\p{L}_][\\p{L}\\p{N}_]*$");
    private static final Pattern FUNCTION_ID = Pattern.compile("^[\\p{L}_][\\p{L}\\p{N}_]*(\\.[\\p{L}_][\\p{L}\\p{N}_]*)*$");
    private static final Pattern STATIC_STEP = Pattern.compile("^([a-zA-Z_][a-zA-Z0-9_.]*)\\[([^\\]]+)]$");

    boolean isDeclaration(String line) {
        String text = line.trim();
        if (text.startsWith("func ") || text.startsWith("if ") || text.startsWith("var ") || text.contains(":=")) {
            return false;
        }
        int equals = SourceScanner.indexOfTopLevel(text, "=", 0);
        return equals > 0 && text.indexOf("->", equals) > 0 && !text.startsWith("==", equals);
    }

    Optional<StepDefinition> parse(String line, int lineNumber, String desc, ParseState state) {
        String text = SourceScanner.stripComment(line).trim();
        int equals = text.indexOf('=');
        String alias = text.substring(0, equals).trim();
        if (!IDENTIFIER.matcher(alias).matches()) {
            return skip(state, lineNumber, "invalid step alias '" + alias + "'");
        }

        String definition = text.substring(equals + 1).trim();
        int arrow = SourceScanner.indexOfTopLevel(definition, "->", 0);
        if (arrow < 0) {
            return skip(state, lineNumber, "step " + alias + " is missing '->'");
        }
        String inputPart = definition.substring(0, arrow).trim();
        String outputPart = definition.substring(arrow + 2).trim();
        while (outputPart.endsWith(";")) {
            outputPart = outputPart.substring(0, outputPart.length() - 1).trim();
        }

        StepDefinition.Builder builder = StepDefinition.builder().name(alias).desc(desc);

        Matcher staticStep = STATIC_STEP.matcher(inputPart);
        if (staticStep.matches()) {
            builder.function(staticStep.group(1).trim())
                    .isStatic(true)
                    .caseId(staticStep.group(2).trim());
        } else {
            int open = inputPart.indexOf('(');
            int close = SourceScanner.findClosing(inputPart, open);
            if (open <= 0 || close != inputPart.length() - 1) {
                return skip(state, lineNumber, "cannot parse inputs of step " + alias);
            }
            String function = inputPart.substring(0, open).trim();
            if (!FUNCTION_ID.matcher(function).matches()) {
                return skip(state, lineNumber, "invalid function name '" + function + "' for step " + alias);
            }
            builder.function(function)
                    .inputParams(parseParameters(inputPart.substring(open + 1, close), lineNumber, state));
        }

        String outputs;
        String trailing;
        if (outputPart.startsWith("(")) {
            int close = SourceScanner.findClosing(outputPart, 0);
            if (close < 0) {
                return skip(state, lineNumber, "unterminated outputs of step " + alias);
            }
            outputs = outputPart.substring(1, close);
            trailing = outputPart.substring(close + 1).trim();
        } else {
            int metadataStart = SourceScanner.indexOfTopLevel(outputPart, " {", 0);
            if (metadataStart >= 0 && outputPart.endsWith("}")) {
                outputs = outputPart.substring(0, metadataStart);
                trailing = outputPart.substring(metadataStart).trim();
            } else {
                outputs = outputPart;
                trailing = "";
            }
        }
        builder.outputParams(parseParameters(outputs, lineNumber, state));

        if (!trailing.isEmpty()) {
            if (trailing.startsWith("{") && trailing.endsWith("}")) {
                Map<String, FlowValue> metadata = MetadataParser.parse(trailing, message -> state.warn(lineNumber, message));
                builder.metadata(metadata);
            } else {
                state.warn(lineNumber, "ignoring unexpected text after outputs of step " + alias + ": " + trailing);
            }
        }

        return Optional.of(builder.build());
    }

    List<ParameterInfo> parseParameters(String text, int lineNumber, ParseState state) {
        List<ParameterInfo> params = new ArrayList<>();
        for (String entry : SourceScanner.splitTopLevel(text, ',')) {
            ParameterInfo param = parseParameter(entry);
            if (param != null) {
                params.add(param);
            } else {
                state.warn(lineNumber, "ignoring malformed parameter '" + entry + "'");
            }
        }
        return params;
    }

    /**
     * @return the parameter, or null if the entry fits none of the accepted forms
     */
    ParameterInfo parseParameter(String entry) {
        String text = entry.trim();
        int quote = text.indexOf('"');
        String head = quote >= 0 ? text.substring(0, quote).trim() : text;
        String desc = quote >= 0 ? Literals.unquote(text.substring(quote)) : "";

        int colon = SourceScanner.indexOfTopLevel(head, ":", 0);
        if (colon > 0) {
            String name = head.substring(0, colon).trim();
            String type = head.substring(colon + 1).trim();
            if (!IDENTIFIER.matcher(name).matches() || type.isEmpty()) {
                return null;
            }
            return new ParameterInfo(name, type, desc);
        }

        String[] fields = head.split("\\s+");
        if (fields.length >= 2) {
            String name = String.join(" ", Arrays.copyOfRange(fields, 1, fields.length));
            return new ParameterInfo(name, fields[0], desc);
        }
        return null;
    }

    private static Optional<StepDefinition> skip(ParseState state, int lineNumber, String reason) {
        state.warn(lineNumber, reason);
        return Optional.empty();
    }
}
