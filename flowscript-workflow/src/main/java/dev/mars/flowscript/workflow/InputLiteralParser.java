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
import dev.mars.flowscript.core.exceptions.FlowParseException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the {@code input} literal map from flow source.
 *
 * <p>Both {@code var input = map[string]interface{}{ ... }} and {@code var input = { ... }} are
 * accepted. Entries are {@code "key": value} pairs separated by commas or newlines; values are
 * quoted strings, booleans, integers or decimals, and any other token is kept as raw text.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
class InputLiteralParser {

    private static final Pattern INPUT_DECLARATION = Pattern.compile("^var\\s+input\\s*(:?=)\\s*");
    private static final Pattern MAP_TYPE = Pattern.compile("^map\\s*\\[[^\\]]*]\\s*[\\p{L}_.]*\\s*(\\{\\s*})?\\s*");

    boolean isInputDeclaration(String line) {
        return INPUT_DECLARATION.matcher(line.trim()).lookingAt();
    }

    /**
     * Parses the block that starts at {@code startLine}.
     *
     * @throws FlowParseException if the block is malformed or never closed
     */
    InputBlock parse(List<String> lines, int startLine, ParseState state) throws FlowParseException {
        StringBuilder joined = new StringBuilder();
        for (int i = startLine; i < lines.size(); i++) {
            if (i > startLine) {
                joined.append('\n');
            }
            joined.append(SourceScanner.stripComment(lines.get(i)));
        }
        String text = joined.toString().stripLeading();

        Matcher declaration = INPUT_DECLARATION.matcher(text);
        if (!declaration.lookingAt()) {
            throw new FlowParseException(state.getFlowId(), startLine + 1, "malformed input declaration");
        }
        int position = declaration.end();
        Matcher type = MAP_TYPE.matcher(text).region(position, text.length());
        if (type.lookingAt()) {
            position = type.end();
        }
        if (position >= text.length() || text.charAt(position) != '{') {
            throw new FlowParseException(state.getFlowId(), startLine + 1, "input block must start with '{'");
        }

        int close = SourceScanner.findClosing(text, position);
        if (close < 0) {
            throw new FlowParseException(state.getFlowId(), startLine + 1, "unterminated input block");
        }

        int endLine = startLine;
        for (int i = 0; i < close; i++) {
            if (text.charAt(i) == '\n') {
                endLine++;
            }
        }

        Map<String, FlowValue> values = new LinkedHashMap<>();
        for (String entry : SourceScanner.splitTopLevel(text.substring(position + 1, close), ',')) {
            int colon = SourceScanner.indexOfTopLevel(entry, ":", 0);
            if (colon <= 0) {
                state.warn(startLine + 1, "ignoring malformed input entry '" + entry + "'");
                continue;
            }
            String key = Literals.unquote(entry.substring(0, colon));
            values.put(key, Literals.parse(entry.substring(colon + 1)));
        }
        return new InputBlock(values, endLine);
    }

    record InputBlock(Map<String, FlowValue> values, int endLine) {
    }
}
