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

import java.util.ArrayList;
import java.util.List;

/**
 * Lexical helpers shared by the flow source parsers. All scanning skips over string
 * literals ({@code "..."}, {@code '...'} and {@code `...`}) so that separators and braces
 * inside them are never treated as structure.
 */
final class SourceScanner {

    private SourceScanner() {
    }

    /**
     * Splits on {@code separator} where it appears outside quotes and outside (), [] and {}.
     * Empty pieces are dropped and the remaining ones trimmed.
     */
    static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == '\\' && quote != '`' && i + 1 < text.length()) {
                    current.append(text.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (isQuote(c)) {
                quote = c;
                current.append(c);
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
                current.append(c);
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
                current.append(c);
            } else if (depth == 0 && (c == separator || (separator == ',' && c == '\n'))) {
                addPart(parts, current);
            } else {
                current.append(c);
            }
        }
        addPart(parts, current);
        return parts;
    }

    /**
     * Index of {@code token} outside quotes and brackets, or -1.
     */
    static int indexOfTopLevel(String text, String token, int from) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\' && quote != '`') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (i >= from && depth == 0 && text.startsWith(token, i)) {
                return i;
            }
            if (isQuote(c)) {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
            }
        }
        return -1;
    }

    /**
     * Given the index of an opening {@code (}, {@code [} or {@code {}, returns the index of the
     * bracket that closes it, or -1 if the text ends first.
     */
    static int findClosing(String text, int openIndex) {
        if (openIndex < 0 || openIndex >= text.length()) {
            return -1;
        }
        int depth = 0;
        char quote = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\' && quote != '`') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (isQuote(c)) {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Finds the line holding the brace that closes the first {@code {} opened at or after
     * {@code startLine}. Comments are ignored.
     *
     * @return the closing line index, or -1 if the block is never closed
     */
    static int findBlockEnd(List<String> lines, int startLine) {
        int depth = 0;
        boolean opened = false;
        for (int lineIndex = startLine; lineIndex < lines.size(); lineIndex++) {
            String line = stripComment(lines.get(lineIndex));
            char quote = 0;
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (quote != 0) {
                    if (c == '\\' && quote != '`') {
                        i++;
                    } else if (c == quote) {
                        quote = 0;
                    }
                    continue;
                }
                if (isQuote(c)) {
                    quote = c;
                } else if (c == '{') {
                    depth++;
                    opened = true;
                } else if (c == '}') {
                    depth--;
                    if (opened && depth == 0) {
                        return lineIndex;
                    }
                }
            }
        }
        return -1;
    }

    /**
     * Removes a trailing {@code //} comment that is not inside a string literal.
     */
    static String stripComment(String line) {
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == '\\' && quote != '`') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (isQuote(c)) {
                quote = c;
            } else if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                return line.substring(0, i);
            }
        }
        return line;
    }

    /**
     * Looks upwards from {@code index} through comment lines for a {@code //desc:} annotation.
     */
    static String extractDescription(List<String> lines, int index) {
        for (int j = index - 1; j >= 0; j--) {
            String previous = lines.get(j).trim();
            if (previous.isEmpty()) {
                continue;
            }
            if (previous.startsWith("//desc:")) {
                return previous.substring("//desc:".length()).trim();
            }
            if (!previous.startsWith("//")) {
                break;
            }
        }
        return "";
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'' || c == '`';
    }

    private static void addPart(List<String> parts, StringBuilder current) {
        String part = current.toString().trim();
        if (!part.isEmpty()) {
            parts.add(part);
        }
        current.setLength(0);
    }
}
