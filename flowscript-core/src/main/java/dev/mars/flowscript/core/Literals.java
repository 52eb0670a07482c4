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


package dev.mars.flowscript.core;

import java.util.regex.Pattern;

/**
 * Conversion of literal source tokens (metadata values, input entries, arguments) to {@link FlowValue}s.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class Literals {

    private static final Pattern INTEGER = Pattern.compile("^[-+]?\\d+$");
    private static final Pattern DECIMAL = Pattern.compile("^[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?$");

    private Literals() {
    }

    public static boolean isNumeric(String text) {
        return DECIMAL.matcher(text).matches();
    }

    /**
     * Parses a literal token. Quoted text loses its quotes, {@code true}/{@code false} become booleans,
     * {@code nil}/{@code null} become null, numerals become integers or decimals. Any other token is
     * returned as its raw text.
     */
    public static FlowValue parse(String token) {
        if (token == null) {
            return FlowValue.NULL;
        }
        String text = token.trim();
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '"' || first == '\'' || first == '`') && first == last) {
                return new FlowValue.StringValue(unescape(text.substring(1, text.length() - 1), first));
            }
        }
        if ("true".equals(text)) {
            return FlowValue.ofBoolean(true);
        }
        if ("false".equals(text)) {
            return FlowValue.ofBoolean(false);
        }
        if ("nil".equals(text) || "null".equals(text)) {
            return FlowValue.NULL;
        }
        if (INTEGER.matcher(text).matches()) {
            try {
                return new FlowValue.IntegerValue(Long.parseLong(text.startsWith("+") ? text.substring(1) : text));
            } catch (NumberFormatException e) {
                return new FlowValue.DecimalValue(Double.parseDouble(text));
            }
        }
        if (DECIMAL.matcher(text).matches()) {
            return new FlowValue.DecimalValue(Double.parseDouble(text));
        }
        return new FlowValue.StringValue(text);
    }

    /**
     * Removes one pair of matching surrounding quotes, if present.
     */
    public static String unquote(String text) {
        String trimmed = text.trim();
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            if ((first == '"' || first == '\'' || first == '`') && trimmed.charAt(trimmed.length() - 1) == first) {
                return trimmed.substring(1, trimmed.length() - 1);
            }
        }
        return trimmed;
    }

    private static String unescape(String body, char quote) {
        if (quote == '`' || body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(++i);
                switch (next) {
                    case 'n':
                        sb.append('\n');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    default:
                        sb.append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
