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
import dev.mars.flowscript.core.VariableInfo;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates {@code if} conditions. Only four forms are understood:
 *
 * <ul>
 *   <li>{@code x != nil}: {@code x} exists and holds a non-null value</li>
 *   <li>{@code x == true}: {@code x} holds boolean true</li>
 *   <li>{@code x == false}: {@code x} holds boolean false, or is absent or null</li>
 *   <li>{@code x != true}: {@code x} does not hold boolean true, including when absent</li>
 * </ul>
 *
 * Every other expression evaluates to false.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class ConditionEvaluator {

    private static final Pattern CONDITION = Pattern.compile(
            "^\\(?\\s*([\\p{L}_][\\p{L}\\p{N}_]*)\\s*(==|!=)\\s*(nil|true|false)\\s*\\)?$");

    public boolean evaluate(String condition, Map<String, VariableInfo> variables) {
        if (condition == null) {
            return false;
        }
        Matcher matcher = CONDITION.matcher(condition.trim());
        if (!matcher.matches()) {
            return false;
        }

        VariableInfo variable = variables.get(matcher.group(1));
        FlowValue value = variable != null ? variable.getValue() : null;
        boolean absent = value == null || value.isNull();
        String operator = matcher.group(2);
        String operand = matcher.group(3);

        if ("!=".equals(operator) && "nil".equals(operand)) {
            return !absent;
        }
        if ("==".equals(operator) && "true".equals(operand)) {
            return isBoolean(value, true);
        }
        if ("==".equals(operator) && "false".equals(operand)) {
            return absent || isBoolean(value, false);
        }
        if ("!=".equals(operator) && "true".equals(operand)) {
            return !isBoolean(value, true);
        }
        return false;
    }

    /**
     * Whether the expression is one of the supported forms.
     */
    public boolean isSupported(String condition) {
        return condition != null && CONDITION.matcher(condition.trim()).matches();
    }

    private static boolean isBoolean(FlowValue value, boolean expected) {
        return value instanceof FlowValue.BooleanValue && ((FlowValue.BooleanValue) value).value() == expected;
    }
}
