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
import dev.mars.flowscript.core.StepDefinition;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Parses {@code {key: value, ...}} blocks attached to step declarations and call sites.
 * Values are typed as booleans, numbers or strings; {@code err_continue} is always a boolean
 * and only the literal {@code true} enables it.
 */
final class MetadataParser {

    private MetadataParser() {
    }

    static Map<String, FlowValue> parse(String block, Consumer<String> warnings) {
        Map<String, FlowValue> metadata = new LinkedHashMap<>();
        String body = block.trim();
        if (body.startsWith("{") && body.endsWith("}")) {
            body = body.substring(1, body.length() - 1);
        }

        for (String pair : SourceScanner.splitTopLevel(body, ',')) {
            int colon = SourceScanner.indexOfTopLevel(pair, ":", 0);
            if (colon <= 0) {
                warnings.accept("ignoring malformed metadata entry '" + pair + "'");
                continue;
            }
            String key = Literals.unquote(pair.substring(0, colon));
            String value = pair.substring(colon + 1).trim();

            if (StepDefinition.ERR_CONTINUE.equals(key)) {
                metadata.put(key, FlowValue.ofBoolean("true".equals(value)));
            } else {
                metadata.put(key, Literals.parse(value));
            }
        }
        return metadata;
    }
}
