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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Reads the JSON written by {@link FlowValueSerializer}. Arrays and objects other than the
 * error marker are kept as their JSON text.
 */
public class FlowValueDeserializer extends StdDeserializer<FlowValue> {

    public FlowValueDeserializer() {
        super(FlowValue.class);
    }

    @Override
    public FlowValue deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        if (node == null || node.isNull() || node.isMissingNode()) {
            return FlowValue.NULL;
        }
        if (node.isTextual()) {
            return new FlowValue.StringValue(node.textValue());
        }
        if (node.isBoolean()) {
            return FlowValue.ofBoolean(node.booleanValue());
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return new FlowValue.IntegerValue(node.longValue());
        }
        if (node.isNumber()) {
            return new FlowValue.DecimalValue(node.doubleValue());
        }
        if (node.isObject() && node.size() == 1 && node.has("error")) {
            return new FlowValue.ErrorValue(node.get("error").asText());
        }
        return new FlowValue.StringValue(node.toString());
    }

    @Override
    public FlowValue getNullValue(DeserializationContext context) {
        return FlowValue.NULL;
    }
}
