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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes a {@link FlowValue} as its raw JSON scalar.
 */
public class FlowValueSerializer extends StdSerializer<FlowValue> {

    public FlowValueSerializer() {
        super(FlowValue.class);
    }

    @Override
    public void serialize(FlowValue value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (value instanceof FlowValue.StringValue) {
            gen.writeString(((FlowValue.StringValue) value).value());
        } else if (value instanceof FlowValue.IntegerValue) {
            gen.writeNumber(((FlowValue.IntegerValue) value).value());
        } else if (value instanceof FlowValue.DecimalValue) {
            gen.writeNumber(((FlowValue.DecimalValue) value).value());
        } else if (value instanceof FlowValue.BooleanValue) {
            gen.writeBoolean(((FlowValue.BooleanValue) value).value());
        } else if (value instanceof FlowValue.ErrorValue) {
            gen.writeStartObject();
            gen.writeStringField("error", ((FlowValue.ErrorValue) value).message());
            gen.writeEndObject();
        } else {
            gen.writeNull();
        }
    }
}
