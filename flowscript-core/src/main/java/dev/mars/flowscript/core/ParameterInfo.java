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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A formal input or output parameter of a step declaration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class ParameterInfo {

    private final String name;
    private final String type;
    private final String desc;

    @JsonCreator
    public ParameterInfo(@JsonProperty("name") String name,
                         @JsonProperty("type") String type,
                         @JsonProperty("desc") String desc) {
        this.name = Objects.requireNonNull(name, "Parameter name cannot be null");
        this.type = type != null ? type : "";
        this.desc = desc != null ? desc : "";
    }

    public ParameterInfo(String name, String type) {
        this(name, type, "");
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @JsonProperty("desc")
    public String getDesc() {
        return desc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParameterInfo that = (ParameterInfo) o;
        return name.equals(that.name) && type.equals(that.type) && desc.equals(that.desc);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, desc);
    }

    @Override
    public String toString() {
        return desc.isEmpty() ? name + ": " + type : name + ": " + type + " \"" + desc + "\"";
    }
}
