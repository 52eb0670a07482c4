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

/**
 * How a call-site argument is resolved at execution time.
 */
public enum ArgumentKind {
    /** A quoted string, number, {@code true}, {@code false} or {@code nil}. */
    LITERAL,
    /** A reference into the flow's input map, written {@code input["key"]}. */
    INPUT,
    /** A name looked up in the flow's variable table, falling back to literal text. */
    VARIABLE
}
