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

import dev.mars.flowscript.core.FlowModel;
import dev.mars.flowscript.core.exceptions.FlowParseException;

import java.nio.file.Path;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Parses flow source text into a {@link FlowModel}.
 *
 * <p>Structural problems (no {@code func main()}, an unterminated block, an empty body) do not
 * throw: they yield a model with {@code success=false} and an error message. Malformed fragments
 * are skipped and recorded as {@code warn} entries in the model's global logs.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public interface FlowSourceParser {

    /**
     * Parses with a freshly generated flow id.
     */
    FlowModel parse(String source);

    FlowModel parse(String flowId, String source);

    /**
     * Reads a UTF-8 source file and parses it with a generated flow id.
     *
     * @throws FlowParseException if the file cannot be read
     */
    FlowModel parse(Path sourceFile) throws FlowParseException;

    static String generateFlowId() {
        return "flow_" + System.nanoTime() + "_" + ThreadLocalRandom.current().nextInt(10000);
    }
}
