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

import dev.mars.flowscript.core.FlowView;

/**
 * Notifications fired synchronously on the flow's own thread. Implementations should be quick;
 * a runtime exception thrown from a callback aborts the flow.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public interface FlowListener {

    FlowListener NONE = new FlowListener() {
    };

    /**
     * Called after every statement finishes or is cancelled, including statements nested in {@code if} blocks.
     */
    default void onProgress(FlowView flow) {
    }

    /**
     * Called once when the statement list is exhausted without a {@code return}.
     */
    default void onCompleted(FlowView flow) {
    }

    /**
     * Called once when a {@code return} statement ends the flow early.
     */
    default void onReturned(FlowView flow) {
    }
}
