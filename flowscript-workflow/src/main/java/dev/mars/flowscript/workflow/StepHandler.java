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

/**
 * The single effect boundary of the engine: performs the real work behind a step.
 *
 * <p>Implementations report failure either by throwing or by returning a result with
 * {@code success=false}; both are handled by the same retry and continuation policy.
 * Output keys must match the step's formal output parameter names. A handler that blocks
 * for long should poll {@link FlowContext#isCancelled()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
@FunctionalInterface
public interface StepHandler {

    StepResult executeStep(FlowContext context, StepRequest request) throws Exception;
}
