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

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation handle for one flow execution.
 *
 * <p>Cancellation is observed, never forced: the engine checks {@link #isCancelled()} before
 * every statement and after every handler attempt, and backoff waits use {@link #await(Duration)}
 * so they end as soon as the flow is cancelled. Handlers that run long should poll the
 * context they are given. Cancelling a context cancels all of its children.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class FlowContext {

    private final String contextId;
    private final FlowContext parent;
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<FlowContext> children = new CopyOnWriteArrayList<>();
    private volatile String cancelReason;

    private FlowContext(String contextId, FlowContext parent) {
        this.contextId = Objects.requireNonNull(contextId, "Context ID cannot be null");
        this.parent = parent;
    }

    public static FlowContext root() {
        return new FlowContext(UUID.randomUUID().toString(), null);
    }

    public static FlowContext root(String contextId) {
        return new FlowContext(contextId, null);
    }

    /**
     * Creates a context that is cancelled together with this one but can also be cancelled on its own.
     * Callers should {@link #detach()} the child once it is no longer needed.
     */
    public FlowContext child() {
        FlowContext child = new FlowContext(contextId + "/" + children.size(), this);
        children.add(child);
        if (isCancelled()) {
            child.cancel(cancelReason);
        }
        return child;
    }

    public void cancel() {
        cancel("cancelled");
    }

    public void cancel(String reason) {
        if (cancelled.getCount() == 0) {
            return;
        }
        this.cancelReason = reason;
        cancelled.countDown();
        for (FlowContext child : children) {
            child.cancel(reason);
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return true if the context was cancelled before the timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        return cancelled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Removes this context from its parent's child list.
     */
    public void detach() {
        if (parent != null) {
            parent.children.remove(this);
        }
    }

    public String getContextId() {
        return contextId;
    }

    public String getCancelReason() {
        return cancelReason;
    }

    @Override
    public String toString() {
        return "FlowContext{" +
                "contextId='" + contextId + '\'' +
                ", cancelled=" + isCancelled() +
                '}';
    }
}
