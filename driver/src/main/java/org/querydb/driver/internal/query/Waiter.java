/*
 * Copyright (c) the QueryDB driver authors
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
package org.querydb.driver.internal.query;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;

/**
 * A pending acquisition. Completed at most once: either with a session, or with an error on timeout, cancellation or
 * pool shutdown.
 */
final class Waiter {
    private final CompletableFuture<PooledQuerySession> future = new CompletableFuture<>();
    private volatile Future<?> timeout;
    private volatile Runnable cleanup;

    Waiter() {
        future.whenComplete((session, error) -> complete());
    }

    CompletionStage<PooledQuerySession> future() {
        return future;
    }

    void timeout(Future<?> timeout) {
        this.timeout = timeout;
        if (future.isDone()) {
            timeout.cancel(false);
        }
    }

    void onCompletion(Runnable cleanup) {
        this.cleanup = cleanup;
        if (future.isDone()) {
            cleanup.run();
        }
    }

    /**
     * @param session the session to hand over
     * @return {@code false} when the waiter was already completed and the session has to go elsewhere
     */
    boolean fulfil(PooledQuerySession session) {
        return future.complete(session);
    }

    boolean fail(Throwable error) {
        return future.completeExceptionally(error);
    }

    private void complete() {
        var scheduledTimeout = timeout;
        if (scheduledTimeout != null) {
            scheduledTimeout.cancel(false);
        }
        var completionCleanup = cleanup;
        if (completionCleanup != null) {
            completionCleanup.run();
        }
    }
}
