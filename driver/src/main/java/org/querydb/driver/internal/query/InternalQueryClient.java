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

import static java.util.Objects.requireNonNull;
import static org.querydb.driver.internal.util.ErrorUtil.addSuppressed;
import static org.querydb.driver.internal.util.ErrorUtil.isSessionBroken;
import static org.querydb.driver.internal.util.ErrorUtil.newClientClosedError;
import static org.querydb.driver.internal.util.Futures.failedFuture;

import io.grpc.Context;
import io.netty.util.concurrent.EventExecutorGroup;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.querydb.driver.ExecuteConfig;
import org.querydb.driver.Logger;
import org.querydb.driver.Logging;
import org.querydb.driver.QueryClient;
import org.querydb.driver.SessionCallback;
import org.querydb.driver.TxSettings;
import org.querydb.driver.internal.retry.AttemptResult;
import org.querydb.driver.internal.retry.RetryLogic;
import org.querydb.driver.internal.util.Futures;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Mono;

public class InternalQueryClient implements QueryClient {
    private final QuerySessionPool sessionPool;
    private final RetryLogic retryLogic;
    private final EventExecutorGroup eventExecutorGroup;
    private final boolean ownsEventExecutorGroup;
    private final Logger log;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();

    public InternalQueryClient(
            QuerySessionPool sessionPool,
            RetryLogic retryLogic,
            EventExecutorGroup eventExecutorGroup,
            boolean ownsEventExecutorGroup,
            Logging logging) {
        this.sessionPool = requireNonNull(sessionPool, "sessionPool");
        this.retryLogic = requireNonNull(retryLogic, "retryLogic");
        this.eventExecutorGroup = requireNonNull(eventExecutorGroup, "eventExecutorGroup");
        this.ownsEventExecutorGroup = ownsEventExecutorGroup;
        this.log = logging.getLog(getClass());
    }

    @Override
    public <T> CompletionStage<T> executeAsync(SessionCallback<T> callback, ExecuteConfig config) {
        requireNonNull(callback, "callback");
        requireNonNull(config, "config");
        if (closed.get()) {
            return failedFuture(newClientClosedError());
        }

        var context = executionContext(config);
        return retryLogic
                .<T>retry(context, attemptContext -> attempt(attemptContext, callback, config))
                .whenComplete((ignore, error) -> context.cancel(null));
    }

    @Override
    public <T> CompletionStage<T> executeTxAsync(SessionCallback<T> callback, ExecuteConfig config) {
        requireNonNull(config, "config");
        if (config.txSettings() == null) {
            config = config.withTxSettings(TxSettings.serializableReadWrite());
        }
        return executeAsync(callback, config);
    }

    @Override
    public <T> T execute(SessionCallback<T> callback, ExecuteConfig config) {
        return Futures.blockingGet(executeAsync(callback, config));
    }

    @Override
    public <T> T executeTx(SessionCallback<T> callback, ExecuteConfig config) {
        return Futures.blockingGet(executeTxAsync(callback, config));
    }

    @Override
    public <T> Publisher<T> executeRx(SessionCallback<T> callback, ExecuteConfig config) {
        return Mono.fromCompletionStage(() -> executeAsync(callback, config));
    }

    @Override
    public void close() {
        Futures.blockingGet(closeAsync(), () -> log.warn("Close was interrupted, sessions may be left on the server"));
    }

    @Override
    public CompletionStage<Void> closeAsync() {
        if (closed.compareAndSet(false, true)) {
            log.info("Closing query client");
            sessionPool
                    .destroy()
                    .thenCompose(ignore -> ownsEventExecutorGroup
                            ? Futures.shutdownGracefully(eventExecutorGroup)
                            : Futures.<Void>completedWithNull())
                    .whenComplete(Futures.futureCompletingConsumer(closeFuture));
        }
        return closeFuture;
    }

    public QuerySessionPool sessionPool() {
        return sessionPool;
    }

    private Context.CancellableContext executionContext(ExecuteConfig config) {
        var parent = config.context();
        var timeout = config.timeout();
        if (timeout != null) {
            return parent.withDeadlineAfter(timeout.toNanos(), TimeUnit.NANOSECONDS, eventExecutorGroup);
        }
        return parent.withCancellation();
    }

    private <T> CompletionStage<AttemptResult<T>> attempt(
            Context context, SessionCallback<T> callback, ExecuteConfig config) {
        return sessionPool
                .acquire(context)
                .<CompletionStage<AttemptResult<T>>>handle((session, error) -> {
                    if (error != null) {
                        // no work ran, replaying the attempt is safe
                        return CompletableFuture.completedFuture(
                                AttemptResult.<T>failure(Futures.completionExceptionCause(error), true));
                    }
                    return runInSession(context, session, callback, config);
                })
                .thenCompose(stage -> stage);
    }

    private <T> CompletionStage<AttemptResult<T>> runInSession(
            Context context, PooledQuerySession session, SessionCallback<T> callback, ExecuteConfig config) {
        var callState = session.callState();
        callState.context(context);
        if (config.idempotent() != null) {
            callState.callLevelIdempotent(config.idempotent());
        }
        callState.txSettings(config.txSettings());

        CompletionStage<T> callbackStage;
        try {
            callbackStage = requireNonNull(callback.execute(session), "Callback returned null stage");
        } catch (Throwable error) {
            callbackStage = failedFuture(error);
        }

        return callbackStage
                .<CompletionStage<T>>handle((result, error) -> {
                    var cause = Futures.completionExceptionCause(error);
                    if (cause != null) {
                        return rollbackOnFailure(session, cause).<T>thenApply(ignore -> null);
                    }
                    return finishTransaction(session, config).thenApply(ignore -> result);
                })
                .thenCompose(stage -> stage)
                .handle((result, error) -> {
                    var cause = Futures.completionExceptionCause(error);
                    var idempotent = Boolean.TRUE.equals(callState.idempotent());
                    callState.clear();
                    if (cause != null && isSessionBroken(cause)) {
                        log.debug("Session %s failed with %s and is evicted", session.id(), cause);
                        session.broken();
                    } else {
                        session.release();
                    }
                    return cause == null ? AttemptResult.success(result) : AttemptResult.failure(cause, idempotent);
                });
    }

    private static CompletionStage<Void> finishTransaction(PooledQuerySession session, ExecuteConfig config) {
        if (session.transactionId() == null) {
            return Futures.completedWithNull();
        }
        return config.txSettings() != null ? session.commitTransaction() : session.rollbackTransaction();
    }

    /**
     * Roll back the transaction left open by a failed callback. The failure of the callback is what the caller sees,
     * whatever the outcome of the rollback.
     */
    private CompletionStage<Void> rollbackOnFailure(PooledQuerySession session, Throwable error) {
        if (session.transactionId() == null || isSessionBroken(error)) {
            return failedFuture(error);
        }
        return session.rollbackTransaction().handle((ignore, rollbackError) -> {
            if (rollbackError != null) {
                var rollbackCause = Futures.completionExceptionCause(rollbackError);
                log.warn("Failed to roll back transaction of session " + session.id(), rollbackCause);
                addSuppressed(error, rollbackCause);
            }
            throw Futures.asCompletionException(error);
        });
    }
}
