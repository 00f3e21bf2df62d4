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
import static org.querydb.driver.internal.util.ErrorUtil.newCancellationError;
import static org.querydb.driver.internal.util.Futures.completedWithNull;
import static org.querydb.driver.internal.util.Futures.failedFuture;

import io.grpc.Context;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.querydb.driver.Endpoint;
import org.querydb.driver.Logger;
import org.querydb.driver.Logging;
import org.querydb.driver.Query;
import org.querydb.driver.QueryResult;
import org.querydb.driver.QuerySession;
import org.querydb.driver.TxSettings;
import org.querydb.driver.exceptions.BadSessionException;
import org.querydb.driver.exceptions.ClientException;
import org.querydb.driver.internal.util.Futures;
import org.querydb.driver.spi.AttachStream;
import org.querydb.driver.spi.QueryServiceRpc;
import org.querydb.driver.spi.TxControl;

/**
 * Session owned by a {@link QuerySessionPool}.
 * <p>
 * A session is {@link State#FREE} in the pool, {@link State#BUSY} while held, {@link State#RELEASED} between the end
 * of a hold and the pool's decision about it, and {@link State#DELETED} once removed on the server. Only the pool moves
 * a released session on.
 */
public class PooledQuerySession implements QuerySession {
    enum State {
        FREE,
        BUSY,
        RELEASED,
        DELETED
    }

    private final String id;
    private final Endpoint endpoint;
    private final QueryServiceRpc rpc;
    private final SessionLifecycleListener listener;
    private final Logger log;

    private final AtomicReference<State> state = new AtomicReference<>(State.BUSY);
    private final AtomicBoolean deletionStarted = new AtomicBoolean();
    private final AtomicBoolean remoteDeleteStarted = new AtomicBoolean();
    private final CompletableFuture<Void> deleteFuture = new CompletableFuture<>();
    private final SessionCallState callState = new SessionCallState();
    private volatile boolean closing;
    private volatile String transactionId;
    private volatile long hold;
    private volatile AttachStream attachStream;

    /**
     * Sessions start held by their creator.
     */
    PooledQuerySession(
            String id, Endpoint endpoint, QueryServiceRpc rpc, SessionLifecycleListener listener, Logging logging) {
        this.id = requireNonNull(id, "id");
        this.endpoint = requireNonNull(endpoint, "endpoint");
        this.rpc = requireNonNull(rpc, "rpc");
        this.listener = requireNonNull(listener, "listener");
        this.log = logging.getLog(getClass());
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Endpoint endpoint() {
        return endpoint;
    }

    @Override
    public String transactionId() {
        return transactionId;
    }

    @Override
    public CompletionStage<QueryResult> executeQuery(Query query) {
        requireNonNull(query, "query");
        var error = checkUsable();
        if (error != null) {
            return failedFuture(error);
        }
        if (callState.currentOperation() != null) {
            return failedFuture(new ClientException("Session " + id + " already has an operation in progress, "
                    + "wait for it to complete before running the next one"));
        }

        var currentTransactionId = transactionId;
        TxControl txControl;
        if (currentTransactionId != null) {
            txControl = TxControl.continueTx(currentTransactionId);
        } else if (callState.txSettings() != null) {
            txControl = TxControl.begin(callState.txSettings());
        } else {
            txControl = TxControl.none();
        }
        callState.queryIdempotent(query.idempotent());

        var context = callState.context();
        var issuingHold = hold;
        var operation = invoke(() -> rpc.executeQuery(context, id, query, txControl)).toCompletableFuture();
        callState.currentOperation(operation);

        Context.CancellationListener cancellationListener =
                cancelledContext -> operation.completeExceptionally(newCancellationError(cancelledContext));
        context.addListener(cancellationListener, Runnable::run);

        return operation.whenComplete((result, queryError) -> {
            context.removeListener(cancellationListener);
            if (callState.currentOperation() == operation) {
                callState.currentOperation(null);
            }
            if (queryError == null && txControl.beginSettings() != null && result.transactionId() != null) {
                updateTransactionId(issuingHold, result.transactionId());
            }
        });
    }

    @Override
    public CompletionStage<Void> beginTransaction(TxSettings settings) {
        requireNonNull(settings, "settings");
        var error = checkUsable();
        if (error != null) {
            return failedFuture(error);
        }
        if (transactionId != null) {
            return failedFuture(new ClientException("Session " + id + " already has an open transaction"));
        }
        var issuingHold = hold;
        return invoke(() -> rpc.beginTransaction(id, settings))
                .thenAccept(beganTransactionId -> updateTransactionId(issuingHold, beganTransactionId));
    }

    @Override
    public CompletionStage<Void> commitTransaction() {
        var error = checkUsable();
        if (error != null) {
            return failedFuture(error);
        }
        var currentTransactionId = transactionId;
        if (currentTransactionId == null) {
            return failedFuture(new ClientException("Session " + id + " has no open transaction to commit"));
        }
        var issuingHold = hold;
        return invoke(() -> rpc.commitTransaction(id, currentTransactionId))
                .whenComplete((ignore, commitError) -> updateTransactionId(issuingHold, null));
    }

    @Override
    public CompletionStage<Void> rollbackTransaction() {
        var error = checkUsable();
        if (error != null) {
            return failedFuture(error);
        }
        var currentTransactionId = transactionId;
        if (currentTransactionId == null) {
            return completedWithNull();
        }
        var issuingHold = hold;
        return invoke(() -> rpc.rollbackTransaction(id, currentTransactionId))
                .whenComplete((ignore, rollbackError) -> updateTransactionId(issuingHold, null));
    }

    State state() {
        return state.get();
    }

    SessionCallState callState() {
        return callState;
    }

    boolean isFree() {
        return state.get() == State.FREE && !closing && !deletionStarted.get();
    }

    boolean isClosing() {
        return closing;
    }

    boolean isDeleted() {
        return state.get() == State.DELETED;
    }

    boolean tryAcquire() {
        if (state.compareAndSet(State.FREE, State.BUSY)) {
            hold++;
            return true;
        }
        return false;
    }

    PooledQuerySession acquire() {
        if (!tryAcquire()) {
            throw new IllegalStateException("Session " + id + " can't be acquired in state " + state.get());
        }
        return this;
    }

    /**
     * End the current hold and hand the session back to the pool. Ignored for a session deleted while held.
     */
    void release() {
        hold++;
        if (deletionStarted.get()) {
            return;
        }
        if (state.compareAndSet(State.BUSY, State.RELEASED)) {
            listener.released(this);
        } else {
            throw new IllegalStateException("Session " + id + " can't be released in state " + state.get());
        }
    }

    /**
     * End the current hold reporting the session unusable. The pool deletes it whatever its transaction state.
     */
    void broken() {
        hold++;
        transactionId = null;
        if (deletionStarted.get()) {
            return;
        }
        if (state.compareAndSet(State.BUSY, State.RELEASED)) {
            listener.broken(this);
        } else {
            throw new IllegalStateException("Session " + id + " can't be evicted in state " + state.get());
        }
    }

    /**
     * Make the session unavailable for further acquisitions. A free session goes straight to deletion, a held one
     * once its holder releases it.
     */
    void markForDeleteOnRelease() {
        closing = true;
        if (tryAcquire()) {
            release();
        }
    }

    /**
     * Called by the pool only, when a session it owns is handed to a waiter.
     */
    void handOver() {
        var current = state.get();
        if (current != State.RELEASED && current != State.BUSY) {
            throw new IllegalStateException("Session " + id + " can't be handed over in state " + current);
        }
        hold++;
        state.set(State.BUSY);
    }

    /**
     * Called by the pool only, under its lock, when a session it owns returns to the idle set.
     */
    void makeFree() {
        var current = state.get();
        if (deletionStarted.get()) {
            return;
        }
        if (current != State.RELEASED && current != State.BUSY) {
            throw new IllegalStateException("Session " + id + " can't be made free in state " + current);
        }
        state.set(State.FREE);
    }

    /**
     * Open the keep-alive stream. The session can't serve requests once its stream ended.
     *
     * @param onStreamClosed invoked once the stream ended, normally or not
     * @return stage completed when the server confirmed the attachment
     */
    CompletionStage<Void> attach(Runnable onStreamClosed) {
        return rpc.attachSession(id).thenAccept(stream -> {
            attachStream = stream;
            stream.termination().whenComplete((ignore, error) -> {
                if (error != null) {
                    log.debug("Attach stream of session %s ended with error: %s", id, error);
                } else {
                    log.debug("Attach stream of session %s ended", id);
                }
                onStreamClosed.run();
            });
        });
    }

    /**
     * @return {@code true} for the first caller only
     */
    boolean startDeletion() {
        return deletionStarted.compareAndSet(false, true);
    }

    /**
     * Delete the session on the server and close its stream. Repeated calls return the stage of the first one.
     *
     * @return stage completed once the session is deleted
     */
    CompletionStage<Void> delete() {
        deletionStarted.set(true);
        if (!remoteDeleteStarted.compareAndSet(false, true)) {
            return deleteFuture;
        }
        transactionId = null;
        invoke(() -> rpc.deleteSession(id)).whenComplete((ignore, error) -> {
            var cause = Futures.completionExceptionCause(error);
            var stream = attachStream;
            if (stream != null) {
                stream.cancel();
            }
            state.set(State.DELETED);
            if (cause == null || cause instanceof BadSessionException) {
                // the server no longer knows the session, which is what deletion is after
                log.debug("Session %s deleted", id);
                deleteFuture.complete(null);
            } else {
                deleteFuture.completeExceptionally(cause);
            }
        });
        return deleteFuture;
    }

    /**
     * Record a transaction outcome unless the session moved on to another holder meanwhile.
     */
    private void updateTransactionId(long issuingHold, String newTransactionId) {
        if (hold == issuingHold) {
            transactionId = newTransactionId;
        }
    }

    private static <T> CompletionStage<T> invoke(Supplier<CompletionStage<T>> call) {
        try {
            return call.get();
        } catch (Throwable error) {
            return failedFuture(error);
        }
    }

    @Override
    public String toString() {
        return "PooledQuerySession{" + "id='" + id + '\'' + ", endpoint=" + endpoint + ", state=" + state.get()
                + ", closing=" + closing + '}';
    }

    private ClientException checkUsable() {
        var currentState = state.get();
        if (currentState != State.BUSY || deletionStarted.get()) {
            return new ClientException(
                    "Session " + id + " is not held by the caller or was deleted, current state: " + currentState);
        }
        return null;
    }
}
