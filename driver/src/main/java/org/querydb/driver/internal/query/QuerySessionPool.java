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
import static org.querydb.driver.internal.util.ErrorUtil.newClientClosedError;
import static org.querydb.driver.internal.util.Futures.completedWithNull;
import static org.querydb.driver.internal.util.Futures.failedFuture;
import static org.querydb.driver.internal.util.LockUtil.executeWithLock;

import io.grpc.Context;
import io.netty.util.concurrent.EventExecutorGroup;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.querydb.driver.Endpoint;
import org.querydb.driver.Logger;
import org.querydb.driver.Logging;
import org.querydb.driver.discovery.DiscoveryService;
import org.querydb.driver.exceptions.SessionPoolEmptyException;
import org.querydb.driver.internal.retry.RetryLogic;
import org.querydb.driver.internal.util.Futures;
import org.querydb.driver.spi.QueryServiceRpcFactory;

/**
 * Pool of server sessions shared by all executions of a client.
 * <p>
 * The pool never holds more than {@link PoolSettings#maxLimit()} sessions, counting sessions being created and not
 * counting sessions being deleted. Acquisitions that find neither a free session nor room for a new one wait in FIFO
 * order for a released session.
 * <p>
 * All bookkeeping happens under one lock. Futures handed to callers are completed outside of it.
 */
public class QuerySessionPool implements SessionLifecycleListener {
    private final PoolSettings settings;
    private final DiscoveryService discovery;
    private final QueryServiceRpcFactory rpcFactory;
    private final RetryLogic retryLogic;
    private final EventExecutorGroup eventExecutorGroup;
    private final Logging logging;
    private final Logger log;

    private final Lock lock = new ReentrantLock();
    private final Set<PooledQuerySession> sessions = new LinkedHashSet<>();
    private final Map<Endpoint, SessionBuilder> sessionBuilders = new HashMap<>();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private int newSessionsRequested;
    private int sessionsBeingDeleted;
    private boolean closed;

    public QuerySessionPool(
            PoolSettings settings,
            DiscoveryService discovery,
            QueryServiceRpcFactory rpcFactory,
            RetryLogic retryLogic,
            EventExecutorGroup eventExecutorGroup,
            Logging logging) {
        this.settings = requireNonNull(settings, "settings");
        this.discovery = requireNonNull(discovery, "discovery");
        this.rpcFactory = requireNonNull(rpcFactory, "rpcFactory");
        this.retryLogic = requireNonNull(retryLogic, "retryLogic");
        this.eventExecutorGroup = requireNonNull(eventExecutorGroup, "eventExecutorGroup");
        this.logging = logging;
        this.log = logging.getLog(getClass());

        discovery.addEndpointRemovedListener(this::onEndpointRemoved);
    }

    public PoolSettings settings() {
        return settings;
    }

    /**
     * Acquire a session, waiting for one without a time limit when the pool is exhausted.
     *
     * @return stage completed with a held session
     */
    public CompletionStage<PooledQuerySession> acquire() {
        return acquire(0, Context.ROOT);
    }

    /**
     * Acquire a session.
     *
     * @param timeoutMs how long to wait for a released session when the pool is exhausted, {@code 0} for no limit
     * @return stage completed with a held session, or failed with {@link SessionPoolEmptyException} on timeout
     */
    public CompletionStage<PooledQuerySession> acquire(long timeoutMs) {
        return acquire(timeoutMs, Context.ROOT);
    }

    /**
     * Acquire a session within the deadline of the given context. A wait for a released session ends when the
     * context is cancelled. A session creation already under way is not interrupted.
     *
     * @param context the execution context
     * @return stage completed with a held session
     */
    public CompletionStage<PooledQuerySession> acquire(Context context) {
        requireNonNull(context, "context");
        if (context.isCancelled()) {
            return failedFuture(newCancellationError(context));
        }
        long timeoutMs = 0;
        var deadline = context.getDeadline();
        if (deadline != null) {
            timeoutMs = Math.max(1, deadline.timeRemaining(TimeUnit.MILLISECONDS));
        }
        return acquire(timeoutMs, context);
    }

    private CompletionStage<PooledQuerySession> acquire(long timeoutMs, Context context) {
        log.trace("Acquiring a session from the pool");
        var decision = executeWithLock(lock, () -> {
            if (closed) {
                return Decision.failed(newClientClosedError());
            }
            for (var session : sessions) {
                if (session.isFree() && session.tryAcquire()) {
                    return Decision.ready(session);
                }
            }
            if (sessions.size() + newSessionsRequested - sessionsBeingDeleted < settings.maxLimit()) {
                newSessionsRequested++;
                return Decision.create();
            }
            var waiter = new Waiter();
            waiters.addLast(waiter);
            return Decision.await(waiter);
        });

        if (decision.error() != null) {
            return failedFuture(decision.error());
        } else if (decision.session() != null) {
            log.trace("Acquired free session %s", decision.session().id());
            return CompletableFuture.completedFuture(decision.session());
        } else if (decision.waiter() == null) {
            return createSession();
        }

        var waiter = decision.waiter();
        log.debug("Session pool is exhausted, waiting for a session to be released, %d waiter(s)", waiters());
        if (timeoutMs > 0) {
            waiter.timeout(eventExecutorGroup
                    .next()
                    .schedule(
                            () -> expire(
                                    waiter,
                                    new SessionPoolEmptyException("No session became available within timeout of "
                                            + timeoutMs + " ms")),
                            timeoutMs,
                            TimeUnit.MILLISECONDS));
        }
        if (context.isCancelled()) {
            expire(waiter, newCancellationError(context));
        } else if (context != Context.ROOT) {
            Context.CancellationListener cancellationListener =
                    cancelledContext -> expire(waiter, newCancellationError(cancelledContext));
            context.addListener(cancellationListener, Runnable::run);
            waiter.onCompletion(() -> context.removeListener(cancellationListener));
        }
        // the caller may cancel the returned future itself
        waiter.future().whenComplete((session, error) -> {
            if (error != null) {
                executeWithLock(lock, () -> waiters.remove(waiter));
            }
        });
        return waiter.future();
    }

    @Override
    public void released(PooledQuerySession session) {
        if (session.isClosing()) {
            log.debug("Session %s was released while closing, deleting it", session.id());
            deleteSession(session);
            return;
        }
        if (!handOver(session)) {
            log.trace("Session %s returned to the pool", session.id());
        }
    }

    @Override
    public void broken(PooledQuerySession session) {
        log.debug("Session %s is broken, evicting it from the pool", session.id());
        deleteSession(session);
    }

    /**
     * @return the number of live sessions, including sessions being deleted
     */
    public int size() {
        return executeWithLock(lock, sessions::size);
    }

    public int waiters() {
        return executeWithLock(lock, waiters::size);
    }

    public int newSessionsRequested() {
        return executeWithLock(lock, () -> newSessionsRequested);
    }

    public int sessionsBeingDeleted() {
        return executeWithLock(lock, () -> sessionsBeingDeleted);
    }

    public boolean isClosed() {
        return executeWithLock(lock, () -> closed);
    }

    /**
     * Delete every session and fail every waiter. Later acquisitions fail.
     *
     * @return stage completed once all sessions are deleted
     */
    public CompletionStage<Void> destroy() {
        List<Waiter> pendingWaiters = new ArrayList<>();
        List<PooledQuerySession> liveSessions = new ArrayList<>();
        List<SessionBuilder> builders = new ArrayList<>();
        var alreadyClosed = executeWithLock(lock, () -> {
            if (closed) {
                return true;
            }
            closed = true;
            pendingWaiters.addAll(waiters);
            waiters.clear();
            liveSessions.addAll(sessions);
            builders.addAll(sessionBuilders.values());
            sessionBuilders.clear();
            return false;
        });
        if (alreadyClosed) {
            return completedWithNull();
        }

        log.debug("Destroying session pool with %d session(s)", liveSessions.size());
        pendingWaiters.forEach(waiter -> waiter.fail(newClientClosedError()));

        var deletions = liveSessions.stream()
                .map(this::deleteSession)
                .map(CompletionStage::toCompletableFuture)
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(deletions)
                .thenCompose(ignore -> closeTransports(builders))
                .thenRun(() -> log.debug("Session pool destroyed"));
    }

    /**
     * Give the session to the first waiter still interested in it, or make it free when there is none.
     *
     * @param session a session owned by the pool, either released or freshly created for a waiter
     * @return {@code true} when a waiter took the session
     */
    private boolean handOver(PooledQuerySession session) {
        while (true) {
            var waiter = executeWithLock(lock, () -> {
                var next = waiters.pollFirst();
                if (next == null) {
                    session.makeFree();
                }
                return next;
            });
            if (waiter == null) {
                if (session.isClosing() && session.tryAcquire()) {
                    // stream ended while the session was on its way back
                    session.release();
                }
                return false;
            }
            session.handOver();
            if (waiter.fulfil(session)) {
                log.trace("Session %s handed over to a waiter", session.id());
                return true;
            }
        }
    }

    private CompletionStage<PooledQuerySession> createSession() {
        return sessionBuilder()
                .thenCompose(builder -> builder.create(this))
                .handle((session, error) -> {
                    var cause = Futures.completionExceptionCause(error);
                    if (cause != null) {
                        log.warn("Failed to create a session", cause);
                        var waiter = executeWithLock(lock, () -> {
                            newSessionsRequested--;
                            if (closed || waiters.isEmpty()) {
                                return null;
                            }
                            // the freed slot goes to the oldest waiter
                            newSessionsRequested++;
                            return waiters.poll();
                        });
                        if (waiter != null) {
                            createSessionFor(waiter);
                        }
                        throw Futures.asCompletionException(cause);
                    }
                    var poolClosed = executeWithLock(lock, () -> {
                        newSessionsRequested--;
                        sessions.add(session);
                        return closed;
                    });
                    if (poolClosed) {
                        deleteSession(session);
                        throw Futures.asCompletionException(newClientClosedError());
                    }
                    return session;
                });
    }

    /**
     * Create a session on behalf of a waiter already taken off the queue. Every waiter gets at most one such attempt,
     * its failure fails the waiter.
     */
    private void createSessionFor(Waiter waiter) {
        createSession().whenComplete((session, error) -> {
            if (error != null) {
                waiter.fail(Futures.completionExceptionCause(error));
            } else if (!waiter.fulfil(session)) {
                // waiter expired meanwhile
                session.release();
            }
        });
    }

    private CompletionStage<SessionBuilder> sessionBuilder() {
        return discovery.endpoint().thenApply(endpoint -> executeWithLock(lock, () -> sessionBuilders.computeIfAbsent(
                endpoint, e -> new SessionBuilder(e, rpcFactory.create(e), discovery, retryLogic, logging))));
    }

    /**
     * Delete a session exactly once. When acquisitions are waiting, a replacement is acquired for the first of them.
     */
    private CompletionStage<Void> deleteSession(PooledQuerySession session) {
        var replaceForWaiter = executeWithLock(lock, () -> {
            if (!session.startDeletion()) {
                return null;
            }
            sessionsBeingDeleted++;
            return !waiters.isEmpty() && !closed;
        });
        if (replaceForWaiter == null) {
            return session.delete().exceptionally(error -> null);
        }
        if (replaceForWaiter) {
            acquireReplacement();
        }
        return session.delete().handle((ignore, error) -> {
            executeWithLock(lock, () -> {
                sessions.remove(session);
                sessionsBeingDeleted--;
            });
            if (error != null) {
                log.warn("Failed to delete session " + session.id(), Futures.completionExceptionCause(error));
            }
            return null;
        });
    }

    private void acquireReplacement() {
        acquire().whenComplete((replacement, error) -> {
            if (error != null) {
                log.debug("Failed to acquire a replacement session for a waiter: %s", error);
                return;
            }
            handOver(replacement);
        });
    }

    private CompletionStage<Void> closeTransports(List<SessionBuilder> builders) {
        var closes = builders.stream()
                .map(builder -> builder.rpc().close().toCompletableFuture().exceptionally(error -> {
                    log.warn(
                            "Failed to close transport to " + builder.endpoint(),
                            Futures.completionExceptionCause(error));
                    return null;
                }))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(closes);
    }

    private void onEndpointRemoved(Endpoint endpoint) {
        var removed = executeWithLock(lock, () -> sessionBuilders.remove(endpoint));
        if (removed != null) {
            log.info("Endpoint %s was removed, no new sessions will be created on it", endpoint);
        }
    }

    private void expire(Waiter waiter, Throwable error) {
        executeWithLock(lock, () -> waiters.remove(waiter));
        // a no-op for a waiter served meanwhile
        waiter.fail(error);
    }

    private record Decision(PooledQuerySession session, Waiter waiter, Throwable error) {
        static Decision ready(PooledQuerySession session) {
            return new Decision(session, null, null);
        }

        static Decision create() {
            return new Decision(null, null, null);
        }

        static Decision await(Waiter waiter) {
            return new Decision(null, waiter, null);
        }

        static Decision failed(Throwable error) {
            return new Decision(null, null, error);
        }
    }
}
