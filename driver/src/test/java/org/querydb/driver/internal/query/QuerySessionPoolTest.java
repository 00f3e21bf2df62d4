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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.querydb.driver.internal.logging.DevNullLogging.DEV_NULL_LOGGING;
import static org.querydb.driver.testutil.TestUtil.await;

import io.grpc.Context;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.querydb.driver.Endpoint;
import org.querydb.driver.discovery.StaticDiscoveryService;
import org.querydb.driver.exceptions.ClientException;
import org.querydb.driver.exceptions.ServiceUnavailableException;
import org.querydb.driver.exceptions.SessionPoolEmptyException;
import org.querydb.driver.internal.retry.ExponentialBackoffRetryLogic;
import org.querydb.driver.testutil.FakeQueryServiceRpc;

class QuerySessionPoolTest {
    private final FakeQueryServiceRpc rpc = new FakeQueryServiceRpc();
    private final StaticDiscoveryService discovery =
            new StaticDiscoveryService(List.of(rpc.endpoint()), DEV_NULL_LOGGING);
    private EventExecutorGroup eventExecutorGroup;

    @BeforeEach
    void setUp() {
        eventExecutorGroup = new DefaultEventExecutorGroup(1);
    }

    @AfterEach
    void tearDown() {
        eventExecutorGroup.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS).syncUninterruptibly();
    }

    @Test
    void shouldCreateSessionWhenPoolIsEmpty() {
        var pool = newPool(3);

        var session = await(pool.acquire());

        assertEquals(PooledQuerySession.State.BUSY, session.state());
        assertTrue(rpc.hasSession(session.id()));
        assertEquals(1, rpc.createCalls());
        assertEquals(1, pool.size());
        assertEquals(0, pool.newSessionsRequested());
    }

    @Test
    void shouldReuseReleasedSession() {
        var pool = newPool(3);
        var session = await(pool.acquire());

        session.release();

        assertEquals(PooledQuerySession.State.FREE, session.state());
        assertSame(session, await(pool.acquire()));
        assertEquals(1, rpc.createCalls());
    }

    @Test
    void shouldNeverHandOutSessionToTwoHolders() throws Exception {
        var pool = newPool(3);
        var holders = new ConcurrentHashMap<String, AtomicInteger>();
        var violations = new AtomicInteger();
        var threads = 8;
        var executor = Executors.newFixedThreadPool(threads);
        var done = new CountDownLatch(threads);
        try {
            for (var i = 0; i < threads; i++) {
                executor.execute(() -> {
                    try {
                        for (var j = 0; j < 200; j++) {
                            var session = await(pool.acquire());
                            var holderCount = holders.computeIfAbsent(session.id(), id -> new AtomicInteger());
                            if (holderCount.incrementAndGet() != 1) {
                                violations.incrementAndGet();
                            }
                            holderCount.decrementAndGet();
                            session.release();
                        }
                    } finally {
                        done.countDown();
                    }
                });
            }
            assertTrue(done.await(30, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(0, violations.get());
        assertThat(rpc.maxLiveSessions(), lessThanOrEqualTo(3));
        assertEquals(0, pool.waiters());
    }

    @Test
    void shouldNotCreateMoreSessionsThanLimitUnderBurst() {
        var pool = newPool(3);
        var createGate = rpc.holdCreates();

        var acquisitions = new ArrayList<CompletionStage<PooledQuerySession>>();
        for (var i = 0; i < 10; i++) {
            acquisitions.add(pool.acquire());
        }

        assertEquals(3, rpc.createCalls());
        assertEquals(3, pool.newSessionsRequested());
        assertEquals(7, pool.waiters());

        createGate.complete(null);
        var sessions = new ArrayList<PooledQuerySession>();
        for (var i = 0; i < 3; i++) {
            sessions.add(await(acquisitions.get(i)));
        }
        assertEquals(3, pool.size());
        assertEquals(0, pool.newSessionsRequested());

        for (var i = 3; i < 10; i++) {
            sessions.remove(0).release();
            var session = await(acquisitions.get(i));
            sessions.add(session);
        }

        assertEquals(3, rpc.createCalls());
        assertEquals(3, rpc.maxLiveSessions());
        assertEquals(0, pool.waiters());
    }

    @Test
    void shouldServeWaitersInArrivalOrder() {
        var pool = newPool(1);
        var session = await(pool.acquire());
        var first = pool.acquire().toCompletableFuture();
        var second = pool.acquire().toCompletableFuture();
        var third = pool.acquire().toCompletableFuture();

        session.release();
        assertTrue(first.isDone());
        assertFalse(second.isDone());
        assertFalse(third.isDone());

        await(first).release();
        assertTrue(second.isDone());
        assertFalse(third.isDone());

        await(second).release();
        assertSame(session, await(third));
    }

    @Test
    void shouldSkipWaiterCancelledByCaller() {
        var pool = newPool(1);
        var session = await(pool.acquire());
        var cancelled = pool.acquire().toCompletableFuture();
        var next = pool.acquire().toCompletableFuture();

        cancelled.cancel(false);
        session.release();

        assertSame(session, await(next));
        assertEquals(0, pool.waiters());
    }

    @Test
    void shouldFailAcquisitionAfterTimeoutAndForgetWaiter() {
        var pool = newPool(1);
        var holder = await(pool.acquire());

        var error = assertThrows(SessionPoolEmptyException.class, () -> await(pool.acquire(50)));

        assertThat(error.getMessage(), containsString("No session became available within timeout of 50 ms"));
        assertEquals(0, pool.waiters());

        holder.release();
        assertEquals(PooledQuerySession.State.FREE, holder.state());
        assertSame(holder, await(pool.acquire(50)));
    }

    @Test
    void shouldHandOutReleasedSessionToLaterAcquisitionAfterTimeout() {
        var pool = newPool(1);
        var sessionA = await(pool.acquire());

        assertThrows(SessionPoolEmptyException.class, () -> await(pool.acquire(20)));
        sessionA.release();
        var sessionC = await(pool.acquire(20));

        assertSame(sessionA, sessionC);
        assertEquals(1, rpc.createCalls());
    }

    @Test
    void shouldStopWaitingWhenContextIsCancelled() {
        var pool = newPool(1);
        var holder = await(pool.acquire());
        var context = Context.ROOT.withCancellation();

        var acquisition = pool.acquire(context);
        assertEquals(1, pool.waiters());
        context.cancel(null);

        var error = assertThrows(ClientException.class, () -> await(acquisition));
        assertThat(error.getMessage(), containsString("cancelled"));
        assertEquals(0, pool.waiters());

        holder.release();
        assertEquals(PooledQuerySession.State.FREE, holder.state());
    }

    @Test
    void shouldStopWaitingAtContextDeadline() {
        var pool = newPool(1);
        await(pool.acquire());
        var context = Context.ROOT.withDeadlineAfter(50, TimeUnit.MILLISECONDS, eventExecutorGroup);

        assertThrows(Exception.class, () -> await(pool.acquire(context)));

        assertEquals(0, pool.waiters());
        context.cancel(null);
    }

    @Test
    void shouldFailAcquisitionInCancelledContext() {
        var pool = newPool(1);
        var context = Context.ROOT.withCancellation();
        context.cancel(null);

        assertThrows(ClientException.class, () -> await(pool.acquire(context)));
        assertEquals(0, rpc.createCalls());
    }

    @Test
    void shouldDeleteBrokenSessionAndNeverReturnIt() {
        var pool = newPool(3);
        var broken = await(pool.acquire());

        broken.broken();

        assertTrue(broken.isDeleted());
        assertThat(rpc.deletedSessions(), contains(broken.id()));
        assertEquals(0, pool.size());
        assertEquals(0, pool.sessionsBeingDeleted());

        var next = await(pool.acquire());
        assertNotEquals(broken.id(), next.id());
    }

    @Test
    void shouldDeleteSessionOnceWhenBrokenAndClosing() {
        var pool = newPool(3);
        var session = await(pool.acquire());

        rpc.endAttachStream(session.id());
        assertTrue(session.isClosing());
        session.broken();

        assertEquals(1, rpc.deleteCalls());
        assertTrue(session.isDeleted());
        assertEquals(0, pool.size());
    }

    @Test
    void shouldDeleteClosingSessionOnRelease() {
        var pool = newPool(3);
        var session = await(pool.acquire());

        rpc.endAttachStream(session.id());
        assertEquals(PooledQuerySession.State.BUSY, session.state());
        session.release();

        assertTrue(session.isDeleted());
        assertEquals(0, pool.size());
    }

    @Test
    void shouldDeleteFreeSessionWhenItsStreamEnds() {
        var pool = newPool(3);
        var session = await(pool.acquire());
        session.release();

        rpc.endAttachStream(session.id());

        assertTrue(session.isDeleted());
        assertEquals(0, pool.size());
        assertNotEquals(session.id(), await(pool.acquire()).id());
    }

    @Test
    void shouldAcquireReplacementForWaiterWhenSessionIsDeleted() {
        var pool = newPool(1);
        var broken = await(pool.acquire());
        var waiter = pool.acquire().toCompletableFuture();

        broken.broken();

        var replacement = await(waiter);
        assertNotEquals(broken.id(), replacement.id());
        assertEquals(PooledQuerySession.State.BUSY, replacement.state());
        assertEquals(1, pool.size());
        assertEquals(0, pool.waiters());
        assertEquals(2, rpc.createCalls());
    }

    @Test
    void shouldPropagateCreationFailureAndPessimizeEndpoint() {
        var pool = newPool(1);
        rpc.failNextCreate(new ServiceUnavailableException("Connection refused"));

        assertThrows(ServiceUnavailableException.class, () -> await(pool.acquire()));

        assertEquals(0, pool.newSessionsRequested());
        assertEquals(0, pool.size());
        assertTrue(discovery.isPessimized(rpc.endpoint()));

        // the failed creation frees its slot
        await(pool.acquire());
    }

    @Test
    void shouldServeWaiterAfterFailedCreationFreesItsSlot() {
        var pool = newPool(1);
        var createGate = rpc.holdCreates();
        rpc.failNextCreate(new ClientException("Session quota exceeded"));
        var first = pool.acquire();
        var second = pool.acquire();
        assertEquals(1, pool.waiters());

        createGate.complete(null);

        assertThrows(ClientException.class, () -> await(first));
        var session = await(second);
        assertEquals(2, rpc.createCalls());
        assertEquals(1, pool.size());
        assertEquals(0, pool.waiters());
        assertEquals(0, pool.newSessionsRequested());
        assertTrue(rpc.hasSession(session.id()));
    }

    @Test
    void shouldFailWaiterWhenCreationOnItsBehalfFails() {
        var pool = newPool(1);
        var createGate = rpc.holdCreates();
        rpc.failNextCreate(new ClientException("Session quota exceeded"));
        rpc.failNextCreate(new ClientException("Session quota still exceeded"));
        var first = pool.acquire();
        var second = pool.acquire();

        createGate.complete(null);

        assertThrows(ClientException.class, () -> await(first));
        var error = assertThrows(ClientException.class, () -> await(second));
        assertThat(error.getMessage(), containsString("still exceeded"));
        assertEquals(0, pool.waiters());
        assertEquals(0, pool.newSessionsRequested());
        assertEquals(2, rpc.createCalls());
    }

    @Test
    void shouldDropBuilderOfRemovedEndpoint() {
        var first = new Endpoint("db1", 2136);
        var second = new Endpoint("db2", 2136);
        var twoEndpoints = new StaticDiscoveryService(List.of(first, second), DEV_NULL_LOGGING);
        Map<Endpoint, AtomicInteger> transports = new ConcurrentHashMap<>();
        var pool = new QuerySessionPool(
                new PoolSettings(0, 10),
                twoEndpoints,
                endpoint -> {
                    transports.computeIfAbsent(endpoint, e -> new AtomicInteger()).incrementAndGet();
                    return rpc;
                },
                newRetryLogic(),
                eventExecutorGroup,
                DEV_NULL_LOGGING);

        var sessions = List.of(await(pool.acquire()), await(pool.acquire()));
        assertEquals(Set.of(first, second), Set.of(sessions.get(0).endpoint(), sessions.get(1).endpoint()));

        twoEndpoints.removeEndpoint(first);
        twoEndpoints.updateEndpoints(List.of(first, second));
        await(pool.acquire());
        await(pool.acquire());

        assertEquals(2, transports.get(first).get());
        assertEquals(1, transports.get(second).get());
    }

    @Test
    void shouldDeleteAllSessionsAndFailWaitersOnDestroy() {
        var pool = newPool(2);
        var held = await(pool.acquire());
        var free = await(pool.acquire());
        free.release();
        assertSame(free, await(pool.acquire()));
        var waiting = pool.acquire(Context.ROOT.withCancellation());
        assertFalse(waiting.toCompletableFuture().isDone());

        await(pool.destroy());

        assertTrue(held.isDeleted());
        assertTrue(free.isDeleted());
        assertThrows(ClientException.class, () -> await(waiting));
        assertEquals(0, rpc.liveSessions());
        assertEquals(0, pool.size());
        assertTrue(pool.isClosed());
        assertTrue(rpc.isClosed());

        var error = assertThrows(ClientException.class, () -> await(pool.acquire()));
        assertThat(error.getMessage(), containsString("closed"));

        // holders of deleted sessions may still give them back
        held.release();
    }

    @Test
    void shouldDestroyOnlyOnce() {
        var pool = newPool(2);
        await(pool.acquire());

        await(pool.destroy());
        await(pool.destroy());

        assertEquals(1, rpc.deleteCalls());
    }

    private QuerySessionPool newPool(int maxLimit) {
        return new QuerySessionPool(
                new PoolSettings(0, maxLimit),
                discovery,
                rpc.factory(),
                newRetryLogic(),
                eventExecutorGroup,
                DEV_NULL_LOGGING);
    }

    private ExponentialBackoffRetryLogic newRetryLogic() {
        return new ExponentialBackoffRetryLogic(0, 0, eventExecutorGroup, Clock.systemUTC(), DEV_NULL_LOGGING);
    }
}
