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
package org.querydb.driver.testutil;

import static org.querydb.driver.internal.util.Futures.completedWithNull;
import static org.querydb.driver.internal.util.Futures.failedFuture;

import io.grpc.Context;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.querydb.driver.Endpoint;
import org.querydb.driver.Query;
import org.querydb.driver.QueryResult;
import org.querydb.driver.TxSettings;
import org.querydb.driver.exceptions.BadSessionException;
import org.querydb.driver.exceptions.ClientException;
import org.querydb.driver.exceptions.DatabaseException;
import org.querydb.driver.exceptions.StatusCode;
import org.querydb.driver.spi.AttachStream;
import org.querydb.driver.spi.QueryServiceRpc;
import org.querydb.driver.spi.QueryServiceRpcFactory;
import org.querydb.driver.spi.TxControl;

/**
 * In-memory query service. Keeps track of sessions, their attach streams and transactions, counts calls and fails
 * calls on demand.
 */
public class FakeQueryServiceRpc implements QueryServiceRpc {
    private final Endpoint endpoint;
    private final AtomicInteger sessionIds = new AtomicInteger();
    private final AtomicInteger transactionIds = new AtomicInteger();
    private final Map<String, FakeAttachStream> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> openTransactions = new ConcurrentHashMap<>();
    private final AtomicInteger maxLiveSessions = new AtomicInteger();

    private final AtomicInteger createCalls = new AtomicInteger();
    private final AtomicInteger deleteCalls = new AtomicInteger();
    private final AtomicInteger beginCalls = new AtomicInteger();
    private final AtomicInteger executeCalls = new AtomicInteger();
    private final AtomicInteger commitCalls = new AtomicInteger();
    private final AtomicInteger rollbackCalls = new AtomicInteger();
    private final List<String> deletedSessions = new CopyOnWriteArrayList<>();
    private final List<String> committedTransactions = new CopyOnWriteArrayList<>();
    private final List<String> rolledBackTransactions = new CopyOnWriteArrayList<>();
    private final List<TxControl> txControls = new CopyOnWriteArrayList<>();

    private final Queue<Throwable> createFailures = new ConcurrentLinkedQueue<>();
    private final Queue<Throwable> executeFailures = new ConcurrentLinkedQueue<>();
    private final Queue<Throwable> commitFailures = new ConcurrentLinkedQueue<>();
    private final Queue<Throwable> rollbackFailures = new ConcurrentLinkedQueue<>();

    private volatile CompletableFuture<Void> createGate = CompletableFuture.completedFuture(null);
    private volatile CompletableFuture<Void> executeGate = CompletableFuture.completedFuture(null);
    private final AtomicBoolean closed = new AtomicBoolean();

    public FakeQueryServiceRpc() {
        this(new Endpoint("localhost", 2136));
    }

    public FakeQueryServiceRpc(Endpoint endpoint) {
        this.endpoint = endpoint;
    }

    /**
     * @return a factory handing out this instance for every endpoint
     */
    public QueryServiceRpcFactory factory() {
        return ignore -> this;
    }

    public Endpoint endpoint() {
        return endpoint;
    }

    @Override
    public CompletionStage<String> createSession() {
        createCalls.incrementAndGet();
        return createGate.thenCompose(ignore -> {
            var failure = createFailures.poll();
            if (failure != null) {
                return failedFuture(failure);
            }
            var sessionId = "session-" + sessionIds.incrementAndGet();
            sessions.put(sessionId, new FakeAttachStream());
            maxLiveSessions.accumulateAndGet(sessions.size(), Math::max);
            return CompletableFuture.completedFuture(sessionId);
        });
    }

    @Override
    public CompletionStage<Void> deleteSession(String sessionId) {
        deleteCalls.incrementAndGet();
        var stream = sessions.remove(sessionId);
        if (stream == null) {
            return failedFuture(new BadSessionException("Session " + sessionId + " not found"));
        }
        deletedSessions.add(sessionId);
        openTransactions.remove(sessionId);
        stream.end();
        return completedWithNull();
    }

    @Override
    public CompletionStage<AttachStream> attachSession(String sessionId) {
        var stream = sessions.get(sessionId);
        if (stream == null) {
            return failedFuture(new BadSessionException("Session " + sessionId + " not found"));
        }
        return CompletableFuture.completedFuture(stream);
    }

    @Override
    public CompletionStage<String> beginTransaction(String sessionId, TxSettings settings) {
        beginCalls.incrementAndGet();
        var error = checkSession(sessionId);
        if (error != null) {
            return failedFuture(error);
        }
        return CompletableFuture.completedFuture(newTransaction(sessionId));
    }

    @Override
    public CompletionStage<Void> commitTransaction(String sessionId, String transactionId) {
        commitCalls.incrementAndGet();
        var failure = commitFailures.poll();
        if (failure != null) {
            openTransactions.remove(sessionId, transactionId);
            return failedFuture(failure);
        }
        return finishTransaction(sessionId, transactionId, committedTransactions);
    }

    @Override
    public CompletionStage<Void> rollbackTransaction(String sessionId, String transactionId) {
        rollbackCalls.incrementAndGet();
        var failure = rollbackFailures.poll();
        if (failure != null) {
            openTransactions.remove(sessionId, transactionId);
            return failedFuture(failure);
        }
        return finishTransaction(sessionId, transactionId, rolledBackTransactions);
    }

    @Override
    public CompletionStage<QueryResult> executeQuery(
            Context context, String sessionId, Query query, TxControl txControl) {
        executeCalls.incrementAndGet();
        txControls.add(txControl);
        var result = new CompletableFuture<QueryResult>();
        executeGate.whenComplete((ignore, gateError) -> {
            var failure = executeFailures.poll();
            if (failure != null) {
                result.completeExceptionally(failure);
                return;
            }
            var error = checkSession(sessionId);
            if (error != null) {
                result.completeExceptionally(error);
                return;
            }
            String transactionId = null;
            if (txControl.beginSettings() != null) {
                transactionId = newTransaction(sessionId);
            } else if (txControl.transactionId() != null) {
                if (!txControl.transactionId().equals(openTransactions.get(sessionId))) {
                    result.completeExceptionally(new DatabaseException(
                            StatusCode.NOT_FOUND, "Transaction " + txControl.transactionId() + " not found"));
                    return;
                }
                transactionId = txControl.transactionId();
            }
            result.complete(new QueryResult(List.<Object>of(query.text()), transactionId));
        });
        return result;
    }

    @Override
    public CompletionStage<Void> close() {
        closed.set(true);
        return completedWithNull();
    }

    public void failNextCreate(Throwable error) {
        createFailures.add(error);
    }

    public void failNextExecute(Throwable error) {
        executeFailures.add(error);
    }

    public void failNextCommit(Throwable error) {
        commitFailures.add(error);
    }

    public void failNextRollback(Throwable error) {
        rollbackFailures.add(error);
    }

    /**
     * Make session creations wait until the returned future completes.
     *
     * @return the future releasing pending creations
     */
    public CompletableFuture<Void> holdCreates() {
        var gate = new CompletableFuture<Void>();
        createGate = gate;
        return gate;
    }

    /**
     * Make query executions wait until the returned future completes.
     *
     * @return the future releasing pending executions
     */
    public CompletableFuture<Void> holdExecutes() {
        var gate = new CompletableFuture<Void>();
        executeGate = gate;
        return gate;
    }

    /**
     * End the attach stream of a session, as the server does when it drops the session.
     *
     * @param sessionId the session
     */
    public void endAttachStream(String sessionId) {
        var stream = sessions.get(sessionId);
        if (stream != null) {
            stream.end();
        }
    }

    /**
     * Forget a session without ending its stream, the next call on it fails with {@link BadSessionException}.
     *
     * @param sessionId the session
     */
    public void dropSession(String sessionId) {
        sessions.remove(sessionId);
        openTransactions.remove(sessionId);
    }

    public int liveSessions() {
        return sessions.size();
    }

    public int maxLiveSessions() {
        return maxLiveSessions.get();
    }

    public boolean hasSession(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public int createCalls() {
        return createCalls.get();
    }

    public int deleteCalls() {
        return deleteCalls.get();
    }

    public int beginCalls() {
        return beginCalls.get();
    }

    public int executeCalls() {
        return executeCalls.get();
    }

    public int commitCalls() {
        return commitCalls.get();
    }

    public int rollbackCalls() {
        return rollbackCalls.get();
    }

    public List<String> deletedSessions() {
        return deletedSessions;
    }

    public List<String> committedTransactions() {
        return committedTransactions;
    }

    public List<String> rolledBackTransactions() {
        return rolledBackTransactions;
    }

    public List<TxControl> txControls() {
        return txControls;
    }

    public boolean hasOpenTransaction(String sessionId) {
        return openTransactions.containsKey(sessionId);
    }

    public boolean isClosed() {
        return closed.get();
    }

    private String newTransaction(String sessionId) {
        var transactionId = "tx-" + transactionIds.incrementAndGet();
        openTransactions.put(sessionId, transactionId);
        return transactionId;
    }

    private CompletionStage<Void> finishTransaction(String sessionId, String transactionId, List<String> outcome) {
        var error = checkSession(sessionId);
        if (error != null) {
            return failedFuture(error);
        }
        if (!openTransactions.remove(sessionId, transactionId)) {
            return failedFuture(
                    new DatabaseException(StatusCode.NOT_FOUND, "Transaction " + transactionId + " not found"));
        }
        outcome.add(transactionId);
        return completedWithNull();
    }

    private Throwable checkSession(String sessionId) {
        if (closed.get()) {
            return new ClientException("Transport is closed");
        }
        if (!sessions.containsKey(sessionId)) {
            return new BadSessionException("Session " + sessionId + " not found");
        }
        return null;
    }

    private static final class FakeAttachStream implements AttachStream {
        private final CompletableFuture<Void> termination = new CompletableFuture<>();

        @Override
        public CompletionStage<Void> termination() {
            return termination;
        }

        @Override
        public void cancel() {
            end();
        }

        void end() {
            termination.complete(null);
        }
    }
}
