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

import io.grpc.Context;
import java.util.concurrent.CompletionStage;
import org.querydb.driver.Endpoint;
import org.querydb.driver.Logger;
import org.querydb.driver.Logging;
import org.querydb.driver.discovery.DiscoveryService;
import org.querydb.driver.exceptions.ServiceUnavailableException;
import org.querydb.driver.internal.retry.AttemptResult;
import org.querydb.driver.internal.retry.RetryLogic;
import org.querydb.driver.internal.util.Futures;
import org.querydb.driver.spi.QueryServiceRpc;

/**
 * Creates sessions on one endpoint.
 */
public class SessionBuilder {
    private final Endpoint endpoint;
    private final QueryServiceRpc rpc;
    private final DiscoveryService discovery;
    private final RetryLogic retryLogic;
    private final Logging logging;
    private final Logger log;

    public SessionBuilder(
            Endpoint endpoint,
            QueryServiceRpc rpc,
            DiscoveryService discovery,
            RetryLogic retryLogic,
            Logging logging) {
        this.endpoint = requireNonNull(endpoint, "endpoint");
        this.rpc = requireNonNull(rpc, "rpc");
        this.discovery = requireNonNull(discovery, "discovery");
        this.retryLogic = requireNonNull(retryLogic, "retryLogic");
        this.logging = logging;
        this.log = logging.getLog(getClass());
    }

    public Endpoint endpoint() {
        return endpoint;
    }

    public QueryServiceRpc rpc() {
        return rpc;
    }

    /**
     * Create and attach a session, retrying failures the retry policy allows. Creating a session has no effect visible
     * to the caller, so every attempt counts as idempotent.
     *
     * @param listener receives the lifecycle events of the session
     * @return stage completed with a session held by the caller
     */
    CompletionStage<PooledQuerySession> create(SessionLifecycleListener listener) {
        return retryLogic.retry(Context.ROOT, context -> createOnce(listener)
                .handle((session, error) -> error == null
                        ? AttemptResult.success(session)
                        : AttemptResult.failure(Futures.completionExceptionCause(error), true)));
    }

    private CompletionStage<PooledQuerySession> createOnce(SessionLifecycleListener listener) {
        return rpc.createSession()
                .thenCompose(sessionId -> {
                    var session = new PooledQuerySession(sessionId, endpoint, rpc, listener, logging);
                    return session.attach(session::markForDeleteOnRelease)
                            .handle((ignore, attachError) -> {
                                if (attachError != null) {
                                    session.startDeletion();
                                    session.delete().whenComplete((ignored, deleteError) -> {
                                        if (deleteError != null) {
                                            log.debug(
                                                    "Failed to delete session %s which could not be attached: %s",
                                                    sessionId,
                                                    deleteError);
                                        }
                                    });
                                    throw Futures.asCompletionException(
                                            Futures.completionExceptionCause(attachError));
                                }
                                log.debug("Session %s created on %s", sessionId, endpoint);
                                return session;
                            });
                })
                .whenComplete((session, error) -> {
                    if (Futures.completionExceptionCause(error) instanceof ServiceUnavailableException) {
                        log.warn("Endpoint %s is unavailable, pessimizing it", endpoint);
                        discovery.pessimize(endpoint);
                    }
                });
    }
}
