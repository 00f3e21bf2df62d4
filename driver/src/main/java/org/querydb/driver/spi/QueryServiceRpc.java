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
package org.querydb.driver.spi;

import io.grpc.Context;
import java.util.concurrent.CompletionStage;
import org.querydb.driver.Query;
import org.querydb.driver.QueryResult;
import org.querydb.driver.TxSettings;
import org.querydb.driver.exceptions.QueryDbException;

/**
 * Request/response channel towards the query service of one endpoint. Authentication and wire encoding are the
 * implementation's concern.
 * <p>
 * Every returned stage fails with a {@link QueryDbException} describing the status of the call, e.g.
 * {@link org.querydb.driver.exceptions.BadSessionException} when the server no longer knows the session.
 * {@link org.querydb.driver.internal.util.ErrorUtil#newQueryDbError} maps raw statuses to those exceptions.
 *
 * @since 1.0
 */
public interface QueryServiceRpc {
    /**
     * @return id of the newly created remote session
     */
    CompletionStage<String> createSession();

    CompletionStage<Void> deleteSession(String sessionId);

    /**
     * Open the keep-alive stream of a session.
     *
     * @param sessionId the session id
     * @return stage completed with the stream once the server confirmed the attachment
     */
    CompletionStage<AttachStream> attachSession(String sessionId);

    /**
     * @return id of the begun transaction
     */
    CompletionStage<String> beginTransaction(String sessionId, TxSettings settings);

    CompletionStage<Void> commitTransaction(String sessionId, String transactionId);

    CompletionStage<Void> rollbackTransaction(String sessionId, String transactionId);

    /**
     * Execute a query. Cancelling the returned stage, or the given context, abandons the call.
     *
     * @param context the execution context, carrying the deadline of the call
     * @param sessionId the session id
     * @param query the query
     * @param txControl transaction control of the request
     * @return the result
     */
    CompletionStage<QueryResult> executeQuery(Context context, String sessionId, Query query, TxControl txControl);

    CompletionStage<Void> close();
}
