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
package org.querydb.driver;

import java.util.concurrent.CompletionStage;

/**
 * A server-allocated session, handed to a {@link SessionCallback} for the duration of one attempt.
 * <p>
 * A session runs one operation at a time. It must not be used after the callback's stage completed: the client
 * returns it to the pool, or evicts it, at that point.
 *
 * @since 1.0
 */
public interface QuerySession {
    /**
     * @return the session id assigned by the server
     */
    String id();

    /**
     * @return the endpoint the session lives on
     */
    Endpoint endpoint();

    /**
     * Execute a query.
     * <p>
     * When the execution was configured with {@link TxSettings}, the first query begins a transaction with those
     * settings and the following ones continue it. A transaction begun with {@link #beginTransaction(TxSettings)} is
     * continued the same way.
     *
     * @param query the query
     * @return stage completed with the result
     */
    CompletionStage<QueryResult> executeQuery(Query query);

    /**
     * Begin a transaction explicitly. A transaction left open when the callback completes normally is rolled back by
     * {@link QueryClient#executeAsync(SessionCallback)}, and committed by
     * {@link QueryClient#executeTxAsync(SessionCallback)}.
     *
     * @param settings the transaction settings
     * @return stage completed once the transaction began
     */
    CompletionStage<Void> beginTransaction(TxSettings settings);

    CompletionStage<Void> commitTransaction();

    CompletionStage<Void> rollbackTransaction();

    /**
     * @return id of the open transaction, {@code null} when none is open
     */
    String transactionId();
}
