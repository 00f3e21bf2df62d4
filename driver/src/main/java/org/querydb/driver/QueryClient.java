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
import org.reactivestreams.Publisher;

/**
 * Executes units of work against pooled sessions, with retries.
 * <p>
 * Every execution acquires a session from the pool, stamps the execution settings on it, invokes the callback and
 * gives the session back. A failure caused by a broken session evicts that session and replays the callback on
 * another one. Other retryable failures are replayed only when the execution is idempotent, either because it was
 * declared so with {@link ExecuteConfig.Builder#withIdempotent(boolean)} or because every query it ran was.
 * <p>
 * Instances are thread-safe and meant to be shared. Close the client once it is no longer needed, to delete the
 * sessions it holds on the server.
 *
 * @since 1.0
 */
public interface QueryClient extends AutoCloseable {
    /**
     * Execute the callback with default settings. A transaction the callback leaves open is rolled back.
     *
     * @param callback the unit of work
     * @param <T> the result type
     * @return stage completed with the result of the callback
     */
    default <T> CompletionStage<T> executeAsync(SessionCallback<T> callback) {
        return executeAsync(callback, ExecuteConfig.defaultConfig());
    }

    /**
     * Execute the callback.
     * <p>
     * When the config carries {@link TxSettings}, queries run by the callback belong to one transaction, committed
     * once the callback completed normally. Without settings, a transaction the callback began and left open is
     * rolled back. Either way, a transaction is rolled back when the callback fails, unless the session broke.
     *
     * @param callback the unit of work
     * @param config the execution settings
     * @param <T> the result type
     * @return stage completed with the result of the callback
     */
    <T> CompletionStage<T> executeAsync(SessionCallback<T> callback, ExecuteConfig config);

    /**
     * Execute the callback in a serializable read-write transaction, committed once the callback completed normally.
     *
     * @param callback the unit of work
     * @param <T> the result type
     * @return stage completed with the result of the callback
     */
    default <T> CompletionStage<T> executeTxAsync(SessionCallback<T> callback) {
        return executeTxAsync(callback, ExecuteConfig.defaultConfig());
    }

    /**
     * Execute the callback in a transaction, committed once the callback completed normally. The transaction uses the
     * settings of the config, or {@link TxSettings#serializableReadWrite()} when it has none.
     *
     * @param callback the unit of work
     * @param config the execution settings
     * @param <T> the result type
     * @return stage completed with the result of the callback
     */
    <T> CompletionStage<T> executeTxAsync(SessionCallback<T> callback, ExecuteConfig config);

    /**
     * Blocking variant of {@link #executeAsync(SessionCallback, ExecuteConfig)}.
     *
     * @param callback the unit of work
     * @param config the execution settings
     * @param <T> the result type
     * @return the result of the callback
     */
    <T> T execute(SessionCallback<T> callback, ExecuteConfig config);

    default <T> T execute(SessionCallback<T> callback) {
        return execute(callback, ExecuteConfig.defaultConfig());
    }

    /**
     * Blocking variant of {@link #executeTxAsync(SessionCallback, ExecuteConfig)}.
     *
     * @param callback the unit of work
     * @param config the execution settings
     * @param <T> the result type
     * @return the result of the callback
     */
    <T> T executeTx(SessionCallback<T> callback, ExecuteConfig config);

    default <T> T executeTx(SessionCallback<T> callback) {
        return executeTx(callback, ExecuteConfig.defaultConfig());
    }

    /**
     * Reactive variant of {@link #executeAsync(SessionCallback, ExecuteConfig)}. Nothing is executed until the
     * publisher is subscribed to, and every subscription executes the callback anew.
     *
     * @param callback the unit of work
     * @param config the execution settings
     * @param <T> the result type
     * @return publisher of the result of the callback
     */
    <T> Publisher<T> executeRx(SessionCallback<T> callback, ExecuteConfig config);

    /**
     * Close all the resources assigned to this client, including deleting the pooled sessions.
     * Executions started afterwards fail.
     */
    @Override
    void close();

    /**
     * Close all the resources assigned to this client asynchronously.
     *
     * @return a {@link CompletionStage} that is completed with {@code null} when all resources have been closed.
     */
    CompletionStage<Void> closeAsync();
}
