/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [https://neo4j.com]
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
package org.querydb.driver.internal;

import static java.util.Objects.requireNonNull;

import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import java.time.Clock;
import org.querydb.driver.Config;
import org.querydb.driver.QueryClient;
import org.querydb.driver.discovery.DiscoveryService;
import org.querydb.driver.internal.query.InternalQueryClient;
import org.querydb.driver.internal.query.PoolSettings;
import org.querydb.driver.internal.query.QuerySessionPool;
import org.querydb.driver.internal.retry.ExponentialBackoffRetryLogic;
import org.querydb.driver.internal.retry.RetryLogic;
import org.querydb.driver.spi.QueryServiceRpcFactory;

public class QueryClientFactory {
    static final String THREAD_NAME_PREFIX = "querydb-driver";

    public final QueryClient newInstance(
            DiscoveryService discovery, QueryServiceRpcFactory rpcFactory, Config config) {
        return newInstance(discovery, rpcFactory, config, null);
    }

    public final QueryClient newInstance(
            DiscoveryService discovery,
            QueryServiceRpcFactory rpcFactory,
            Config config,
            EventExecutorGroup eventExecutorGroup) {
        requireNonNull(discovery, "discovery must not be null");
        requireNonNull(rpcFactory, "rpcFactory must not be null");
        requireNonNull(config, "config must not be null");

        boolean ownsEventExecutorGroup;
        if (eventExecutorGroup == null) {
            eventExecutorGroup = createEventExecutorGroup(config.eventLoopThreads());
            ownsEventExecutorGroup = true;
        } else {
            ownsEventExecutorGroup = false;
        }

        var retryLogic = createRetryLogic(config, eventExecutorGroup);
        var poolSettings = new PoolSettings(config.minSessionPoolSize(), config.maxSessionPoolSize());
        var sessionPool =
                createSessionPool(poolSettings, discovery, rpcFactory, retryLogic, eventExecutorGroup, config);

        var log = config.logging().getLog(getClass());
        log.info(
                "Query client created with session pool limits [%d, %d]",
                poolSettings.minLimit(),
                poolSettings.maxLimit());
        return new InternalQueryClient(
                sessionPool, retryLogic, eventExecutorGroup, ownsEventExecutorGroup, config.logging());
    }

    /**
     * <b>This method is protected only for testing</b>
     */
    protected QuerySessionPool createSessionPool(
            PoolSettings poolSettings,
            DiscoveryService discovery,
            QueryServiceRpcFactory rpcFactory,
            RetryLogic retryLogic,
            EventExecutorGroup eventExecutorGroup,
            Config config) {
        return new QuerySessionPool(
                poolSettings, discovery, rpcFactory, retryLogic, eventExecutorGroup, config.logging());
    }

    /**
     * <b>This method is protected only for testing</b>
     */
    protected RetryLogic createRetryLogic(Config config, EventExecutorGroup eventExecutorGroup) {
        return new ExponentialBackoffRetryLogic(
                config.maxRetries(), config.maxRetryTimeMillis(), eventExecutorGroup, createClock(), config.logging());
    }

    /**
     * <b>This method is protected only for testing</b>
     */
    protected EventExecutorGroup createEventExecutorGroup(int size) {
        if (size <= 0) {
            size = Runtime.getRuntime().availableProcessors();
        }
        return new DefaultEventExecutorGroup(size, new DefaultThreadFactory(THREAD_NAME_PREFIX, true));
    }

    /**
     * <b>This method is protected only for testing</b>
     */
    protected Clock createClock() {
        return Clock.systemUTC();
    }
}
