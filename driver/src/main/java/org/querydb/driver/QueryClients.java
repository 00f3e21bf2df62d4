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
package org.querydb.driver;

import org.querydb.driver.discovery.DiscoveryService;
import org.querydb.driver.internal.QueryClientFactory;
import org.querydb.driver.spi.QueryServiceRpcFactory;

/**
 * Creates {@link QueryClient query clients}.
 *
 * @since 1.0
 */
public final class QueryClients {
    private QueryClients() {}

    /**
     * Return a client with the default configuration.
     *
     * @param discovery source of the endpoints sessions are created on
     * @param rpcFactory creates the query service transport of an endpoint
     * @return a new client
     */
    public static QueryClient client(DiscoveryService discovery, QueryServiceRpcFactory rpcFactory) {
        return client(discovery, rpcFactory, Config.defaultConfig());
    }

    /**
     * Return a client with the given configuration. The discovery service stays owned by the caller, closing the
     * client does not close it.
     *
     * @param discovery source of the endpoints sessions are created on
     * @param rpcFactory creates the query service transport of an endpoint
     * @param config user defined configuration
     * @return a new client
     */
    public static QueryClient client(DiscoveryService discovery, QueryServiceRpcFactory rpcFactory, Config config) {
        config = config == null ? Config.defaultConfig() : config;
        return new QueryClientFactory().newInstance(discovery, rpcFactory, config);
    }
}
