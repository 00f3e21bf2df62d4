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
package org.querydb.driver.discovery;

import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import org.querydb.driver.Endpoint;

/**
 * Resolves endpoints of the query service.
 *
 * @since 1.0
 */
public interface DiscoveryService {
    /**
     * @return the endpoint new sessions should be created against
     */
    CompletionStage<Endpoint> endpoint();

    /**
     * Deprioritize an endpoint after failures to reach it.
     *
     * @param endpoint the endpoint
     */
    void pessimize(Endpoint endpoint);

    /**
     * Register a listener notified when an endpoint leaves the service.
     *
     * @param listener the listener
     */
    void addEndpointRemovedListener(Consumer<Endpoint> listener);

    CompletionStage<Void> close();
}
