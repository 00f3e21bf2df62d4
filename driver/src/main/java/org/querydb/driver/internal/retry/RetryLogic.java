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
package org.querydb.driver.internal.retry;

import io.grpc.Context;
import java.util.concurrent.CompletionStage;

/**
 * Pluggable policy deciding whether and when a failed attempt is repeated.
 */
public interface RetryLogic {
    /**
     * Run the attempt until it succeeds, the policy gives up, or the context is cancelled.
     *
     * @param context the execution context, its cancellation stops further attempts
     * @param attempt the attempt
     * @param <T> the value type
     * @return the value of the first successful attempt, or the failure of the last one
     */
    <T> CompletionStage<T> retry(Context context, Attempt<T> attempt);
}
