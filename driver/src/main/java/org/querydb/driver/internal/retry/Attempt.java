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
package org.querydb.driver.internal.retry;

import io.grpc.Context;
import java.util.concurrent.CompletionStage;

@FunctionalInterface
public interface Attempt<T> {
    /**
     * Run the operation once. Failures are expected to be reported through {@link AttemptResult#failure}, together
     * with the idempotency verdict of this attempt.
     *
     * @param context the execution context of the whole retried operation
     * @return the outcome
     */
    CompletionStage<AttemptResult<T>> run(Context context);
}
