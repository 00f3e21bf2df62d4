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

import static java.util.Objects.requireNonNull;

/**
 * Outcome of one attempt of a retried operation.
 *
 * @param value the produced value, only meaningful on success
 * @param error the failure, {@code null} on success
 * @param idempotent whether replaying the failed attempt is safe
 * @param <T> the value type
 */
public record AttemptResult<T>(T value, Throwable error, boolean idempotent) {
    public static <T> AttemptResult<T> success(T value) {
        return new AttemptResult<>(value, null, false);
    }

    public static <T> AttemptResult<T> failure(Throwable error, boolean idempotent) {
        return new AttemptResult<>(null, requireNonNull(error, "error"), idempotent);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
