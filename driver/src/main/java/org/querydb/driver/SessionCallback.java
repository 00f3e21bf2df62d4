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
 * Unit of work executed by a {@link QueryClient} against a pooled session. It may be invoked several times when the
 * work is retried, each time with a different session.
 *
 * @param <T> the result type
 * @since 1.0
 */
@FunctionalInterface
public interface SessionCallback<T> {
    CompletionStage<T> execute(QuerySession session);
}
