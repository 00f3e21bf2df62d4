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

import static java.util.Objects.requireNonNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The components of a query: its text, its parameters, and whether it is safe to replay.
 *
 * @param text the query text
 * @param parameters the query parameters, never {@code null}
 * @param idempotent {@code true} when the query may be executed again without changing the outcome, {@code false}
 * when it may not, {@code null} when unspecified
 * @since 1.0
 */
public record Query(String text, Map<String, Object> parameters, Boolean idempotent) {
    public Query {
        requireNonNull(text, "text");
        if (text.isBlank()) {
            throw new IllegalArgumentException("Query text should not be blank");
        }
        parameters = parameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public Query(String text) {
        this(text, null, null);
    }

    public Query(String text, Map<String, Object> parameters) {
        this(text, parameters, null);
    }

    /**
     * Create a new query with the same text and parameters, declared idempotent or not.
     *
     * @param idempotent the idempotency flag
     * @return a new query
     */
    public Query withIdempotent(boolean idempotent) {
        return new Query(text, parameters, idempotent);
    }
}
