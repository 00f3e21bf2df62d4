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
package org.querydb.driver.exceptions;

import static java.util.Objects.requireNonNull;

import java.io.Serial;

/**
 * This is the base class for all exceptions raised by the driver.
 *
 * @since 1.0
 */
public class QueryDbException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -3157203410398723371L;

    private final StatusCode code;

    /**
     * Creates a new instance.
     *
     * @param code    the status code
     * @param message the message
     */
    public QueryDbException(StatusCode code, String message) {
        this(code, message, null);
    }

    /**
     * Creates a new instance.
     *
     * @param code    the status code
     * @param message the message
     * @param cause   the cause
     */
    public QueryDbException(StatusCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = requireNonNull(code, "code");
    }

    /**
     * Access the status code for this exception.
     *
     * @return the status code reported by the server, or {@link StatusCode#CLIENT_ERROR} for local failures
     */
    public StatusCode code() {
        return code;
    }
}
