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

import java.io.Serial;

/**
 * A <em>SessionExpiredException</em> indicates that the remote session can no longer be used. The driver evicts such a
 * session from the pool instead of returning it, and the work is replayed on a fresh session.
 *
 * @since 1.0
 */
public class SessionExpiredException extends QueryDbException {
    @Serial
    private static final long serialVersionUID = 843176371236755724L;

    /**
     * Creates a new instance.
     * @param code the status code
     * @param message the message
     */
    public SessionExpiredException(StatusCode code, String message) {
        super(code, message);
    }
}
