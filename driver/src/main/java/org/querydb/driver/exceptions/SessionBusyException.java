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
package org.querydb.driver.exceptions;

import java.io.Serial;

/**
 * The server considers the session to be in the middle of another operation, e.g. a retry raced an in-flight call
 * after a network partition.
 *
 * @since 1.0
 */
public class SessionBusyException extends SessionExpiredException {
    @Serial
    private static final long serialVersionUID = 5320486012776313251L;

    /**
     * Creates a new instance.
     * @param message the message
     */
    public SessionBusyException(String message) {
        super(StatusCode.SESSION_BUSY, message);
    }
}
