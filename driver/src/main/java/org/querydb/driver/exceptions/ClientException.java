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
 * A <em>ClientException</em> indicates that the client has carried out an operation incorrectly, or that the driver can
 * no longer serve the request, e.g. the client was closed or the execution context was cancelled.
 *
 * @since 1.0
 */
public class ClientException extends QueryDbException {
    @Serial
    private static final long serialVersionUID = 6285643237829125384L;

    /**
     * Creates a new instance.
     * @param message the message
     */
    public ClientException(String message) {
        this(message, null);
    }

    /**
     * Creates a new instance.
     * @param message the message
     * @param cause the cause
     */
    public ClientException(String message, Throwable cause) {
        super(StatusCode.CLIENT_ERROR, message, cause);
    }
}
