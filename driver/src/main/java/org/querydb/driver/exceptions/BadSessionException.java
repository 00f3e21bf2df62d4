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
 * The server no longer recognizes the session id.
 *
 * @since 1.0
 */
public class BadSessionException extends SessionExpiredException {
    @Serial
    private static final long serialVersionUID = -1180251273582410712L;

    /**
     * Creates a new instance.
     * @param message the message
     */
    public BadSessionException(String message) {
        super(StatusCode.BAD_SESSION, message);
    }
}
