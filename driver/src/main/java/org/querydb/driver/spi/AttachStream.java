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
package org.querydb.driver.spi;

import java.util.concurrent.CompletionStage;

/**
 * Long-lived stream confirming a remote session is alive. The server revokes the session by ending the stream.
 *
 * @since 1.0
 */
public interface AttachStream {
    /**
     * @return stage completed when the stream ends, normally or exceptionally
     */
    CompletionStage<Void> termination();

    /**
     * Close the stream from the client side. Calling it on an ended stream has no effect.
     */
    void cancel();
}
