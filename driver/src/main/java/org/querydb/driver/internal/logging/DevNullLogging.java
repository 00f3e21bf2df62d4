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
package org.querydb.driver.internal.logging;

import org.querydb.driver.Logger;
import org.querydb.driver.Logging;

public class DevNullLogging implements Logging {
    public static final Logging DEV_NULL_LOGGING = new DevNullLogging();

    private DevNullLogging() {}

    @Override
    public Logger getLog(String name) {
        return DevNullLogger.DEV_NULL_LOGGER;
    }
}
