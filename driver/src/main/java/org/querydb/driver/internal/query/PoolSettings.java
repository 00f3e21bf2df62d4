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
package org.querydb.driver.internal.query;

import static org.querydb.driver.internal.util.Preconditions.checkArgument;

public record PoolSettings(int minLimit, int maxLimit) {
    public static final int DEFAULT_MIN_LIMIT = 5;
    public static final int DEFAULT_MAX_LIMIT = 20;

    public PoolSettings {
        checkArgument(minLimit >= 0, "Min session pool size should be >= 0: " + minLimit);
        checkArgument(maxLimit > 0, "Max session pool size should be > 0: " + maxLimit);
        checkArgument(
                minLimit <= maxLimit,
                "Min session pool size should not exceed max session pool size: " + minLimit + " > " + maxLimit);
    }

    public static PoolSettings defaultSettings() {
        return new PoolSettings(DEFAULT_MIN_LIMIT, DEFAULT_MAX_LIMIT);
    }
}
