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

import static java.lang.String.format;
import static org.querydb.driver.internal.logging.DevNullLogging.DEV_NULL_LOGGING;

import java.io.Serial;
import java.io.Serializable;
import java.util.concurrent.TimeUnit;
import org.querydb.driver.internal.query.PoolSettings;
import org.querydb.driver.internal.retry.ExponentialBackoffRetryLogic;

/**
 * A configuration class to config {@link QueryClient} properties.
 * <p>
 * To build a simple config with custom logging implementation:
 * <pre>
 * {@code
 * Config config = Config.builder()
 *                       .withLogging(Logging.slf4j())
 *                       .withMaxSessionPoolSize(50)
 *                       .build();
 * }
 * </pre>
 * <p>
 * Instances are immutable.
 *
 * @since 1.0
 */
public final class Config implements Serializable {
    @Serial
    private static final long serialVersionUID = 4129581749267017532L;

    private static final Config EMPTY = builder().build();

    private final transient Logging logging;
    private final int minSessionPoolSize;
    private final int maxSessionPoolSize;
    private final int maxRetries;
    private final long maxRetryTimeMillis;
    private final int eventLoopThreads;

    private Config(ConfigBuilder builder) {
        this.logging = builder.logging;
        this.minSessionPoolSize = builder.minSessionPoolSize;
        this.maxSessionPoolSize = builder.maxSessionPoolSize;
        this.maxRetries = builder.maxRetries;
        this.maxRetryTimeMillis = builder.maxRetryTimeMillis;
        this.eventLoopThreads = builder.eventLoopThreads;
    }

    /**
     * Logging provider
     *
     * @return the Logging provider to use
     */
    public Logging logging() {
        return logging;
    }

    public int minSessionPoolSize() {
        return minSessionPoolSize;
    }

    public int maxSessionPoolSize() {
        return maxSessionPoolSize;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public long maxRetryTimeMillis() {
        return maxRetryTimeMillis;
    }

    /**
     * @return the number of threads running timers and retries, {@code 0} for the number of available processors
     */
    public int eventLoopThreads() {
        return eventLoopThreads;
    }

    /**
     * Return a {@link ConfigBuilder} instance
     *
     * @return a {@link ConfigBuilder} instance
     */
    public static ConfigBuilder builder() {
        return new ConfigBuilder();
    }

    /**
     * @return A config with all default settings
     */
    public static Config defaultConfig() {
        return EMPTY;
    }

    /**
     * Used to build new config instances
     */
    public static final class ConfigBuilder {
        private Logging logging = DEV_NULL_LOGGING;
        private int minSessionPoolSize = PoolSettings.DEFAULT_MIN_LIMIT;
        private boolean minSessionPoolSizeSet;
        private int maxSessionPoolSize = PoolSettings.DEFAULT_MAX_LIMIT;
        private int maxRetries = ExponentialBackoffRetryLogic.DEFAULT_MAX_RETRIES;
        private long maxRetryTimeMillis = ExponentialBackoffRetryLogic.DEFAULT_MAX_RETRY_TIME_MS;
        private int eventLoopThreads = 0;

        private ConfigBuilder() {}

        /**
         * Provide a logging implementation for the client to use. Nothing is logged by default. Callers are expected to
         * either implement {@link Logging} interface or provide one of the existing implementations available from static
         * factory methods in the {@link Logging} interface.
         *
         * @param logging the logging instance to use
         * @return this builder
         */
        public ConfigBuilder withLogging(Logging logging) {
            this.logging = logging;
            return this;
        }

        /**
         * Configure the minimum number of sessions the pool keeps around. Left unset, it defaults to
         * {@value PoolSettings#DEFAULT_MIN_LIMIT}, capped at the max session pool size.
         *
         * @param value the minimum size, zero or more
         * @return this builder
         */
        public ConfigBuilder withMinSessionPoolSize(int value) {
            if (value < 0) {
                throw new IllegalArgumentException(
                        format("The min session pool size may not be smaller than 0, but was %d.", value));
            }
            this.minSessionPoolSize = value;
            this.minSessionPoolSizeSet = true;
            return this;
        }

        /**
         * Configure the maximum number of sessions the pool holds, including sessions being created.
         * When every session is in use, further executions wait for one to be released.
         *
         * @param value the maximum size, positive
         * @return this builder
         */
        public ConfigBuilder withMaxSessionPoolSize(int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(
                        format("The max session pool size must be positive, but was %d.", value));
            }
            this.maxSessionPoolSize = value;
            return this;
        }

        public ConfigBuilder withMaxRetries(int value) {
            if (value < 0) {
                throw new IllegalArgumentException(
                        format("The max retries may not be smaller than 0, but was %d.", value));
            }
            this.maxRetries = value;
            return this;
        }

        /**
         * Specify the maximum time executions are allowed to retry.
         * <p>
         * Executions started by {@link QueryClient#executeAsync(SessionCallback)} and
         * {@link QueryClient#executeTxAsync(SessionCallback)} are retried on broken sessions and, when idempotent, on
         * transient failures. Retries are made with an exponential backoff, until this time elapses.
         *
         * @param value the timeout duration
         * @param unit the unit in which duration is given
         * @return this builder
         */
        public ConfigBuilder withMaxRetryTime(long value, TimeUnit unit) {
            var maxRetryTimeMs = unit.toMillis(value);
            if (maxRetryTimeMs < 0) {
                throw new IllegalArgumentException(
                        format("The max retry time may not be smaller than 0, but was %d %s.", value, unit));
            }
            this.maxRetryTimeMillis = maxRetryTimeMs;
            return this;
        }

        /**
         * Configure the event loop thread count. This specifies how many threads the client can use to run timers
         * and retries. By default, the number of available processors is used.
         *
         * @param size the thread count.
         * @return this builder.
         * @throws IllegalArgumentException if the value of the size is set to a number that is less than 1.
         */
        public ConfigBuilder withEventLoopThreads(int size) {
            if (size < 1) {
                throw new IllegalArgumentException(
                        format("The event loop thread may not be smaller than 1, but was %d.", size));
            }
            this.eventLoopThreads = size;
            return this;
        }

        /**
         * Create a config instance from this builder.
         *
         * @return a new {@link Config} instance.
         */
        public Config build() {
            if (!minSessionPoolSizeSet) {
                minSessionPoolSize = Math.min(PoolSettings.DEFAULT_MIN_LIMIT, maxSessionPoolSize);
            } else if (minSessionPoolSize > maxSessionPoolSize) {
                throw new IllegalArgumentException(format(
                        "The min session pool size %d may not exceed the max session pool size %d.",
                        minSessionPoolSize, maxSessionPoolSize));
            }
            return new Config(this);
        }
    }
}
