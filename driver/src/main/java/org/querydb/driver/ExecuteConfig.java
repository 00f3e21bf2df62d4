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
package org.querydb.driver;

import static java.util.Objects.requireNonNull;
import static org.querydb.driver.internal.util.Preconditions.checkArgument;

import io.grpc.Context;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of a single {@link QueryClient} execution.
 * <p>
 * The execution context carries the caller's deadline and cancellation. The client derives its own cancellable
 * context from it, bounded by {@link #timeout()} when one is set, and passes the derived context explicitly to every
 * step of the execution. The context is never attached to the calling thread.
 *
 * @since 1.0
 */
public final class ExecuteConfig {
    private static final ExecuteConfig DEFAULT = builder().build();

    private final Context context;
    private final TxSettings txSettings;
    private final Duration timeout;
    private final Boolean idempotent;

    private ExecuteConfig(Builder builder) {
        this.context = builder.context;
        this.txSettings = builder.txSettings;
        this.timeout = builder.timeout;
        this.idempotent = builder.idempotent;
    }

    /**
     * Returns default config value: root context, no transaction settings, no timeout, idempotency unspecified.
     *
     * @return the default config
     */
    public static ExecuteConfig defaultConfig() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the parent execution context
     */
    public Context context() {
        return context;
    }

    /**
     * @return transaction settings applied to the session, {@code null} when the callback manages transactions itself
     */
    public TxSettings txSettings() {
        return txSettings;
    }

    /**
     * @return the timeout bounding the whole execution, retries included, {@code null} when unbounded
     */
    public Duration timeout() {
        return timeout;
    }

    /**
     * @return the call-level idempotency flag, {@code null} when not specified
     */
    public Boolean idempotent() {
        return idempotent;
    }

    /**
     * Create a copy of this config with the given transaction settings.
     *
     * @param txSettings the settings
     * @return the new config
     */
    public ExecuteConfig withTxSettings(TxSettings txSettings) {
        return new Builder(this).withTxSettings(txSettings).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        var that = (ExecuteConfig) o;
        return context == that.context
                && Objects.equals(txSettings, that.txSettings)
                && Objects.equals(timeout, that.timeout)
                && Objects.equals(idempotent, that.idempotent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(context), txSettings, timeout, idempotent);
    }

    @Override
    public String toString() {
        return "ExecuteConfig{" + "txSettings=" + txSettings + ", timeout=" + timeout + ", idempotent=" + idempotent
                + '}';
    }

    public static final class Builder {
        private Context context = Context.ROOT;
        private TxSettings txSettings;
        private Duration timeout;
        private Boolean idempotent;

        private Builder() {}

        private Builder(ExecuteConfig config) {
            this.context = config.context;
            this.txSettings = config.txSettings;
            this.timeout = config.timeout;
            this.idempotent = config.idempotent;
        }

        /**
         * Set the parent execution context. Its cancellation and deadline apply to the execution.
         *
         * @param context the context, must not be {@code null}
         * @return this builder
         */
        public Builder withContext(Context context) {
            this.context = requireNonNull(context, "Context should not be null");
            return this;
        }

        /**
         * Set transaction settings. Every query run by the callback then belongs to a transaction begun with these
         * settings, which is committed when the callback completes normally.
         *
         * @param txSettings the settings, {@code null} to let the callback manage transactions
         * @return this builder
         */
        public Builder withTxSettings(TxSettings txSettings) {
            this.txSettings = txSettings;
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            requireNonNull(timeout, "Timeout should not be null");
            checkArgument(!timeout.isNegative() && !timeout.isZero(), "Timeout should be positive");
            this.timeout = timeout;
            return this;
        }

        /**
         * Declare whether the callback may safely be executed more than once. When set, it overrides the idempotency
         * of the individual queries the callback runs.
         *
         * @param idempotent the flag
         * @return this builder
         */
        public Builder withIdempotent(boolean idempotent) {
            this.idempotent = idempotent;
            return this;
        }

        public ExecuteConfig build() {
            return new ExecuteConfig(this);
        }
    }
}
