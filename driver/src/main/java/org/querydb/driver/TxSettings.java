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

/**
 * Settings used to begin a transaction.
 * <p>
 * Instances are immutable and reusable. {@link #serializableReadWrite()} is what {@link QueryClient#executeTxAsync}
 * applies when no settings were given.
 *
 * @param mode the isolation mode
 * @since 1.0
 */
public record TxSettings(Mode mode) {
    private static final TxSettings SERIALIZABLE_READ_WRITE = new TxSettings(Mode.SERIALIZABLE_READ_WRITE);

    public TxSettings {
        requireNonNull(mode, "mode");
    }

    /**
     * The default transaction settings.
     *
     * @return serializable read-write settings
     */
    public static TxSettings serializableReadWrite() {
        return SERIALIZABLE_READ_WRITE;
    }

    public static TxSettings snapshotReadOnly() {
        return new TxSettings(Mode.SNAPSHOT_READ_ONLY);
    }

    public static TxSettings staleReadOnly() {
        return new TxSettings(Mode.STALE_READ_ONLY);
    }

    public static TxSettings onlineReadOnly() {
        return new TxSettings(Mode.ONLINE_READ_ONLY);
    }

    public enum Mode {
        SERIALIZABLE_READ_WRITE,
        SNAPSHOT_READ_ONLY,
        STALE_READ_ONLY,
        ONLINE_READ_ONLY
    }
}
