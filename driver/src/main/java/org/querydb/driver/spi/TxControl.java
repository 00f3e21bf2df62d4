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

import org.querydb.driver.TxSettings;

/**
 * Transaction control attached to a query request.
 *
 * @param transactionId id of the open transaction to continue, {@code null} to begin one or to run outside of one
 * @param beginSettings settings of the transaction to begin with this request, {@code null} when not beginning
 * @param commit whether the transaction is committed together with the request
 * @since 1.0
 */
public record TxControl(String transactionId, TxSettings beginSettings, boolean commit) {
    private static final TxControl NONE = new TxControl(null, null, false);

    public TxControl {
        if (transactionId != null && beginSettings != null) {
            throw new IllegalArgumentException("Can't both continue and begin a transaction");
        }
    }

    public static TxControl none() {
        return NONE;
    }

    public static TxControl begin(TxSettings settings) {
        return new TxControl(null, settings, false);
    }

    public static TxControl continueTx(String transactionId) {
        return new TxControl(transactionId, null, false);
    }

    public boolean isNone() {
        return transactionId == null && beginSettings == null;
    }
}
