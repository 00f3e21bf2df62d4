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
package org.querydb.driver.internal.query;

import io.grpc.Context;
import java.util.concurrent.CompletableFuture;
import org.querydb.driver.TxSettings;

/**
 * State a client execution stamps on the session it holds. Cleared before the session is given back.
 */
final class SessionCallState {
    private volatile Context context = Context.ROOT;
    private volatile TxSettings txSettings;
    private volatile Boolean idempotent;
    private volatile boolean idempotentSetAtCallLevel;
    private volatile CompletableFuture<?> currentOperation;

    Context context() {
        return context;
    }

    void context(Context context) {
        this.context = context;
    }

    TxSettings txSettings() {
        return txSettings;
    }

    void txSettings(TxSettings txSettings) {
        this.txSettings = txSettings;
    }

    Boolean idempotent() {
        return idempotent;
    }

    boolean idempotentSetAtCallLevel() {
        return idempotentSetAtCallLevel;
    }

    void callLevelIdempotent(boolean idempotent) {
        this.idempotent = idempotent;
        this.idempotentSetAtCallLevel = true;
    }

    /**
     * Fold the idempotency of a query into the verdict of the call, unless the call declared it.
     * One non-idempotent query makes the whole call non-idempotent.
     *
     * @param queryIdempotent the idempotency of the query, {@code null} when unknown
     */
    void queryIdempotent(Boolean queryIdempotent) {
        if (idempotentSetAtCallLevel || queryIdempotent == null) {
            return;
        }
        if (queryIdempotent) {
            if (idempotent == null) {
                idempotent = true;
            }
        } else {
            idempotent = false;
        }
    }

    CompletableFuture<?> currentOperation() {
        return currentOperation;
    }

    void currentOperation(CompletableFuture<?> currentOperation) {
        this.currentOperation = currentOperation;
    }

    void clear() {
        context = Context.ROOT;
        txSettings = null;
        idempotent = null;
        idempotentSetAtCallLevel = false;
        currentOperation = null;
    }
}
