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

import java.util.List;

/**
 * Response of a query execution. Result sets are handed over as produced by the transport, decoding them is up to the
 * caller.
 *
 * @param resultSets the result sets, in the order the server produced them
 * @param transactionId id of the transaction the query ran in, {@code null} if none is open afterwards
 * @since 1.0
 */
public record QueryResult(List<Object> resultSets, String transactionId) {
    public QueryResult {
        resultSets = resultSets == null ? List.of() : List.copyOf(resultSets);
    }
}
