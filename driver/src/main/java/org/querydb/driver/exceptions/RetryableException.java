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

/**
 * A marker interface for transient failures.
 * <p>
 * The operation that failed with such an error may be attempted again, on a fresh session, when the caller has declared
 * it idempotent. Failures of the session itself, see {@link SessionExpiredException}, are retried regardless.
 *
 * @since 1.0
 */
public interface RetryableException {}
