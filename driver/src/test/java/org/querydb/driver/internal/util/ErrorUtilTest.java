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
package org.querydb.driver.internal.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.querydb.driver.internal.util.ErrorUtil.addSuppressed;
import static org.querydb.driver.internal.util.ErrorUtil.isSessionBroken;
import static org.querydb.driver.internal.util.ErrorUtil.newCancellationError;
import static org.querydb.driver.internal.util.ErrorUtil.newQueryDbError;
import static org.querydb.driver.internal.util.ErrorUtil.rethrowAsyncException;

import io.grpc.Context;
import java.io.IOException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;
import org.querydb.driver.exceptions.BadSessionException;
import org.querydb.driver.exceptions.ClientException;
import org.querydb.driver.exceptions.DatabaseException;
import org.querydb.driver.exceptions.QueryDbException;
import org.querydb.driver.exceptions.RetryableException;
import org.querydb.driver.exceptions.ServiceUnavailableException;
import org.querydb.driver.exceptions.SessionBusyException;
import org.querydb.driver.exceptions.SessionExpiredException;
import org.querydb.driver.exceptions.StatusCode;
import org.querydb.driver.exceptions.TransientException;

class ErrorUtilTest {
    @Test
    void shouldMapStatusesToExceptions() {
        assertThat(newQueryDbError(StatusCode.BAD_SESSION, "msg"), instanceOf(BadSessionException.class));
        assertThat(newQueryDbError(StatusCode.SESSION_BUSY, "msg"), instanceOf(SessionBusyException.class));
        assertThat(newQueryDbError(StatusCode.SESSION_EXPIRED, "msg"), instanceOf(SessionExpiredException.class));
        assertThat(newQueryDbError(StatusCode.ABORTED, "msg"), instanceOf(TransientException.class));
        assertThat(newQueryDbError(StatusCode.OVERLOADED, "msg"), instanceOf(TransientException.class));
        assertThat(newQueryDbError(StatusCode.UNAVAILABLE, "msg"), instanceOf(ServiceUnavailableException.class));
        assertThat(newQueryDbError(StatusCode.CLIENT_ERROR, "msg"), instanceOf(ClientException.class));
        assertThat(newQueryDbError(StatusCode.SCHEME_ERROR, "msg"), instanceOf(DatabaseException.class));
    }

    @Test
    void shouldKeepStatusAndMessage() {
        var error = newQueryDbError(StatusCode.PRECONDITION_FAILED, "Duplicate key");

        assertEquals(StatusCode.PRECONDITION_FAILED, error.code());
        assertEquals("Duplicate key", error.getMessage());
    }

    @Test
    void shouldRejectSuccessStatus() {
        assertThrows(IllegalArgumentException.class, () -> newQueryDbError(StatusCode.SUCCESS, "ok"));
    }

    @Test
    void shouldClassifyRetryableErrors() {
        assertInstanceOf(RetryableException.class, newQueryDbError(StatusCode.ABORTED, "msg"));
        assertInstanceOf(RetryableException.class, newQueryDbError(StatusCode.UNAVAILABLE, "msg"));
        assertFalse(newQueryDbError(StatusCode.SCHEME_ERROR, "msg") instanceof RetryableException);
    }

    @Test
    void shouldDetectBrokenSessions() {
        assertTrue(isSessionBroken(new BadSessionException("gone")));
        assertTrue(isSessionBroken(new SessionBusyException("busy")));
        assertTrue(isSessionBroken(new SessionExpiredException(StatusCode.SESSION_EXPIRED, "expired")));
        assertFalse(isSessionBroken(new TransientException(StatusCode.ABORTED, "aborted")));
        assertFalse(isSessionBroken(new IOException()));
    }

    @Test
    void shouldDescribeDeadline() {
        var timeout = new TimeoutException("context timed out");
        var context = Context.ROOT.withCancellation();
        context.cancel(timeout);

        var error = newCancellationError(context);

        assertEquals("Execution deadline exceeded", error.getMessage());
        assertSame(timeout, error.getCause());
    }

    @Test
    void shouldDescribeCancellation() {
        var context = Context.ROOT.withCancellation();
        context.cancel(null);

        assertEquals("Execution was cancelled", newCancellationError(context).getMessage());
    }

    @Test
    void shouldNotSuppressItself() {
        var error = new RuntimeException();
        var other = new RuntimeException();

        addSuppressed(error, error);
        addSuppressed(error, other);

        assertArrayEquals(new Throwable[] {other}, error.getSuppressed());
    }

    @Test
    void shouldRethrowRuntimeCauseOfExecutionException() {
        var cause = new DatabaseException(StatusCode.INTERNAL_ERROR, "Internal");

        var thrown = assertThrows(
                DatabaseException.class, () -> rethrowAsyncException(new ExecutionException(cause)));

        assertSame(cause, thrown);
        assertEquals(1, thrown.getSuppressed().length);
    }

    @Test
    void shouldWrapCheckedCauseOfExecutionException() {
        var cause = new IOException("Connection reset");

        var thrown =
                assertThrows(QueryDbException.class, () -> rethrowAsyncException(new ExecutionException(cause)));

        assertSame(cause, thrown.getCause());
        assertEquals(StatusCode.CLIENT_ERROR, thrown.code());
    }
}
