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

import io.grpc.Context;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.querydb.driver.exceptions.BadSessionException;
import org.querydb.driver.exceptions.ClientException;
import org.querydb.driver.exceptions.DatabaseException;
import org.querydb.driver.exceptions.QueryDbException;
import org.querydb.driver.exceptions.ServiceUnavailableException;
import org.querydb.driver.exceptions.SessionBusyException;
import org.querydb.driver.exceptions.SessionExpiredException;
import org.querydb.driver.exceptions.StatusCode;
import org.querydb.driver.exceptions.TransientException;

public final class ErrorUtil {
    private ErrorUtil() {}

    /**
     * Maps a non-successful status reported by the server to the matching exception type.
     *
     * @param code the status code, must not be {@link StatusCode#SUCCESS}
     * @param message the message reported by the server
     * @return the exception describing the status
     */
    public static QueryDbException newQueryDbError(StatusCode code, String message) {
        return switch (code) {
            case SUCCESS -> throw new IllegalArgumentException("Successful status is not an error");
            case BAD_SESSION -> new BadSessionException(message);
            case SESSION_BUSY -> new SessionBusyException(message);
            case SESSION_EXPIRED -> new SessionExpiredException(code, message);
            case ABORTED, OVERLOADED -> new TransientException(code, message);
            case UNAVAILABLE -> new ServiceUnavailableException(message);
            case CLIENT_ERROR -> new ClientException(message);
            default -> new DatabaseException(code, message);
        };
    }

    /**
     * @param error a failure reported for a session
     * @return {@code true} when the session must not serve further requests
     */
    public static boolean isSessionBroken(Throwable error) {
        return error instanceof SessionExpiredException;
    }

    /**
     * Describe why an execution context was cancelled.
     *
     * @param context a cancelled context
     * @return the error to fail the execution with
     */
    public static ClientException newCancellationError(Context context) {
        var cause = context.cancellationCause();
        if (cause instanceof TimeoutException) {
            return new ClientException("Execution deadline exceeded", cause);
        }
        return new ClientException("Execution was cancelled", cause);
    }

    public static ClientException newClientClosedError() {
        return new ClientException("Query client is closed and can't be used anymore");
    }

    public static void addSuppressed(Throwable mainError, Throwable error) {
        if (mainError != error) {
            mainError.addSuppressed(error);
        }
    }

    public static void rethrowAsyncException(ExecutionException e) {
        var error = e.getCause();

        var internalCause = new InternalExceptionCause(error.getStackTrace());
        error.addSuppressed(internalCause);

        var currentStackTrace = Thread.currentThread().getStackTrace();
        error.setStackTrace(currentStackTrace);

        RuntimeException exception;
        if (error instanceof RuntimeException) {
            exception = (RuntimeException) error;
        } else {
            exception = new QueryDbException(StatusCode.CLIENT_ERROR, "Unable to execute query", error);
        }
        throw exception;
    }

    /**
     * Exception which is merely a holder of an async stacktrace, which is not the primary stacktrace users are interested in.
     * Used for blocking API calls that block on async API calls.
     */
    private static class InternalExceptionCause extends RuntimeException {
        private static final long serialVersionUID = -1988733529334222027L;

        InternalExceptionCause(StackTraceElement[] stackTrace) {
            setStackTrace(stackTrace);
        }

        @Override
        public synchronized Throwable fillInStackTrace() {
            // no need to fill in the stack trace
            // this exception just uses the given stack trace
            return this;
        }
    }
}
