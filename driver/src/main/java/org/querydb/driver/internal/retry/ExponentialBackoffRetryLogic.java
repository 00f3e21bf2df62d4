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
package org.querydb.driver.internal.retry;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.querydb.driver.internal.util.ErrorUtil.newCancellationError;

import io.grpc.Context;
import io.netty.util.concurrent.EventExecutorGroup;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import org.querydb.driver.Logger;
import org.querydb.driver.Logging;
import org.querydb.driver.exceptions.RetryableException;
import org.querydb.driver.exceptions.SessionExpiredException;
import org.querydb.driver.internal.util.Futures;

public class ExponentialBackoffRetryLogic implements RetryLogic {
    public static final int DEFAULT_MAX_RETRIES = 10;
    public static final long DEFAULT_MAX_RETRY_TIME_MS = SECONDS.toMillis(30);

    private static final long INITIAL_RETRY_DELAY_MS = SECONDS.toMillis(1);
    private static final double RETRY_DELAY_MULTIPLIER = 2.0;
    private static final double RETRY_DELAY_JITTER_FACTOR = 0.2;
    private static final long MAX_RETRY_DELAY = Long.MAX_VALUE / 2;

    private final int maxRetries;
    private final long maxRetryTimeMs;
    private final long initialRetryDelayMs;
    private final double multiplier;
    private final double jitterFactor;
    private final EventExecutorGroup eventExecutorGroup;
    private final Clock clock;
    private final Logger log;

    public ExponentialBackoffRetryLogic(
            int maxRetries, long maxRetryTimeMs, EventExecutorGroup eventExecutorGroup, Clock clock, Logging logging) {
        this(
                maxRetries,
                maxRetryTimeMs,
                INITIAL_RETRY_DELAY_MS,
                RETRY_DELAY_MULTIPLIER,
                RETRY_DELAY_JITTER_FACTOR,
                eventExecutorGroup,
                clock,
                logging);
    }

    ExponentialBackoffRetryLogic(
            int maxRetries,
            long maxRetryTimeMs,
            long initialRetryDelayMs,
            double multiplier,
            double jitterFactor,
            EventExecutorGroup eventExecutorGroup,
            Clock clock,
            Logging logging) {
        this.maxRetries = maxRetries;
        this.maxRetryTimeMs = maxRetryTimeMs;
        this.initialRetryDelayMs = initialRetryDelayMs;
        this.multiplier = multiplier;
        this.jitterFactor = jitterFactor;
        this.eventExecutorGroup = eventExecutorGroup;
        this.clock = clock;
        this.log = logging.getLog(getClass());

        verifyAfterConstruction();
    }

    @Override
    public <T> CompletionStage<T> retry(Context context, Attempt<T> attempt) {
        var resultFuture = new CompletableFuture<T>();
        // the first attempt runs on the calling thread, retries run in the event loop
        executeWork(resultFuture, context, attempt, new RetryState(-1, 0, initialRetryDelayMs, null));
        return resultFuture;
    }

    /**
     * Decide whether a failed attempt may be repeated.
     * <p>
     * A broken session says nothing about the operation, it is replayed on a fresh session. Transient failures are
     * replayed only when the attempt is idempotent.
     *
     * @param error the failure of the attempt
     * @param idempotent the idempotency verdict of the attempt
     * @return {@code true} when the attempt should be repeated
     */
    protected boolean canRetryOn(Throwable error, boolean idempotent) {
        if (error instanceof SessionExpiredException) {
            return true;
        }
        return idempotent && error instanceof RetryableException;
    }

    private <T> void executeWork(
            CompletableFuture<T> resultFuture, Context context, Attempt<T> attempt, RetryState state) {
        if (context.isCancelled()) {
            var error = newCancellationError(context);
            addSuppressed(error, state.errors());
            resultFuture.completeExceptionally(error);
            return;
        }

        CompletionStage<AttemptResult<T>> attemptStage;
        try {
            attemptStage = attempt.run(context);
        } catch (Throwable error) {
            // attempt failed in a sync way, it never reached the point of reporting its idempotency
            retryOnError(resultFuture, context, attempt, state, AttemptResult.failure(error, false));
            return;
        }

        attemptStage.whenComplete((result, completionError) -> {
            var error = Futures.completionExceptionCause(completionError);
            if (error != null) {
                retryOnError(resultFuture, context, attempt, state, AttemptResult.failure(error, false));
            } else if (result.isSuccess()) {
                resultFuture.complete(result.value());
            } else {
                retryOnError(resultFuture, context, attempt, state, result);
            }
        });
    }

    private <T> void retryOnError(
            CompletableFuture<T> resultFuture,
            Context context,
            Attempt<T> attempt,
            RetryState state,
            AttemptResult<T> failure) {
        var error = failure.error();
        var retryable = canRetryOn(error, failure.idempotent());
        if (retryable && context.isCancelled()) {
            var cancellation = newCancellationError(context);
            addSuppressed(cancellation, recordError(error, state.errors()));
            resultFuture.completeExceptionally(cancellation);
            return;
        }
        if (retryable && state.retries() < maxRetries) {
            var currentTime = clock.millis();
            var startTime = state.startTime() == -1 ? currentTime : state.startTime();

            var elapsedTime = currentTime - startTime;
            if (elapsedTime < maxRetryTimeMs) {
                var errors = recordError(error, state.errors());
                if (error instanceof SessionExpiredException) {
                    // a fresh session is all that is needed, no reason to back off
                    log.warn("Attempt failed on a broken session and is retried immediately", error);
                    var nextState = new RetryState(startTime, state.retries() + 1, state.nextDelayMs(), errors);
                    eventExecutorGroup.next().execute(() -> executeWork(resultFuture, context, attempt, nextState));
                } else {
                    var delayWithJitterMs = computeDelayWithJitter(state.nextDelayMs());
                    log.warn("Attempt failed and is scheduled to retry in " + delayWithJitterMs + "ms", error);
                    var nextState = new RetryState(
                            startTime, state.retries() + 1, (long) (state.nextDelayMs() * multiplier), errors);
                    eventExecutorGroup
                            .next()
                            .schedule(
                                    () -> executeWork(resultFuture, context, attempt, nextState),
                                    delayWithJitterMs,
                                    TimeUnit.MILLISECONDS);
                }
                return;
            }
        }

        addSuppressed(error, state.errors());
        resultFuture.completeExceptionally(error);
    }

    private long computeDelayWithJitter(long delayMs) {
        if (delayMs > MAX_RETRY_DELAY) {
            delayMs = MAX_RETRY_DELAY;
        }

        var jitter = (long) (delayMs * jitterFactor);
        var min = delayMs - jitter;
        var max = delayMs + jitter;
        return ThreadLocalRandom.current().nextLong(min, max + 1);
    }

    private void verifyAfterConstruction() {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries should be >= 0: " + maxRetries);
        }
        if (maxRetryTimeMs < 0) {
            throw new IllegalArgumentException("Max retry time should be >= 0: " + maxRetryTimeMs);
        }
        if (initialRetryDelayMs < 0) {
            throw new IllegalArgumentException("Initial retry delay should >= 0: " + initialRetryDelayMs);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier should be >= 1.0: " + multiplier);
        }
        if (jitterFactor < 0 || jitterFactor > 1) {
            throw new IllegalArgumentException("Jitter factor should be in [0.0, 1.0]: " + jitterFactor);
        }
        if (clock == null) {
            throw new IllegalArgumentException("Clock should not be null");
        }
    }

    private static List<Throwable> recordError(Throwable error, List<Throwable> errors) {
        var result = errors == null ? new ArrayList<Throwable>() : new ArrayList<>(errors);
        result.add(error);
        return result;
    }

    private static void addSuppressed(Throwable error, List<Throwable> suppressedErrors) {
        if (suppressedErrors != null) {
            for (var suppressedError : suppressedErrors) {
                if (error != suppressedError) {
                    error.addSuppressed(suppressedError);
                }
            }
        }
    }

    private record RetryState(long startTime, int retries, long nextDelayMs, List<Throwable> errors) {}
}
