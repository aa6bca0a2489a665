package org.javai.netguard.retry;

import org.javai.netguard.ClassifiedError;
import org.javai.netguard.ErrorKind;
import org.javai.netguard.FailureCode;
import org.javai.netguard.NetworkFailureException;
import org.javai.netguard.classify.DefaultErrorClassifier;
import org.javai.netguard.classify.ErrorClassifier;
import org.javai.netguard.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Executes asynchronous remote operations under a {@link RetryPolicy}.
 *
 * <p>Every failed attempt is classified by the {@link ErrorClassifier}; retryable failures are
 * retried after an exponential backoff with up to 10% jitter, everything else completes the
 * returned future with a {@link NetworkFailureException} carrying the {@link ClassifiedError}.
 *
 * <p>No retry state is shared between calls. Cancelling the returned future cancels the pending
 * backoff and the in-flight attempt; no attempt starts after cancellation.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryOrchestrator orchestrator = RetryOrchestrator.builder()
 *     .reporter(new Log4jOpReporter())
 *     .build();
 *
 * CompletableFuture<Forecast> forecast = orchestrator.executeWithTimeout(
 *     "Forecast.current",
 *     () -> client.currentForecast(lat, lon),
 *     config.requestTimeoutFor(monitor.current()),
 *     config.policyFor(monitor.current()));
 * }</pre>
 */
public final class RetryOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(RetryOrchestrator.class);

    /**
     * Upper bound of the random jitter, as a fraction of the backoff.
     */
    public static final double JITTER_FRACTION = 0.1;

    private final ErrorClassifier classifier;
    private final OpReporter reporter;
    private final Delayer delayer;
    private final DoubleSupplier jitterSource;
    private final Clock clock;

    private RetryOrchestrator(Builder builder) {
        this.classifier = builder.classifier;
        this.reporter = builder.reporter;
        this.delayer = builder.delayer;
        this.jitterSource = builder.jitterSource;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring a RetryOrchestrator.
     */
    public static final class Builder {
        private ErrorClassifier classifier = new DefaultErrorClassifier();
        private OpReporter reporter = OpReporter.noOp();
        private Delayer delayer = Delayer.system();
        private DoubleSupplier jitterSource = () -> ThreadLocalRandom.current().nextDouble();
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the source of backoff and timeout delays (optional, defaults to {@link Delayer#system()}).
         */
        public Builder delayer(Delayer delayer) {
            this.delayer = Objects.requireNonNull(delayer, "delayer must not be null");
            return this;
        }

        /**
         * Sets the jitter source; must return values in {@code [0, 1)}.
         */
        public Builder jitterSource(DoubleSupplier jitterSource) {
            this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public RetryOrchestrator build() {
            return new RetryOrchestrator(this);
        }
    }

    /**
     * Executes an operation with retry according to the given policy.
     *
     * @param operation The operation name for reporting
     * @param attempt Starts one attempt of the remote operation
     * @param policy The policy for this call
     * @return a future completing with the first successful value, or exceptionally with a
     *         {@link NetworkFailureException} once the failure is terminal
     */
    public <T> CompletableFuture<T> execute(String operation, Supplier<? extends CompletionStage<T>> attempt,
            RetryPolicy policy) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        return new Execution<T>(operation, attempt, policy).start();
    }

    /**
     * Executes an operation with retry and runs {@code fallback} once if it ultimately fails.
     * A failing fallback propagates its own error.
     */
    public <T> CompletableFuture<T> executeWithFallback(String operation, Supplier<? extends CompletionStage<T>> attempt,
            Supplier<? extends CompletionStage<T>> fallback, RetryPolicy policy) {
        Objects.requireNonNull(fallback, "fallback must not be null");
        CompletableFuture<T> primary = execute(operation, attempt, policy);
        CompletableFuture<T> result = new CompletableFuture<>();
        result.whenComplete((value, failure) -> {
            if (result.isCancelled()) {
                primary.cancel(true);
            }
        });
        primary.whenComplete((value, failure) -> {
            if (failure == null) {
                result.complete(value);
                return;
            }
            if (result.isDone()) {
                return;
            }
            LOG.warn("Operation [{}] failed, using fallback: {}", operation, unwrap(failure).getMessage());
            start(fallback).whenComplete((fallbackValue, fallbackFailure) -> {
                if (fallbackFailure == null) {
                    result.complete(fallbackValue);
                } else {
                    result.completeExceptionally(unwrap(fallbackFailure));
                }
            });
        });
        return result;
    }

    /**
     * Executes an operation with retry, racing every attempt against a timer.
     * An attempt that loses the race fails with a retryable {@code TIMEOUT} error and is cancelled.
     */
    public <T> CompletableFuture<T> executeWithTimeout(String operation, Supplier<? extends CompletionStage<T>> attempt,
            Duration timeout, RetryPolicy policy) {
        Objects.requireNonNull(attempt, "attempt must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, was: " + timeout);
        }
        return execute(operation, () -> race(operation, attempt, timeout), policy);
    }

    /**
     * Executes independent operations concurrently, each with its own retry under {@code policy}.
     *
     * <p>The returned future completes with the successful values in input order once every
     * operation has finished. Individual failures are logged and skipped; only if no operation
     * succeeds does the future fail, with the error of the first failed operation. An empty
     * list yields an empty result. Cancelling the returned future cancels every operation.
     */
    public <T> CompletableFuture<List<T>> executeAll(String operation,
            List<? extends Supplier<? extends CompletionStage<T>>> attempts, RetryPolicy policy) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(attempts, "attempts must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        List<CompletableFuture<T>> calls = new ArrayList<>(attempts.size());
        for (int i = 0; i < attempts.size(); i++) {
            calls.add(execute(operation + "[" + i + "]", attempts.get(i), policy));
        }
        CompletableFuture<List<T>> result = new CompletableFuture<>();
        result.whenComplete((value, failure) -> {
            if (result.isCancelled()) {
                calls.forEach(call -> call.cancel(true));
            }
        });
        CompletableFuture.allOf(calls.toArray(new CompletableFuture<?>[0]))
                .whenComplete((ignored, failure) -> collect(operation, calls, result));
        return result;
    }

    private static <T> void collect(String operation, List<CompletableFuture<T>> calls,
            CompletableFuture<List<T>> result) {
        List<T> successes = new ArrayList<>(calls.size());
        Throwable firstFailure = null;
        for (int i = 0; i < calls.size(); i++) {
            CompletableFuture<T> call = calls.get(i);
            if (!call.isCompletedExceptionally()) {
                successes.add(call.join());
                continue;
            }
            Throwable failure = unwrap(call.handle((value, f) -> f).join());
            LOG.warn("Operation [{}] item {} failed: {}", operation, i, failure.getMessage());
            if (firstFailure == null) {
                firstFailure = failure;
            }
        }
        if (successes.isEmpty() && firstFailure != null) {
            result.completeExceptionally(firstFailure);
        } else {
            result.complete(Collections.unmodifiableList(successes));
        }
    }

    /**
     * Adds up to {@link #JITTER_FRACTION} of random delay on top of the backoff.
     */
    Duration withJitter(Duration backoff) {
        long millis = backoff.toMillis();
        long jitter = (long) Math.floor(jitterSource.getAsDouble() * JITTER_FRACTION * millis);
        return Duration.ofMillis(millis + jitter);
    }

    private <T> CompletableFuture<T> race(String operation, Supplier<? extends CompletionStage<T>> attempt,
            Duration timeout) {
        CompletableFuture<T> inFlight = start(attempt);
        CompletableFuture<Void> timer = delayer.delay(timeout);
        CompletableFuture<T> race = new CompletableFuture<>();
        race.whenComplete((value, failure) -> {
            if (race.isCancelled()) {
                inFlight.cancel(true);
                timer.cancel(false);
            }
        });
        inFlight.whenComplete((value, failure) -> {
            timer.cancel(false);
            if (failure == null) {
                race.complete(value);
            } else {
                race.completeExceptionally(failure);
            }
        });
        timer.whenComplete((ignored, timerFailure) -> {
            if (timerFailure == null && race.completeExceptionally(timeoutFailure(operation, timeout))) {
                inFlight.cancel(true);
            }
        });
        return race;
    }

    private NetworkFailureException timeoutFailure(String operation, Duration timeout) {
        String message = "Operation [" + operation + "] timed out after " + timeout.toMillis() + " ms";
        return new NetworkFailureException(new ClassifiedError(
                ErrorKind.TIMEOUT,
                true,
                null,
                message,
                FailureCode.of("operation", "timeout"),
                new TimeoutException(message),
                clock.instant()));
    }

    private static <T> CompletableFuture<T> start(Supplier<? extends CompletionStage<T>> operation) {
        try {
            CompletionStage<T> stage = Objects.requireNonNull(operation.get(), "operation returned null");
            return stage.toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        return failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
    }

    /**
     * State of one {@code execute} call.
     */
    private final class Execution<T> {
        private final String operation;
        private final Supplier<? extends CompletionStage<T>> attempt;
        private final RetryPolicy policy;
        private final CompletableFuture<T> result = new CompletableFuture<>();
        private volatile CompletableFuture<?> pending;

        Execution(String operation, Supplier<? extends CompletionStage<T>> attempt, RetryPolicy policy) {
            this.operation = operation;
            this.attempt = attempt;
            this.policy = policy;
        }

        CompletableFuture<T> start() {
            result.whenComplete((value, failure) -> {
                CompletableFuture<?> current = pending;
                if (result.isCancelled() && current != null) {
                    current.cancel(true);
                }
            });
            if (policy.maxAttempts() == 0) {
                ClassifiedError offline = ClassifiedError.offline(
                        "Policy [" + policy.id() + "] permits no attempts for operation [" + operation + "]");
                reporter.reportRetryExhausted(operation, offline, 0, "policy permits no attempts");
                result.completeExceptionally(new NetworkFailureException(offline));
                return result;
            }
            runAttempt(RetryContext.first(clock));
            return result;
        }

        private void runAttempt(RetryContext context) {
            if (result.isDone()) {
                return;
            }
            CompletableFuture<T> inFlight = RetryOrchestrator.start(attempt);
            pending = inFlight;
            if (result.isDone()) {
                inFlight.cancel(true);
                return;
            }
            inFlight.whenComplete((value, failure) -> {
                if (failure == null) {
                    result.complete(value);
                } else {
                    onFailure(context, failure);
                }
            });
        }

        private void onFailure(RetryContext context, Throwable failure) {
            if (result.isDone()) {
                return;
            }
            ClassifiedError error = classifier.classify(failure);
            reporter.report(operation, error, context.attemptNumber());

            RetryDecision decision = policy.decide(context, error);
            if (decision instanceof RetryDecision.GiveUp giveUp) {
                reporter.reportRetryExhausted(operation, error, context.attemptNumber(), giveUp.reason());
                result.completeExceptionally(new NetworkFailureException(error));
                return;
            }

            Duration delay = withJitter(((RetryDecision.Retry) decision).delay());
            reporter.reportRetryAttempt(operation, error, context.attemptNumber(), delay);
            CompletableFuture<Void> backoff = delayer.delay(delay);
            pending = backoff;
            if (result.isDone()) {
                backoff.cancel(false);
                return;
            }
            backoff.whenComplete((ignored, backoffFailure) -> {
                if (backoffFailure == null) {
                    runAttempt(context.next(clock));
                } else if (!result.isDone()) {
                    LOG.error("Backoff for operation [{}] failed", operation, backoffFailure);
                    result.completeExceptionally(new NetworkFailureException(error));
                }
            });
        }
    }
}
