package com.stationalmanac.service.retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.logging.Logger;

public final class ResilientClient {
    private static final Logger LOGGER = Logger.getLogger(ResilientClient.class.getName());

    private final Sleeper sleeper;
    private final Clock clock;

    public ResilientClient() {
        this(duration -> Thread.sleep(duration.toMillis()), Clock.systemUTC());
    }

    public ResilientClient(Sleeper sleeper, Clock clock) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public <T> RetryOutcome<T> execute(RetryPolicy policy, Supplier<T> operation, Predicate<T> succeeded) {
        return execute(policy, operation, succeeded, null);
    }

    public <T> RetryOutcome<T> execute(
            RetryPolicy policy,
            Supplier<T> operation,
            Predicate<T> succeeded,
            Instant deadline
    ) {
        return execute(policy.maxAttempts(), policy.delay(), operation, succeeded, deadline);
    }

    public <T> RetryOutcome<T> execute(int maxAttempts, Duration delay, Supplier<T> operation, Predicate<T> succeeded) {
        return execute(maxAttempts, delay, operation, succeeded, null);
    }

    /**
     * Same as {@link #execute(int, Duration, Supplier, Predicate)}, but gives up early instead of waiting
     * past {@code deadline}. A {@code null} deadline means no limit.
     */
    public <T> RetryOutcome<T> execute(
            int maxAttempts,
            Duration delay,
            Supplier<T> operation,
            Predicate<T> succeeded,
            Instant deadline
    ) {
        Objects.requireNonNull(delay, "delay is required");
        Objects.requireNonNull(operation, "operation is required");
        Objects.requireNonNull(succeeded, "succeeded is required");
        int attemptsAllowed = Math.max(maxAttempts, 0);

        T last = null;
        for (int attempt = 1; attempt <= attemptsAllowed; attempt++) {
            last = operation.get();
            if (succeeded.test(last)) {
                return new RetryOutcome<>(last, attempt, true);
            }
            if (attempt == attemptsAllowed) {
                break;
            }
            if (deadline != null && clock.instant().plus(delay).isAfter(deadline)) {
                LOGGER.warning("Retry deadline " + deadline + " reached after " + attempt + " attempt(s)");
                return new RetryOutcome<>(last, attempt, false);
            }
            LOGGER.fine("Attempt " + attempt + " of " + attemptsAllowed + " failed; retrying in " + delay);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.warning("Retry interrupted after " + attempt + " attempt(s)");
                return new RetryOutcome<>(last, attempt, false);
            }
        }
        return new RetryOutcome<>(last, attemptsAllowed, false);
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
