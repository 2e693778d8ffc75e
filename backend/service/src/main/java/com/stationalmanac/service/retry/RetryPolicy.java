package com.stationalmanac.service.retry;

import java.time.Duration;
import java.util.Objects;

public record RetryPolicy(int maxAttempts, Duration delay) {
    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(4));

    public RetryPolicy {
        Objects.requireNonNull(delay, "delay is required");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }
    }
}
