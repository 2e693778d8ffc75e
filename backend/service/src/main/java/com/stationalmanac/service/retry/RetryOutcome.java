package com.stationalmanac.service.retry;

import java.util.Optional;

public record RetryOutcome<T>(T response, int attempts, boolean succeeded) {
    public Optional<T> lastResponse() {
        return Optional.ofNullable(response);
    }
}
