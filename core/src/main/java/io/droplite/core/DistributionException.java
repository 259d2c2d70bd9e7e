package io.droplite.core;

import java.util.Objects;

/** Raised for every rejected distribution operation; the operation leaves no partial state. */
public class DistributionException extends RuntimeException {
    private final Failure failure;

    public DistributionException(Failure failure, String message) {
        super(message);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public DistributionException(Failure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public Failure failure() {
        return failure;
    }

    public boolean terminal() {
        return failure.terminal();
    }
}
