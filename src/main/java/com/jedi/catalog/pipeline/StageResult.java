package com.jedi.catalog.pipeline;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Outcome of one stage for one channel or pair: computed, deliberately skipped, or failed.
 */
public final class StageResult<T> {

    private enum Status {
        COMPUTED, SKIPPED, FAILED
    }

    private final Status status;
    private final T value;
    private final String reason;
    private final Throwable error;

    private StageResult(Status status, T value, String reason, Throwable error) {
        this.status = status;
        this.value = value;
        this.reason = reason;
        this.error = error;
    }

    public static <T> StageResult<T> computed(T value) {
        return new StageResult<>(Status.COMPUTED, Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> StageResult<T> skipped(String reason) {
        return new StageResult<>(Status.SKIPPED, null, reason, null);
    }

    public static <T> StageResult<T> failed(Throwable error) {
        Objects.requireNonNull(error, "error");
        return new StageResult<>(Status.FAILED, null, error.getMessage(), error);
    }

    public boolean isComputed() {
        return status == Status.COMPUTED;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public T getValue() {
        if (status != Status.COMPUTED) {
            throw new NoSuchElementException("No value for " + status + " result: " + reason);
        }
        return value;
    }

    public String getReason() {
        return reason;
    }

    public Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        return switch (status) {
            case COMPUTED -> "COMPUTED[" + value + "]";
            case SKIPPED -> "SKIPPED[" + reason + "]";
            case FAILED -> "FAILED[" + reason + "]";
        };
    }
}
