package com.qqsuccubus.rkafka.core.retry;

import com.qqsuccubus.rkafka.core.error.AdapterException;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a single adapter operation: a value or the error that replaced it.
 * <p>
 * Streams carry failures as items so that one bad record does not terminate them.
 * </p>
 *
 * @param <T> value type
 */
public final class Result<T> {

    private final T value;
    private final AdapterException error;

    private Result(@Nullable T value, @Nullable AdapterException error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> success(@Nullable T value) {
        return new Result<>(value, null);
    }

    public static <T> Result<T> failure(AdapterException error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @return the value
     * @throws AdapterException the recorded error if this is a failure
     */
    public T get() {
        if (error != null) {
            throw error;
        }
        return value;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    @Nullable
    public AdapterException getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success[" + value + "]" : "Failure[" + error + "]";
    }
}
