package com.vibeflows.dataserver.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an operation that can fail for domain reasons.
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(GatewayError error) {
        return new Failure<>(Objects.requireNonNull(error, "error"));
    }

    boolean isSuccess();

    /**
     * @throws IllegalStateException if this is a failure
     */
    T getValue();

    /**
     * @throws IllegalStateException if this is a success
     */
    GatewayError getError();

    default <R> Result<R> map(Function<T, R> mapper) {
        if (isSuccess()) {
            return success(mapper.apply(getValue()));
        }
        return failure(getError());
    }

    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getValue() {
            return value;
        }

        @Override
        public GatewayError getError() {
            throw new IllegalStateException("Result is a success");
        }
    }

    record Failure<T>(GatewayError error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getValue() {
            throw new IllegalStateException("Result is a failure: " + error.code() + " - " + error.message());
        }

        @Override
        public GatewayError getError() {
            return error;
        }
    }
}
