package com.assetdesk.backend.global.result;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an inventory operation: either a value or a business error.
 * Business-rule violations travel as {@link Err}; infrastructure failures are still thrown.
 *
 * @param <T> success value type, {@link Void} for operations without a payload
 * @param <E> error type
 */
public sealed interface Result<T, E> permits Result.Ok, Result.Err {

    static <T, E> Result<T, E> ok(T value) {
        return new Ok<>(value);
    }

    static <E> Result<Void, E> success() {
        return new Ok<>(null);
    }

    static <T, E> Result<T, E> err(E error) {
        return new Err<>(Objects.requireNonNull(error, "error"));
    }

    boolean isOk();

    default boolean isErr() {
        return !isOk();
    }

    /**
     * @throws IllegalStateException when this is an {@link Err}
     */
    T get();

    /**
     * @throws IllegalStateException when this is an {@link Ok}
     */
    E getError();

    <U> Result<U, E> map(Function<? super T, ? extends U> mapper);

    <X extends RuntimeException> T orElseThrow(Function<? super E, X> exceptionFactory);

    record Ok<T, E>(T value) implements Result<T, E> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public T get() {
            return value;
        }

        @Override
        public E getError() {
            throw new IllegalStateException("Result is successful");
        }

        @Override
        public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <X extends RuntimeException> T orElseThrow(Function<? super E, X> exceptionFactory) {
            return value;
        }
    }

    record Err<T, E>(E error) implements Result<T, E> {

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T get() {
            throw new IllegalStateException("Result failed with " + error);
        }

        @Override
        public E getError() {
            return error;
        }

        @Override
        public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
            return new Err<>(error);
        }

        @Override
        public <X extends RuntimeException> T orElseThrow(Function<? super E, X> exceptionFactory) {
            throw exceptionFactory.apply(error);
        }
    }
}
