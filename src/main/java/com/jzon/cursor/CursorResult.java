package com.jzon.cursor;

import com.jzon.exceptions.JsonCursorException;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * The outcome of {@link JsonTraversal#get} or {@link JsonTraversal#delete}:
 * either a value or a {@link CursorError}. Navigation never throws.
 */
public sealed interface CursorResult<T> {
    record Success<T>(T value) implements CursorResult<T> {
        public Success {
            Objects.requireNonNull(value, "value");
        }
    }

    record Failure<T>(CursorError error) implements CursorResult<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }

    static <T> CursorResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> CursorResult<T> failure(CursorError error) {
        return new Failure<>(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * @throws NoSuchElementException if this is a failure
     */
    default T value() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw new NoSuchElementException("No value: " + error().message());
    }

    /**
     * @throws NoSuchElementException if this is a success
     */
    default CursorError error() {
        if (this instanceof Failure<T> failure) {
            return failure.error();
        }
        throw new NoSuchElementException("Not a failure");
    }

    default <U> CursorResult<U> map(Function<? super T, ? extends U> f) {
        if (this instanceof Success<T> success) {
            return success(f.apply(success.value()));
        }
        return failure(error());
    }

    default <U> CursorResult<U> flatMap(Function<? super T, CursorResult<U>> f) {
        if (this instanceof Success<T> success) {
            return f.apply(success.value());
        }
        return failure(error());
    }

    default T orElse(T other) {
        return isSuccess() ? value() : other;
    }

    default T orElseThrow() {
        if (this instanceof Failure<T> failure) {
            throw new JsonCursorException(failure.error());
        }
        return value();
    }
}
