package com.d2stacks.core.result;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a fallible operation: exactly one of {@link Success} or {@link Failure}.
 *
 * <p>Every control-plane operation returns a Result instead of throwing, so
 * network failures, rejected requests and logical failures (such as an
 * unknown endpoint name) reach the caller through the same channel:
 * <pre>{@code
 * api.getStacks().fold(
 *         error -> ConsoleOutput.error(error),
 *         stacks -> stacks.forEach(this::print));
 * }</pre>
 *
 * @param <T> success value type
 * @param <E> error type
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Collapses both variants into a single value.
     */
    <R> R fold(Function<? super E, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    default <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        return fold(Result::failure, value -> Result.success(mapper.apply(value)));
    }

    /**
     * Chains a dependent fallible operation; a failure short-circuits and the mapper is never called.
     */
    default <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> mapper) {
        return fold(Result::failure, mapper);
    }

    default <F> Result<T, F> mapFailure(Function<? super E, ? extends F> mapper) {
        return fold(error -> Result.failure(mapper.apply(error)), Result::success);
    }

    default Optional<T> successValue() {
        return fold(error -> Optional.empty(), Optional::of);
    }

    default Optional<E> failureError() {
        return fold(Optional::of, value -> Optional.empty());
    }

    default T orElseThrow() {
        return fold(error -> {
            throw new IllegalStateException("Result is a failure: " + error);
        }, Function.identity());
    }

    record Success<T, E>(T value) implements Result<T, E> {

        public Success {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> R fold(Function<? super E, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }
    }

    record Failure<T, E>(E error) implements Result<T, E> {

        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <R> R fold(Function<? super E, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(error);
        }
    }
}
