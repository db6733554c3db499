package com.questrail.protowire.api;

import java.util.Objects;
import java.util.function.Function;

/**
 * Success-or-failure value with a wire representation: one discriminant byte
 * ({@code 0} = {@link Ok}, {@code 1} = {@link Err}) followed by the payload.
 *
 * @param <T> success type
 * @param <E> failure type
 */
public sealed interface WireResult<T, E> permits WireResult.Ok, WireResult.Err
{
    static <T, E> WireResult<T, E> ok(T value)
    {
        return new Ok<>(value);
    }

    static <T, E> WireResult<T, E> err(E error)
    {
        return new Err<>(error);
    }

    default boolean isOk()
    {
        return this instanceof Ok;
    }

    default <R> R fold(Function<? super T, ? extends R> onOk, Function<? super E, ? extends R> onErr)
    {
        if (this instanceof Ok<T, E> ok) {
            return onOk.apply(ok.value());
        }
        return onErr.apply(((Err<T, E>) this).error());
    }

    record Ok<T, E>(T value) implements WireResult<T, E>
    {
        public Ok {
            Objects.requireNonNull(value, "value");
        }
    }

    record Err<T, E>(E error) implements WireResult<T, E>
    {
        public Err {
            Objects.requireNonNull(error, "error");
        }
    }
}
