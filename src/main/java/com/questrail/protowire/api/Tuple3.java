package com.questrail.protowire.api;

/**
 * Triple of values encoded back to back, with no Length Field.
 */
public record Tuple3<A, B, C>(A first, B second, C third)
{
    public static <A, B, C> Tuple3<A, B, C> of(A first, B second, C third)
    {
        return new Tuple3<>(first, second, third);
    }
}
