package com.questrail.protowire.api;

/**
 * Pair of values encoded back to back, with no Length Field.
 */
public record Tuple2<A, B>(A first, B second)
{
    public static <A, B> Tuple2<A, B> of(A first, B second)
    {
        return new Tuple2<>(first, second);
    }
}
