package com.questrail.protowire.fixtures;

import com.questrail.protowire.codegen.WireType;

/** Generic union; the arms name their type parameters differently. */
@WireType
public sealed interface Either<L, R> permits Either.Left, Either.Right
{
    record Left<X, Y>(X value) implements Either<X, Y> {}

    record Right<P, Q>(Q value) implements Either<P, Q> {}
}
