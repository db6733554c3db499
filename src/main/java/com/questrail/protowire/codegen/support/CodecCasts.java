package com.questrail.protowire.codegen.support;

import com.questrail.protowire.api.WireCodec;

/**
 * Unchecked view of a codec as a codec for a compatible declared type, such
 * as a {@code SortedSet} codec used for a {@code NavigableSet} component. The
 * generator only emits it where the runtime values agree.
 */
public final class CodecCasts
{
    private CodecCasts() {}

    @SuppressWarnings("unchecked")
    public static <T> WireCodec<T> adapt(WireCodec<?> codec)
    {
        return (WireCodec<T>) codec;
    }
}
