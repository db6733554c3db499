package com.questrail.protowire.codec;

import com.questrail.protowire.api.WireCodec;

/**
 * A codec whose encoding starts with a Length Field: text, byte strings and
 * dynamic containers.
 *
 * <p>By default the Length Field is an unsigned 64-bit integer. A codec
 * derived with {@link #withMaxLength(long)} uses the narrowest unsigned width
 * that can hold {@code max} (one, two, four or eight bytes), refuses to encode
 * longer values and fails decoding of a larger Length Field with
 * {@code OVERSIZED_REQUEST} before reading any element.</p>
 */
public interface LengthPrefixedCodec<T> extends WireCodec<T>
{
    /**
     * @param max largest permitted length, {@code >= 0}
     * @return a codec for the same type with a bounded Length Field
     */
    LengthPrefixedCodec<T> withMaxLength(long max);
}
