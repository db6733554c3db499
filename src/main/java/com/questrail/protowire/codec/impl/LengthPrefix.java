package com.questrail.protowire.codec.impl;

import com.questrail.protowire.api.WireDecodeException;
import com.questrail.protowire.api.WireEncodeException;
import com.questrail.protowire.api.WireErrorKind;
import com.questrail.protowire.internal.async.Futures;
import com.questrail.protowire.transport.WireReader;
import com.questrail.protowire.transport.WireWriter;

import java.util.concurrent.CompletableFuture;

/**
 * LengthPrefix
 * -----------------------------------------------------------------------------
 * Width and upper bound of a Length Field.
 *
 * <p>{@code max} is an unsigned 64-bit value; {@link #UNBOUNDED} uses
 * {@code -1}, i.e. 2<sup>64</sup>-1.</p>
 *
 * @param width Length Field size in bytes: 1, 2, 4 or 8
 * @param max   largest accepted length, unsigned
 */
public record LengthPrefix(int width, long max)
{
    public static final LengthPrefix UNBOUNDED = new LengthPrefix(8, -1L);

    public LengthPrefix {
        if (width != 1 && width != 2 && width != 4 && width != 8) {
            throw new IllegalArgumentException("unsupported Length Field width: " + width);
        }
    }

    /**
     * Narrowest Length Field that can carry every length up to {@code max}.
     */
    public static LengthPrefix forMax(long max)
    {
        if (max < 0) {
            throw new IllegalArgumentException("max length must be non-negative: " + max);
        }
        if (max <= 0xFFL) {
            return new LengthPrefix(1, max);
        }
        if (max <= 0xFFFFL) {
            return new LengthPrefix(2, max);
        }
        if (max <= 0xFFFF_FFFFL) {
            return new LengthPrefix(4, max);
        }
        return new LengthPrefix(8, max);
    }

    public CompletableFuture<Void> write(long length, WireWriter out, String typeName)
    {
        if (Long.compareUnsigned(length, max) > 0) {
            return Futures.failed(new WireEncodeException(WireErrorKind.OVERSIZED_REQUEST,
                    typeName + " length " + length + " exceeds the maximum of " + Long.toUnsignedString(max)));
        }
        return out.writeAll(BigEndian.encode(length, width));
    }

    /**
     * Reads the Length Field. Lengths beyond {@link Long#MAX_VALUE} come back
     * negative and are refused by the decode budget.
     */
    public CompletableFuture<Long> read(WireReader in, String typeName)
    {
        return in.readExact(width).thenApply(bytes -> {
            long length = BigEndian.decodeUnsigned(bytes);
            if (Long.compareUnsigned(length, max) > 0) {
                throw new WireDecodeException(WireErrorKind.OVERSIZED_REQUEST,
                        typeName + " length " + Long.toUnsignedString(length)
                                + " exceeds the maximum of " + Long.toUnsignedString(max));
            }
            return length;
        });
    }
}
