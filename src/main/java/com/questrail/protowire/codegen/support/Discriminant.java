package com.questrail.protowire.codegen.support;

import com.questrail.protowire.codec.impl.BigEndian;
import com.questrail.protowire.transport.WireReader;

import java.util.concurrent.CompletableFuture;

/**
 * Union discriminant: an unsigned big-endian integer of one, two or four
 * bytes, sized by the largest discriminant of the union.
 *
 * @param width size in bytes
 */
public record Discriminant(int width)
{
    public Discriminant {
        if (width != 1 && width != 2 && width != 4) {
            throw new IllegalArgumentException("unsupported discriminant width: " + width);
        }
    }

    public static Discriminant forMax(long maxDiscriminant)
    {
        if (maxDiscriminant < 0 || maxDiscriminant > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("discriminant out of range: " + maxDiscriminant);
        }
        if (maxDiscriminant <= 0xFFL) {
            return new Discriminant(1);
        }
        if (maxDiscriminant <= 0xFFFFL) {
            return new Discriminant(2);
        }
        return new Discriminant(4);
    }

    public byte[] encode(long discriminant)
    {
        return BigEndian.encode(discriminant, width);
    }

    public CompletableFuture<Long> read(WireReader in)
    {
        return in.readExact(width).thenApply(BigEndian::decodeUnsigned);
    }
}
