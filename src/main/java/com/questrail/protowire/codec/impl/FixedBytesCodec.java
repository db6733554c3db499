package com.questrail.protowire.codec.impl;

import com.questrail.protowire.api.WireCodec;
import com.questrail.protowire.budget.DecodeBudget;
import com.questrail.protowire.internal.async.Futures;
import com.questrail.protowire.transport.WireReader;
import com.questrail.protowire.transport.WireWriter;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Byte array of a statically known length, written without a Length Field.
 */
public final class FixedBytesCodec implements WireCodec<byte[]>
{
    private final int length;

    public FixedBytesCodec(int length)
    {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative: " + length);
        }
        this.length = length;
    }

    @Override
    public CompletableFuture<Void> write(byte[] value, WireWriter out)
    {
        return Futures.call(() -> {
            Objects.requireNonNull(value, "bytes");
            if (value.length != length) {
                throw new IllegalArgumentException(typeName() + " cannot hold " + value.length + " bytes");
            }
            return out.writeAll(value.clone());
        });
    }

    @Override
    public CompletableFuture<byte[]> read(WireReader in, DecodeBudget budget)
    {
        return Futures.call(() -> in.readExact(length));
    }

    @Override
    public int minEncodedSize()
    {
        return length;
    }

    @Override
    public String typeName()
    {
        return "bytes[" + length + "]";
    }
}
