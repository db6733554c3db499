package com.questrail.protowire.codec.impl;

import com.questrail.protowire.budget.DecodeBudget;
import com.questrail.protowire.codec.LengthPrefixedCodec;
import com.questrail.protowire.internal.async.Futures;
import com.questrail.protowire.transport.WireReader;
import com.questrail.protowire.transport.WireWriter;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Byte string: a Length Field giving the byte count, then the raw bytes.
 */
public final class BytesCodec implements LengthPrefixedCodec<byte[]>
{
    public static final BytesCodec UNBOUNDED = new BytesCodec(LengthPrefix.UNBOUNDED);

    private final LengthPrefix prefix;

    private BytesCodec(LengthPrefix prefix)
    {
        this.prefix = prefix;
    }

    @Override
    public BytesCodec withMaxLength(long max)
    {
        return new BytesCodec(LengthPrefix.forMax(max));
    }

    @Override
    public CompletableFuture<Void> write(byte[] value, WireWriter out)
    {
        return Futures.call(() -> {
            Objects.requireNonNull(value, "bytes");
            return prefix.write(value.length, out, typeName())
                    .thenCompose(v -> out.writeAll(value.clone()));
        });
    }

    @Override
    public CompletableFuture<byte[]> read(WireReader in, DecodeBudget budget)
    {
        return Futures.call(() -> prefix.read(in, typeName())
                .thenCompose(length -> in.readExact(budget.reserve(length, 1, typeName()))));
    }

    @Override
    public int minEncodedSize()
    {
        return prefix.width();
    }

    @Override
    public String typeName()
    {
        return "bytes";
    }
}
