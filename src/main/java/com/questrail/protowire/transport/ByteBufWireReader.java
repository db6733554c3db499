package com.questrail.protowire.transport;

import com.questrail.protowire.api.WireDecodeException;
import com.questrail.protowire.budget.FallibleAllocation;
import com.questrail.protowire.internal.async.Futures;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;

/**
 * ByteBufWireReader
 * -----------------------------------------------------------------------------
 * In-memory {@link WireReader} over the readable bytes of a Netty {@link ByteBuf}.
 *
 * <p>All reads complete synchronously. Because the whole input is present, the
 * reader reports its exact remaining size, which lets the decode budget reject
 * any Length Field that could not possibly be satisfied.</p>
 *
 * <p>The buffer's reader index advances as bytes are consumed. The reader does
 * not take ownership of the buffer and never releases it.</p>
 */
public final class ByteBufWireReader implements WireReader
{
    private final ByteBuf buffer;

    public ByteBufWireReader(ByteBuf buffer)
    {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
    }

    public static ByteBufWireReader of(byte[] bytes)
    {
        return new ByteBufWireReader(Unpooled.wrappedBuffer(bytes));
    }

    @Override
    public CompletableFuture<byte[]> readExact(int length)
    {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative: " + length);
        }
        final int available = buffer.readableBytes();
        if (available < length) {
            return Futures.failed(WireDecodeException.endOfStream(length, available));
        }
        byte[] out = FallibleAllocation.bytes(length, "read buffer");
        buffer.readBytes(out);
        return CompletableFuture.completedFuture(out);
    }

    @Override
    public OptionalLong remainingHint()
    {
        return OptionalLong.of(buffer.readableBytes());
    }
}
