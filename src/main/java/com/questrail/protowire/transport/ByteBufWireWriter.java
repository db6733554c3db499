package com.questrail.protowire.transport;

import com.questrail.protowire.internal.async.Futures;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory {@link WireWriter} that appends to a Netty {@link ByteBuf}.
 * Writes complete synchronously.
 */
public final class ByteBufWireWriter implements WireWriter
{
    private final ByteBuf buffer;

    public ByteBufWireWriter(ByteBuf buffer)
    {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
    }

    public ByteBufWireWriter()
    {
        this(Unpooled.buffer());
    }

    @Override
    public CompletableFuture<Void> writeAll(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        buffer.writeBytes(bytes);
        return Futures.done();
    }

    public ByteBuf buffer()
    {
        return buffer;
    }

    /**
     * @return a copy of the readable bytes written so far
     */
    public byte[] toByteArray()
    {
        return ByteBufUtil.getBytes(buffer);
    }
}
