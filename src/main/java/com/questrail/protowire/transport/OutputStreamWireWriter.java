package com.questrail.protowire.transport;

import com.questrail.protowire.api.WireEncodeException;
import com.questrail.protowire.api.WireErrorKind;
import com.questrail.protowire.internal.async.Futures;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Blocking {@link WireWriter} over an {@link OutputStream}. Each write blocks
 * until the stream accepts the bytes.
 */
public final class OutputStreamWireWriter implements WireWriter
{
    private final OutputStream out;

    public OutputStreamWireWriter(OutputStream out)
    {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public CompletableFuture<Void> writeAll(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        try {
            out.write(bytes);
            return Futures.done();
        }
        catch (IOException e) {
            return Futures.failed(ioFailure(e));
        }
    }

    @Override
    public CompletableFuture<Void> flush()
    {
        try {
            out.flush();
            return Futures.done();
        }
        catch (IOException e) {
            return Futures.failed(ioFailure(e));
        }
    }

    private static WireEncodeException ioFailure(IOException e)
    {
        return new WireEncodeException(WireErrorKind.IO, "I/O error while writing: " + e.getMessage(), e);
    }
}
