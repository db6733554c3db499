package com.questrail.protowire.transport;

import com.questrail.protowire.api.WireDecodeException;
import com.questrail.protowire.api.WireErrorKind;
import com.questrail.protowire.internal.async.Futures;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * InputStreamWireReader
 * -----------------------------------------------------------------------------
 * Blocking {@link WireReader}: each read blocks the calling thread until the
 * stream delivers the bytes, then returns an already completed future.
 *
 * <p>This is the non-suspending specialization. It shares the wire format and
 * the error taxonomy with the asynchronous readers.</p>
 *
 * <p>Reads go through {@link InputStream#readNBytes(int)}, which grows its
 * buffer as data actually arrives. A large Length Field followed by a short
 * stream therefore costs memory proportional to the bytes received, not to the
 * claimed length.</p>
 */
public final class InputStreamWireReader implements WireReader
{
    private final InputStream in;

    public InputStreamWireReader(InputStream in)
    {
        this.in = Objects.requireNonNull(in, "in");
    }

    @Override
    public CompletableFuture<byte[]> readExact(int length)
    {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative: " + length);
        }
        try {
            byte[] bytes = in.readNBytes(length);
            if (bytes.length < length) {
                return Futures.failed(WireDecodeException.endOfStream(length, bytes.length));
            }
            return CompletableFuture.completedFuture(bytes);
        }
        catch (IOException e) {
            return Futures.failed(new WireDecodeException(WireErrorKind.IO,
                    "I/O error while reading: " + e.getMessage(), e));
        }
    }
}
