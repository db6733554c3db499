package com.questrail.protowire.transport;

import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;

/**
 * WireReader
 * -----------------------------------------------------------------------------
 * Read half of the Stream Adapter: a sequential, order-preserving byte source
 * with asynchronous suspension.
 *
 * <p>Implementations may be backed by an in-memory buffer, a blocking
 * {@code InputStream} or a Netty channel. Callers must not issue a second
 * {@link #readExact(int)} before the previous one has completed; the format has
 * no self-describing boundaries, so interleaved reads would corrupt framing.</p>
 */
public interface WireReader
{
    /**
     * Read exactly {@code length} bytes.
     *
     * <p>The returned future completes once all bytes are available. It fails with
     * a {@code WireDecodeException} of kind {@code END_OF_STREAM} if the source
     * closes first, or of kind {@code IO} if the transport fails.</p>
     *
     * @param length number of bytes, {@code >= 0}
     * @return the bytes, exactly {@code length} long
     */
    CompletableFuture<byte[]> readExact(int length);

    /**
     * Bytes known to remain in this source, if the source knows.
     *
     * <p>Used to cap the decode budget: a Length Field can never be honoured
     * for more elements than the remaining bytes could encode.</p>
     */
    default OptionalLong remainingHint()
    {
        return OptionalLong.empty();
    }
}
