package com.questrail.protowire.transport;

import com.questrail.protowire.internal.async.Futures;

import java.util.concurrent.CompletableFuture;

/**
 * WireWriter
 * -----------------------------------------------------------------------------
 * Write half of the Stream Adapter: a sequential byte sink with asynchronous
 * suspension.
 */
public interface WireWriter
{
    /**
     * Append all of {@code bytes} to the sink.
     *
     * <p>The returned future completes once the sink has accepted every byte,
     * or fails with a {@code WireEncodeException} of kind {@code IO}. The caller
     * must not modify {@code bytes} before then.</p>
     */
    CompletableFuture<Void> writeAll(byte[] bytes);

    /**
     * Push buffered bytes towards the transport. Writers without buffering
     * complete immediately.
     */
    default CompletableFuture<Void> flush()
    {
        return Futures.done();
    }
}
