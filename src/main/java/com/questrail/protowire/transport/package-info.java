/**
 * Stream Adapter
 * =============================================================================
 *
 * <p>These interfaces are the boundary between the codecs and whatever moves
 * the bytes: an in-memory buffer, a blocking stream, or a Netty channel.</p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@code readExact(n)} completes with exactly {@code n} bytes, or fails with
 *       end of stream if the source closes first, or with an I/O error.</li>
 *   <li>{@code writeAll(bytes)} completes once every byte is accepted, or fails
 *       with an I/O error.</li>
 *   <li>Adapters buffer nothing across calls beyond what one in-flight read or
 *       write needs, and never hold on to decoded values.</li>
 * </ul>
 *
 * <h2>Caller obligations</h2>
 * <p>One stream is driven by one encode or decode at a time. This is not
 * enforced for every adapter; {@code NettyWireChannel} rejects a second
 * pending read.</p>
 *
 * <p>Cancelling a pending read is memory-safe, but the stream is then at an
 * unknown offset and must not be used for further decoding. Timeouts are
 * layered on the returned futures by the caller
 * ({@code CompletableFuture.orTimeout}).</p>
 *
 * <p>Framing above the byte level (one value per message frame) is not this
 * package's job.</p>
 */
package com.questrail.protowire.transport;
