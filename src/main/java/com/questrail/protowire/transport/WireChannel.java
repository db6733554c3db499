package com.questrail.protowire.transport;

/**
 * A duplex transport that can serve as both source and sink, for example a
 * network connection.
 */
public interface WireChannel extends WireReader, WireWriter, AutoCloseable
{
    /**
     * Close the underlying transport. Pending reads fail with end of stream.
     */
    @Override
    void close();
}
