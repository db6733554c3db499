package com.questrail.protowire.api;

/**
 * Indicates that a value could not be written. In practice this is a sink I/O
 * failure, or a value longer than its declared maximum length.
 */
public final class WireEncodeException extends WireException
{
    public WireEncodeException(WireErrorKind kind, String message)
    {
        super(kind, message, null);
    }

    public WireEncodeException(WireErrorKind kind, String message, Throwable cause)
    {
        super(kind, message, cause);
    }
}
