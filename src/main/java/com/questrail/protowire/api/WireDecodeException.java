package com.questrail.protowire.api;

import java.util.OptionalLong;

/**
 * Indicates that bytes read from a stream could not be turned into a value of
 * the expected type.
 *
 * This typically reflects:
 * <ul>
 *   <li>A stream that ended or failed mid-value</li>
 *   <li>Bytes that violate the wire format (bad boolean, bad UTF-8, unknown discriminant)</li>
 *   <li>A Length Field rejected by the allocation-safety checks</li>
 * </ul>
 *
 * A decode failure aborts the whole decode call tree. There is never a
 * partially decoded value.
 */
public final class WireDecodeException extends WireException
{
    private final long variant;
    private final boolean hasVariant;

    public WireDecodeException(WireErrorKind kind, String message)
    {
        this(kind, message, null);
    }

    public WireDecodeException(WireErrorKind kind, String message, Throwable cause)
    {
        super(kind, message, cause);
        this.variant = 0;
        this.hasVariant = false;
    }

    private WireDecodeException(long variant, String typeName)
    {
        super(WireErrorKind.UNKNOWN_VARIANT, "unknown " + typeName + " variant: " + variant, null);
        this.variant = variant;
        this.hasVariant = true;
    }

    public static WireDecodeException unknownVariant(long variant, String typeName)
    {
        return new WireDecodeException(variant, typeName);
    }

    public static WireDecodeException endOfStream(int expected, int received)
    {
        return new WireDecodeException(WireErrorKind.END_OF_STREAM,
                "reached end of stream after " + received + " of " + expected + " bytes");
    }

    /**
     * @return the unrecognised discriminant for {@link WireErrorKind#UNKNOWN_VARIANT} failures
     */
    public OptionalLong variant()
    {
        return hasVariant ? OptionalLong.of(variant) : OptionalLong.empty();
    }
}
