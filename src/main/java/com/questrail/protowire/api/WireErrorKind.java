package com.questrail.protowire.api;

/**
 * WireErrorKind
 * -----------------------------------------------------------------------------
 * Classification of everything that can go wrong while reading or writing a
 * value.
 *
 * <p>Decode failures always map to exactly one of these kinds. No malformed or
 * adversarial input is allowed to surface as anything else (an unchecked
 * {@code IndexOutOfBoundsException}, an {@code OutOfMemoryError}, a partially
 * assembled value).</p>
 */
public enum WireErrorKind
{
    /** The transport failed while reading or writing. */
    IO,

    /** The stream closed before the expected bytes arrived. */
    END_OF_STREAM,

    /** A text payload was not valid UTF-8. */
    INVALID_TEXT,

    /** A discriminant selected no declared variant. Carries the offending value. */
    UNKNOWN_VARIANT,

    /** A boolean byte other than {@code 0} or {@code 1}. */
    INVALID_BOOLEAN,

    /**
     * A Length Field would require more capacity than the remaining decode
     * budget allows, or a value exceeds the declared maximum length on encode.
     */
    OVERSIZED_REQUEST,

    /** Nested composite decoding went deeper than the configured maximum. */
    NESTING_TOO_DEEP,

    /** Attempted to read a value of a type that has no values (an enum with no constants). */
    EMPTY_TYPE,

    /** Escape hatch for hand-written codecs. */
    CUSTOM
}
