package com.questrail.protowire.observability;

import com.questrail.protowire.api.WireException;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a failed top-level encode or decode.
 *
 * @param timestamp when the failure was observed
 * @param operation {@code "decode"} or {@code "encode"}
 * @param typeName  the top-level type being processed
 * @param cause     the failure, carrying kind and field path
 */
public record WireErrorEvent(
    Instant timestamp,
    String operation,
    String typeName,
    WireException cause
) {
    public WireErrorEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(cause, "cause");
    }
}
