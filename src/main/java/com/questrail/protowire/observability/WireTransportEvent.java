package com.questrail.protowire.observability;

import java.time.Instant;

/**
 * Record representing a transport lifecycle change.
 *
 * @param timestamp when it happened
 * @param channel   transport identifier, for logs
 * @param kind      what happened
 * @param cause     the failure for {@link Kind#FAILED}, otherwise {@code null}
 */
public record WireTransportEvent(
    Instant timestamp,
    String channel,
    Kind kind,
    Throwable cause
) {
    public enum Kind {
        ATTACHED,
        CLOSED,
        FAILED
    }
}
