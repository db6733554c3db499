package com.questrail.protowire.observability;

/**
 * Main interface for receiving codec and transport observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface WireObservabilitySink {
    /**
     * Called when a top-level encode or decode fails.
     * @param event the error event
     */
    void onError(WireErrorEvent event);

    /**
     * Called when a transport-level event occurs (e.g., channel attached or closed).
     * @param event the transport event
     */
    void onTransportEvent(WireTransportEvent event);
}
