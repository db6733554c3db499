package com.questrail.protowire.observability;

/**
 * No-op implementation of WireObservabilitySink.
 */
public final class NullObservabilitySink implements WireObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onError(WireErrorEvent event) {}

    @Override
    public void onTransportEvent(WireTransportEvent event) {}
}
