package com.questrail.protowire.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of WireObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jWireObservabilitySink implements WireObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jWireObservabilitySink.class);

    @Override
    public void onError(WireErrorEvent event) {
        var cause = event.cause();
        switch (cause.kind()) {
            case IO, END_OF_STREAM ->
                log.debug("Wire {} of {} stopped: {}", event.operation(), event.typeName(), cause.getMessage());
            default ->
                log.warn("Wire {} of {} failed [{}]: {}", event.operation(), event.typeName(), cause.kind(), cause.getMessage());
        }
    }

    @Override
    public void onTransportEvent(WireTransportEvent event) {
        if (event.kind() == WireTransportEvent.Kind.FAILED) {
            log.error("Wire transport {} failed", event.channel(), event.cause());
        }
        else {
            log.info("Wire transport {}: {}", event.channel(), event.kind());
        }
    }
}
