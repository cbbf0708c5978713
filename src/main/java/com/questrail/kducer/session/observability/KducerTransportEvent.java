package com.questrail.kducer.session.observability;

import java.time.Instant;

/**
 * Record representing a connection-level event.
 *
 * @param cause failure cause; {@code null} for {@link Kind#CONNECTED}
 */
public record KducerTransportEvent(
    Instant timestamp,
    String endpoint,
    Kind kind,
    Throwable cause
) {
    public enum Kind {
        CONNECTED,
        CONNECT_FAILED,
        CONNECTION_LOST
    }
}
