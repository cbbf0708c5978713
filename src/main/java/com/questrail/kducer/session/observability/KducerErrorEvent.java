package com.questrail.kducer.session.observability;

import java.time.Instant;

/**
 * Record representing an unexpected error in the session loop.
 */
public record KducerErrorEvent(
    Instant timestamp,
    String endpoint,
    String message,
    Throwable cause
) {
}
