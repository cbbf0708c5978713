package com.questrail.kducer.session.observability;

import java.time.Instant;

/**
 * Record representing a failed command or result poll.
 *
 * @param operation command kind name, or {@code RESULT_POLL}
 */
public record KducerCommandFailureEvent(
    Instant timestamp,
    String endpoint,
    String operation,
    Throwable cause
) {
}
