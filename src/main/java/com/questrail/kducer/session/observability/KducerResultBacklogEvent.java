package com.questrail.kducer.session.observability;

import java.time.Instant;

/**
 * Record representing a growing result queue.
 */
public record KducerResultBacklogEvent(
    Instant timestamp,
    String endpoint,
    int queuedResults
) {
}
