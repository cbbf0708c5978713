package com.questrail.kducer.session.observability;

import com.questrail.kducer.api.SessionPhase;

import java.time.Instant;

/**
 * Record representing a session phase change.
 */
public record KducerPhaseTransitionEvent(
    Instant timestamp,
    String endpoint,
    SessionPhase oldPhase,
    SessionPhase newPhase
) {
}
