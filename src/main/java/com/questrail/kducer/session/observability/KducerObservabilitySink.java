package com.questrail.kducer.session.observability;

/**
 * Receives observability events from a device session.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on the session loop thread and must not block.</p>
 */
public interface KducerObservabilitySink {
    /**
     * Called when the session moves between connection phases.
     * @param event the transition
     */
    void onPhaseTransition(KducerPhaseTransitionEvent event);

    /**
     * Called on connect, failed connect, and connection loss.
     * @param event the transport event
     */
    void onTransportEvent(KducerTransportEvent event);

    /**
     * Called when a queued command or a result poll fails without
     * affecting the connection (protocol error, device exception, validation).
     * @param event the failure
     */
    void onCommandFailure(KducerCommandFailureEvent event);

    /**
     * Called when undrained results pile up (10, 100, 1000, ...).
     * @param event the backlog event
     */
    void onResultBacklog(KducerResultBacklogEvent event);

    /**
     * Called when an unexpected error occurs inside the session loop.
     * @param event the error event
     */
    void onError(KducerErrorEvent event);
}
