package com.questrail.kducer.session.observability;

/**
 * No-op implementation of KducerObservabilitySink.
 */
public final class NullKducerObservabilitySink implements KducerObservabilitySink {
    public static final NullKducerObservabilitySink INSTANCE = new NullKducerObservabilitySink();

    private NullKducerObservabilitySink() {}

    @Override
    public void onPhaseTransition(KducerPhaseTransitionEvent event) {}

    @Override
    public void onTransportEvent(KducerTransportEvent event) {}

    @Override
    public void onCommandFailure(KducerCommandFailureEvent event) {}

    @Override
    public void onResultBacklog(KducerResultBacklogEvent event) {}

    @Override
    public void onError(KducerErrorEvent event) {}
}
