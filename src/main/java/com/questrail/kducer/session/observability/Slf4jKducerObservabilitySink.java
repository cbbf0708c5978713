package com.questrail.kducer.session.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of KducerObservabilitySink that emits logs via SLF4J.
 *
 * <p>Failed connection attempts are logged at WARN, or at INFO when
 * {@code logFailedConnectionsAsWarning} is false (useful on lines where
 * controllers are often switched off).</p>
 */
public final class Slf4jKducerObservabilitySink implements KducerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jKducerObservabilitySink.class);

    private final boolean logFailedConnectionsAsWarning;

    public Slf4jKducerObservabilitySink() {
        this(true);
    }

    public Slf4jKducerObservabilitySink(boolean logFailedConnectionsAsWarning) {
        this.logFailedConnectionsAsWarning = logFailedConnectionsAsWarning;
    }

    @Override
    public void onPhaseTransition(KducerPhaseTransitionEvent event) {
        log.info("K-Ducer {}: phase {} -> {}", event.endpoint(), event.oldPhase(), event.newPhase());
    }

    @Override
    public void onTransportEvent(KducerTransportEvent event) {
        switch (event.kind()) {
            case CONNECTED -> log.info("K-Ducer {}: connected", event.endpoint());
            case CONNECT_FAILED -> {
                if (logFailedConnectionsAsWarning) {
                    log.warn("K-Ducer {}: TCP connection failed, will retry: {}",
                        event.endpoint(), describe(event.cause()));
                } else {
                    log.info("K-Ducer {}: TCP connection failed, will retry: {}",
                        event.endpoint(), describe(event.cause()));
                }
            }
            case CONNECTION_LOST -> log.warn("K-Ducer {}: connection lost, reconnecting",
                event.endpoint(), event.cause());
        }
    }

    @Override
    public void onCommandFailure(KducerCommandFailureEvent event) {
        log.warn("K-Ducer {}: {} failed and will not be retried: {}",
            event.endpoint(), event.operation(), describe(event.cause()));
    }

    @Override
    public void onResultBacklog(KducerResultBacklogEvent event) {
        log.warn("K-Ducer {}: {} tightening results accumulated in the result queue. Are results being fetched?",
            event.endpoint(), event.queuedResults());
    }

    @Override
    public void onError(KducerErrorEvent event) {
        log.error("K-Ducer {}: {}", event.endpoint(), event.message(), event.cause());
    }

    private static String describe(Throwable cause) {
        return cause == null ? "unknown cause" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
