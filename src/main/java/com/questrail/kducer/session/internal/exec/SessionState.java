package com.questrail.kducer.session.internal.exec;

import java.util.Optional;

/**
 * Device-derived state the session loop keeps across ticks.
 *
 * <p>Written only by the loop thread. {@code firmware} and {@code fetchGraphs}
 * are volatile so callers can read them without queueing a command.</p>
 */
public final class SessionState
{
    private volatile FirmwareVersion firmware;
    private volatile boolean fetchGraphs;
    private boolean motorLockedBySession;

    public SessionState(boolean fetchGraphs) {
        this.fetchGraphs = fetchGraphs;
    }

    public Optional<FirmwareVersion> firmware() {
        return Optional.ofNullable(firmware);
    }

    public void firmware(FirmwareVersion firmware) {
        this.firmware = firmware;
    }

    /**
     * Address map for the cached firmware; the legacy tier until a version is
     * known.
     */
    public KducerAddressMap addressMap() {
        FirmwareVersion f = firmware;
        return KducerAddressMap.forVersion(f != null ? f.number() : FirmwareVersion.FALLBACK_NUMBER);
    }

    public boolean fetchGraphs() {
        return fetchGraphs;
    }

    public void fetchGraphs(boolean fetchGraphs) {
        this.fetchGraphs = fetchGraphs;
    }

    public boolean motorLockedBySession() {
        return motorLockedBySession;
    }

    public void motorLockedBySession(boolean locked) {
        this.motorLockedBySession = locked;
    }
}
