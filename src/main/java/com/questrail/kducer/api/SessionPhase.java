package com.questrail.kducer.api;

/**
 * Connection phase of a device session.
 *
 * <pre>
 *   DISCONNECTED ──start()──▶ CONNECTING ──connected + firmware read──▶ ACTIVE
 *                                 ▲                                      │
 *                                 └────────── transport failure ─────────┘
 *
 *   any phase ──stop()──▶ STOPPED (terminal)
 * </pre>
 */
public enum SessionPhase
{
    DISCONNECTED,
    CONNECTING,
    ACTIVE,
    STOPPED;

    public boolean isTerminal() {
        return this == STOPPED;
    }
}
