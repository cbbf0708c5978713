package com.questrail.kducer.session.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for result timestamps ({@code receivedAt}, the local-time
 * override written into result records) and observability events.
 *
 * <p>This clock may jump (NTP, DST, manual setting). It MUST NOT be used for
 * tick scheduling or timeouts.</p>
 */
public interface WallClock
{
    Instant now();
}
