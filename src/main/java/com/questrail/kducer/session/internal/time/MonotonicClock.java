package com.questrail.kducer.session.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for the session loop's tick deadlines.
 *
 * <h2>Binding invariant</h2>
 * Tick scheduling MUST use a monotonic time source. Wall-clock time is used
 * only for result timestamps and observability.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two values are meaningful.
     */
    long nowNanos();
}
