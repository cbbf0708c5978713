package com.questrail.kducer.api;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CancellationToken
 * =============================================================================
 * Cooperative cancellation signal shared between a caller and the session loop.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>{@link #cancel()} is idempotent and never blocks.</li>
 *   <li>A token created with {@link #linked(CancellationToken...)} is cancelled
 *       as soon as any of its parents is; cancelling the child does not affect
 *       the parents.</li>
 *   <li>{@link #sleep(Duration)} returns early by throwing
 *       {@link CancellationException} when the token is cancelled, so a stop of
 *       the session wakes every sleeping waiter at once.</li>
 * </ul>
 *
 * <p>Linked tokens register with their parents. Call {@link #release()} once a
 * linked token is no longer needed so long-lived parents do not accumulate
 * children.</p>
 */
public final class CancellationToken
{
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<CancellationToken> children = new CopyOnWriteArrayList<>();
    private final List<CancellationToken> parents;

    private CancellationToken(List<CancellationToken> parents) {
        this.parents = parents;
    }

    /**
     * A fresh token that is cancelled only by calling {@link #cancel()} on it.
     */
    public static CancellationToken create() {
        return new CancellationToken(List.of());
    }

    /**
     * A fresh token for callers that never cancel.
     */
    public static CancellationToken none() {
        return create();
    }

    public static CancellationToken linked(CancellationToken... parents) {
        Objects.requireNonNull(parents, "parents");
        List<CancellationToken> parentList = List.of(parents);
        CancellationToken child = new CancellationToken(parentList);
        for (CancellationToken parent : parentList) {
            parent.children.add(child);
            if (parent.isCancellationRequested()) {
                child.cancel();
            }
        }
        return child;
    }

    public void cancel() {
        if (cancelled.getCount() == 0L) {
            return;
        }
        cancelled.countDown();
        for (CancellationToken child : children) {
            child.cancel();
        }
    }

    public boolean isCancellationRequested() {
        return cancelled.getCount() == 0L;
    }

    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("Operation cancelled");
        }
    }

    /**
     * Sleep for {@code duration} unless cancelled first.
     *
     * @throws CancellationException when the token is (or becomes) cancelled,
     *                               or the sleeping thread is interrupted
     */
    public void sleep(Duration duration) {
        Objects.requireNonNull(duration, "duration");
        throwIfCancellationRequested();
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            if (cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new CancellationException("Operation cancelled");
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException ce = new CancellationException("Interrupted while sleeping");
            ce.initCause(e);
            throw ce;
        }
    }

    /**
     * Detach this token from its parents.
     */
    public void release() {
        for (CancellationToken parent : parents) {
            parent.children.remove(this);
        }
    }

    /**
     * Number of linked tokens currently registered with this one.
     */
    int linkedChildCount() {
        return children.size();
    }

    @Override
    public String toString() {
        return "CancellationToken[cancelled=" + isCancellationRequested() + "]";
    }
}
