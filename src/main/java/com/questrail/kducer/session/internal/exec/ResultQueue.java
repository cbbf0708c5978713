package com.questrail.kducer.session.internal.exec;

import com.questrail.kducer.api.TighteningResultEvent;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * FIFO of tightening results published by the loop and drained by callers.
 *
 * <p>Results are removed only by {@link #poll()} or {@link #clear()}.</p>
 */
public final class ResultQueue
{
    private final ConcurrentLinkedQueue<TighteningResultEvent> queue = new ConcurrentLinkedQueue<>();

    public void publish(TighteningResultEvent event) {
        queue.offer(Objects.requireNonNull(event, "event"));
    }

    public Optional<TighteningResultEvent> poll() {
        return Optional.ofNullable(queue.poll());
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    public void clear() {
        queue.clear();
    }
}
