package com.questrail.kducer.session.internal.exec;

import java.util.Objects;
import java.util.concurrent.LinkedBlockingDeque;

/**
 * FIFO of commands waiting for the session loop.
 *
 * <p>Any thread may {@link #enqueue}; only the loop thread calls {@link #poll}
 * and {@link #requeueFirst}.</p>
 */
public final class CommandQueue
{
    private final LinkedBlockingDeque<KducerCommand<?>> deque = new LinkedBlockingDeque<>();

    public void enqueue(KducerCommand<?> command) {
        deque.offerLast(Objects.requireNonNull(command, "command"));
    }

    /**
     * @return the oldest command, or {@code null} when the queue is empty
     */
    public KducerCommand<?> poll() {
        return deque.pollFirst();
    }

    /**
     * Put a command back ahead of everything queued after it.
     */
    public void requeueFirst(KducerCommand<?> command) {
        deque.offerFirst(Objects.requireNonNull(command, "command"));
    }

    public int size() {
        return deque.size();
    }

    public boolean isEmpty() {
        return deque.isEmpty();
    }

    /**
     * Remove every queued command without completing it.
     */
    public void discardAll() {
        deque.clear();
    }
}
