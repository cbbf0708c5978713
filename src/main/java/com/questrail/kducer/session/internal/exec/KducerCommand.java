package com.questrail.kducer.session.internal.exec;

import com.questrail.kducer.api.CancellationToken;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * KducerCommand
 * =============================================================================
 * One queued unit of work plus its completion slot.
 *
 * <h2>Completion</h2>
 * <ul>
 *   <li>Completed at most once, by the loop thread, with either an output or an
 *       error.</li>
 *   <li>{@code output} and {@code error} are written before the volatile
 *       {@code completed} flag, so a caller that observes the flag also
 *       observes them.</li>
 *   <li>Callers wait by polling the flag at the poll interval; there is no
 *       push notification. The first check happens one interval after the
 *       wait starts, so observing completion always takes at least one
 *       interval.</li>
 * </ul>
 *
 * <h2>Cancellation</h2>
 * The {@link #token()} is linked to both the caller's token and the session
 * shutdown token. Either one firing makes {@link #await} throw
 * {@link CancellationException} and aborts the operation's waits. A waiter
 * that leaves {@link #await} before completion for any other reason (thread
 * interrupt) cancels the token itself, so the loop never runs a command
 * nobody is waiting for.
 *
 * @param <T> output type ({@code Void} for commands without output)
 */
public final class KducerCommand<T>
{
    private final CommandKind kind;
    private final CommandOperation<T> operation;
    private final CancellationToken token;

    private final AtomicBoolean completing = new AtomicBoolean(false);
    private volatile boolean completed;
    private volatile T output;
    private volatile RuntimeException error;

    public KducerCommand(CommandKind kind, CommandOperation<T> operation, CancellationToken token)
    {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.operation = Objects.requireNonNull(operation, "operation");
        this.token = Objects.requireNonNull(token, "token");
    }

    public CommandKind kind() {
        return kind;
    }

    public CancellationToken token() {
        return token;
    }

    public boolean isCompleted() {
        return completed;
    }

    /**
     * Run the operation and store its output. Failures propagate to the loop,
     * which decides whether to attach them ({@link #fail}) or requeue.
     */
    public void execute(CommandContext context) {
        T out = operation.execute(context);
        complete(out);
    }

    public void complete(T value) {
        if (completing.compareAndSet(false, true)) {
            output = value;
            completed = true;
        }
    }

    public void fail(RuntimeException failure) {
        Objects.requireNonNull(failure, "failure");
        if (completing.compareAndSet(false, true)) {
            error = failure;
            completed = true;
        }
    }

    /**
     * Block the calling thread until the command completes.
     *
     * @param pollInterval completion check interval
     * @return the command output
     * @throws CancellationException when the caller or the session cancels first
     */
    public T await(Duration pollInterval) {
        try {
            do {
                token.sleep(pollInterval);
            } while (!completed);
        }
        finally {
            if (!completed) {
                // the caller is gone; the loop must drop or abort the command
                token.cancel();
            }
            token.release();
        }

        RuntimeException failure = error;
        if (failure != null) {
            throw failure;
        }
        return output;
    }

    @Override
    public String toString() {
        return "KducerCommand[" + kind + ", completed=" + completed + "]";
    }
}
