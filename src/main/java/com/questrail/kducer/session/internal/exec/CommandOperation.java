package com.questrail.kducer.session.internal.exec;

/**
 * The body of a queued command, run on the session loop thread.
 *
 * @param <T> command output type ({@code Void} for commands without output)
 */
@FunctionalInterface
public interface CommandOperation<T>
{
    T execute(CommandContext context);
}
