package com.questrail.flicker;

/**
 * Indicates that the transition could not be executed, as opposed to an
 * assertion rejecting the captured traces.
 *
 * <p>Raised by {@link Flicker#execute()} when the execution recorded a global
 * error. It is fatal for the current result and never retried.</p>
 */
public final class TransitionExecutionException extends IllegalStateException
{
    public TransitionExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
