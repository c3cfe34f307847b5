package com.questrail.flicker.runner;

import java.util.Objects;

/**
 * Indicates that a phase of the test cycle raised and the execution was aborted.
 *
 * <p>The cause is the exception thrown by the command or monitor. Repetition
 * {@code -1} denotes a failure outside of any repetition (output preparation
 * or setup before the first run).</p>
 */
public final class PhaseExecutionException extends RuntimeException
{
    private final TransitionPhase phase;
    private final int iteration;

    public PhaseExecutionException(TransitionPhase phase, int iteration, Throwable cause) {
        this(phase, iteration, null, cause);
    }

    public PhaseExecutionException(TransitionPhase phase, int iteration, String detail, Throwable cause) {
        super(describe(phase, iteration, detail, cause), cause);
        this.phase = Objects.requireNonNull(phase, "phase");
        this.iteration = iteration;
    }

    public TransitionPhase phase() {
        return phase;
    }

    public int iteration() {
        return iteration;
    }

    private static String describe(TransitionPhase phase, int iteration, String detail, Throwable cause) {
        StringBuilder sb = new StringBuilder();
        sb.append("Phase ").append(phase);
        if (iteration >= 0) {
            sb.append(" of run ").append(iteration);
        }
        if (detail != null) {
            sb.append(" (").append(detail).append(')');
        }
        sb.append(" failed");
        if (cause != null) {
            sb.append(": ").append(cause.getClass().getSimpleName());
            if (cause.getMessage() != null) {
                sb.append(": ").append(cause.getMessage());
            }
        }
        return sb.toString();
    }
}
