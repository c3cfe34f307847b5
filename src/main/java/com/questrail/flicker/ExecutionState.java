package com.questrail.flicker;

/**
 * Lifecycle of a {@link Flicker} instance.
 *
 * <pre>
 *   NOT_EXECUTED → EXECUTING → EXECUTED_OK | EXECUTED_WITH_ERROR
 *        ↑                          │
 *        └──────── cleanUp() ───────┘
 * </pre>
 */
public enum ExecutionState
{
    NOT_EXECUTED,
    EXECUTING,
    EXECUTED_OK,
    /** Terminal for the current result; {@link Flicker#execute()} has failed. */
    EXECUTED_WITH_ERROR
}
