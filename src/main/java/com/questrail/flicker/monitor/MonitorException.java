package com.questrail.flicker.monitor;

/**
 * Indicates that a monitor could not be driven, e.g. its trace could not be
 * started, flushed or written.
 */
public final class MonitorException extends RuntimeException
{
    public MonitorException(String message, Throwable cause) {
        super(message, cause);
    }
}
