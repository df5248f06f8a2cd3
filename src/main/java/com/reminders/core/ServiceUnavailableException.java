package com.reminders.core;

/**
 * Thrown when the backing store cannot be reached or a statement fails.
 *
 * <p>The operation that raised it has been rolled back; callers must not
 * assume it took effect. The original {@link java.sql.SQLException} is kept
 * as the cause.</p>
 */
public class ServiceUnavailableException extends SchedulerException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
