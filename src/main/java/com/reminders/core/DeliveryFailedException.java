package com.reminders.core;

/**
 * Thrown by a {@link Dispatcher} when a notification could not be delivered.
 *
 * <p>Non-fatal to the scheduler: the failure is logged and counted, and the
 * reminder is deleted anyway. There is a single delivery attempt per
 * reminder.</p>
 */
public class DeliveryFailedException extends Exception {

    public DeliveryFailedException(String message) {
        super(message);
    }

    public DeliveryFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
