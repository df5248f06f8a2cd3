package com.reminders.core;

/**
 * Base class for failures of the reminder store and scheduler.
 *
 * <p>Checked on purpose: every caller of the scheduler API sits on a user
 * request and has to turn each of these into a reply.</p>
 *
 * @see DuplicateIdException
 * @see CollisionExhaustedException
 * @see ReminderNotFoundException
 * @see ServiceUnavailableException
 */
public abstract class SchedulerException extends Exception {

    protected SchedulerException(String message) {
        super(message);
    }

    protected SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
