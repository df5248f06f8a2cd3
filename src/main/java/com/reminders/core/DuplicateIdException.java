package com.reminders.core;

/**
 * Thrown when a reminder is inserted under an id the store already holds.
 */
public class DuplicateIdException extends SchedulerException {
    private final String reminderId;

    public DuplicateIdException(String reminderId) {
        super("Reminder id already exists: " + reminderId);
        this.reminderId = reminderId;
    }

    public DuplicateIdException(String reminderId, Throwable cause) {
        super("Reminder id already exists: " + reminderId, cause);
        this.reminderId = reminderId;
    }

    public String getReminderId() {
        return reminderId;
    }
}
