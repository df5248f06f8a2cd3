package com.reminders.core;

/**
 * Thrown when a reminder id is unknown, or the reminder is already being
 * fired and can no longer be cancelled.
 */
public class ReminderNotFoundException extends SchedulerException {
    private final String reminderId;

    public ReminderNotFoundException(String reminderId) {
        super("No reminder with id " + reminderId);
        this.reminderId = reminderId;
    }

    public ReminderNotFoundException(String reminderId, String message) {
        super(message);
        this.reminderId = reminderId;
    }

    public String getReminderId() {
        return reminderId;
    }
}
