package com.reminders.core;

/**
 * Lifecycle of a reminder.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>SCHEDULED → FIRED: due time reached and the dispatch attempt resolved</li>
 *   <li>SCHEDULED → CANCELLED: removed by its owner before firing</li>
 * </ul>
 *
 * <p>Only SCHEDULED reminders are stored. Reaching either end state deletes
 * the row, so the scheduler counts end states instead of recording them.</p>
 */
public enum ReminderStatus {
    SCHEDULED,
    FIRED,
    CANCELLED
}
