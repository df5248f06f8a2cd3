package com.reminders.core;

/**
 * Delivers the notification of a fired reminder.
 *
 * <p>Implementations talk to whatever surface the user is on (a chat
 * channel, a log, a push service). The scheduler calls {@link #dispatch}
 * exactly once per fired reminder from a dispatch worker thread, never from
 * the thread that scheduled it. A failed delivery is not retried.</p>
 *
 * <p>Implementations must be safe to call from several dispatch workers at
 * once.</p>
 */
public interface Dispatcher {

    /**
     * Deliver one reminder.
     *
     * @param ownerId the user to notify
     * @param channelId where to deliver the notification
     * @param taskName the label the reminder was scheduled with
     * @throws DeliveryFailedException if the notification could not be delivered
     */
    void dispatch(long ownerId, long channelId, String taskName) throws DeliveryFailedException;
}
