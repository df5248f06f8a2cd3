package com.reminders.core;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A single scheduled, one-shot reminder as stored in the reminders table.
 *
 * <p>Times are truncated to milliseconds so that an instance read back from
 * the database equals the one that was written.</p>
 */
public final class Reminder {
    private final String id;
    private final ReminderPayload payload;
    private final Instant dueTime;
    private final Instant createdAt;

    public Reminder(String id, ReminderPayload payload, Instant dueTime, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.dueTime = Objects.requireNonNull(dueTime, "dueTime").truncatedTo(ChronoUnit.MILLIS);
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt").truncatedTo(ChronoUnit.MILLIS);
    }

    public String getId() { return id; }

    public ReminderPayload getPayload() { return payload; }

    public long getOwnerId() { return payload.getOwnerId(); }

    public long getChannelId() { return payload.getChannelId(); }

    public String getTaskName() { return payload.getTaskName(); }

    public Instant getDueTime() { return dueTime; }

    public Instant getCreatedAt() { return createdAt; }

    /**
     * @return true if the reminder is eligible to fire at the given instant
     */
    public boolean isDue(Instant now) {
        return !dueTime.isAfter(now);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Reminder)) {
            return false;
        }
        Reminder that = (Reminder) o;
        return id.equals(that.id)
                && payload.equals(that.payload)
                && dueTime.equals(that.dueTime)
                && createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, payload, dueTime, createdAt);
    }

    @Override
    public String toString() {
        return "Reminder{id='" + id + "', owner=" + getOwnerId() + ", task='" + getTaskName()
                + "', due=" + dueTime + "}";
    }
}
