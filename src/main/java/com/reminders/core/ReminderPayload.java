package com.reminders.core;

import com.google.gson.Gson;
import com.google.gson.JsonSyntaxException;
import com.google.gson.reflect.TypeToken;

import java.lang.reflect.Type;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed payload carried by a reminder from creation through to dispatch.
 *
 * <p>The three fields every dispatcher needs are fixed: who asked, where to
 * deliver, and what the reminder is about. Anything else travels in
 * {@link #getExtras()}, an explicit map of optional string fields that is
 * persisted as a JSON column.</p>
 *
 * <p><b>Thread Safety:</b> Instances are immutable.</p>
 */
public final class ReminderPayload {
    // Shared Gson instance for the extras column - thread-safe
    private static final Gson gson = new Gson();
    private static final Type EXTRAS_TYPE = new TypeToken<LinkedHashMap<String, String>>() {}.getType();

    private final long ownerId;
    private final long channelId;
    private final String taskName;
    private final Map<String, String> extras;

    public ReminderPayload(long ownerId, long channelId, String taskName) {
        this(ownerId, channelId, taskName, Collections.emptyMap());
    }

    /**
     * @param ownerId the requesting user
     * @param channelId the delivery destination
     * @param taskName label shown when the reminder fires, must not be blank
     * @param extras optional additional fields, may be null
     * @throws IllegalArgumentException if taskName is null or blank
     */
    public ReminderPayload(long ownerId, long channelId, String taskName, Map<String, String> extras) {
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("Task name is required");
        }
        this.ownerId = ownerId;
        this.channelId = channelId;
        this.taskName = taskName;
        this.extras = extras == null || extras.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    public long getOwnerId() {
        return ownerId;
    }

    public long getChannelId() {
        return channelId;
    }

    public String getTaskName() {
        return taskName;
    }

    public Map<String, String> getExtras() {
        return extras;
    }

    /**
     * Serialize the optional fields for storage.
     *
     * @return JSON object text, or null when there are no extras
     */
    public String extrasToJson() {
        return extras.isEmpty() ? null : gson.toJson(extras, EXTRAS_TYPE);
    }

    /**
     * Parse the optional fields read back from storage.
     *
     * @param json JSON object text, may be null or empty
     * @return the extras map, never null
     * @throws IllegalArgumentException if the text is not a JSON object of strings
     */
    public static Map<String, String> extrasFromJson(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            Map<String, String> parsed = gson.fromJson(json, EXTRAS_TYPE);
            return parsed == null ? Collections.emptyMap() : parsed;
        } catch (JsonSyntaxException e) {
            throw new IllegalArgumentException("Invalid extras JSON: " + json, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReminderPayload)) {
            return false;
        }
        ReminderPayload that = (ReminderPayload) o;
        return ownerId == that.ownerId
                && channelId == that.channelId
                && taskName.equals(that.taskName)
                && extras.equals(that.extras);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ownerId, channelId, taskName, extras);
    }

    @Override
    public String toString() {
        return "ReminderPayload{owner=" + ownerId + ", channel=" + channelId + ", task='" + taskName + "'}";
    }
}
