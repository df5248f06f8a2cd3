package com.reminders.app;

import com.reminders.core.CollisionExhaustedException;
import com.reminders.core.DuplicateIdException;
import com.reminders.core.Reminder;
import com.reminders.core.ReminderNotFoundException;
import com.reminders.core.ReminderPayload;
import com.reminders.core.ServiceUnavailableException;
import com.reminders.engine.ReminderScheduler;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * User-facing reminder operations: schedule, cancel and list.
 *
 * <p>Translates requests from whatever front end hosts the bot into calls on
 * a {@link ReminderScheduler} and turns scheduler failures into plain
 * replies. The scheduler instance is passed in; there is no global lookup.</p>
 */
public class ReminderCommands {
    private static final Logger logger = Logger.getLogger(ReminderCommands.class.getName());

    static final String MSG_RETRY = "Could not schedule the reminder, please try again.";
    static final String MSG_UNAVAILABLE = "Reminders are temporarily unavailable, please try again later.";

    private final ReminderScheduler scheduler;
    private final RecipeBook recipes;
    private final Clock clock;

    public ReminderCommands(ReminderScheduler scheduler, RecipeBook recipes) {
        this(scheduler, recipes, Clock.systemUTC());
    }

    public ReminderCommands(ReminderScheduler scheduler, RecipeBook recipes, Clock clock) {
        this.scheduler = scheduler;
        this.recipes = recipes;
        this.clock = clock;
    }

    public enum Outcome {
        SCHEDULED,
        CANCELLED,
        NOT_FOUND,
        INVALID,
        RETRY,
        UNAVAILABLE
    }

    /**
     * Reply to a command. {@code jobId} is set when a reminder was scheduled.
     */
    public static final class CommandResult {
        private final Outcome outcome;
        private final String jobId;
        private final String message;

        CommandResult(Outcome outcome, String jobId, String message) {
            this.outcome = outcome;
            this.jobId = jobId;
            this.message = message;
        }

        public Outcome getOutcome() { return outcome; }

        public String getJobId() { return jobId; }

        public String getMessage() { return message; }

        public boolean isSuccess() {
            return outcome == Outcome.SCHEDULED || outcome == Outcome.CANCELLED;
        }

        @Override
        public String toString() {
            return "CommandResult{" + outcome + ", jobId=" + jobId + ", message='" + message + "'}";
        }
    }

    /**
     * One line of a reminder listing.
     */
    public static final class ReminderView {
        private final String jobId;
        private final String taskName;
        private final Instant dueTime;

        ReminderView(String jobId, String taskName, Instant dueTime) {
            this.jobId = jobId;
            this.taskName = taskName;
            this.dueTime = dueTime;
        }

        public String getJobId() { return jobId; }

        public String getTaskName() { return taskName; }

        public Instant getDueTime() { return dueTime; }

        @Override
        public String toString() {
            return jobId + " " + taskName + " " + dueTime;
        }
    }

    /**
     * Remind the owner about a task after a number of seconds.
     */
    public CommandResult schedule(long ownerId, long channelId, String taskName, long durationSeconds) {
        if (durationSeconds <= 0) {
            return new CommandResult(Outcome.INVALID, null, "Duration must be a positive number of seconds.");
        }
        if (taskName == null || taskName.isBlank()) {
            return new CommandResult(Outcome.INVALID, null, "A task name is required.");
        }

        Instant dueTime;
        try {
            dueTime = clock.instant().plusSeconds(durationSeconds);
            dueTime.toEpochMilli();
        } catch (DateTimeException | ArithmeticException e) {
            return new CommandResult(Outcome.INVALID, null, "Duration is too long.");
        }

        try {
            String jobId = scheduler.addJob(new ReminderPayload(ownerId, channelId, taskName), dueTime);
            String message = "You will be reminded in " + formatDuration(durationSeconds)
                    + " to finish your " + taskName + " task(s). Reminder id: " + jobId;
            return new CommandResult(Outcome.SCHEDULED, jobId, message);

        } catch (CollisionExhaustedException | DuplicateIdException e) {
            logger.warning("Could not schedule " + taskName + " for owner " + ownerId + ": " + e.getMessage());
            return new CommandResult(Outcome.RETRY, null, MSG_RETRY);
        } catch (ServiceUnavailableException e) {
            return new CommandResult(Outcome.UNAVAILABLE, null, MSG_UNAVAILABLE);
        }
    }

    /**
     * Look the task up in the recipe book, then schedule it for the recipe's duration.
     */
    public CommandResult scheduleRecipe(long ownerId, long channelId, String taskKey) {
        RecipeBook.Recipe recipe = recipes.resolve(taskKey);
        if (recipe == null) {
            logger.warning(taskKey + " key not found in recipes");
            return new CommandResult(Outcome.NOT_FOUND, null, taskKey + " not found in recipes.");
        }
        return schedule(ownerId, channelId, recipe.getName(), recipe.getDurationSeconds());
    }

    public CommandResult cancel(String jobId) {
        try {
            scheduler.removeJob(jobId);
            return new CommandResult(Outcome.CANCELLED, jobId, "Successfully removed reminder " + jobId);
        } catch (ReminderNotFoundException e) {
            logger.info("Could not find reminder with id " + jobId);
            return new CommandResult(Outcome.NOT_FOUND, jobId, "Could not find reminder with id " + jobId);
        } catch (ServiceUnavailableException e) {
            return new CommandResult(Outcome.UNAVAILABLE, jobId, MSG_UNAVAILABLE);
        }
    }

    /**
     * The owner's pending reminders, earliest due first.
     *
     * @throws ServiceUnavailableException if the store cannot be reached
     */
    public List<ReminderView> list(long ownerId) throws ServiceUnavailableException {
        List<Reminder> reminders = scheduler.getUserJobs(ownerId);
        return reminders.stream()
                .map(r -> new ReminderView(r.getId(), r.getTaskName(), r.getDueTime()))
                .collect(Collectors.toList());
    }

    /**
     * Format seconds as {@code HH:MM:SS}; hours are not wrapped at 24.
     */
    public static String formatDuration(long seconds) {
        long h = seconds / 3600;
        long m = (seconds % 3600) / 60;
        long s = seconds % 60;
        return String.format("%02d:%02d:%02d", h, m, s);
    }
}
