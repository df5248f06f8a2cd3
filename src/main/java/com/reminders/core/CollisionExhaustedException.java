package com.reminders.core;

/**
 * Thrown when every generated identifier candidate collided with an id
 * already in the store.
 *
 * <p>With 62^8 possible ids this is not expected to happen in practice; the
 * caller reports "could not schedule, try again".</p>
 */
public class CollisionExhaustedException extends SchedulerException {
    private final int attempts;

    public CollisionExhaustedException(int attempts) {
        super("No unique reminder id after " + attempts + " attempts");
        this.attempts = attempts;
    }

    /**
     * @return how many candidates were tried before giving up
     */
    public int getAttempts() {
        return attempts;
    }
}
