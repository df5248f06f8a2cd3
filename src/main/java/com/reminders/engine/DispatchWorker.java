package com.reminders.engine;

import com.reminders.core.DeliveryFailedException;
import com.reminders.core.Dispatcher;
import com.reminders.core.Reminder;
import com.reminders.core.ServiceUnavailableException;
import com.reminders.db.ReminderRepository;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fires a single due reminder on the dispatch pool.
 *
 * <p>Each worker makes exactly one delivery attempt:</p>
 * <ul>
 *   <li>Confirm the reminder is still stored (the store wins over the in-memory schedule)</li>
 *   <li>Call the {@link Dispatcher} once</li>
 *   <li>Hand the outcome back to the scheduler, which deletes the reminder</li>
 * </ul>
 *
 * <p>A failed delivery is logged and counted but never retried. Nothing the
 * dispatcher throws escapes this worker.</p>
 *
 * @see ReminderScheduler
 */
public class DispatchWorker implements Runnable {
    private static final Logger logger = Logger.getLogger(DispatchWorker.class.getName());

    private final Reminder reminder;
    private final ReminderScheduler scheduler;
    private final ReminderRepository repository;
    private final Dispatcher dispatcher;

    public DispatchWorker(Reminder reminder, ReminderScheduler scheduler,
                          ReminderRepository repository, Dispatcher dispatcher) {
        this.reminder = reminder;
        this.scheduler = scheduler;
        this.repository = repository;
        this.dispatcher = dispatcher;
    }

    @Override
    public void run() {
        String id = reminder.getId();

        if (!isStillStored(id)) {
            logger.warning("Reminder " + id + " is no longer stored, skipping dispatch");
            scheduler.releaseInFlight(id);
            return;
        }

        boolean delivered = false;
        try {
            dispatcher.dispatch(reminder.getOwnerId(), reminder.getChannelId(), reminder.getTaskName());
            delivered = true;
            logger.info("Delivered reminder " + id + " (" + reminder.getTaskName() + ") to owner "
                    + reminder.getOwnerId());

        } catch (DeliveryFailedException e) {
            logger.log(Level.WARNING, "Delivery failed for reminder " + id + ", not retrying", e);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Dispatcher threw for reminder " + id + ", not retrying", e);
        } finally {
            scheduler.completeFiring(reminder, delivered);
        }
    }

    private boolean isStillStored(String id) {
        try {
            return repository.get(id) != null;
        } catch (ServiceUnavailableException e) {
            // Cannot tell; the in-memory schedule is all we have
            logger.log(Level.WARNING, "Could not confirm reminder " + id + " before dispatch", e);
            return true;
        }
    }
}
