package com.reminders.engine;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.reminders.core.CollisionExhaustedException;
import com.reminders.core.Dispatcher;
import com.reminders.core.DuplicateIdException;
import com.reminders.core.Reminder;
import com.reminders.core.ReminderNotFoundException;
import com.reminders.core.ReminderPayload;
import com.reminders.core.ReminderStatus;
import com.reminders.core.ServiceUnavailableException;
import com.reminders.db.ReminderRepository;

/**
 * Runtime orchestrator for persistent one-shot reminders.
 *
 * <p>The store ({@link ReminderRepository}) is the source of truth. The scheduler
 * keeps a derived, in-memory ordering of stored reminders by due time and a
 * dedicated firing thread that sleeps until the earliest one is due.</p>
 *
 * <p><b>Key Responsibilities:</b></p>
 * <ul>
 *   <li>Rebuild the schedule from the store on {@link #start()}; reminders that came
 *       due while the process was down fire immediately</li>
 *   <li>Add reminders: generate a unique id, persist, then enqueue</li>
 *   <li>Cancel reminders: delete from the store and the queue together</li>
 *   <li>Fire every due reminder once on the dispatch pool, then delete it</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b></p>
 * <ul>
 *   <li>One {@link ReentrantLock} guards the queue, the id index and the in-flight set</li>
 *   <li>{@link #addJob} and {@link #removeJob} hold the lock across their store
 *       transaction, so store and queue always change together</li>
 *   <li>The firing thread waits on a {@link Condition}; adding an earlier reminder
 *       signals it so the next wake time is recomputed</li>
 *   <li>Reminders pulled for firing are marked in-flight; cancelling one of those
 *       fails with {@link ReminderNotFoundException}</li>
 * </ul>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ReminderScheduler scheduler = new ReminderScheduler(repository, dispatcher, 4);
 * scheduler.start();
 *
 * String id = scheduler.addJob(new ReminderPayload(owner, channel, "Smelter"),
 *                              Instant.now().plusSeconds(10));
 * scheduler.removeJob(id);
 *
 * scheduler.shutdown();
 * }</pre>
 *
 * @see DispatchWorker
 * @see ReminderIdGenerator
 */
public class ReminderScheduler {
    private static final Logger logger = Logger.getLogger(ReminderScheduler.class.getName());

    public static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ReminderRepository repository;
    private final Dispatcher dispatcher;
    private final ReminderIdGenerator idGenerator;
    private final Clock clock;
    private final ExecutorService dispatchPool;
    private final int dispatchWorkers;
    private final long shutdownTimeoutSeconds;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeup = lock.newCondition();
    // Guarded by lock
    private final PriorityQueue<Reminder> dueQueue = new PriorityQueue<>(
            Comparator.comparing(Reminder::getDueTime).thenComparing(Reminder::getId));
    private final Map<String, Reminder> queued = new HashMap<>();
    private final Set<String> inFlight = new HashSet<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Map<ReminderStatus, AtomicLong> outcomes = new EnumMap<>(ReminderStatus.class);
    private final AtomicLong deliveryFailures = new AtomicLong();
    private volatile Thread firingThread;

    public ReminderScheduler(ReminderRepository repository, Dispatcher dispatcher, int dispatchWorkers) {
        this(repository, dispatcher, new ReminderIdGenerator(), dispatchWorkers,
                DEFAULT_SHUTDOWN_TIMEOUT_SECONDS, Clock.systemUTC());
    }

    /**
     * @param repository durable reminder store
     * @param dispatcher delivers fired reminders
     * @param idGenerator source of unique reminder ids
     * @param dispatchWorkers number of threads delivering fired reminders
     * @param shutdownTimeoutSeconds how long {@link #shutdown()} waits for in-flight dispatches
     * @param clock time source for due-time checks
     * @throws IllegalArgumentException if dispatchWorkers < 1
     */
    public ReminderScheduler(ReminderRepository repository, Dispatcher dispatcher,
                             ReminderIdGenerator idGenerator, int dispatchWorkers,
                             long shutdownTimeoutSeconds, Clock clock) {
        if (dispatchWorkers < 1) {
            throw new IllegalArgumentException("dispatchWorkers must be at least 1, got " + dispatchWorkers);
        }
        this.repository = repository;
        this.dispatcher = dispatcher;
        this.idGenerator = idGenerator;
        this.dispatchWorkers = dispatchWorkers;
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
        this.clock = clock;
        this.dispatchPool = Executors.newFixedThreadPool(dispatchWorkers);
        for (ReminderStatus status : ReminderStatus.values()) {
            outcomes.put(status, new AtomicLong());
        }

        logger.info("Reminder scheduler initialized with " + dispatchWorkers + " dispatch workers");
    }

    /**
     * Load every stored reminder and start the firing thread.
     *
     * <p>Whatever was queued before this call is discarded and rebuilt from the
     * store. Reminders whose due time already passed fire right away. A second
     * call while running is ignored.</p>
     *
     * @throws ServiceUnavailableException if the store cannot be read; the scheduler stays stopped
     * @throws IllegalStateException if the scheduler was shut down
     */
    public void start() throws ServiceUnavailableException {
        if (dispatchPool.isShutdown()) {
            throw new IllegalStateException("Reminder scheduler has been shut down");
        }
        if (!running.compareAndSet(false, true)) {
            logger.warning("Reminder scheduler is already running");
            return;
        }

        int loaded;
        int overdue = 0;
        lock.lock();
        try {
            List<Reminder> stored = repository.listAll();
            dueQueue.clear();
            queued.clear();
            Instant now = clock.instant();
            for (Reminder reminder : stored) {
                dueQueue.add(reminder);
                queued.put(reminder.getId(), reminder);
                if (reminder.isDue(now)) {
                    overdue++;
                }
            }
            loaded = stored.size();
        } catch (ServiceUnavailableException e) {
            running.set(false);
            throw e;
        } finally {
            lock.unlock();
        }

        logger.info("Loaded " + loaded + " stored reminders (" + overdue + " overdue, firing now)");

        Thread thread = new Thread(this::runFiringLoop, "Reminder-Firing-Thread");
        thread.setDaemon(false);
        firingThread = thread;
        thread.start();
    }

    /**
     * Schedule a reminder.
     *
     * @param payload who, where and what to remind about
     * @param dueTime when to fire; must be after the current time at millisecond precision
     * @return the new reminder's id
     * @throws IllegalArgumentException if dueTime is not in the future or cannot be stored as epoch millis
     * @throws CollisionExhaustedException if no unique id could be generated
     * @throws DuplicateIdException if the id was taken between check and insert
     * @throws ServiceUnavailableException if the store cannot be reached
     */
    public String addJob(ReminderPayload payload, Instant dueTime)
            throws CollisionExhaustedException, DuplicateIdException, ServiceUnavailableException {
        // Compare at the stored precision: a due time within the current millisecond is not in the future
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Instant due = dueTime.truncatedTo(ChronoUnit.MILLIS);
        if (!due.isAfter(now)) {
            throw new IllegalArgumentException("Due time must be in the future: " + dueTime);
        }
        try {
            due.toEpochMilli();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Due time out of range: " + dueTime, e);
        }

        lock.lock();
        try {
            String id = idGenerator.generateUnique(repository);
            Reminder reminder = new Reminder(id, payload, due, now);

            // Store first: on failure nothing has been queued
            repository.insert(reminder);
            enqueue(reminder);

            logger.info("Scheduled reminder " + id + " (" + payload.getTaskName() + ") for owner "
                    + payload.getOwnerId() + " due " + reminder.getDueTime());
            return id;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancel a scheduled reminder.
     *
     * @param id the reminder id
     * @throws ReminderNotFoundException if the reminder is unknown or already firing
     * @throws ServiceUnavailableException if the store cannot be reached; nothing was removed
     */
    public void removeJob(String id) throws ReminderNotFoundException, ServiceUnavailableException {
        lock.lock();
        try {
            if (inFlight.contains(id)) {
                throw new ReminderNotFoundException(id, "Reminder " + id + " is already firing");
            }

            Reminder queuedReminder = queued.get(id);
            try {
                repository.delete(id);
            } catch (ReminderNotFoundException e) {
                if (queuedReminder == null) {
                    throw e;
                }
                logger.warning("Reminder " + id + " was queued but missing from the store");
            }

            if (queuedReminder != null) {
                dueQueue.remove(queuedReminder);
                queued.remove(id);
                wakeup.signalAll();
            }
            outcomes.get(ReminderStatus.CANCELLED).incrementAndGet();
            logger.info("Cancelled reminder " + id);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pending reminders of one owner, earliest due first. Served from the store.
     *
     * @throws ServiceUnavailableException if the store cannot be reached
     */
    public List<Reminder> getUserJobs(long ownerId) throws ServiceUnavailableException {
        return repository.listByOwner(ownerId);
    }

    // Caller holds the lock
    private void enqueue(Reminder reminder) {
        dueQueue.add(reminder);
        queued.put(reminder.getId(), reminder);
        if (dueQueue.peek() == reminder) {
            // New head: the firing thread may be sleeping past it
            wakeup.signalAll();
        }
    }

    private void runFiringLoop() {
        logger.info("Firing loop started");

        while (running.get()) {
            List<Reminder> due;
            try {
                due = awaitDueReminders();
            } catch (InterruptedException e) {
                logger.info("Firing loop interrupted, stopping");
                Thread.currentThread().interrupt();
                break;
            }

            for (Reminder reminder : due) {
                try {
                    dispatchPool.submit(new DispatchWorker(reminder, this, repository, dispatcher));
                } catch (RejectedExecutionException e) {
                    // Shutting down: the reminder is still stored and fires after the next start
                    logger.warning("Dispatch pool closed, reminder " + reminder.getId() + " left for next start");
                    releaseInFlight(reminder.getId());
                }
            }
        }

        logger.info("Firing loop exited");
    }

    /**
     * Block until at least one reminder is due, then move every due reminder
     * from the queue to the in-flight set.
     *
     * @return the due reminders, or an empty list if the scheduler stopped
     */
    private List<Reminder> awaitDueReminders() throws InterruptedException {
        lock.lock();
        try {
            while (running.get()) {
                Reminder head = dueQueue.peek();
                if (head == null) {
                    wakeup.await();
                    continue;
                }

                long waitMillis = head.getDueTime().toEpochMilli() - clock.millis();
                if (waitMillis > 0) {
                    wakeup.await(waitMillis, TimeUnit.MILLISECONDS);
                    continue;
                }

                Instant now = clock.instant();
                List<Reminder> due = new ArrayList<>();
                while (!dueQueue.isEmpty() && dueQueue.peek().isDue(now)) {
                    Reminder reminder = dueQueue.poll();
                    queued.remove(reminder.getId());
                    inFlight.add(reminder.getId());
                    due.add(reminder);
                }
                return due;
            }
            return Collections.emptyList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Called by a {@link DispatchWorker} once its single delivery attempt resolved.
     * Deletes the reminder from the store, then clears its in-flight mark.
     */
    void completeFiring(Reminder reminder, boolean delivered) {
        String id = reminder.getId();
        try {
            if (!delivered) {
                deliveryFailures.incrementAndGet();
            }
            repository.delete(id);
            outcomes.get(ReminderStatus.FIRED).incrementAndGet();
        } catch (ReminderNotFoundException e) {
            logger.warning("Fired reminder " + id + " was already gone from the store");
        } catch (ServiceUnavailableException e) {
            logger.log(Level.SEVERE, "Could not delete fired reminder " + id
                    + "; it will fire again after the next start", e);
        } finally {
            releaseInFlight(id);
        }
    }

    void releaseInFlight(String id) {
        lock.lock();
        try {
            inFlight.remove(id);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop the firing thread and wait for in-flight dispatches.
     *
     * <p>Queued reminders stay in the store and are picked up by the next
     * {@link #start()}.</p>
     */
    public void shutdown() {
        running.set(false);
        logger.info("Shutting down reminder scheduler...");

        lock.lock();
        try {
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }

        dispatchPool.shutdown();
        try {
            Thread thread = firingThread;
            if (thread != null) {
                thread.join(TimeUnit.SECONDS.toMillis(shutdownTimeoutSeconds));
            }
            if (!dispatchPool.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                logger.warning("Forcing shutdown of remaining dispatches");
                dispatchPool.shutdownNow();
                if (!dispatchPool.awaitTermination(10, TimeUnit.SECONDS)) {
                    logger.severe("Dispatch pool did not terminate after forced shutdown");
                }
            }
        } catch (InterruptedException e) {
            dispatchPool.shutdownNow();
            Thread.currentThread().interrupt();
        }

        logger.info("Reminder scheduler shutdown complete");
    }

    /**
     * @return snapshot of scheduler state and outcome counters
     */
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new HashMap<>();
        status.put("running", running.get());
        status.put("dispatchWorkers", dispatchWorkers);
        status.put("fired", outcomes.get(ReminderStatus.FIRED).get());
        status.put("cancelled", outcomes.get(ReminderStatus.CANCELLED).get());
        status.put("deliveryFailures", deliveryFailures.get());

        lock.lock();
        try {
            status.put("queued", dueQueue.size());
            status.put("inFlight", inFlight.size());
        } finally {
            lock.unlock();
        }
        return status;
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getDispatchWorkers() {
        return dispatchWorkers;
    }
}
