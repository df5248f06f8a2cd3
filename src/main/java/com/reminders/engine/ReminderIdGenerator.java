package com.reminders.engine;

import com.reminders.core.CollisionExhaustedException;
import com.reminders.core.ServiceUnavailableException;
import com.reminders.db.ReminderRepository;

import java.security.SecureRandom;
import java.util.Random;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Produces short random reminder ids that are unique in the store.
 *
 * <p>Ids are {@value #ID_LENGTH} characters from {@code [A-Za-z0-9]}. Each
 * candidate is checked against the repository; a colliding candidate is
 * discarded and another drawn, up to {@value #MAX_ATTEMPTS} attempts.</p>
 *
 * <p>The check-then-insert gap is closed by the scheduler lock and, as a
 * last resort, by the primary key on the reminders table.</p>
 */
public class ReminderIdGenerator {
    private static final Logger logger = Logger.getLogger(ReminderIdGenerator.class.getName());

    public static final int ID_LENGTH = 8;
    public static final int MAX_ATTEMPTS = 100;

    private static final String ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final Supplier<String> candidates;
    private final int maxAttempts;

    public ReminderIdGenerator() {
        this(new SecureRandom());
    }

    public ReminderIdGenerator(Random random) {
        this(() -> randomId(random), MAX_ATTEMPTS);
    }

    // Candidate source is swappable so collisions can be forced in tests
    ReminderIdGenerator(Supplier<String> candidates, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.candidates = candidates;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Draw one candidate id without checking the store.
     */
    public String generate() {
        return candidates.get();
    }

    /**
     * Draw candidates until one is not in the store.
     *
     * @param repository the store to check against
     * @return an id no stored reminder uses
     * @throws CollisionExhaustedException if every attempt collided
     * @throws ServiceUnavailableException if the store cannot be reached
     */
    public String generateUnique(ReminderRepository repository)
            throws CollisionExhaustedException, ServiceUnavailableException {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = generate();
            if (repository.get(candidate) == null) {
                return candidate;
            }
            logger.warning("Reminder id collision on attempt " + attempt + ": " + candidate);
        }
        throw new CollisionExhaustedException(maxAttempts);
    }

    private static String randomId(Random random) {
        StringBuilder sb = new StringBuilder(ID_LENGTH);
        for (int i = 0; i < ID_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
