package com.reminders.engine;

import com.reminders.core.CollisionExhaustedException;
import com.reminders.core.Reminder;
import com.reminders.core.ReminderPayload;
import com.reminders.db.Database;
import com.reminders.db.ReminderRepository;
import com.reminders.test.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ReminderIdGeneratorTest {

    private Database database;
    private ReminderRepository repository;

    @BeforeEach
    public void setUp() throws Exception {
        database = TestDatabases.inMemory();
        repository = new ReminderRepository(database);
    }

    @AfterEach
    public void tearDown() {
        database.close();
    }

    private void store(String id) throws Exception {
        Instant now = Instant.now();
        repository.insert(new Reminder(id, new ReminderPayload(1L, 1L, "Taken"), now.plusSeconds(60), now));
    }

    @Test
    public void testIdsAreEightAlphanumericCharacters() {
        ReminderIdGenerator generator = new ReminderIdGenerator(new Random(42));
        for (int i = 0; i < 200; i++) {
            String id = generator.generate();
            assertEquals(ReminderIdGenerator.ID_LENGTH, id.length());
            assertTrue(id.matches("[A-Za-z0-9]{8}"), id);
        }
    }

    @Test
    public void testRandomIdsDoNotRepeat() {
        ReminderIdGenerator generator = new ReminderIdGenerator();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            assertTrue(seen.add(generator.generate()));
        }
    }

    @Test
    public void testCollidingCandidateIsSkipped() throws Exception {
        store("TAKEN000");
        Iterator<String> candidates = List.of("TAKEN000", "TAKEN000", "FREE0000").iterator();
        ReminderIdGenerator generator = new ReminderIdGenerator(candidates::next, ReminderIdGenerator.MAX_ATTEMPTS);

        assertEquals("FREE0000", generator.generateUnique(repository));
    }

    @Test
    public void testExhaustedAfterOneHundredCollisions() throws Exception {
        store("TAKEN000");
        AtomicInteger drawn = new AtomicInteger();
        ReminderIdGenerator generator = new ReminderIdGenerator(() -> {
            drawn.incrementAndGet();
            return "TAKEN000";
        }, ReminderIdGenerator.MAX_ATTEMPTS);

        CollisionExhaustedException e = assertThrows(CollisionExhaustedException.class,
                () -> generator.generateUnique(repository));

        assertEquals(100, e.getAttempts());
        assertEquals(100, drawn.get());
    }

    @Test
    public void testSucceedsOnLastAttempt() throws Exception {
        store("TAKEN000");
        AtomicInteger drawn = new AtomicInteger();
        ReminderIdGenerator generator = new ReminderIdGenerator(
                () -> drawn.incrementAndGet() < 100 ? "TAKEN000" : "LAST0000",
                ReminderIdGenerator.MAX_ATTEMPTS);

        assertEquals("LAST0000", generator.generateUnique(repository));
    }
}
