package com.reminders.app;

import com.reminders.core.Reminder;
import com.reminders.core.ReminderPayload;
import com.reminders.core.ServiceUnavailableException;
import com.reminders.db.Database;
import com.reminders.db.ReminderRepository;
import com.reminders.engine.ReminderIdGenerator;
import com.reminders.engine.ReminderScheduler;
import com.reminders.test.RecordingDispatcher;
import com.reminders.test.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class ReminderCommandsTest {

    private Database database;
    private ReminderRepository repository;
    private RecordingDispatcher dispatcher;
    private ReminderScheduler scheduler;
    private ReminderCommands commands;

    @BeforeEach
    public void setUp() throws Exception {
        database = TestDatabases.inMemory();
        repository = new ReminderRepository(database);
        dispatcher = new RecordingDispatcher();
        scheduler = new ReminderScheduler(repository, dispatcher, 2);
        RecipeBook recipes = new RecipeBook(Map.of(
                "smelter_iron", new RecipeBook.Recipe("Smelter", 10),
                "quick_test", new RecipeBook.Recipe("Quick Test", 1)));
        commands = new ReminderCommands(scheduler, recipes);
    }

    @AfterEach
    public void tearDown() {
        scheduler.shutdown();
        database.close();
    }

    @Test
    public void testScheduleReply() throws Exception {
        ReminderCommands.CommandResult result = commands.schedule(1L, 2L, "Smelter", 10);

        assertEquals(ReminderCommands.Outcome.SCHEDULED, result.getOutcome());
        assertTrue(result.isSuccess());
        assertNotNull(result.getJobId());
        assertEquals("You will be reminded in 00:00:10 to finish your Smelter task(s). Reminder id: "
                + result.getJobId(), result.getMessage());

        Reminder stored = repository.get(result.getJobId());
        assertNotNull(stored);
        assertEquals(1L, stored.getOwnerId());
        assertEquals(2L, stored.getChannelId());
    }

    @Test
    public void testScheduleRejectsBadInput() {
        assertEquals(ReminderCommands.Outcome.INVALID, commands.schedule(1L, 2L, "Smelter", 0).getOutcome());
        assertEquals(ReminderCommands.Outcome.INVALID, commands.schedule(1L, 2L, "Smelter", -5).getOutcome());
        assertEquals(ReminderCommands.Outcome.INVALID, commands.schedule(1L, 2L, "  ", 10).getOutcome());
        assertEquals(ReminderCommands.Outcome.INVALID, commands.schedule(1L, 2L, null, 10).getOutcome());
        assertFalse(commands.schedule(1L, 2L, "Smelter", 0).isSuccess());
    }

    @Test
    public void testScheduleRejectsOverlongDuration() throws Exception {
        ReminderCommands.CommandResult huge = commands.schedule(1L, 2L, "Smelter", 10_000_000_000_000_000L);
        assertEquals(ReminderCommands.Outcome.INVALID, huge.getOutcome());
        assertEquals("Duration is too long.", huge.getMessage());

        assertEquals(ReminderCommands.Outcome.INVALID,
                commands.schedule(1L, 2L, "Smelter", Long.MAX_VALUE).getOutcome());
        assertEquals(0, repository.count());
    }

    @Test
    public void testScheduleRecipe() throws Exception {
        ReminderCommands.CommandResult result = commands.scheduleRecipe(1L, 2L, "smelter_iron");

        assertEquals(ReminderCommands.Outcome.SCHEDULED, result.getOutcome());
        assertTrue(result.getMessage().startsWith("You will be reminded in 00:00:10 to finish your Smelter task(s)."));
        assertEquals("Smelter", repository.get(result.getJobId()).getTaskName());
    }

    @Test
    public void testScheduleUnknownRecipe() throws Exception {
        ReminderCommands.CommandResult result = commands.scheduleRecipe(1L, 2L, "unobtanium");

        assertEquals(ReminderCommands.Outcome.NOT_FOUND, result.getOutcome());
        assertEquals("unobtanium not found in recipes.", result.getMessage());
        assertNull(result.getJobId());
        assertEquals(0, repository.count());
    }

    @Test
    public void testRecipeReminderIsDelivered() throws Exception {
        scheduler.start();
        dispatcher.expect(1);

        commands.scheduleRecipe(7L, 8L, "quick_test");

        assertTrue(dispatcher.await(Duration.ofSeconds(5)));
        RecordingDispatcher.Delivery delivery = dispatcher.getDeliveries().get(0);
        assertEquals(7L, delivery.getOwnerId());
        assertEquals(8L, delivery.getChannelId());
        assertEquals("Quick Test", delivery.getTaskName());
    }

    @Test
    public void testCancel() throws Exception {
        String jobId = commands.schedule(1L, 2L, "Smelter", 60).getJobId();

        ReminderCommands.CommandResult result = commands.cancel(jobId);

        assertEquals(ReminderCommands.Outcome.CANCELLED, result.getOutcome());
        assertEquals("Successfully removed reminder " + jobId, result.getMessage());
        assertTrue(commands.list(1L).isEmpty());
    }

    @Test
    public void testCancelUnknown() {
        ReminderCommands.CommandResult result = commands.cancel("nonexistent");

        assertEquals(ReminderCommands.Outcome.NOT_FOUND, result.getOutcome());
        assertEquals("Could not find reminder with id nonexistent", result.getMessage());
        assertFalse(result.isSuccess());
    }

    @Test
    public void testListEarliestFirst() throws Exception {
        String later = commands.schedule(1L, 2L, "Greenhouse", 600).getJobId();
        String sooner = commands.schedule(1L, 2L, "Smelter", 10).getJobId();
        commands.schedule(99L, 2L, "Not mine", 5);

        List<ReminderCommands.ReminderView> views = commands.list(1L);

        assertEquals(2, views.size());
        assertEquals(sooner, views.get(0).getJobId());
        assertEquals("Smelter", views.get(0).getTaskName());
        assertEquals(later, views.get(1).getJobId());
        assertTrue(views.get(0).getDueTime().isBefore(views.get(1).getDueTime()));
    }

    @Test
    public void testStoreDown() {
        database.close();

        ReminderCommands.CommandResult scheduled = commands.schedule(1L, 2L, "Smelter", 10);
        assertEquals(ReminderCommands.Outcome.UNAVAILABLE, scheduled.getOutcome());
        assertEquals(ReminderCommands.MSG_UNAVAILABLE, scheduled.getMessage());

        assertEquals(ReminderCommands.Outcome.UNAVAILABLE, commands.cancel("whatever").getOutcome());
        assertThrows(ServiceUnavailableException.class, () -> commands.list(1L));
    }

    @Test
    public void testIdCollisionsAskForRetry() throws Exception {
        // Every candidate comes out as AAAAAAAA
        Random stuck = new Random() {
            @Override
            public int nextInt(int bound) {
                return 0;
            }
        };
        Instant now = Instant.now();
        repository.insert(new Reminder("AAAAAAAA", new ReminderPayload(1L, 2L, "Taken"), now.plusSeconds(60), now));

        ReminderScheduler colliding = new ReminderScheduler(repository, dispatcher,
                new ReminderIdGenerator(stuck), 1, 5, Clock.systemUTC());
        try {
            ReminderCommands retrying = new ReminderCommands(colliding, new RecipeBook(Map.of()));
            ReminderCommands.CommandResult result = retrying.schedule(1L, 2L, "Smelter", 10);

            assertEquals(ReminderCommands.Outcome.RETRY, result.getOutcome());
            assertEquals(ReminderCommands.MSG_RETRY, result.getMessage());
            assertEquals(1, repository.count());
        } finally {
            colliding.shutdown();
        }
    }

    @Test
    public void testFormatDuration() {
        assertEquals("00:00:00", ReminderCommands.formatDuration(0));
        assertEquals("00:00:10", ReminderCommands.formatDuration(10));
        assertEquals("00:01:30", ReminderCommands.formatDuration(90));
        assertEquals("01:01:01", ReminderCommands.formatDuration(3661));
        assertEquals("25:00:00", ReminderCommands.formatDuration(90000));
    }
}
