package com.reminders.app;

import com.reminders.db.Database;
import com.reminders.db.ReminderRepository;
import com.reminders.engine.ReminderIdGenerator;
import com.reminders.engine.ReminderScheduler;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for the reminder service.
 * Builds the scheduler once and hands it to the command layer and the metrics server.
 *
 * <p>Run with {@code --demo} to schedule one short reminder from the recipe book
 * on startup.</p>
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    private static final String DEMO_RECIPE = "smelter_iron";
    private static final long DEMO_OWNER = 1L;
    private static final long DEMO_CHANNEL = 2L;

    public static void main(String[] args) {
        configureLogging();
        logger.info("=== Reminder Scheduler Starting ===");

        SchedulerConfig config = SchedulerConfig.load();
        Database database = new Database(config.getDbUrl(), config.getDbUser(),
                config.getDbPassword(), config.getDbPoolSize());

        try {
            // 1. Database and store
            database.initialize();
            ReminderRepository repository = new ReminderRepository(database);

            // 2. Scheduler, restoring whatever was pending at the last shutdown
            ReminderScheduler scheduler = new ReminderScheduler(repository, new LoggingDispatcher(),
                    new ReminderIdGenerator(), config.getDispatchWorkers(),
                    config.getShutdownTimeoutSeconds(), Clock.systemUTC());
            scheduler.start();

            // 3. Command layer
            RecipeBook recipes = RecipeBook.load(config.getRecipesPath());
            ReminderCommands commands = new ReminderCommands(scheduler, recipes);

            // 4. Metrics
            MetricsServer metricsServer = new MetricsServer(scheduler, repository, config.getMetricsPort());
            metricsServer.start();

            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received");
                metricsServer.stop();
                scheduler.shutdown();
                database.close();
                stopped.countDown();
            }, "Shutdown-Hook"));

            if (args.length > 0 && "--demo".equals(args[0])) {
                ReminderCommands.CommandResult result = commands.scheduleRecipe(DEMO_OWNER, DEMO_CHANNEL, DEMO_RECIPE);
                logger.info("Demo: " + result.getMessage());
            }

            logger.info("=== Reminder Scheduler is running (" + recipes.size() + " recipes) ===");
            logger.info("Press Ctrl+C to stop");

            stopped.await();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted");
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Fatal error during startup", e);
            database.close();
            System.exit(1);
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read logging.properties, using JVM defaults", e);
        }
    }
}
