package com.reminders.test;

import com.reminders.db.Database;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.UUID;

/**
 * Database factories for tests.
 */
public final class TestDatabases {

    private TestDatabases() {
    }

    /**
     * A fresh private in-memory database, gone once its pool is closed.
     */
    public static Database inMemory() throws SQLException {
        Database database = new Database("jdbc:h2:mem:reminders-" + UUID.randomUUID(), "sa", "", 4);
        database.initialize();
        return database;
    }

    /**
     * A file database under the given directory. Opening the same directory
     * again after close() sees the same data, which is how tests simulate a restart.
     */
    public static Database onDisk(Path directory) throws SQLException {
        String url = "jdbc:h2:file:" + directory.resolve("reminders").toAbsolutePath();
        Database database = new Database(url, "sa", "", 4);
        database.initialize();
        return database;
    }
}
