package com.reminders.db;

import com.reminders.core.DuplicateIdException;
import com.reminders.core.Reminder;
import com.reminders.core.ReminderNotFoundException;
import com.reminders.core.ReminderPayload;
import com.reminders.core.ServiceUnavailableException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable store for reminders. The single source of truth for what is scheduled.
 *
 * <p>All methods use PreparedStatement and try-with-resources. Mutations run in
 * an explicit transaction and are committed before the method returns; on any
 * failure they are rolled back, so readers never observe a partial write.</p>
 *
 * <p>Every {@link SQLException} is translated: a primary-key violation on
 * insert becomes {@link DuplicateIdException}, everything else becomes
 * {@link ServiceUnavailableException}.</p>
 */
public class ReminderRepository {
    private static final Logger logger = Logger.getLogger(ReminderRepository.class.getName());

    private static final String UNIQUE_VIOLATION_STATE = "23505";

    private static final String INSERT_SQL =
            "INSERT INTO reminders (id, owner_id, channel_id, task_name, due_time, created_at, extras) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?)";
    private static final String DELETE_SQL = "DELETE FROM reminders WHERE id = ?";
    private static final String SELECT_BY_ID_SQL = "SELECT * FROM reminders WHERE id = ?";
    private static final String SELECT_BY_OWNER_SQL =
            "SELECT * FROM reminders WHERE owner_id = ? ORDER BY due_time ASC, id ASC";
    private static final String SELECT_ALL_SQL = "SELECT * FROM reminders ORDER BY due_time ASC, id ASC";
    private static final String COUNT_SQL = "SELECT COUNT(*) FROM reminders";

    private final Database database;

    public ReminderRepository(Database database) {
        this.database = database;
    }

    /**
     * Persist a new reminder.
     *
     * @param reminder the reminder to store
     * @throws DuplicateIdException if a reminder with the same id is already stored
     * @throws ServiceUnavailableException if the store cannot be reached
     */
    public void insert(Reminder reminder) throws DuplicateIdException, ServiceUnavailableException {
        Connection conn = null;
        try {
            conn = database.getConnection();
            conn.setAutoCommit(false);

            try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
                stmt.setString(1, reminder.getId());
                stmt.setLong(2, reminder.getOwnerId());
                stmt.setLong(3, reminder.getChannelId());
                stmt.setString(4, reminder.getTaskName());
                stmt.setLong(5, reminder.getDueTime().toEpochMilli());
                stmt.setLong(6, reminder.getCreatedAt().toEpochMilli());
                stmt.setString(7, reminder.getPayload().extrasToJson());
                stmt.executeUpdate();
            }

            conn.commit();
            logger.fine("Stored reminder " + reminder.getId());

        } catch (SQLException e) {
            rollback(conn);
            if (isUniqueViolation(e)) {
                throw new DuplicateIdException(reminder.getId(), e);
            }
            throw unavailable("insert reminder " + reminder.getId(), e);
        } finally {
            release(conn);
        }
    }

    /**
     * Remove a reminder.
     *
     * @param id the reminder id
     * @throws ReminderNotFoundException if no reminder has this id
     * @throws ServiceUnavailableException if the store cannot be reached
     */
    public void delete(String id) throws ReminderNotFoundException, ServiceUnavailableException {
        Connection conn = null;
        int rowsDeleted;
        try {
            conn = database.getConnection();
            conn.setAutoCommit(false);

            try (PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
                stmt.setString(1, id);
                rowsDeleted = stmt.executeUpdate();
            }

            conn.commit();

        } catch (SQLException e) {
            rollback(conn);
            throw unavailable("delete reminder " + id, e);
        } finally {
            release(conn);
        }

        if (rowsDeleted == 0) {
            throw new ReminderNotFoundException(id);
        }
        logger.fine("Deleted reminder " + id);
    }

    /**
     * Look up a reminder by id.
     *
     * @param id the reminder id
     * @return the reminder, or null if not stored
     * @throws ServiceUnavailableException if the store cannot be reached
     */
    public Reminder get(String id) throws ServiceUnavailableException {
        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {

            stmt.setString(1, id);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return mapResultSetToReminder(rs);
                }
            }
        } catch (SQLException e) {
            throw unavailable("look up reminder " + id, e);
        }
        return null;
    }

    /**
     * All reminders of one owner, earliest due first.
     *
     * @param ownerId the owner
     * @return the owner's reminders, possibly empty
     * @throws ServiceUnavailableException if the store cannot be reached
     */
    public List<Reminder> listByOwner(long ownerId) throws ServiceUnavailableException {
        List<Reminder> reminders = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_OWNER_SQL)) {

            stmt.setLong(1, ownerId);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    reminders.add(mapResultSetToReminder(rs));
                }
            }
        } catch (SQLException e) {
            throw unavailable("list reminders of owner " + ownerId, e);
        }

        return reminders;
    }

    /**
     * Every stored reminder, earliest due first. Used to rebuild the schedule on startup.
     *
     * @throws ServiceUnavailableException if the store cannot be reached
     */
    public List<Reminder> listAll() throws ServiceUnavailableException {
        List<Reminder> reminders = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_SQL);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                reminders.add(mapResultSetToReminder(rs));
            }
        } catch (SQLException e) {
            throw unavailable("list all reminders", e);
        }

        logger.fine("Loaded " + reminders.size() + " stored reminders");
        return reminders;
    }

    /**
     * @return number of stored reminders
     * @throws ServiceUnavailableException if the store cannot be reached
     */
    public int count() throws ServiceUnavailableException {
        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_SQL);
             ResultSet rs = stmt.executeQuery()) {

            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw unavailable("count reminders", e);
        }
    }

    private static boolean isUniqueViolation(SQLException e) {
        return e instanceof SQLIntegrityConstraintViolationException
                || UNIQUE_VIOLATION_STATE.equals(e.getSQLState());
    }

    private static ServiceUnavailableException unavailable(String action, SQLException e) {
        logger.log(Level.SEVERE, "Failed to " + action, e);
        return new ServiceUnavailableException("Reminder store unavailable: could not " + action, e);
    }

    private static void rollback(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            logger.log(Level.WARNING, "Error during rollback", rollbackEx);
        }
    }

    // The pool restores auto-commit when the connection comes back
    private static void release(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Error closing connection", e);
        }
    }

    private Reminder mapResultSetToReminder(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        ReminderPayload payload;
        try {
            payload = new ReminderPayload(
                    rs.getLong("owner_id"),
                    rs.getLong("channel_id"),
                    rs.getString("task_name"),
                    ReminderPayload.extrasFromJson(rs.getString("extras")));
        } catch (IllegalArgumentException e) {
            throw new SQLException("Corrupt reminder row " + id, e);
        }

        return new Reminder(
                id,
                payload,
                Instant.ofEpochMilli(rs.getLong("due_time")),
                Instant.ofEpochMilli(rs.getLong("created_at")));
    }
}
