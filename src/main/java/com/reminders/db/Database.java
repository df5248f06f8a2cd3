package com.reminders.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Array;
import java.sql.Blob;
import java.sql.CallableStatement;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.NClob;
import java.sql.PreparedStatement;
import java.sql.SQLClientInfoException;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.sql.SQLXML;
import java.sql.Savepoint;
import java.sql.Statement;
import java.sql.Struct;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

// Fixed-size JDBC connection pool for the H2 reminder store
public class Database {
    private static final Logger logger = Logger.getLogger(Database.class.getName());

    private static final String SCHEMA_RESOURCE = "/schema.sql";
    private static final int CONNECTION_TIMEOUT_SECONDS = 30;
    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final String url;
    private final String user;
    private final String password;
    private final int poolSize;
    private final BlockingQueue<Connection> connectionPool;
    private volatile boolean initialized = false;
    private volatile boolean closed = false;

    public Database(String url, String user, String password, int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1, got " + poolSize);
        }
        this.url = url;
        this.user = user;
        this.password = password;
        this.poolSize = poolSize;
        this.connectionPool = new ArrayBlockingQueue<>(poolSize);
    }

    public synchronized void initialize() throws SQLException {
        if (initialized) {
            logger.fine("Database already initialized");
            return;
        }
        if (closed) {
            throw new SQLException("Database has been closed");
        }

        logger.info("Initializing connection pool for " + url);

        try {
            for (int i = 0; i < poolSize; i++) {
                connectionPool.offer(createConnection());
            }
            initializeSchema();
        } catch (SQLException e) {
            drainPool();
            throw e;
        }

        initialized = true;
        logger.info("Database initialized with " + poolSize + " connections");
    }

    private Connection createConnection() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    /**
     * Borrow a connection. Closing the returned connection hands it back to the pool.
     *
     * @throws SQLException if the pool is not usable or no connection frees up in time
     */
    public Connection getConnection() throws SQLException {
        if (!initialized) {
            throw new SQLException("Database not initialized. Call initialize() first.");
        }
        if (closed) {
            throw new SQLException("Database has been closed");
        }

        try {
            Connection conn = connectionPool.poll(CONNECTION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (conn == null) {
                throw new SQLException("Timeout waiting for available connection");
            }

            if (conn.isClosed() || !conn.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                logger.warning("Pooled connection invalid, creating a new one");
                closeQuietly(conn);
                conn = createConnection();
            }

            return wrap(conn);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SQLException("Interrupted while waiting for connection", e);
        }
    }

    // Called when a borrowed connection is closed
    synchronized void returnConnection(Connection connection) {
        if (closed) {
            closeQuietly(connection);
            return;
        }

        try {
            if (connection.isClosed() || !connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                logger.warning("Returned connection invalid, replacing it");
                closeQuietly(connection);
                connection = createConnection();
            } else if (!connection.getAutoCommit()) {
                // A caller left a transaction open
                connection.rollback();
                connection.setAutoCommit(true);
            }

            if (!connectionPool.offer(connection)) {
                logger.severe("Connection pool full, closing returned connection");
                closeQuietly(connection);
            }

        } catch (SQLException e) {
            logger.log(Level.WARNING, "Error returning connection to pool", e);
            closeQuietly(connection);
        }
    }

    private void closeQuietly(Connection conn) {
        if (conn != null) {
            try {
                conn.close();
            } catch (SQLException e) {
                logger.log(Level.WARNING, "Failed to close connection", e);
            }
        }
    }

    // Apply schema.sql from the classpath, one statement per ';'
    private void initializeSchema() throws SQLException {
        String schema;
        try (InputStream in = Database.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new SQLException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            schema = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema resource", e);
        }

        Connection conn = connectionPool.peek();
        if (conn == null) {
            throw new SQLException("No connection available for schema initialization");
        }

        int executedCount = 0;
        try (Statement stmt = conn.createStatement()) {
            StringBuilder currentStatement = new StringBuilder();
            for (String line : schema.split("\n")) {
                line = line.trim();
                if (line.startsWith("--") || line.isEmpty()) {
                    continue;
                }

                currentStatement.append(line).append(' ');

                if (line.endsWith(";")) {
                    String sql = currentStatement.toString().trim();
                    sql = sql.substring(0, sql.length() - 1).trim();
                    if (!sql.isEmpty()) {
                        stmt.execute(sql);
                        executedCount++;
                    }
                    currentStatement = new StringBuilder();
                }
            }
        }

        logger.info("Schema applied (" + executedCount + " statements)");
    }

    public synchronized void close() {
        if (closed) {
            return;
        }

        closed = true;
        int closedCount = drainPool();
        logger.info("Closed " + closedCount + " database connections");
    }

    private int drainPool() {
        int closedCount = 0;
        Connection conn;
        while ((conn = connectionPool.poll()) != null) {
            closeQuietly(conn);
            closedCount++;
        }
        return closedCount;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isClosed() {
        return closed;
    }

    private Connection wrap(Connection delegate) {
        return new PooledConnection(delegate, this);
    }

    /**
     * Borrowed view of a pooled connection. close() hands the real connection
     * back to the pool; any other call after that fails.
     */
    private static final class PooledConnection implements Connection {
        private final Connection delegate;
        private final Database database;
        private volatile boolean released = false;

        PooledConnection(Connection delegate, Database database) {
            this.delegate = delegate;
            this.database = database;
        }

        private Connection delegate() throws SQLException {
            if (released) {
                throw new SQLException("Connection already returned to the pool");
            }
            return delegate;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                database.returnConnection(delegate);
            }
        }

        @Override
        public boolean isClosed() throws SQLException {
            return released || delegate.isClosed();
        }

        @Override
        public String toString() {
            return "PooledConnection[" + delegate + "]";
        }

        @Override
        public Statement createStatement() throws SQLException {
            return delegate().createStatement();
        }

        @Override
        public Statement createStatement(int resultSetType, int resultSetConcurrency) throws SQLException {
            return delegate().createStatement(resultSetType, resultSetConcurrency);
        }

        @Override
        public Statement createStatement(int resultSetType, int resultSetConcurrency,
                                         int resultSetHoldability) throws SQLException {
            return delegate().createStatement(resultSetType, resultSetConcurrency, resultSetHoldability);
        }

        @Override
        public PreparedStatement prepareStatement(String sql) throws SQLException {
            return delegate().prepareStatement(sql);
        }

        @Override
        public PreparedStatement prepareStatement(String sql, int resultSetType,
                                                  int resultSetConcurrency) throws SQLException {
            return delegate().prepareStatement(sql, resultSetType, resultSetConcurrency);
        }

        @Override
        public PreparedStatement prepareStatement(String sql, int resultSetType, int resultSetConcurrency,
                                                  int resultSetHoldability) throws SQLException {
            return delegate().prepareStatement(sql, resultSetType, resultSetConcurrency, resultSetHoldability);
        }

        @Override
        public PreparedStatement prepareStatement(String sql, int autoGeneratedKeys) throws SQLException {
            return delegate().prepareStatement(sql, autoGeneratedKeys);
        }

        @Override
        public PreparedStatement prepareStatement(String sql, int[] columnIndexes) throws SQLException {
            return delegate().prepareStatement(sql, columnIndexes);
        }

        @Override
        public PreparedStatement prepareStatement(String sql, String[] columnNames) throws SQLException {
            return delegate().prepareStatement(sql, columnNames);
        }

        @Override
        public CallableStatement prepareCall(String sql) throws SQLException {
            return delegate().prepareCall(sql);
        }

        @Override
        public CallableStatement prepareCall(String sql, int resultSetType,
                                             int resultSetConcurrency) throws SQLException {
            return delegate().prepareCall(sql, resultSetType, resultSetConcurrency);
        }

        @Override
        public CallableStatement prepareCall(String sql, int resultSetType, int resultSetConcurrency,
                                             int resultSetHoldability) throws SQLException {
            return delegate().prepareCall(sql, resultSetType, resultSetConcurrency, resultSetHoldability);
        }

        @Override
        public String nativeSQL(String sql) throws SQLException {
            return delegate().nativeSQL(sql);
        }

        @Override
        public void setAutoCommit(boolean autoCommit) throws SQLException {
            delegate().setAutoCommit(autoCommit);
        }

        @Override
        public boolean getAutoCommit() throws SQLException {
            return delegate().getAutoCommit();
        }

        @Override
        public void commit() throws SQLException {
            delegate().commit();
        }

        @Override
        public void rollback() throws SQLException {
            delegate().rollback();
        }

        @Override
        public void rollback(Savepoint savepoint) throws SQLException {
            delegate().rollback(savepoint);
        }

        @Override
        public Savepoint setSavepoint() throws SQLException {
            return delegate().setSavepoint();
        }

        @Override
        public Savepoint setSavepoint(String name) throws SQLException {
            return delegate().setSavepoint(name);
        }

        @Override
        public void releaseSavepoint(Savepoint savepoint) throws SQLException {
            delegate().releaseSavepoint(savepoint);
        }

        @Override
        public DatabaseMetaData getMetaData() throws SQLException {
            return delegate().getMetaData();
        }

        @Override
        public void setReadOnly(boolean readOnly) throws SQLException {
            delegate().setReadOnly(readOnly);
        }

        @Override
        public boolean isReadOnly() throws SQLException {
            return delegate().isReadOnly();
        }

        @Override
        public void setCatalog(String catalog) throws SQLException {
            delegate().setCatalog(catalog);
        }

        @Override
        public String getCatalog() throws SQLException {
            return delegate().getCatalog();
        }

        @Override
        public void setSchema(String schema) throws SQLException {
            delegate().setSchema(schema);
        }

        @Override
        public String getSchema() throws SQLException {
            return delegate().getSchema();
        }

        @Override
        public void setTransactionIsolation(int level) throws SQLException {
            delegate().setTransactionIsolation(level);
        }

        @Override
        public int getTransactionIsolation() throws SQLException {
            return delegate().getTransactionIsolation();
        }

        @Override
        public SQLWarning getWarnings() throws SQLException {
            return delegate().getWarnings();
        }

        @Override
        public void clearWarnings() throws SQLException {
            delegate().clearWarnings();
        }

        @Override
        public Map<String, Class<?>> getTypeMap() throws SQLException {
            return delegate().getTypeMap();
        }

        @Override
        public void setTypeMap(Map<String, Class<?>> map) throws SQLException {
            delegate().setTypeMap(map);
        }

        @Override
        public void setHoldability(int holdability) throws SQLException {
            delegate().setHoldability(holdability);
        }

        @Override
        public int getHoldability() throws SQLException {
            return delegate().getHoldability();
        }

        @Override
        public Clob createClob() throws SQLException {
            return delegate().createClob();
        }

        @Override
        public Blob createBlob() throws SQLException {
            return delegate().createBlob();
        }

        @Override
        public NClob createNClob() throws SQLException {
            return delegate().createNClob();
        }

        @Override
        public SQLXML createSQLXML() throws SQLException {
            return delegate().createSQLXML();
        }

        @Override
        public Array createArrayOf(String typeName, Object[] elements) throws SQLException {
            return delegate().createArrayOf(typeName, elements);
        }

        @Override
        public Struct createStruct(String typeName, Object[] attributes) throws SQLException {
            return delegate().createStruct(typeName, attributes);
        }

        @Override
        public boolean isValid(int timeout) throws SQLException {
            return !released && delegate.isValid(timeout);
        }

        @Override
        public void setClientInfo(String name, String value) throws SQLClientInfoException {
            if (released) {
                throw new SQLClientInfoException();
            }
            delegate.setClientInfo(name, value);
        }

        @Override
        public void setClientInfo(Properties properties) throws SQLClientInfoException {
            if (released) {
                throw new SQLClientInfoException();
            }
            delegate.setClientInfo(properties);
        }

        @Override
        public String getClientInfo(String name) throws SQLException {
            return delegate().getClientInfo(name);
        }

        @Override
        public Properties getClientInfo() throws SQLException {
            return delegate().getClientInfo();
        }

        @Override
        public void abort(Executor executor) throws SQLException {
            delegate().abort(executor);
        }

        @Override
        public void setNetworkTimeout(Executor executor, int milliseconds) throws SQLException {
            delegate().setNetworkTimeout(executor, milliseconds);
        }

        @Override
        public int getNetworkTimeout() throws SQLException {
            return delegate().getNetworkTimeout();
        }

        @Override
        public <T> T unwrap(Class<T> iface) throws SQLException {
            return delegate().unwrap(iface);
        }

        @Override
        public boolean isWrapperFor(Class<?> iface) throws SQLException {
            return delegate().isWrapperFor(iface);
        }
    }
}
