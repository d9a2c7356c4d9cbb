package com.nana.iep.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * DatabaseManager - Owns the SQLite connection of the master table store.
 *
 * <p>RESPONSIBILITIES:
 * <ul>
 *   <li>Create the database file and its parent directories if absent.</li>
 *   <li>Open and hold one {@link Connection} for the duration of a run.</li>
 *   <li>Create the master table schema on first use.</li>
 *   <li>Record the schema version and refuse stores written at any other version.</li>
 * </ul>
 *
 * <p>One instance per database file. The audit job is a single process
 * guarded by a lock file, so a single connection is enough.
 */
public final class DatabaseManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DatabaseManager.class);

    // -----------------------------------------------------------------------
    // CONSTANTS
    // -----------------------------------------------------------------------

    /** Schema version written to new stores and required of existing ones. */
    static final int CURRENT_SCHEMA_VERSION = 1;

    private static final String PRAGMA_WAL  = "PRAGMA journal_mode=WAL;";
    private static final String PRAGMA_FK   = "PRAGMA foreign_keys=ON;";
    private static final String PRAGMA_BUSY = "PRAGMA busy_timeout=5000;";

    private Connection connection;

    private final Path dbPath;

    // -----------------------------------------------------------------------
    // CONSTRUCTOR
    // -----------------------------------------------------------------------

    /**
     * Opens (creating if needed) the database at {@code dbPath} and brings
     * its schema up to date.
     *
     * @param dbPath path of the SQLite file
     * @throws DatabaseInitException if anything in the startup sequence fails
     */
    public DatabaseManager(Path dbPath) {
        if (dbPath == null) {
            throw new IllegalArgumentException("Database path must not be null.");
        }
        this.dbPath = dbPath.toAbsolutePath();
        log.info("Database path resolved to: {}", this.dbPath);

        try {
            initializeDirectory();
            openConnection();
            configurePragmas();
            initializeSchema();
            checkSchemaVersion();
        } catch (SQLException | IOException ex) {
            throw new DatabaseInitException(
                    "Failed to initialize the database at: " + this.dbPath, ex);
        }
    }

    // -----------------------------------------------------------------------
    // PUBLIC ACCESS
    // -----------------------------------------------------------------------

    /**
     * Returns the open connection, reopening it if it was closed.
     *
     * @return the configured JDBC connection
     * @throws DatabaseInitException if the connection cannot be reopened
     */
    public Connection getConnection() {
        try {
            if (connection == null || connection.isClosed()) {
                log.warn("Connection was closed or null; attempting to reopen.");
                openConnection();
                configurePragmas();
            }
        } catch (SQLException ex) {
            throw new DatabaseInitException("Failed to reopen database connection.", ex);
        }
        return connection;
    }

    public Path getDatabasePath() {
        return dbPath;
    }

    /**
     * Checkpoints the WAL into the main file and closes the connection.
     */
    public void shutdown() {
        if (connection != null) {
            try {
                if (!connection.isClosed()) {
                    try (Statement st = connection.createStatement()) {
                        st.execute("PRAGMA wal_checkpoint(TRUNCATE);");
                    }
                    connection.close();
                    log.info("Database connection closed.");
                }
            } catch (SQLException ex) {
                log.error("Error closing database connection during shutdown.", ex);
            }
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    // -----------------------------------------------------------------------
    // PRIVATE INITIALIZATION METHODS
    // -----------------------------------------------------------------------

    private void initializeDirectory() throws IOException {
        Path dir = dbPath.getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
            log.info("Created database directory: {}", dir);
        }
    }

    private void openConnection() throws SQLException {
        connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
        DatabaseMetaData meta = connection.getMetaData();
        log.debug("Connected to SQLite {} via driver {}",
                meta.getDatabaseProductVersion(),
                meta.getDriverVersion());
    }

    /** PRAGMAs other than journal_mode are per connection. */
    private void configurePragmas() throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute(PRAGMA_WAL);
            st.execute(PRAGMA_FK);
            st.execute(PRAGMA_BUSY);
        }
    }

    /**
     * Creates the store tables if they do not already exist.
     *
     * <ul>
     *   <li>{@code master_row}: one row per student, {@code position} is the
     *       row order of the master table.</li>
     *   <li>{@code master_identity}: passthrough identity columns in their
     *       original order.</li>
     *   <li>{@code session_fact}, {@code goal_observation}: the retained facts
     *       the next run deduplicates against.</li>
     * </ul>
     */
    private void initializeSchema() throws SQLException {
        try (Statement st = connection.createStatement()) {

            st.execute("""
                CREATE TABLE IF NOT EXISTS master_row (
                    student_code   TEXT    PRIMARY KEY,
                    position       INTEGER NOT NULL UNIQUE,
                    session_count  INTEGER NOT NULL DEFAULT 0,
                    last_seen      TEXT
                );
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS master_identity (
                    student_code   TEXT    NOT NULL
                                   REFERENCES master_row(student_code) ON DELETE CASCADE,
                    field_order    INTEGER NOT NULL,
                    field_name     TEXT    NOT NULL,
                    field_value    TEXT    NOT NULL,
                    PRIMARY KEY (student_code, field_name)
                );
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS session_fact (
                    student_code   TEXT    NOT NULL
                                   REFERENCES master_row(student_code) ON DELETE CASCADE,
                    fact_date      TEXT    NOT NULL,
                    fact_value     TEXT    NOT NULL,
                    PRIMARY KEY (student_code, fact_date, fact_value)
                );
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS goal_observation (
                    student_code   TEXT    NOT NULL
                                   REFERENCES master_row(student_code) ON DELETE CASCADE,
                    category       TEXT    NOT NULL,
                    status         TEXT    NOT NULL,
                    observed_on    TEXT    NOT NULL,
                    PRIMARY KEY (student_code, category)
                );
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS schema_version (
                    version        INTEGER NOT NULL
                );
                """);

            log.debug("Schema initialization complete.");
        }
    }

    private void checkSchemaVersion() throws SQLException {
        int storedVersion = getStoredSchemaVersion();

        if (storedVersion == -1) {
            insertSchemaVersion(CURRENT_SCHEMA_VERSION);
            log.info("New store created at schema version {}.", CURRENT_SCHEMA_VERSION);
            return;
        }
        if (storedVersion > CURRENT_SCHEMA_VERSION) {
            throw new SQLException("Store schema version " + storedVersion
                    + " is newer than supported version " + CURRENT_SCHEMA_VERSION + ".");
        }
        if (storedVersion < CURRENT_SCHEMA_VERSION) {
            throw new SQLException("Store schema version " + storedVersion
                    + " predates supported version " + CURRENT_SCHEMA_VERSION + ".");
        }
        log.debug("Schema is up to date at version {}.", CURRENT_SCHEMA_VERSION);
    }

    /** @return the stored version, or -1 if none has been recorded */
    int getStoredSchemaVersion() throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                     "SELECT version FROM schema_version LIMIT 1;");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt("version") : -1;
        }
    }

    private void insertSchemaVersion(int version) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO schema_version (version) VALUES (?);")) {
            ps.setInt(1, version);
            ps.executeUpdate();
        }
    }

    // -----------------------------------------------------------------------
    // INNER EXCEPTION CLASS
    // -----------------------------------------------------------------------

    /**
     * Unchecked exception for a store that cannot be opened or initialized.
     * The run cannot proceed without it.
     */
    public static final class DatabaseInitException extends RuntimeException {

        public DatabaseInitException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
