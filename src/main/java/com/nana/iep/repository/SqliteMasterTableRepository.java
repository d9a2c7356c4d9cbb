package com.nana.iep.repository;

import com.nana.iep.domain.GoalObservation;
import com.nana.iep.domain.GoalStatus;
import com.nana.iep.domain.MasterRow;
import com.nana.iep.domain.MasterTable;
import com.nana.iep.domain.SessionFact;
import com.nana.iep.domain.StudentSummary;
import com.nana.iep.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SqliteMasterTableRepository - SQLite-backed {@link MasterTableRepository}.
 *
 * <p>All SQL lives in this class and uses prepared statements.
 * {@link SQLException}s are wrapped in {@link RepositoryException}.
 *
 * <p>Dates are stored as ISO-8601 text. {@code session_count} and
 * {@code last_seen} are written for readers of the database file; on load
 * they are recomputed from the stored facts.
 */
public class SqliteMasterTableRepository implements MasterTableRepository {

    private static final Logger log = LoggerFactory.getLogger(SqliteMasterTableRepository.class);

    // -----------------------------------------------------------------------
    // SQL CONSTANTS
    // -----------------------------------------------------------------------

    private static final String SQL_FIND_ROWS = """
            SELECT student_code, position
            FROM master_row
            ORDER BY position ASC
            """;

    private static final String SQL_FIND_IDENTITY = """
            SELECT student_code, field_name, field_value
            FROM master_identity
            ORDER BY student_code ASC, field_order ASC
            """;

    private static final String SQL_FIND_SESSIONS = """
            SELECT student_code, fact_date, fact_value
            FROM session_fact
            """;

    private static final String SQL_FIND_GOALS = """
            SELECT student_code, category, status, observed_on
            FROM goal_observation
            """;

    private static final String SQL_INSERT_ROW = """
            INSERT INTO master_row (student_code, position, session_count, last_seen)
            VALUES (?, ?, ?, ?)
            """;

    private static final String SQL_INSERT_IDENTITY = """
            INSERT INTO master_identity (student_code, field_order, field_name, field_value)
            VALUES (?, ?, ?, ?)
            """;

    private static final String SQL_INSERT_SESSION = """
            INSERT INTO session_fact (student_code, fact_date, fact_value)
            VALUES (?, ?, ?)
            """;

    private static final String SQL_INSERT_GOAL = """
            INSERT INTO goal_observation (student_code, category, status, observed_on)
            VALUES (?, ?, ?, ?)
            """;

    private static final String SQL_COUNT_ROWS =
            "SELECT COUNT(*) FROM master_row";

    private final DatabaseManager database;

    // -----------------------------------------------------------------------
    // CONSTRUCTOR
    // -----------------------------------------------------------------------

    /**
     * @param database the open store; must not be null
     */
    public SqliteMasterTableRepository(DatabaseManager database) {
        if (database == null) {
            throw new IllegalArgumentException("DatabaseManager must not be null.");
        }
        this.database = database;
        log.debug("SqliteMasterTableRepository instantiated for {}.", database.getDatabasePath());
    }

    private Connection conn() {
        return database.getConnection();
    }

    // -----------------------------------------------------------------------
    // READ
    // -----------------------------------------------------------------------

    @Override
    public MasterTable load() {
        List<String>                      order      = new ArrayList<>();
        Map<String, StudentSummary.Builder> builders = new LinkedHashMap<>();
        Map<String, Map<String, String>>  identities = new LinkedHashMap<>();

        try (Statement st = conn().createStatement()) {

            try (ResultSet rs = st.executeQuery(SQL_FIND_ROWS)) {
                while (rs.next()) {
                    String code = rs.getString("student_code");
                    order.add(code);
                    builders.put(code, new StudentSummary.Builder(code));
                    identities.put(code, new LinkedHashMap<>());
                }
            }

            try (ResultSet rs = st.executeQuery(SQL_FIND_IDENTITY)) {
                while (rs.next()) {
                    Map<String, String> identity = identities.get(rs.getString("student_code"));
                    if (identity != null) {
                        identity.put(rs.getString("field_name"), rs.getString("field_value"));
                    }
                }
            }

            try (ResultSet rs = st.executeQuery(SQL_FIND_SESSIONS)) {
                while (rs.next()) {
                    StudentSummary.Builder builder = builders.get(rs.getString("student_code"));
                    if (builder != null) {
                        builder.addSession(new SessionFact(
                                parseDate(rs.getString("fact_date")),
                                rs.getString("fact_value")));
                    }
                }
            }

            try (ResultSet rs = st.executeQuery(SQL_FIND_GOALS)) {
                while (rs.next()) {
                    StudentSummary.Builder builder = builders.get(rs.getString("student_code"));
                    if (builder != null) {
                        builder.observeGoal(rs.getString("category"), new GoalObservation(
                                parseStatus(rs.getString("status")),
                                parseDate(rs.getString("observed_on"))));
                    }
                }
            }

        } catch (SQLException ex) {
            throw new RepositoryException("Failed to load the master table.", ex);
        }

        List<MasterRow> rows = new ArrayList<>(order.size());
        for (String code : order) {
            rows.add(new MasterRow(identities.get(code), builders.get(code).build()));
        }
        log.debug("load() returned {} rows.", rows.size());
        return MasterTable.of(rows);
    }

    @Override
    public int countRows() {
        try (PreparedStatement ps = conn().prepareStatement(SQL_COUNT_ROWS);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to count master rows.", ex);
        }
    }

    // -----------------------------------------------------------------------
    // WRITE
    // -----------------------------------------------------------------------

    /**
     * {@inheritDoc}
     *
     * <p>Deletes every stored row and inserts the table in one transaction.
     * Child rows go with their parent through {@code ON DELETE CASCADE}.
     */
    @Override
    public void save(MasterTable table) {
        if (table == null) {
            throw new IllegalArgumentException("Master table must not be null.");
        }
        log.info("save() writing {} rows.", table.size());
        Connection connection = conn();

        try {
            connection.setAutoCommit(false);

            try (Statement st = connection.createStatement()) {
                st.executeUpdate("DELETE FROM master_row");
            }

            try (PreparedStatement rowPs      = connection.prepareStatement(SQL_INSERT_ROW);
                 PreparedStatement identityPs = connection.prepareStatement(SQL_INSERT_IDENTITY);
                 PreparedStatement sessionPs  = connection.prepareStatement(SQL_INSERT_SESSION);
                 PreparedStatement goalPs     = connection.prepareStatement(SQL_INSERT_GOAL)) {

                int position = 0;
                for (MasterRow row : table.getRows()) {
                    bindRow(rowPs, row, position++);
                    rowPs.executeUpdate();
                    insertIdentity(identityPs, row);
                    insertSessions(sessionPs, row);
                    insertGoals(goalPs, row);
                }
                identityPs.executeBatch();
                sessionPs.executeBatch();
                goalPs.executeBatch();
            }

            connection.commit();
            log.info("save() committed {} rows.", table.size());

        } catch (SQLException transactionEx) {
            log.error("save() transaction failed; attempting rollback.", transactionEx);
            try {
                connection.rollback();
                log.warn("save() rolled back; stored table unchanged.");
            } catch (SQLException rollbackEx) {
                log.error("Rollback also failed.", rollbackEx);
            }
            throw new RepositoryException("Failed to save the master table.", transactionEx);

        } finally {
            try {
                connection.setAutoCommit(true);
            } catch (SQLException acEx) {
                log.error("Failed to re-enable auto-commit after save().", acEx);
            }
        }
    }

    private void bindRow(PreparedStatement ps, MasterRow row, int position) throws SQLException {
        StudentSummary summary = row.getSummary();
        LocalDate lastSeen = summary.getLastSeenDate();
        ps.setString(1, row.getStudentCode());
        ps.setInt(2,    position);
        ps.setInt(3,    summary.getSessionCount());
        ps.setString(4, lastSeen == null ? null : lastSeen.toString());
    }

    private void insertIdentity(PreparedStatement ps, MasterRow row) throws SQLException {
        int order = 0;
        for (Map.Entry<String, String> field : row.getIdentity().entrySet()) {
            ps.setString(1, row.getStudentCode());
            ps.setInt(2,    order++);
            ps.setString(3, field.getKey());
            ps.setString(4, field.getValue() == null ? "" : field.getValue());
            ps.addBatch();
        }
    }

    private void insertSessions(PreparedStatement ps, MasterRow row) throws SQLException {
        for (SessionFact fact : row.getSummary().getSessionFacts()) {
            ps.setString(1, row.getStudentCode());
            ps.setString(2, fact.getDate().toString());
            ps.setString(3, fact.getValue());
            ps.addBatch();
        }
    }

    private void insertGoals(PreparedStatement ps, MasterRow row) throws SQLException {
        for (Map.Entry<String, GoalObservation> goal : row.getSummary().getGoals().entrySet()) {
            ps.setString(1, row.getStudentCode());
            ps.setString(2, goal.getKey());
            ps.setString(3, goal.getValue().getStatus().name());
            ps.setString(4, goal.getValue().getObservedOn().toString());
            ps.addBatch();
        }
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    private static LocalDate parseDate(String value) throws SQLException {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException | NullPointerException ex) {
            throw new SQLException("Corrupt date in store: '" + value + "'", ex);
        }
    }

    private static GoalStatus parseStatus(String value) throws SQLException {
        return GoalStatus.fromToken(value)
                .orElseThrow(() -> new SQLException("Corrupt goal status in store: '" + value + "'"));
    }
}
