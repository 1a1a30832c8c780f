package reminders.dispatcher.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reminders.dispatcher.model.Cadence;
import reminders.dispatcher.model.Priority;
import reminders.dispatcher.model.Task;
import reminders.dispatcher.model.Visibility;
import reminders.dispatcher.repository.RepositoryException;
import reminders.dispatcher.repository.TaskRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of TaskRepository.
 * Notification bookkeeping is a single conditional UPDATE so concurrent writers
 * cannot lose a recorded notification.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Task task) {
        String sql = """
                    INSERT INTO tasks (id, name, description, priority, trigger_at, cadence, sent_once,
                                       last_notified_at, recipients, visibility, created_by, updated_by,
                                       created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = prepare(conn, sql)) {

            ps.setString(1, task.id());
            ps.setString(2, task.name());
            ps.setString(3, task.description());
            ps.setString(4, task.priority().name());
            setTimestamp(ps, 5, task.triggerAt());
            ps.setString(6, task.cadence().name());
            ps.setBoolean(7, task.sentOnce());
            setTimestamp(ps, 8, task.lastNotifiedAt());
            ps.setString(9, task.recipients());
            ps.setString(10, task.visibility().name());
            ps.setString(11, task.createdBy());
            ps.setString(12, task.updatedBy());
            setTimestamp(ps, 13, task.createdAt() != null ? task.createdAt() : Instant.now());
            setTimestamp(ps, 14, task.updatedAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw translate("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = prepare(conn, sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw translate("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<Task> findAll() {
        String sql = "SELECT * FROM tasks ORDER BY trigger_at ASC, created_at DESC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = prepare(conn, sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw translate("Failed to list tasks", e);
        }
    }

    /**
     * Write the author-editable columns of {@code task}.
     * <p>
     * Notification bookkeeping is never taken from the caller: {@code last_notified_at}
     * stays whatever the row holds, and the downgrade ratchet is evaluated against the
     * row's current cadence and notification state, so a notification recorded while
     * the edit was in progress survives it.
     */
    @Override
    public boolean update(Task task) {
        String sql = """
                    UPDATE tasks
                    SET name = ?, description = ?, priority = ?, trigger_at = ?, cadence = ?,
                        sent_once = CASE
                            WHEN CAST(? AS VARCHAR(10)) = 'NONE' AND cadence <> 'NONE' AND last_notified_at IS NOT NULL THEN TRUE
                            ELSE sent_once
                        END,
                        recipients = ?, visibility = ?, updated_by = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = prepare(conn, sql)) {

            ps.setString(1, task.name());
            ps.setString(2, task.description());
            ps.setString(3, task.priority().name());
            setTimestamp(ps, 4, task.triggerAt());
            ps.setString(5, task.cadence().name());
            ps.setString(6, task.cadence().name());
            ps.setString(7, task.recipients());
            ps.setString(8, task.visibility().name());
            ps.setString(9, task.updatedBy());
            setTimestamp(ps, 10, task.updatedAt());
            ps.setString(11, task.id());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw translate("Failed to update task: " + task.id(), e);
        }
    }

    @Override
    public boolean delete(String taskId) {
        String sql = "DELETE FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = prepare(conn, sql)) {

            ps.setString(1, taskId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw translate("Failed to delete task: " + taskId, e);
        }
    }

    @Override
    public int count() {
        String sql = "SELECT COUNT(*) FROM tasks";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = prepare(conn, sql);
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw translate("Failed to count tasks", e);
        }
    }

    @Override
    public List<Task> listDueCandidates(Instant now) {
        String sql = """
                    SELECT * FROM tasks
                    WHERE trigger_at <= ?
                      AND (cadence <> 'NONE' OR sent_once = FALSE)
                    ORDER BY trigger_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = prepare(conn, sql)) {

            setTimestamp(ps, 1, now);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw translate("Failed to list due candidates", e);
        }
    }

    @Override
    public boolean recordNotification(String taskId, Instant notifiedAt) {
        String sql = """
                    UPDATE tasks
                    SET last_notified_at = ?,
                        sent_once = CASE WHEN cadence = 'NONE' THEN TRUE ELSE sent_once END
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = prepare(conn, sql)) {

            setTimestamp(ps, 1, notifiedAt);
            ps.setString(2, taskId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Recorded notification of task {} at {}", taskId, notifiedAt);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw translate("Failed to record notification for task: " + taskId, e);
        }
    }

    // Helper methods

    private PreparedStatement prepare(Connection conn, String sql) throws SQLException {
        PreparedStatement ps = conn.prepareStatement(sql);
        ps.setQueryTimeout(db.queryTimeoutSeconds());
        return ps;
    }

    /**
     * Classify a driver failure. Connection problems and timeouts are transient,
     * everything else (constraint, syntax, data) is permanent.
     */
    static RepositoryException translate(String message, SQLException e) {
        String state = e.getSQLState();
        boolean transientFailure = e instanceof SQLTransientException
                || e instanceof SQLRecoverableException
                || (state != null && state.startsWith("08"));
        return transientFailure
                ? RepositoryException.transientFailure(message, e)
                : RepositoryException.permanentFailure(message, e);
    }

    /**
     * Decode every row of a listing. A row that cannot be decoded is logged and left
     * out so that one corrupt task does not hide all the others.
     */
    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                try {
                    results.add(mapRow(rs));
                } catch (SQLDataException e) {
                    log.error("Skipping undecodable task row {}: {}", rs.getString("id"), e.getCause().getMessage());
                }
            }
        }
        return results;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        try {
            return buildTask(rs);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new SQLDataException("Corrupt task row: " + rs.getString("id"), "22000", e);
        }
    }

    private Task buildTask(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .priority(Priority.valueOf(rs.getString("priority")))
                .triggerAt(toInstant(rs.getTimestamp("trigger_at")))
                .cadence(Cadence.valueOf(rs.getString("cadence")))
                .sentOnce(rs.getBoolean("sent_once"))
                .lastNotifiedAt(toInstant(rs.getTimestamp("last_notified_at")))
                .recipients(rs.getString("recipients"))
                .visibility(Visibility.valueOf(rs.getString("visibility")))
                .createdBy(rs.getString("created_by"))
                .updatedBy(rs.getString("updated_by"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
