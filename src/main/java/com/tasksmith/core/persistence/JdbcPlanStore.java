package com.tasksmith.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasksmith.core.events.EventLevel;
import com.tasksmith.core.events.RunEvent;
import com.tasksmith.core.events.RunEventType;
import com.tasksmith.core.model.Plan;
import com.tasksmith.core.model.PlanProgressEntry;
import com.tasksmith.core.model.PlanStatus;
import com.tasksmith.core.model.Run;
import com.tasksmith.core.model.RunFinalization;
import com.tasksmith.core.model.RunStatus;
import com.tasksmith.core.model.Task;
import com.tasksmith.core.model.TaskStatus;
import com.tasksmith.core.model.TodoItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link PlanStore} backed by SQLite.
 * <p>
 * Timestamps are stored as epoch milliseconds; list-valued columns (dependencies, acceptance
 * criteria, event payloads, todos) as JSON text. Tables are created by {@link #createTables()}.
 * <p>
 * Methods never hold more than one connection at a time, so the store works with a pool of one.
 */
public class JdbcPlanStore implements PlanStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcPlanStore.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> PAYLOAD = new TypeReference<>() {};
    private static final TypeReference<List<TodoItem>> TODO_LIST = new TypeReference<>() {};

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS plans (
                id            TEXT PRIMARY KEY,
                project_path  TEXT NOT NULL,
                summary       TEXT,
                status        TEXT NOT NULL,
                created_at_ms INTEGER NOT NULL,
                updated_at_ms INTEGER NOT NULL,
                archived_at_ms INTEGER
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tasks (
                plan_id                  TEXT NOT NULL,
                id                       TEXT NOT NULL,
                ordinal                  INTEGER NOT NULL,
                title                    TEXT NOT NULL,
                description              TEXT,
                dependencies_json        TEXT NOT NULL DEFAULT '[]',
                acceptance_criteria_json TEXT NOT NULL DEFAULT '[]',
                technical_notes          TEXT,
                status                   TEXT NOT NULL,
                created_at_ms            INTEGER NOT NULL,
                updated_at_ms            INTEGER NOT NULL,
                completed_at_ms          INTEGER,
                PRIMARY KEY (plan_id, id),
                FOREIGN KEY (plan_id) REFERENCES plans(id)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS runs (
                id            TEXT PRIMARY KEY,
                plan_id       TEXT NOT NULL,
                task_id       TEXT NOT NULL,
                status        TEXT NOT NULL,
                session_id    TEXT,
                retry_count   INTEGER NOT NULL DEFAULT 0,
                started_at_ms INTEGER NOT NULL,
                ended_at_ms   INTEGER,
                duration_ms   INTEGER,
                result_text   TEXT,
                cost_usd      REAL,
                stop_reason   TEXT,
                error_text    TEXT
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_runs_plan_status ON runs (plan_id, status)",
            """
            CREATE TABLE IF NOT EXISTS run_events (
                seq          INTEGER PRIMARY KEY AUTOINCREMENT,
                id           TEXT NOT NULL UNIQUE,
                run_id       TEXT,
                plan_id      TEXT NOT NULL,
                task_id      TEXT,
                ts_ms        INTEGER NOT NULL,
                type         TEXT NOT NULL,
                level        TEXT NOT NULL,
                payload_json TEXT NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_run_events_run ON run_events (run_id, seq)",
            """
            CREATE TABLE IF NOT EXISTS todo_snapshots (
                id            INTEGER PRIMARY KEY AUTOINCREMENT,
                run_id        TEXT NOT NULL,
                todos_json    TEXT NOT NULL,
                created_at_ms INTEGER NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS plan_progress_entries (
                id            INTEGER PRIMARY KEY AUTOINCREMENT,
                plan_id       TEXT NOT NULL,
                run_id        TEXT,
                status        TEXT NOT NULL,
                entry_text    TEXT NOT NULL,
                created_at_ms INTEGER NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS app_settings (
                key           TEXT PRIMARY KEY,
                value         TEXT NOT NULL,
                updated_at_ms INTEGER NOT NULL
            )
            """
    );

    /** Columns added after the first release, with their definitions; applied to older databases. */
    private static final Map<String, String> PLAN_COLUMN_MIGRATIONS = Map.of(
            "archived_at_ms", "INTEGER");

    /** Child tables of a plan, in deletion order. */
    private static final List<String> DELETE_PLAN_SQL = List.of(
            "DELETE FROM run_events WHERE plan_id = ?",
            "DELETE FROM todo_snapshots WHERE run_id IN (SELECT id FROM runs WHERE plan_id = ?)",
            "DELETE FROM plan_progress_entries WHERE plan_id = ?",
            "DELETE FROM runs WHERE plan_id = ?",
            "DELETE FROM tasks WHERE plan_id = ?");

    private static final String INSERT_PLAN_SQL = """
            INSERT INTO plans (id, project_path, summary, status, created_at_ms, updated_at_ms, archived_at_ms)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_PLANS_SQL = """
            SELECT * FROM plans
             WHERE (? IS NULL OR (archived_at_ms IS NOT NULL) = ?)
               AND (? IS NULL OR summary LIKE ? ESCAPE '\\' OR project_path LIKE ? ESCAPE '\\')
             ORDER BY created_at_ms DESC
            """;

    private static final String INSERT_TASK_SQL = """
            INSERT INTO tasks (plan_id, id, ordinal, title, description, dependencies_json,
                               acceptance_criteria_json, technical_notes, status,
                               created_at_ms, updated_at_ms, completed_at_ms)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_TASKS_SQL = """
            SELECT * FROM tasks WHERE plan_id = ? ORDER BY ordinal ASC
            """;

    private static final String UPDATE_TASK_STATUS_SQL = """
            UPDATE tasks
               SET status = ?,
                   updated_at_ms = ?,
                   completed_at_ms = CASE WHEN ? = 'completed' THEN ? ELSE completed_at_ms END
             WHERE plan_id = ? AND id = ?
            """;

    private static final String INSERT_RUN_SQL = """
            INSERT INTO runs (id, plan_id, task_id, status, session_id, retry_count, started_at_ms)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String FINALIZE_RUN_SQL = """
            UPDATE runs
               SET status      = ?,
                   ended_at_ms = ?,
                   duration_ms = COALESCE(?, duration_ms),
                   session_id  = COALESCE(?, session_id),
                   result_text = COALESCE(?, result_text),
                   cost_usd    = COALESCE(?, cost_usd),
                   stop_reason = COALESCE(?, stop_reason),
                   error_text  = COALESCE(?, error_text)
             WHERE id = ? AND status = 'in_progress'
            """;

    private static final String INSERT_EVENT_SQL = """
            INSERT INTO run_events (id, run_id, plan_id, task_id, ts_ms, type, level, payload_json)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_EVENTS_SQL = """
            SELECT * FROM run_events
             WHERE run_id = ?
               AND seq > COALESCE((SELECT seq FROM run_events WHERE id = ? AND run_id = ?), 0)
             ORDER BY seq ASC
             LIMIT ?
            """;

    private static final String UPSERT_SETTING_SQL = """
            INSERT INTO app_settings (key, value, updated_at_ms) VALUES (?, ?, ?)
            ON CONFLICT (key) DO UPDATE SET value = excluded.value, updated_at_ms = excluded.updated_at_ms
            """;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcPlanStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");
    }

    /**
     * Creates all tables and indexes if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String ddl : SCHEMA) {
                stmt.execute(ddl);
            }
            migratePlanColumns(conn, stmt);
            log.info("Plan store schema ensured ({} statements)", SCHEMA.size());
        } catch (SQLException e) {
            throw new PlanStoreException("Failed to create plan store schema", e);
        }
    }

    private static void migratePlanColumns(Connection conn, Statement stmt) throws SQLException {
        var existing = new HashSet<String>();
        try (ResultSet rs = conn.getMetaData().getColumns(null, null, "plans", null)) {
            while (rs.next()) {
                existing.add(rs.getString("COLUMN_NAME"));
            }
        }
        for (Map.Entry<String, String> column : PLAN_COLUMN_MIGRATIONS.entrySet()) {
            if (!existing.contains(column.getKey())) {
                stmt.execute("ALTER TABLE plans ADD COLUMN " + column.getKey() + " " + column.getValue());
                log.info("Added column plans.{}", column.getKey());
            }
        }
    }

    // -- plans and tasks ------------------------------------------------------

    @Override
    public void createPlan(Plan plan) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_PLAN_SQL)) {
                    stmt.setString(1, plan.id());
                    stmt.setString(2, plan.projectPath());
                    stmt.setString(3, plan.summary());
                    stmt.setString(4, plan.status().value());
                    stmt.setLong(5, plan.createdAt().toEpochMilli());
                    stmt.setLong(6, plan.updatedAt().toEpochMilli());
                    setInstant(stmt, 7, plan.archivedAt());
                    stmt.executeUpdate();
                }
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_TASK_SQL)) {
                    for (Task task : plan.tasks()) {
                        stmt.setString(1, plan.id());
                        stmt.setString(2, task.id());
                        stmt.setInt(3, task.ordinal());
                        stmt.setString(4, task.title());
                        stmt.setString(5, task.description());
                        stmt.setString(6, toJson(task.dependencies()));
                        stmt.setString(7, toJson(task.acceptanceCriteria()));
                        stmt.setString(8, task.technicalNotes());
                        stmt.setString(9, task.status().value());
                        stmt.setLong(10, task.createdAt().toEpochMilli());
                        stmt.setLong(11, task.updatedAt().toEpochMilli());
                        setInstant(stmt, 12, task.completedAt());
                        stmt.addBatch();
                    }
                    stmt.executeBatch();
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
            log.debug("Created plan {} with {} tasks", plan.id(), plan.tasks().size());
        } catch (SQLException e) {
            throw new PlanStoreException("Failed to create plan " + plan.id(), e);
        }
    }

    @Override
    public Optional<Plan> findPlan(String planId) {
        Optional<Plan> plan = queryOne("SELECT * FROM plans WHERE id = ?", this::mapPlan, planId);
        return plan.map(p -> p.withTasks(listTasks(planId)));
    }

    @Override
    public List<Plan> listPlans(PlanFilter filter) {
        Integer archived = filter.archived() == null ? null : filter.archived() ? 1 : 0;
        String pattern = filter.search() == null ? null : "%" + escapeLike(filter.search()) + "%";
        List<Plan> plans = queryList(SELECT_PLANS_SQL, this::mapPlan,
                archived, archived, pattern, pattern, pattern);
        return plans.stream().map(p -> p.withTasks(listTasks(p.id()))).toList();
    }

    private static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    @Override
    public void updatePlanStatus(String planId, PlanStatus status) {
        update("UPDATE plans SET status = ?, updated_at_ms = ? WHERE id = ?",
                status.value(), Instant.now().toEpochMilli(), planId);
    }

    @Override
    public boolean setPlanArchived(String planId, Instant archivedAt) {
        int rows = update("UPDATE plans SET archived_at_ms = ?, updated_at_ms = ? WHERE id = ?",
                archivedAt == null ? null : archivedAt.toEpochMilli(), Instant.now().toEpochMilli(), planId);
        return rows > 0;
    }

    @Override
    public boolean deletePlan(String planId) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                for (String sql : DELETE_PLAN_SQL) {
                    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                        stmt.setString(1, planId);
                        stmt.executeUpdate();
                    }
                }
                int rows;
                try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM plans WHERE id = ?")) {
                    stmt.setString(1, planId);
                    rows = stmt.executeUpdate();
                }
                conn.commit();
                if (rows > 0) {
                    log.info("Deleted plan {} and its history", planId);
                }
                return rows > 0;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new PlanStoreException("Failed to delete plan " + planId, e);
        }
    }

    @Override
    public List<Task> listTasks(String planId) {
        return queryList(SELECT_TASKS_SQL, this::mapTask, planId);
    }

    @Override
    public Optional<Task> findTask(String planId, String taskId) {
        return queryOne("SELECT * FROM tasks WHERE plan_id = ? AND id = ?", this::mapTask, planId, taskId);
    }

    @Override
    public void updateTaskStatus(String planId, String taskId, TaskStatus status) {
        long now = Instant.now().toEpochMilli();
        update(UPDATE_TASK_STATUS_SQL, status.value(), now, status.value(), now, planId, taskId);
    }

    // -- runs -----------------------------------------------------------------

    @Override
    public void createRun(Run run) {
        update(INSERT_RUN_SQL, run.id(), run.planId(), run.taskId(), run.status().value(),
                run.sessionId(), run.retryCount(), run.startedAt().toEpochMilli());
    }

    @Override
    public void updateRunSession(String runId, String sessionId) {
        update("UPDATE runs SET session_id = ? WHERE id = ?", sessionId, runId);
    }

    @Override
    public boolean finalizeRun(RunFinalization f) {
        int rows = update(FINALIZE_RUN_SQL,
                f.status().value(),
                f.endedAt().toEpochMilli(),
                f.durationMs(),
                f.sessionId(),
                f.resultText(),
                f.costUsd(),
                f.stopReason(),
                f.errorText(),
                f.runId());
        return rows > 0;
    }

    @Override
    public Optional<Run> findRun(String runId) {
        return queryOne("SELECT * FROM runs WHERE id = ?", this::mapRun, runId);
    }

    @Override
    public List<Run> listRuns(String planId) {
        return queryList("SELECT * FROM runs WHERE plan_id = ? ORDER BY started_at_ms DESC, retry_count DESC",
                this::mapRun, planId);
    }

    @Override
    public List<Run> findInProgressRuns(String planId) {
        return queryList("SELECT * FROM runs WHERE plan_id = ? AND status = 'in_progress'", this::mapRun, planId);
    }

    @Override
    public Optional<Run> findInProgressRunForTask(String planId, String taskId) {
        return queryOne("SELECT * FROM runs WHERE plan_id = ? AND task_id = ? AND status = 'in_progress' LIMIT 1",
                this::mapRun, planId, taskId);
    }

    @Override
    public List<Run> findStaleInProgressRuns(Instant startedBefore) {
        return queryList("SELECT * FROM runs WHERE status = 'in_progress' AND started_at_ms < ?",
                this::mapRun, startedBefore.toEpochMilli());
    }

    @Override
    public Optional<Run> findLatestFailedRun(String planId, String taskId) {
        return queryOne("""
                SELECT * FROM runs
                 WHERE plan_id = ? AND task_id = ? AND status = 'failed'
                 ORDER BY started_at_ms DESC, retry_count DESC
                 LIMIT 1
                """, this::mapRun, planId, taskId);
    }

    // -- history --------------------------------------------------------------

    @Override
    public void appendRunEvent(RunEvent event) {
        update(INSERT_EVENT_SQL, event.id(), event.runId(), event.planId(), event.taskId(),
                event.ts().toEpochMilli(), event.type().value(), event.level().value(),
                toJson(event.payload()));
    }

    @Override
    public RunEventPage listRunEvents(String runId, String afterId, int limit) {
        int pageSize = PlanStore.clampEventLimit(limit);
        List<RunEvent> fetched = queryList(SELECT_EVENTS_SQL, this::mapEvent, runId, afterId, runId, pageSize + 1);
        return RunEventPage.of(fetched, pageSize);
    }

    @Override
    public void addTodoSnapshot(String runId, List<TodoItem> todos) {
        update("INSERT INTO todo_snapshots (run_id, todos_json, created_at_ms) VALUES (?, ?, ?)",
                runId, toJson(todos), Instant.now().toEpochMilli());
    }

    @Override
    public List<TodoItem> latestTodoSnapshot(String runId) {
        return queryOne("SELECT todos_json FROM todo_snapshots WHERE run_id = ? ORDER BY id DESC LIMIT 1",
                rs -> fromJson(rs.getString("todos_json"), TODO_LIST), runId)
                .orElse(List.of());
    }

    @Override
    public void appendProgressEntry(String planId, String runId, RunStatus status, String entryText) {
        update("""
                INSERT INTO plan_progress_entries (plan_id, run_id, status, entry_text, created_at_ms)
                VALUES (?, ?, ?, ?, ?)
                """, planId, runId, status.value(), PlanProgressEntry.truncate(entryText),
                Instant.now().toEpochMilli());
    }

    @Override
    public List<PlanProgressEntry> listProgressEntries(String planId, int limit) {
        return queryList("SELECT * FROM plan_progress_entries WHERE plan_id = ? ORDER BY id DESC LIMIT ?",
                rs -> new PlanProgressEntry(
                        rs.getLong("id"),
                        rs.getString("plan_id"),
                        rs.getString("run_id"),
                        RunStatus.fromValue(rs.getString("status")),
                        rs.getString("entry_text"),
                        Instant.ofEpochMilli(rs.getLong("created_at_ms"))),
                planId, PlanStore.clampProgressLimit(limit));
    }

    // -- settings -------------------------------------------------------------

    @Override
    public Optional<String> getSetting(String key) {
        return queryOne("SELECT value FROM app_settings WHERE key = ?", rs -> rs.getString("value"), key);
    }

    @Override
    public void putSetting(String key, String value) {
        update(UPSERT_SETTING_SQL, key, value, Instant.now().toEpochMilli());
    }

    @Override
    public Map<String, String> listSettings() {
        var settings = new LinkedHashMap<String, String>();
        for (String[] row : queryList("SELECT key, value FROM app_settings ORDER BY key",
                rs -> new String[]{rs.getString("key"), rs.getString("value")})) {
            settings.put(row[0], row[1]);
        }
        return settings;
    }

    // -- row mapping ----------------------------------------------------------

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private Plan mapPlan(ResultSet rs) throws SQLException {
        return new Plan(
                rs.getString("id"),
                rs.getString("project_path"),
                rs.getString("summary"),
                PlanStatus.fromValue(rs.getString("status")),
                Instant.ofEpochMilli(rs.getLong("created_at_ms")),
                Instant.ofEpochMilli(rs.getLong("updated_at_ms")),
                getInstant(rs, "archived_at_ms"),
                List.of());
    }

    private Task mapTask(ResultSet rs) throws SQLException {
        return new Task(
                rs.getString("id"),
                rs.getString("plan_id"),
                rs.getInt("ordinal"),
                rs.getString("title"),
                rs.getString("description"),
                fromJson(rs.getString("dependencies_json"), STRING_LIST),
                fromJson(rs.getString("acceptance_criteria_json"), STRING_LIST),
                rs.getString("technical_notes"),
                TaskStatus.fromValue(rs.getString("status")),
                Instant.ofEpochMilli(rs.getLong("created_at_ms")),
                Instant.ofEpochMilli(rs.getLong("updated_at_ms")),
                getInstant(rs, "completed_at_ms"));
    }

    private Run mapRun(ResultSet rs) throws SQLException {
        return new Run(
                rs.getString("id"),
                rs.getString("plan_id"),
                rs.getString("task_id"),
                RunStatus.fromValue(rs.getString("status")),
                rs.getString("session_id"),
                rs.getInt("retry_count"),
                Instant.ofEpochMilli(rs.getLong("started_at_ms")),
                getInstant(rs, "ended_at_ms"),
                getLong(rs, "duration_ms"),
                rs.getString("result_text"),
                getDouble(rs, "cost_usd"),
                rs.getString("stop_reason"),
                rs.getString("error_text"));
    }

    private RunEvent mapEvent(ResultSet rs) throws SQLException {
        return new RunEvent(
                rs.getString("id"),
                Instant.ofEpochMilli(rs.getLong("ts_ms")),
                rs.getString("run_id"),
                rs.getString("plan_id"),
                rs.getString("task_id"),
                RunEventType.fromValue(rs.getString("type")),
                EventLevel.fromValue(rs.getString("level")),
                fromJson(rs.getString("payload_json"), PAYLOAD));
    }

    // -- JDBC helpers ---------------------------------------------------------

    private int update(String sql, Object... params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new PlanStoreException("Update failed: " + firstLine(sql), e);
        }
    }

    private <T> List<T> queryList(String sql, RowMapper<T> mapper, Object... params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            List<T> results = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new PlanStoreException("Query failed: " + firstLine(sql), e);
        }
    }

    private <T> Optional<T> queryOne(String sql, RowMapper<T> mapper, Object... params) {
        List<T> results = queryList(sql, mapper, params);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private static void bind(PreparedStatement stmt, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            Object value = params[i];
            int index = i + 1;
            if (value == null) {
                stmt.setNull(index, Types.NULL);
            } else if (value instanceof String s) {
                stmt.setString(index, s);
            } else if (value instanceof Integer n) {
                stmt.setInt(index, n);
            } else if (value instanceof Long n) {
                stmt.setLong(index, n);
            } else if (value instanceof Double d) {
                stmt.setDouble(index, d);
            } else {
                stmt.setObject(index, value);
            }
        }
    }

    private static void setInstant(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setLong(index, value.toEpochMilli());
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    private static Long getLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Double getDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize value for storage", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) throws SQLException {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt JSON column: " + e.getOriginalMessage(), e);
        }
    }

    private static String firstLine(String sql) {
        return sql.strip().lines().findFirst().orElse(sql);
    }
}
