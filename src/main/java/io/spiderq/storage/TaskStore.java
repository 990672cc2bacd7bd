package io.spiderq.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.spiderq.model.JobDescription;
import io.spiderq.model.LogEntry;
import io.spiderq.model.QueueItem;
import io.spiderq.model.QueueItemStatus;
import io.spiderq.model.QueueStats;
import io.spiderq.model.TaskStatus;
import io.spiderq.model.TaskView;
import io.spiderq.model.WorkerEvent;
import io.spiderq.model.WorkerEventType;
import io.spiderq.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for tasks, their logs and the job queue. Every call opens its own connection; multi-statement
 * writes run in one transaction.
 */
public final class TaskStore {
    public static final String INTERRUPTED_MESSAGE = "interrupted";

    private static final String TASK_COLUMNS =
            "id,task_type,params,status,started_at_ms,completed_at_ms,error_message,result_count,config";
    private static final String LOG_COLUMNS = "id,task_id,type,level,message,timestamp_ms,metadata";
    private static final String QUEUE_COLUMNS =
            "id,task_config,priority,status,created_at_ms,started_at_ms,completed_at_ms,task_id,error_message";
    private static final String QUEUE_ORDER = " ORDER BY priority DESC, created_at_ms ASC, id ASC";

    private final Database database;
    private final Clock clock;

    public TaskStore(Database database) {
        this(database, Clock.systemUTC());
    }

    public TaskStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    // ---- tasks ----

    public long createTask(String taskType, JsonNode params, JsonNode configSnapshot) {
        String sql = "INSERT INTO tasks(task_type,params,status,started_at_ms,result_count,config) VALUES(?,?,?,?,0,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, taskType);
            ps.setString(2, params == null ? "{}" : Jsons.toCompactJson(params));
            ps.setString(3, TaskStatus.RUNNING.dbValue());
            ps.setLong(4, clock.millis());
            if (configSnapshot == null || configSnapshot.isNull()) {
                ps.setNull(5, Types.VARCHAR);
            } else {
                ps.setString(5, Jsons.toCompactJson(configSnapshot));
            }
            ps.executeUpdate();
            return lastInsertId(c);
        } catch (SQLException e) {
            throw new StoreException("Failed to create task", e);
        }
    }

    /**
     * Sets the task status. Terminal statuses stamp the completion time, {@code running} clears it. A null
     * {@code resultCount} keeps the stored count.
     */
    public boolean updateTask(long taskId, TaskStatus status, String errorMessage, Integer resultCount) {
        String sql = """
                UPDATE tasks
                   SET status=?, completed_at_ms=?, error_message=?, result_count=COALESCE(?, result_count)
                 WHERE id=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, status.dbValue());
            if (status.isTerminal()) {
                ps.setLong(2, clock.millis());
            } else {
                ps.setNull(2, Types.BIGINT);
            }
            ps.setString(3, errorMessage);
            if (resultCount == null) {
                ps.setNull(4, Types.INTEGER);
            } else {
                ps.setInt(4, resultCount);
            }
            ps.setLong(5, taskId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update task " + taskId, e);
        }
    }

    public Optional<TaskView> getTask(long taskId) {
        String sql = "SELECT " + TASK_COLUMNS + " FROM tasks WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(mapTask(rs));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read task " + taskId, e);
        }
    }

    public List<TaskView> getRecentTasks(int limit) {
        String sql = "SELECT " + TASK_COLUMNS + " FROM tasks ORDER BY started_at_ms DESC, id DESC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                List<TaskView> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(mapTask(rs));
                }
                return out;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to list recent tasks", e);
        }
    }

    /**
     * The running task if there is one, otherwise the most recently started task.
     */
    public Optional<TaskView> currentTask() {
        String sql = "SELECT " + TASK_COLUMNS + """
                 FROM tasks
                 ORDER BY CASE WHEN status='running' THEN 0 ELSE 1 END, started_at_ms DESC, id DESC
                 LIMIT 1
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(mapTask(rs));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read current task", e);
        }
    }

    /**
     * Removes a task and all of its logs. Queue entries that ran it keep their row but lose the reference.
     */
    public boolean deleteTask(long taskId) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement unlink = c.prepareStatement("UPDATE task_queue SET task_id=NULL WHERE task_id=?");
                 PreparedStatement logs = c.prepareStatement("DELETE FROM logs WHERE task_id=?");
                 PreparedStatement task = c.prepareStatement("DELETE FROM tasks WHERE id=?")) {
                unlink.setLong(1, taskId);
                unlink.executeUpdate();
                logs.setLong(1, taskId);
                logs.executeUpdate();
                task.setLong(1, taskId);
                int deleted = task.executeUpdate();
                c.commit();
                return deleted > 0;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to delete task " + taskId, e);
        }
    }

    /**
     * Marks tasks still {@code running} after {@code staleThreshold} as stopped. Meant for process start, before
     * any scheduling, to repair what an unclean shutdown left behind.
     */
    public int fixStuckTasks(Duration staleThreshold) {
        long now = clock.millis();
        String sql = "UPDATE tasks SET status=?, completed_at_ms=?, error_message=? WHERE status=? AND started_at_ms < ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.STOPPED.dbValue());
            ps.setLong(2, now);
            ps.setString(3, INTERRUPTED_MESSAGE);
            ps.setString(4, TaskStatus.RUNNING.dbValue());
            ps.setLong(5, now - staleThreshold.toMillis());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to fix stuck tasks", e);
        }
    }

    // ---- logs ----

    public long addLog(long taskId, WorkerEvent event) {
        String sql = "INSERT INTO logs(task_id,type,level,message,timestamp_ms,metadata) VALUES(?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, taskId);
            ps.setString(2, event.type().wireValue());
            ps.setString(3, event.level());
            ps.setString(4, logMessage(event));
            ps.setLong(5, clock.millis());
            ObjectNode metadata = logMetadata(event);
            if (metadata == null) {
                ps.setNull(6, Types.VARCHAR);
            } else {
                ps.setString(6, Jsons.toCompactJson(metadata));
            }
            ps.executeUpdate();
            return lastInsertId(c);
        } catch (SQLException e) {
            throw new StoreException("Failed to add log for task " + taskId, e);
        }
    }

    public List<LogEntry> getTaskLogs(long taskId) {
        String sql = "SELECT " + LOG_COLUMNS + " FROM logs WHERE task_id=? ORDER BY timestamp_ms ASC, id ASC";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                List<LogEntry> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(new LogEntry(
                            rs.getLong("id"),
                            rs.getLong("task_id"),
                            rs.getString("type"),
                            rs.getString("level"),
                            rs.getString("message"),
                            rs.getLong("timestamp_ms"),
                            rs.getString("metadata")
                    ));
                }
                return out;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read logs for task " + taskId, e);
        }
    }

    /**
     * Retention sweep: drops logs older than {@code cutoffMs}, then terminal tasks started before it that have no
     * logs left and no live queue entry pointing at them.
     */
    public PurgeResult purgeHistoryOlderThan(long cutoffMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement logs = c.prepareStatement("DELETE FROM logs WHERE timestamp_ms < ?");
                 PreparedStatement unlink = c.prepareStatement("""
                         UPDATE task_queue SET task_id=NULL
                          WHERE status IN ('completed','failed')
                            AND task_id IN (SELECT id FROM tasks WHERE status<>'running' AND started_at_ms < ?)
                         """);
                 PreparedStatement tasks = c.prepareStatement("""
                         DELETE FROM tasks
                          WHERE status<>'running'
                            AND started_at_ms < ?
                            AND NOT EXISTS (SELECT 1 FROM logs l WHERE l.task_id=tasks.id)
                            AND NOT EXISTS (SELECT 1 FROM task_queue q WHERE q.task_id=tasks.id)
                         """)) {
                logs.setLong(1, cutoffMs);
                int logsDeleted = logs.executeUpdate();
                unlink.setLong(1, cutoffMs);
                unlink.executeUpdate();
                tasks.setLong(1, cutoffMs);
                int tasksDeleted = tasks.executeUpdate();
                c.commit();
                return new PurgeResult(logsDeleted, tasksDeleted);
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to purge history", e);
        }
    }

    // ---- queue ----

    public long enqueue(JobDescription job, int priority) {
        String sql = "INSERT INTO task_queue(task_config,priority,status,created_at_ms) VALUES(?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, Jsons.toCompactJson(job));
            ps.setInt(2, priority);
            ps.setString(3, QueueItemStatus.PENDING.dbValue());
            ps.setLong(4, clock.millis());
            ps.executeUpdate();
            return lastInsertId(c);
        } catch (SQLException e) {
            throw new StoreException("Failed to enqueue job", e);
        }
    }

    public long enqueue(JobDescription job) {
        return enqueue(job, 0);
    }

    public Optional<QueueItem> nextPending() {
        String sql = "SELECT " + QUEUE_COLUMNS + " FROM task_queue WHERE status=?" + QUEUE_ORDER + " LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, QueueItemStatus.PENDING.dbValue());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(mapQueueItem(rs));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read next pending queue item", e);
        }
    }

    public Optional<QueueItem> getQueueItem(long queueId) {
        String sql = "SELECT " + QUEUE_COLUMNS + " FROM task_queue WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, queueId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(mapQueueItem(rs));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read queue item " + queueId, e);
        }
    }

    /**
     * Moves a queue entry to {@code status}. Entering {@code running} stamps the start time and only applies to a
     * pending row while no other row is running; entering {@code completed}/{@code failed} stamps the completion
     * time. A null {@code taskId} keeps the bound task.
     *
     * @return whether the row changed
     */
    public boolean setQueueStatus(long queueId, QueueItemStatus status, Long taskId, String errorMessage) {
        long now = clock.millis();
        try (Connection c = database.openConnection()) {
            if (status == QueueItemStatus.RUNNING) {
                try (PreparedStatement ps = c.prepareStatement("""
                        UPDATE task_queue
                           SET status='running', started_at_ms=?, completed_at_ms=NULL,
                               task_id=COALESCE(?, task_id), error_message=NULL
                         WHERE id=? AND status='pending'
                           AND NOT EXISTS (SELECT 1 FROM task_queue o WHERE o.status='running' AND o.id<>?)
                        """)) {
                    ps.setLong(1, now);
                    setNullableLong(ps, 2, taskId);
                    ps.setLong(3, queueId);
                    ps.setLong(4, queueId);
                    return ps.executeUpdate() > 0;
                }
            }
            if (status == QueueItemStatus.PENDING) {
                return revertToPending(c, queueId);
            }
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE task_queue
                       SET status=?, completed_at_ms=?, task_id=COALESCE(?, task_id), error_message=?
                     WHERE id=?
                    """)) {
                ps.setString(1, status.dbValue());
                ps.setLong(2, now);
                setNullableLong(ps, 3, taskId);
                ps.setString(4, errorMessage);
                ps.setLong(5, queueId);
                return ps.executeUpdate() > 0;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to set queue item " + queueId + " to " + status.dbValue(), e);
        }
    }

    /**
     * Binds the task created for a running entry. The bound task never changes once set.
     */
    public boolean bindQueueTask(long queueId, long taskId) {
        String sql = "UPDATE task_queue SET task_id=? WHERE id=? AND status='running' AND task_id IS NULL";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, taskId);
            ps.setLong(2, queueId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to bind task to queue item " + queueId, e);
        }
    }

    /**
     * Returns a running entry to pending so it can be picked again, dropping its task binding.
     */
    public boolean revertToPending(long queueId) {
        try (Connection c = database.openConnection()) {
            return revertToPending(c, queueId);
        } catch (SQLException e) {
            throw new StoreException("Failed to revert queue item " + queueId, e);
        }
    }

    private boolean revertToPending(Connection c, long queueId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE task_queue
                   SET status='pending', started_at_ms=NULL, completed_at_ms=NULL, task_id=NULL, error_message=NULL
                 WHERE id=?
                """)) {
            ps.setLong(1, queueId);
            return ps.executeUpdate() > 0;
        }
    }

    /**
     * Queue entries left {@code running} by a dead process go back to pending; their tasks, if still running, are
     * stopped as interrupted.
     */
    public int recoverOrphanedQueueItems() {
        long now = clock.millis();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement tasks = c.prepareStatement("""
                    UPDATE tasks SET status='stopped', completed_at_ms=?, error_message=?
                     WHERE status='running'
                       AND id IN (SELECT task_id FROM task_queue WHERE status='running' AND task_id IS NOT NULL)
                    """);
                 PreparedStatement queue = c.prepareStatement("""
                         UPDATE task_queue
                            SET status='pending', started_at_ms=NULL, completed_at_ms=NULL, task_id=NULL, error_message=NULL
                          WHERE status='running'
                         """)) {
                tasks.setLong(1, now);
                tasks.setString(2, INTERRUPTED_MESSAGE);
                tasks.executeUpdate();
                int recovered = queue.executeUpdate();
                c.commit();
                return recovered;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to recover orphaned queue items", e);
        }
    }

    /**
     * Deletes an entry unless it is running.
     *
     * @return whether a row was deleted
     */
    public boolean removeQueueItem(long queueId) {
        String sql = "DELETE FROM task_queue WHERE id=? AND status<>'running'";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, queueId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to remove queue item " + queueId, e);
        }
    }

    public boolean setPriority(long queueId, int priority) {
        String sql = "UPDATE task_queue SET priority=? WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, priority);
            ps.setLong(2, queueId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to set priority of queue item " + queueId, e);
        }
    }

    public int clearTerminal() {
        String sql = "DELETE FROM task_queue WHERE status IN ('completed','failed')";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to clear finished queue items", e);
        }
    }

    public List<QueueItem> listQueueItems(QueueItemStatus status) {
        String sql = "SELECT " + QUEUE_COLUMNS + " FROM task_queue"
                + (status == null ? "" : " WHERE status=?") + QUEUE_ORDER;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (status != null) {
                ps.setString(1, status.dbValue());
            }
            try (ResultSet rs = ps.executeQuery()) {
                List<QueueItem> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(mapQueueItem(rs));
                }
                return out;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to list queue items", e);
        }
    }

    public QueueStats queueStats() {
        String sql = "SELECT status, COUNT(1) AS cnt FROM task_queue GROUP BY status";
        try (Connection c = database.openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            int pending = 0;
            int running = 0;
            int completed = 0;
            int failed = 0;
            int total = 0;
            while (rs.next()) {
                int count = rs.getInt("cnt");
                total += count;
                switch (rs.getString("status")) {
                    case "pending" -> pending = count;
                    case "running" -> running = count;
                    case "completed" -> completed = count;
                    case "failed" -> failed = count;
                    default -> {
                    }
                }
            }
            return new QueueStats(pending, running, completed, failed, total);
        } catch (SQLException e) {
            throw new StoreException("Failed to load queue stats", e);
        }
    }

    // ---- mapping ----

    private static TaskView mapTask(ResultSet rs) throws SQLException {
        long completedAt = rs.getLong("completed_at_ms");
        Long completedAtMs = rs.wasNull() ? null : completedAt;
        return new TaskView(
                rs.getLong("id"),
                rs.getString("task_type"),
                rs.getString("params"),
                TaskStatus.fromDb(rs.getString("status")),
                rs.getLong("started_at_ms"),
                completedAtMs,
                rs.getString("error_message"),
                rs.getInt("result_count"),
                rs.getString("config")
        );
    }

    private static QueueItem mapQueueItem(ResultSet rs) throws SQLException {
        return new QueueItem(
                rs.getLong("id"),
                rs.getString("task_config"),
                rs.getInt("priority"),
                QueueItemStatus.fromString(rs.getString("status")),
                rs.getLong("created_at_ms"),
                nullableLong(rs, "started_at_ms"),
                nullableLong(rs, "completed_at_ms"),
                nullableLong(rs, "task_id"),
                rs.getString("error_message")
        );
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value);
        }
    }

    private static long lastInsertId(Connection c) throws SQLException {
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) {
                throw new SQLException("last_insert_rowid() returned no row");
            }
            return rs.getLong(1);
        }
    }

    static String logMessage(WorkerEvent event) {
        if (event.message() != null && !event.message().isBlank()) {
            return event.message();
        }
        WorkerEventType type = event.type();
        if (type == WorkerEventType.PROGRESS) {
            String counters = (event.current() == null ? "?" : event.current()) + "/"
                    + (event.total() == null ? "?" : event.total());
            return event.title() == null ? counters : counters + " " + event.title();
        }
        if (type == WorkerEventType.DONE) {
            return "done, count=" + (event.count() == null ? 0 : event.count());
        }
        if (type == WorkerEventType.MEDIA) {
            return "media, files=" + (event.files() == null ? 0 : event.files().size());
        }
        return type.wireValue();
    }

    /**
     * Progress counters go into the metadata column; completion keeps its count and files.
     */
    static ObjectNode logMetadata(WorkerEvent event) {
        if (event.type() == WorkerEventType.PROGRESS) {
            ObjectNode node = Jsons.mapper().createObjectNode();
            if (event.current() != null) node.put("current", event.current());
            if (event.total() != null) node.put("total", event.total());
            if (event.title() != null) node.put("title", event.title());
            return node;
        }
        if (event.type() == WorkerEventType.DONE || event.type() == WorkerEventType.MEDIA) {
            ObjectNode node = Jsons.mapper().createObjectNode();
            if (event.count() != null) node.put("count", event.count());
            if (event.files() != null) {
                node.set("files", Jsons.mapper().valueToTree(event.files()));
            }
            return node.isEmpty() ? null : node;
        }
        if (event.code() != null) {
            ObjectNode node = Jsons.mapper().createObjectNode();
            node.put("code", event.code());
            if (event.exitCode() != null) node.put("exitCode", event.exitCode());
            return node;
        }
        return null;
    }

    public record PurgeResult(int logsDeleted, int tasksDeleted) {
    }
}
