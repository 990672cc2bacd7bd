package io.spiderq.runtime;

import io.spiderq.config.SpiderqConfig;
import io.spiderq.config.SpiderqSettings;
import io.spiderq.model.JobDescription;
import io.spiderq.model.LogEntry;
import io.spiderq.model.OperationResult;
import io.spiderq.model.QueueItem;
import io.spiderq.model.QueueItemStatus;
import io.spiderq.model.QueueSnapshot;
import io.spiderq.model.QueueStats;
import io.spiderq.model.TaskView;
import io.spiderq.model.ValidationResult;
import io.spiderq.observability.AuditLogger;
import io.spiderq.observability.AuditLogger.AuditEvent;
import io.spiderq.scheduler.QueueScheduler;
import io.spiderq.scheduler.StatusBroadcaster;
import io.spiderq.scheduler.StatusChannel;
import io.spiderq.storage.Database;
import io.spiderq.storage.TaskStore;
import io.spiderq.worker.ProcessWorkerLauncher;
import io.spiderq.worker.WorkerBridge;
import io.spiderq.worker.WorkerLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single owner of every engine component for one data root. Create one per process, call {@link #init()} before
 * anything else and {@link #close()} on the way out.
 */
public final class SpiderqRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SpiderqRuntime.class);

    private final SpiderqConfig config;
    private final SpiderqSettings settings;
    private final Clock clock;
    private final Database database;
    private final TaskStore taskStore;
    private final WorkerBridge workerBridge;
    private final StatusBroadcaster broadcaster;
    private final AuditLogger auditLogger;
    private final QueueScheduler scheduler;

    public SpiderqRuntime(SpiderqConfig config) {
        this(config, SpiderqSettings.load(config.settingsFile()));
    }

    public SpiderqRuntime(SpiderqConfig config, SpiderqSettings settings) {
        this(config, settings, ProcessWorkerLauncher.fromSettings(settings), Clock.systemUTC());
    }

    public SpiderqRuntime(SpiderqConfig config, SpiderqSettings settings, WorkerLauncher launcher, Clock clock) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.database = new Database(config);
        this.taskStore = new TaskStore(database, clock);
        this.workerBridge = new WorkerBridge(taskStore, launcher, settings.maxFrameBytes(), settings.validateTimeout());
        this.broadcaster = new StatusBroadcaster();
        this.auditLogger = new AuditLogger(config.auditFile(), clock);
        this.scheduler = new QueueScheduler(taskStore, workerBridge, broadcaster, auditLogger,
                settings.settleDelay(), settings.stopGrace());
    }

    /**
     * Creates the schema only. For processes that read or edit the queue next to a running scheduler.
     */
    public void open() {
        database.init();
    }

    /**
     * Creates the schema, then repairs what an unclean shutdown left behind and applies log retention. Must run
     * before the queue is started.
     */
    public RecoveryResult init() {
        database.init();
        RecoveryResult recovered = recover();
        purge(settings.logRetention());
        return recovered;
    }

    /**
     * Stops tasks stuck in {@code running} past the staleness threshold and returns orphaned running queue
     * entries to pending.
     */
    public RecoveryResult recover() {
        int stuck = taskStore.fixStuckTasks(settings.staleTaskThreshold());
        int orphaned = taskStore.recoverOrphanedQueueItems();
        if (stuck > 0 || orphaned > 0) {
            log.info("Recovered {} stuck task(s) and {} orphaned queue item(s)", stuck, orphaned);
        }
        auditLogger.log(AuditEvent.of("runtime.recover", "store", "success", null, null,
                Map.of("stuckTasks", stuck, "orphanedQueueItems", orphaned)));
        return new RecoveryResult(stuck, orphaned);
    }

    public TaskStore.PurgeResult purge(Duration retention) {
        long cutoff = clock.millis() - retention.toMillis();
        TaskStore.PurgeResult result = taskStore.purgeHistoryOlderThan(cutoff);
        if (result.logsDeleted() > 0 || result.tasksDeleted() > 0) {
            log.info("Purged {} log(s) and {} task(s) older than {}", result.logsDeleted(), result.tasksDeleted(),
                    retention);
        }
        return result;
    }

    // ---- queue ----

    public long enqueue(JobDescription job, int priority) {
        return scheduler.enqueue(job, priority);
    }

    public OperationResult start() {
        return scheduler.start();
    }

    public OperationResult stop() {
        return scheduler.stop();
    }

    public boolean remove(long queueId) {
        return scheduler.remove(queueId);
    }

    public boolean setPriority(long queueId, int priority) {
        return scheduler.setPriority(queueId, priority);
    }

    public int clearCompleted() {
        return scheduler.clearCompleted();
    }

    public List<QueueItem> listItems(QueueItemStatus status) {
        return scheduler.listItems(status);
    }

    public QueueStats stats() {
        return scheduler.stats();
    }

    public QueueSnapshot snapshot() {
        return scheduler.snapshot();
    }

    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        return scheduler.awaitIdle(timeout);
    }

    public void addListener(StatusChannel listener) {
        broadcaster.addListener(listener);
    }

    public void removeListener(StatusChannel listener) {
        broadcaster.removeListener(listener);
    }

    // ---- task history ----

    public Optional<TaskView> getTask(long taskId) {
        return taskStore.getTask(taskId);
    }

    public List<LogEntry> getTaskLogs(long taskId) {
        return taskStore.getTaskLogs(taskId);
    }

    public List<TaskView> getRecentTasks(int limit) {
        return taskStore.getRecentTasks(limit);
    }

    public Optional<TaskView> currentTask() {
        return taskStore.currentTask();
    }

    public boolean deleteTask(long taskId) {
        Long running = workerBridge.currentTaskId();
        if (running != null && running == taskId) {
            throw new IllegalStateException("Cannot delete task " + taskId + " while it is running");
        }
        boolean deleted = taskStore.deleteTask(taskId);
        if (deleted) {
            auditLogger.log(AuditEvent.of("task.delete", "task", "success", taskId, null, Map.of()));
        }
        return deleted;
    }

    public ValidationResult validate(String payload) {
        ValidationResult result = workerBridge.validate(payload);
        auditLogger.log(AuditEvent.of("credential.validate", "worker", result.valid() ? "success" : "failure",
                null, null, Map.of()));
        return result;
    }

    public SpiderqConfig config() {
        return config;
    }

    public SpiderqSettings settings() {
        return settings;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    @Override
    public void close() {
        scheduler.close();
    }

    public record RecoveryResult(int stuckTasks, int orphanedQueueItems) {
    }
}
