package io.spiderq.scheduler;

import io.spiderq.model.JobDescription;
import io.spiderq.model.OperationResult;
import io.spiderq.model.QueueItem;
import io.spiderq.model.QueueItemStatus;
import io.spiderq.model.QueueSnapshot;
import io.spiderq.model.QueueStats;
import io.spiderq.model.SchedulerStatus;
import io.spiderq.model.TaskStatus;
import io.spiderq.model.ValidationResult;
import io.spiderq.model.WorkerEvent;
import io.spiderq.observability.AuditLogger;
import io.spiderq.observability.AuditLogger.AuditEvent;
import io.spiderq.storage.StoreException;
import io.spiderq.storage.TaskStore;
import io.spiderq.worker.WorkerBridge;
import io.spiderq.worker.WorkerBusyException;
import io.spiderq.worker.WorkerRun;
import io.spiderq.worker.WorkerSpawnException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs queued jobs one at a time on a single loop thread.
 *
 * <p>Each pass of the loop takes the next pending entry, marks it running, starts the worker, drains the run's
 * events until {@code exit} and then records the entry as completed or failed. Between jobs it waits the settle
 * delay, which {@link #stop()} cuts short. A job failure never ends the loop; only an empty queue or
 * {@link #stop()} does.
 *
 * <p>Every {@link #start()} opens a new generation. A loop pass that finishes after a {@link #stop()} belongs to
 * an old generation and leaves the queue alone, so an entry reverted to pending stays pending.
 */
public final class QueueScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueueScheduler.class);

    private final TaskStore store;
    private final WorkerBridge bridge;
    private final StatusChannel channel;
    private final AuditLogger audit;
    private final Duration settleDelay;
    private final Duration stopGrace;
    private final ExecutorService loop;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private SchedulerStatus status = SchedulerStatus.IDLE;
    private QueueItem currentItem;
    private long generation;

    public QueueScheduler(TaskStore store, WorkerBridge bridge, StatusChannel channel, AuditLogger audit,
                          Duration settleDelay, Duration stopGrace) {
        this.store = store;
        this.bridge = bridge;
        this.channel = channel == null ? StatusChannel.noop() : channel;
        this.audit = audit;
        this.settleDelay = settleDelay;
        this.stopGrace = stopGrace;
        this.loop = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "spiderq-queue");
            t.setDaemon(true);
            return t;
        });
    }

    public long enqueue(JobDescription job, int priority) {
        long queueId = store.enqueue(job, priority);
        audit("queue.enqueue", "success", null, queueId, Map.of("taskType", job.taskType(), "priority", priority));
        publish();
        return queueId;
    }

    public OperationResult start() {
        lock.lock();
        try {
            if (status == SchedulerStatus.RUNNING) {
                return OperationResult.fail("Queue is already running");
            }
            if (bridge.isRunning()) {
                return OperationResult.fail("A task is currently running. Please wait for it to complete.");
            }
            status = SchedulerStatus.RUNNING;
            long gen = ++generation;
            changed.signalAll();
            loop.execute(() -> runLoop(gen));
        } finally {
            lock.unlock();
        }
        log.info("Queue started");
        audit("queue.start", "success", null, null, Map.of());
        publish();
        return OperationResult.ok("Queue started");
    }

    /**
     * Pauses the queue. The running entry, if any, goes back to pending and its worker is told to terminate; this
     * call then waits up to the stop grace period for that process to be gone.
     */
    public OperationResult stop() {
        QueueItem reverted;
        lock.lock();
        try {
            if (status == SchedulerStatus.IDLE) {
                return OperationResult.fail("Queue is not running");
            }
            status = SchedulerStatus.PAUSED;
            generation++;
            reverted = currentItem;
            currentItem = null;
            changed.signalAll();
            if (reverted != null) {
                revertQuietly(reverted.id());
            }
            try {
                bridge.stop();
            } catch (RuntimeException e) {
                log.error("Failed to stop worker of queue item {}", reverted == null ? null : reverted.id(), e);
            }
        } finally {
            lock.unlock();
        }
        log.info("Queue stopped{}", reverted == null ? "" : ", item " + reverted.id() + " returned to pending");
        audit("queue.stop", "success", reverted == null ? null : reverted.taskId(),
                reverted == null ? null : reverted.id(), Map.of());
        publish();
        if (!bridge.awaitExit(stopGrace)) {
            log.warn("Worker did not exit within {}", stopGrace);
        }
        return OperationResult.ok("Queue stopped");
    }

    /**
     * @throws ItemNotRemovableException when {@code queueId} is the entry being executed
     */
    public boolean remove(long queueId) {
        lock.lock();
        try {
            if (currentItem != null && currentItem.id() == queueId) {
                throw new ItemNotRemovableException("Cannot remove queue item " + queueId + " while it is running");
            }
        } finally {
            lock.unlock();
        }
        boolean removed = store.removeQueueItem(queueId);
        if (!removed) {
            Optional<QueueItem> item = store.getQueueItem(queueId);
            if (item.isPresent() && item.get().status() == QueueItemStatus.RUNNING) {
                throw new ItemNotRemovableException("Cannot remove queue item " + queueId + " while it is running");
            }
            return false;
        }
        audit("queue.remove", "success", null, queueId, Map.of());
        publish();
        return true;
    }

    public boolean setPriority(long queueId, int priority) {
        boolean updated = store.setPriority(queueId, priority);
        if (updated) {
            audit("queue.priority", "success", null, queueId, Map.of("priority", priority));
            publish();
        }
        return updated;
    }

    public int clearCompleted() {
        int cleared = store.clearTerminal();
        audit("queue.clear", "success", null, null, Map.of("removed", cleared));
        publish();
        return cleared;
    }

    public List<QueueItem> listItems(QueueItemStatus status) {
        return store.listQueueItems(status);
    }

    /**
     * Queue counts for display. A storage failure yields zeroes instead of an exception.
     */
    public QueueStats stats() {
        try {
            return store.queueStats();
        } catch (StoreException e) {
            log.warn("Queue stats unavailable: {}", e.getMessage());
            return QueueStats.empty();
        }
    }

    public SchedulerStatus status() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public QueueItem currentItem() {
        lock.lock();
        try {
            return currentItem;
        } finally {
            lock.unlock();
        }
    }

    public QueueSnapshot snapshot() {
        SchedulerStatus s;
        QueueItem item;
        lock.lock();
        try {
            s = status;
            item = currentItem;
        } finally {
            lock.unlock();
        }
        return new QueueSnapshot(s, item, stats());
    }

    /**
     * Blocks until the loop is no longer running (queue drained or stopped).
     *
     * @return false on timeout
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (status == SchedulerStatus.RUNNING) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = changed.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        if (status() != SchedulerStatus.IDLE) {
            stop();
        }
        loop.shutdownNow();
        try {
            if (!loop.awaitTermination(stopGrace.toMillis() + 1_000L, TimeUnit.MILLISECONDS)) {
                log.warn("Queue loop did not terminate");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void runLoop(long gen) {
        try {
            while (runOnce(gen)) {
                settle(gen);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Queue loop interrupted");
        } catch (RuntimeException e) {
            log.error("Queue loop aborted", e);
            lock.lock();
            try {
                if (generation == gen) {
                    if (currentItem != null) {
                        revertQuietly(currentItem.id());
                    }
                    status = SchedulerStatus.IDLE;
                    currentItem = null;
                    changed.signalAll();
                }
            } finally {
                lock.unlock();
            }
            audit("queue.abort", "failure", null, null, Map.of("error", String.valueOf(e.getMessage())));
            publish();
        }
    }

    /**
     * Executes one queue entry.
     *
     * @return whether the loop should continue
     */
    private boolean runOnce(long gen) throws InterruptedException {
        QueueItem item;
        WorkerRun run = null;
        WorkerRun abandoned = null;
        String startFailure = null;
        lock.lock();
        try {
            if (status != SchedulerStatus.RUNNING || generation != gen) {
                return false;
            }
            Optional<QueueItem> next = store.nextPending();
            if (next.isEmpty() || !store.setQueueStatus(next.get().id(), QueueItemStatus.RUNNING, null, null)) {
                if (next.isPresent()) {
                    log.warn("Queue item {} could not be marked running, another item holds the slot", next.get().id());
                }
                status = SchedulerStatus.IDLE;
                currentItem = null;
                changed.signalAll();
                item = null;
            } else {
                currentItem = next.get().withStatus(QueueItemStatus.RUNNING, null);
                item = store.getQueueItem(next.get().id()).orElse(currentItem);
                currentItem = item;
                try {
                    run = bridge.start(item.job());
                    store.bindQueueTask(item.id(), run.taskId());
                    item = item.withStatus(QueueItemStatus.RUNNING, run.taskId());
                    currentItem = item;
                } catch (RuntimeException e) {
                    startFailure = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                    if (!(e instanceof WorkerSpawnException || e instanceof WorkerBusyException)) {
                        log.error("Queue item {} could not be started", item.id(), e);
                    }
                    if (run != null) {
                        abandoned = run;
                        run = null;
                        abandonRun(abandoned, startFailure);
                    }
                    failQuietly(item.id(), startFailure);
                    currentItem = null;
                }
            }
        } finally {
            lock.unlock();
        }

        if (item == null) {
            log.info("Queue drained");
            audit("queue.idle", "success", null, null, Map.of());
            publish();
            return false;
        }
        if (run == null) {
            if (abandoned != null && !bridge.awaitExit(stopGrace)) {
                log.warn("Worker of task {} did not exit within {}", abandoned.taskId(), stopGrace);
            }
            log.warn("Queue item {} failed to start: {}", item.id(), startFailure);
            audit("task.start", "failure", null, item.id(), Map.of("error", String.valueOf(startFailure)));
            publish();
            return true;
        }

        log.info("Queue item {} running as task {}", item.id(), run.taskId());
        audit("task.start", "success", run.taskId(), item.id(), Map.of("taskType", item.job().taskType()));
        publish();

        WorkerEvent event;
        boolean accountAnomaly = false;
        do {
            event = run.take();
            accountAnomaly |= event.isAccountAnomaly();
            forward(run.taskId(), event);
        } while (!event.isTerminal());

        finishItem(gen, item.id(), run.taskId(), event);
        if (accountAnomaly) {
            recheckCredential(gen, item, run.taskId());
        }
        return true;
    }

    /**
     * The worker reported an account anomaly: validate the job's credential again and announce it when it no
     * longer passes.
     */
    private void recheckCredential(long gen, QueueItem item, long taskId) {
        String credential = item.job().credential();
        if (credential == null) {
            log.info("Task {} reported an account anomaly, no credential to re-validate", taskId);
            return;
        }
        if (!isCurrent(gen)) {
            return;
        }
        log.info("Task {} reported an account anomaly, re-validating credential", taskId);
        ValidationResult result;
        try {
            result = bridge.validate(credential);
        } catch (WorkerSpawnException e) {
            log.warn("Credential re-validation for task {} could not run: {}", taskId, e.getMessage());
            return;
        }
        if (result.valid()) {
            log.info("Credential used by task {} is still valid", taskId);
            return;
        }
        log.warn("Credential used by task {} is no longer valid: {}", taskId, result.message());
        audit("credential.invalid", "failure", taskId, item.id(), Map.of("message", String.valueOf(result.message())));
        try {
            channel.credentialInvalid(taskId, result.message());
        } catch (RuntimeException e) {
            log.warn("Status channel rejected credential notice of task {}: {}", taskId, e.getMessage());
        }
    }

    private boolean isCurrent(long gen) {
        lock.lock();
        try {
            return status == SchedulerStatus.RUNNING && generation == gen;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases a worker that started but whose queue entry could not be bound to it.
     */
    private void abandonRun(WorkerRun run, String reason) {
        try {
            bridge.stop();
            store.updateTask(run.taskId(), TaskStatus.FAILED, reason, null);
        } catch (RuntimeException e) {
            log.error("Failed to release worker of task {}", run.taskId(), e);
        }
    }

    private void failQuietly(long queueId, String reason) {
        try {
            store.setQueueStatus(queueId, QueueItemStatus.FAILED, null, reason);
        } catch (RuntimeException e) {
            log.error("Failed to mark queue item {} failed, returning it to pending", queueId, e);
            revertQuietly(queueId);
        }
    }

    private void revertQuietly(long queueId) {
        try {
            store.revertToPending(queueId);
        } catch (RuntimeException e) {
            log.error("Failed to return queue item {} to pending; startup recovery will", queueId, e);
        }
    }

    private void finishItem(long gen, long queueId, long taskId, WorkerEvent exit) {
        TaskStatus taskStatus = exit.taskStatus() == null ? TaskStatus.FAILED : exit.taskStatus();
        boolean success = taskStatus.isSuccessful();
        lock.lock();
        try {
            if (generation != gen || currentItem == null || currentItem.id() != queueId) {
                log.debug("Ignoring exit of task {}, queue item {} was already released", taskId, queueId);
                return;
            }
            store.setQueueStatus(queueId, success ? QueueItemStatus.COMPLETED : QueueItemStatus.FAILED,
                    taskId, success ? null : exit.message());
            currentItem = null;
        } finally {
            lock.unlock();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("taskStatus", taskStatus.dbValue());
        details.put("exitCode", exit.exitCode());
        if (exit.message() != null) {
            details.put("message", exit.message());
        }
        audit("task.finish", success ? "success" : "failure", taskId, queueId, details);
        publish();
    }

    private void settle(long gen) throws InterruptedException {
        long remaining = settleDelay.toNanos();
        lock.lock();
        try {
            while (remaining > 0 && status == SchedulerStatus.RUNNING && generation == gen) {
                remaining = changed.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    private void forward(long taskId, WorkerEvent event) {
        try {
            channel.workerEvent(taskId, event);
        } catch (RuntimeException e) {
            log.warn("Status channel rejected {} event of task {}: {}", event.type().wireValue(), taskId,
                    e.getMessage());
        }
    }

    private void publish() {
        try {
            channel.publish(snapshot());
        } catch (RuntimeException e) {
            log.warn("Status channel rejected snapshot: {}", e.getMessage());
        }
    }

    private void audit(String action, String result, Long taskId, Long queueId, Map<String, Object> details) {
        if (audit == null) {
            return;
        }
        try {
            audit.log(AuditEvent.of(action, "queue", result, taskId, queueId, details));
        } catch (RuntimeException e) {
            log.warn("Failed to write audit row {}: {}", action, e.getMessage());
        }
    }
}
