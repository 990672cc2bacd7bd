package io.spiderq.storage;

import io.spiderq.MutableClock;
import io.spiderq.TestFiles;
import io.spiderq.config.SpiderqConfig;
import io.spiderq.model.JobDescription;
import io.spiderq.model.LogEntry;
import io.spiderq.model.QueueItem;
import io.spiderq.model.QueueItemStatus;
import io.spiderq.model.QueueStats;
import io.spiderq.model.TaskStatus;
import io.spiderq.model.TaskView;
import io.spiderq.model.WorkerEvent;
import io.spiderq.util.Jsons;
import io.spiderq.worker.WorkerEvents;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

final class TaskStoreTest {
    private Path root;
    private MutableClock clock;
    private Database database;
    private TaskStore store;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("spiderq-test-store-");
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        database = new Database(SpiderqConfig.fromRoot(root.toString()));
        database.init();
        store = new TaskStore(database, clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        TestFiles.deleteRecursively(root);
    }

    @Test
    void higherPriorityIsListedFirst() {
        long a = store.enqueue(job("A"), 0);
        clock.advance(Duration.ofSeconds(1));
        long b = store.enqueue(job("B"), 5);

        List<QueueItem> items = store.listQueueItems(null);
        Assertions.assertEquals(List.of(b, a), items.stream().map(QueueItem::id).toList());
        Assertions.assertEquals(b, store.nextPending().orElseThrow().id());
    }

    @Test
    void equalPriorityRunsInArrivalOrder() {
        long first = store.enqueue(job("first"), 1);
        long second = store.enqueue(job("second"), 1);
        clock.advance(Duration.ofMillis(5));
        long third = store.enqueue(job("third"), 1);
        long low = store.enqueue(job("low"), -3);

        List<Long> order = store.listQueueItems(QueueItemStatus.PENDING).stream().map(QueueItem::id).toList();
        Assertions.assertEquals(List.of(first, second, third, low), order);
    }

    @Test
    void queueItemKeepsTheJobDescription() {
        long id = store.enqueue(new JobDescription("user",
                Jsons.readTree("{\"userUrl\":\"https://example.com/u/1\"}"),
                Jsons.readTree("{\"cookie\":\"c=1\",\"proxy\":\"http://p:1\"}")), 2);

        QueueItem item = store.getQueueItem(id).orElseThrow();
        Assertions.assertEquals(QueueItemStatus.PENDING, item.status());
        Assertions.assertEquals(2, item.priority());
        Assertions.assertEquals("user", item.job().taskType());
        Assertions.assertEquals("https://example.com/u/1", item.job().params().path("userUrl").asText());
        Assertions.assertEquals("c=1", item.job().config().path("cookie").asText());
        Assertions.assertNull(item.startedAtMs());
        Assertions.assertNull(item.taskId());
    }

    @Test
    void createdTaskIsRunningWithoutCompletionTime() {
        long taskId = store.createTask("search", Jsons.readTree("{\"keyword\":\"tea\"}"),
                Jsons.readTree("{\"paths\":{\"excel\":\"/tmp\"}}"));

        TaskView task = store.getTask(taskId).orElseThrow();
        Assertions.assertEquals(TaskStatus.RUNNING, task.status());
        Assertions.assertEquals(clock.millis(), task.startedAtMs());
        Assertions.assertNull(task.completedAtMs());
        Assertions.assertEquals(0, task.resultCount());
        Assertions.assertEquals("tea", Jsons.readTree(task.params()).path("keyword").asText());
        Assertions.assertEquals("/tmp", Jsons.readTree(task.config()).path("paths").path("excel").asText());
    }

    @Test
    void updateTaskStampsCompletionAndKeepsCountWhenNotGiven() {
        long taskId = store.createTask("search", null, null);
        clock.advance(Duration.ofSeconds(30));

        store.updateTask(taskId, TaskStatus.RUNNING, null, 7);
        TaskView mid = store.getTask(taskId).orElseThrow();
        Assertions.assertNull(mid.completedAtMs());
        Assertions.assertEquals(7, mid.resultCount());

        store.updateTask(taskId, TaskStatus.FAILED, "boom", null);
        TaskView done = store.getTask(taskId).orElseThrow();
        Assertions.assertEquals(TaskStatus.FAILED, done.status());
        Assertions.assertEquals("boom", done.errorMessage());
        Assertions.assertEquals(7, done.resultCount());
        Assertions.assertEquals(clock.millis(), done.completedAtMs());
    }

    @Test
    void logsComeBackInArrivalOrderWithProgressMetadata() {
        long taskId = store.createTask("notes", null, null);
        store.addLog(taskId, WorkerEvent.log("INFO", "starting"));
        store.addLog(taskId, event("{\"type\":\"progress\",\"current\":3,\"total\":10,\"title\":\"note 3\"}"));
        store.addLog(taskId, event("{\"type\":\"done\",\"count\":10}"));

        List<LogEntry> logs = store.getTaskLogs(taskId);
        Assertions.assertEquals(List.of("log", "progress", "done"), logs.stream().map(LogEntry::type).toList());
        Assertions.assertEquals("starting", logs.get(0).message());
        Assertions.assertEquals("INFO", logs.get(0).level());
        Assertions.assertNull(logs.get(0).metadata());

        LogEntry progress = logs.get(1);
        Assertions.assertEquals(3, Jsons.readTree(progress.metadata()).path("current").asInt());
        Assertions.assertEquals(10, Jsons.readTree(progress.metadata()).path("total").asInt());
        Assertions.assertEquals("note 3", Jsons.readTree(progress.metadata()).path("title").asText());
        Assertions.assertEquals("3/10 note 3", progress.message());
    }

    @Test
    void logForMissingTaskIsRejected() {
        Assertions.assertThrows(StoreException.class, () -> store.addLog(9_999L, WorkerEvent.log("INFO", "orphan")));
    }

    @Test
    void deleteTaskRemovesOnlyItsOwnLogs() {
        long doomed = store.createTask("search", null, null);
        long kept = store.createTask("search", null, null);
        store.addLog(doomed, WorkerEvent.log("INFO", "a"));
        store.addLog(doomed, WorkerEvent.log("INFO", "b"));
        store.addLog(kept, WorkerEvent.log("INFO", "c"));
        long queueId = store.enqueue(job("x"), 0);
        Assertions.assertTrue(store.setQueueStatus(queueId, QueueItemStatus.RUNNING, doomed, null));
        store.setQueueStatus(queueId, QueueItemStatus.COMPLETED, null, null);

        Assertions.assertTrue(store.deleteTask(doomed));

        Assertions.assertTrue(store.getTask(doomed).isEmpty());
        Assertions.assertTrue(store.getTaskLogs(doomed).isEmpty());
        Assertions.assertEquals(1, store.getTaskLogs(kept).size());
        Assertions.assertNull(store.getQueueItem(queueId).orElseThrow().taskId());
        Assertions.assertFalse(store.deleteTask(doomed));
    }

    @Test
    void fixStuckTasksStopsOnlyStaleRunningTasks() {
        long stale = store.createTask("search", null, null);
        long finished = store.createTask("search", null, null);
        store.updateTask(finished, TaskStatus.COMPLETED, null, 4);
        clock.advance(Duration.ofMinutes(15));
        long fresh = store.createTask("search", null, null);
        clock.advance(Duration.ofMinutes(5));

        int fixed = store.fixStuckTasks(Duration.ofMinutes(10));

        Assertions.assertEquals(1, fixed);
        TaskView stopped = store.getTask(stale).orElseThrow();
        Assertions.assertEquals(TaskStatus.STOPPED, stopped.status());
        Assertions.assertEquals("interrupted", stopped.errorMessage());
        Assertions.assertNotNull(stopped.completedAtMs());
        Assertions.assertEquals(TaskStatus.RUNNING, store.getTask(fresh).orElseThrow().status());
        Assertions.assertEquals(TaskStatus.COMPLETED, store.getTask(finished).orElseThrow().status());
    }

    @Test
    void onlyOneQueueItemCanBeRunning() {
        long first = store.enqueue(job("first"));
        long second = store.enqueue(job("second"));
        Assertions.assertEquals(0, store.getQueueItem(first).orElseThrow().priority());

        Assertions.assertTrue(store.setQueueStatus(first, QueueItemStatus.RUNNING, null, null));
        Assertions.assertFalse(store.setQueueStatus(second, QueueItemStatus.RUNNING, null, null));
        Assertions.assertEquals(1, store.queueStats().running());

        store.setQueueStatus(first, QueueItemStatus.FAILED, null, "nope");
        Assertions.assertTrue(store.setQueueStatus(second, QueueItemStatus.RUNNING, null, null));
        Assertions.assertFalse(store.setQueueStatus(first, QueueItemStatus.RUNNING, null, null));
    }

    @Test
    void queueTransitionsStampTimesAndBindTheTaskOnce() {
        long queueId = store.enqueue(job("x"), 0);
        clock.advance(Duration.ofSeconds(2));
        store.setQueueStatus(queueId, QueueItemStatus.RUNNING, null, null);
        long taskId = store.createTask("search", null, null);
        long otherTask = store.createTask("search", null, null);

        Assertions.assertTrue(store.bindQueueTask(queueId, taskId));
        Assertions.assertFalse(store.bindQueueTask(queueId, otherTask));

        QueueItem running = store.getQueueItem(queueId).orElseThrow();
        Assertions.assertEquals(QueueItemStatus.RUNNING, running.status());
        Assertions.assertEquals(clock.millis(), running.startedAtMs());
        Assertions.assertEquals(taskId, running.taskId());

        clock.advance(Duration.ofSeconds(3));
        store.setQueueStatus(queueId, QueueItemStatus.FAILED, null, "Process exited with code 1");
        QueueItem failed = store.getQueueItem(queueId).orElseThrow();
        Assertions.assertEquals(QueueItemStatus.FAILED, failed.status());
        Assertions.assertEquals(clock.millis(), failed.completedAtMs());
        Assertions.assertEquals(taskId, failed.taskId());
        Assertions.assertEquals("Process exited with code 1", failed.errorMessage());
    }

    @Test
    void revertToPendingDropsTheBinding() {
        long queueId = store.enqueue(job("x"), 0);
        long taskId = store.createTask("search", null, null);
        store.setQueueStatus(queueId, QueueItemStatus.RUNNING, taskId, null);

        Assertions.assertTrue(store.revertToPending(queueId));

        QueueItem item = store.getQueueItem(queueId).orElseThrow();
        Assertions.assertEquals(QueueItemStatus.PENDING, item.status());
        Assertions.assertNull(item.taskId());
        Assertions.assertNull(item.startedAtMs());
        Assertions.assertEquals(queueId, store.nextPending().orElseThrow().id());
    }

    @Test
    void runningItemCannotBeRemoved() {
        long running = store.enqueue(job("running"), 0);
        long pending = store.enqueue(job("pending"), 0);
        store.setQueueStatus(running, QueueItemStatus.RUNNING, null, null);

        Assertions.assertFalse(store.removeQueueItem(running));
        Assertions.assertTrue(store.removeQueueItem(pending));
        Assertions.assertTrue(store.getQueueItem(running).isPresent());
        Assertions.assertTrue(store.getQueueItem(pending).isEmpty());
    }

    @Test
    void clearTerminalLeavesPendingAndRunning() {
        long pending = store.enqueue(job("p"), 0);
        long running = store.enqueue(job("r"), 0);
        long completed = store.enqueue(job("c"), 0);
        long failed = store.enqueue(job("f"), 0);
        store.setQueueStatus(completed, QueueItemStatus.RUNNING, null, null);
        store.setQueueStatus(completed, QueueItemStatus.COMPLETED, null, null);
        store.setQueueStatus(failed, QueueItemStatus.RUNNING, null, null);
        store.setQueueStatus(failed, QueueItemStatus.FAILED, null, "x");
        store.setQueueStatus(running, QueueItemStatus.RUNNING, null, null);

        Assertions.assertEquals(new QueueStats(1, 1, 1, 1, 4), store.queueStats());
        Assertions.assertEquals(2, store.clearTerminal());

        List<Long> left = store.listQueueItems(null).stream().map(QueueItem::id).toList();
        Assertions.assertEquals(List.of(pending, running), left);
        Assertions.assertEquals(new QueueStats(1, 1, 0, 0, 2), store.queueStats());
    }

    @Test
    void setPriorityReordersTheQueue() {
        long a = store.enqueue(job("a"), 0);
        long b = store.enqueue(job("b"), 0);

        Assertions.assertTrue(store.setPriority(b, 9));
        Assertions.assertFalse(store.setPriority(12_345L, 1));
        Assertions.assertEquals(List.of(b, a), store.listQueueItems(null).stream().map(QueueItem::id).toList());
    }

    @Test
    void orphanedRunningItemsGoBackToPending() {
        long queueId = store.enqueue(job("x"), 0);
        store.setQueueStatus(queueId, QueueItemStatus.RUNNING, null, null);
        long taskId = store.createTask("search", null, null);
        store.bindQueueTask(queueId, taskId);

        Assertions.assertEquals(1, store.recoverOrphanedQueueItems());

        QueueItem item = store.getQueueItem(queueId).orElseThrow();
        Assertions.assertEquals(QueueItemStatus.PENDING, item.status());
        Assertions.assertNull(item.taskId());
        TaskView task = store.getTask(taskId).orElseThrow();
        Assertions.assertEquals(TaskStatus.STOPPED, task.status());
        Assertions.assertEquals("interrupted", task.errorMessage());
        Assertions.assertEquals(0, store.recoverOrphanedQueueItems());
    }

    @Test
    void currentTaskPrefersTheRunningOne() {
        Assertions.assertTrue(store.currentTask().isEmpty());
        long running = store.createTask("search", null, null);
        clock.advance(Duration.ofSeconds(1));
        long later = store.createTask("search", null, null);
        store.updateTask(later, TaskStatus.COMPLETED, null, 1);

        Assertions.assertEquals(running, store.currentTask().orElseThrow().id());

        store.updateTask(running, TaskStatus.STOPPED, null, null);
        Assertions.assertEquals(later, store.currentTask().orElseThrow().id());
    }

    @Test
    void recentTasksAreNewestFirst() {
        long first = store.createTask("search", null, null);
        clock.advance(Duration.ofSeconds(1));
        long second = store.createTask("user", null, null);
        clock.advance(Duration.ofSeconds(1));
        long third = store.createTask("notes", null, null);

        Assertions.assertEquals(List.of(third, second),
                store.getRecentTasks(2).stream().map(TaskView::id).toList());
        Assertions.assertEquals(List.of(third, second, first),
                store.getRecentTasks(10).stream().map(TaskView::id).toList());
    }

    @Test
    void purgeDropsOldLogsAndTheirFinishedTasks() {
        long old = store.createTask("search", null, null);
        store.addLog(old, WorkerEvent.log("INFO", "old"));
        store.updateTask(old, TaskStatus.COMPLETED, null, 1);
        long oldRunning = store.createTask("search", null, null);
        clock.advance(Duration.ofDays(31));
        long recent = store.createTask("search", null, null);
        store.addLog(recent, WorkerEvent.log("INFO", "recent"));
        store.updateTask(recent, TaskStatus.COMPLETED, null, 1);

        TaskStore.PurgeResult result = store.purgeHistoryOlderThan(clock.millis() - Duration.ofDays(30).toMillis());

        Assertions.assertEquals(1, result.logsDeleted());
        Assertions.assertEquals(1, result.tasksDeleted());
        Assertions.assertTrue(store.getTask(old).isEmpty());
        Assertions.assertTrue(store.getTask(oldRunning).isPresent());
        Assertions.assertEquals(1, store.getTaskLogs(recent).size());
    }

    @Test
    void initIsIdempotentAndRecordsMigrations() {
        database.init();
        Assertions.assertEquals(List.of("20261019_001_history_lookup_indexes"), database.appliedMigrations());
    }

    private static JobDescription job(String keyword) {
        return new JobDescription("search", Jsons.readTree("{\"keyword\":\"" + keyword + "\"}"), null);
    }

    private static WorkerEvent event(String json) {
        return WorkerEvents.parse(json).orElseThrow();
    }
}
