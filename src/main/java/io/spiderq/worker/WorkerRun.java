package io.spiderq.worker;

import io.spiderq.model.WorkerEvent;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Event channel of one worker run. Events arrive in the order the worker produced them; the last one is always the
 * synthetic {@code exit} event.
 */
public final class WorkerRun {
    private final long taskId;
    private final BlockingQueue<WorkerEvent> events = new LinkedBlockingQueue<>();

    WorkerRun(long taskId) {
        this.taskId = taskId;
    }

    public long taskId() {
        return taskId;
    }

    public WorkerEvent take() throws InterruptedException {
        return events.take();
    }

    /**
     * @return the next event, or null when none arrived within {@code timeout}
     */
    public WorkerEvent poll(Duration timeout) throws InterruptedException {
        return events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    void deliver(WorkerEvent event) {
        events.add(event);
    }
}
