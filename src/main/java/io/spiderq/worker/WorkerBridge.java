package io.spiderq.worker;

import io.spiderq.model.JobDescription;
import io.spiderq.model.TaskStatus;
import io.spiderq.model.ValidationResult;
import io.spiderq.model.WorkerEvent;
import io.spiderq.model.WorkerEventType;
import io.spiderq.storage.StoreException;
import io.spiderq.storage.TaskStore;
import io.spiderq.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Owns at most one worker process at a time. Each run creates its task row up front, persists every event the
 * worker emits as a log of that task and hands the same events to the run's {@link WorkerRun} channel.
 *
 * <p>{@link #stop()} does not wait for the process: it signals termination, marks the task stopped and detaches the
 * run. Anything the dying process still prints is discarded, so a stopped task is never finalized twice. The
 * channel still gets its {@code exit} event once the process is gone, and {@link #isRunning()} stays true until
 * then; callers that need the slot back use {@link #awaitExit(Duration)}.
 */
public final class WorkerBridge {
    private static final Logger log = LoggerFactory.getLogger(WorkerBridge.class);

    public static final String VALIDATE_MODE = "validate-cookie";
    public static final String STOPPED_MESSAGE = "Stopped by user";
    public static final String EMPTY_RESULT_MESSAGE = "Task finished without collecting any records";
    private static final long READER_JOIN_MS = 5_000L;

    private final TaskStore store;
    private final WorkerLauncher launcher;
    private final int maxFrameBytes;
    private final Duration validateTimeout;
    private final Object lock = new Object();
    private ActiveRun active;

    public WorkerBridge(TaskStore store, WorkerLauncher launcher, int maxFrameBytes, Duration validateTimeout) {
        this.store = store;
        this.launcher = launcher;
        this.maxFrameBytes = maxFrameBytes;
        this.validateTimeout = validateTimeout;
    }

    /**
     * Creates the task and spawns the worker for {@code job}.
     *
     * @throws WorkerBusyException  when a process is still active, including one that was stopped but has not
     *                              exited yet
     * @throws WorkerSpawnException when the process cannot be started; the task is then already marked failed
     */
    public WorkerRun start(JobDescription job) {
        synchronized (lock) {
            if (active != null) {
                throw new WorkerBusyException("Task already running");
            }
            long taskId = store.createTask(job.taskType(), job.params(), job.configSnapshot());
            Process process;
            try {
                process = launcher.launch(List.of(Jsons.toCompactJson(job.workerArgument())));
            } catch (IOException | RuntimeException e) {
                String message = "Failed to start worker: " + e.getMessage();
                store.updateTask(taskId, TaskStatus.FAILED, message, null);
                throw new WorkerSpawnException(message, e);
            }
            ActiveRun run = new ActiveRun(taskId, process);
            active = run;
            run.begin();
            log.info("Worker started for task {} ({})", taskId, job.taskType());
            return run.channel;
        }
    }

    /**
     * Signals the active process to terminate and marks its task stopped. Returns without waiting for the exit.
     *
     * @return false when there was nothing left to stop
     */
    public boolean stop() {
        ActiveRun run;
        synchronized (lock) {
            run = active;
        }
        if (run == null || !run.detach()) {
            return false;
        }
        run.process.destroy();
        store.updateTask(run.taskId, TaskStatus.STOPPED, STOPPED_MESSAGE, null);
        log.info("Worker for task {} stopped", run.taskId);
        return true;
    }

    /**
     * True from {@link #start} until the process has actually exited and its output is drained.
     */
    public boolean isRunning() {
        synchronized (lock) {
            return active != null;
        }
    }

    /**
     * The task bound to the active run, or null when idle or after {@link #stop()}.
     */
    public Long currentTaskId() {
        ActiveRun run;
        synchronized (lock) {
            run = active;
        }
        return run == null || run.isDetached() ? null : run.taskId;
    }

    /**
     * Waits for the active process to be gone, killing it forcibly once {@code timeout} has passed.
     *
     * @return whether the bridge is free again
     */
    public boolean awaitExit(Duration timeout) {
        ActiveRun run;
        synchronized (lock) {
            run = active;
        }
        if (run == null) {
            return true;
        }
        try {
            if (run.finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            log.warn("Worker for task {} still alive after {}, killing it", run.taskId, timeout);
            run.process.destroyForcibly();
            return run.finished.await(READER_JOIN_MS * 2, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Runs the worker in validation mode. No task is created and nothing is logged to the store.
     */
    public ValidationResult validate(String payload) {
        Process process;
        try {
            process = launcher.launch(List.of(VALIDATE_MODE, Jsons.toCompactJson(payload)));
        } catch (IOException | RuntimeException e) {
            throw new WorkerSpawnException("Failed to start validation worker: " + e.getMessage(), e);
        }
        List<String> frames = Collections.synchronizedList(new ArrayList<>());
        StringBuffer stderr = new StringBuffer();
        Thread out = reader("spiderq-validate-stdout", process.getInputStream(), LineFramer.strict(maxFrameBytes),
                frames::add);
        Thread err = reader("spiderq-validate-stderr", process.getErrorStream(), LineFramer.lenient(maxFrameBytes),
                line -> stderr.append(line).append('\n'));
        try {
            if (!process.waitFor(validateTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return ValidationResult.invalid("Validation timed out after " + validateTimeout.toSeconds() + "s");
            }
            out.join(READER_JOIN_MS);
            err.join(READER_JOIN_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return ValidationResult.invalid("Validation interrupted");
        }
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            String detail = stderr.toString().strip();
            return ValidationResult.invalid("Validation worker exited with code " + exitCode
                    + (detail.isEmpty() ? "" : ": " + detail));
        }
        List<String> snapshot;
        synchronized (frames) {
            snapshot = new ArrayList<>(frames);
        }
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            Optional<WorkerEvent> parsed = WorkerEvents.parse(snapshot.get(i));
            if (parsed.isEmpty()) {
                continue;
            }
            WorkerEvent event = parsed.get();
            if (event.type() == WorkerEventType.VALIDATION_RESULT) {
                boolean valid = Boolean.TRUE.equals(event.valid());
                String message = event.message() != null ? event.message() : (valid ? "Valid" : "Invalid");
                return new ValidationResult(valid, message, valid ? event.userInfo() : null);
            }
            if (event.type() == WorkerEventType.ERROR) {
                return ValidationResult.invalid(event.message());
            }
        }
        String detail = stderr.toString().strip();
        return ValidationResult.invalid(detail.isEmpty() ? "Unknown validation error" : detail);
    }

    private Thread reader(String name, InputStream in, LineFramer framer, Consumer<String> sink) {
        Thread t = new Thread(() -> {
            try {
                LineFramer.Result result = framer.frame(in, sink);
                if (result.oversizedFrames() > 0) {
                    log.warn("{}: rejected {} oversized frame(s) over {} bytes", name, result.oversizedFrames(),
                            maxFrameBytes);
                }
                if (result.truncatedTail()) {
                    log.warn("{}: rejected unterminated trailing output", name);
                }
            } catch (IOException e) {
                log.debug("{}: stream closed: {}", name, e.getMessage());
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private record Signal(WorkerEvent event, int exitCode) {
        static Signal event(WorkerEvent event) {
            return new Signal(event, 0);
        }

        static Signal exit(int exitCode) {
            return new Signal(null, exitCode);
        }

        boolean isExit() {
            return event == null;
        }
    }

    /**
     * One spawned process. Readers and the exit waiter post to {@code inbox}; a single dispatcher thread persists,
     * tracks and forwards, so logs land in the order the worker produced them.
     */
    private final class ActiveRun {
        final long taskId;
        final Process process;
        final WorkerRun channel;
        final BlockingQueue<Signal> inbox = new LinkedBlockingQueue<>();
        final CountDownLatch finished = new CountDownLatch(1);

        private boolean detached;
        private boolean finalized;
        private String lastError;
        private Integer resultCount;
        private TaskStatus doneStatus;
        private String doneMessage;

        ActiveRun(long taskId, Process process) {
            this.taskId = taskId;
            this.process = process;
            this.channel = new WorkerRun(taskId);
        }

        void begin() {
            String prefix = "spiderq-worker-" + taskId;
            Thread out = reader(prefix + "-stdout", process.getInputStream(), LineFramer.strict(maxFrameBytes),
                    frame -> WorkerEvents.parse(frame).ifPresent(ev -> inbox.add(Signal.event(ev))));
            Thread err = reader(prefix + "-stderr", process.getErrorStream(), LineFramer.lenient(maxFrameBytes),
                    line -> inbox.add(Signal.event(WorkerEvent.error(line, WorkerEvent.CODE_STDERR))));
            Thread waiter = new Thread(() -> {
                int code;
                try {
                    code = process.waitFor();
                    out.join(READER_JOIN_MS);
                    err.join(READER_JOIN_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    code = -1;
                }
                inbox.add(Signal.exit(code));
            }, prefix + "-exit");
            waiter.setDaemon(true);
            waiter.start();
            Thread dispatcher = new Thread(this::dispatch, prefix + "-dispatch");
            dispatcher.setDaemon(true);
            dispatcher.start();
        }

        synchronized boolean detach() {
            if (detached || finalized) {
                return false;
            }
            detached = true;
            return true;
        }

        synchronized boolean isDetached() {
            return detached;
        }

        private void dispatch() {
            try {
                while (true) {
                    Signal signal = inbox.take();
                    if (signal.isExit()) {
                        finish(signal.exitCode());
                        return;
                    }
                    handle(signal.event());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Dispatcher for task {} interrupted", taskId);
                finish(-1);
            }
        }

        private synchronized void handle(WorkerEvent event) {
            if (detached) {
                log.debug("Discarding {} event from stopped task {}", event.type().wireValue(), taskId);
                return;
            }
            persist(event);
            if (event.type() == WorkerEventType.ERROR) {
                lastError = event.message() == null || event.message().isBlank()
                        ? "Worker reported an error"
                        : event.message();
            } else if (event.type() == WorkerEventType.DONE) {
                int count = event.count() == null ? 0 : event.count();
                resultCount = count;
                if (event.isAccountAnomaly()) {
                    doneStatus = TaskStatus.FAILED;
                    doneMessage = event.apiMessage() == null || event.apiMessage().isBlank()
                            ? WorkerEvent.ACCOUNT_ANOMALY_MESSAGE
                            : event.apiMessage();
                    log.warn("Task {} reported an account anomaly: {}", taskId, doneMessage);
                } else if (count == 0) {
                    doneStatus = TaskStatus.WARNING;
                    doneMessage = EMPTY_RESULT_MESSAGE;
                } else {
                    doneStatus = TaskStatus.COMPLETED;
                    doneMessage = null;
                }
            }
            channel.deliver(event);
        }

        private void finish(int exitCode) {
            TaskStatus status;
            String message;
            synchronized (this) {
                finalized = true;
                if (detached) {
                    status = TaskStatus.STOPPED;
                    message = STOPPED_MESSAGE;
                } else {
                    if (exitCode != 0) {
                        WorkerEvent exitError = WorkerEvent.error("Process exited with code " + exitCode,
                                WorkerEvent.CODE_PROCESS_EXIT);
                        persist(exitError);
                        channel.deliver(exitError);
                    }
                    if (lastError != null) {
                        status = TaskStatus.FAILED;
                        message = lastError;
                    } else if (exitCode != 0) {
                        status = TaskStatus.FAILED;
                        message = "Process exited with code " + exitCode;
                    } else if (doneStatus != null) {
                        status = doneStatus;
                        message = doneMessage;
                    } else {
                        status = TaskStatus.COMPLETED;
                        message = null;
                    }
                    try {
                        store.updateTask(taskId, status, message, resultCount);
                    } catch (StoreException e) {
                        log.error("Failed to finalize task {} as {}", taskId, status.dbValue(), e);
                    }
                }
            }
            log.info("Worker for task {} exited with code {}, task {}", taskId, exitCode, status.dbValue());
            synchronized (lock) {
                if (active == this) {
                    active = null;
                }
            }
            finished.countDown();
            channel.deliver(WorkerEvent.exit(exitCode, status, message));
        }

        private void persist(WorkerEvent event) {
            try {
                store.addLog(taskId, event);
            } catch (StoreException e) {
                log.error("Failed to persist {} event for task {}", event.type().wireValue(), taskId, e);
            }
        }
    }
}
