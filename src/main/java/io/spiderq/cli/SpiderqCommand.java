package io.spiderq.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.spiderq.config.SpiderqConfig;
import io.spiderq.model.JobDescription;
import io.spiderq.model.OperationResult;
import io.spiderq.model.QueueItemStatus;
import io.spiderq.model.QueueSnapshot;
import io.spiderq.model.TaskView;
import io.spiderq.model.ValidationResult;
import io.spiderq.model.WorkerEvent;
import io.spiderq.runtime.SpiderqRuntime;
import io.spiderq.scheduler.ItemNotRemovableException;
import io.spiderq.scheduler.StatusChannel;
import io.spiderq.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "spiderq",
        mixinStandardHelpOptions = true,
        description = "spiderq job queue and worker runner",
        subcommands = {
                SpiderqCommand.InitCommand.class,
                SpiderqCommand.EnqueueCommand.class,
                SpiderqCommand.QueueCommand.class,
                SpiderqCommand.RunCommand.class,
                SpiderqCommand.RemoveCommand.class,
                SpiderqCommand.PriorityCommand.class,
                SpiderqCommand.ClearCommand.class,
                SpiderqCommand.StatsCommand.class,
                SpiderqCommand.TasksCommand.class,
                SpiderqCommand.TaskCommand.class,
                SpiderqCommand.LogsCommand.class,
                SpiderqCommand.CurrentCommand.class,
                SpiderqCommand.DeleteTaskCommand.class,
                SpiderqCommand.ValidateCommand.class,
                SpiderqCommand.RecoverCommand.class,
                SpiderqCommand.PurgeCommand.class,
                SpiderqCommand.AuditVerifyCommand.class
        }
)
public final class SpiderqCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | enqueue | queue | run | remove | priority | clear | stats | tasks | task | logs | current | delete-task | validate | recover | purge | audit-verify");
    }

    SpiderqRuntime runtime() {
        return new SpiderqRuntime(SpiderqConfig.fromRoot(root));
    }

    private static void printError(String message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", message);
        System.out.println(Jsons.toJson(out));
    }

    @Command(name = "init", description = "Initialize the data root, SQLite schema and run startup recovery")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        SpiderqCommand parent;

        @Override
        public Integer call() {
            SpiderqRuntime runtime = parent.runtime();
            SpiderqRuntime.RecoveryResult recovered = runtime.init();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("root", runtime.config().rootDir().toString());
            out.put("recovered", recovered);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "enqueue", description = "Add a job to the queue")
    static final class EnqueueCommand implements Callable<Integer> {
        @ParentCommand
        SpiderqCommand parent;

        @Option(names = {"--type"}, description = "Job kind: notes | user | search")
        String taskType;

        @Option(names = {"--params"}, defaultValue = "{}", description = "Job parameters as JSON")
        String params;

        @Option(names = {"--config"}, defaultValue = "{}", description = "Execution config as JSON (cookie, saveOptions, paths, proxy)")
        String config;

        @Option(names = {"--file"}, description = "Job description JSON file ({taskType, params, config})")
        String file;

        @Option(names = {"--priority"}, defaultValue = "0", description = "Higher runs first")
        int priority;

        @Override
        public Integer call() throws Exception {
            JobDescription job;
            if (file != null) {
                job = JobDescription.fromJson(Files.readString(Path.of(file), StandardCharsets.UTF_8));
            } else {
                JsonNode paramsNode = Jsons.readTree(params);
                JsonNode configNode = Jsons.readTree(config);
                job = new JobDescription(taskType, paramsNode, configNode);
            }
            SpiderqRuntime runtime = parent.runtime();
            runtime.open();
            long queueId = runtime.enqueue(job, priority);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("queueId", queueId);
            out.put("priority", priority);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "queue", description = "List queue items in execution order")
    static final class QueueCommand implements Callable<Integer> {
        @ParentCommand
        SpiderqCommand parent;

        @Option(names = {"--status"}, description = "Filter: pending | running | completed | failed")
        String status;

        @Override
        public Integer call() {
            SpiderqRuntime runtime = parent.runtime();
            runtime.open();
            QueueItemStatus filter = status == null ? null : QueueItemStatus.fromString(status);
            System.out.println(Jsons.toJson(runtime.listItems(filter)));
            return 0;
        }
    }

    @Command(name = "run", description = "Run the queue until it is empty, Ctrl+C stops it")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        SpiderqCommand parent;

        @Option(names = {"--timeout-seconds"}, defaultValue = "0", description = "Stop after this long, 0 waits until the queue is empty")
        long timeoutSeconds;

        @Option(names = {"--events"}, description = "Print worker events as JSON lines while running")
        boolean events;

        @Override
        public Integer call() throws Exception {
            SpiderqRuntime runtime = parent.runtime();
            runtime.init();
            if (events) {
                runtime.addListener(new StatusChannel() {
                    @Override
                    public void publish(QueueSnapshot snapshot) {
                    }

                    @Override
                    public void workerEvent(long taskId, WorkerEvent event) {
                        Map<String, Object> line = new LinkedHashMap<>();
                        line.put("taskId", taskId);
                        line.put("event", event);
                        System.out.println(Jsons.toCompactJson(line));
                    }

                    @Override
                    public void credentialInvalid(long taskId, String message) {
                        Map<String, Object> line = new LinkedHashMap<>();
                        line.put("taskId", taskId);
                        line.put("credentialInvalid", message);
                        System.out.println(Jsons.toCompactJson(line));
                    }
                });
            }
            OperationResult started = runtime.start();
            if (!started.success()) {
                System.out.println(Jsons.toJson(started));
                return 1;
            }
            Thread hook = new Thread(runtime::close, "spiderq-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            Duration timeout = timeoutSeconds <= 0 ? Duration.ofDays(365) : Duration.ofSeconds(timeoutSeconds);
            boolean drained = runtime.awaitIdle(timeout);
            if (!drained) {
                runtime.stop();
            }
            Runtime.getRuntime().removeShutdownHook(hook);
            runtime.close();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("drained", drained);
            out.put("snapshot", runtime.snapshot());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "remove", description = "Remove a queue item that is not running")
    static final class RemoveCommand implements Callable<Integer> {
        @ParentCommand
        SpiderqCommand parent;

        @Parameters(index = "0", description = "Queue item id")
        long queueId;

        @Override
        public Integer call() {
            SpiderqRuntime runtime = parent.runtime();
            runtime.open();
            try {
                if (!runtime.remove(queueId)) {
                    printError("queue item not found");
                    return 1;
                }
            } catch (ItemNotRemovableException e) {
                printError(e.getMessage());
                return 1;
            }
            System.out.println(Jsons.toJson(Map.of("removed", queueId)));
            return 0;
        }
    }

    @Command(name = "priority", description = "Change the priority of a queue item")
    static final class PriorityCommand implements Callable<Integer> {
        @ParentCommand
        SpiderqCommand parent;

        @Parameters(index = "0", description = "Queue item id")
        long queueId;

        @Parameters(index = "1", description = "New priority, higher runs first")
        int priority;

        @Override
        public Integer call() {
            SpiderqRuntime runtime = parent.runtime();
            runtime.open();
            if (!runtime.setPriority(queueId, priority)) {
                printError("queue item not found");
                return 1;
            }
            System.out.println(Jsons.toJson(runtime.listItems(null)));
            return 0;
        }
    }

    @Command(name = "clear", description = "Delete completed and failed queue items")
    static final class ClearCommand implements Callable<Integer> {
        @ParentCommand
        SpiderqCommand parent;

        @Override
        public Integer call() {
            SpiderqRuntime runtime = parent.runtime();
            runtime.open();
            System.out.println(Jsons.toJson(Map.of("removed", runtime.clearCompleted())));
            return 0;
        }
    }

    @Command(name = "stats", description = "Show queue counters")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        SpiderqCommand parent;

        @Override
        public Integer call() {
            SpiderqRuntime runtime = parent.runtime();
            runtime.open();
            System.out.println(Jsons.toJson(runtime.stats()));
            return 0;
        }
    }

    @Command(name = "tasks", description = "List recent tasks, newest first")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        SpiderqCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            SpiderqRuntime runtime = parent.runtime();
            runtime.open();
            System.out.println(Jsons.toJson(runtime.getRecentTasks(limit)));
            return 0;
        }
    }

    @Command(name = "task", description = "Show one task by id")
    static final class TaskCommand implements Callable<Integer> {
        @ParentCommand
        SpiderqCommand parent;

        @Parameters(index = "0", description = "Task id")
        long taskId;

        @Override
        public Integer call() {
            SpiderqRuntime runtime = parent.runtime();
            runtime.open();
            Optional<TaskView> task = runtime.getTask(taskId);
            if (task.isEmpty()) {
                printError("task not found");
                return 1;
            }
            System.out.println(Jsons.toJson(task.get()));
            return 0;
        }
    }

    @Command(name = "logs", description = "Show the logs of a task in arrival order")
    static final class LogsCommand implements Callable<Integer> {
        @ParentCommand
        SpiderqCommand parent;

        @Parameters(index = "0", description = "Task id")
        long taskId;

        @Override
        public Integer call() {
            SpiderqRuntime runtime = parent.runtime();
            runtime.open();
            System.out.println(Jsons.toJson(runtime.getTaskLogs(taskId)));
            return 0;
        }
    }

    @Command(name = "current", description = "Show the running task, or the latest one")
    static final class CurrentCommand implements Callable<Integer> {
        @ParentCommand
        SpiderqCommand parent;

        @Override
        public Integer call() {
            SpiderqRuntime runtime = parent.runtime();
            runtime.open();
            Optional<TaskView> task = runtime.currentTask();
            if (task.isEmpty()) {
                printError("no tasks yet");
                return 1;
            }
            System.out.println(Jsons.toJson(task.get()));
            return 0;
        }
    }

    @Command(name = "delete-task", description = "Delete a task and its logs")
    static final class DeleteTaskCommand implements Callable<Integer> {
        @ParentCommand
        SpiderqCommand parent;

        @Parameters(index = "0", description = "Task id")
        long taskId;

        @Override
        public Integer call() {
            SpiderqRuntime runtime = parent.runtime();
            runtime.open();
            try {
                if (!runtime.deleteTask(taskId)) {
                    printError("task not found");
                    return 1;
                }
            } catch (IllegalStateException e) {
                printError(e.getMessage());
                return 1;
            }
            System.out.println(Jsons.toJson(Map.of("deleted", taskId)));
            return 0;
        }
    }

    @Command(name = "validate", description = "Check a credential with the worker's validation mode")
    static final class ValidateCommand implements Callable<Integer> {
        @ParentCommand
        SpiderqCommand parent;

        @Parameters(index = "0", description = "Credential to validate")
        String payload;

        @Override
        public Integer call() {
            SpiderqRuntime runtime = parent.runtime();
            runtime.open();
            ValidationResult result = runtime.validate(payload);
            System.out.println(Jsons.toJson(result));
            return result.valid() ? 0 : 2;
        }
    }

    @Command(name = "recover", description = "Stop stale running tasks and return orphaned queue items to pending")
    static final class RecoverCommand implements Callable<Integer> {
        @ParentCommand
        SpiderqCommand parent;

        @Override
        public Integer call() {
            SpiderqRuntime runtime = parent.runtime();
            runtime.open();
            System.out.println(Jsons.toJson(runtime.recover()));
            return 0;
        }
    }

    @Command(name = "purge", description = "Delete logs and finished tasks older than the retention period")
    static final class PurgeCommand implements Callable<Integer> {
        @ParentCommand
        SpiderqCommand parent;

        @Option(names = {"--days"}, description = "Retention in days, defaults to logRetentionDays from settings")
        Integer days;

        @Override
        public Integer call() {
            SpiderqRuntime runtime = parent.runtime();
            runtime.open();
            Duration retention = days == null || days < 1
                    ? runtime.settings().logRetention()
                    : Duration.ofDays(days);
            System.out.println(Jsons.toJson(runtime.purge(retention)));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        SpiderqCommand parent;

        @Override
        public Integer call() {
            SpiderqRuntime runtime = parent.runtime();
            int result = runtime.auditLogger().verifyChain();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("valid", result >= 0);
            if (result >= 0) {
                out.put("rows", result);
            } else {
                out.put("brokenAtLine", -result);
            }
            System.out.println(Jsons.toJson(out));
            return result >= 0 ? 0 : 1;
        }
    }
}
