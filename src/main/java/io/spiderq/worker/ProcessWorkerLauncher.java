package io.spiderq.worker;

import io.spiderq.config.SpiderqSettings;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Launches {@code workerCommand + args} as an OS process. Stdout and stderr stay separate pipes; stdin is closed
 * right away since the worker gets everything it needs as an argument.
 */
public final class ProcessWorkerLauncher implements WorkerLauncher {
    private final List<String> command;
    private final String workingDir;
    private final Map<String, String> env;

    public ProcessWorkerLauncher(List<String> command, String workingDir, Map<String, String> env) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("worker command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.workingDir = workingDir;
        this.env = env == null ? Map.of() : Map.copyOf(env);
    }

    public static ProcessWorkerLauncher fromSettings(SpiderqSettings settings) {
        return new ProcessWorkerLauncher(settings.workerCommand(), settings.workerWorkingDir(), settings.workerEnv());
    }

    @Override
    public Process launch(List<String> args) throws IOException {
        List<String> full = new ArrayList<>(command);
        full.addAll(args);
        ProcessBuilder pb = new ProcessBuilder(full);
        if (workingDir != null) {
            pb.directory(new File(workingDir));
        }
        pb.environment().putAll(env);
        Process process = pb.start();
        process.getOutputStream().close();
        return process;
    }
}
