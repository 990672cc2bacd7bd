package io.spiderq.worker;

import java.io.IOException;
import java.util.List;

/**
 * Starts a worker process with the given trailing arguments.
 */
@FunctionalInterface
public interface WorkerLauncher {
    Process launch(List<String> args) throws IOException;
}
