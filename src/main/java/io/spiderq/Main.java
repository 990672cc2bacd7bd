package io.spiderq;

import io.spiderq.cli.SpiderqCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SpiderqCommand()).execute(args);
        System.exit(code);
    }
}
