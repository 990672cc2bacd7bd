package io.spiderq.model;

public record QueueStats(
        int pending,
        int running,
        int completed,
        int failed,
        int total
) {
    public static QueueStats empty() {
        return new QueueStats(0, 0, 0, 0, 0);
    }
}
