package io.spiderq.config;

import io.spiderq.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables read from {@code spiderq-settings.json} in the data root.
 *
 * <p>Every field of the file is optional; missing or out-of-range values fall back to
 * {@link #defaults()}.
 */
public record SpiderqSettings(
        List<String> workerCommand,
        String workerWorkingDir,
        Map<String, String> workerEnv,
        long settleDelayMs,
        long staleTaskThresholdMs,
        long stopGraceMs,
        long validateTimeoutMs,
        int logRetentionDays,
        int maxFrameBytes
) {
    public static final long DEFAULT_SETTLE_DELAY_MS = 1_000L;
    public static final long DEFAULT_STALE_TASK_THRESHOLD_MS = 10L * 60L * 1000L;
    public static final long DEFAULT_STOP_GRACE_MS = 5_000L;
    public static final long DEFAULT_VALIDATE_TIMEOUT_MS = 60_000L;
    public static final int DEFAULT_LOG_RETENTION_DAYS = 30;
    public static final int DEFAULT_MAX_FRAME_BYTES = 1024 * 1024;

    public SpiderqSettings {
        workerCommand = List.copyOf(workerCommand);
        workerEnv = Map.copyOf(workerEnv);
    }

    public static SpiderqSettings defaults() {
        return new SpiderqSettings(
                List.of("python", "python-engine/cli.py"),
                null,
                Map.of(),
                DEFAULT_SETTLE_DELAY_MS,
                DEFAULT_STALE_TASK_THRESHOLD_MS,
                DEFAULT_STOP_GRACE_MS,
                DEFAULT_VALIDATE_TIMEOUT_MS,
                DEFAULT_LOG_RETENTION_DAYS,
                DEFAULT_MAX_FRAME_BYTES
        );
    }

    public static SpiderqSettings load(Path file) {
        SpiderqSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + file, e);
        }
    }

    static SpiderqSettings fromFile(SettingsFile file, SpiderqSettings defaults) {
        if (file == null) {
            return defaults;
        }
        List<String> command = defaults.workerCommand();
        if (file.workerCommand() != null && !file.workerCommand().isEmpty()
                && file.workerCommand().stream().noneMatch(s -> s == null || s.isBlank())) {
            command = file.workerCommand();
        }
        String workingDir = file.workerWorkingDir() == null || file.workerWorkingDir().isBlank()
                ? defaults.workerWorkingDir()
                : file.workerWorkingDir().trim();
        Map<String, String> env = new LinkedHashMap<>(defaults.workerEnv());
        if (file.workerEnv() != null) {
            file.workerEnv().forEach((k, v) -> {
                if (k != null && !k.isBlank() && v != null) {
                    env.put(k, v);
                }
            });
        }
        return new SpiderqSettings(
                command,
                workingDir,
                env,
                sanitizeLong(file.settleDelayMs(), defaults.settleDelayMs(), 0L),
                sanitizeLong(file.staleTaskThresholdMs(), defaults.staleTaskThresholdMs(), 1_000L),
                sanitizeLong(file.stopGraceMs(), defaults.stopGraceMs(), 0L),
                sanitizeLong(file.validateTimeoutMs(), defaults.validateTimeoutMs(), 1_000L),
                sanitizeInt(file.logRetentionDays(), defaults.logRetentionDays(), 1),
                sanitizeInt(file.maxFrameBytes(), defaults.maxFrameBytes(), 1024)
        );
    }

    public Duration settleDelay() {
        return Duration.ofMillis(settleDelayMs);
    }

    public Duration staleTaskThreshold() {
        return Duration.ofMillis(staleTaskThresholdMs);
    }

    public Duration stopGrace() {
        return Duration.ofMillis(stopGraceMs);
    }

    public Duration validateTimeout() {
        return Duration.ofMillis(validateTimeoutMs);
    }

    public Duration logRetention() {
        return Duration.ofDays(logRetentionDays);
    }

    public SpiderqSettings withSettleDelayMs(long value) {
        return new SpiderqSettings(workerCommand, workerWorkingDir, workerEnv, value, staleTaskThresholdMs,
                stopGraceMs, validateTimeoutMs, logRetentionDays, maxFrameBytes);
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    record SettingsFile(
            List<String> workerCommand,
            String workerWorkingDir,
            Map<String, String> workerEnv,
            Long settleDelayMs,
            Long staleTaskThresholdMs,
            Long stopGraceMs,
            Long validateTimeoutMs,
            Integer logRetentionDays,
            Integer maxFrameBytes
    ) {
    }
}
