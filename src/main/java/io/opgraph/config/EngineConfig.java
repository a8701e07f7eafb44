package io.opgraph.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.opgraph.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tuning knobs of a scheduler and its worker pool.
 *
 * <p>{@link #fromFile(Path)} reads an optional JSON settings file; absent or out-of-range
 * fields fall back to the defaults below.
 */
public final class EngineConfig {
    public static final String SETTINGS_FILE = "opgraph-settings.json";
    public static final int DEFAULT_MAX_CONCURRENT_TASKS = 64;
    public static final int DEFAULT_WORKER_CORE_THREADS = 4;
    public static final long DEFAULT_WORKER_KEEP_ALIVE_MS = 60_000L;
    public static final int DEFAULT_TIMER_THREADS = 1;
    public static final long DEFAULT_AWAIT_TIMEOUT_MS = 30_000L;

    private final int maxConcurrentTasks;
    private final int workerCoreThreads;
    private final long workerKeepAliveMs;
    private final int timerThreads;
    private final long awaitTimeoutMs;

    public EngineConfig(
            int maxConcurrentTasks,
            int workerCoreThreads,
            long workerKeepAliveMs,
            int timerThreads,
            long awaitTimeoutMs
    ) {
        if (maxConcurrentTasks < 1) {
            throw new IllegalArgumentException("maxConcurrentTasks must be >= 1: " + maxConcurrentTasks);
        }
        if (workerCoreThreads < 0) {
            throw new IllegalArgumentException("workerCoreThreads must be >= 0: " + workerCoreThreads);
        }
        if (timerThreads < 1) {
            throw new IllegalArgumentException("timerThreads must be >= 1: " + timerThreads);
        }
        this.maxConcurrentTasks = maxConcurrentTasks;
        this.workerCoreThreads = workerCoreThreads;
        this.workerKeepAliveMs = Math.max(0L, workerKeepAliveMs);
        this.timerThreads = timerThreads;
        this.awaitTimeoutMs = Math.max(1L, awaitTimeoutMs);
    }

    public static EngineConfig defaults() {
        return new EngineConfig(
                DEFAULT_MAX_CONCURRENT_TASKS,
                DEFAULT_WORKER_CORE_THREADS,
                DEFAULT_WORKER_KEEP_ALIVE_MS,
                DEFAULT_TIMER_THREADS,
                DEFAULT_AWAIT_TIMEOUT_MS
        );
    }

    /**
     * Loads {@code file}, or returns the defaults when it does not exist.
     */
    public static EngineConfig fromFile(Path file) {
        EngineConfig defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        SettingsFile settings;
        try {
            settings = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read engine settings: " + file, e);
        }
        if (settings == null) {
            return defaults;
        }
        return new EngineConfig(
                sanitizeInt(settings.maxConcurrentTasks(), defaults.maxConcurrentTasks(), 1),
                sanitizeInt(settings.workerCoreThreads(), defaults.workerCoreThreads(), 0),
                sanitizeLong(settings.workerKeepAliveMs(), defaults.workerKeepAliveMs(), 0L),
                sanitizeInt(settings.timerThreads(), defaults.timerThreads(), 1),
                sanitizeLong(settings.awaitTimeoutMs(), defaults.awaitTimeoutMs(), 1L)
        );
    }

    public static EngineConfig fromDirectory(Path dir) {
        return fromFile(dir == null ? null : dir.resolve(SETTINGS_FILE));
    }

    public EngineConfig withMaxConcurrentTasks(int value) {
        return new EngineConfig(value, workerCoreThreads, workerKeepAliveMs, timerThreads, awaitTimeoutMs);
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    public int maxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    public int workerCoreThreads() {
        return workerCoreThreads;
    }

    public long workerKeepAliveMs() {
        return workerKeepAliveMs;
    }

    public int timerThreads() {
        return timerThreads;
    }

    public long awaitTimeoutMs() {
        return awaitTimeoutMs;
    }

    @Override
    public String toString() {
        return "EngineConfig{maxConcurrentTasks=" + maxConcurrentTasks
                + ", workerCoreThreads=" + workerCoreThreads
                + ", workerKeepAliveMs=" + workerKeepAliveMs
                + ", timerThreads=" + timerThreads
                + ", awaitTimeoutMs=" + awaitTimeoutMs + "}";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SettingsFile(
            Integer maxConcurrentTasks,
            Integer workerCoreThreads,
            Long workerKeepAliveMs,
            Integer timerThreads,
            Long awaitTimeoutMs
    ) {
    }
}
