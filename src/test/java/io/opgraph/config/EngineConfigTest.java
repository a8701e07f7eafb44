package io.opgraph.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class EngineConfigTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("opgraph-config-missing-");
        try {
            EngineConfig config = EngineConfig.fromDirectory(root);

            Assertions.assertEquals(EngineConfig.DEFAULT_MAX_CONCURRENT_TASKS, config.maxConcurrentTasks());
            Assertions.assertEquals(EngineConfig.DEFAULT_WORKER_CORE_THREADS, config.workerCoreThreads());
            Assertions.assertEquals(EngineConfig.DEFAULT_TIMER_THREADS, config.timerThreads());
            Assertions.assertEquals(EngineConfig.DEFAULT_AWAIT_TIMEOUT_MS, config.awaitTimeoutMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void settingsFileOverridesAndSanitizesFields() throws Exception {
        Path root = Files.createTempDirectory("opgraph-config-file-");
        try {
            Files.writeString(root.resolve(EngineConfig.SETTINGS_FILE), """
                    {
                      "maxConcurrentTasks": 3,
                      "workerCoreThreads": 2,
                      "workerKeepAliveMs": 1500,
                      "timerThreads": 0,
                      "awaitTimeoutMs": -10,
                      "unknownSetting": true
                    }
                    """, StandardCharsets.UTF_8);

            EngineConfig config = EngineConfig.fromDirectory(root);

            Assertions.assertEquals(3, config.maxConcurrentTasks());
            Assertions.assertEquals(2, config.workerCoreThreads());
            Assertions.assertEquals(1500L, config.workerKeepAliveMs());
            Assertions.assertEquals(EngineConfig.DEFAULT_TIMER_THREADS, config.timerThreads());
            Assertions.assertEquals(EngineConfig.DEFAULT_AWAIT_TIMEOUT_MS, config.awaitTimeoutMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedSettingsFileFailsLoudly() throws Exception {
        Path root = Files.createTempDirectory("opgraph-config-bad-");
        try {
            Path file = root.resolve(EngineConfig.SETTINGS_FILE);
            Files.writeString(file, "{not json", StandardCharsets.UTF_8);

            RuntimeException error = Assertions.assertThrows(RuntimeException.class, () -> EngineConfig.fromFile(file));
            Assertions.assertTrue(error.getMessage().startsWith("Failed to read engine settings"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void constructorRejectsInvalidLimits() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new EngineConfig(0, 1, 0L, 1, 1L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new EngineConfig(1, -1, 0L, 1, 1L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new EngineConfig(1, 1, 0L, 0, 1L));
        Assertions.assertEquals(7, EngineConfig.defaults().withMaxConcurrentTasks(7).maxConcurrentTasks());
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
