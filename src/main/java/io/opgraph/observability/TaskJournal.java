package io.opgraph.observability;

import io.opgraph.observer.Observer;
import io.opgraph.task.Task;
import io.opgraph.task.TaskError;
import io.opgraph.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Appends one JSON object per task lifecycle event to a JSON-lines file.
 * A single journal may observe any number of tasks.
 */
public final class TaskJournal implements Observer {
    public static final String EVENT_START = "task.start";
    public static final String EVENT_PRODUCE = "task.produce";
    public static final String EVENT_FINISH = "task.finish";

    private final Path journalFile;
    private final Clock clock;

    public TaskJournal(Path journalFile) {
        this(journalFile, Clock.systemUTC());
    }

    public TaskJournal(Path journalFile, Clock clock) {
        this.journalFile = Objects.requireNonNull(journalFile, "journalFile");
        this.clock = Objects.requireNonNull(clock, "clock");
        try {
            Path parent = journalFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize task journal: " + journalFile, e);
        }
    }

    public Path journalFile() {
        return journalFile;
    }

    @Override
    public void onStart(Task task) {
        append(row(EVENT_START, task));
    }

    @Override
    public void onProduce(Task task, Task produced) {
        Map<String, Object> row = row(EVENT_PRODUCE, task);
        row.put("produced_id", produced.id());
        row.put("produced_name", produced.name());
        append(row);
    }

    @Override
    public void onFinish(Task task, List<TaskError> errors) {
        Map<String, Object> row = row(EVENT_FINISH, task);
        row.put("cancelled", task.isCancelled());
        List<Map<String, Object>> rendered = new ArrayList<>();
        for (TaskError error : errors) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("kind", error.kind().name());
            item.put("category", error.category());
            item.put("message", error.message());
            rendered.add(item);
        }
        row.put("errors", rendered);
        append(row);
    }

    private Map<String, Object> row(String event, Task task) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("event", event);
        row.put("task_id", task.id());
        row.put("task_name", task.name());
        return row;
    }

    private synchronized void append(Map<String, Object> row) {
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(journalFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write task journal", e);
        }
    }
}
