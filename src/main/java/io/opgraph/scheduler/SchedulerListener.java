package io.opgraph.scheduler;

import io.opgraph.task.Task;
import io.opgraph.task.TaskError;

import java.util.List;

/**
 * Scheduler-level notifications. {@code onFinished} runs on the scheduler's admission
 * executor after the task left the tracked set, so {@link Scheduler#trackedCount()}
 * already excludes it.
 */
public interface SchedulerListener {
    default void onSubmitted(Scheduler scheduler, Task task) {
    }

    default void onFinished(Scheduler scheduler, Task task, List<TaskError> errors) {
    }
}
