package io.opgraph.observer;

import io.opgraph.task.Task;
import io.opgraph.task.TaskError;

import java.util.List;

/**
 * Passive lifecycle listener attached to a task before submission. Hooks run on whatever
 * thread drives the transition and must not block. An exception thrown from a hook is
 * logged and does not affect the task.
 */
public interface Observer {
    default void onStart(Task task) {
    }

    default void onProduce(Task task, Task produced) {
    }

    default void onFinish(Task task, List<TaskError> errors) {
    }
}
