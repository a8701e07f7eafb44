package io.opgraph.task;

import java.util.concurrent.ScheduledExecutorService;

/**
 * The scheduler a task is attached to, as seen from the task.
 */
public interface TaskHost {
    String name();

    ScheduledExecutorService timer();
}
