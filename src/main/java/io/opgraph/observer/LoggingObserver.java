package io.opgraph.observer;

import io.opgraph.task.Task;
import io.opgraph.task.TaskError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public final class LoggingObserver implements Observer {
    private static final Logger log = LoggerFactory.getLogger(LoggingObserver.class);

    @Override
    public void onStart(Task task) {
        log.info("task.start name={} id={}", task.name(), task.id());
    }

    @Override
    public void onProduce(Task task, Task produced) {
        log.info("task.produce name={} id={} produced={}", task.name(), task.id(), produced);
    }

    @Override
    public void onFinish(Task task, List<TaskError> errors) {
        List<TaskError> failures = errors.stream().filter(TaskError::isFailure).toList();
        if (failures.isEmpty()) {
            log.info("task.finish name={} id={} cancelled={}", task.name(), task.id(), task.isCancelled());
            return;
        }
        for (TaskError failure : failures) {
            log.warn("task.finish name={} id={} error={} {}", task.name(), task.id(), failure.kind(), failure.message());
        }
    }
}
