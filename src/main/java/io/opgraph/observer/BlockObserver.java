package io.opgraph.observer;

import io.opgraph.task.Task;
import io.opgraph.task.TaskError;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

public final class BlockObserver implements Observer {
    private final Consumer<Task> onStart;
    private final BiConsumer<Task, Task> onProduce;
    private final BiConsumer<Task, List<TaskError>> onFinish;

    public BlockObserver(
            Consumer<Task> onStart,
            BiConsumer<Task, Task> onProduce,
            BiConsumer<Task, List<TaskError>> onFinish
    ) {
        this.onStart = onStart;
        this.onProduce = onProduce;
        this.onFinish = onFinish;
    }

    public static BlockObserver onStart(Consumer<Task> onStart) {
        return new BlockObserver(onStart, null, null);
    }

    public static BlockObserver onProduce(BiConsumer<Task, Task> onProduce) {
        return new BlockObserver(null, onProduce, null);
    }

    public static BlockObserver onFinish(BiConsumer<Task, List<TaskError>> onFinish) {
        return new BlockObserver(null, null, onFinish);
    }

    @Override
    public void onStart(Task task) {
        if (onStart != null) {
            onStart.accept(task);
        }
    }

    @Override
    public void onProduce(Task task, Task produced) {
        if (onProduce != null) {
            onProduce.accept(task, produced);
        }
    }

    @Override
    public void onFinish(Task task, List<TaskError> errors) {
        if (onFinish != null) {
            onFinish.accept(task, errors);
        }
    }
}
