package io.opgraph.cli;

import io.opgraph.condition.MutuallyExclusive;
import io.opgraph.config.EngineConfig;
import io.opgraph.group.GroupTask;
import io.opgraph.observability.TaskJournal;
import io.opgraph.observer.LoggingObserver;
import io.opgraph.scheduler.Scheduler;
import io.opgraph.scheduler.WorkerPool;
import io.opgraph.task.BlockTask;
import io.opgraph.task.DelayTask;
import io.opgraph.task.Task;
import io.opgraph.task.TaskError;
import io.opgraph.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

@Command(
        name = "opgraph",
        mixinStandardHelpOptions = true,
        description = "Runs small task graphs on an opgraph scheduler and prints the outcome as JSON",
        subcommands = {
                OpGraphCommand.DelayCommand.class,
                OpGraphCommand.GroupCommand.class,
                OpGraphCommand.ExclusiveCommand.class
        }
)
public final class OpGraphCommand implements Runnable {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_TIMEOUT = 2;

    @Option(names = {"--config"}, description = "Engine settings JSON file (defaults when absent)")
    Path config;

    @Option(names = {"--journal"}, description = "Append task lifecycle events to this JSON-lines file")
    Path journal;

    @Option(names = {"--verbose"}, defaultValue = "false", description = "Log task lifecycle events")
    boolean verbose;

    private TaskJournal journalInstance;

    @Override
    public void run() {
        System.out.println("Use subcommands: delay | group | exclusive");
    }

    EngineConfig engineConfig() {
        return EngineConfig.fromFile(config);
    }

    void instrument(Task task) {
        if (journal != null) {
            task.addObserver(journalObserver());
        }
        if (verbose) {
            task.addObserver(new LoggingObserver());
        }
    }

    private synchronized TaskJournal journalObserver() {
        if (journalInstance == null) {
            journalInstance = new TaskJournal(journal);
        }
        return journalInstance;
    }

    int await(Scheduler scheduler, Task root, EngineConfig engine) throws InterruptedException {
        if (!root.awaitFinished(Duration.ofMillis(engine.awaitTimeoutMs()))) {
            scheduler.cancelAll();
            return EXIT_TIMEOUT;
        }
        return root.hasFailures() ? EXIT_FAILED : EXIT_OK;
    }

    static TaskOutcome outcome(Task task, long startedNanos) {
        List<String> errors = new ArrayList<>();
        for (TaskError error : task.errors()) {
            errors.add(error.kind() + ": " + error.message());
        }
        return new TaskOutcome(
                task.id(),
                task.name(),
                task.state().name(),
                task.isCancelled(),
                errors,
                (System.nanoTime() - startedNanos) / 1_000_000L
        );
    }

    @Command(name = "delay", description = "Run a single delay task")
    static final class DelayCommand implements Callable<Integer> {
        @ParentCommand
        OpGraphCommand parent;

        @Option(names = {"--interval-ms"}, defaultValue = "100", description = "Delay interval in ms, zero or negative finishes at once")
        long intervalMs;

        @Override
        public Integer call() throws Exception {
            EngineConfig engine = parent.engineConfig();
            try (WorkerPool pool = new WorkerPool("opgraph-cli", engine)) {
                Scheduler scheduler = new Scheduler("delay", engine, pool);
                DelayTask delay = DelayTask.ofMillis(intervalMs);
                parent.instrument(delay);
                long started = System.nanoTime();
                scheduler.submit(delay);
                int code = parent.await(scheduler, delay, engine);
                System.out.println(Jsons.toJson(outcome(delay, started)));
                return code;
            }
        }
    }

    @Command(name = "group", description = "Run a group of delay children, optionally with one failing child")
    static final class GroupCommand implements Callable<Integer> {
        @ParentCommand
        OpGraphCommand parent;

        @Option(names = {"--children"}, defaultValue = "3", description = "Number of children")
        int children;

        @Option(names = {"--fail-index"}, defaultValue = "-1", description = "Index of the child that fails, -1 for none")
        int failIndex;

        @Option(names = {"--delay-ms"}, defaultValue = "50", description = "Delay of each non-failing child in ms")
        long delayMs;

        @Override
        public Integer call() throws Exception {
            EngineConfig engine = parent.engineConfig();
            try (WorkerPool pool = new WorkerPool("opgraph-cli", engine)) {
                Scheduler scheduler = new Scheduler("group", engine, pool);
                List<Task> members = new ArrayList<>();
                for (int i = 0; i < Math.max(0, children); i++) {
                    Task child;
                    if (i == failIndex) {
                        int index = i;
                        child = BlockTask.of("child-" + i, task -> {
                            throw new IllegalStateException("child " + index + " failed on purpose");
                        });
                    } else {
                        child = DelayTask.ofMillis(delayMs);
                    }
                    parent.instrument(child);
                    members.add(child);
                }
                GroupTask group = new GroupTask("group", members, engine, pool, scheduler.exclusivity());
                parent.instrument(group);
                long started = System.nanoTime();
                scheduler.submit(group);
                int code = parent.await(scheduler, group, engine);
                List<TaskOutcome> childOutcomes = new ArrayList<>();
                for (Task child : members) {
                    childOutcomes.add(outcome(child, started));
                }
                System.out.println(Jsons.toJson(new GroupOutcome(outcome(group, started), childOutcomes)));
                return code;
            }
        }
    }

    @Command(name = "exclusive", description = "Run tasks that share one exclusivity category")
    static final class ExclusiveCommand implements Callable<Integer> {
        @ParentCommand
        OpGraphCommand parent;

        @Option(names = {"--tasks"}, defaultValue = "4", description = "Number of tasks")
        int tasks;

        @Option(names = {"--category"}, defaultValue = "exclusive", description = "Shared exclusivity category")
        String category;

        @Option(names = {"--work-ms"}, defaultValue = "20", description = "Time each task holds the category in ms")
        long workMs;

        @Override
        public Integer call() throws Exception {
            EngineConfig engine = parent.engineConfig();
            try (WorkerPool pool = new WorkerPool("opgraph-cli", engine)) {
                Scheduler scheduler = new Scheduler("exclusive", engine, pool);
                List<String> order = new CopyOnWriteArrayList<>();
                AtomicInteger running = new AtomicInteger();
                AtomicInteger maxRunning = new AtomicInteger();
                List<Task> submitted = new ArrayList<>();
                for (int i = 0; i < Math.max(0, tasks); i++) {
                    BlockTask task = BlockTask.of("exclusive-" + i, self -> {
                        maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                        order.add(self.name());
                        Thread.sleep(workMs);
                        running.decrementAndGet();
                    });
                    task.addCondition(MutuallyExclusive.category(category));
                    parent.instrument(task);
                    submitted.add(task);
                }
                long started = System.nanoTime();
                scheduler.submit(submitted);
                boolean idle = scheduler.awaitIdle(Duration.ofMillis(engine.awaitTimeoutMs()));
                if (!idle) {
                    scheduler.cancelAll();
                }
                boolean failed = submitted.stream().anyMatch(Task::hasFailures);
                System.out.println(Jsons.toJson(new ExclusiveOutcome(
                        category,
                        order,
                        maxRunning.get(),
                        (System.nanoTime() - started) / 1_000_000L
                )));
                if (!idle) {
                    return EXIT_TIMEOUT;
                }
                return failed ? EXIT_FAILED : EXIT_OK;
            }
        }
    }

    record TaskOutcome(
            String id,
            String name,
            String state,
            boolean cancelled,
            List<String> errors,
            long elapsedMs
    ) {
    }

    record GroupOutcome(TaskOutcome group, List<TaskOutcome> children) {
    }

    record ExclusiveOutcome(String category, List<String> executionOrder, int maxConcurrent, long elapsedMs) {
    }
}
