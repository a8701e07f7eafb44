package io.opgraph.scheduler;

import io.opgraph.condition.Condition;
import io.opgraph.condition.ConditionResult;
import io.opgraph.config.EngineConfig;
import io.opgraph.observer.Observer;
import io.opgraph.task.DoubleFinishException;
import io.opgraph.task.Task;
import io.opgraph.task.TaskError;
import io.opgraph.task.TaskHost;
import io.opgraph.task.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Admits tasks to execution once their dependencies finished, their conditions are
 * satisfied and their exclusivity categories are free. All admission bookkeeping runs on
 * one serial executor per scheduler; task work runs on the worker pool.
 */
public final class Scheduler implements TaskHost {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final String name;
    private final EngineConfig config;
    private final WorkerPool pool;
    private final ExclusivityController exclusivity;
    private final SerialExecutor admission;
    private final Set<Task> tracked = ConcurrentHashMap.newKeySet();
    private final List<SchedulerListener> listeners = new CopyOnWriteArrayList<>();
    private final Object idleLock = new Object();
    private volatile boolean suspended;

    // confined to the admission executor
    private final Map<Task, Evaluation> evaluations = new HashMap<>();
    private final LinkedHashSet<Task> ready = new LinkedHashSet<>();
    private final Set<Task> executing = new HashSet<>();

    public Scheduler(String name) {
        this(name, EngineConfig.defaults(), WorkerPool.common());
    }

    public Scheduler(String name, EngineConfig config, WorkerPool pool) {
        this(name, config, pool, new ExclusivityController());
    }

    public Scheduler(String name, EngineConfig config, WorkerPool pool, ExclusivityController exclusivity) {
        this.name = name == null || name.isBlank() ? "scheduler" : name.trim();
        this.config = Objects.requireNonNull(config, "config");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.exclusivity = Objects.requireNonNull(exclusivity, "exclusivity");
        this.admission = new SerialExecutor(this.name + "-admission", pool.workers());
    }

    /**
     * Starts tracking {@code task}.
     *
     * @return false if the task was already submitted to this or another scheduler
     */
    public boolean submit(Task task) {
        Objects.requireNonNull(task, "task");
        if (task.host().isPresent() || task.state() != TaskState.INITIALIZED) {
            log.warn("Rejected submit of task {} to scheduler {}: already submitted (state={})", task, name, task.state());
            return false;
        }
        List<Condition> conditions = task.conditions();
        List<Task> conditionDependencies = new ArrayList<>();
        for (Condition condition : conditions) {
            Optional<Task> dependency = condition.dependency(task);
            dependency.ifPresent(conditionDependencies::add);
        }
        if (!task.attach(this)) {
            log.warn("Rejected submit of task {} to scheduler {}: submitted concurrently", task, name);
            return false;
        }
        tracked.add(task);
        for (Task dependency : conditionDependencies) {
            task.addDependency(dependency);
            if (dependency.host().isEmpty() && dependency.state() == TaskState.INITIALIZED) {
                submit(dependency);
            }
        }
        Set<String> categories = new LinkedHashSet<>();
        for (Condition condition : conditions) {
            if (condition.isMutuallyExclusive()) {
                categories.add(condition.exclusivityCategory());
            }
        }
        exclusivity.register(task, categories, () -> admission.execute(() -> advance(task)));
        task.addObserver(new Relay());
        for (Task dependency : task.dependencies()) {
            dependency.whenFinished(() -> admission.execute(() -> advance(task)));
        }
        task.whenCancelled(() -> admission.execute(() -> advance(task)));
        task.markPending();
        log.debug("Scheduler {} accepted task {}", name, task);
        for (SchedulerListener listener : listeners) {
            try {
                listener.onSubmitted(this, task);
            } catch (RuntimeException e) {
                log.warn("Scheduler listener {} failed on submit of {}", listener, task, e);
            }
        }
        admission.execute(() -> advance(task));
        return true;
    }

    public int submit(Collection<? extends Task> tasks) {
        Objects.requireNonNull(tasks, "tasks");
        int accepted = 0;
        for (Task task : tasks) {
            if (submit(task)) {
                accepted++;
            }
        }
        return accepted;
    }

    public void cancelAll() {
        List<Task> snapshot = List.copyOf(tracked);
        log.debug("Scheduler {} cancelling {} task(s)", name, snapshot.size());
        snapshot.forEach(Task::cancel);
    }

    public void suspend() {
        suspended = true;
    }

    public void resume() {
        suspended = false;
        admission.execute(this::dispatchReady);
    }

    public boolean isSuspended() {
        return suspended;
    }

    public void addListener(SchedulerListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(SchedulerListener listener) {
        listeners.remove(listener);
    }

    /**
     * Blocks the caller until no task is tracked.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleLock) {
            while (!tracked.isEmpty()) {
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
                if (remainingMs <= 0L) {
                    return false;
                }
                idleLock.wait(remainingMs);
            }
        }
        return true;
    }

    public boolean isIdle() {
        return tracked.isEmpty();
    }

    public int trackedCount() {
        return tracked.size();
    }

    public List<Task> trackedTasks() {
        return List.copyOf(tracked);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ScheduledExecutorService timer() {
        return pool.timer();
    }

    public EngineConfig config() {
        return config;
    }

    public WorkerPool pool() {
        return pool;
    }

    public ExclusivityController exclusivity() {
        return exclusivity;
    }

    @Override
    public String toString() {
        return "Scheduler[" + name + "]";
    }

    private void advance(Task task) {
        switch (task.state()) {
            case PENDING -> {
                if (task.isCancelled()) {
                    finishUnstarted(task, List.of(TaskError.cancelled()));
                    return;
                }
                for (Task dependency : task.dependencies()) {
                    if (!dependency.isFinished()) {
                        return;
                    }
                }
                if (!task.beginEvaluatingConditions()) {
                    finishUnstarted(task, List.of(TaskError.cancelled()));
                    return;
                }
                evaluateConditions(task);
            }
            case READY -> {
                if (task.isCancelled()) {
                    ready.remove(task);
                    finishUnstarted(task, List.of(TaskError.cancelled()));
                    return;
                }
                ready.add(task);
                dispatchReady();
            }
            case EVALUATING_CONDITIONS -> {
                if (task.isCancelled() && evaluations.remove(task) != null) {
                    finishUnstarted(task, List.of(TaskError.cancelled()));
                }
            }
            default -> {
                // past admission
            }
        }
    }

    private void evaluateConditions(Task task) {
        List<Condition> conditions = task.conditions();
        if (conditions.isEmpty()) {
            task.markReady();
            advance(task);
            return;
        }
        evaluations.put(task, new Evaluation(conditions.size()));
        for (int i = 0; i < conditions.size(); i++) {
            int index = i;
            Condition condition = conditions.get(i);
            AtomicBoolean reported = new AtomicBoolean(false);
            Consumer<ConditionResult> completion = result -> {
                if (!reported.compareAndSet(false, true)) {
                    log.warn("Condition {} reported more than once for task {}", condition.category(), task);
                    return;
                }
                ConditionResult verdict = result == null
                        ? ConditionResult.failed(condition.category(), "condition reported no result")
                        : result;
                admission.execute(() -> onConditionResult(task, index, condition, verdict));
            };
            pool.workers().execute(() -> {
                try {
                    condition.evaluate(task, completion);
                } catch (RuntimeException e) {
                    completion.accept(ConditionResult.failed(e));
                }
            });
        }
    }

    private void onConditionResult(Task task, int index, Condition condition, ConditionResult result) {
        Evaluation evaluation = evaluations.get(task);
        if (evaluation == null) {
            log.debug("Ignoring verdict of {} for task {}: evaluation already settled", condition.category(), task);
            return;
        }
        if (!result.isSatisfied()) {
            evaluations.remove(task);
            log.debug("Task {} vetoed by condition {}", task, condition.category());
            task.cancel();
            finishUnstarted(task, List.of(TaskError.conditionFailed(condition.category(), result.error())));
            return;
        }
        if (evaluation.satisfied(index)) {
            evaluations.remove(task);
            task.markReady();
            advance(task);
        }
    }

    private void dispatchReady() {
        if (suspended) {
            return;
        }
        Iterator<Task> candidates = ready.iterator();
        while (candidates.hasNext() && executing.size() < config.maxConcurrentTasks()) {
            Task task = candidates.next();
            if (!exclusivity.isEligible(task)) {
                continue;
            }
            candidates.remove();
            if (!task.beginExecuting()) {
                finishUnstarted(task, List.of(TaskError.cancelled()));
                continue;
            }
            executing.add(task);
            try {
                pool.workers().execute(() -> run(task));
            } catch (RejectedExecutionException e) {
                log.error("Worker pool {} rejected task {}", pool.name(), task, e);
                task.finishSignal().fail(e);
            }
        }
    }

    private void run(Task task) {
        try {
            task.start();
        } catch (DoubleFinishException e) {
            log.error("Task {} finished more than once on scheduler {}", task, name, e);
        } catch (RuntimeException e) {
            log.error("Task {} could not start on scheduler {}", task, name, e);
        }
    }

    private void finishUnstarted(Task task, List<TaskError> errors) {
        try {
            task.finishWithoutExecuting(errors);
        } catch (IllegalStateException e) {
            log.error("Task {} could not be finished by scheduler {}", task, name, e);
        }
    }

    private void onTaskFinished(Task task, List<TaskError> errors) {
        ready.remove(task);
        evaluations.remove(task);
        executing.remove(task);
        tracked.remove(task);
        for (SchedulerListener listener : listeners) {
            try {
                listener.onFinished(this, task, errors);
            } catch (RuntimeException e) {
                log.warn("Scheduler listener {} failed on finish of {}", listener, task, e);
            }
        }
        dispatchReady();
        if (tracked.isEmpty()) {
            synchronized (idleLock) {
                idleLock.notifyAll();
            }
        }
    }

    // relays produced tasks and settles bookkeeping on finish
    private final class Relay implements Observer {
        @Override
        public void onProduce(Task task, Task produced) {
            if (!submit(produced)) {
                log.warn("Task {} produced {} which could not be submitted", task, produced);
            }
        }

        @Override
        public void onFinish(Task task, List<TaskError> errors) {
            exclusivity.release(task);
            admission.execute(() -> onTaskFinished(task, errors));
        }

        @Override
        public String toString() {
            return "SchedulerRelay[" + name + "]";
        }
    }

    private static final class Evaluation {
        private final boolean[] satisfied;
        private int remaining;

        Evaluation(int size) {
            this.satisfied = new boolean[size];
            this.remaining = size;
        }

        // true once every condition is satisfied
        boolean satisfied(int index) {
            if (!satisfied[index]) {
                satisfied[index] = true;
                remaining--;
            }
            return remaining == 0;
        }
    }
}
