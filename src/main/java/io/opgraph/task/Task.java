package io.opgraph.task;

import io.opgraph.condition.Condition;
import io.opgraph.observer.Observer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A unit of asynchronous work with an explicit lifecycle.
 *
 * <p>Subclasses implement {@link #execute()} and signal completion exactly once, from any
 * thread, through {@link #finish()} or a {@link FinishSignal}. Running work polls
 * {@link #isCancelled()}; nothing is interrupted. Methods after the scheduler hooks marker
 * are driven by the scheduler, not by application code.
 */
public abstract class Task {
    private static final Logger log = LoggerFactory.getLogger(Task.class);

    private final String id;
    private final String name;
    private final Object lock = new Object();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch finishedLatch = new CountDownLatch(1);

    // guarded by lock
    private final Set<Task> dependencies = new LinkedHashSet<>();
    private final List<Condition> conditions = new ArrayList<>();
    private final List<Observer> observers = new ArrayList<>();
    private final List<TaskError> errors = new ArrayList<>();
    private final List<Runnable> finishCallbacks = new ArrayList<>();
    private final List<Runnable> cancelCallbacks = new ArrayList<>();
    private TaskHost host;

    private volatile TaskState state = TaskState.INITIALIZED;

    protected Task() {
        this(null);
    }

    protected Task(String name) {
        this.id = "task-" + UUID.randomUUID();
        this.name = name == null || name.isBlank() ? getClass().getSimpleName() : name.trim();
    }

    /**
     * The work entry point. Called once, on a worker thread, after the task entered
     * {@link TaskState#EXECUTING}. An exception thrown here finishes the task with an
     * {@link TaskError.Kind#EXECUTION_FAILED} error unless it already finished.
     */
    protected abstract void execute() throws Exception;

    protected void onCancelled() {
    }

    protected void onFinishing(List<TaskError> errors) {
    }

    public final String id() {
        return id;
    }

    public final String name() {
        return name;
    }

    public final TaskState state() {
        return state;
    }

    public final boolean isCancelled() {
        return cancelled.get();
    }

    public final boolean isExecuting() {
        return state == TaskState.EXECUTING;
    }

    public final boolean isFinished() {
        return state == TaskState.FINISHED;
    }

    public final void addDependency(Task dependency) {
        Objects.requireNonNull(dependency, "dependency");
        if (dependency == this) {
            throw new IllegalArgumentException("Task cannot depend on itself: " + this);
        }
        synchronized (lock) {
            requireInitialized("add a dependency to");
            dependencies.add(dependency);
        }
    }

    public final List<Task> dependencies() {
        synchronized (lock) {
            return List.copyOf(dependencies);
        }
    }

    public final void addCondition(Condition condition) {
        Objects.requireNonNull(condition, "condition");
        synchronized (lock) {
            requireInitialized("add a condition to");
            conditions.add(condition);
        }
    }

    public final List<Condition> conditions() {
        synchronized (lock) {
            return List.copyOf(conditions);
        }
    }

    public final void addObserver(Observer observer) {
        Objects.requireNonNull(observer, "observer");
        synchronized (lock) {
            requireInitialized("add an observer to");
            observers.add(observer);
        }
    }

    public final List<Observer> observers() {
        synchronized (lock) {
            return List.copyOf(observers);
        }
    }

    public final List<TaskError> errors() {
        synchronized (lock) {
            return List.copyOf(errors);
        }
    }

    public final List<TaskError> failures() {
        synchronized (lock) {
            return errors.stream().filter(TaskError::isFailure).toList();
        }
    }

    public final boolean hasFailures() {
        return !failures().isEmpty();
    }

    public final boolean cancel() {
        return cancel(null);
    }

    /**
     * Cancels the task and records {@code error}, for instance a timeout.
     *
     * @return false if the task was already cancelled or is finishing
     */
    public final boolean cancelWithError(TaskError error) {
        return cancel(Objects.requireNonNull(error, "error"));
    }

    private boolean cancel(TaskError error) {
        List<Runnable> callbacks;
        synchronized (lock) {
            if (state == TaskState.FINISHING || state == TaskState.FINISHED) {
                return false;
            }
            if (!cancelled.compareAndSet(false, true)) {
                return false;
            }
            if (error != null) {
                errors.add(error);
            }
            callbacks = List.copyOf(cancelCallbacks);
        }
        log.debug("Task {} cancelled in state {}", this, state);
        try {
            onCancelled();
        } catch (RuntimeException e) {
            log.warn("Cancellation hook of task {} failed", this, e);
        }
        callbacks.forEach(Runnable::run);
        return true;
    }

    /**
     * Hands a new task to the owning scheduler. Only legal while executing.
     */
    public final void produce(Task task) {
        Objects.requireNonNull(task, "task");
        if (task == this) {
            throw new IllegalArgumentException("Task cannot produce itself: " + this);
        }
        if (state != TaskState.EXECUTING) {
            throw new IllegalStateException("Task " + this + " can only produce tasks while executing, state=" + state);
        }
        notifyObservers(observer -> observer.onProduce(this, task));
    }

    public final FinishSignal finishSignal() {
        return new FinishSignal(this);
    }

    protected final void finish() {
        finish(List.of());
    }

    protected final void finishWithError(Throwable cause) {
        finish(List.of(TaskError.executionFailed(cause)));
    }

    protected final void finish(List<TaskError> reported) {
        complete(reported, true);
    }

    public final boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finishedLatch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    protected final ScheduledExecutorService timer() {
        TaskHost current;
        synchronized (lock) {
            current = host;
        }
        if (current == null) {
            throw new IllegalStateException("Task " + this + " is not attached to a scheduler");
        }
        return current.timer();
    }

    // ---- scheduler hooks ----

    public final boolean attach(TaskHost owner) {
        Objects.requireNonNull(owner, "owner");
        synchronized (lock) {
            if (host != null || state != TaskState.INITIALIZED) {
                return false;
            }
            host = owner;
            return true;
        }
    }

    public final Optional<TaskHost> host() {
        synchronized (lock) {
            return Optional.ofNullable(host);
        }
    }

    public final void markPending() {
        synchronized (lock) {
            transition(TaskState.PENDING);
        }
    }

    public final boolean beginEvaluatingConditions() {
        synchronized (lock) {
            if (cancelled.get()) {
                return false;
            }
            transition(TaskState.EVALUATING_CONDITIONS);
            return true;
        }
    }

    public final void markReady() {
        synchronized (lock) {
            transition(TaskState.READY);
        }
    }

    public final boolean beginExecuting() {
        synchronized (lock) {
            if (cancelled.get()) {
                return false;
            }
            transition(TaskState.EXECUTING);
            return true;
        }
    }

    public final void start() {
        TaskState current = state;
        if (current == TaskState.FINISHING || current == TaskState.FINISHED) {
            // cancelled between dispatch and start, and already settled by onCancelled()
            log.debug("Task {} settled before it started", this);
            return;
        }
        if (current != TaskState.EXECUTING) {
            throw new IllegalStateException("Task " + this + " cannot start from state " + current);
        }
        notifyObservers(observer -> observer.onStart(this));
        try {
            execute();
        } catch (DoubleFinishException e) {
            throw e;
        } catch (Exception e) {
            failFromExecute(e);
        }
    }

    public final void finishWithoutExecuting(List<TaskError> reported) {
        complete(reported, false);
    }

    /**
     * Scheduler hook: runs {@code callback} after the task finished and its observers
     * were notified; immediately if it already finished.
     */
    public final void whenFinished(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        synchronized (lock) {
            if (state != TaskState.FINISHED) {
                finishCallbacks.add(callback);
                return;
            }
        }
        callback.run();
    }

    public final void whenCancelled(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        synchronized (lock) {
            if (!cancelled.get()) {
                cancelCallbacks.add(callback);
                return;
            }
        }
        callback.run();
    }

    private void failFromExecute(Exception e) {
        TaskState current = state;
        if (current == TaskState.FINISHING || current == TaskState.FINISHED) {
            log.warn("Task {} threw after it finished", this, e);
            return;
        }
        try {
            complete(List.of(TaskError.executionFailed(e)), true);
        } catch (DoubleFinishException raced) {
            log.warn("Task {} threw while finishing concurrently", this, e);
        }
    }

    private void complete(List<TaskError> reported, boolean requireExecuting) {
        Objects.requireNonNull(reported, "errors");
        List<TaskError> finishing;
        synchronized (lock) {
            if (state == TaskState.FINISHING || state == TaskState.FINISHED) {
                throw new DoubleFinishException(this);
            }
            if (requireExecuting && state != TaskState.EXECUTING) {
                throw new IllegalStateException("Task " + this + " cannot finish from state " + state);
            }
            if (!requireExecuting && state == TaskState.EXECUTING) {
                throw new IllegalStateException("Task " + this + " is executing and must finish itself");
            }
            transition(TaskState.FINISHING);
            errors.addAll(reported);
            finishing = List.copyOf(errors);
        }
        try {
            onFinishing(finishing);
        } catch (RuntimeException e) {
            log.warn("Finishing hook of task {} failed", this, e);
        }
        List<TaskError> settled;
        List<Runnable> callbacks;
        synchronized (lock) {
            transition(TaskState.FINISHED);
            settled = List.copyOf(errors);
            callbacks = List.copyOf(finishCallbacks);
            finishCallbacks.clear();
            cancelCallbacks.clear();
        }
        log.debug("Task {} finished with {} error(s)", this, settled.size());
        notifyObservers(observer -> observer.onFinish(this, settled));
        callbacks.forEach(Runnable::run);
        finishedLatch.countDown();
    }

    private void notifyObservers(Consumer<Observer> hook) {
        for (Observer observer : observers()) {
            try {
                hook.accept(observer);
            } catch (RuntimeException e) {
                log.warn("Observer {} of task {} failed", observer, this, e);
            }
        }
    }

    private void transition(TaskState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next + " for task " + this);
        }
        state = next;
    }

    private void requireInitialized(String action) {
        if (state != TaskState.INITIALIZED) {
            throw new IllegalStateException("Cannot " + action + " task " + this + " after submission");
        }
    }

    @Override
    public String toString() {
        return name + "[" + id + "]";
    }
}
