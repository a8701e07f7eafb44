package io.opgraph.group;

import io.opgraph.config.EngineConfig;
import io.opgraph.scheduler.ExclusivityController;
import io.opgraph.scheduler.Scheduler;
import io.opgraph.scheduler.SchedulerListener;
import io.opgraph.scheduler.WorkerPool;
import io.opgraph.task.Task;
import io.opgraph.task.TaskError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A task that runs a set of child tasks on a private scheduler and finishes once none of
 * them is left.
 *
 * <p>The private scheduler stays suspended until the group executes, so children are
 * evaluated for admission as soon as they are added but never dispatched early. Child
 * failures become the group's errors in the order the children finished; a cancelled
 * child does not cancel the group. Cancelling the group cancels every child and the group
 * finishes once they have all settled.
 */
public class GroupTask extends Task {
    private static final Logger log = LoggerFactory.getLogger(GroupTask.class);

    private final Scheduler children;
    private final List<TaskError> aggregated = new ArrayList<>();
    private boolean running;
    private boolean settled;

    public GroupTask(String name, List<? extends Task> initial) {
        this(name, initial, EngineConfig.defaults(), WorkerPool.common(), new ExclusivityController());
    }

    public GroupTask(
            String name,
            List<? extends Task> initial,
            EngineConfig config,
            WorkerPool pool,
            ExclusivityController exclusivity
    ) {
        super(name);
        Objects.requireNonNull(initial, "initial");
        this.children = new Scheduler(name() + "-children", config, pool, exclusivity);
        this.children.suspend();
        this.children.addListener(new SchedulerListener() {
            @Override
            public void onFinished(Scheduler scheduler, Task child, List<TaskError> errors) {
                childFinished(child);
            }
        });
        for (Task child : initial) {
            addChild(child);
        }
    }

    /**
     * Adds a child while the group has not finished.
     *
     * @throws IllegalStateException if the group finished or the child was submitted elsewhere
     */
    public final void addChild(Task child) {
        Objects.requireNonNull(child, "child");
        synchronized (this) {
            if (settled) {
                throw new IllegalStateException("Group " + this + " already finished");
            }
            if (!children.submit(child)) {
                throw new IllegalStateException("Task " + child + " could not join group " + this);
            }
        }
        if (isCancelled()) {
            child.cancel();
        }
    }

    public int pendingChildren() {
        return children.trackedCount();
    }

    @Override
    protected void execute() {
        synchronized (this) {
            running = true;
        }
        children.resume();
        checkCompletion();
    }

    @Override
    protected void onCancelled() {
        children.cancelAll();
    }

    @Override
    protected void onFinishing(List<TaskError> errors) {
        synchronized (this) {
            settled = true;
        }
    }

    private void childFinished(Task child) {
        List<TaskError> failures = child.failures();
        if (!failures.isEmpty()) {
            log.debug("Group {} child {} finished with {} failure(s)", this, child, failures.size());
        }
        synchronized (this) {
            aggregated.addAll(failures);
        }
        checkCompletion();
    }

    private void checkCompletion() {
        List<TaskError> result;
        synchronized (this) {
            if (!running || settled || !children.isIdle()) {
                return;
            }
            settled = true;
            result = new ArrayList<>(aggregated);
        }
        if (isCancelled()) {
            result.add(TaskError.cancelled());
        }
        finish(result);
    }
}
