package io.opgraph.scheduler;

import io.opgraph.condition.BlockCondition;
import io.opgraph.config.EngineConfig;
import io.opgraph.observer.BlockObserver;
import io.opgraph.task.BlockTask;
import io.opgraph.task.DelayTask;
import io.opgraph.task.Task;
import io.opgraph.task.TaskError;
import io.opgraph.task.TaskState;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

final class SchedulerTest {
    private static final Duration WAIT = Duration.ofSeconds(5);

    @Test
    void dependentEvaluatesOnlyAfterDependencyFinished() throws Exception {
        Scheduler scheduler = new Scheduler("deps");
        BlockTask first = BlockTask.of("first", self -> Thread.sleep(40));
        BlockTask second = BlockTask.of("second", self -> Thread.sleep(10));
        BlockTask third = BlockTask.noop("third");
        AtomicBoolean depsFinishedAtEvaluation = new AtomicBoolean(false);
        third.addDependency(first);
        third.addDependency(second);
        third.addCondition(new BlockCondition("DependenciesDone", task -> {
            depsFinishedAtEvaluation.set(first.isFinished() && second.isFinished());
            return true;
        }));

        // submitted before its dependencies on purpose
        Assertions.assertTrue(scheduler.submit(third));
        Assertions.assertEquals(2, scheduler.submit(List.of(first, second)));

        Assertions.assertTrue(third.awaitFinished(WAIT));
        Assertions.assertTrue(depsFinishedAtEvaluation.get());
        Assertions.assertTrue(scheduler.awaitIdle(WAIT));
    }

    @Test
    void failedDependencyDoesNotBlockDependent() throws Exception {
        Scheduler scheduler = new Scheduler("failed-dep");
        BlockTask failing = BlockTask.of("failing", self -> {
            throw new IllegalStateException("nope");
        });
        AtomicBoolean ran = new AtomicBoolean(false);
        BlockTask dependent = BlockTask.of("dependent", self -> ran.set(true));
        dependent.addDependency(failing);

        scheduler.submit(List.of(failing, dependent));

        Assertions.assertTrue(dependent.awaitFinished(WAIT));
        Assertions.assertTrue(failing.hasFailures());
        Assertions.assertTrue(ran.get());
        Assertions.assertTrue(dependent.errors().isEmpty());
    }

    @Test
    void dependencyOnAnotherSchedulerIsHonoured() throws Exception {
        Scheduler upstream = new Scheduler("upstream");
        Scheduler downstream = new Scheduler("downstream");
        DelayTask dependency = DelayTask.ofMillis(40);
        AtomicBoolean dependencyFinished = new AtomicBoolean(false);
        BlockTask dependent = BlockTask.of("dependent", self -> dependencyFinished.set(dependency.isFinished()));
        dependent.addDependency(dependency);

        downstream.submit(dependent);
        upstream.submit(dependency);

        Assertions.assertTrue(dependent.awaitFinished(WAIT));
        Assertions.assertTrue(dependencyFinished.get());
    }

    @Test
    void secondSubmitOfSameTaskIsRejected() throws Exception {
        Scheduler scheduler = new Scheduler("dup");
        Scheduler other = new Scheduler("dup-other");
        AtomicInteger runs = new AtomicInteger();
        BlockTask task = BlockTask.of("once", self -> runs.incrementAndGet());

        Assertions.assertTrue(scheduler.submit(task));
        Assertions.assertFalse(scheduler.submit(task));
        Assertions.assertFalse(other.submit(task));

        Assertions.assertTrue(task.awaitFinished(WAIT));
        Assertions.assertTrue(scheduler.awaitIdle(WAIT));
        Assertions.assertFalse(scheduler.submit(task));
        Assertions.assertEquals(1, runs.get());
        Assertions.assertEquals(0, other.trackedCount());
    }

    @Test
    void suspendedSchedulerDispatchesInEligibilityOrderOnResume() throws Exception {
        Scheduler scheduler = new Scheduler("suspend", EngineConfig.defaults().withMaxConcurrentTasks(1), WorkerPool.common());
        List<String> order = new CopyOnWriteArrayList<>();
        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            tasks.add(BlockTask.of("t" + i, self -> order.add(self.name())));
        }
        scheduler.suspend();
        Assertions.assertTrue(scheduler.isSuspended());

        scheduler.submit(tasks);
        waitForState(tasks.get(3), TaskState.READY);
        Assertions.assertTrue(order.isEmpty());
        Assertions.assertEquals(4, scheduler.trackedCount());

        scheduler.resume();

        Assertions.assertTrue(scheduler.awaitIdle(WAIT));
        Assertions.assertEquals(List.of("t0", "t1", "t2", "t3"), order);
    }

    @Test
    void suspendDoesNotAffectExecutingTasks() throws Exception {
        Scheduler scheduler = new Scheduler("suspend-running");
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        BlockTask running = BlockTask.of("running", self -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
        });

        scheduler.submit(running);
        Assertions.assertTrue(started.await(5, TimeUnit.SECONDS));
        scheduler.suspend();
        release.countDown();

        Assertions.assertTrue(running.awaitFinished(WAIT));
        Assertions.assertTrue(scheduler.awaitIdle(WAIT));
    }

    @Test
    void concurrencyLimitCapsExecutingTasks() throws Exception {
        Scheduler scheduler = new Scheduler("limit", EngineConfig.defaults().withMaxConcurrentTasks(2), WorkerPool.common());
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            tasks.add(BlockTask.of("limited-" + i, self -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                Thread.sleep(30);
                running.decrementAndGet();
            }));
        }

        scheduler.submit(tasks);

        Assertions.assertTrue(scheduler.awaitIdle(WAIT));
        Assertions.assertTrue(maxRunning.get() <= 2, "max running " + maxRunning.get());
        Assertions.assertTrue(tasks.stream().allMatch(Task::isFinished));
    }

    @Test
    void producedTaskIsRegisteredBeforeProducerFinishes() throws Exception {
        Scheduler scheduler = new Scheduler("produce");
        AtomicBoolean producedRan = new AtomicBoolean(false);
        BlockTask produced = BlockTask.of("produced", self -> producedRan.set(true));
        AtomicReference<TaskState> producedStateAtFinish = new AtomicReference<>();
        List<Task> relayed = new CopyOnWriteArrayList<>();
        BlockTask producer = BlockTask.of("producer", self -> self.produce(produced));
        producer.addObserver(new BlockObserver(
                null,
                (task, child) -> relayed.add(child),
                (task, errors) -> producedStateAtFinish.set(produced.state())
        ));

        scheduler.submit(producer);

        Assertions.assertTrue(producer.awaitFinished(WAIT));
        Assertions.assertTrue(produced.awaitFinished(WAIT));
        Assertions.assertTrue(producedRan.get());
        Assertions.assertEquals(List.of(produced), relayed);
        Assertions.assertNotEquals(TaskState.INITIALIZED, producedStateAtFinish.get());
        Assertions.assertSame(scheduler, produced.host().orElseThrow());
    }

    @Test
    void cancelAllCancelsEveryTrackedTask() throws Exception {
        Scheduler scheduler = new Scheduler("cancel-all");
        scheduler.suspend();
        AtomicInteger runs = new AtomicInteger();
        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            tasks.add(BlockTask.of("c" + i, self -> runs.incrementAndGet()));
        }
        scheduler.submit(tasks);

        scheduler.cancelAll();

        Assertions.assertTrue(scheduler.awaitIdle(WAIT));
        Assertions.assertEquals(0, runs.get());
        for (Task task : tasks) {
            Assertions.assertTrue(task.isCancelled());
            Assertions.assertEquals(List.of(TaskError.cancelled()), task.errors());
        }
    }

    @Test
    void listenersSeeSubmitAndFinish() throws Exception {
        Scheduler scheduler = new Scheduler("listener");
        List<String> events = new CopyOnWriteArrayList<>();
        CountDownLatch finished = new CountDownLatch(1);
        scheduler.addListener(new SchedulerListener() {
            @Override
            public void onSubmitted(Scheduler source, Task task) {
                events.add("submitted:" + task.name());
            }

            @Override
            public void onFinished(Scheduler source, Task task, List<TaskError> errors) {
                events.add("finished:" + task.name() + ":" + source.trackedCount());
                finished.countDown();
            }
        });

        scheduler.submit(BlockTask.noop("observed"));

        Assertions.assertTrue(finished.await(5, TimeUnit.SECONDS));
        Assertions.assertEquals(List.of("submitted:observed", "finished:observed:0"), events);
    }

    @Test
    void awaitIdleTimesOutWhileTasksAreTracked() throws Exception {
        Scheduler scheduler = new Scheduler("idle-timeout");
        scheduler.suspend();
        BlockTask task = BlockTask.noop("parked");
        scheduler.submit(task);

        Assertions.assertFalse(scheduler.awaitIdle(Duration.ofMillis(50)));
        Assertions.assertFalse(scheduler.isIdle());

        scheduler.resume();
        Assertions.assertTrue(scheduler.awaitIdle(WAIT));
        Assertions.assertTrue(scheduler.isIdle());
    }

    @Test
    void privatePoolRunsAndCloses() throws Exception {
        EngineConfig config = EngineConfig.defaults();
        try (WorkerPool pool = new WorkerPool("private", config)) {
            Scheduler scheduler = new Scheduler("private-pool", config, pool);
            AtomicReference<String> threadName = new AtomicReference<>();
            BlockTask task = BlockTask.of("named", self -> threadName.set(Thread.currentThread().getName()));

            scheduler.submit(task);

            Assertions.assertTrue(task.awaitFinished(WAIT));
            Assertions.assertTrue(threadName.get().startsWith("private-worker-"), threadName.get());
        }
        Assertions.assertThrows(IllegalStateException.class, () -> WorkerPool.common().close());
    }

    private static void waitForState(Task task, TaskState expected) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (task.state() != expected && System.nanoTime() < deadline) {
            Thread.sleep(2);
        }
        Assertions.assertEquals(expected, task.state());
    }
}
