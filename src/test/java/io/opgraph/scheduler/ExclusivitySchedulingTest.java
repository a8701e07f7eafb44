package io.opgraph.scheduler;

import io.opgraph.condition.BlockCondition;
import io.opgraph.condition.MutuallyExclusive;
import io.opgraph.condition.NegatedCondition;
import io.opgraph.config.EngineConfig;
import io.opgraph.task.BlockTask;
import io.opgraph.task.Task;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

final class ExclusivitySchedulingTest {
    private static final Duration WAIT = Duration.ofSeconds(5);

    @Test
    void sameCategoryRunsOneAtATimeInSubmissionOrder() throws Exception {
        Scheduler scheduler = new Scheduler("exclusive");
        List<String> order = new CopyOnWriteArrayList<>();
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            BlockTask task = BlockTask.of("alert-" + i, self -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                order.add(self.name());
                Thread.sleep(15);
                running.decrementAndGet();
            });
            task.addCondition(MutuallyExclusive.category("alert"));
            tasks.add(task);
        }

        scheduler.submit(tasks);

        Assertions.assertTrue(scheduler.awaitIdle(WAIT));
        Assertions.assertEquals(1, maxRunning.get());
        Assertions.assertEquals(List.of("alert-0", "alert-1", "alert-2", "alert-3", "alert-4"), order);
        Assertions.assertTrue(scheduler.exclusivity().categories().isEmpty());
    }

    @Test
    void laterTaskWaitsUntilEarlierIsFinished() throws Exception {
        Scheduler scheduler = new Scheduler("exclusive-pair");
        BlockTask first = BlockTask.of("first", self -> Thread.sleep(40));
        List<Boolean> firstFinishedWhenSecondRan = new CopyOnWriteArrayList<>();
        BlockTask second = BlockTask.of("second", self -> firstFinishedWhenSecondRan.add(first.isFinished()));
        first.addCondition(MutuallyExclusive.category("modal"));
        second.addCondition(MutuallyExclusive.category("modal"));

        scheduler.submit(first);
        scheduler.submit(second);

        Assertions.assertTrue(second.awaitFinished(WAIT));
        Assertions.assertEquals(List.of(true), firstFinishedWhenSecondRan);
    }

    @Test
    void differentCategoriesRunConcurrently() throws Exception {
        Scheduler scheduler = new Scheduler("exclusive-independent");
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<Task> tasks = new ArrayList<>();
        for (String category : List.of("a", "b")) {
            BlockTask task = BlockTask.of("in-" + category, self -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                long deadline = System.nanoTime() + 2_000_000_000L;
                while (maxRunning.get() < 2 && System.nanoTime() < deadline) {
                    Thread.sleep(2);
                }
                running.decrementAndGet();
            });
            task.addCondition(MutuallyExclusive.category(category));
            tasks.add(task);
        }

        scheduler.submit(tasks);

        Assertions.assertTrue(scheduler.awaitIdle(WAIT));
        Assertions.assertEquals(2, maxRunning.get());
    }

    @Test
    void vetoedTaskReleasesItsCategory() throws Exception {
        Scheduler scheduler = new Scheduler("exclusive-veto");
        BlockTask vetoed = BlockTask.noop("vetoed");
        vetoed.addCondition(MutuallyExclusive.wrap(new BlockCondition("gate", task -> false)));
        BlockTask next = BlockTask.noop("next");
        next.addCondition(MutuallyExclusive.category("gate"));

        scheduler.submit(vetoed);
        scheduler.submit(next);

        Assertions.assertTrue(next.awaitFinished(WAIT));
        Assertions.assertTrue(vetoed.isCancelled());
        Assertions.assertTrue(next.errors().isEmpty());
    }

    @Test
    void wrappedConditionKeepsExclusivityKey() {
        MutuallyExclusive exclusive = MutuallyExclusive.category("alert");
        NegatedCondition negated = new NegatedCondition(exclusive);

        Assertions.assertTrue(negated.isMutuallyExclusive());
        Assertions.assertEquals("alert", negated.exclusivityCategory());
        Assertions.assertEquals("Not<MutuallyExclusive<alert>>", negated.category());
    }

    @Test
    void sharedControllerSerializesAcrossSchedulers() throws Exception {
        ExclusivityController shared = new ExclusivityController();
        Scheduler left = new Scheduler("left", EngineConfig.defaults(), WorkerPool.common(), shared);
        Scheduler right = new Scheduler("right", EngineConfig.defaults(), WorkerPool.common(), shared);
        List<String> order = new CopyOnWriteArrayList<>();
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<BlockTask> tasks = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            BlockTask task = BlockTask.of("shared-" + i, self -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                order.add(self.name());
                Thread.sleep(10);
                running.decrementAndGet();
            });
            task.addCondition(MutuallyExclusive.category("sync"));
            tasks.add(task);
        }

        for (int i = 0; i < tasks.size(); i++) {
            (i % 2 == 0 ? left : right).submit(tasks.get(i));
        }

        Assertions.assertTrue(left.awaitIdle(WAIT));
        Assertions.assertTrue(right.awaitIdle(WAIT));
        Assertions.assertEquals(1, maxRunning.get());
        Assertions.assertEquals(List.of("shared-0", "shared-1", "shared-2", "shared-3"), order);
    }
}
