package io.opgraph.scheduler;

import io.opgraph.task.Task;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Serializes tasks that share a named category.
 *
 * <p>Each category keeps its tasks in registration order; only the head may execute. A
 * task declaring several categories is appended to all of them in one step, so two tasks
 * always meet every shared category in the same order and cannot wait on each other.
 *
 * <p>Schedulers use their own controller unless one is passed in explicitly, in which
 * case exclusivity spans all schedulers sharing it.
 */
public final class ExclusivityController {
    private final Object lock = new Object();
    private final Map<String, Deque<Task>> sequences = new HashMap<>();
    private final Map<Task, Set<String>> categoriesByTask = new HashMap<>();
    private final Map<Task, Runnable> wakeups = new HashMap<>();

    /**
     * Appends {@code task} to {@code category}.
     *
     * @return true if the task is now at the head of the category
     */
    public boolean acquire(String category, Task task) {
        return register(task, List.of(category), null);
    }

    /**
     * Appends {@code task} to every category in {@code categories}. {@code onEligible}, if
     * given, runs when a later release makes the task head of all of them.
     *
     * @return true if the task is now at the head of all of them
     */
    public boolean register(Task task, Collection<String> categories, Runnable onEligible) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(categories, "categories");
        if (categories.isEmpty()) {
            return true;
        }
        synchronized (lock) {
            if (categoriesByTask.containsKey(task)) {
                throw new IllegalStateException("Task already registered for exclusivity: " + task);
            }
            Set<String> owned = new LinkedHashSet<>(categories);
            for (String category : owned) {
                if (category == null || category.isBlank()) {
                    throw new IllegalArgumentException("exclusivity category cannot be empty");
                }
            }
            for (String category : owned) {
                sequences.computeIfAbsent(category, ignored -> new ArrayDeque<>()).addLast(task);
            }
            categoriesByTask.put(task, owned);
            if (onEligible != null) {
                wakeups.put(task, onEligible);
            }
            return isEligibleLocked(task);
        }
    }

    public boolean isEligible(Task task) {
        synchronized (lock) {
            return isEligibleLocked(task);
        }
    }

    /**
     * Removes {@code task} from all its categories and wakes the tasks that became head of
     * all their categories because of it.
     *
     * @return the tasks that became eligible
     */
    public List<Task> release(Task task) {
        List<Task> eligible = new ArrayList<>();
        List<Runnable> toWake = new ArrayList<>();
        synchronized (lock) {
            Set<String> owned = categoriesByTask.remove(task);
            wakeups.remove(task);
            if (owned == null) {
                return List.of();
            }
            Set<Task> candidates = new LinkedHashSet<>();
            for (String category : owned) {
                Deque<Task> sequence = sequences.get(category);
                if (sequence == null) {
                    continue;
                }
                boolean wasHead = sequence.peekFirst() == task;
                sequence.remove(task);
                if (sequence.isEmpty()) {
                    sequences.remove(category);
                } else if (wasHead) {
                    candidates.add(sequence.peekFirst());
                }
            }
            for (Task candidate : candidates) {
                if (isEligibleLocked(candidate)) {
                    eligible.add(candidate);
                    Runnable wakeup = wakeups.get(candidate);
                    if (wakeup != null) {
                        toWake.add(wakeup);
                    }
                }
            }
        }
        toWake.forEach(Runnable::run);
        return eligible;
    }

    /**
     * Releases one category held by {@code task}, which must be its head.
     *
     * @return the tasks that became eligible
     */
    public List<Task> release(String category, Task task) {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(task, "task");
        List<Task> eligible = new ArrayList<>();
        List<Runnable> toWake = new ArrayList<>();
        synchronized (lock) {
            Deque<Task> sequence = sequences.get(category);
            if (sequence == null || sequence.peekFirst() != task) {
                throw new IllegalStateException("Task " + task + " does not hold category " + category);
            }
            sequence.removeFirst();
            Set<String> owned = categoriesByTask.get(task);
            owned.remove(category);
            if (owned.isEmpty()) {
                categoriesByTask.remove(task);
                wakeups.remove(task);
            }
            Task next = sequence.peekFirst();
            if (next == null) {
                sequences.remove(category);
            } else if (isEligibleLocked(next)) {
                eligible.add(next);
                Runnable wakeup = wakeups.get(next);
                if (wakeup != null) {
                    toWake.add(wakeup);
                }
            }
        }
        toWake.forEach(Runnable::run);
        return eligible;
    }

    public List<Task> queued(String category) {
        synchronized (lock) {
            Deque<Task> sequence = sequences.get(category);
            return sequence == null ? List.of() : List.copyOf(sequence);
        }
    }

    public Set<String> categories() {
        synchronized (lock) {
            return Set.copyOf(sequences.keySet());
        }
    }

    private boolean isEligibleLocked(Task task) {
        Set<String> owned = categoriesByTask.get(task);
        if (owned == null) {
            return true;
        }
        for (String category : owned) {
            Deque<Task> sequence = sequences.get(category);
            if (sequence == null || sequence.peekFirst() != task) {
                return false;
            }
        }
        return true;
    }
}
