package com.nimblet.internal.microhttp;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Ordered set of deferred tasks owned by a single event loop thread. Not thread-safe.
 */
class Scheduler {

    private final Clock clock;
    private final SortedSet<Task> tasks;
    private long counter;

    Scheduler(Clock clock) {
        this.clock = clock;
        this.tasks = new TreeSet<>(Comparator.comparingLong((Task t) -> t.time).thenComparingLong(t -> t.id));
    }

    int size() {
        return tasks.size();
    }

    Cancellable schedule(Runnable task, Duration delay) {
        Task t = new Task(task, clock.nanoTime() + delay.toNanos(), counter++);
        tasks.add(t);
        return t;
    }

    List<Runnable> expired() {
        long now = clock.nanoTime();
        List<Runnable> result = new ArrayList<>();
        Iterator<Task> it = tasks.iterator();
        while (it.hasNext()) {
            Task task = it.next();
            if (task.time > now) {
                break;
            }
            result.add(task.runnable);
            it.remove();
        }
        return result;
    }

    private class Task implements Cancellable {
        final Runnable runnable;
        final long time;
        final long id;

        Task(Runnable runnable, long time, long id) {
            this.runnable = runnable;
            this.time = time;
            this.id = id;
        }

        @Override
        public void cancel() {
            tasks.remove(this);
        }
    }
}
