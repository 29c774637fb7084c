package org.ticksched.runtime.store;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

import org.ticksched.runtime.ScheduledTask;
import org.ticksched.runtime.spi.ITaskStore;

/**
 * A task store backed by a lock-free {@link ConcurrentLinkedQueue}.
 * <p>
 * The queue offers no selective removal, so a drain dequeues the tasks present when the
 * drain started, keeps the due ones and appends the rest back to the tail. Re-inserted
 * tasks are the same immutable instances, so their visible state does not change.
 * <p>
 * The drain is bounded by the element count observed at its start. Tasks enqueued
 * concurrently sit behind that prefix and are considered on the next drain. Due actions
 * are returned in insertion order.
 */
public class DrainReinsertTaskStore implements ITaskStore {

    private final ConcurrentLinkedQueue<ScheduledTask> queue = new ConcurrentLinkedQueue<>();

    @Override
    public void add(ScheduledTask task) {
        queue.offer(task);
    }

    @Override
    public int drainDue(long currentTick, List<Runnable> sink) {
        // O(n) traversal, but it sees every task whose add() happened before this call
        int present = queue.size();
        if (present == 0) {
            return 0;
        }

        List<ScheduledTask> notDue = new ArrayList<>();
        int drained = 0;
        try {
            for (int i = 0; i < present; i++) {
                ScheduledTask task = queue.poll();
                if (task == null) {
                    break;
                }
                if (task.isDueAt(currentTick)) {
                    sink.add(task.action());
                    drained++;
                } else {
                    notDue.add(task);
                }
            }
        } finally {
            if (!notDue.isEmpty()) {
                queue.addAll(notDue);
            }
        }
        return drained;
    }

    @Override
    public int size() {
        return queue.size();
    }
}
