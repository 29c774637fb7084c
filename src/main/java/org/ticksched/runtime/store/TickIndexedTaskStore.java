package org.ticksched.runtime.store;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

import org.ticksched.runtime.ScheduledTask;
import org.ticksched.runtime.spi.ITaskStore;

/**
 * A task store that keeps tasks sorted by due tick in a {@link ConcurrentSkipListMap}.
 * <p>
 * Every task gets a unique key {@code (dueTick, sequence)}, where the sequence is taken
 * from a shared counter at insertion. A drain walks only the head range
 * {@code dueTick <= currentTick} and removes entries in place, so not-due tasks are never
 * touched. Due actions come back ordered by tick, then by submission.
 * <p>
 * The sequence counter also bounds the drain: entries whose sequence was handed out
 * after the drain started are skipped and left for the next call.
 */
public class TickIndexedTaskStore implements ITaskStore {

    private final ConcurrentSkipListMap<TaskKey, Runnable> tasks = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public void add(ScheduledTask task) {
        tasks.put(new TaskKey(task.dueTick(), sequence.getAndIncrement()), task.action());
    }

    @Override
    public int drainDue(long currentTick, List<Runnable> sink) {
        long horizon = sequence.get();
        TaskKey upperBound = new TaskKey(currentTick, Long.MAX_VALUE);

        int drained = 0;
        Iterator<Map.Entry<TaskKey, Runnable>> it = tasks.headMap(upperBound, true).entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<TaskKey, Runnable> entry = it.next();
            if (entry.getKey().sequence() >= horizon) {
                continue;
            }
            sink.add(entry.getValue());
            it.remove();
            drained++;
        }
        return drained;
    }

    @Override
    public int size() {
        return tasks.size();
    }

    /**
     * Orders tasks by due tick and breaks ties by submission sequence.
     */
    private record TaskKey(long dueTick, long sequence) implements Comparable<TaskKey> {

        @Override
        public int compareTo(TaskKey other) {
            int byTick = Long.compare(dueTick, other.dueTick);
            return byTick != 0 ? byTick : Long.compare(sequence, other.sequence);
        }
    }
}
