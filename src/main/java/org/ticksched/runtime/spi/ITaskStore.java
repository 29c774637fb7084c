package org.ticksched.runtime.spi;

import java.util.List;

import org.ticksched.runtime.ScheduledTask;

/**
 * Concurrent storage backing a {@link org.ticksched.runtime.TickScheduler}.
 * <p>
 * <b>Thread safety:</b> {@link #add(ScheduledTask)} may be called from any number of
 * threads at once, including while a drain is in progress. {@link #drainDue(long, List)}
 * assumes a single consumer; the scheduler guarantees this.
 * <p>
 * Tasks added while a drain is running may be returned by that drain or left for the
 * next one. They are never lost and never returned twice.
 */
public interface ITaskStore {

    /**
     * Inserts a task. Never blocks on a running drain.
     *
     * @param task the task to store
     */
    void add(ScheduledTask task);

    /**
     * Removes every stored task with {@code dueTick <= currentTick} and appends its
     * action to {@code sink}. Tasks that are not yet due stay in the store.
     *
     * @param currentTick the tick observed by the consumer
     * @param sink        receives the due actions in the store's deterministic order
     * @return the number of actions appended to {@code sink}
     */
    int drainDue(long currentTick, List<Runnable> sink);

    /**
     * Returns the number of stored tasks. The value is approximate while producers or
     * the consumer are active and is meant for monitoring only.
     *
     * @return the approximate number of stored tasks
     */
    int size();
}
