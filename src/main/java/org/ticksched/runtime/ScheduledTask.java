package org.ticksched.runtime;

import java.util.Objects;

/**
 * An action bound to the logical tick at which it becomes due.
 * <p>
 * Instances are immutable. A task belongs to the store it was added to until
 * {@link TickScheduler#collectDue(long)} hands its action back to the consumer.
 *
 * @param dueTick the first tick at which the action may run
 * @param action  the deferred work, never {@code null}
 */
public record ScheduledTask(long dueTick, Runnable action) {

    public ScheduledTask {
        Objects.requireNonNull(action, "action cannot be null");
    }

    /**
     * Checks whether this task is due at the given tick.
     *
     * @param currentTick the tick observed by the consumer
     * @return {@code true} if {@code dueTick <= currentTick}
     */
    public boolean isDueAt(long currentTick) {
        return dueTick <= currentTick;
    }
}
