package org.ticksched.runtime.spi;

/**
 * Receives exceptions thrown by scheduled callbacks while the loop runs them.
 * <p>
 * Called on the loop thread. The handler may rethrow to abort the current tick; the
 * loop then re-queues the callbacks it has not run yet before the exception leaves
 * {@link org.ticksched.runtime.TickLoop#tick()}.
 */
@FunctionalInterface
public interface ITaskFailureHandler {

    /**
     * Handles a failed callback.
     *
     * @param tick    the tick during which the callback ran
     * @param action  the callback that failed
     * @param failure the exception it threw
     */
    void onFailure(long tick, Runnable action, RuntimeException failure);
}
