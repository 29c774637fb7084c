package org.ticksched.runtime.spi;

/**
 * Per-tick work registered with a {@link org.ticksched.runtime.TickLoop}.
 * <p>
 * Listeners run on the loop thread after the callbacks due at that tick, in registration
 * order. A listener that throws is logged and counted; the remaining listeners still run.
 */
@FunctionalInterface
public interface ITickListener {

    /**
     * Executes the listener logic for the given tick.
     *
     * @param tick the tick that just started
     */
    void onTick(long tick);
}
