package org.ticksched.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ticksched.runtime.spi.IMonitorable;
import org.ticksched.runtime.spi.ITaskFailureHandler;
import org.ticksched.runtime.spi.ITickListener;
import org.ticksched.runtime.store.TaskStoreFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * The consumer side of a {@link TickScheduler}: owns the logical clock and, once per
 * tick, runs the callbacks that have become due.
 * <p>
 * Each {@link #tick()} performs, in order:
 * <ol>
 *   <li>advance the tick counter by one</li>
 *   <li>collect the due callbacks and run them in the order the scheduler returned them</li>
 *   <li>run the registered {@link ITickListener}s</li>
 * </ol>
 * <p>
 * <b>Budget:</b> with {@code maxTasksPerTick} or {@code timeBudget} set, callbacks left
 * over when the budget runs out are kept by the loop and run first on the next tick,
 * ahead of anything collected from the scheduler. They are neither dropped nor run twice.
 * The time budget is checked every {@value #BUDGET_CHECK_INTERVAL} callbacks.
 * <p>
 * <b>Failures:</b> a callback that throws a {@link RuntimeException} is passed to the
 * {@link ITaskFailureHandler} and the loop moves on. If the handler rethrows, the
 * callbacks not yet started are scheduled again at the current tick before the exception
 * leaves {@link #tick()}. {@link Error}s propagate.
 * <p>
 * <b>Thread safety:</b> {@link #tick()} must only be called from the loop thread.
 * {@link #schedule(long, Runnable)}, {@link #scheduleAfter(long, Runnable)},
 * {@link #currentTick()}, {@link #pendingCount()} and {@link #getMetrics()} are safe from
 * any thread.
 */
public class TickLoop implements IMonitorable {

    private static final Logger LOG = LoggerFactory.getLogger(TickLoop.class);

    static final int BUDGET_CHECK_INTERVAL = 10;

    private final TickScheduler scheduler;
    private final AtomicLong currentTick;
    private final int maxTasksPerTick;
    private final long timeBudgetNanos;
    private final ITaskFailureHandler failureHandler;
    private final List<ITickListener> listeners = new CopyOnWriteArrayList<>();

    // Budget leftovers, touched only by tick()
    private List<Runnable> carryOver = new ArrayList<>();
    private volatile int carriedOver;

    private final AtomicLong tasksExecuted = new AtomicLong();
    private final AtomicLong tasksFailed = new AtomicLong();
    private final AtomicLong tasksDeferred = new AtomicLong();
    private final AtomicLong listenerFailures = new AtomicLong();

    /**
     * Creates a loop starting at tick 0, without a budget, logging callback failures.
     *
     * @param scheduler the scheduler this loop drains
     */
    public TickLoop(TickScheduler scheduler) {
        this(scheduler, 0L, 0, Duration.ZERO, new LoggingTaskFailureHandler());
    }

    /**
     * Creates a loop.
     *
     * @param scheduler       the scheduler this loop drains; the loop must be its only consumer
     * @param initialTick     the tick value before the first {@link #tick()}
     * @param maxTasksPerTick maximum callbacks run per tick, 0 for unlimited
     * @param timeBudget      maximum time spent on callbacks per tick, zero for unlimited
     * @param failureHandler  receives exceptions thrown by callbacks
     * @throws IllegalArgumentException if a budget is negative
     */
    public TickLoop(TickScheduler scheduler, long initialTick, int maxTasksPerTick, Duration timeBudget,
                    ITaskFailureHandler failureHandler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler cannot be null");
        Objects.requireNonNull(timeBudget, "timeBudget cannot be null");
        if (maxTasksPerTick < 0) {
            throw new IllegalArgumentException("maxTasksPerTick cannot be negative, got " + maxTasksPerTick);
        }
        if (timeBudget.isNegative()) {
            throw new IllegalArgumentException("timeBudget cannot be negative, got " + timeBudget);
        }
        this.currentTick = new AtomicLong(initialTick);
        this.maxTasksPerTick = maxTasksPerTick;
        this.timeBudgetNanos = timeBudget.toNanos();
    }

    /**
     * Creates a loop and its scheduler from the {@code ticksched} configuration section.
     * <p>
     * Reads {@code scheduler.store}, {@code loop.max-tasks-per-tick} and
     * {@code loop.time-budget}; missing keys take the same defaults as {@code reference.conf}.
     *
     * @param options the {@code ticksched} section
     * @return the new loop, starting at tick 0
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public static TickLoop fromConfig(Config options) {
        Config defaults = ConfigFactory.parseMap(Map.of(
                "scheduler.store", TaskStoreFactory.DRAIN_REINSERT,
                "loop.max-tasks-per-tick", 0,
                "loop.time-budget", "0ms"
        ));
        Config finalConfig = options.withFallback(defaults);

        try {
            TickScheduler scheduler = TickScheduler.fromConfig(finalConfig.getConfig("scheduler"));
            return new TickLoop(
                    scheduler,
                    0L,
                    finalConfig.getInt("loop.max-tasks-per-tick"),
                    finalConfig.getDuration("loop.time-budget"),
                    new LoggingTaskFailureHandler());
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for TickLoop", e);
        }
    }

    /**
     * Adds a listener that runs once per tick, after the due callbacks.
     *
     * @param listener the listener to add
     */
    public void addTickListener(ITickListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    /**
     * Removes a previously added listener.
     *
     * @param listener the listener to remove
     * @return {@code true} if the listener was registered
     */
    public boolean removeTickListener(ITickListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Returns the tick most recently started by {@link #tick()}, or the initial tick.
     *
     * @return the current tick
     */
    public long currentTick() {
        return currentTick.get();
    }

    /**
     * Queues a callback for an absolute tick.
     *
     * @param tick   the tick at which the callback becomes due
     * @param action the callback
     * @see TickScheduler#schedule(long, Runnable)
     */
    public void schedule(long tick, Runnable action) {
        scheduler.schedule(tick, action);
    }

    /**
     * Queues a callback relative to the current tick. A delay of 0 runs it on the next tick.
     *
     * @param delayTicks number of ticks to wait, at least 0
     * @param action     the callback
     * @throws IllegalArgumentException if {@code delayTicks} is negative
     */
    public void scheduleAfter(long delayTicks, Runnable action) {
        if (delayTicks < 0) {
            throw new IllegalArgumentException("delayTicks cannot be negative, got " + delayTicks);
        }
        scheduler.schedule(currentTick.get() + delayTicks, action);
    }

    /**
     * Advances the clock by one tick and runs the due callbacks and the tick listeners.
     *
     * @return the new tick
     */
    public long tick() {
        long tick = currentTick.incrementAndGet();
        runDueCallbacks(tick);
        notifyListeners(tick);
        return tick;
    }

    private void runDueCallbacks(long tick) {
        List<Runnable> due = scheduler.collectDue(tick);
        if (!carryOver.isEmpty()) {
            // Leftovers from the previous tick go first
            List<Runnable> merged = new ArrayList<>(carryOver.size() + due.size());
            merged.addAll(carryOver);
            merged.addAll(due);
            due = merged;
            carryOver = new ArrayList<>();
            carriedOver = 0;
        }
        if (due.isEmpty()) {
            return;
        }

        int limit = maxTasksPerTick > 0 ? Math.min(maxTasksPerTick, due.size()) : due.size();
        long deadline = timeBudgetNanos > 0 ? System.nanoTime() + timeBudgetNanos : Long.MAX_VALUE;
        int next = 0;
        boolean finishedNormally = false;
        try {
            while (next < limit) {
                Runnable action = due.get(next++);
                try {
                    action.run();
                    tasksExecuted.incrementAndGet();
                } catch (RuntimeException e) {
                    tasksFailed.incrementAndGet();
                    failureHandler.onFailure(tick, action, e);
                }
                if (timeBudgetNanos > 0 && next % BUDGET_CHECK_INTERVAL == 0 && System.nanoTime() >= deadline) {
                    break;
                }
            }
            finishedNormally = true;
        } finally {
            // Everything from 'next' on has not been started
            if (next < due.size()) {
                List<Runnable> remaining = due.subList(next, due.size());
                if (finishedNormally) {
                    deferToNextTick(tick, remaining);
                } else {
                    restoreToScheduler(tick, remaining);
                }
            }
        }
    }

    private void deferToNextTick(long tick, List<Runnable> remaining) {
        carryOver.addAll(remaining);
        carriedOver = carryOver.size();
        tasksDeferred.addAndGet(remaining.size());
        LOG.debug("Deferred {} due callbacks from tick {} to the next tick", remaining.size(), tick);
    }

    private void restoreToScheduler(long tick, List<Runnable> remaining) {
        for (Runnable action : remaining) {
            scheduler.schedule(tick, action);
        }
        LOG.debug("Returned {} unstarted callbacks of tick {} to the scheduler", remaining.size(), tick);
    }

    private void notifyListeners(long tick) {
        for (ITickListener listener : listeners) {
            try {
                listener.onTick(tick);
            } catch (RuntimeException e) {
                listenerFailures.incrementAndGet();
                LOG.warn("Tick listener {} failed at tick {}: {}",
                        listener.getClass().getSimpleName(), tick, e.toString());
                LOG.debug("Exception details:", e);
            }
        }
    }

    /**
     * Returns the number of callbacks waiting to run: those still in the scheduler plus
     * those carried over from the last tick.
     *
     * @return the approximate number of pending callbacks
     */
    public int pendingCount() {
        return scheduler.pendingCount() + carriedOver;
    }

    /**
     * Returns the scheduler drained by this loop.
     *
     * @return the scheduler
     */
    public TickScheduler getScheduler() {
        return scheduler;
    }

    @Override
    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("current_tick", currentTick.get());
        metrics.put("pending_tasks", pendingCount());
        metrics.put("tasks_executed", tasksExecuted.get());
        metrics.put("tasks_failed", tasksFailed.get());
        metrics.put("tasks_deferred", tasksDeferred.get());
        metrics.put("listener_failures", listenerFailures.get());
        return metrics;
    }
}
