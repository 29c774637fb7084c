package org.ticksched.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ticksched.runtime.spi.ITaskStore;
import org.ticksched.runtime.store.DrainReinsertTaskStore;
import org.ticksched.runtime.store.TaskStoreFactory;

import com.typesafe.config.Config;

/**
 * A concurrent, tick-indexed queue of deferred callbacks.
 * <p>
 * Producers on any thread call {@link #schedule(long, Runnable)}. Once per simulation
 * step the owning loop calls {@link #collectDue(long)} and receives, exactly once, every
 * callback whose tick has arrived or passed. Callbacks that are not yet due stay queued.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>The scheduler never runs a callback. Invoking the returned actions, and handling
 *       whatever they throw, is the consumer's job.</li>
 *   <li>If a callback captures state shared with other threads, synchronizing that state
 *       is the caller's responsibility.</li>
 *   <li>{@link #collectDue(long)} has a single consumer. A second call made while one is
 *       still running fails with {@link IllegalStateException} and leaves the queue
 *       untouched.</li>
 *   <li>There is no cancellation. A callback that may become obsolete should check its
 *       own flag when it runs.</li>
 * </ul>
 */
public class TickScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(TickScheduler.class);

    private final ITaskStore store;
    private final AtomicReference<Thread> drainingThread = new AtomicReference<>();

    /**
     * Creates a scheduler backed by a {@link DrainReinsertTaskStore}.
     */
    public TickScheduler() {
        this(new DrainReinsertTaskStore());
    }

    /**
     * Creates a scheduler backed by the given store.
     *
     * @param store an empty store owned exclusively by this scheduler
     */
    public TickScheduler(ITaskStore store) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
    }

    /**
     * Creates a scheduler from the {@code ticksched.scheduler} configuration section.
     *
     * @param options the scheduler options
     * @return the new scheduler
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public static TickScheduler fromConfig(Config options) {
        return new TickScheduler(TaskStoreFactory.fromConfig(options));
    }

    /**
     * Queues a callback for the given tick. Safe to call from any thread, concurrently
     * with other producers and with {@link #collectDue(long)}.
     * <p>
     * A tick that has already passed is allowed; the callback is then returned by the
     * next {@link #collectDue(long)} call.
     *
     * @param tick     the tick at which the callback becomes due
     * @param callback the work to defer
     * @throws NullPointerException if {@code callback} is {@code null}
     */
    public void schedule(long tick, Runnable callback) {
        Objects.requireNonNull(callback, "callback cannot be null");
        store.add(new ScheduledTask(tick, callback));
    }

    /**
     * Removes and returns every callback due at or before {@code currentTick}.
     * <p>
     * Must only be called by the single consumer, normally once per tick. A callback
     * scheduled before this call started, with a due tick at or before
     * {@code currentTick}, is in the result of this call or of a later one. Callbacks
     * scheduled while this call runs are returned now or later, never lost.
     *
     * @param currentTick the tick observed by the consumer
     * @return the due callbacks in a deterministic order; empty if none are due
     * @throws IllegalStateException if another thread is inside {@code collectDue}
     */
    public List<Runnable> collectDue(long currentTick) {
        Thread current = Thread.currentThread();
        Thread owner = drainingThread.compareAndExchange(null, current);
        if (owner != null) {
            throw new IllegalStateException(String.format(
                "collectDue is already running on thread '%s'; only one consumer may drain the scheduler",
                owner.getName()
            ));
        }
        try {
            List<Runnable> due = new ArrayList<>();
            int drained = store.drainDue(currentTick, due);
            if (drained > 0) {
                LOG.trace("Collected {} due callbacks at tick {}", drained, currentTick);
            }
            return due;
        } finally {
            drainingThread.set(null);
        }
    }

    /**
     * Returns the approximate number of callbacks waiting in the queue.
     *
     * @return the number of pending callbacks
     */
    public int pendingCount() {
        return store.size();
    }
}
