package org.ticksched.services;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ticksched.runtime.TickLoop;
import org.ticksched.runtime.spi.IMonitorable;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Drives a {@link TickLoop} in real time on a dedicated thread.
 * <p>
 * The service ticks at a fixed rate of {@code ticks-per-second}. If a tick overruns, the
 * following ticks start immediately to catch up. Once the loop lags by more than
 * {@code max-catch-up-ticks} periods, the schedule is re-based on the current time
 * instead of bursting through the backlog.
 * <p>
 * <b>Shutdown:</b> {@link #stop()} sets a stop flag and wakes the thread, which finishes
 * the tick in progress and exits. If the thread is still alive after
 * {@code shutdown-timeout} it is interrupted; if it survives that too, the service
 * enters {@link State#ERROR}.
 * <p>
 * <b>Errors:</b> an exception escaping the loop (for example a failure handler that
 * rethrows) ends the thread and puts the service in {@link State#ERROR}.
 */
public class TickLoopService implements IService, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());

    private final String serviceName;
    private final TickLoop loop;
    private final long tickPeriodNanos;
    private final int maxCatchUpTicks;
    private final long shutdownTimeoutMs;
    private final Set<Long> pauseTicks;

    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final Object pauseLock = new Object();
    private volatile Thread serviceThread;

    private long lastMetricTime = System.currentTimeMillis();
    private long lastTickCount = 0;
    private double ticksPerSecond = 0.0;

    /**
     * Constructs a TickLoopService.
     *
     * @param name    the service name, also used as the thread name
     * @param loop    the loop to drive; this service becomes its only caller of {@link TickLoop#tick()}
     * @param options the {@code ticksched.loop} section:
     *                <ul>
     *                  <li>{@code ticks-per-second} - tick rate (default: 64)</li>
     *                  <li>{@code max-catch-up-ticks} - lag tolerated before re-basing (default: 8)</li>
     *                  <li>{@code shutdown-timeout} - grace period for {@link #stop()} (default: 5s)</li>
     *                  <li>{@code pause-ticks} - ticks after which the service pauses itself (default: none)</li>
     *                </ul>
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public TickLoopService(String name, TickLoop loop, Config options) {
        this.serviceName = Objects.requireNonNull(name, "name cannot be null");
        this.loop = Objects.requireNonNull(loop, "loop cannot be null");
        Config defaults = ConfigFactory.parseMap(Map.of(
                "ticks-per-second", 64,
                "max-catch-up-ticks", 8,
                "shutdown-timeout", "5s",
                "pause-ticks", Collections.emptyList()
        ));
        Config finalConfig = options.withFallback(defaults);

        try {
            int ticksPerSecondSetting = finalConfig.getInt("ticks-per-second");
            this.maxCatchUpTicks = finalConfig.getInt("max-catch-up-ticks");
            Duration shutdownTimeout = finalConfig.getDuration("shutdown-timeout");
            List<Long> pauseTickList = finalConfig.getLongList("pause-ticks");
            if (ticksPerSecondSetting <= 0) {
                throw new IllegalArgumentException(
                        "ticks-per-second must be positive for service '" + name + "', got " + ticksPerSecondSetting);
            }
            if (maxCatchUpTicks < 1) {
                throw new IllegalArgumentException(
                        "max-catch-up-ticks must be at least 1 for service '" + name + "', got " + maxCatchUpTicks);
            }
            if (shutdownTimeout.isNegative() || shutdownTimeout.isZero()) {
                throw new IllegalArgumentException(
                        "shutdown-timeout must be positive for service '" + name + "', got " + shutdownTimeout);
            }
            this.tickPeriodNanos = TimeUnit.SECONDS.toNanos(1) / ticksPerSecondSetting;
            this.shutdownTimeoutMs = shutdownTimeout.toMillis();
            this.pauseTicks = Set.copyOf(pauseTickList);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for TickLoopService '" + name + "'", e);
        }
    }

    /**
     * Builds the loop, its scheduler and the service from the {@code ticksched} section.
     *
     * @param name    the service name
     * @param options the {@code ticksched} section
     * @return the new, stopped service
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public static TickLoopService fromConfig(String name, Config options) {
        TickLoop loop = TickLoop.fromConfig(options);
        Config loopOptions = options.hasPath("loop") ? options.getConfig("loop") : ConfigFactory.empty();
        return new TickLoopService(name, loop, loopOptions);
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format(
                    "Cannot start service '%s' as it is already in state %s", serviceName, getCurrentState()));
        }
        stopRequested.set(false);
        Thread thread = new Thread(this::runService);
        thread.setName(serviceName);
        serviceThread = thread;
        thread.start();
        log.info("{} started: tickPeriod={}µs, pendingTasks={}, startTick={}",
                serviceName, TimeUnit.NANOSECONDS.toMicros(tickPeriodNanos),
                loop.pendingCount(), loop.currentTick());
    }

    @Override
    public final void stop() {
        State state = getCurrentState();
        if (state != State.RUNNING && state != State.PAUSED) {
            throw new IllegalStateException(String.format(
                    "Cannot stop service '%s' as it is in state %s", serviceName, state));
        }

        stopRequested.set(true);
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }

        Thread thread = serviceThread;
        if (thread == Thread.currentThread()) {
            // Called from a callback on the loop thread; the loop exits after this tick
            log.debug("{} stop requested from its own thread", serviceName);
            return;
        }
        LockSupport.unpark(thread);

        try {
            thread.join(shutdownTimeoutMs);
            if (thread.isAlive()) {
                log.warn("{} did not stop within {} ms, forcing interrupt", serviceName, shutdownTimeoutMs);
                thread.interrupt();
                thread.join(1000);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted while waiting for service shutdown", serviceName);
        }

        if (thread.isAlive()) {
            log.error("{} thread did not stop within {} ms! Forcing ERROR state.", serviceName, shutdownTimeoutMs);
            currentState.set(State.ERROR);
            return;
        }
        log.info("{} stopped at tick {}", serviceName, loop.currentTick());
    }

    @Override
    public final void pause() {
        if (!currentState.compareAndSet(State.RUNNING, State.PAUSED)) {
            throw new IllegalStateException(String.format(
                    "Cannot pause service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        log.info("{} paused at tick {}", serviceName, loop.currentTick());
    }

    @Override
    public final void resume() {
        if (!currentState.compareAndSet(State.PAUSED, State.RUNNING)) {
            throw new IllegalStateException(String.format(
                    "Cannot resume service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        log.info("{} resumed", serviceName);
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    /**
     * Returns the driven loop, for producers that need to schedule work.
     *
     * @return the loop
     */
    public TickLoop getLoop() {
        return loop;
    }

    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("Service thread interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("{} stopped with ERROR at tick {} due to {}",
                    serviceName, loop.currentTick(), e.getClass().getSimpleName());
            log.debug("Exception details:", e);
            currentState.set(State.ERROR);
        } finally {
            if (getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            log.debug("Service thread for {} has terminated.", serviceName);
        }
    }

    private void run() throws InterruptedException {
        long nextTickAt = System.nanoTime();

        while (!stopRequested.get()) {
            if (checkPause()) {
                nextTickAt = System.nanoTime();
            }
            if (stopRequested.get()) {
                break;
            }

            long waitNanos = nextTickAt - System.nanoTime();
            if (waitNanos > 0) {
                LockSupport.parkNanos(this, waitNanos);
                if (Thread.interrupted()) {
                    throw new InterruptedException("Interrupted while waiting for the next tick");
                }
                continue;
            }

            long tick = loop.tick();
            nextTickAt += tickPeriodNanos;

            long lagNanos = System.nanoTime() - nextTickAt;
            if (lagNanos > maxCatchUpTicks * tickPeriodNanos) {
                log.debug("{} is {} ticks behind at tick {}, re-basing schedule",
                        serviceName, lagNanos / tickPeriodNanos, tick);
                nextTickAt = System.nanoTime();
            }

            if (pauseTicks.contains(tick) && currentState.compareAndSet(State.RUNNING, State.PAUSED)) {
                log.info("{} auto-paused at tick {} due to pause-ticks configuration", serviceName, tick);
            }
        }
    }

    /**
     * Blocks while the service is paused.
     *
     * @return {@code true} if the thread waited
     * @throws InterruptedException if interrupted while waiting
     */
    private boolean checkPause() throws InterruptedException {
        boolean waited = false;
        synchronized (pauseLock) {
            while (getCurrentState() == State.PAUSED && !stopRequested.get()) {
                waited = true;
                pauseLock.wait();
            }
        }
        return waited;
    }

    @Override
    public synchronized Map<String, Number> getMetrics() {
        Map<String, Number> metrics = loop.getMetrics();

        long now = System.currentTimeMillis();
        if (now - lastMetricTime >= 1000) {
            long tick = loop.currentTick();
            ticksPerSecond = (double) (tick - lastTickCount) * 1000.0 / (now - lastMetricTime);
            lastMetricTime = now;
            lastTickCount = tick;
        }
        metrics.put("ticks_per_second", ticksPerSecond);
        return metrics;
    }
}
