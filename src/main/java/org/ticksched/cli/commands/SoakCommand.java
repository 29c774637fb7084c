package org.ticksched.cli.commands;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicIntegerArray;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ticksched.cli.CommandLineInterface;
import org.ticksched.runtime.TickLoop;
import org.ticksched.services.IService;
import org.ticksched.services.TickLoopService;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that runs concurrent producers against a live tick loop and checks that
 * every scheduled callback ran exactly once.
 * <p>
 * Exit code 0 means all callbacks ran once; 1 means some were missing or ran twice.
 */
@Command(
    name = "soak",
    description = "Schedule callbacks from concurrent producers into a running tick loop and verify exactly-once execution"
)
public class SoakCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SoakCommand.class);

    @Option(names = {"--producers"}, defaultValue = "4", description = "Number of producer threads (default: ${DEFAULT-VALUE})")
    int producers;

    @Option(names = {"--tasks"}, defaultValue = "10000", description = "Callbacks scheduled per producer (default: ${DEFAULT-VALUE})")
    int tasksPerProducer;

    @Option(names = {"--max-delay"}, defaultValue = "32", description = "Maximum delay in ticks (default: ${DEFAULT-VALUE})")
    int maxDelay;

    @Option(names = {"--store"}, description = "Task store: drain-reinsert or tick-indexed (default: from configuration)")
    String store;

    @Option(names = {"--ticks-per-second"}, description = "Tick rate (default: from configuration)")
    Integer ticksPerSecond;

    @Option(names = {"--timeout"}, defaultValue = "60", description = "Seconds to wait for all callbacks (default: ${DEFAULT-VALUE})")
    long timeoutSeconds;

    @Option(names = {"--seed"}, defaultValue = "42", description = "Random seed for delays (default: ${DEFAULT-VALUE})")
    long seed;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws InterruptedException {
        validateOptions();
        PrintWriter out = spec.commandLine().getOut();

        TickLoopService service = TickLoopService.fromConfig("tick-loop", buildOptions());
        TickLoop loop = service.getLoop();

        int total = producers * tasksPerProducer;
        AtomicIntegerArray runs = new AtomicIntegerArray(total);
        CountDownLatch firstRuns = new CountDownLatch(total);

        long startNanos = System.nanoTime();
        service.start();
        boolean completed;
        try {
            List<Thread> threads = new ArrayList<>(producers);
            for (int p = 0; p < producers; p++) {
                int producerIndex = p;
                Thread thread = new Thread(() -> produce(loop, producerIndex, runs, firstRuns),
                        "soak-producer-" + p);
                threads.add(thread);
                thread.start();
            }
            for (Thread thread : threads) {
                thread.join();
            }
            log.debug("All {} producers finished scheduling {} callbacks", producers, total);

            completed = firstRuns.await(timeoutSeconds, TimeUnit.SECONDS);
            if (completed) {
                // A few more ticks so that a duplicate delivery would have time to show up
                long settleUntil = loop.currentTick() + maxDelay + 2L;
                while (loop.currentTick() < settleUntil && service.getCurrentState() == IService.State.RUNNING) {
                    Thread.sleep(5);
                }
            }
        } finally {
            if (service.getCurrentState() == IService.State.RUNNING
                    || service.getCurrentState() == IService.State.PAUSED) {
                service.stop();
            }
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        int executed = 0;
        int duplicates = 0;
        for (int i = 0; i < total; i++) {
            int count = runs.get(i);
            if (count > 0) {
                executed++;
            }
            if (count > 1) {
                duplicates++;
            }
        }

        Map<String, Number> metrics = service.getMetrics();
        out.println("=== Soak Summary ===");
        out.printf("Scheduled:  %d (%d producers x %d)%n", total, producers, tasksPerProducer);
        out.printf("Executed:   %d%n", executed);
        out.printf("Missing:    %d%n", total - executed);
        out.printf("Duplicates: %d%n", duplicates);
        out.printf("Ticks:      %d in %d ms%n", loop.currentTick(), elapsedMs);
        out.printf("Deferred:   %s%n", metrics.get("tasks_deferred"));
        out.printf("Service:    %s%n", service.getCurrentState());
        out.flush();

        boolean ok = completed && executed == total && duplicates == 0
                && service.getCurrentState() == IService.State.STOPPED;
        if (!ok) {
            log.warn("Soak run failed: executed={}, expected={}, duplicates={}", executed, total, duplicates);
        }
        return ok ? 0 : 1;
    }

    private void produce(TickLoop loop, int producerIndex, AtomicIntegerArray runs, CountDownLatch firstRuns) {
        Random random = new Random(seed + producerIndex);
        int base = producerIndex * tasksPerProducer;
        for (int i = 0; i < tasksPerProducer; i++) {
            int id = base + i;
            loop.scheduleAfter(random.nextInt(maxDelay + 1), () -> {
                if (runs.incrementAndGet(id) == 1) {
                    firstRuns.countDown();
                }
            });
        }
    }

    private Config buildOptions() {
        Config options = parent.getConfig().getConfig("ticksched");
        if (store != null) {
            options = ConfigFactory.parseMap(Map.of("scheduler.store", store)).withFallback(options);
        }
        if (ticksPerSecond != null) {
            options = ConfigFactory.parseMap(Map.of("loop.ticks-per-second", ticksPerSecond)).withFallback(options);
        }
        return options;
    }

    private void validateOptions() {
        if (producers <= 0) {
            throw new ParameterException(spec.commandLine(), "--producers must be positive, got " + producers);
        }
        if (tasksPerProducer <= 0) {
            throw new ParameterException(spec.commandLine(), "--tasks must be positive, got " + tasksPerProducer);
        }
        if (maxDelay < 0) {
            throw new ParameterException(spec.commandLine(), "--max-delay cannot be negative, got " + maxDelay);
        }
        if ((long) producers * tasksPerProducer > Integer.MAX_VALUE) {
            throw new ParameterException(spec.commandLine(), "--producers x --tasks is too large");
        }
    }
}
