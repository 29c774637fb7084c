package org.ticksched.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Stream;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.ticksched.runtime.spi.ITaskFailureHandler;
import org.ticksched.runtime.spi.ITaskStore;
import org.ticksched.runtime.spi.ITickListener;
import org.ticksched.runtime.store.DrainReinsertTaskStore;
import org.ticksched.runtime.store.TickIndexedTaskStore;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class TickLoopTest {

    @Mock
    private ITaskFailureHandler failureHandler;

    private TickLoop newLoop(int maxTasksPerTick, Duration timeBudget) {
        return new TickLoop(new TickScheduler(), 0L, maxTasksPerTick, timeBudget, failureHandler);
    }

    @Test
    void tickAdvancesClockAndRunsCallbacksWhenDue() {
        TickLoop loop = newLoop(0, Duration.ZERO);
        List<Long> ranAt = new ArrayList<>();
        loop.schedule(3, () -> ranAt.add(loop.currentTick()));

        assertThat(loop.tick()).isEqualTo(1);
        assertThat(loop.tick()).isEqualTo(2);
        assertThat(ranAt).isEmpty();

        assertThat(loop.tick()).isEqualTo(3);
        assertThat(ranAt).containsExactly(3L);

        loop.tick();
        assertThat(ranAt).containsExactly(3L);
    }

    @Test
    void scheduleAfterIsRelativeToCurrentTick() {
        TickLoop loop = new TickLoop(new TickScheduler(), 100L, 0, Duration.ZERO, failureHandler);
        List<Long> ranAt = new ArrayList<>();
        loop.scheduleAfter(0, () -> ranAt.add(loop.currentTick()));
        loop.scheduleAfter(2, () -> ranAt.add(loop.currentTick()));

        loop.tick();
        loop.tick();
        loop.tick();

        assertThat(ranAt).containsExactly(101L, 102L);
    }

    @Test
    void scheduleAfterRejectsNegativeDelay() {
        TickLoop loop = newLoop(0, Duration.ZERO);

        assertThatThrownBy(() -> loop.scheduleAfter(-1, () -> { }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-1");
    }

    @Test
    void callbackScheduledFromCallbackRunsOnALaterTick() {
        TickLoop loop = newLoop(0, Duration.ZERO);
        List<Long> ranAt = new ArrayList<>();
        loop.schedule(1, () -> loop.scheduleAfter(0, () -> ranAt.add(loop.currentTick())));

        loop.tick();
        assertThat(ranAt).isEmpty();

        loop.tick();
        assertThat(ranAt).containsExactly(2L);
    }

    @Test
    void listenersRunAfterDueCallbacks() {
        TickLoop loop = newLoop(0, Duration.ZERO);
        List<String> events = new ArrayList<>();
        loop.addTickListener(tick -> events.add("listener@" + tick));
        loop.schedule(1, () -> events.add("callback"));

        loop.tick();

        assertThat(events).containsExactly("callback", "listener@1");
    }

    @Test
    void removedListenerIsNoLongerCalled() {
        TickLoop loop = newLoop(0, Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();
        CountingListener listener = new CountingListener(calls);
        loop.addTickListener(listener);

        loop.tick();
        assertThat(loop.removeTickListener(listener)).isTrue();
        loop.tick();

        assertThat(calls).hasValue(1);
    }

    @Test
    void failingCallbackIsReportedAndOthersStillRun() {
        TickLoop loop = newLoop(0, Duration.ZERO);
        IllegalStateException boom = new IllegalStateException("boom");
        Runnable failing = () -> {
            throw boom;
        };
        AtomicInteger ran = new AtomicInteger();
        loop.schedule(1, failing);
        loop.schedule(1, ran::incrementAndGet);

        loop.tick();

        verify(failureHandler).onFailure(eq(1L), same(failing), same(boom));
        assertThat(ran).hasValue(1);
        assertThat(loop.getMetrics())
                .containsEntry("tasks_executed", 1L)
                .containsEntry("tasks_failed", 1L);
    }

    @Test
    void failingListenerDoesNotStopOtherListeners() {
        TickLoop loop = newLoop(0, Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();
        loop.addTickListener(tick -> {
            throw new IllegalArgumentException("listener broke");
        });
        loop.addTickListener(tick -> calls.incrementAndGet());

        loop.tick();
        loop.tick();

        assertThat(calls).hasValue(2);
        assertThat(loop.getMetrics()).containsEntry("listener_failures", 2L);
        verify(failureHandler, never()).onFailure(anyLong(), any(), any());
    }

    @Test
    void maxTasksPerTickDefersTheRestToTheNextTick() {
        TickLoop loop = newLoop(2, Duration.ZERO);
        List<String> runs = new ArrayList<>();
        for (String name : List.of("a", "b", "c", "d", "e")) {
            loop.schedule(1, () -> runs.add(name + "@" + loop.currentTick()));
        }

        loop.tick();
        assertThat(runs).containsExactly("a@1", "b@1");
        assertThat(loop.getMetrics()).containsEntry("tasks_deferred", 3L);

        loop.tick();
        loop.tick();
        assertThat(runs).hasSize(5).doesNotHaveDuplicates();
        assertThat(loop.pendingCount()).isZero();
    }

    static Stream<Arguments> stores() {
        return Stream.of(
                Arguments.of("drain-reinsert", (Supplier<ITaskStore>) DrainReinsertTaskStore::new),
                Arguments.of("tick-indexed", (Supplier<ITaskStore>) TickIndexedTaskStore::new)
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("stores")
    void deferredCallbackIsNotStarvedBySelfReschedulingCallback(String name, Supplier<ITaskStore> store) {
        TickLoop loop = new TickLoop(new TickScheduler(store.get()), 0L, 1, Duration.ZERO, failureHandler);
        List<Long> deferredRanAt = new ArrayList<>();
        Runnable selfRescheduling = new Runnable() {
            @Override
            public void run() {
                loop.scheduleAfter(0, this);
            }
        };
        loop.schedule(1, selfRescheduling);
        loop.schedule(1, () -> deferredRanAt.add(loop.currentTick()));

        for (int i = 0; i < 50; i++) {
            loop.tick();
        }

        assertThat(deferredRanAt).containsExactly(2L);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("stores")
    void deferredCallbacksRunAheadOfNewlyDueOnes(String name, Supplier<ITaskStore> store) {
        TickLoop loop = new TickLoop(new TickScheduler(store.get()), 0L, 2, Duration.ZERO, failureHandler);
        List<String> runs = new ArrayList<>();
        for (String label : List.of("a", "b", "c")) {
            loop.schedule(1, () -> runs.add(label + "@" + loop.currentTick()));
        }
        loop.schedule(2, () -> runs.add("d@" + loop.currentTick()));
        loop.schedule(2, () -> runs.add("e@" + loop.currentTick()));

        loop.tick();
        assertThat(loop.pendingCount()).isEqualTo(3);
        loop.tick();
        loop.tick();

        assertThat(runs).containsExactly("a@1", "b@1", "c@2", "d@2", "e@3");
        assertThat(loop.pendingCount()).isZero();
        assertThat(loop.getMetrics()).containsEntry("tasks_deferred", 2L);
    }

    @Test
    void rethrowingHandlerReturnsCarriedOverCallbacksToScheduler() {
        RuntimeException fatal = new IllegalStateException("fatal");
        TickLoop loop = new TickLoop(new TickScheduler(new TickIndexedTaskStore()), 0L, 1, Duration.ZERO,
                (tick, action, failure) -> {
                    throw failure;
                });
        AtomicInteger ran = new AtomicInteger();
        loop.schedule(1, ran::incrementAndGet);
        loop.schedule(1, () -> {
            throw fatal;
        });
        loop.schedule(1, ran::incrementAndGet);

        loop.tick();
        assertThat(loop.getScheduler().pendingCount()).isZero();
        assertThat(loop.pendingCount()).isEqualTo(2);

        // The carried-over failing callback aborts tick 2
        assertThatThrownBy(loop::tick).isSameAs(fatal);
        assertThat(loop.getScheduler().pendingCount()).isEqualTo(1);
        assertThat(loop.pendingCount()).isEqualTo(1);

        loop.tick();
        assertThat(ran).hasValue(2);
        assertThat(loop.pendingCount()).isZero();
    }

    @Test
    void timeBudgetIsCheckedEveryTenCallbacks() {
        TickLoop loop = newLoop(0, Duration.ofMillis(1));
        AtomicInteger ran = new AtomicInteger();
        for (int i = 0; i < 30; i++) {
            loop.schedule(1, () -> {
                sleepQuietly(2);
                ran.incrementAndGet();
            });
        }

        loop.tick();

        assertThat(ran).hasValue(TickLoop.BUDGET_CHECK_INTERVAL);
        assertThat(loop.pendingCount()).isEqualTo(30 - TickLoop.BUDGET_CHECK_INTERVAL);

        loop.tick();
        loop.tick();
        assertThat(ran).hasValue(30);
    }

    @Test
    void rethrowingHandlerRequeuesCallbacksNotYetStarted() {
        RuntimeException fatal = new IllegalStateException("fatal");
        TickLoop loop = new TickLoop(new TickScheduler(new TickIndexedTaskStore()), 0L, 0, Duration.ZERO,
                (tick, action, failure) -> {
                    throw failure;
                });
        AtomicInteger ran = new AtomicInteger();
        loop.schedule(1, ran::incrementAndGet);
        loop.schedule(1, () -> {
            throw fatal;
        });
        loop.schedule(1, ran::incrementAndGet);
        loop.schedule(1, ran::incrementAndGet);

        assertThatThrownBy(loop::tick).isSameAs(fatal);
        assertThat(ran).hasValue(1);
        assertThat(loop.getScheduler().pendingCount()).isEqualTo(2);

        loop.tick();
        assertThat(ran).hasValue(3);
    }

    @Test
    void constructorRejectsNegativeBudgets() {
        TickScheduler scheduler = new TickScheduler();

        assertThatThrownBy(() -> new TickLoop(scheduler, 0L, -1, Duration.ZERO, failureHandler))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TickLoop(scheduler, 0L, 0, Duration.ofMillis(-5), failureHandler))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromConfigAppliesBudgetSettings() {
        TickLoop loop = TickLoop.fromConfig(ConfigFactory.parseString(
                "scheduler.store = tick-indexed\nloop.max-tasks-per-tick = 1"));
        loop.schedule(1, () -> { });
        loop.schedule(1, () -> { });

        loop.tick();

        assertThat(loop.pendingCount()).isEqualTo(1);
        assertThat(loop.getMetrics()).containsEntry("tasks_deferred", 1L);
    }

    @Test
    void fromConfigWrapsInvalidValues() {
        assertThatThrownBy(() -> TickLoop.fromConfig(ConfigFactory.parseString("loop.time-budget = soon")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("TickLoop");
    }

    @Test
    void metricsReportClockAndQueueState() {
        TickLoop loop = newLoop(0, Duration.ZERO);
        loop.schedule(10, () -> { });
        loop.tick();

        assertThat(loop.getMetrics())
                .containsEntry("current_tick", 1L)
                .containsEntry("pending_tasks", 1)
                .containsEntry("tasks_executed", 0L)
                .containsKeys("tasks_failed", "tasks_deferred", "listener_failures");
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record CountingListener(AtomicInteger calls) implements ITickListener {
        @Override
        public void onTick(long tick) {
            calls.incrementAndGet();
        }
    }
}
