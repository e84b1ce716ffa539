package com.chainwatch.watcher;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SlotGateTest {

    private final List<Long> slots = new ArrayList<>();
    private final List<String> values = new ArrayList<>();
    private final List<Throwable> errors = new ArrayList<>();

    private final SlotGate<String> gate = new SlotGate<>("test", (slot, value) -> {
        slots.add(slot);
        values.add(value);
    }, errors::add);

    @Test
    void offer_dropsStaleAndDuplicateSlots() {
        gate.offer(5, "a");
        gate.offer(5, "a-again");
        gate.offer(7, "b");
        gate.offer(6, "late");
        gate.offer(9, "c");

        assertThat(slots).containsExactly(5L, 7L, 9L);
        assertThat(values).containsExactly("a", "b", "c");
        assertThat(gate.lastAcceptedSlot()).isEqualTo(9L);
    }

    @Test
    void offerNext_synthesizesConsecutiveSlots() {
        gate.offer(10, "seed");

        gate.offerNext("x");
        gate.offerNext("y");
        gate.offerNext("z");

        assertThat(slots).containsExactly(10L, 11L, 12L, 13L);
    }

    @Test
    void offerNext_beforeAnyUpdate_startsAtZero() {
        gate.offerNext("first");

        assertThat(slots).containsExactly(0L);
    }

    @Test
    void absentValue_isDelivered() {
        assertThat(gate.offer(3, null)).isTrue();

        assertThat(values).containsExactly((String) null);
    }

    @Test
    void closed_deliversNothing() {
        gate.offer(1, "a");
        assertThat(gate.close()).isTrue();
        assertThat(gate.close()).isFalse();

        assertThat(gate.offer(2, "b")).isFalse();
        gate.report(new RuntimeException("late"));

        assertThat(slots).containsExactly(1L);
        assertThat(errors).isEmpty();
    }

    @Test
    void throwingUpdateCallback_isReportedAndSlotKept() {
        SlotGate<String> failing = new SlotGate<>("failing", (slot, value) -> {
            throw new IllegalStateException("consumer bug");
        }, errors::add);

        assertThat(failing.offer(4, "a")).isTrue();

        assertThat(failing.lastAcceptedSlot()).isEqualTo(4L);
        assertThat(errors).singleElement().isInstanceOf(IllegalStateException.class);
    }

    @Test
    void throwingErrorCallback_isIgnored() {
        SlotGate<String> noisy = new SlotGate<>("noisy", (slot, value) -> { }, e -> {
            throw new IllegalStateException("handler bug");
        });

        noisy.report(new RuntimeException("x"));

        assertThat(noisy.isClosed()).isFalse();
    }

    @Test
    void concurrentProducers_deliverStrictlyIncreasingSlots() throws Exception {
        List<Long> delivered = new ArrayList<>();
        SlotGate<Integer> shared = new SlotGate<>("concurrent", (slot, value) -> delivered.add(slot), errors::add);
        int producers = 4;
        ExecutorService executor = Executors.newFixedThreadPool(producers);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int p = 0; p < producers; p++) {
                int producer = p;
                futures.add(executor.submit(() -> {
                    go.await();
                    Random random = new Random(producer);
                    for (int i = 0; i < 20_000; i++) {
                        if (i % 10 == 0) {
                            shared.offerNext(i);
                        } else {
                            shared.offer(i + random.nextInt(50), i);
                        }
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(delivered).isNotEmpty().doesNotHaveDuplicates();
        for (int i = 1; i < delivered.size(); i++) {
            assertThat(delivered.get(i)).isGreaterThan(delivered.get(i - 1));
        }
        assertThat(shared.lastAcceptedSlot()).isEqualTo(delivered.get(delivered.size() - 1));
        assertThat(errors).isEmpty();
    }
}
