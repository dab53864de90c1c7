/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.timerstore.metrics;

import org.fireflyframework.timerstore.TestEvent;
import org.fireflyframework.timerstore.core.InMemoryTimerStore;
import org.fireflyframework.timerstore.persistence.PersistentTimerStore;
import org.fireflyframework.timerstore.persistence.TimerPersistence;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TimerStoreMetrics} as recorded by the timer stores.
 */
class TimerStoreMetricsTest {

    private SimpleMeterRegistry meterRegistry;
    private VirtualTimeScheduler scheduler;
    private TimerStoreMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        scheduler = VirtualTimeScheduler.create();
        metrics = new TimerStoreMetrics(meterRegistry);
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private TestEvent eventIn(Duration delay) {
        return new TestEvent("e", Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS)).plus(delay));
    }

    private double count(String name) {
        return meterRegistry.get("firefly.timerstore." + name).counter().count();
    }

    @Test
    @DisplayName("should count started, expired, cancelled and replaced timers")
    void recordsLifecycleCounters() {
        InMemoryTimerStore<String, TestEvent> store = new InMemoryTimerStore<>(scheduler, metrics);

        store.start("a", eventIn(Duration.ofSeconds(1)), () -> { });
        store.start("b", eventIn(Duration.ofHours(1)), () -> { });
        store.start("b", eventIn(Duration.ofHours(2)), () -> { });
        store.cancel("b");
        store.cancel("b");
        scheduler.advanceTimeBy(Duration.ofSeconds(1));

        assertThat(count("started")).isEqualTo(3.0);
        assertThat(count("replaced")).isEqualTo(1.0);
        assertThat(count("cancelled")).isEqualTo(1.0);
        assertThat(count("expired")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should expose the number of pending timers as a gauge")
    void pendingGauge_tracksRegistrations() {
        InMemoryTimerStore<String, TestEvent> store = new InMemoryTimerStore<>(scheduler, metrics);

        store.start("a", eventIn(Duration.ofSeconds(1)), () -> { });
        store.start("b", eventIn(Duration.ofSeconds(2)), () -> { });
        assertThat(meterRegistry.get("firefly.timerstore.pending").gauge().value()).isEqualTo(2.0);

        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertThat(meterRegistry.get("firefly.timerstore.pending").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should count callbacks that throw")
    void recordsCallbackFailures() {
        InMemoryTimerStore<String, TestEvent> store = new InMemoryTimerStore<>(scheduler, metrics);

        store.start("a", eventIn(Duration.ofSeconds(1)), () -> {
            throw new IllegalStateException("boom");
        });
        scheduler.advanceTimeBy(Duration.ofSeconds(1));

        assertThat(count("callback.failures")).isEqualTo(1.0);
        assertThat(count("expired")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should tag persistence failures with the failed operation")
    void recordsPersistenceFailuresByOperation() {
        TimerPersistence<String, TestEvent> failing = new TimerPersistence<>() {
            @Override
            public void put(String id, TestEvent event) {
                if (id.startsWith("reject")) {
                    throw new IllegalStateException("put rejected");
                }
            }

            @Override
            public void delete(String id, TestEvent event) {
                throw new IllegalStateException("delete rejected");
            }
        };
        PersistentTimerStore<String, TestEvent> store = new PersistentTimerStore<>(failing, scheduler, metrics);

        assertThatThrownBy(() -> store.start("reject-1", eventIn(Duration.ofSeconds(1)), () -> { }))
                .isInstanceOf(RuntimeException.class);
        store.start("accept-1", eventIn(Duration.ofSeconds(1)), () -> { });
        scheduler.advanceTimeBy(Duration.ofSeconds(1));

        assertThat(meterRegistry.get("firefly.timerstore.persistence.failures")
                .tag("operation", "put").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("firefly.timerstore.persistence.failures")
                .tag("operation", "delete").counter().count()).isEqualTo(1.0);
    }
}
