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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Provides Micrometer metrics for timer store monitoring.
 * <p>
 * This class tracks the following metrics:
 * <ul>
 *   <li><b>started</b> - Counter of registrations started</li>
 *   <li><b>cancelled</b> - Counter of registrations cancelled before expiring</li>
 *   <li><b>expired</b> - Counter of registrations that fired</li>
 *   <li><b>replaced</b> - Counter of pending registrations replaced by a new start</li>
 *   <li><b>callback.failures</b> - Counter of expiration callbacks that threw</li>
 *   <li><b>persistence.failures</b> - Counter of external store failures (tags: operation)</li>
 *   <li><b>pending</b> - Gauge of currently pending registrations</li>
 * </ul>
 * <p>
 * All metrics are prefixed with "firefly.timerstore.". Identifiers are never used as
 * tags.
 */
@Slf4j
public class TimerStoreMetrics {

    private static final String METRIC_PREFIX = "firefly.timerstore.";

    private static final String TAG_OPERATION = "operation";

    private final MeterRegistry meterRegistry;
    private final Counter started;
    private final Counter cancelled;
    private final Counter expired;
    private final Counter replaced;
    private final Counter callbackFailures;

    public TimerStoreMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.started = counter("started", "Number of timers started");
        this.cancelled = counter("cancelled", "Number of timers cancelled before expiring");
        this.expired = counter("expired", "Number of timers that expired and fired");
        this.replaced = counter("replaced", "Number of pending timers replaced by a new start");
        this.callbackFailures = counter("callback.failures", "Number of expiration callbacks that threw");
        log.info("TimerStoreMetrics initialized with MeterRegistry: {}", meterRegistry.getClass().getSimpleName());
    }

    public void recordStarted() {
        started.increment();
    }

    public void recordCancelled() {
        cancelled.increment();
    }

    public void recordExpired() {
        expired.increment();
    }

    public void recordReplaced() {
        replaced.increment();
    }

    public void recordCallbackFailure() {
        callbackFailures.increment();
    }

    /**
     * Records a failed call to the external persistent store.
     *
     * @param operation the store operation, {@code put} or {@code delete}
     */
    public void recordPersistenceFailure(String operation) {
        Counter.builder(METRIC_PREFIX + "persistence.failures")
                .description("Number of failed external store operations")
                .tag(TAG_OPERATION, operation)
                .register(meterRegistry)
                .increment();

        log.debug("METRIC: persistence.failures operation={}", operation);
    }

    /**
     * Registers the gauge of pending registrations. Only the first registration for a
     * registry takes effect.
     *
     * @param pendingCount supplies the current number of pending registrations
     */
    public void registerPendingGauge(Supplier<Number> pendingCount) {
        Gauge.builder(METRIC_PREFIX + "pending", pendingCount)
                .description("Number of pending timers")
                .register(meterRegistry);
    }

    private Counter counter(String name, String description) {
        return Counter.builder(METRIC_PREFIX + name)
                .description(description)
                .register(meterRegistry);
    }
}
