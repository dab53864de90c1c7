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

package org.fireflyframework.timerstore.health;

import org.fireflyframework.timerstore.core.TimerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Health indicator for the Timer Store.
 * <p>
 * Reports the health status based on:
 * <ul>
 *   <li>Number of pending timers</li>
 *   <li>Whether the store has been shut down</li>
 *   <li>Whether the expiration scheduler is still running</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class TimerStoreHealthIndicator implements ReactiveHealthIndicator {

    private final TimerStore<?, ?> timerStore;
    private final Scheduler scheduler;

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(() -> {
                    boolean schedulerRunning = !scheduler.isDisposed();
                    boolean storeRunning = !timerStore.isShutdown();

                    Health.Builder builder = schedulerRunning && storeRunning ? Health.up() : Health.down();

                    return builder
                            .withDetail("pendingTimers", timerStore.pendingCount())
                            .withDetail("store", storeRunning ? "running" : "shutdown")
                            .withDetail("scheduler", schedulerRunning ? "running" : "disposed")
                            .build();
                })
                .onErrorResume(e -> {
                    log.warn("Timer store health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }
}
