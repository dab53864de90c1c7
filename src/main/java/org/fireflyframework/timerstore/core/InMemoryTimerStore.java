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

package org.fireflyframework.timerstore.core;

import org.fireflyframework.timerstore.exception.TimerStoreException;
import org.fireflyframework.timerstore.metrics.TimerStoreMetrics;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.lang.Nullable;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link TimerStore} that keeps registrations in memory and schedules their expiration
 * on a Reactor {@link Scheduler}.
 * <p>
 * Registrations live in a {@link ConcurrentHashMap}. Removing a registration from the
 * map is the single arbitration point between a firing timer and a concurrent
 * {@link #cancel(Object)}: the timer task removes only its own registration
 * (compare-and-remove) and runs the callback only if that removal succeeded, while
 * {@code cancel} removes whatever registration is present. Whoever removes it wins.
 * <p>
 * <b>Time source:</b> the delay until expiration is computed against
 * {@link Scheduler#now(TimeUnit)}, so a virtual-time scheduler drives expiration
 * deterministically in tests.
 * <p>
 * <b>Replacement:</b> starting an identifier that is still pending disposes the previous
 * timer. The replaced callback never runs.
 *
 * @param <I> the identifier type
 * @param <E> the event type
 */
@Slf4j
public class InMemoryTimerStore<I, E extends Expirable> implements TimerStore<I, E>, DisposableBean {

    private final ConcurrentHashMap<I, Registration<I, E>> registrations = new ConcurrentHashMap<>();
    private final Scheduler scheduler;
    @Nullable
    private final TimerStoreMetrics metrics;

    private volatile boolean shutdown;

    public InMemoryTimerStore(Scheduler scheduler) {
        this(scheduler, null);
    }

    public InMemoryTimerStore(Scheduler scheduler, @Nullable TimerStoreMetrics metrics) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.metrics = metrics;
        if (metrics != null) {
            metrics.registerPendingGauge(registrations::size);
        }
    }

    @Override
    public void start(I id, E event, Runnable onExpire) {
        register(id, event, onExpire);
    }

    /**
     * Starts a timer like {@link #start(Object, Expirable, Runnable)} and reports the
     * registration it replaced, if any.
     *
     * @param id       the identifier
     * @param event    the event
     * @param onExpire the callback to run on expiration
     * @return the event of the replaced pending registration, or {@code null} if the
     *         identifier was not pending
     * @throws TimerStoreException if the store is shut down or the scheduler rejected the timer
     */
    @Nullable
    public E register(I id, E event, Runnable onExpire) {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(event, "event cannot be null");
        Objects.requireNonNull(onExpire, "onExpire cannot be null");
        if (shutdown) {
            throw new TimerStoreException("Timer store is shut down, cannot start timer '" + id + "'");
        }

        Instant expireAt = event.expireAt();
        long delayMs = delayUntil(expireAt);

        // The registration must be visible before the timer can fire, a zero delay may run at once.
        Registration<I, E> registration = new Registration<>(id, event, onExpire);
        Registration<I, E> replaced = registrations.put(id, registration);
        if (shutdown) {
            // shutdown() may have swept the map before the put landed
            registrations.remove(id, registration);
            registration.dispose();
            if (replaced != null) {
                replaced.dispose();
            }
            throw new TimerStoreException("Timer store is shut down, cannot start timer '" + id + "'");
        }
        if (replaced != null) {
            replaced.dispose();
            log.warn("Timer '{}' replaced a pending registration (expireAt={}); its callback will not run",
                    id, replaced.event().expireAt());
            if (metrics != null) {
                metrics.recordReplaced();
            }
        }

        Disposable handle;
        try {
            handle = scheduler.schedule(() -> fire(registration), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            registrations.remove(id, registration);
            throw new TimerStoreException("Scheduler rejected timer '" + id + "'", e);
        }
        registration.attach(handle);

        if (metrics != null) {
            metrics.recordStarted();
        }
        log.debug("Timer started: id={}, expireAt={}, delayMs={}", id, expireAt, delayMs);
        return replaced != null ? replaced.event() : null;
    }

    @Override
    public CancelResult<E> cancel(I id) {
        Objects.requireNonNull(id, "id cannot be null");
        Registration<I, E> registration = registrations.remove(id);
        if (registration == null) {
            log.debug("Timer not pending, nothing to cancel: id={}", id);
            return CancelResult.notCancelled();
        }

        registration.dispose();
        if (metrics != null) {
            metrics.recordCancelled();
        }
        log.debug("Timer cancelled: id={}", id);
        return CancelResult.cancelled(registration.event());
    }

    @Override
    public boolean isPending(I id) {
        return registrations.containsKey(id);
    }

    @Override
    public Optional<E> find(I id) {
        Registration<I, E> registration = registrations.get(id);
        return registration != null ? Optional.of(registration.event()) : Optional.empty();
    }

    @Override
    public int pendingCount() {
        return registrations.size();
    }

    @Override
    public boolean isShutdown() {
        return shutdown;
    }

    @Override
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;

        int disposed = 0;
        for (I id : registrations.keySet()) {
            Registration<I, E> registration = registrations.remove(id);
            if (registration != null) {
                registration.dispose();
                disposed++;
            }
        }
        log.info("Timer store shut down, disposed {} pending timer(s)", disposed);
    }

    /**
     * Disposes pending timers on Spring context shutdown.
     */
    @Override
    public void destroy() {
        shutdown();
    }

    private long delayUntil(Instant expireAt) {
        long now = scheduler.now(TimeUnit.MILLISECONDS);
        try {
            return Math.max(0L, Math.subtractExact(expireAt.toEpochMilli(), now));
        } catch (ArithmeticException e) {
            // Out of the epoch-millis range
            return expireAt.isBefore(Instant.EPOCH) ? 0L : Long.MAX_VALUE;
        }
    }

    private void fire(Registration<I, E> registration) {
        if (!registrations.remove(registration.id(), registration)) {
            // Cancelled or replaced after the timer was already queued.
            log.debug("Timer fired but registration is gone: id={}", registration.id());
            return;
        }

        log.debug("Timer expired: id={}, expireAt={}", registration.id(), registration.event().expireAt());
        if (metrics != null) {
            metrics.recordExpired();
        }
        try {
            registration.onExpire().run();
        } catch (RuntimeException e) {
            if (metrics != null) {
                metrics.recordCallbackFailure();
            }
            log.error("Expiration callback failed for timer '{}': {}", registration.id(), e.getMessage(), e);
        }
    }

    /**
     * A live registration: the event, its callback and the pending timer handle.
     */
    private static final class Registration<I, E> {

        private final I id;
        private final E event;
        private final Runnable onExpire;

        private volatile Disposable handle;
        private volatile boolean disposed;

        Registration(I id, E event, Runnable onExpire) {
            this.id = id;
            this.event = event;
            this.onExpire = onExpire;
        }

        I id() {
            return id;
        }

        E event() {
            return event;
        }

        Runnable onExpire() {
            return onExpire;
        }

        // attach and dispose may race when cancel runs between put and schedule
        void attach(Disposable handle) {
            this.handle = handle;
            if (disposed) {
                handle.dispose();
            }
        }

        void dispose() {
            disposed = true;
            Disposable current = handle;
            if (current != null) {
                current.dispose();
            }
        }
    }
}
