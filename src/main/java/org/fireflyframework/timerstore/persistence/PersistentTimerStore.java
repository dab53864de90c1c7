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

package org.fireflyframework.timerstore.persistence;

import org.fireflyframework.timerstore.core.CancelResult;
import org.fireflyframework.timerstore.core.Expirable;
import org.fireflyframework.timerstore.core.InMemoryTimerStore;
import org.fireflyframework.timerstore.core.TimerStore;
import org.fireflyframework.timerstore.exception.TimerPersistenceException;
import org.fireflyframework.timerstore.exception.TimerStoreException;
import org.fireflyframework.timerstore.metrics.TimerStoreMetrics;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.lang.Nullable;

import lombok.extern.slf4j.Slf4j;
import reactor.core.scheduler.Scheduler;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link TimerStore} that mirrors every registration into a {@link TimerPersistence}.
 * <p>
 * <b>Start:</b> a shut-down store rejects the call without touching the external store.
 * Otherwise the event is written to the external store first. If the write fails the
 * error is propagated and no in-memory registration is created. Otherwise the event is
 * registered in memory with a callback that deletes the stored entry before running the
 * caller's callback. When the start replaces a pending registration, the replaced entry
 * is deleted from the external store.
 * <p>
 * <b>Cancel:</b> the in-memory registration is cancelled first. The stored entry is
 * deleted only when that cancellation succeeded, so entries of identifiers that already
 * expired or never existed are left alone.
 * <p>
 * Deletes are best effort: a failing delete is logged and never surfaced. There is no
 * transaction spanning the external store and the in-memory map.
 *
 * @param <I> the identifier type
 * @param <E> the event type
 * @see InMemoryTimerStore
 */
@Slf4j
public class PersistentTimerStore<I, E extends Expirable> implements TimerStore<I, E>, DisposableBean {

    private final TimerPersistence<I, E> persistence;
    private final InMemoryTimerStore<I, E> timers;
    @Nullable
    private final TimerStoreMetrics metrics;

    public PersistentTimerStore(TimerPersistence<I, E> persistence, Scheduler scheduler) {
        this(persistence, scheduler, null);
    }

    public PersistentTimerStore(TimerPersistence<I, E> persistence, Scheduler scheduler,
                                @Nullable TimerStoreMetrics metrics) {
        this(persistence, new InMemoryTimerStore<>(scheduler, metrics), metrics);
    }

    PersistentTimerStore(TimerPersistence<I, E> persistence, InMemoryTimerStore<I, E> timers,
                         @Nullable TimerStoreMetrics metrics) {
        this.persistence = Objects.requireNonNull(persistence, "persistence cannot be null");
        this.timers = Objects.requireNonNull(timers, "timers cannot be null");
        this.metrics = metrics;
    }

    @Override
    public void start(I id, E event, Runnable onExpire) {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(event, "event cannot be null");
        Objects.requireNonNull(onExpire, "onExpire cannot be null");
        if (timers.isShutdown()) {
            throw new TimerStoreException("Timer store is shut down, cannot start timer '" + id + "'");
        }

        try {
            persistence.put(id, event);
        } catch (RuntimeException e) {
            recordFailure("put");
            log.error("Failed to persist timer '{}', registration aborted: {}", id, e.getMessage(), e);
            if (e instanceof TimerPersistenceException persistenceFailure) {
                throw persistenceFailure;
            }
            throw new TimerPersistenceException(id, e.getMessage(), e);
        }

        E replaced;
        try {
            replaced = timers.register(id, event, () -> {
                delete(id, event);
                onExpire.run();
            });
        } catch (RuntimeException e) {
            delete(id, event);
            throw e;
        }

        // The replaced timer will never fire, so its entry is removed here.
        if (replaced != null && !replaced.equals(event)) {
            delete(id, replaced);
        }
    }

    @Override
    public CancelResult<E> cancel(I id) {
        CancelResult<E> result = timers.cancel(id);
        if (!result.cancelled()) {
            return result;
        }

        delete(id, result.event());
        return result;
    }

    @Override
    public boolean isPending(I id) {
        return timers.isPending(id);
    }

    @Override
    public Optional<E> find(I id) {
        return timers.find(id);
    }

    @Override
    public int pendingCount() {
        return timers.pendingCount();
    }

    @Override
    public boolean isShutdown() {
        return timers.isShutdown();
    }

    /**
     * Disposes the in-memory timers. Stored entries are kept so a restart can recover them.
     */
    @Override
    public void shutdown() {
        timers.shutdown();
    }

    @Override
    public void destroy() {
        shutdown();
    }

    private void delete(I id, E event) {
        try {
            persistence.delete(id, event);
            log.debug("Timer removed from persistent store: id={}", id);
        } catch (RuntimeException e) {
            recordFailure("delete");
            log.warn("Failed to delete timer '{}' from persistent store: {}", id, e.getMessage(), e);
        }
    }

    private void recordFailure(String operation) {
        if (metrics != null) {
            metrics.recordPersistenceFailure(operation);
        }
    }
}
