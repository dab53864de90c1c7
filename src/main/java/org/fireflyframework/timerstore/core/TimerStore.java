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

import java.util.Optional;

/**
 * Registry of expiring events keyed by a caller-chosen identifier.
 * <p>
 * Each registration fires its completion callback once the event's
 * {@link Expirable#expireAt() expiration} has passed, unless it is cancelled first.
 * For a single registration exactly one of the two outcomes is observed:
 * <ul>
 *   <li>the callback runs, and a later {@link #cancel(Object)} reports {@code false}</li>
 *   <li>{@link #cancel(Object)} reports {@code true}, and the callback never runs</li>
 * </ul>
 * Operations on different identifiers are independent and have no relative ordering.
 *
 * @param <I> the identifier type, must implement {@code equals} and {@code hashCode}
 * @param <E> the event type
 * @see InMemoryTimerStore
 * @see org.fireflyframework.timerstore.persistence.PersistentTimerStore
 */
public interface TimerStore<I, E extends Expirable> {

    /**
     * Registers an event under the given identifier.
     * <p>
     * A pending registration for the same identifier is replaced and its callback
     * will not run.
     *
     * @param id       the identifier
     * @param event    the event carrying the expiration instant
     * @param onExpire the callback invoked on a scheduler thread when the event expires
     * @throws org.fireflyframework.timerstore.exception.TimerStoreException if the registration could not be created
     */
    void start(I id, E event, Runnable onExpire);

    /**
     * Cancels the pending registration for the given identifier.
     * <p>
     * Does not wait for a callback that is already running. An identifier that already
     * expired, was already cancelled or never existed yields
     * {@link CancelResult#notCancelled()}.
     *
     * @param id the identifier
     * @return the cancellation outcome
     */
    CancelResult<E> cancel(I id);

    /**
     * Checks whether a registration is pending for the identifier.
     *
     * @param id the identifier
     * @return true if pending
     */
    boolean isPending(I id);

    /**
     * Returns the pending event for the identifier.
     *
     * @param id the identifier
     * @return the event if a registration is pending
     */
    Optional<E> find(I id);

    /**
     * Returns the number of pending registrations.
     *
     * @return the pending count
     */
    int pendingCount();

    /**
     * Whether {@link #shutdown()} has been called.
     *
     * @return true once shut down
     */
    boolean isShutdown();

    /**
     * Disposes all pending timers without running their callbacks and rejects further
     * registrations. Safe to call more than once.
     */
    void shutdown();
}
