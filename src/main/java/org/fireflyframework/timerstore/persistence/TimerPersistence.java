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

import org.fireflyframework.timerstore.core.Expirable;

/**
 * External persistent store mirrored by {@link PersistentTimerStore}.
 * <p>
 * Implementations back pending registrations with durable storage (a database, a
 * distributed cache) so they can be recovered after a restart. Recovery itself is up
 * to the consumer of that storage.
 *
 * @param <I> the identifier type
 * @param <E> the event type
 */
public interface TimerPersistence<I, E extends Expirable> {

    /**
     * Writes the event for the identifier. Must be safe to call concurrently for
     * distinct identifiers.
     *
     * @param id    the identifier
     * @param event the event
     * @throws RuntimeException if the write failed; the registration is then aborted
     */
    void put(I id, E event);

    /**
     * Deletes the event for the identifier.
     * <p>
     * Called fire-and-forget, possibly from a scheduler thread, so it must be idempotent:
     * deleting an entry that was already deleted or never written is not an error.
     * <p>
     * When a start replaces a pending registration, the replaced event is deleted after
     * the new one was written. A store keyed by identifier alone must therefore leave an
     * entry in place when it holds a different event than the one given.
     *
     * @param id    the identifier
     * @param event the event that was written by {@link #put(Object, Expirable)}
     */
    void delete(I id, E event);
}
