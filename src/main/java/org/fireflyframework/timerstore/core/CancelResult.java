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

/**
 * Outcome of a {@link TimerStore#cancel(Object)} call.
 *
 * @param event     the event of the cancelled registration, or null if nothing was cancelled
 * @param cancelled true if a pending registration was removed by this call
 * @param <E>       the event type
 */
public record CancelResult<E>(E event, boolean cancelled) {

    private static final CancelResult<?> NOT_CANCELLED = new CancelResult<>(null, false);

    public static <E> CancelResult<E> cancelled(E event) {
        return new CancelResult<>(event, true);
    }

    @SuppressWarnings("unchecked")
    public static <E> CancelResult<E> notCancelled() {
        return (CancelResult<E>) NOT_CANCELLED;
    }
}
