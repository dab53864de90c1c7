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

package org.fireflyframework.timerstore.exception;

/**
 * Exception thrown when an event could not be written to the external persistent store.
 * <p>
 * When raised from {@code start}, no registration has been created for the identifier.
 */
public class TimerPersistenceException extends TimerStoreException {

    private final Object timerId;

    public TimerPersistenceException(Object timerId, String message) {
        super("Timer '" + timerId + "' persistence failed: " + message);
        this.timerId = timerId;
    }

    public TimerPersistenceException(Object timerId, String message, Throwable cause) {
        super("Timer '" + timerId + "' persistence failed: " + message, cause);
        this.timerId = timerId;
    }

    public Object getTimerId() {
        return timerId;
    }
}
