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

import java.time.Instant;

/**
 * An event that knows when it expires.
 * <p>
 * This is the only capability a {@link TimerStore} requires from the events it holds;
 * the store never looks at anything else.
 */
@FunctionalInterface
public interface Expirable {

    /**
     * Returns the instant at which the event expires. Instants in the past are legal
     * and cause the registration to fire almost immediately.
     *
     * @return the expiration instant, never null
     */
    Instant expireAt();
}
