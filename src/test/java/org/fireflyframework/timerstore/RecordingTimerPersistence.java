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

package org.fireflyframework.timerstore;

import org.fireflyframework.timerstore.persistence.TimerPersistence;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link TimerPersistence} for tests, keyed by identifier.
 */
public class RecordingTimerPersistence implements TimerPersistence<String, TestEvent> {

    private final Map<String, TestEvent> entries = new ConcurrentHashMap<>();

    @Override
    public void put(String id, TestEvent event) {
        entries.put(id, event);
    }

    @Override
    public void delete(String id, TestEvent event) {
        entries.remove(id, event);
    }

    public Map<String, TestEvent> entries() {
        return entries;
    }
}
