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

package org.fireflyframework.timerstore.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Timer Store library.
 */
@ConfigurationProperties(prefix = "firefly.timerstore")
@Validated
@Data
public class TimerStoreProperties {

    /**
     * Whether the timer store is enabled.
     */
    private boolean enabled = true;

    /**
     * Whether to enable metrics collection.
     */
    private boolean metricsEnabled = true;

    /**
     * Whether to enable health checks.
     */
    private boolean healthEnabled = true;

    /**
     * Scheduler running the expiration callbacks.
     */
    @Valid
    @NotNull
    private SchedulerConfig scheduler = new SchedulerConfig();

    /**
     * Scheduler configuration.
     */
    @Data
    public static class SchedulerConfig {

        /**
         * Thread name prefix of the scheduler workers.
         */
        @NotBlank
        private String name = "firefly-timerstore";

        /**
         * Number of worker threads.
         */
        @Min(1)
        private int threads = Runtime.getRuntime().availableProcessors();

        /**
         * Whether worker threads are daemon threads.
         */
        private boolean daemon = true;
    }
}
