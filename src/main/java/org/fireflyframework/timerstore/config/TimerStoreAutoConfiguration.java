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

package org.fireflyframework.timerstore.config;

import org.fireflyframework.timerstore.core.Expirable;
import org.fireflyframework.timerstore.core.InMemoryTimerStore;
import org.fireflyframework.timerstore.core.TimerStore;
import org.fireflyframework.timerstore.health.TimerStoreHealthIndicator;
import org.fireflyframework.timerstore.metrics.TimerStoreMetrics;
import org.fireflyframework.timerstore.persistence.PersistentTimerStore;
import org.fireflyframework.timerstore.persistence.TimerPersistence;
import org.fireflyframework.timerstore.properties.TimerStoreProperties;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Auto-configuration for the Firefly Timer Store.
 * <p>
 * This configuration provides:
 * <ul>
 *   <li>timerStoreScheduler - Reactor scheduler running expiration callbacks</li>
 *   <li>PersistentTimerStore - when a {@link TimerPersistence} bean is present</li>
 *   <li>InMemoryTimerStore - otherwise</li>
 *   <li>TimerStoreMetrics - when a Micrometer MeterRegistry is present</li>
 *   <li>TimerStoreHealthIndicator - when Spring Boot Actuator is on the classpath</li>
 * </ul>
 * <p>
 * Configuration properties:
 * <pre>
 * firefly:
 *   timerstore:
 *     enabled: true
 *     metrics-enabled: true
 *     health-enabled: true
 *     scheduler:
 *       name: firefly-timerstore
 *       threads: 4
 *       daemon: true
 * </pre>
 */
@Slf4j
@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(TimerStoreProperties.class)
@ConditionalOnProperty(prefix = "firefly.timerstore", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TimerStoreAutoConfiguration {

    public static final String SCHEDULER_BEAN_NAME = "timerStoreScheduler";

    @Bean(name = SCHEDULER_BEAN_NAME, destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = SCHEDULER_BEAN_NAME)
    public Scheduler timerStoreScheduler(TimerStoreProperties properties) {
        TimerStoreProperties.SchedulerConfig config = properties.getScheduler();
        log.info("Creating timer store scheduler: name={}, threads={}, daemon={}",
                config.getName(), config.getThreads(), config.isDaemon());
        return Schedulers.newParallel(config.getName(), config.getThreads(), config.isDaemon());
    }

    @Bean
    @ConditionalOnMissingBean(TimerStore.class)
    @ConditionalOnBean(TimerPersistence.class)
    @SuppressWarnings({"unchecked", "rawtypes"})
    public PersistentTimerStore<?, ?> persistentTimerStore(
            TimerPersistence<?, ?> persistence,
            @Qualifier(SCHEDULER_BEAN_NAME) Scheduler scheduler,
            @Nullable TimerStoreMetrics metrics) {
        log.info("Creating PersistentTimerStore backed by {}, metrics: {}",
                persistence.getClass().getSimpleName(), metrics != null);
        return new PersistentTimerStore(persistence, scheduler, metrics);
    }

    @Bean
    @ConditionalOnMissingBean({TimerStore.class, TimerPersistence.class})
    public InMemoryTimerStore<?, ?> inMemoryTimerStore(
            @Qualifier(SCHEDULER_BEAN_NAME) Scheduler scheduler,
            @Nullable TimerStoreMetrics metrics) {
        log.info("Creating InMemoryTimerStore, metrics: {}", metrics != null);
        return new InMemoryTimerStore<Object, Expirable>(scheduler, metrics);
    }

    /**
     * Micrometer metrics, only when a MeterRegistry is available.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "firefly.timerstore", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    static class TimerStoreMetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnBean(MeterRegistry.class)
        public TimerStoreMetrics timerStoreMetrics(MeterRegistry meterRegistry) {
            log.info("Configuring TimerStoreMetrics with Micrometer MeterRegistry");
            return new TimerStoreMetrics(meterRegistry);
        }
    }

    /**
     * Health indicator, only when Actuator is on the classpath.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(ReactiveHealthIndicator.class)
    @ConditionalOnProperty(prefix = "firefly.timerstore", name = "health-enabled", havingValue = "true", matchIfMissing = true)
    static class TimerStoreHealthConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public TimerStoreHealthIndicator timerStoreHealthIndicator(
                TimerStore<?, ?> timerStore,
                @Qualifier(SCHEDULER_BEAN_NAME) Scheduler scheduler) {
            log.info("Creating TimerStoreHealthIndicator");
            return new TimerStoreHealthIndicator(timerStore, scheduler);
        }
    }
}
