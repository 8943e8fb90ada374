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

package org.fireflyframework.automation.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.fireflyframework.automation.core.health.AutomationHealthIndicator;
import org.fireflyframework.automation.core.observability.AutomationMetrics;
import org.fireflyframework.automation.persistence.ExecutionPersistenceProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Auto-configuration for Micrometer metrics and the actuator health indicator.
 *
 * <p>Runs before {@link AutomationAutoConfiguration} so the metrics listener is
 * registered by the time the {@code AutomationEvents} composite is assembled.
 */
@Slf4j
@AutoConfiguration(before = AutomationAutoConfiguration.class, afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"})
@ConditionalOnProperty(name = "firefly.automation.engine.enabled", havingValue = "true", matchIfMissing = true)
public class AutomationObservabilityAutoConfiguration {

    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(name = "firefly.automation.metrics.enabled", havingValue = "true", matchIfMissing = true)
    static class MetricsConfig {

        @Bean
        @ConditionalOnMissingBean
        public AutomationMetrics automationMetrics(MeterRegistry meterRegistry) {
            log.info("[automation] Micrometer metrics initialized");
            return new AutomationMetrics(meterRegistry);
        }
    }

    @Configuration
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.ReactiveHealthIndicator")
    @ConditionalOnProperty(name = "firefly.automation.health.enabled", havingValue = "true", matchIfMissing = true)
    static class HealthConfig {

        @Bean
        @ConditionalOnMissingBean
        public AutomationHealthIndicator automationHealthIndicator(ExecutionPersistenceProvider persistence) {
            log.info("[automation] Health indicator initialized");
            return new AutomationHealthIndicator(persistence);
        }
    }
}
