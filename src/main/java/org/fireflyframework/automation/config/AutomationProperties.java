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

import org.fireflyframework.automation.client.ExecutionPollingPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;

/**
 * Configuration properties for the automation engine.
 *
 * <p>Example YAML:
 * <pre>{@code
 * firefly:
 *   automation:
 *     engine:
 *       enabled: true
 *       default-step-timeout: 30s
 *       max-concurrency: 8
 *       write-conflict-retries: 5
 *     persistence:
 *       provider: redis
 *       key-prefix: automation:
 *       key-ttl: 30d
 *       retention: 7d
 *     recovery:
 *       enabled: true
 *       stale-threshold: 1h
 *     rest:
 *       enabled: true
 *     webhook:
 *       enabled: true
 *     health:
 *       enabled: true
 *     metrics:
 *       enabled: true
 *     polling:
 *       running-interval: 1s
 *       waiting-interval: 2s
 *       max-attempts: 300
 * }</pre>
 */
@ConfigurationProperties(prefix = "firefly.automation")
public class AutomationProperties {

    @NestedConfigurationProperty
    private EngineProperties engine = new EngineProperties();

    @NestedConfigurationProperty
    private PersistenceProperties persistence = new PersistenceProperties();

    @NestedConfigurationProperty
    private RecoveryProperties recovery = new RecoveryProperties();

    @NestedConfigurationProperty
    private RestProperties rest = new RestProperties();

    @NestedConfigurationProperty
    private WebhookProperties webhook = new WebhookProperties();

    @NestedConfigurationProperty
    private HealthProperties health = new HealthProperties();

    @NestedConfigurationProperty
    private MetricsProperties metrics = new MetricsProperties();

    @NestedConfigurationProperty
    private PollingProperties polling = new PollingProperties();

    // --- Getters and Setters ---

    public EngineProperties getEngine() { return engine; }
    public void setEngine(EngineProperties engine) { this.engine = engine; }

    public PersistenceProperties getPersistence() { return persistence; }
    public void setPersistence(PersistenceProperties persistence) { this.persistence = persistence; }

    public RecoveryProperties getRecovery() { return recovery; }
    public void setRecovery(RecoveryProperties recovery) { this.recovery = recovery; }

    public RestProperties getRest() { return rest; }
    public void setRest(RestProperties rest) { this.rest = rest; }

    public WebhookProperties getWebhook() { return webhook; }
    public void setWebhook(WebhookProperties webhook) { this.webhook = webhook; }

    public HealthProperties getHealth() { return health; }
    public void setHealth(HealthProperties health) { this.health = health; }

    public MetricsProperties getMetrics() { return metrics; }
    public void setMetrics(MetricsProperties metrics) { this.metrics = metrics; }

    public PollingProperties getPolling() { return polling; }
    public void setPolling(PollingProperties polling) { this.polling = polling; }

    // --- Nested property classes ---

    public static class EngineProperties {
        private boolean enabled = true;
        private Duration defaultStepTimeout = Duration.ZERO;
        private int maxConcurrency = 0;
        private int writeConflictRetries = 5;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getDefaultStepTimeout() { return defaultStepTimeout; }
        public void setDefaultStepTimeout(Duration defaultStepTimeout) { this.defaultStepTimeout = defaultStepTimeout; }

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

        public int getWriteConflictRetries() { return writeConflictRetries; }
        public void setWriteConflictRetries(int writeConflictRetries) { this.writeConflictRetries = writeConflictRetries; }
    }

    public static class PersistenceProperties {
        private String provider = "in-memory";
        private String keyPrefix = "automation:";
        private Duration keyTtl;
        private Duration retention = Duration.ofDays(7);

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getKeyPrefix() { return keyPrefix; }
        public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }

        public Duration getKeyTtl() { return keyTtl; }
        public void setKeyTtl(Duration keyTtl) { this.keyTtl = keyTtl; }

        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }
    }

    public static class RecoveryProperties {
        private boolean enabled = true;
        private Duration staleThreshold = Duration.ofHours(1);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getStaleThreshold() { return staleThreshold; }
        public void setStaleThreshold(Duration staleThreshold) { this.staleThreshold = staleThreshold; }
    }

    public static class RestProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class WebhookProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class HealthProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class MetricsProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class PollingProperties {
        private Duration runningInterval = Duration.ofSeconds(1);
        private Duration waitingInterval = Duration.ofSeconds(2);
        private int maxAttempts = 300;

        public Duration getRunningInterval() { return runningInterval; }
        public void setRunningInterval(Duration runningInterval) { this.runningInterval = runningInterval; }

        public Duration getWaitingInterval() { return waitingInterval; }
        public void setWaitingInterval(Duration waitingInterval) { this.waitingInterval = waitingInterval; }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public ExecutionPollingPolicy toPolicy() {
            return new ExecutionPollingPolicy(runningInterval, waitingInterval, maxAttempts);
        }
    }
}
