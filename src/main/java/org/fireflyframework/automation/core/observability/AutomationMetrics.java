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

package org.fireflyframework.automation.core.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.fireflyframework.automation.core.model.ExecutionStatus;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

public class AutomationMetrics implements AutomationEvents {
    private static final String PREFIX = "firefly.automation";
    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public AutomationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onExecutionStarted(String workflowId, String executionId) {
        counter("executions.started", "workflowId", workflowId).increment();
    }

    @Override
    public void onExecutionCompleted(String workflowId, String executionId, ExecutionStatus status, long durationMs) {
        counter("executions.completed", "workflowId", workflowId, "status", status.value()).increment();
        timer("executions.duration", "workflowId", workflowId).record(Duration.ofMillis(durationMs));
    }

    @Override
    public void onStepSuccess(String workflowId, String executionId, String nodeId, int attempts, long latencyMs) {
        counter("steps.completed", "workflowId", workflowId, "nodeId", nodeId, "success", "true").increment();
        timer("steps.duration", "workflowId", workflowId, "nodeId", nodeId).record(Duration.ofMillis(latencyMs));
    }

    @Override
    public void onStepRetrying(String workflowId, String executionId, String nodeId, int attempt, String error) {
        counter("steps.retries", "workflowId", workflowId, "nodeId", nodeId).increment();
    }

    @Override
    public void onStepFailed(String workflowId, String executionId, String nodeId, String error, int attempts) {
        counter("steps.completed", "workflowId", workflowId, "nodeId", nodeId, "success", "false").increment();
    }

    @Override
    public void onStepSkipped(String workflowId, String executionId, String nodeId) {
        counter("steps.skipped", "workflowId", workflowId).increment();
    }

    @Override
    public void onExecutionWaiting(String workflowId, String executionId, String nodeId) {
        counter("executions.waiting", "workflowId", workflowId).increment();
    }

    @Override
    public void onWebhookTriggered(String workflowId, String path, String method) {
        counter("webhooks.triggered", "workflowId", workflowId, "method", method).increment();
    }

    private Counter counter(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }

    private Timer timer(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return timers.computeIfAbsent(key, k -> Timer.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }
}
