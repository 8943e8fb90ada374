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

package org.fireflyframework.automation.unit.core;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.core.observability.AutomationEvents;
import org.fireflyframework.automation.core.observability.AutomationLoggerEvents;
import org.fireflyframework.automation.core.observability.AutomationMetrics;
import org.fireflyframework.automation.core.observability.CompositeAutomationEvents;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AutomationMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final AutomationMetrics metrics = new AutomationMetrics(registry);

    @Test
    void executionLifecycle_isCounted() {
        metrics.onExecutionStarted("wf", "e1");
        metrics.onExecutionStarted("wf", "e2");
        metrics.onExecutionCompleted("wf", "e1", ExecutionStatus.COMPLETED, 120);
        metrics.onExecutionCompleted("wf", "e2", ExecutionStatus.ERRORED, 80);

        assertThat(registry.get("firefly.automation.executions.started").tag("workflowId", "wf").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("firefly.automation.executions.completed").tag("status", "completed").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("firefly.automation.executions.completed").tag("status", "errored").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("firefly.automation.executions.duration").timer().count()).isEqualTo(2);
    }

    @Test
    void stepOutcomes_areTaggedBySuccess() {
        metrics.onStepSuccess("wf", "e1", "fetch", 1, 15);
        metrics.onStepRetrying("wf", "e1", "store", 1, "timeout");
        metrics.onStepFailed("wf", "e1", "store", "timeout", 2);
        metrics.onStepSkipped("wf", "e1", "audit");

        assertThat(registry.get("firefly.automation.steps.completed").tags("nodeId", "fetch", "success", "true")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("firefly.automation.steps.completed").tags("nodeId", "store", "success", "false")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("firefly.automation.steps.retries").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("firefly.automation.steps.skipped").counter().count()).isEqualTo(1.0);
    }

    @Test
    void webhookTriggers_areTaggedByMethod() {
        metrics.onWebhookTriggered("wf", "/orders", "POST");

        assertThat(registry.get("firefly.automation.webhooks.triggered").tag("method", "POST").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void composite_isolatesFailingDelegates() {
        List<String> seen = new ArrayList<>();
        AutomationEvents failing = new AutomationEvents() {
            @Override
            public void onExecutionStarted(String workflowId, String executionId) {
                throw new IllegalStateException("listener down");
            }
        };
        AutomationEvents recording = new AutomationEvents() {
            @Override
            public void onExecutionStarted(String workflowId, String executionId) {
                seen.add(executionId);
            }
        };
        CompositeAutomationEvents composite = new CompositeAutomationEvents(
                List.of(failing, new AutomationLoggerEvents(), metrics, recording));

        assertThatCode(() -> composite.onExecutionStarted("wf", "e1")).doesNotThrowAnyException();

        assertThat(seen).containsExactly("e1");
        assertThat(registry.get("firefly.automation.executions.started").counter().count()).isEqualTo(1.0);
        assertThat(composite.getDelegates()).hasSize(4);
    }
}
