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

import org.fireflyframework.automation.core.model.ExecutionStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Consumer;

@Slf4j
public class CompositeAutomationEvents implements AutomationEvents {
    private final List<AutomationEvents> delegates;

    public CompositeAutomationEvents(List<AutomationEvents> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    private void safeForEach(Consumer<AutomationEvents> action) {
        for (var d : delegates) {
            try { action.accept(d); }
            catch (Exception e) { log.warn("[composite-events] Delegate {} failed: {}", d.getClass().getSimpleName(), e.getMessage()); }
        }
    }

    public List<AutomationEvents> getDelegates() { return delegates; }

    @Override public void onExecutionStarted(String workflowId, String executionId) { safeForEach(d -> d.onExecutionStarted(workflowId, executionId)); }
    @Override public void onStepStarted(String workflowId, String executionId, String nodeId, int attempt) { safeForEach(d -> d.onStepStarted(workflowId, executionId, nodeId, attempt)); }
    @Override public void onStepSuccess(String workflowId, String executionId, String nodeId, int attempts, long latencyMs) { safeForEach(d -> d.onStepSuccess(workflowId, executionId, nodeId, attempts, latencyMs)); }
    @Override public void onStepRetrying(String workflowId, String executionId, String nodeId, int attempt, String error) { safeForEach(d -> d.onStepRetrying(workflowId, executionId, nodeId, attempt, error)); }
    @Override public void onStepFailed(String workflowId, String executionId, String nodeId, String error, int attempts) { safeForEach(d -> d.onStepFailed(workflowId, executionId, nodeId, error, attempts)); }
    @Override public void onStepSkipped(String workflowId, String executionId, String nodeId) { safeForEach(d -> d.onStepSkipped(workflowId, executionId, nodeId)); }
    @Override public void onBranchSelected(String workflowId, String executionId, String nodeId, String branch) { safeForEach(d -> d.onBranchSelected(workflowId, executionId, nodeId, branch)); }
    @Override public void onExecutionWaiting(String workflowId, String executionId, String nodeId) { safeForEach(d -> d.onExecutionWaiting(workflowId, executionId, nodeId)); }
    @Override public void onExecutionResumed(String workflowId, String executionId) { safeForEach(d -> d.onExecutionResumed(workflowId, executionId)); }
    @Override public void onExecutionCompleted(String workflowId, String executionId, ExecutionStatus status, long durationMs) { safeForEach(d -> d.onExecutionCompleted(workflowId, executionId, status, durationMs)); }
    @Override public void onWebhookTriggered(String workflowId, String path, String method) { safeForEach(d -> d.onWebhookTriggered(workflowId, path, method)); }
}
