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

/**
 * Lifecycle callbacks emitted by the engine. All methods default to no-ops so
 * listeners override only what they need.
 */
public interface AutomationEvents {
    default void onExecutionStarted(String workflowId, String executionId) {}
    default void onStepStarted(String workflowId, String executionId, String nodeId, int attempt) {}
    default void onStepSuccess(String workflowId, String executionId, String nodeId, int attempts, long latencyMs) {}
    default void onStepRetrying(String workflowId, String executionId, String nodeId, int attempt, String error) {}
    default void onStepFailed(String workflowId, String executionId, String nodeId, String error, int attempts) {}
    default void onStepSkipped(String workflowId, String executionId, String nodeId) {}
    default void onBranchSelected(String workflowId, String executionId, String nodeId, String branch) {}
    default void onExecutionWaiting(String workflowId, String executionId, String nodeId) {}
    default void onExecutionResumed(String workflowId, String executionId) {}
    default void onExecutionCompleted(String workflowId, String executionId, ExecutionStatus status, long durationMs) {}
    default void onWebhookTriggered(String workflowId, String path, String method) {}
}
