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

@Slf4j
public class AutomationLoggerEvents implements AutomationEvents {
    @Override
    public void onExecutionStarted(String workflowId, String executionId) {
        log.info("[automation] started workflowId={} executionId={}", workflowId, executionId);
    }
    @Override
    public void onStepStarted(String workflowId, String executionId, String nodeId, int attempt) {
        log.info("[automation] step.started workflowId={} executionId={} nodeId={} attempt={}", workflowId, executionId, nodeId, attempt);
    }
    @Override
    public void onStepSuccess(String workflowId, String executionId, String nodeId, int attempts, long latencyMs) {
        log.info("[automation] step.success workflowId={} executionId={} nodeId={} attempts={} latencyMs={}", workflowId, executionId, nodeId, attempts, latencyMs);
    }
    @Override
    public void onStepRetrying(String workflowId, String executionId, String nodeId, int attempt, String error) {
        log.warn("[automation] step.retrying workflowId={} executionId={} nodeId={} attempt={} error={}", workflowId, executionId, nodeId, attempt, error);
    }
    @Override
    public void onStepFailed(String workflowId, String executionId, String nodeId, String error, int attempts) {
        log.warn("[automation] step.failed workflowId={} executionId={} nodeId={} attempts={} error={}", workflowId, executionId, nodeId, attempts, error);
    }
    @Override
    public void onStepSkipped(String workflowId, String executionId, String nodeId) {
        log.info("[automation] step.skipped workflowId={} executionId={} nodeId={}", workflowId, executionId, nodeId);
    }
    @Override
    public void onBranchSelected(String workflowId, String executionId, String nodeId, String branch) {
        log.info("[automation] branch.selected workflowId={} executionId={} nodeId={} branch={}", workflowId, executionId, nodeId, branch);
    }
    @Override
    public void onExecutionWaiting(String workflowId, String executionId, String nodeId) {
        log.info("[automation] waiting workflowId={} executionId={} currentStep={}", workflowId, executionId, nodeId);
    }
    @Override
    public void onExecutionResumed(String workflowId, String executionId) {
        log.info("[automation] resumed workflowId={} executionId={}", workflowId, executionId);
    }
    @Override
    public void onExecutionCompleted(String workflowId, String executionId, ExecutionStatus status, long durationMs) {
        log.info("[automation] completed workflowId={} executionId={} status={} durationMs={}", workflowId, executionId, status, durationMs);
    }
    @Override
    public void onWebhookTriggered(String workflowId, String path, String method) {
        log.info("[webhook] triggered workflowId={} path={} method={}", workflowId, path, method);
    }
}
