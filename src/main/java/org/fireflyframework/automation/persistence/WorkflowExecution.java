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

package org.fireflyframework.automation.persistence;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.core.model.TriggerType;
import org.fireflyframework.automation.graph.WorkflowDefinition;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Persisted state of one workflow run.
 *
 * <p>Everything the scheduler needs to continue a run lives here: the definition
 * snapshot, per-node results and the completion order. Every write goes through
 * {@link ExecutionPersistenceProvider#update}, which bumps {@code revision}.
 */
public record WorkflowExecution(
        String id,
        String workflowId,
        WorkflowDefinition definition,
        String instanceId,
        ExecutionStatus status,
        TriggerType triggerType,
        Object triggerPayload,
        String entryNodeId,
        String currentStep,
        List<String> completedSteps,
        Map<String, NodeResult> results,
        String error,
        boolean pauseRequested,
        long revision,
        Instant startedAt,
        Instant updatedAt,
        Instant completedAt,
        Long durationMs
) {
    public WorkflowExecution {
        completedSteps = completedSteps != null ? List.copyOf(completedSteps) : List.of();
        results = results != null ? Collections.unmodifiableMap(new LinkedHashMap<>(results)) : Map.of();
        triggerType = triggerType != null ? triggerType : TriggerType.MANUAL;
    }

    public static WorkflowExecution queued(WorkflowDefinition definition, TriggerType triggerType,
                                           Object payload, String instanceId, String entryNodeId) {
        Instant now = Instant.now();
        return new WorkflowExecution(UUID.randomUUID().toString(), definition.id(), definition, instanceId,
                ExecutionStatus.QUEUED, triggerType, payload, entryNodeId, null, List.of(), Map.of(),
                null, false, 0, now, now, null, null);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public WorkflowExecution withStatus(ExecutionStatus newStatus) {
        return new WorkflowExecution(id, workflowId, definition, instanceId, newStatus, triggerType, triggerPayload,
                entryNodeId, currentStep, completedSteps, results, error, pauseRequested, revision,
                startedAt, updatedAt, completedAt, durationMs);
    }

    public WorkflowExecution withCurrentStep(String step) {
        return new WorkflowExecution(id, workflowId, definition, instanceId, status, triggerType, triggerPayload,
                entryNodeId, step, completedSteps, results, error, pauseRequested, revision,
                startedAt, updatedAt, completedAt, durationMs);
    }

    public WorkflowExecution withPauseRequested(boolean value) {
        return new WorkflowExecution(id, workflowId, definition, instanceId, status, triggerType, triggerPayload,
                entryNodeId, currentStep, completedSteps, results, error, value, revision,
                startedAt, updatedAt, completedAt, durationMs);
    }

    /** Records a node's result and appends it to the completion order. */
    public WorkflowExecution withCompletedNode(String nodeId, NodeResult result) {
        Map<String, NodeResult> newResults = new LinkedHashMap<>(results);
        newResults.put(nodeId, result);
        List<String> newCompleted = new ArrayList<>(completedSteps);
        if (!newCompleted.contains(nodeId)) {
            newCompleted.add(nodeId);
        }
        return new WorkflowExecution(id, workflowId, definition, instanceId, status, triggerType, triggerPayload,
                entryNodeId, currentStep, newCompleted, newResults, error, pauseRequested, revision,
                startedAt, updatedAt, completedAt, durationMs);
    }

    /** Moves to a terminal status, stamping completion time and duration. */
    public WorkflowExecution finish(ExecutionStatus terminal, String errorMessage, Instant now) {
        long duration = startedAt != null ? Duration.between(startedAt, now).toMillis() : 0L;
        return new WorkflowExecution(id, workflowId, definition, instanceId, terminal, triggerType, triggerPayload,
                entryNodeId, currentStep, completedSteps, results, errorMessage, false, revision,
                startedAt, updatedAt, now, duration);
    }

    public WorkflowExecution withRevision(long newRevision, Instant now) {
        return new WorkflowExecution(id, workflowId, definition, instanceId, status, triggerType, triggerPayload,
                entryNodeId, currentStep, completedSteps, results, error, pauseRequested, newRevision,
                startedAt, now, completedAt, durationMs);
    }
}
