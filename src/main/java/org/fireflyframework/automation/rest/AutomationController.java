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

package org.fireflyframework.automation.rest;

import org.fireflyframework.automation.compiler.WorkflowCompiler;
import org.fireflyframework.automation.compiler.editor.EditorGraph;
import org.fireflyframework.automation.compiler.editor.EditorGraphMapper;
import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.core.model.TriggerType;
import org.fireflyframework.automation.core.validation.ValidationIssue;
import org.fireflyframework.automation.core.validation.ValidationResult;
import org.fireflyframework.automation.engine.ExecuteRequest;
import org.fireflyframework.automation.engine.ExecutionView;
import org.fireflyframework.automation.engine.WorkflowEngine;
import org.fireflyframework.automation.graph.WorkflowDefinition;
import org.fireflyframework.automation.persistence.StepLog;
import org.fireflyframework.automation.persistence.WorkflowExecution;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * REST API for workflow definitions and execution control.
 */
@RestController
@RequestMapping("/api/automation")
public class AutomationController {

    private final WorkflowEngine engine;
    private final WorkflowCompiler compiler;
    private final EditorGraphMapper editorMapper;

    public AutomationController(WorkflowEngine engine, WorkflowCompiler compiler, EditorGraphMapper editorMapper) {
        this.engine = engine;
        this.compiler = compiler;
        this.editorMapper = editorMapper;
    }

    // ── Definition Endpoints ──────────────────────────────────────

    @PostMapping("/workflows")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<WorkflowDefinition> saveWorkflow(@RequestBody WorkflowDefinition definition) {
        return engine.saveWorkflow(definition);
    }

    @PostMapping("/workflows/validate")
    public Mono<ValidationResponse> validate(@RequestBody WorkflowDefinition definition) {
        return engine.validate(definition).map(ValidationResponse::from);
    }

    @PostMapping("/workflows/editor")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<WorkflowDefinition> saveEditorGraph(@RequestParam(required = false) String workflowId,
                                                    @RequestParam(required = false) String owner,
                                                    @RequestBody EditorGraph graph) {
        return Mono.fromCallable(() -> editorMapper.toDefinition(graph, workflowId, owner))
                .flatMap(engine::saveWorkflow);
    }

    @GetMapping("/workflows")
    public Flux<WorkflowSummary> listWorkflows(@RequestParam(required = false) String owner) {
        return engine.listWorkflows(owner).map(WorkflowSummary::from);
    }

    @GetMapping("/workflows/{workflowId}")
    public Mono<WorkflowDefinition> getWorkflow(@PathVariable String workflowId) {
        return engine.getWorkflow(workflowId);
    }

    @GetMapping("/workflows/{workflowId}/editor")
    public Mono<EditorGraph> getEditorGraph(@PathVariable String workflowId) {
        return engine.getWorkflow(workflowId)
                .map(def -> editorMapper.fromPlan(compiler.compileOrThrow(def), def.name(), def.description()));
    }

    @DeleteMapping("/workflows/{workflowId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteWorkflow(@PathVariable String workflowId) {
        return engine.deleteWorkflow(workflowId);
    }

    // ── Execution Endpoints ───────────────────────────────────────

    @PostMapping("/workflows/{workflowId}/execute")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<ExecutionSummary> execute(@PathVariable String workflowId,
                                          @RequestBody(required = false) ExecuteRequestDto request) {
        ExecuteRequestDto req = request != null ? request : new ExecuteRequestDto(null, null, null, null);
        return engine.execute(workflowId, req.toRequest()).map(ExecutionSummary::from);
    }

    @GetMapping("/workflows/{workflowId}/executions")
    public Flux<ExecutionSummary> listExecutions(@PathVariable String workflowId) {
        return engine.listExecutions(workflowId).map(ExecutionSummary::from);
    }

    @GetMapping("/executions/{executionId}")
    public Mono<WorkflowExecution> getExecution(@PathVariable String executionId) {
        return engine.getExecution(executionId);
    }

    @GetMapping("/executions/{executionId}/steps")
    public Flux<StepLog> getStepLogs(@PathVariable String executionId) {
        return engine.getStepLogs(executionId);
    }

    @GetMapping("/executions/{executionId}/view")
    public Mono<ExecutionView> getExecutionView(@PathVariable String executionId) {
        return engine.getExecutionView(executionId);
    }

    // ── Control Endpoints ─────────────────────────────────────────

    @PostMapping("/executions/{executionId}/pause")
    public Mono<ExecutionSummary> pause(@PathVariable String executionId) {
        return engine.pause(executionId).map(ExecutionSummary::from);
    }

    @PostMapping("/executions/{executionId}/resume")
    public Mono<ExecutionSummary> resume(@PathVariable String executionId,
                                         @RequestBody(required = false) ResumeRequest request) {
        return engine.resume(executionId, request != null ? request.payload() : null).map(ExecutionSummary::from);
    }

    @PostMapping("/executions/{executionId}/terminate")
    public Mono<ExecutionSummary> terminate(@PathVariable String executionId) {
        return engine.terminate(executionId).map(ExecutionSummary::from);
    }

    // ── DTOs ──────────────────────────────────────────────────────

    public record ExecuteRequestDto(TriggerType triggerType, Object payload, String instanceId, String entryNodeId) {
        ExecuteRequest toRequest() {
            return new ExecuteRequest(triggerType, payload, instanceId, entryNodeId);
        }
    }

    public record ResumeRequest(Object payload) {}

    public record ValidationResponse(boolean valid, List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        static ValidationResponse from(ValidationResult result) {
            return new ValidationResponse(result.valid(), result.errors(), result.warnings());
        }
    }

    public record WorkflowSummary(String id, String owner, String name, boolean active, int version,
                                  int nodeCount, Instant updatedAt) {
        static WorkflowSummary from(WorkflowDefinition d) {
            return new WorkflowSummary(d.id(), d.owner(), d.name(), d.active(), d.version(),
                    d.nodes().size(), d.updatedAt());
        }
    }

    public record ExecutionSummary(String id, String workflowId, ExecutionStatus status, TriggerType triggerType,
                                   String currentStep, String error, Instant startedAt, Instant completedAt,
                                   Long durationMs) {
        static ExecutionSummary from(WorkflowExecution e) {
            return new ExecutionSummary(e.id(), e.workflowId(), e.status(), e.triggerType(), e.currentStep(),
                    e.error(), e.startedAt(), e.completedAt(), e.durationMs());
        }
    }
}
