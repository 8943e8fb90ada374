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

package org.fireflyframework.automation.engine;

import org.fireflyframework.automation.compiler.CompilationResult;
import org.fireflyframework.automation.compiler.ExecutionPlan;
import org.fireflyframework.automation.compiler.WorkflowCompiler;
import org.fireflyframework.automation.core.exception.ExecutionControlException;
import org.fireflyframework.automation.core.exception.ExecutionNotFoundException;
import org.fireflyframework.automation.core.exception.WorkflowNotFoundException;
import org.fireflyframework.automation.core.exception.WorkflowValidationException;
import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.core.model.StepStatus;
import org.fireflyframework.automation.core.observability.AutomationEvents;
import org.fireflyframework.automation.core.validation.ValidationIssue;
import org.fireflyframework.automation.core.validation.ValidationResult;
import org.fireflyframework.automation.graph.WorkflowDefinition;
import org.fireflyframework.automation.persistence.ExecutionPersistenceProvider;
import org.fireflyframework.automation.persistence.ExecutionSerializer;
import org.fireflyframework.automation.persistence.NodeResult;
import org.fireflyframework.automation.persistence.StepLog;
import org.fireflyframework.automation.persistence.WorkflowExecution;
import org.fireflyframework.automation.persistence.WorkflowStore;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Transport-agnostic control surface of the automation engine.
 *
 * <p>{@link #execute} returns as soon as the execution is persisted; the scheduler
 * continues in the background. Pause, resume and terminate go through the
 * persistence provider's atomic update, so concurrent commands on one execution
 * are serialized and invalid ones fail with {@link ExecutionControlException}
 * without side effects.
 */
@Slf4j
public class WorkflowEngine {

    private final WorkflowStore workflowStore;
    private final ExecutionPersistenceProvider persistence;
    private final WorkflowCompiler compiler;
    private final ExecutionScheduler scheduler;
    private final ExecutionInspector inspector;
    private final ExecutionSerializer serializer;
    private final AutomationEvents events;

    public WorkflowEngine(WorkflowStore workflowStore, ExecutionPersistenceProvider persistence,
                          WorkflowCompiler compiler, ExecutionScheduler scheduler,
                          ExecutionInspector inspector, ExecutionSerializer serializer,
                          AutomationEvents events) {
        this.workflowStore = workflowStore;
        this.persistence = persistence;
        this.compiler = compiler;
        this.scheduler = scheduler;
        this.inspector = inspector;
        this.serializer = serializer;
        this.events = events;
    }

    // ── Definitions ───────────────────────────────────────────────

    public Mono<ValidationResult> validate(WorkflowDefinition definition) {
        return Mono.fromCallable(() -> compiler.validate(definition));
    }

    /**
     * Validates and stores a definition. Updating an existing id bumps its version;
     * running executions keep the snapshot they started with.
     */
    public Mono<WorkflowDefinition> saveWorkflow(WorkflowDefinition definition) {
        return validate(definition)
                .flatMap(result -> result.valid()
                        ? workflowStore.save(definition)
                        : Mono.error(new WorkflowValidationException(definition.id(), result.errors())))
                .doOnNext(saved -> log.info("[automation] workflow saved workflowId={} version={}",
                        saved.id(), saved.version()));
    }

    public Mono<WorkflowDefinition> getWorkflow(String workflowId) {
        return workflowStore.findById(workflowId)
                .flatMap(opt -> opt.map(Mono::just)
                        .orElseGet(() -> Mono.error(new WorkflowNotFoundException(workflowId))));
    }

    public Flux<WorkflowDefinition> listWorkflows(String owner) {
        return owner != null ? workflowStore.findByOwner(owner) : workflowStore.findAll();
    }

    public Mono<Void> deleteWorkflow(String workflowId) {
        return workflowStore.delete(workflowId)
                .flatMap(existed -> existed
                        ? Mono.<Void>empty()
                        : Mono.error(new WorkflowNotFoundException(workflowId)));
    }

    // ── Execution ─────────────────────────────────────────────────

    /**
     * Starts an execution of the stored workflow and returns it in {@code queued}
     * state. A repeated {@code instanceId} returns the execution created first.
     */
    public Mono<WorkflowExecution> execute(String workflowId, ExecuteRequest request) {
        ExecuteRequest req = request != null ? request : ExecuteRequest.manual(Map.of());
        return getWorkflow(workflowId)
                .flatMap(definition -> {
                    CompilationResult compiled = compiler.compile(definition);
                    if (!compiled.isSuccess()) {
                        return Mono.error(new WorkflowValidationException(workflowId, compiled.validation().errors()));
                    }
                    if (req.entryNodeId() != null && !isTrigger(compiled.plan(), req.entryNodeId())) {
                        return Mono.error(new WorkflowValidationException(workflowId, List.of(ValidationIssue.error(
                                "Entry node '" + req.entryNodeId() + "' is not a trigger of this workflow",
                                req.entryNodeId()))));
                    }
                    Mono<WorkflowExecution> existing = req.instanceId() == null ? Mono.empty()
                            : persistence.findByInstanceId(workflowId, req.instanceId())
                                    .flatMap(opt -> opt.map(Mono::just).orElseGet(Mono::empty));
                    return existing
                            .doOnNext(e -> log.info("[automation] instance {} already executed as {}",
                                    req.instanceId(), e.id()))
                            .switchIfEmpty(Mono.defer(() -> create(definition, req)));
                });
    }

    private Mono<WorkflowExecution> create(WorkflowDefinition definition, ExecuteRequest req) {
        WorkflowExecution queued = WorkflowExecution.queued(definition, req.triggerType(),
                serializer.normalize(req.payload()), req.instanceId(), req.entryNodeId());
        return persistence.create(queued)
                .doOnNext(created -> {
                    if (created.id().equals(queued.id())) {
                        events.onExecutionStarted(created.workflowId(), created.id());
                        startInBackground(created.id());
                    }
                });
    }

    private void startInBackground(String executionId) {
        scheduler.run(executionId)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        e -> log.debug("[automation] execution {} suspended at status {}", executionId, e.status()),
                        err -> log.error("[automation] execution {} failed in background: {}",
                                executionId, err.getMessage(), err));
    }

    public Mono<WorkflowExecution> getExecution(String executionId) {
        return persistence.findById(executionId)
                .flatMap(opt -> opt.map(Mono::just)
                        .orElseGet(() -> Mono.error(new ExecutionNotFoundException(executionId))));
    }

    public Flux<StepLog> getStepLogs(String executionId) {
        return getExecution(executionId).flatMapMany(e -> persistence.findStepLogs(executionId));
    }

    public Flux<WorkflowExecution> listExecutions(String workflowId) {
        return persistence.findByWorkflowId(workflowId);
    }

    public Mono<ExecutionView> getExecutionView(String executionId) {
        return getExecution(executionId)
                .flatMap(execution -> persistence.findStepLogs(executionId).collectList()
                        .map(logs -> inspector.view(compiler.compileOrThrow(execution.definition()), execution, logs)));
    }

    // ── Control ───────────────────────────────────────────────────

    /**
     * Requests a pause. The scheduler moves the execution to {@code waiting} at the
     * next step boundary.
     */
    public Mono<WorkflowExecution> pause(String executionId) {
        return persistence.update(executionId, e -> {
                    if (!e.status().canPause()) {
                        throw new ExecutionControlException(executionId, e.status(), "pause");
                    }
                    return e.pauseRequested() ? e : e.withPauseRequested(true);
                })
                .doOnNext(e -> log.info("[automation] pause requested executionId={}", executionId));
    }

    /**
     * Resumes a waiting execution. Wait nodes the execution is parked on complete with
     * {@code payload} as their output, then traversal continues with their successors.
     */
    public Mono<WorkflowExecution> resume(String executionId, Object payload) {
        Object output = payload != null ? serializer.normalize(payload) : Map.of("resumed", true);
        return persistence.update(executionId, e -> {
                    if (!e.status().canResume()) {
                        throw new ExecutionControlException(executionId, e.status(), "resume");
                    }
                    return e.withStatus(ExecutionStatus.RUNNING).withPauseRequested(false);
                })
                .flatMap(resumed -> persistence.findStepLogs(executionId)
                        .filter(l -> l.status() == StepStatus.WAITING && !resumed.results().containsKey(l.nodeId()))
                        .concatMap(l -> completeWaitNode(executionId, l, output))
                        .then(getExecution(executionId)))
                .doOnNext(e -> {
                    events.onExecutionResumed(e.workflowId(), executionId);
                    startInBackground(executionId);
                });
    }

    private Mono<WorkflowExecution> completeWaitNode(String executionId, StepLog waitLog, Object output) {
        Instant now = Instant.now();
        long duration = waitLog.startedAt() != null ? Duration.between(waitLog.startedAt(), now).toMillis() : 0L;
        NodeResult result = new NodeResult(output, null, waitLog.attemptNumber(), duration, false);
        return persistence.updateStepLog(executionId, waitLog.sequence(), l -> l.succeeded(output, now))
                .then(persistence.update(executionId, e -> e.status() == ExecutionStatus.RUNNING
                        ? e.withCompletedNode(waitLog.nodeId(), result) : e));
    }

    /**
     * Cancels a running or waiting execution. Terminating an execution that is already
     * terminal returns it unchanged. A node invocation in flight is not interrupted;
     * its result is discarded.
     */
    public Mono<WorkflowExecution> terminate(String executionId) {
        AtomicReference<ExecutionStatus> previous = new AtomicReference<>();
        return persistence.update(executionId, e -> {
                    previous.set(e.status());
                    if (e.isTerminal()) {
                        return e;
                    }
                    if (!e.status().canTerminate()) {
                        throw new ExecutionControlException(executionId, e.status(), "terminate");
                    }
                    return e.finish(ExecutionStatus.CANCELLED, null, Instant.now());
                })
                .flatMap(e -> {
                    if (previous.get() != null && previous.get().isTerminal()) {
                        return Mono.just(e);
                    }
                    Instant now = Instant.now();
                    return persistence.findStepLogs(executionId)
                            .filter(l -> l.status() != null && l.status().isActive())
                            .concatMap(l -> persistence.updateStepLog(executionId, l.sequence(),
                                    row -> row.status().isActive() ? row.failed(StepStatus.ERROR, StepLog.CANCELLED_MESSAGE, now) : row))
                            .then(Mono.fromSupplier(() -> {
                                events.onExecutionCompleted(e.workflowId(), executionId, ExecutionStatus.CANCELLED,
                                        e.durationMs() != null ? e.durationMs() : 0L);
                                return e;
                            }));
                });
    }

    private static boolean isTrigger(ExecutionPlan plan, String nodeId) {
        return plan.findNode(nodeId).map(n -> n.isTrigger()).orElse(false);
    }
}
