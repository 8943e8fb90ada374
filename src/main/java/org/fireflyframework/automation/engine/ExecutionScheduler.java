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

import org.fireflyframework.automation.compiler.ExecutionPlan;
import org.fireflyframework.automation.compiler.WorkflowCompiler;
import org.fireflyframework.automation.core.exception.ExecutionNotFoundException;
import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.core.model.StepStatus;
import org.fireflyframework.automation.core.observability.AutomationEvents;
import org.fireflyframework.automation.graph.NodeDefinition;
import org.fireflyframework.automation.persistence.ExecutionPersistenceProvider;
import org.fireflyframework.automation.persistence.NodeResult;
import org.fireflyframework.automation.persistence.StepLog;
import org.fireflyframework.automation.persistence.WorkflowExecution;
import org.fireflyframework.automation.step.NodeInput;
import org.fireflyframework.automation.step.ParameterInterpolator;
import org.fireflyframework.automation.step.StepOutcome;
import org.fireflyframework.automation.step.StepRunner;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one execution forward until it suspends or reaches a terminal status.
 *
 * <p>The scheduler keeps no state between calls: every wave is computed from the
 * persisted execution and step logs, so {@link #run} can be invoked again after a
 * resume or a process restart. Nodes of the same wave run concurrently; pause and
 * terminate are observed between waves.
 */
@Slf4j
public class ExecutionScheduler {

    private final ExecutionPersistenceProvider persistence;
    private final WorkflowCompiler compiler;
    private final StepRunner stepRunner;
    private final ParameterInterpolator interpolator;
    private final AutomationEvents events;
    private final int maxConcurrency;

    public ExecutionScheduler(ExecutionPersistenceProvider persistence, WorkflowCompiler compiler,
                              StepRunner stepRunner, ParameterInterpolator interpolator,
                              AutomationEvents events, int maxConcurrency) {
        this.persistence = persistence;
        this.compiler = compiler;
        this.stepRunner = stepRunner;
        this.interpolator = interpolator;
        this.events = events;
        this.maxConcurrency = maxConcurrency;
    }

    /**
     * Runs the execution until it is waiting or terminal and emits its state at that point.
     * A queued execution is moved to running first; any other non-running status is
     * returned as-is.
     */
    public Mono<WorkflowExecution> run(String executionId) {
        AtomicBoolean started = new AtomicBoolean();
        return persistence.update(executionId, e -> {
                    if (e.status() == ExecutionStatus.QUEUED) {
                        started.set(true);
                        return e.withStatus(ExecutionStatus.RUNNING);
                    }
                    return e;
                })
                .flatMap(execution -> {
                    if (execution.status() != ExecutionStatus.RUNNING) {
                        return Mono.just(execution);
                    }
                    if (started.get()) {
                        log.debug("[scheduler] execution {} moved to running", executionId);
                    }
                    ExecutionPlan plan = compiler.compileOrThrow(execution.definition());
                    return loop(plan, executionId);
                })
                .onErrorResume(e -> failUnexpectedly(executionId, e));
    }

    private Mono<WorkflowExecution> loop(ExecutionPlan plan, String executionId) {
        return Mono.defer(() -> Mono.zip(
                        load(executionId),
                        persistence.findStepLogs(executionId).collectList()))
                .flatMap(tuple -> {
                    WorkflowExecution execution = tuple.getT1();
                    List<StepLog> logs = tuple.getT2();
                    if (execution.status() != ExecutionStatus.RUNNING) {
                        return Mono.just(execution);
                    }
                    TraversalState state = TraversalState.of(plan, execution, waitingNodes(plan, execution, logs));
                    List<String> ready = state.ready();

                    if (ready.isEmpty()) {
                        if (!state.waiting().isEmpty()) {
                            return suspend(execution.workflowId(), executionId, state.waiting().get(0));
                        }
                        return complete(plan, execution, logs);
                    }
                    if (execution.pauseRequested()) {
                        return pause(execution);
                    }
                    return runWave(plan, execution, ready)
                            .flatMap(wave -> afterWave(plan, execution, wave));
                });
    }

    private Mono<List<NodeProgress>> runWave(ExecutionPlan plan, WorkflowExecution execution, List<String> ready) {
        NodeInputContext context = NodeInputContext.of(execution);
        int concurrency = maxConcurrency > 0 ? maxConcurrency : Math.max(1, ready.size());
        log.debug("[scheduler] wave executionId={} nodes={}", execution.id(), ready);
        return Flux.fromIterable(ready)
                .flatMapSequential(id -> processNode(plan, execution, plan.node(id), context)
                        .subscribeOn(Schedulers.boundedElastic()), concurrency)
                .collectList();
    }

    private Mono<WorkflowExecution> afterWave(ExecutionPlan plan, WorkflowExecution execution, List<NodeProgress> wave) {
        String executionId = execution.id();
        Optional<NodeProgress> failure = wave.stream().filter(p -> p.kind() == NodeProgress.Kind.FAILED).findFirst();
        if (failure.isPresent()) {
            String error = failure.get().error();
            return persistence.update(executionId, e -> e.status() == ExecutionStatus.RUNNING
                            ? e.finish(ExecutionStatus.ERRORED, error, Instant.now()) : e)
                    .doOnNext(e -> {
                        if (e.status() == ExecutionStatus.ERRORED) {
                            events.onExecutionCompleted(e.workflowId(), executionId, ExecutionStatus.ERRORED,
                                    e.durationMs() != null ? e.durationMs() : 0L);
                        }
                    });
        }
        if (wave.stream().anyMatch(p -> p.kind() == NodeProgress.Kind.STOPPED)) {
            return load(executionId);
        }
        Optional<NodeProgress> waiting = wave.stream().filter(p -> p.kind() == NodeProgress.Kind.WAITING).findFirst();
        if (waiting.isPresent()) {
            return suspend(execution.workflowId(), executionId, waiting.get().nodeId());
        }
        return loop(plan, executionId);
    }

    private Mono<NodeProgress> processNode(ExecutionPlan plan, WorkflowExecution execution,
                                           NodeDefinition node, NodeInputContext context) {
        if (node.disabled()) {
            return skipDisabled(execution, node);
        }
        if (node.isWait()) {
            return enterWait(execution, node, context);
        }
        String executionId = execution.id();
        Map<String, Object> parameters = interpolator.interpolate(node.parameters(), context.asMap());
        NodeInput input = new NodeInput(parameters, context.trigger(), context.steps());

        return persistence.update(executionId, e -> e.status() == ExecutionStatus.RUNNING ? e.withCurrentStep(node.id()) : e)
                .flatMap(current -> {
                    if (current.status() != ExecutionStatus.RUNNING) {
                        return Mono.just(NodeProgress.stopped(node.id()));
                    }
                    return stepRunner.run(execution.workflowId(), executionId, node, input, () -> isCancelled(executionId))
                            .flatMap(outcome -> recordOutcome(plan, execution, node, outcome));
                });
    }

    private Mono<NodeProgress> recordOutcome(ExecutionPlan plan, WorkflowExecution execution,
                                             NodeDefinition node, StepOutcome outcome) {
        switch (outcome.kind()) {
            case FAILED:
                return Mono.just(NodeProgress.failed(node.id(), outcome.error()));
            case CANCELLED:
                return Mono.just(NodeProgress.stopped(node.id()));
            default:
                break;
        }
        NodeResult result = new NodeResult(outcome.output(), outcome.branch(), outcome.attempts(),
                outcome.durationMs(), false);
        return persistence.update(execution.id(), e -> e.status() == ExecutionStatus.RUNNING
                        ? e.withCompletedNode(node.id(), result) : e)
                .flatMap(updated -> {
                    if (updated.status() != ExecutionStatus.RUNNING) {
                        log.info("[scheduler] execution {} is {}, discarding result of node {}",
                                execution.id(), updated.status(), node.id());
                        return closeDiscardedAttempt(execution.id(), node.id(), outcome.attempts())
                                .thenReturn(NodeProgress.stopped(node.id()));
                    }
                    if (node.isConditional()) {
                        events.onBranchSelected(execution.workflowId(), execution.id(), node.id(), outcome.branch());
                        if (plan.outgoing(node.id(), outcome.branch()).isEmpty()) {
                            log.warn("[scheduler] node {} selected branch '{}' which has no connections",
                                    node.id(), outcome.branch());
                        }
                    }
                    return Mono.just(NodeProgress.done(node.id()));
                });
    }

    /** The row of a result that lost the race with terminate must not read as a success. */
    private Mono<Void> closeDiscardedAttempt(String executionId, String nodeId, int attempt) {
        return persistence.findStepLogs(executionId)
                .filter(l -> nodeId.equals(l.nodeId()) && l.attemptNumber() == attempt && l.status() == StepStatus.SUCCESS)
                .concatMap(l -> persistence.updateStepLog(executionId, l.sequence(),
                        row -> row.status() == StepStatus.SUCCESS
                                ? row.failed(StepStatus.ERROR, StepLog.CANCELLED_MESSAGE, Instant.now())
                                : row))
                .then();
    }

    private Mono<NodeProgress> skipDisabled(WorkflowExecution execution, NodeDefinition node) {
        NodeResult skipped = NodeResult.skippedResult();
        Instant now = Instant.now();
        StepLog row = new StepLog(null, execution.id(), node.id(), node.name(), StepStatus.SKIPPED, 0, 0,
                node.parameters(), skipped.output(), null, now, now, 0L);
        return persistence.update(execution.id(), e -> e.status() == ExecutionStatus.RUNNING
                        ? e.withCompletedNode(node.id(), skipped) : e)
                .flatMap(updated -> {
                    if (updated.status() != ExecutionStatus.RUNNING) {
                        return Mono.just(NodeProgress.stopped(node.id()));
                    }
                    events.onStepSkipped(execution.workflowId(), execution.id(), node.id());
                    return persistence.appendStepLog(row).thenReturn(NodeProgress.done(node.id()));
                });
    }

    private Mono<NodeProgress> enterWait(WorkflowExecution execution, NodeDefinition node, NodeInputContext context) {
        Map<String, Object> parameters = interpolator.interpolate(node.parameters(), context.asMap());
        StepLog row = StepLog.started(execution.id(), node.id(), node.name(), StepStatus.WAITING, 1, parameters);
        return persistence.update(execution.id(), e -> e.status() == ExecutionStatus.RUNNING ? e.withCurrentStep(node.id()) : e)
                .flatMap(updated -> {
                    if (updated.status() != ExecutionStatus.RUNNING) {
                        return Mono.just(NodeProgress.stopped(node.id()));
                    }
                    return persistence.appendStepLog(row).thenReturn(NodeProgress.waiting(node.id()));
                });
    }

    private Mono<WorkflowExecution> suspend(String workflowId, String executionId, String waitNodeId) {
        return persistence.update(executionId, e -> e.status() == ExecutionStatus.RUNNING
                        ? e.withStatus(ExecutionStatus.WAITING).withCurrentStep(waitNodeId).withPauseRequested(false)
                        : e)
                .doOnNext(e -> {
                    if (e.status() == ExecutionStatus.WAITING) {
                        events.onExecutionWaiting(workflowId, executionId, waitNodeId);
                    }
                });
    }

    private Mono<WorkflowExecution> pause(WorkflowExecution execution) {
        List<String> completed = execution.completedSteps();
        String lastCompleted = completed.isEmpty() ? execution.currentStep() : completed.get(completed.size() - 1);
        return persistence.update(execution.id(), e -> e.status() == ExecutionStatus.RUNNING && e.pauseRequested()
                        ? e.withStatus(ExecutionStatus.WAITING).withCurrentStep(lastCompleted).withPauseRequested(false)
                        : e)
                .doOnNext(e -> {
                    if (e.status() == ExecutionStatus.WAITING) {
                        log.info("[scheduler] execution {} paused after {}", e.id(), lastCompleted);
                        events.onExecutionWaiting(e.workflowId(), e.id(), lastCompleted);
                    }
                });
    }

    /**
     * Marks the execution completed and writes a {@code skipped} row for every node
     * that never ran, so the audit trail covers the whole graph.
     */
    private Mono<WorkflowExecution> complete(ExecutionPlan plan, WorkflowExecution execution, List<StepLog> logs) {
        Set<String> logged = new HashSet<>();
        logs.forEach(l -> logged.add(l.nodeId()));
        Instant now = Instant.now();
        List<StepLog> skippedRows = plan.topologicalOrder().stream()
                .filter(id -> !execution.results().containsKey(id) && !logged.contains(id))
                .map(id -> new StepLog(null, execution.id(), id, plan.node(id).name(), StepStatus.SKIPPED, 0, 0,
                        null, null, null, now, now, 0L))
                .toList();

        return persistence.update(execution.id(), e -> e.status() == ExecutionStatus.RUNNING
                        ? e.finish(ExecutionStatus.COMPLETED, null, Instant.now()) : e)
                .flatMap(e -> {
                    if (e.status() != ExecutionStatus.COMPLETED) {
                        return Mono.just(e);
                    }
                    return Flux.fromIterable(skippedRows)
                            .concatMap(persistence::appendStepLog)
                            .then(Mono.fromSupplier(() -> {
                                events.onExecutionCompleted(e.workflowId(), e.id(), ExecutionStatus.COMPLETED,
                                        e.durationMs() != null ? e.durationMs() : 0L);
                                return e;
                            }));
                });
    }

    private Mono<WorkflowExecution> failUnexpectedly(String executionId, Throwable error) {
        log.error("[scheduler] execution {} aborted: {}", executionId, error.getMessage(), error);
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return persistence.update(executionId, e -> e.status() == ExecutionStatus.RUNNING || e.status() == ExecutionStatus.QUEUED
                        ? e.finish(ExecutionStatus.ERRORED, message, Instant.now()) : e)
                .onErrorResume(e -> {
                    log.error("[scheduler] could not record failure of execution {}: {}", executionId, e.getMessage());
                    return Mono.error(error);
                });
    }

    private Mono<Boolean> isCancelled(String executionId) {
        return persistence.findById(executionId)
                .map(opt -> opt.map(e -> e.status() == ExecutionStatus.CANCELLED).orElse(true));
    }

    private Mono<WorkflowExecution> load(String executionId) {
        return persistence.findById(executionId)
                .flatMap(opt -> opt.map(Mono::just).orElseGet(() -> Mono.error(
                        new ExecutionNotFoundException(executionId))));
    }

    /** Wait nodes whose latest row is still {@code waiting} and that have no result yet. */
    static Set<String> waitingNodes(ExecutionPlan plan, WorkflowExecution execution, List<StepLog> logs) {
        Map<String, StepLog> latest = new HashMap<>();
        for (StepLog l : logs) {
            StepLog prev = latest.get(l.nodeId());
            if (prev == null || l.sequence() > prev.sequence()) {
                latest.put(l.nodeId(), l);
            }
        }
        Set<String> waiting = new LinkedHashSet<>();
        latest.forEach((nodeId, l) -> {
            if (l.status() == StepStatus.WAITING && !execution.results().containsKey(nodeId)
                    && plan.findNode(nodeId).map(NodeDefinition::isWait).orElse(false)) {
                waiting.add(nodeId);
            }
        });
        return waiting;
    }

    private record NodeProgress(String nodeId, Kind kind, String error) {
        enum Kind { DONE, WAITING, FAILED, STOPPED }

        static NodeProgress done(String nodeId) { return new NodeProgress(nodeId, Kind.DONE, null); }
        static NodeProgress waiting(String nodeId) { return new NodeProgress(nodeId, Kind.WAITING, null); }
        static NodeProgress failed(String nodeId, String error) { return new NodeProgress(nodeId, Kind.FAILED, error); }
        static NodeProgress stopped(String nodeId) { return new NodeProgress(nodeId, Kind.STOPPED, null); }
    }
}
