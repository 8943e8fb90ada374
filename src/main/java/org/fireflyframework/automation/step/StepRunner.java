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

package org.fireflyframework.automation.step;

import org.fireflyframework.automation.core.model.RetryPolicy;
import org.fireflyframework.automation.core.model.StepStatus;
import org.fireflyframework.automation.core.observability.AutomationEvents;
import org.fireflyframework.automation.graph.NodeDefinition;
import org.fireflyframework.automation.persistence.ExecutionPersistenceProvider;
import org.fireflyframework.automation.persistence.ExecutionSerializer;
import org.fireflyframework.automation.persistence.StepLog;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs a single node with the engine-owned retry loop.
 *
 * <p>Every attempt appends its own {@link StepLog}. A retryable failure with
 * attempts left marks that row {@code retrying} and waits for the policy's backoff;
 * otherwise the row ends as {@code success} or {@code error}. Cancellation is
 * checked after each backoff. Rows already moved out of {@code running} by a
 * terminate are left as they are.
 */
@Slf4j
public class StepRunner {

    private final NodeExecutorRegistry registry;
    private final ExecutionPersistenceProvider persistence;
    private final ExecutionSerializer serializer;
    private final AutomationEvents events;
    private final Duration defaultTimeout;

    public StepRunner(NodeExecutorRegistry registry, ExecutionPersistenceProvider persistence,
                      ExecutionSerializer serializer, AutomationEvents events, Duration defaultTimeout) {
        this.registry = registry;
        this.persistence = persistence;
        this.serializer = serializer;
        this.events = events;
        this.defaultTimeout = defaultTimeout != null ? defaultTimeout : Duration.ZERO;
    }

    /**
     * @param cancelled emits true once the execution has been terminated
     */
    public Mono<StepOutcome> run(String workflowId, String executionId, NodeDefinition node,
                                 NodeInput input, Supplier<Mono<Boolean>> cancelled) {
        Run run = new Run(workflowId, executionId, node, input, cancelled, System.currentTimeMillis());
        return closeInterruptedAttempts(run)
                .flatMap(lastAttempt -> attempt(run, lastAttempt + 1));
    }

    /**
     * Closes rows of this node left open by an earlier, interrupted traversal and
     * returns the highest attempt number already recorded, so numbering continues.
     */
    private Mono<Integer> closeInterruptedAttempts(Run run) {
        String nodeId = run.node().id();
        return persistence.findStepLogs(run.executionId())
                .filter(l -> nodeId.equals(l.nodeId()))
                .concatMap(l -> {
                    if (l.status() != StepStatus.RUNNING && l.status() != StepStatus.RETRYING) {
                        return Mono.just(l);
                    }
                    log.warn("[scheduler] closing interrupted attempt {} of node {} in execution {}",
                            l.attemptNumber(), nodeId, run.executionId());
                    return persistence.updateStepLog(run.executionId(), l.sequence(),
                                    row -> row.status() == StepStatus.RUNNING || row.status() == StepStatus.RETRYING
                                            ? row.failed(StepStatus.ERROR, StepLog.INTERRUPTED_MESSAGE, Instant.now())
                                            : row)
                            .defaultIfEmpty(l);
                })
                .map(StepLog::attemptNumber)
                .reduce(0, Math::max);
    }

    private Mono<StepOutcome> attempt(Run run, int attempt) {
        NodeDefinition node = run.node();
        StepLog row = StepLog.started(run.executionId(), node.id(), node.name(), StepStatus.RUNNING,
                attempt, run.input().parameters());
        return persistence.appendStepLog(row)
                .flatMap(stepLog -> Mono.defer(run.cancelled())
                        .flatMap(cancelled -> {
                            // a terminate that landed before the append did not see this row
                            if (Boolean.TRUE.equals(cancelled)) {
                                return abandon(run, attempt, stepLog);
                            }
                            events.onStepStarted(run.workflowId(), run.executionId(), node.id(), attempt);
                            return invoke(node, run.input())
                                    .flatMap(result -> Mono.defer(run.cancelled())
                                            .flatMap(late -> Boolean.TRUE.equals(late)
                                                    ? abandon(run, attempt, stepLog)
                                                    : handle(run, attempt, stepLog, result)));
                        }));
    }

    private Mono<StepOutcome> abandon(Run run, int attempt, StepLog stepLog) {
        log.info("[scheduler] attempt {} of node {} abandoned, execution {} cancelled",
                attempt, run.node().id(), run.executionId());
        return persistence.updateStepLog(run.executionId(), stepLog.sequence(),
                        l -> l.status().isActive() ? l.failed(StepStatus.ERROR, StepLog.CANCELLED_MESSAGE, Instant.now()) : l)
                .then(Mono.fromSupplier(() -> StepOutcome.cancelled(run.node().id(), attempt,
                        System.currentTimeMillis() - run.startedAtMs())));
    }

    private Mono<StepResult> invoke(NodeDefinition node, NodeInput input) {
        Optional<NodeExecutor> executor = registry.resolve(node);
        if (executor.isEmpty()) {
            return Mono.just(StepResult.fatal("Unknown node type: " + node.type()));
        }
        long timeoutMs = node.timeoutMs() > 0 ? node.timeoutMs() : defaultTimeout.toMillis();
        Mono<StepResult> call = Mono.defer(() -> executor.get().execute(node, input));
        if (timeoutMs > 0) {
            call = call.timeout(Duration.ofMillis(timeoutMs));
        }
        return call
                .defaultIfEmpty(StepResult.success(null))
                .onErrorResume(TimeoutException.class,
                        e -> Mono.just(StepResult.failure("Step timed out after " + timeoutMs + "ms")))
                .onErrorResume(e -> Mono.just(StepResult.failure(messageOf(e))));
    }

    private Mono<StepOutcome> handle(Run run, int attempt, StepLog stepLog, StepResult result) {
        if (result instanceof StepResult.Success success) {
            Object output;
            try {
                output = serializer.normalize(success.output());
            } catch (IllegalArgumentException e) {
                return handle(run, attempt, stepLog, StepResult.fatal("Output is not serializable: " + e.getMessage()));
            }
            String branch = success.branch();
            if (branch == null && output instanceof Map<?, ?> map && map.get("branch") instanceof String selected) {
                branch = selected;
            }
            if (run.node().isConditional() && (branch == null || branch.isBlank())) {
                return handle(run, attempt, stepLog,
                        StepResult.fatal("Conditional node '" + run.node().id() + "' did not select a branch"));
            }
            String selectedBranch = run.node().isConditional() ? branch : null;
            long duration = System.currentTimeMillis() - run.startedAtMs();
            return persistence.updateStepLog(run.executionId(), stepLog.sequence(),
                            l -> l.status() == StepStatus.RUNNING ? l.succeeded(output, Instant.now()) : l)
                    .then(Mono.fromSupplier(() -> {
                        events.onStepSuccess(run.workflowId(), run.executionId(), run.node().id(), attempt, duration);
                        return StepOutcome.succeeded(run.node().id(), output, selectedBranch, attempt, duration);
                    }));
        }

        StepResult.Failure failure = (StepResult.Failure) result;
        RetryPolicy policy = run.node().retryPolicy();
        if (failure.retryable() && policy.shouldRetry(attempt)) {
            Duration delay = policy.calculateDelay(attempt - 1);
            events.onStepRetrying(run.workflowId(), run.executionId(), run.node().id(), attempt, failure.error());
            return persistence.updateStepLog(run.executionId(), stepLog.sequence(),
                            l -> l.status() == StepStatus.RUNNING ? l.failed(StepStatus.RETRYING, failure.error(), Instant.now()) : l)
                    .then(Mono.delay(delay))
                    .then(Mono.defer(run.cancelled()))
                    .flatMap(cancelled -> {
                        if (Boolean.TRUE.equals(cancelled)) {
                            log.info("[scheduler] Retry of node {} abandoned, execution {} cancelled",
                                    run.node().id(), run.executionId());
                            return Mono.just(StepOutcome.cancelled(run.node().id(), attempt,
                                    System.currentTimeMillis() - run.startedAtMs()));
                        }
                        return attempt(run, attempt + 1);
                    });
        }

        long duration = System.currentTimeMillis() - run.startedAtMs();
        return persistence.updateStepLog(run.executionId(), stepLog.sequence(),
                        l -> l.status() == StepStatus.RUNNING ? l.failed(StepStatus.ERROR, failure.error(), Instant.now()) : l)
                .then(Mono.fromSupplier(() -> {
                    events.onStepFailed(run.workflowId(), run.executionId(), run.node().id(), failure.error(), attempt);
                    return StepOutcome.failed(run.node().id(), failure.error(), attempt, duration);
                }));
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private record Run(String workflowId, String executionId, NodeDefinition node, NodeInput input,
                       Supplier<Mono<Boolean>> cancelled, long startedAtMs) {}
}
