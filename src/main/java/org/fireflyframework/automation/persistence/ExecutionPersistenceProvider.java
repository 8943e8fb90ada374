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

import org.fireflyframework.automation.core.model.ExecutionStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage for executions and their step logs.
 *
 * <p>{@link #update} is the only way to change a stored execution. It applies the
 * mutation atomically per execution id and bumps the revision. A mutation that
 * returns its argument unchanged performs no write; a mutation that throws aborts
 * the write and the exception is propagated.
 */
public interface ExecutionPersistenceProvider {

    /**
     * Stores a new execution. When an execution with the same non-null
     * {@code (workflowId, instanceId)} already exists, that one is returned instead.
     */
    Mono<WorkflowExecution> create(WorkflowExecution execution);

    Mono<Optional<WorkflowExecution>> findById(String executionId);

    Mono<Optional<WorkflowExecution>> findByInstanceId(String workflowId, String instanceId);

    /**
     * Atomically replaces the execution with {@code mutation(current)}.
     * Errors with {@code ExecutionNotFoundException} when the id is unknown.
     */
    Mono<WorkflowExecution> update(String executionId, UnaryOperator<WorkflowExecution> mutation);

    Flux<WorkflowExecution> findByWorkflowId(String workflowId);

    Flux<WorkflowExecution> findByStatus(ExecutionStatus status);

    Flux<WorkflowExecution> findInFlight();

    /** Appends a step log, assigning its id and sequence. */
    Mono<StepLog> appendStepLog(StepLog stepLog);

    Mono<StepLog> updateStepLog(String executionId, long sequence, UnaryOperator<StepLog> mutation);

    /** Step logs of an execution ordered by sequence. */
    Flux<StepLog> findStepLogs(String executionId);

    /** Removes terminal executions, and their logs, last updated before {@code now - olderThan}. */
    Mono<Long> cleanup(Duration olderThan);

    Mono<Boolean> isHealthy();
}
