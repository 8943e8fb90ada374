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

import org.fireflyframework.automation.core.exception.ExecutionNotFoundException;
import org.fireflyframework.automation.core.model.ExecutionStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

public class InMemoryPersistenceProvider implements ExecutionPersistenceProvider {

    private final ConcurrentHashMap<String, WorkflowExecution> store = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> instances = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<StepLog>> stepLogs = new ConcurrentHashMap<>();

    @Override
    public Mono<WorkflowExecution> create(WorkflowExecution execution) {
        return Mono.fromCallable(() -> {
            // instance reservation and insert must be observed together
            synchronized (instances) {
                if (execution.instanceId() != null) {
                    String key = instanceKey(execution.workflowId(), execution.instanceId());
                    String existing = instances.get(key);
                    if (existing != null && store.containsKey(existing)) {
                        return store.get(existing);
                    }
                    instances.put(key, execution.id());
                }
                store.put(execution.id(), execution);
                return execution;
            }
        });
    }

    @Override
    public Mono<Optional<WorkflowExecution>> findById(String executionId) {
        return Mono.fromCallable(() -> Optional.ofNullable(store.get(executionId)));
    }

    @Override
    public Mono<Optional<WorkflowExecution>> findByInstanceId(String workflowId, String instanceId) {
        return Mono.fromCallable(() -> Optional.ofNullable(instances.get(instanceKey(workflowId, instanceId)))
                .map(store::get));
    }

    @Override
    public Mono<WorkflowExecution> update(String executionId, UnaryOperator<WorkflowExecution> mutation) {
        return Mono.fromCallable(() -> {
            AtomicReference<WorkflowExecution> result = new AtomicReference<>();
            store.compute(executionId, (k, current) -> {
                if (current == null) {
                    throw new ExecutionNotFoundException(executionId);
                }
                WorkflowExecution next = mutation.apply(current);
                if (next == current) {
                    result.set(current);
                    return current;
                }
                WorkflowExecution stored = next.withRevision(current.revision() + 1, Instant.now());
                result.set(stored);
                return stored;
            });
            return result.get();
        });
    }

    @Override
    public Flux<WorkflowExecution> findByWorkflowId(String workflowId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(store.values()))
                .filter(e -> workflowId.equals(e.workflowId()))
                .sort(Comparator.comparing(WorkflowExecution::startedAt, Comparator.nullsLast(Comparator.reverseOrder()))));
    }

    @Override
    public Flux<WorkflowExecution> findByStatus(ExecutionStatus status) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(store.values()))
                .filter(e -> e.status() == status));
    }

    @Override
    public Flux<WorkflowExecution> findInFlight() {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(store.values()))
                .filter(e -> e.status() != null && e.status().isActive()));
    }

    @Override
    public Mono<StepLog> appendStepLog(StepLog stepLog) {
        return Mono.fromCallable(() -> {
            AtomicReference<StepLog> result = new AtomicReference<>();
            stepLogs.compute(stepLog.executionId(), (k, logs) -> {
                List<StepLog> next = logs != null ? new ArrayList<>(logs) : new ArrayList<>();
                StepLog stored = stepLog.withIdentity(
                        stepLog.id() != null ? stepLog.id() : UUID.randomUUID().toString(), next.size() + 1L);
                next.add(stored);
                result.set(stored);
                return next;
            });
            return result.get();
        });
    }

    @Override
    public Mono<StepLog> updateStepLog(String executionId, long sequence, UnaryOperator<StepLog> mutation) {
        return Mono.fromCallable(() -> {
            AtomicReference<StepLog> result = new AtomicReference<>();
            stepLogs.computeIfPresent(executionId, (k, logs) -> {
                List<StepLog> next = new ArrayList<>(logs);
                for (int i = 0; i < next.size(); i++) {
                    if (next.get(i).sequence() == sequence) {
                        StepLog updated = mutation.apply(next.get(i));
                        next.set(i, updated);
                        result.set(updated);
                    }
                }
                return next;
            });
            return Optional.ofNullable(result.get());
        }).flatMap(opt -> opt.map(Mono::just).orElseGet(Mono::empty));
    }

    @Override
    public Flux<StepLog> findStepLogs(String executionId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(stepLogs.getOrDefault(executionId, List.of()))));
    }

    @Override
    public Mono<Long> cleanup(Duration olderThan) {
        Instant threshold = Instant.now().minus(olderThan);
        return Mono.fromCallable(() -> {
            long count = 0;
            var it = store.entrySet().iterator();
            while (it.hasNext()) {
                var entry = it.next();
                WorkflowExecution e = entry.getValue();
                if (e.isTerminal() && e.updatedAt() != null && e.updatedAt().isBefore(threshold)) {
                    it.remove();
                    stepLogs.remove(entry.getKey());
                    if (e.instanceId() != null) {
                        instances.remove(instanceKey(e.workflowId(), e.instanceId()), e.id());
                    }
                    count++;
                }
            }
            return count;
        });
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }

    private static String instanceKey(String workflowId, String instanceId) {
        return workflowId + "|" + instanceId;
    }

    // Test helpers
    public int size() { return store.size(); }
    public void clear() {
        store.clear();
        instances.clear();
        stepLogs.clear();
    }
}
