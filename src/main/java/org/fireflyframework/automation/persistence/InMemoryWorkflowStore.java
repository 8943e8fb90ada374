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

import org.fireflyframework.automation.core.exception.WebhookConflictException;
import org.fireflyframework.automation.core.exception.WebhookNotFoundException;
import org.fireflyframework.automation.graph.WorkflowDefinition;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryWorkflowStore implements WorkflowStore {

    private final ConcurrentHashMap<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, WebhookBinding> webhooks = new ConcurrentHashMap<>();

    @Override
    public Mono<WorkflowDefinition> save(WorkflowDefinition definition) {
        return Mono.fromCallable(() -> {
            WorkflowDefinition toSave = definition.id() != null && !definition.id().isBlank()
                    ? definition : definition.withId(UUID.randomUUID().toString());
            Instant now = Instant.now();
            return definitions.compute(toSave.id(), (id, existing) -> existing == null
                    ? toSave.withVersion(1, now)
                    : new WorkflowDefinition(id, toSave.owner() != null ? toSave.owner() : existing.owner(),
                            toSave.name(), toSave.description(), toSave.nodes(), toSave.connections(),
                            toSave.active(), existing.version() + 1, existing.createdAt(), now));
        });
    }

    @Override
    public Mono<Optional<WorkflowDefinition>> findById(String workflowId) {
        return Mono.fromCallable(() -> Optional.ofNullable(definitions.get(workflowId)));
    }

    @Override
    public Flux<WorkflowDefinition> findByOwner(String owner) {
        return findAll().filter(d -> Objects.equals(owner, d.owner()));
    }

    @Override
    public Flux<WorkflowDefinition> findAll() {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(definitions.values()))
                .sort(Comparator.comparing(WorkflowDefinition::updatedAt, Comparator.nullsLast(Comparator.reverseOrder()))));
    }

    @Override
    public Mono<Boolean> delete(String workflowId) {
        return Mono.fromCallable(() -> definitions.remove(workflowId) != null)
                .flatMap(removed -> deleteWebhooks(workflowId).thenReturn(removed));
    }

    @Override
    public Mono<WebhookBinding> registerWebhook(WebhookBinding binding) {
        return Mono.fromCallable(() -> webhooks.compute(binding.key(), (key, existing) -> {
            if (existing == null) return binding;
            if (existing.workflowId().equals(binding.workflowId())) return existing;
            throw new WebhookConflictException(binding.path(), binding.method());
        }));
    }

    @Override
    public Mono<Optional<WebhookBinding>> findWebhook(String path, String method) {
        return Mono.fromCallable(() -> Optional.ofNullable(webhooks.get(
                WebhookBinding.normalizeMethod(method) + " " + WebhookBinding.normalizePath(path))));
    }

    @Override
    public Flux<WebhookBinding> findWebhooks(String workflowId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(webhooks.values()))
                .filter(b -> b.workflowId().equals(workflowId)));
    }

    @Override
    public Mono<Long> deleteWebhooks(String workflowId) {
        return Mono.fromCallable(() -> {
            long count = 0;
            var it = webhooks.values().iterator();
            while (it.hasNext()) {
                if (it.next().workflowId().equals(workflowId)) {
                    it.remove();
                    count++;
                }
            }
            return count;
        });
    }

    @Override
    public Mono<WebhookBinding> recordWebhookTrigger(String path, String method, Instant at) {
        String key = WebhookBinding.normalizeMethod(method) + " " + WebhookBinding.normalizePath(path);
        return Mono.fromCallable(() -> {
            WebhookBinding updated = webhooks.computeIfPresent(key, (k, b) -> b.triggered(at));
            if (updated == null) {
                throw new WebhookNotFoundException(path, method);
            }
            return updated;
        });
    }

    // Test helpers
    public int size() { return definitions.size(); }
    public void clear() {
        definitions.clear();
        webhooks.clear();
    }
}
