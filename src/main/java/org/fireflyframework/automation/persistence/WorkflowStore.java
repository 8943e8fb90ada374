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

import org.fireflyframework.automation.graph.WorkflowDefinition;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage for workflow definitions and their webhook bindings.
 */
public interface WorkflowStore {

    /**
     * Inserts or replaces a definition. A definition without id gets a generated one;
     * replacing an existing definition increments its version and keeps {@code createdAt}.
     */
    Mono<WorkflowDefinition> save(WorkflowDefinition definition);

    Mono<Optional<WorkflowDefinition>> findById(String workflowId);

    Flux<WorkflowDefinition> findByOwner(String owner);

    Flux<WorkflowDefinition> findAll();

    /** Deletes the definition and its webhook bindings. Emits whether it existed. */
    Mono<Boolean> delete(String workflowId);

    /**
     * Registers a binding. Re-registering the same pair for the same workflow returns the
     * existing binding; a pair owned by another workflow fails with
     * {@code WebhookConflictException}.
     */
    Mono<WebhookBinding> registerWebhook(WebhookBinding binding);

    Mono<Optional<WebhookBinding>> findWebhook(String path, String method);

    Flux<WebhookBinding> findWebhooks(String workflowId);

    Mono<Long> deleteWebhooks(String workflowId);

    Mono<WebhookBinding> recordWebhookTrigger(String path, String method, Instant at);
}
