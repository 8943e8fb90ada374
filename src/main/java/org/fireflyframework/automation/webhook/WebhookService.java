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

package org.fireflyframework.automation.webhook;

import org.fireflyframework.automation.core.exception.WebhookNotFoundException;
import org.fireflyframework.automation.core.exception.WorkflowInactiveException;
import org.fireflyframework.automation.core.model.TriggerType;
import org.fireflyframework.automation.core.observability.AutomationEvents;
import org.fireflyframework.automation.engine.ExecuteRequest;
import org.fireflyframework.automation.engine.WorkflowEngine;
import org.fireflyframework.automation.graph.NodeDefinition;
import org.fireflyframework.automation.graph.WorkflowDefinition;
import org.fireflyframework.automation.persistence.WebhookAuthMode;
import org.fireflyframework.automation.persistence.WebhookBinding;
import org.fireflyframework.automation.persistence.WorkflowExecution;
import org.fireflyframework.automation.persistence.WorkflowStore;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Routes inbound HTTP calls to workflow executions.
 *
 * <p>A binding's {@code (path, method)} pair is unique across all workflows. When the
 * target workflow has a {@code webhook-trigger} node, the execution starts from the
 * first one; otherwise all triggers fire.
 */
@Slf4j
public class WebhookService {

    static final String WEBHOOK_TRIGGER_TYPE = "webhook-trigger";

    private final WorkflowStore workflowStore;
    private final WorkflowEngine engine;
    private final AutomationEvents events;

    public WebhookService(WorkflowStore workflowStore, WorkflowEngine engine, AutomationEvents events) {
        this.workflowStore = workflowStore;
        this.engine = engine;
        this.events = events;
    }

    public Mono<WebhookBinding> registerWebhook(String workflowId, String path, String method,
                                                WebhookAuthMode authMode) {
        return engine.getWorkflow(workflowId)
                .then(Mono.fromCallable(() -> WebhookBinding.create(workflowId, path, method, authMode)))
                .flatMap(workflowStore::registerWebhook)
                .doOnNext(b -> log.info("[webhook] registered workflowId={} method={} path={}",
                        b.workflowId(), b.method(), b.path()));
    }

    public Flux<WebhookBinding> listWebhooks(String workflowId) {
        return workflowStore.findWebhooks(workflowId);
    }

    public Mono<Long> unregisterWebhooks(String workflowId) {
        return workflowStore.deleteWebhooks(workflowId);
    }

    /**
     * Starts an execution of the workflow bound to {@code (path, method)} with
     * {@code body} as the trigger payload.
     */
    public Mono<WorkflowExecution> trigger(String path, String method, Object body) {
        String normalizedPath = WebhookBinding.normalizePath(path);
        String normalizedMethod = WebhookBinding.normalizeMethod(method);
        return workflowStore.findWebhook(normalizedPath, normalizedMethod)
                .flatMap(opt -> opt.map(Mono::just)
                        .orElseGet(() -> Mono.error(new WebhookNotFoundException(normalizedPath, normalizedMethod))))
                .flatMap(binding -> engine.getWorkflow(binding.workflowId())
                        .flatMap(definition -> {
                            if (!definition.active()) {
                                return Mono.error(new WorkflowInactiveException(definition.id()));
                            }
                            ExecuteRequest request = new ExecuteRequest(TriggerType.WEBHOOK, body, null,
                                    webhookEntry(definition));
                            return engine.execute(definition.id(), request)
                                    .flatMap(execution -> recordTrigger(normalizedPath, normalizedMethod)
                                            .thenReturn(execution));
                        })
                        .doOnNext(execution -> events.onWebhookTriggered(binding.workflowId(),
                                normalizedPath, normalizedMethod)));
    }

    /** Only a delivery that produced an execution counts as a trigger. */
    private Mono<Void> recordTrigger(String path, String method) {
        return workflowStore.recordWebhookTrigger(path, method, Instant.now())
                .onErrorResume(err -> {
                    log.warn("[webhook] could not record trigger method={} path={}: {}", method, path, err.toString());
                    return Mono.empty();
                })
                .then();
    }

    private static String webhookEntry(WorkflowDefinition definition) {
        return definition.nodes().stream()
                .filter(NodeDefinition::isTrigger)
                .filter(n -> WEBHOOK_TRIGGER_TYPE.equals(n.type()))
                .map(NodeDefinition::id)
                .findFirst()
                .orElse(null);
    }
}
