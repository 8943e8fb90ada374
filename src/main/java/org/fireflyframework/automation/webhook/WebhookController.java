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

import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.persistence.WebhookAuthMode;
import org.fireflyframework.automation.persistence.WebhookBinding;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Webhook registration under {@code /api/automation/webhooks} and ingress under
 * {@code /hooks/**}. The path after {@code /hooks} is the bound webhook path.
 */
@RestController
public class WebhookController {

    static final String INGRESS_PREFIX = "/hooks";

    private final WebhookService webhookService;

    public WebhookController(WebhookService webhookService) {
        this.webhookService = webhookService;
    }

    @PostMapping("/api/automation/webhooks")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<WebhookBinding> register(@RequestBody RegisterWebhookRequest request) {
        return webhookService.registerWebhook(request.workflowId(), request.path(), request.method(),
                WebhookAuthMode.fromValue(request.authMode()));
    }

    @GetMapping("/api/automation/webhooks")
    public Flux<WebhookBinding> list(@RequestParam String workflowId) {
        return webhookService.listWebhooks(workflowId);
    }

    @RequestMapping(path = INGRESS_PREFIX + "/**",
            method = {RequestMethod.GET, RequestMethod.POST, RequestMethod.PUT,
                    RequestMethod.PATCH, RequestMethod.DELETE})
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<WebhookResponse> receive(ServerHttpRequest request,
                                         @RequestBody(required = false) Object body) {
        String path = request.getPath().pathWithinApplication().value().substring(INGRESS_PREFIX.length());
        Object payload = body != null ? body : queryParams(request);
        return webhookService.trigger(path, request.getMethod().name(), payload)
                .map(e -> new WebhookResponse(e.id(), e.workflowId(), e.status()));
    }

    private static Map<String, Object> queryParams(ServerHttpRequest request) {
        Map<String, Object> params = new LinkedHashMap<>();
        request.getQueryParams().forEach((k, v) -> params.put(k, v.size() == 1 ? v.get(0) : v));
        return params;
    }

    // ── DTOs ──────────────────────────────────────────────────────

    public record RegisterWebhookRequest(String workflowId, String path, String method, String authMode) {}

    public record WebhookResponse(String executionId, String workflowId, ExecutionStatus status) {}
}
