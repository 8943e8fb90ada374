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

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Maps an inbound {@code (path, method)} pair to a workflow. The pair is globally
 * unique; paths are stored with a leading slash and no trailing slash, methods upper-cased.
 */
public record WebhookBinding(
        String id,
        String workflowId,
        String path,
        String method,
        WebhookAuthMode authMode,
        Instant createdAt,
        Instant lastTriggeredAt,
        long triggerCount
) {
    public WebhookBinding {
        path = normalizePath(path);
        method = normalizeMethod(method);
        authMode = authMode != null ? authMode : WebhookAuthMode.NONE;
    }

    public static WebhookBinding create(String workflowId, String path, String method, WebhookAuthMode authMode) {
        return new WebhookBinding(UUID.randomUUID().toString(), workflowId, path, method, authMode,
                Instant.now(), null, 0);
    }

    public WebhookBinding triggered(Instant at) {
        return new WebhookBinding(id, workflowId, path, method, authMode, createdAt, at, triggerCount + 1);
    }

    public String key() {
        return method + " " + path;
    }

    public static String normalizePath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Webhook path must not be blank");
        }
        String p = path.trim();
        if (!p.startsWith("/")) p = "/" + p;
        while (p.length() > 1 && p.endsWith("/")) p = p.substring(0, p.length() - 1);
        return p;
    }

    public static String normalizeMethod(String method) {
        return method == null || method.isBlank() ? "POST" : method.trim().toUpperCase(Locale.ROOT);
    }
}
