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

package org.fireflyframework.automation.core.exception;

import java.util.Map;

/**
 * Another workflow already owns the {@code (path, method)} pair.
 */
public class WebhookConflictException extends AutomationException {

    public WebhookConflictException(String path, String method) {
        super("Webhook already registered: " + method + " " + path, "WEBHOOK_CONFLICT",
                Map.of("path", path, "method", method), null);
    }
}
