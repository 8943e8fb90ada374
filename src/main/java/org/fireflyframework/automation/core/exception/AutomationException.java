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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Root of the automation engine's exception hierarchy.
 *
 * <p>Every subtype carries a stable {@code errorCode} that the REST layer returns
 * to callers, plus an optional context map with the identifiers involved.
 */
public class AutomationException extends RuntimeException {

    private final String errorCode;
    private final Map<String, Object> context;

    public AutomationException(String message) {
        this(message, "AUTOMATION_ERROR", Map.of(), null);
    }

    public AutomationException(String message, Throwable cause) {
        this(message, "AUTOMATION_ERROR", Map.of(), cause);
    }

    public AutomationException(String message, String errorCode, Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.context = context != null ? Collections.unmodifiableMap(new HashMap<>(context)) : Map.of();
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
