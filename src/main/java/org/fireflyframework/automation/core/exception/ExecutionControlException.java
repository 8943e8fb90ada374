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

import org.fireflyframework.automation.core.model.ExecutionStatus;

import java.util.Map;

/**
 * A pause, resume or terminate command was issued against an execution whose
 * current status does not allow it. The execution is left unchanged.
 */
public class ExecutionControlException extends AutomationException {

    private final String executionId;
    private final ExecutionStatus currentStatus;
    private final String operation;

    public ExecutionControlException(String executionId, ExecutionStatus currentStatus, String operation) {
        super("Cannot " + operation + " execution " + executionId + " in status " + currentStatus,
                "INVALID_TRANSITION",
                Map.of("executionId", executionId, "status", String.valueOf(currentStatus), "operation", operation),
                null);
        this.executionId = executionId;
        this.currentStatus = currentStatus;
        this.operation = operation;
    }

    public String getExecutionId() {
        return executionId;
    }

    public ExecutionStatus getCurrentStatus() {
        return currentStatus;
    }

    public String getOperation() {
        return operation;
    }
}
