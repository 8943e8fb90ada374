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

import org.fireflyframework.automation.core.validation.ValidationIssue;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Raised when a workflow definition fails compilation. No execution is created.
 */
public class WorkflowValidationException extends AutomationException {

    private final List<ValidationIssue> issues;

    public WorkflowValidationException(String workflowId, List<ValidationIssue> issues) {
        super(buildMessage(workflowId, issues), "WORKFLOW_INVALID",
                workflowId != null ? Map.of("workflowId", workflowId) : Map.of(), null);
        this.issues = List.copyOf(issues);
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }

    private static String buildMessage(String workflowId, List<ValidationIssue> issues) {
        String details = issues.stream().map(ValidationIssue::message).collect(Collectors.joining("; "));
        return "Workflow '" + workflowId + "' is invalid: " + details;
    }
}
