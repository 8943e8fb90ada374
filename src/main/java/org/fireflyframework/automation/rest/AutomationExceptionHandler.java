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

package org.fireflyframework.automation.rest;

import org.fireflyframework.automation.core.exception.AutomationException;
import org.fireflyframework.automation.core.exception.ExecutionControlException;
import org.fireflyframework.automation.core.exception.ExecutionNotFoundException;
import org.fireflyframework.automation.core.exception.PersistenceException;
import org.fireflyframework.automation.core.exception.WebhookConflictException;
import org.fireflyframework.automation.core.exception.WebhookNotFoundException;
import org.fireflyframework.automation.core.exception.WorkflowInactiveException;
import org.fireflyframework.automation.core.exception.WorkflowNotFoundException;
import org.fireflyframework.automation.core.exception.WorkflowValidationException;
import org.fireflyframework.automation.core.validation.ValidationIssue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.Map;

/**
 * Maps the engine's exceptions onto HTTP statuses with a stable error body.
 */
@Slf4j
@RestControllerAdvice(assignableTypes = {AutomationController.class,
        org.fireflyframework.automation.webhook.WebhookController.class})
public class AutomationExceptionHandler {

    @ExceptionHandler(WorkflowValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WorkflowValidationException ex) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex, ex.getIssues());
    }

    @ExceptionHandler({ExecutionControlException.class, WebhookConflictException.class,
            WorkflowInactiveException.class})
    public ResponseEntity<ErrorResponse> handleConflict(AutomationException ex) {
        return respond(HttpStatus.CONFLICT, ex, List.of());
    }

    @ExceptionHandler({ExecutionNotFoundException.class, WorkflowNotFoundException.class,
            WebhookNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(AutomationException ex) {
        return respond(HttpStatus.NOT_FOUND, ex, List.of());
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(PersistenceException ex) {
        log.error("[automation] persistence failure: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex, List.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("BAD_REQUEST", ex.getMessage(), Map.of(), List.of()));
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, AutomationException ex,
                                                         List<ValidationIssue> issues) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(ex.getErrorCode(), ex.getMessage(), ex.getContext(), issues));
    }

    public record ErrorResponse(String errorCode, String message, Map<String, Object> context,
                                List<ValidationIssue> issues) {}
}
