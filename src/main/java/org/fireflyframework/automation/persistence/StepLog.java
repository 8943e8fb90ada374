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

import org.fireflyframework.automation.core.model.StepStatus;

import java.time.Duration;
import java.time.Instant;

/**
 * One row per node attempt. Rows are appended, never reordered; {@code sequence}
 * is assigned by the persistence provider and is unique within an execution.
 */
public record StepLog(
        String id,
        String executionId,
        String nodeId,
        String stepName,
        StepStatus status,
        int attemptNumber,
        long sequence,
        Object input,
        Object output,
        String error,
        Instant startedAt,
        Instant completedAt,
        Long durationMs
) {
    /** Error recorded on a row whose execution was terminated. */
    public static final String CANCELLED_MESSAGE = "Execution cancelled";

    /** Error recorded on a row left open by a process that stopped mid-step. */
    public static final String INTERRUPTED_MESSAGE = "Interrupted by restart";

    public static StepLog started(String executionId, String nodeId, String stepName, StepStatus status,
                                  int attemptNumber, Object input) {
        return new StepLog(null, executionId, nodeId, stepName, status, attemptNumber, 0, input,
                null, null, Instant.now(), null, null);
    }

    public StepLog withIdentity(String newId, long newSequence) {
        return new StepLog(newId, executionId, nodeId, stepName, status, attemptNumber, newSequence, input,
                output, error, startedAt, completedAt, durationMs);
    }

    public StepLog withStatus(StepStatus newStatus) {
        return new StepLog(id, executionId, nodeId, stepName, newStatus, attemptNumber, sequence, input,
                output, error, startedAt, completedAt, durationMs);
    }

    public StepLog succeeded(Object result, Instant now) {
        return new StepLog(id, executionId, nodeId, stepName, StepStatus.SUCCESS, attemptNumber, sequence, input,
                result, null, startedAt, now, elapsed(now));
    }

    public StepLog failed(StepStatus newStatus, String message, Instant now) {
        return new StepLog(id, executionId, nodeId, stepName, newStatus, attemptNumber, sequence, input,
                output, message, startedAt, now, elapsed(now));
    }

    private Long elapsed(Instant now) {
        return startedAt != null ? Duration.between(startedAt, now).toMillis() : null;
    }
}
