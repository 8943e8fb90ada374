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

package org.fireflyframework.automation.client;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.fireflyframework.automation.core.model.ExecutionStatus;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * What a polling client knows about one execution. Every field mirrors the last
 * server snapshot; the client never derives status on its own.
 */
public record ClientExecutionView(
        String executionId,
        ExecutionStatus status,
        String currentStep,
        List<String> completedSteps,
        String error,
        int attempts,
        boolean timedOut,
        ExecutionPollingPolicy policy
) {
    public ClientExecutionView {
        completedSteps = completedSteps != null ? List.copyOf(completedSteps) : List.of();
        policy = policy != null ? policy : ExecutionPollingPolicy.DEFAULT;
    }

    /** View for an execution handle returned by {@code execute}, before the first poll. */
    public static ClientExecutionView initial(String executionId, ExecutionPollingPolicy policy) {
        return new ClientExecutionView(executionId, ExecutionStatus.QUEUED, null, List.of(), null, 0, false, policy);
    }

    @JsonIgnore
    public boolean isFinished() {
        return timedOut || (status != null && status.isTerminal());
    }

    /**
     * Delay before the next poll, empty once polling should stop.
     */
    public Optional<Duration> nextDelay() {
        if (isFinished()) {
            return Optional.empty();
        }
        return Optional.of(status == ExecutionStatus.WAITING ? policy.waitingInterval() : policy.runningInterval());
    }
}
