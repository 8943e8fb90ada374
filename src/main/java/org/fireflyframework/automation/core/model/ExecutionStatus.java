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

package org.fireflyframework.automation.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Execution-level states of a workflow run.
 *
 * <p>{@code queued} is the only initial state; {@code completed}, {@code errored} and
 * {@code cancelled} are terminal. Wire values are persisted and polled by clients,
 * so they must not change.
 */
public enum ExecutionStatus {
    QUEUED("queued"),
    RUNNING("running"),
    WAITING("waiting"),
    COMPLETED("completed"),
    ERRORED("errored"),
    CANCELLED("cancelled");

    private final String value;

    ExecutionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ExecutionStatus fromValue(String value) {
        for (ExecutionStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown execution status: " + value);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ERRORED || this == CANCELLED;
    }

    public boolean isActive() {
        return this == QUEUED || this == RUNNING || this == WAITING;
    }

    public boolean canPause() {
        return this == RUNNING;
    }

    public boolean canResume() {
        return this == WAITING;
    }

    public boolean canTerminate() {
        return this == RUNNING || this == WAITING;
    }

    public boolean canTransitionTo(ExecutionStatus next) {
        return allowedTransitions().contains(next);
    }

    private Set<ExecutionStatus> allowedTransitions() {
        return switch (this) {
            case QUEUED -> EnumSet.of(RUNNING);
            case RUNNING -> EnumSet.of(WAITING, COMPLETED, ERRORED, CANCELLED);
            case WAITING -> EnumSet.of(RUNNING, CANCELLED);
            case COMPLETED, ERRORED, CANCELLED -> EnumSet.noneOf(ExecutionStatus.class);
        };
    }

    @Override
    public String toString() {
        return value;
    }
}
