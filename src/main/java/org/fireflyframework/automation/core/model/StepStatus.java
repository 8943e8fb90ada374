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

public enum StepStatus {
    PENDING("pending"),
    RUNNING("running"),
    SUCCESS("success"),
    ERROR("error"),
    RETRYING("retrying"),
    SKIPPED("skipped"),
    WAITING("waiting");

    private final String value;

    StepStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static StepStatus fromValue(String value) {
        for (StepStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown step status: " + value);
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == ERROR || this == SKIPPED;
    }

    public boolean isActive() {
        return this == RUNNING || this == RETRYING || this == WAITING;
    }

    @Override
    public String toString() {
        return value;
    }
}
