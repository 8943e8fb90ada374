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

package org.fireflyframework.automation.step;

import org.fireflyframework.automation.persistence.StepLog;

/**
 * Final result of running one node through all of its attempts.
 */
public record StepOutcome(String nodeId, Kind kind, Object output, String branch,
                          int attempts, long durationMs, String error) {

    public enum Kind { SUCCEEDED, FAILED, CANCELLED }

    public static StepOutcome succeeded(String nodeId, Object output, String branch, int attempts, long durationMs) {
        return new StepOutcome(nodeId, Kind.SUCCEEDED, output, branch, attempts, durationMs, null);
    }

    public static StepOutcome failed(String nodeId, String error, int attempts, long durationMs) {
        return new StepOutcome(nodeId, Kind.FAILED, null, null, attempts, durationMs, error);
    }

    public static StepOutcome cancelled(String nodeId, int attempts, long durationMs) {
        return new StepOutcome(nodeId, Kind.CANCELLED, null, null, attempts, durationMs, StepLog.CANCELLED_MESSAGE);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCEEDED;
    }
}
