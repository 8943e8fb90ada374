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

import java.util.Map;

/**
 * Outcome of a completed node as recorded on the execution.
 *
 * @param output     executor output, normalised to JSON-compatible values
 * @param branch     branch selected by a conditional node, null otherwise
 * @param attempts   number of attempts the node took
 * @param durationMs wall time from first attempt to completion
 * @param skipped    true for disabled nodes passed through without invocation
 */
public record NodeResult(Object output, String branch, int attempts, long durationMs, boolean skipped) {

    public static NodeResult skippedResult() {
        return new NodeResult(Map.of("skipped", true), null, 0, 0, true);
    }
}
