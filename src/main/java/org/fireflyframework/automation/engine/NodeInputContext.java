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

package org.fireflyframework.automation.engine;

import org.fireflyframework.automation.persistence.NodeResult;
import org.fireflyframework.automation.persistence.WorkflowExecution;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Trigger data and completed node outputs as seen by placeholders and executors:
 * {@code trigger.type}, {@code trigger.data}, {@code steps.<nodeId>.data},
 * {@code steps.<nodeId>.branch}.
 */
record NodeInputContext(Map<String, Object> trigger, Map<String, Object> steps) {

    static NodeInputContext of(WorkflowExecution execution) {
        Map<String, Object> trigger = new LinkedHashMap<>();
        trigger.put("type", execution.triggerType().value());
        trigger.put("data", execution.triggerPayload());

        Map<String, Object> steps = new LinkedHashMap<>();
        for (Map.Entry<String, NodeResult> entry : execution.results().entrySet()) {
            Map<String, Object> step = new HashMap<>();
            step.put("data", entry.getValue().output());
            step.put("branch", entry.getValue().branch());
            steps.put(entry.getKey(), step);
        }
        return new NodeInputContext(trigger, steps);
    }

    Map<String, Object> asMap() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("trigger", trigger);
        context.put("steps", steps);
        return context;
    }
}
