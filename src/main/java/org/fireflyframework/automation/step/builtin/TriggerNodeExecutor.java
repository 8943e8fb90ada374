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

package org.fireflyframework.automation.step.builtin;

import org.fireflyframework.automation.graph.NodeDefinition;
import org.fireflyframework.automation.step.NodeExecutor;
import org.fireflyframework.automation.step.NodeInput;
import org.fireflyframework.automation.step.StepResult;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Set;

/**
 * Emits the trigger payload so downstream nodes can address it as
 * {@code steps.<triggerId>.data}.
 */
public class TriggerNodeExecutor implements NodeExecutor {

    @Override
    public Set<String> types() {
        return Set.of("trigger", "manual-trigger", "webhook-trigger", "schedule-trigger", "event-trigger");
    }

    @Override
    public Mono<StepResult> execute(NodeDefinition node, NodeInput input) {
        Object data = input.triggerData();
        return Mono.just(StepResult.success(data != null ? data : Map.of()));
    }
}
