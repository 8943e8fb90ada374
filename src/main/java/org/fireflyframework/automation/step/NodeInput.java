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

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything a node executor may read.
 *
 * @param parameters node parameters with placeholders already resolved
 * @param trigger    trigger context, {@code {type, data}}
 * @param steps      outputs of completed nodes, {@code nodeId -> {data, branch}}
 */
public record NodeInput(Map<String, Object> parameters, Map<String, Object> trigger, Map<String, Object> steps) {

    public NodeInput {
        parameters = parameters != null ? Collections.unmodifiableMap(new HashMap<>(parameters)) : Map.of();
        trigger = trigger != null ? Collections.unmodifiableMap(new HashMap<>(trigger)) : Map.of();
        steps = steps != null ? Collections.unmodifiableMap(new HashMap<>(steps)) : Map.of();
    }

    /** Root object placeholder paths are resolved against. */
    public Map<String, Object> context() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("trigger", trigger);
        context.put("steps", steps);
        return context;
    }

    public Object triggerData() {
        return trigger.get("data");
    }

    @SuppressWarnings("unchecked")
    public Object output(String nodeId) {
        Object step = steps.get(nodeId);
        return step instanceof Map<?, ?> map ? ((Map<String, Object>) map).get("data") : null;
    }

    public Object parameter(String name) {
        return parameters.get(name);
    }
}
