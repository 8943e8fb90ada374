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

import org.fireflyframework.automation.graph.NodeDefinition;
import org.fireflyframework.automation.step.builtin.ConditionNodeExecutor;
import org.fireflyframework.automation.step.builtin.TriggerNodeExecutor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the executor for a node: first by its {@code type}, then by its kind's
 * wire value. Built-in trigger and condition executors are registered first so
 * application executors can replace them.
 */
@Slf4j
public class NodeExecutorRegistry {

    private final Map<String, NodeExecutor> byType = new LinkedHashMap<>();

    public NodeExecutorRegistry(Collection<? extends NodeExecutor> executors) {
        register(new TriggerNodeExecutor());
        register(new ConditionNodeExecutor());
        if (executors != null) {
            executors.forEach(this::register);
        }
        log.info("[automation] Registered node executors for types: {}", byType.keySet());
    }

    public NodeExecutorRegistry() {
        this(List.of());
    }

    private void register(NodeExecutor executor) {
        for (String type : executor.types()) {
            NodeExecutor previous = byType.put(type, executor);
            if (previous != null && previous.getClass() != executor.getClass()) {
                log.debug("[automation] Executor {} replaces {} for type '{}'",
                        executor.getClass().getSimpleName(), previous.getClass().getSimpleName(), type);
            }
        }
    }

    public Optional<NodeExecutor> resolve(NodeDefinition node) {
        NodeExecutor executor = byType.get(node.type());
        if (executor == null) {
            executor = byType.get(node.kind().value());
        }
        return Optional.ofNullable(executor);
    }

    public Set<String> registeredTypes() {
        return byType.keySet();
    }
}
