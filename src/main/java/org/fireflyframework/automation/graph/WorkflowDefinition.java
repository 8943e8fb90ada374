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

package org.fireflyframework.automation.graph;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A user-authored workflow: nodes plus typed connections.
 *
 * <p>Definitions are immutable. Every stored update produces a new record with an
 * incremented {@code version}; executions keep a snapshot of the definition they
 * started with.
 */
public record WorkflowDefinition(
        String id,
        String owner,
        String name,
        String description,
        List<NodeDefinition> nodes,
        ConnectionMap connections,
        boolean active,
        int version,
        Instant createdAt,
        Instant updatedAt
) {
    public WorkflowDefinition {
        name = name != null ? name : id;
        description = description != null ? description : "";
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        connections = connections != null ? connections : ConnectionMap.empty();
    }

    public static WorkflowBuilder builder(String id) {
        return new WorkflowBuilder(id);
    }

    public Optional<NodeDefinition> findNode(String nodeId) {
        return nodes.stream().filter(n -> n.id().equals(nodeId)).findFirst();
    }

    public WorkflowDefinition withId(String newId) {
        return new WorkflowDefinition(newId, owner, name, description, nodes, connections, active, version, createdAt, updatedAt);
    }

    public WorkflowDefinition withVersion(int newVersion, Instant timestamp) {
        return new WorkflowDefinition(id, owner, name, description, nodes, connections, active, newVersion,
                createdAt != null ? createdAt : timestamp, timestamp);
    }

    public WorkflowDefinition withActive(boolean value) {
        return new WorkflowDefinition(id, owner, name, description, nodes, connections, value, version, createdAt, updatedAt);
    }
}
