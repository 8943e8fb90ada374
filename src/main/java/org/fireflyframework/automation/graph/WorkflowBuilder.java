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

import org.fireflyframework.automation.core.model.RetryPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fluent builder for {@link WorkflowDefinition}, mostly used from code and tests.
 *
 * <pre>{@code
 * WorkflowDefinition wf = WorkflowDefinition.builder("orders")
 *         .trigger("start")
 *         .condition("check", Map.of("conditions", List.of(...)))
 *         .action("notify", "send-email", Map.of())
 *         .connect("start", "check")
 *         .connect("check", "true", "notify")
 *         .build();
 * }</pre>
 */
public class WorkflowBuilder {

    private final String id;
    private String owner;
    private String name;
    private String description = "";
    private boolean active = true;
    private final List<NodeDefinition> nodes = new ArrayList<>();
    private final ConnectionMap.Builder connections = ConnectionMap.builder();

    public WorkflowBuilder(String id) {
        this.id = id;
    }

    public WorkflowBuilder owner(String owner) {
        this.owner = owner;
        return this;
    }

    public WorkflowBuilder name(String name) {
        this.name = name;
        return this;
    }

    public WorkflowBuilder description(String description) {
        this.description = description;
        return this;
    }

    public WorkflowBuilder active(boolean active) {
        this.active = active;
        return this;
    }

    public WorkflowBuilder node(NodeDefinition node) {
        nodes.add(node);
        return this;
    }

    public WorkflowBuilder trigger(String nodeId) {
        return node(NodeDefinition.of(nodeId, NodeKind.TRIGGER, "manual-trigger", Map.of()));
    }

    public WorkflowBuilder action(String nodeId, String type, Map<String, Object> parameters) {
        return node(NodeDefinition.of(nodeId, NodeKind.ACTION, type, parameters));
    }

    public WorkflowBuilder action(String nodeId, String type, Map<String, Object> parameters, RetryPolicy retryPolicy) {
        return node(NodeDefinition.of(nodeId, NodeKind.ACTION, type, parameters).withRetryPolicy(retryPolicy));
    }

    public WorkflowBuilder agent(String nodeId, String type, Map<String, Object> parameters) {
        return node(NodeDefinition.of(nodeId, NodeKind.AI_AGENT, type, parameters));
    }

    public WorkflowBuilder condition(String nodeId, Map<String, Object> parameters) {
        return node(NodeDefinition.of(nodeId, NodeKind.CONDITION, null, parameters));
    }

    public WorkflowBuilder switchNode(String nodeId, Map<String, Object> parameters) {
        return node(NodeDefinition.of(nodeId, NodeKind.SWITCH, null, parameters));
    }

    public WorkflowBuilder waitNode(String nodeId) {
        return node(NodeDefinition.of(nodeId, NodeKind.WAIT, null, Map.of()));
    }

    public WorkflowBuilder connect(String source, String target) {
        connections.connect(source, target);
        return this;
    }

    public WorkflowBuilder connect(String source, String branchTag, String target) {
        connections.connect(source, branchTag, target);
        return this;
    }

    public WorkflowDefinition build() {
        return new WorkflowDefinition(id, owner, name, description, nodes, connections.build(),
                active, 1, null, null);
    }
}
