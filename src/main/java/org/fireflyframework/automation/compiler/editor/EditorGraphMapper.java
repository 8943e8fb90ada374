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

package org.fireflyframework.automation.compiler.editor;

import org.fireflyframework.automation.compiler.ExecutionPlan;
import org.fireflyframework.automation.graph.Connection;
import org.fireflyframework.automation.graph.ConnectionMap;
import org.fireflyframework.automation.graph.Edge;
import org.fireflyframework.automation.graph.NodeDefinition;
import org.fireflyframework.automation.graph.NodeKind;
import org.fireflyframework.automation.graph.WorkflowDefinition;

import java.util.*;

/**
 * Converts between the editor's node/edge list and {@link WorkflowDefinition}.
 *
 * <p>Output groups are ordered with {@code main} first, then by tag name, so a
 * definition decompiled from a plan and mapped back yields the same connections.
 */
public class EditorGraphMapper {

    static final String NODE_TYPE_KEY = "nodeType";
    static final String LABEL_KEY = "label";
    static final String DISABLED_KEY = "disabled";

    public WorkflowDefinition toDefinition(EditorGraph graph, String workflowId, String owner) {
        List<NodeDefinition> nodes = new ArrayList<>();
        for (EditorNode en : graph.nodes()) {
            Map<String, Object> parameters = new LinkedHashMap<>(en.data());
            Object nodeType = parameters.remove(NODE_TYPE_KEY);
            Object label = parameters.remove(LABEL_KEY);
            Object disabled = parameters.remove(DISABLED_KEY);

            String type = en.nodeType() != null ? en.nodeType() : nodeType != null ? nodeType.toString() : null;
            String name = en.label() != null ? en.label() : label != null ? label.toString() : type;
            NodeKind kind = en.type() != null ? NodeKind.fromValue(en.type()) : NodeKind.ACTION;
            nodes.add(new NodeDefinition(en.id(), name, kind, type, en.position(), parameters,
                    Boolean.TRUE.equals(disabled), null, 0));
        }

        Map<String, Map<String, List<EditorEdge>>> grouped = new LinkedHashMap<>();
        for (EditorEdge edge : graph.edges()) {
            String handle = edge.sourceHandle() == null || edge.sourceHandle().isBlank()
                    ? ConnectionMap.MAIN : edge.sourceHandle();
            grouped.computeIfAbsent(edge.source(), k -> new TreeMap<>(EditorGraphMapper::compareHandles))
                    .computeIfAbsent(handle, k -> new ArrayList<>())
                    .add(edge);
        }

        ConnectionMap.Builder connections = ConnectionMap.builder();
        grouped.forEach((source, handles) -> handles.forEach((tag, edges) -> edges.forEach(e ->
                connections.connect(source, tag, new Connection(e.target(), parseIndex(e.targetHandle()), e.label())))));

        return new WorkflowDefinition(workflowId, owner, graph.name(), graph.description(), nodes,
                connections.build(), true, 1, null, null);
    }

    public EditorGraph fromPlan(ExecutionPlan plan, String name, String description) {
        List<EditorNode> nodes = new ArrayList<>();
        for (NodeDefinition node : plan.nodes().values()) {
            Map<String, Object> data = new LinkedHashMap<>(node.parameters());
            data.put(NODE_TYPE_KEY, node.type());
            data.put(LABEL_KEY, node.name());
            if (node.disabled()) data.put(DISABLED_KEY, true);
            nodes.add(new EditorNode(node.id(), node.kind().value(), node.type(), node.name(), node.position(), data));
        }
        List<EditorEdge> edges = new ArrayList<>();
        for (Edge edge : plan.edges()) {
            String handle = edge.isMain() ? null : edge.branchTag();
            edges.add(new EditorEdge(edge.source() + "-" + edge.branchTag() + "-" + edge.target(),
                    edge.source(), edge.target(), handle, String.valueOf(edge.targetInputIndex()), edge.label()));
        }
        return new EditorGraph(name, description, nodes, edges);
    }

    private static int compareHandles(String a, String b) {
        if (a.equals(b)) return 0;
        if (ConnectionMap.MAIN.equals(a)) return -1;
        if (ConnectionMap.MAIN.equals(b)) return 1;
        return a.compareTo(b);
    }

    private static int parseIndex(String handle) {
        if (handle == null) return 0;
        try {
            return Integer.parseInt(handle.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
