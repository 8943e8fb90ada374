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

package org.fireflyframework.automation.compiler;

import org.fireflyframework.automation.core.topology.TopologyBuilder;
import org.fireflyframework.automation.graph.Connection;
import org.fireflyframework.automation.graph.ConnectionMap;
import org.fireflyframework.automation.graph.Edge;
import org.fireflyframework.automation.graph.NodeDefinition;
import org.fireflyframework.automation.graph.WorkflowDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compiled, immutable form of a {@link WorkflowDefinition}.
 *
 * <p>Nodes live in an arena keyed by id; edges are indexed both ways and grouped by
 * branch tag. Only {@link WorkflowCompiler} creates plans, after validation, so the
 * graph is known to be acyclic with no dangling edges.
 */
public final class ExecutionPlan {

    private final String workflowId;
    private final Map<String, NodeDefinition> nodes;
    private final Map<String, Map<String, List<Edge>>> outgoing;
    private final Map<String, List<Edge>> incoming;
    private final List<String> triggers;
    private final List<List<String>> layers;
    private final List<String> topologicalOrder;

    ExecutionPlan(WorkflowDefinition definition) {
        this.workflowId = definition.id();

        Map<String, NodeDefinition> arena = new LinkedHashMap<>();
        for (NodeDefinition node : definition.nodes()) {
            arena.put(node.id(), node);
        }

        Map<String, Map<String, List<Edge>>> out = new LinkedHashMap<>();
        Map<String, List<Edge>> in = new LinkedHashMap<>();
        Map<String, Set<String>> preds = new LinkedHashMap<>();
        for (String id : arena.keySet()) {
            out.put(id, new LinkedHashMap<>());
            in.put(id, new ArrayList<>());
            preds.put(id, new LinkedHashSet<>());
        }
        for (Edge edge : definition.connections().edges()) {
            out.get(edge.source()).computeIfAbsent(edge.branchTag(), k -> new ArrayList<>()).add(edge);
            in.get(edge.target()).add(edge);
            preds.get(edge.target()).add(edge.source());
        }

        Map<String, Map<String, List<Edge>>> frozenOut = new LinkedHashMap<>();
        out.forEach((id, groups) -> {
            Map<String, List<Edge>> g = new LinkedHashMap<>();
            groups.forEach((tag, edges) -> g.put(tag, List.copyOf(edges)));
            frozenOut.put(id, Collections.unmodifiableMap(g));
        });
        Map<String, List<Edge>> frozenIn = new LinkedHashMap<>();
        in.forEach((id, edges) -> frozenIn.put(id, List.copyOf(edges)));

        this.nodes = Collections.unmodifiableMap(arena);
        this.outgoing = Collections.unmodifiableMap(frozenOut);
        this.incoming = Collections.unmodifiableMap(frozenIn);
        this.triggers = arena.values().stream().filter(NodeDefinition::isTrigger).map(NodeDefinition::id).toList();

        List<List<String>> built = TopologyBuilder.buildLayers(
                List.copyOf(arena.keySet()), id -> id, preds::get);
        this.layers = built.stream().map(List::copyOf).toList();
        List<String> order = new ArrayList<>();
        layers.forEach(order::addAll);
        this.topologicalOrder = List.copyOf(order);
    }

    public String workflowId() {
        return workflowId;
    }

    public Map<String, NodeDefinition> nodes() {
        return nodes;
    }

    public NodeDefinition node(String id) {
        NodeDefinition node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + id);
        }
        return node;
    }

    public Optional<NodeDefinition> findNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /** Output groups of a node keyed by branch tag, in declaration order. */
    public Map<String, List<Edge>> outgoing(String id) {
        return outgoing.getOrDefault(id, Map.of());
    }

    public List<Edge> outgoing(String id, String branchTag) {
        return outgoing(id).getOrDefault(branchTag, List.of());
    }

    public List<Edge> incoming(String id) {
        return incoming.getOrDefault(id, List.of());
    }

    public List<String> successors(String id) {
        Set<String> result = new LinkedHashSet<>();
        outgoing(id).values().forEach(edges -> edges.forEach(e -> result.add(e.target())));
        return List.copyOf(result);
    }

    public List<String> predecessors(String id) {
        Set<String> result = new LinkedHashSet<>();
        incoming(id).forEach(e -> result.add(e.source()));
        return List.copyOf(result);
    }

    public List<Edge> edges() {
        List<Edge> all = new ArrayList<>();
        outgoing.values().forEach(groups -> groups.values().forEach(all::addAll));
        return all;
    }

    public List<String> triggers() {
        return triggers;
    }

    public List<List<String>> layers() {
        return layers;
    }

    public List<String> topologicalOrder() {
        return topologicalOrder;
    }

    /** Rebuilds the connection map, preserving group and connection order. */
    public ConnectionMap connections() {
        ConnectionMap.Builder builder = ConnectionMap.builder();
        outgoing.forEach((source, groups) -> groups.forEach((tag, edges) -> edges.forEach(e ->
                builder.connect(source, tag, new Connection(
                        e.target(), e.targetInputIndex(), e.label())))));
        return builder.build();
    }
}
