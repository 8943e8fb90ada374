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

package org.fireflyframework.automation.core.topology;

import org.fireflyframework.automation.core.exception.TopologyValidationException;

import java.util.*;
import java.util.function.Function;

public final class TopologyBuilder {

    private TopologyBuilder() {}

    /**
     * Builds execution layers from a list of nodes using Kahn's BFS algorithm.
     * Nodes with no predecessors form layer 0; each subsequent layer contains
     * nodes whose predecessors all appear in earlier layers.
     *
     * @param items list of graph items
     * @param idExtractor function to get the item ID
     * @param predecessorsExtractor function to get the IDs the item depends on
     * @return ordered list of layers, each layer is a list of IDs in input order
     * @throws TopologyValidationException if the topology is invalid
     */
    public static <T> List<List<String>> buildLayers(
            List<T> items,
            Function<T, String> idExtractor,
            Function<T, Collection<String>> predecessorsExtractor) {

        validate(items, idExtractor, predecessorsExtractor);

        // LinkedHashMap keeps the order deterministic
        Map<String, Integer> indegree = new LinkedHashMap<>();
        Map<String, List<String>> adjacency = new LinkedHashMap<>();

        for (T item : items) {
            String id = idExtractor.apply(item);
            indegree.putIfAbsent(id, 0);
            adjacency.putIfAbsent(id, new ArrayList<>());
        }

        for (T item : items) {
            String id = idExtractor.apply(item);
            Collection<String> preds = predecessorsExtractor.apply(item);
            if (preds != null) {
                for (String pred : new LinkedHashSet<>(preds)) {
                    indegree.merge(id, 1, Integer::sum);
                    adjacency.get(pred).add(id);
                }
            }
        }

        List<List<String>> layers = new ArrayList<>();
        Queue<String> queue = new ArrayDeque<>();

        for (String id : indegree.keySet()) {
            if (indegree.get(id) == 0) {
                queue.add(id);
            }
        }

        while (!queue.isEmpty()) {
            int size = queue.size();
            List<String> layer = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                String u = queue.poll();
                layer.add(u);
                for (String v : adjacency.getOrDefault(u, List.of())) {
                    indegree.put(v, indegree.get(v) - 1);
                    if (indegree.get(v) == 0) {
                        queue.add(v);
                    }
                }
            }
            layers.add(layer);
        }

        return layers;
    }

    /**
     * Flattens {@link #buildLayers} into a single topological order.
     */
    public static <T> List<String> topologicalOrder(
            List<T> items,
            Function<T, String> idExtractor,
            Function<T, Collection<String>> predecessorsExtractor) {
        List<String> order = new ArrayList<>();
        buildLayers(items, idExtractor, predecessorsExtractor).forEach(order::addAll);
        return order;
    }

    /**
     * Checks for duplicate IDs, unknown predecessors, self-loops and cycles.
     */
    public static <T> void validate(
            List<T> items,
            Function<T, String> idExtractor,
            Function<T, Collection<String>> predecessorsExtractor) {

        if (items == null || items.isEmpty()) {
            throw new TopologyValidationException("Node list cannot be empty");
        }

        Set<String> knownIds = new LinkedHashSet<>();
        for (T item : items) {
            String id = idExtractor.apply(item);
            if (!knownIds.add(id)) {
                throw new TopologyValidationException("Duplicate node ID: " + id);
            }
        }

        Map<String, Collection<String>> graph = new LinkedHashMap<>();
        for (T item : items) {
            String id = idExtractor.apply(item);
            Collection<String> preds = predecessorsExtractor.apply(item);
            if (preds == null) preds = List.of();
            for (String pred : preds) {
                if (pred.equals(id)) {
                    throw new TopologyValidationException("Self-loop detected: node '" + id + "' connects to itself");
                }
                if (!knownIds.contains(pred)) {
                    throw new TopologyValidationException("Node '" + id + "' depends on non-existent node '" + pred + "'");
                }
            }
            graph.put(id, preds);
        }

        List<String> cycle = findCycle(graph);
        if (!cycle.isEmpty()) {
            throw new TopologyValidationException("Cycle detected: " + String.join(" -> ", cycle));
        }
    }

    /**
     * Three-colour DFS over a predecessor map. Returns the nodes of the first cycle
     * found, in edge order, or an empty list when the graph is acyclic.
     */
    public static List<String> findCycle(Map<String, ? extends Collection<String>> predecessors) {
        Set<String> visited = new HashSet<>();
        Deque<String> recursionStack = new ArrayDeque<>();
        for (String id : predecessors.keySet()) {
            List<String> cycle = visit(id, predecessors, visited, recursionStack);
            if (!cycle.isEmpty()) return cycle;
        }
        return List.of();
    }

    private static List<String> visit(String node, Map<String, ? extends Collection<String>> graph,
                                      Set<String> visited, Deque<String> recursionStack) {
        if (recursionStack.contains(node)) {
            List<String> path = new ArrayList<>();
            Iterator<String> it = recursionStack.descendingIterator();
            boolean inCycle = false;
            while (it.hasNext()) {
                String n = it.next();
                if (n.equals(node)) inCycle = true;
                if (inCycle) path.add(n);
            }
            path.add(node);
            // walked along predecessor links, so reverse into edge direction
            Collections.reverse(path);
            return path;
        }
        if (visited.contains(node)) return List.of();

        visited.add(node);
        recursionStack.push(node);

        Collection<String> preds = graph.get(node);
        for (String pred : preds != null ? preds : List.<String>of()) {
            List<String> cycle = visit(pred, graph, visited, recursionStack);
            if (!cycle.isEmpty()) return cycle;
        }

        recursionStack.pop();
        return List.of();
    }
}
