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

import org.fireflyframework.automation.core.exception.WorkflowValidationException;
import org.fireflyframework.automation.core.topology.TopologyBuilder;
import org.fireflyframework.automation.core.validation.ValidationIssue;
import org.fireflyframework.automation.core.validation.ValidationResult;
import org.fireflyframework.automation.graph.ConnectionMap;
import org.fireflyframework.automation.graph.Edge;
import org.fireflyframework.automation.graph.NodeDefinition;
import org.fireflyframework.automation.graph.WorkflowDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Turns a {@link WorkflowDefinition} into an {@link ExecutionPlan}.
 *
 * <p>Compilation is pure: it never touches executors or storage. Errors block
 * execution; warnings (unreachable nodes, triggers with incoming edges) are
 * reported but the plan is still produced.
 */
@Slf4j
public class WorkflowCompiler {

    public CompilationResult compile(WorkflowDefinition definition) {
        List<ValidationIssue> issues = check(definition);
        ValidationResult validation = ValidationResult.of(issues);
        if (!validation.valid()) {
            log.debug("[compiler] rejected workflowId={} errors={}", definition.id(), validation.errors().size());
            return new CompilationResult(null, validation);
        }
        ExecutionPlan plan = new ExecutionPlan(definition);
        log.debug("[compiler] compiled workflowId={} nodes={} layers={} warnings={}",
                definition.id(), plan.nodes().size(), plan.layers().size(), validation.warnings().size());
        return new CompilationResult(plan, validation);
    }

    public ValidationResult validate(WorkflowDefinition definition) {
        return ValidationResult.of(check(definition));
    }

    public ExecutionPlan compileOrThrow(WorkflowDefinition definition) {
        CompilationResult result = compile(definition);
        if (!result.isSuccess()) {
            throw new WorkflowValidationException(definition.id(), result.validation().errors());
        }
        return result.plan();
    }

    private List<ValidationIssue> check(WorkflowDefinition def) {
        List<ValidationIssue> issues = new ArrayList<>();

        if (def.nodes().isEmpty()) {
            issues.add(ValidationIssue.error("Workflow has no nodes", null));
            return issues;
        }

        Map<String, NodeDefinition> byId = new LinkedHashMap<>();
        for (NodeDefinition node : def.nodes()) {
            if (node.id().isBlank()) {
                issues.add(ValidationIssue.error("Node id must not be blank", null));
            } else if (byId.putIfAbsent(node.id(), node) != null) {
                issues.add(ValidationIssue.error("Duplicate node id '" + node.id() + "'", node.id()));
            }
        }

        if (byId.values().stream().noneMatch(NodeDefinition::isTrigger)) {
            issues.add(ValidationIssue.error("Workflow must contain at least one trigger node", null));
        }

        List<Edge> edges = def.connections().edges();
        List<Edge> validEdges = new ArrayList<>();
        for (Edge edge : edges) {
            String loc = edge.source() + "->" + edge.target();
            boolean ok = true;
            if (!byId.containsKey(edge.source())) {
                issues.add(ValidationIssue.error("Connection from unknown node '" + edge.source() + "'", loc));
                ok = false;
            }
            if (!byId.containsKey(edge.target())) {
                issues.add(ValidationIssue.error("Connection to unknown node '" + edge.target() + "'", loc));
                ok = false;
            }
            if (edge.branchTag() == null || edge.branchTag().isBlank()) {
                issues.add(ValidationIssue.error("Connection has a blank branch tag", loc));
                ok = false;
            }
            if (ok && edge.source().equals(edge.target())) {
                issues.add(ValidationIssue.error("Node '" + edge.source() + "' connects to itself", loc));
                ok = false;
            }
            if (ok) validEdges.add(edge);
        }

        for (NodeDefinition node : byId.values()) {
            Map<String, ?> groups = def.connections().groups(node.id());
            if (node.isConditional()) {
                boolean labeled = groups.keySet().stream()
                        .anyMatch(tag -> tag != null && !tag.isBlank() && !ConnectionMap.MAIN.equals(tag));
                if (!labeled) {
                    issues.add(ValidationIssue.error(
                            "Conditional node '" + node.id() + "' needs at least one labeled output branch", node.id()));
                }
            } else if (groups.keySet().stream().anyMatch(tag -> tag != null && !tag.isBlank() && !ConnectionMap.MAIN.equals(tag))) {
                issues.add(ValidationIssue.warning(
                        "Node '" + node.id() + "' is not conditional; all its branch outputs fire", node.id()));
            }
        }

        Map<String, Set<String>> preds = new LinkedHashMap<>();
        Map<String, Set<String>> succs = new LinkedHashMap<>();
        for (String id : byId.keySet()) {
            preds.put(id, new LinkedHashSet<>());
            succs.put(id, new LinkedHashSet<>());
        }
        for (Edge edge : validEdges) {
            preds.get(edge.target()).add(edge.source());
            succs.get(edge.source()).add(edge.target());
        }

        List<String> cycle = TopologyBuilder.findCycle(preds);
        if (!cycle.isEmpty()) {
            issues.add(ValidationIssue.error("Cycle detected: " + String.join(" -> ", cycle), cycle.get(0)));
        }

        for (NodeDefinition node : byId.values()) {
            if (node.isTrigger() && !preds.get(node.id()).isEmpty()) {
                issues.add(ValidationIssue.warning(
                        "Trigger node '" + node.id() + "' has incoming connections", node.id()));
            }
        }

        Set<String> reachable = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        byId.values().stream().filter(NodeDefinition::isTrigger).forEach(n -> {
            reachable.add(n.id());
            queue.add(n.id());
        });
        while (!queue.isEmpty()) {
            for (String next : succs.get(queue.poll())) {
                if (reachable.add(next)) queue.add(next);
            }
        }
        for (NodeDefinition node : byId.values()) {
            if (!reachable.contains(node.id())) {
                issues.add(ValidationIssue.warning(
                        "Node '" + node.id() + "' is unreachable from any trigger", node.id()));
            }
        }

        return issues;
    }
}
