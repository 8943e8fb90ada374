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

import org.fireflyframework.automation.compiler.ExecutionPlan;
import org.fireflyframework.automation.graph.Edge;
import org.fireflyframework.automation.graph.NodeDefinition;
import org.fireflyframework.automation.persistence.NodeResult;
import org.fireflyframework.automation.persistence.WorkflowExecution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Where a traversal stands, derived purely from the plan and persisted records.
 *
 * <p>An edge is <em>fired</em> when its source completed and either the source is not
 * conditional or the edge's tag is the branch the source selected; <em>dead</em> when
 * the source completed with another branch or the source is itself dead; otherwise
 * <em>pending</em>. A node is ready once none of its incoming edges is pending and at
 * least one fired. Entry triggers are ready from the start; other triggers are dead.
 */
public final class TraversalState {

    public enum NodeState { COMPLETED, READY, WAITING, PENDING, DEAD }

    private final Map<String, NodeState> states;

    private TraversalState(Map<String, NodeState> states) {
        this.states = Collections.unmodifiableMap(states);
    }

    public static TraversalState of(ExecutionPlan plan, WorkflowExecution execution, Set<String> waitingNodes) {
        Map<String, NodeResult> results = execution.results();
        String entry = execution.entryNodeId();
        Map<String, NodeState> states = new LinkedHashMap<>();

        for (String id : plan.topologicalOrder()) {
            if (results.containsKey(id)) {
                states.put(id, NodeState.COMPLETED);
                continue;
            }
            NodeDefinition node = plan.node(id);
            if (node.isTrigger()) {
                boolean isEntry = entry == null || entry.equals(id);
                states.put(id, !isEntry ? NodeState.DEAD
                        : waitingNodes.contains(id) ? NodeState.WAITING : NodeState.READY);
                continue;
            }
            int fired = 0;
            int pending = 0;
            for (Edge edge : plan.incoming(id)) {
                EdgeState edgeState = edgeState(plan, edge, states, results);
                if (edgeState == EdgeState.FIRED) fired++;
                else if (edgeState == EdgeState.PENDING) pending++;
            }
            if (pending > 0) {
                states.put(id, NodeState.PENDING);
            } else if (fired > 0) {
                states.put(id, waitingNodes.contains(id) ? NodeState.WAITING : NodeState.READY);
            } else {
                states.put(id, NodeState.DEAD);
            }
        }
        return new TraversalState(states);
    }

    enum EdgeState { FIRED, DEAD, PENDING }

    static EdgeState edgeState(ExecutionPlan plan, Edge edge, Map<String, NodeState> states,
                               Map<String, NodeResult> results) {
        NodeResult sourceResult = results.get(edge.source());
        if (sourceResult != null) {
            return firesAlong(plan.node(edge.source()), sourceResult, edge) ? EdgeState.FIRED : EdgeState.DEAD;
        }
        return states.get(edge.source()) == NodeState.DEAD ? EdgeState.DEAD : EdgeState.PENDING;
    }

    /**
     * Whether a completed node's result sends control along {@code edge}. Disabled
     * nodes pass through on every output.
     */
    static boolean firesAlong(NodeDefinition source, NodeResult result, Edge edge) {
        if (!source.isConditional() || result.skipped()) {
            return true;
        }
        return edge.branchTag().equals(result.branch());
    }

    public NodeState state(String nodeId) {
        return states.getOrDefault(nodeId, NodeState.PENDING);
    }

    /** Ready nodes in topological order. */
    public List<String> ready() {
        return byState(NodeState.READY);
    }

    public List<String> waiting() {
        return byState(NodeState.WAITING);
    }

    public List<String> dead() {
        return byState(NodeState.DEAD);
    }

    public Map<String, NodeState> states() {
        return states;
    }

    private List<String> byState(NodeState wanted) {
        List<String> result = new ArrayList<>();
        states.forEach((id, s) -> {
            if (s == wanted) result.add(id);
        });
        return result;
    }
}
