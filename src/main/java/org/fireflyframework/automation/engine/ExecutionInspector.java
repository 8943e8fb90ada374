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
import org.fireflyframework.automation.core.model.StepStatus;
import org.fireflyframework.automation.graph.Edge;
import org.fireflyframework.automation.persistence.NodeResult;
import org.fireflyframework.automation.persistence.StepLog;
import org.fireflyframework.automation.persistence.WorkflowExecution;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure queries over an execution's persisted records.
 */
public class ExecutionInspector {

    /**
     * Status per node from its latest step log row. Nodes without rows are
     * {@code pending} while the execution is active and {@code skipped} once it is terminal.
     */
    public Map<String, StepStatus> nodeStatuses(ExecutionPlan plan, WorkflowExecution execution, List<StepLog> logs) {
        Map<String, StepLog> latest = new HashMap<>();
        for (StepLog log : logs) {
            StepLog prev = latest.get(log.nodeId());
            if (prev == null || log.sequence() > prev.sequence()) {
                latest.put(log.nodeId(), log);
            }
        }
        Map<String, StepStatus> statuses = new LinkedHashMap<>();
        for (String id : plan.topologicalOrder()) {
            StepLog log = latest.get(id);
            if (log != null) {
                statuses.put(id, log.status());
            } else if (execution.results().containsKey(id)) {
                statuses.put(id, execution.results().get(id).skipped() ? StepStatus.SKIPPED : StepStatus.SUCCESS);
            } else {
                statuses.put(id, execution.isTerminal() ? StepStatus.SKIPPED : StepStatus.PENDING);
            }
        }
        return statuses;
    }

    /**
     * Edges whose source and target both completed without being skipped, and whose
     * tag matches the branch a conditional source selected.
     */
    public List<Edge> executedEdges(ExecutionPlan plan, WorkflowExecution execution) {
        Map<String, NodeResult> results = execution.results();
        List<Edge> executed = new ArrayList<>();
        for (Edge edge : plan.edges()) {
            NodeResult source = results.get(edge.source());
            NodeResult target = results.get(edge.target());
            if (source == null || target == null || source.skipped() || target.skipped()) {
                continue;
            }
            boolean conditional = plan.node(edge.source()).isConditional();
            if (!conditional || edge.branchTag().equals(source.branch())) {
                executed.add(edge);
            }
        }
        return executed;
    }

    public ExecutionView view(ExecutionPlan plan, WorkflowExecution execution, List<StepLog> logs) {
        return new ExecutionView(execution, logs, nodeStatuses(plan, execution, logs), executedEdges(plan, execution));
    }
}
