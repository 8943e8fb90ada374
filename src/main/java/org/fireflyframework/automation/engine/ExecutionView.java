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

import org.fireflyframework.automation.core.model.StepStatus;
import org.fireflyframework.automation.graph.Edge;
import org.fireflyframework.automation.persistence.StepLog;
import org.fireflyframework.automation.persistence.WorkflowExecution;

import java.util.List;
import java.util.Map;

/**
 * Read model for the editor: the execution, its step log history, a status per
 * node and the edges control actually flowed along.
 */
public record ExecutionView(
        WorkflowExecution execution,
        List<StepLog> stepLogs,
        Map<String, StepStatus> nodeStatuses,
        List<Edge> executedEdges
) {
}
