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

package org.fireflyframework.automation.unit.client;

import org.fireflyframework.automation.client.ClientExecutionView;
import org.fireflyframework.automation.client.ExecutionPollingPolicy;
import org.fireflyframework.automation.client.ExecutionStatusReducer;
import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.core.model.TriggerType;
import org.fireflyframework.automation.graph.WorkflowDefinition;
import org.fireflyframework.automation.persistence.NodeResult;
import org.fireflyframework.automation.persistence.WorkflowExecution;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ExecutionStatusReducerTest {

    private static final ExecutionPollingPolicy POLICY =
            new ExecutionPollingPolicy(Duration.ofMillis(100), Duration.ofMillis(500), 3);

    private final WorkflowExecution queued = WorkflowExecution.queued(
            WorkflowDefinition.builder("wf").trigger("start").build(), TriggerType.MANUAL, Map.of(), null, null);

    @Test
    void initialView_pollsAtRunningInterval() {
        ClientExecutionView view = ClientExecutionView.initial(queued.id(), POLICY);

        assertThat(view.status()).isEqualTo(ExecutionStatus.QUEUED);
        assertThat(view.isFinished()).isFalse();
        assertThat(view.nextDelay()).contains(Duration.ofMillis(100));
    }

    @Test
    void snapshot_isMirroredVerbatim() {
        WorkflowExecution running = queued.withStatus(ExecutionStatus.RUNNING)
                .withCompletedNode("start", new NodeResult(Map.of(), null, 1, 0, false))
                .withCurrentStep("fetch");

        ClientExecutionView view = ExecutionStatusReducer.reduce(ClientExecutionView.initial(queued.id(), POLICY), running);

        assertThat(view.status()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(view.currentStep()).isEqualTo("fetch");
        assertThat(view.completedSteps()).containsExactly("start");
        assertThat(view.attempts()).isEqualTo(1);
    }

    @Test
    void waitingExecution_pollsSlower() {
        ClientExecutionView view = ExecutionStatusReducer.reduce(ClientExecutionView.initial(queued.id(), POLICY),
                queued.withStatus(ExecutionStatus.WAITING));

        assertThat(view.nextDelay()).contains(Duration.ofMillis(500));
    }

    @Test
    void terminalSnapshot_stopsPollingAndFreezesView() {
        WorkflowExecution failed = queued.finish(ExecutionStatus.ERRORED, "HTTP 500", Instant.now());

        ClientExecutionView done = ExecutionStatusReducer.reduce(ClientExecutionView.initial(queued.id(), POLICY), failed);
        ClientExecutionView after = ExecutionStatusReducer.reduce(done, queued.withStatus(ExecutionStatus.RUNNING));

        assertThat(done.isFinished()).isTrue();
        assertThat(done.error()).isEqualTo("HTTP 500");
        assertThat(done.nextDelay()).isEmpty();
        assertThat(after).isEqualTo(done);
    }

    @Test
    void attemptCap_marksTimeoutWithoutChangingStatus() {
        ClientExecutionView view = ClientExecutionView.initial(queued.id(), POLICY);
        WorkflowExecution running = queued.withStatus(ExecutionStatus.RUNNING);

        view = ExecutionStatusReducer.reduce(view, running);
        view = ExecutionStatusReducer.pollFailed(view);
        view = ExecutionStatusReducer.reduce(view, running);

        assertThat(view.timedOut()).isTrue();
        assertThat(view.status()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(view.nextDelay()).isEmpty();
    }

    @Test
    void snapshotOfAnotherExecution_isIgnored() {
        ClientExecutionView view = ClientExecutionView.initial("other-id", POLICY);

        assertThat(ExecutionStatusReducer.reduce(view, queued)).isEqualTo(view);
        assertThat(ExecutionStatusReducer.reduce(view, null)).isEqualTo(view);
    }

    @Test
    void policy_rejectsZeroAttempts() {
        assertThatThrownBy(() -> new ExecutionPollingPolicy(null, null, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(ExecutionPollingPolicy.DEFAULT.maxAttempts()).isEqualTo(300);
    }
}
