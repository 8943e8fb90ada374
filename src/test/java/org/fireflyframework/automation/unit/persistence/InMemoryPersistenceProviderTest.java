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

package org.fireflyframework.automation.unit.persistence;

import org.fireflyframework.automation.core.exception.ExecutionNotFoundException;
import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.core.model.StepStatus;
import org.fireflyframework.automation.core.model.TriggerType;
import org.fireflyframework.automation.graph.WorkflowDefinition;
import org.fireflyframework.automation.persistence.InMemoryPersistenceProvider;
import org.fireflyframework.automation.persistence.StepLog;
import org.fireflyframework.automation.persistence.WorkflowExecution;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class InMemoryPersistenceProviderTest {

    private InMemoryPersistenceProvider provider;
    private final WorkflowDefinition definition = WorkflowDefinition.builder("wf").trigger("start").build();

    @BeforeEach
    void setUp() {
        provider = new InMemoryPersistenceProvider();
    }

    private WorkflowExecution queued(String instanceId) {
        return WorkflowExecution.queued(definition, TriggerType.MANUAL, Map.of(), instanceId, null);
    }

    @Test
    void create_thenFindById() {
        WorkflowExecution execution = queued(null);

        StepVerifier.create(provider.create(execution).then(provider.findById(execution.id())))
                .assertNext(found -> assertThat(found).contains(execution))
                .verifyComplete();
        StepVerifier.create(provider.findById("missing"))
                .assertNext(found -> assertThat(found).isEmpty())
                .verifyComplete();
    }

    @Test
    void create_withTakenInstanceId_returnsExisting() {
        WorkflowExecution first = provider.create(queued("inst-1")).block();

        WorkflowExecution second = provider.create(queued("inst-1")).block();

        assertThat(second.id()).isEqualTo(first.id());
        assertThat(provider.size()).isEqualTo(1);
        assertThat(provider.findByInstanceId("wf", "inst-1").block()).contains(first);
    }

    @Test
    void update_bumpsRevisionOnlyOnChange() {
        WorkflowExecution execution = provider.create(queued(null)).block();

        WorkflowExecution running = provider.update(execution.id(), e -> e.withStatus(ExecutionStatus.RUNNING)).block();
        WorkflowExecution unchanged = provider.update(execution.id(), e -> e).block();

        assertThat(running.revision()).isEqualTo(1);
        assertThat(running.status()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(unchanged.revision()).isEqualTo(1);
    }

    @Test
    void concurrentUpdates_areSerialized() {
        WorkflowExecution execution = provider.create(queued(null)).block();

        Flux.range(0, 50)
                .flatMap(i -> provider.update(execution.id(), e -> e.withCurrentStep("step-" + i)))
                .blockLast();

        assertThat(provider.findById(execution.id()).block().orElseThrow().revision()).isEqualTo(50);
    }

    @Test
    void update_unknownExecution_fails() {
        StepVerifier.create(provider.update("missing", e -> e))
                .expectError(ExecutionNotFoundException.class)
                .verify();
    }

    @Test
    void stepLogs_areSequencedPerExecutionAndUpdatable() {
        StepLog a = provider.appendStepLog(StepLog.started("x", "a", "a", StepStatus.RUNNING, 1, null)).block();
        StepLog b = provider.appendStepLog(StepLog.started("x", "b", "b", StepStatus.RUNNING, 1, null)).block();
        StepLog other = provider.appendStepLog(StepLog.started("y", "a", "a", StepStatus.RUNNING, 1, null)).block();

        assertThat(a.sequence()).isEqualTo(1);
        assertThat(b.sequence()).isEqualTo(2);
        assertThat(other.sequence()).isEqualTo(1);
        assertThat(a.id()).isNotNull();

        provider.updateStepLog("x", 2, l -> l.succeeded("done", Instant.now())).block();

        assertThat(provider.findStepLogs("x").collectList().block())
                .extracting(StepLog::nodeId, StepLog::status)
                .containsExactly(tuple("a", StepStatus.RUNNING), tuple("b", StepStatus.SUCCESS));
        StepVerifier.create(provider.updateStepLog("x", 99, l -> l)).verifyComplete();
    }

    @Test
    void queriesByStatusAndWorkflow() {
        WorkflowExecution running = provider.create(queued(null).withStatus(ExecutionStatus.RUNNING)).block();
        provider.create(queued(null).finish(ExecutionStatus.COMPLETED, null, Instant.now())).block();

        assertThat(provider.findByStatus(ExecutionStatus.RUNNING).collectList().block())
                .extracting(WorkflowExecution::id).containsExactly(running.id());
        assertThat(provider.findInFlight().collectList().block()).hasSize(1);
        assertThat(provider.findByWorkflowId("wf").collectList().block()).hasSize(2);
        assertThat(provider.findByWorkflowId("other").collectList().block()).isEmpty();
    }
}
