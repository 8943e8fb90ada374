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

package org.fireflyframework.automation.unit.engine;

import org.fireflyframework.automation.core.exception.ExecutionNotFoundException;
import org.fireflyframework.automation.core.exception.WorkflowNotFoundException;
import org.fireflyframework.automation.core.exception.WorkflowValidationException;
import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.core.model.TriggerType;
import org.fireflyframework.automation.core.observability.AutomationEvents;
import org.fireflyframework.automation.engine.ExecuteRequest;
import org.fireflyframework.automation.graph.NodeDefinition;
import org.fireflyframework.automation.graph.NodeKind;
import org.fireflyframework.automation.graph.WorkflowDefinition;
import org.fireflyframework.automation.persistence.StepLog;
import org.fireflyframework.automation.persistence.WorkflowExecution;
import org.fireflyframework.automation.testsupport.EngineHarness;
import org.fireflyframework.automation.testsupport.ScriptedNodeExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

class WorkflowEngineTest {

    private static final String T = ScriptedNodeExecutor.TYPE;

    private final List<String> started = new CopyOnWriteArrayList<>();
    private final List<String> completed = new CopyOnWriteArrayList<>();
    private EngineHarness harness;

    @BeforeEach
    void setUp() {
        harness = new EngineHarness(new AutomationEvents() {
            @Override
            public void onExecutionStarted(String workflowId, String executionId) {
                started.add(executionId);
            }

            @Override
            public void onExecutionCompleted(String workflowId, String executionId, ExecutionStatus status, long durationMs) {
                completed.add(executionId + ":" + status);
            }
        });
    }

    private static WorkflowDefinition simple(String id) {
        return WorkflowDefinition.builder(id)
                .owner("alice")
                .trigger("start")
                .action("work", T, Map.of("input", "{{trigger.data.value}}"))
                .connect("start", "work")
                .build();
    }

    // ── Definitions ───────────────────────────────────────────────

    @Test
    void saveWorkflow_rejectsInvalidDefinitions() {
        WorkflowDefinition noTrigger = WorkflowDefinition.builder("bad").action("a", T, Map.of()).build();

        StepVerifier.create(harness.engine.saveWorkflow(noTrigger))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(WorkflowValidationException.class);
                    assertThat(((WorkflowValidationException) e).getIssues()).isNotEmpty();
                })
                .verify();
        assertThat(harness.store.size()).isZero();
    }

    @Test
    void saveWorkflow_bumpsVersionOnUpdate() {
        harness.engine.saveWorkflow(simple("wf")).block();

        WorkflowDefinition updated = harness.engine.saveWorkflow(simple("wf")).block();

        assertThat(updated.version()).isEqualTo(2);
        assertThat(updated.createdAt()).isNotNull();
        assertThat(harness.engine.listWorkflows("alice").collectList().block()).hasSize(1);
        assertThat(harness.engine.listWorkflows("bob").collectList().block()).isEmpty();
        assertThat(harness.engine.listWorkflows(null).collectList().block()).hasSize(1);
    }

    @Test
    void deleteWorkflow_unknownIsNotFound() {
        StepVerifier.create(harness.engine.deleteWorkflow("nope"))
                .expectError(WorkflowNotFoundException.class)
                .verify();
    }

    // ── Execute ───────────────────────────────────────────────────

    @Test
    void execute_returnsQueuedExecutionAndRunsInBackground() {
        harness.engine.saveWorkflow(simple("wf")).block();

        WorkflowExecution execution = harness.engine.execute("wf", ExecuteRequest.manual(Map.of("value", 7))).block();

        assertThat(execution.status()).isEqualTo(ExecutionStatus.QUEUED);
        assertThat(execution.triggerPayload()).isEqualTo(Map.of("value", 7));
        WorkflowExecution done = harness.await(execution.id(), WorkflowExecution::isTerminal);
        assertThat(done.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(harness.actions.lastInput("work").parameters()).containsEntry("input", 7);
        assertThat(started).containsExactly(execution.id());
        assertThat(completed).containsExactly(execution.id() + ":" + ExecutionStatus.COMPLETED);
    }

    @Test
    void execute_withSameInstanceId_isIdempotent() {
        harness.engine.saveWorkflow(simple("wf")).block();
        ExecuteRequest request = ExecuteRequest.manual(Map.of("value", 1)).withInstanceId("order-42");

        WorkflowExecution first = harness.engine.execute("wf", request).block();
        harness.await(first.id(), WorkflowExecution::isTerminal);
        WorkflowExecution second = harness.engine.execute("wf", request).block();

        assertThat(second.id()).isEqualTo(first.id());
        assertThat(harness.persistence.size()).isEqualTo(1);
        assertThat(harness.actions.calls("work")).isEqualTo(1);
        assertThat(started).hasSize(1);
    }

    @Test
    void execute_unknownWorkflow_isNotFound() {
        StepVerifier.create(harness.engine.execute("missing", null))
                .expectError(WorkflowNotFoundException.class)
                .verify();
    }

    @Test
    void execute_invalidStoredDefinition_createsNothing() {
        harness.store.save(WorkflowDefinition.builder("broken").action("a", T, Map.of()).build()).block();

        StepVerifier.create(harness.engine.execute("broken", ExecuteRequest.manual(Map.of())))
                .expectError(WorkflowValidationException.class)
                .verify();
        assertThat(harness.persistence.size()).isZero();
    }

    @Test
    void execute_entryNodeMustBeATrigger() {
        harness.engine.saveWorkflow(simple("wf")).block();

        StepVerifier.create(harness.engine.execute("wf",
                        new ExecuteRequest(TriggerType.MANUAL, Map.of(), null, "work")))
                .expectError(WorkflowValidationException.class)
                .verify();
    }

    @Test
    void execute_fromEntryTrigger_leavesOtherTriggersUnrun() {
        WorkflowDefinition def = WorkflowDefinition.builder("multi")
                .trigger("manual")
                .node(NodeDefinition.of("hook", NodeKind.TRIGGER, "webhook-trigger", Map.of()))
                .action("fromManual", T, Map.of())
                .action("fromHook", T, Map.of("body", "{{steps.hook.data}}"))
                .connect("manual", "fromManual")
                .connect("hook", "fromHook")
                .build();
        harness.engine.saveWorkflow(def).block();

        WorkflowExecution execution = harness.engine.execute("multi",
                new ExecuteRequest(TriggerType.WEBHOOK, Map.of("id", 3), null, "hook")).block();
        WorkflowExecution done = harness.await(execution.id(), WorkflowExecution::isTerminal);

        assertThat(done.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(harness.actions.invocations()).containsExactly("fromHook");
        assertThat(harness.actions.lastInput("fromHook").parameters()).containsEntry("body", Map.of("id", 3));
        assertThat(harness.actions.lastInput("fromHook").trigger()).containsEntry("type", "webhook");
    }

    // ── Queries ───────────────────────────────────────────────────

    @Test
    void queries_reportHistory() {
        harness.engine.saveWorkflow(simple("wf")).block();
        WorkflowExecution execution = harness.engine.execute("wf", null).block();
        harness.await(execution.id(), WorkflowExecution::isTerminal);

        assertThat(harness.engine.listExecutions("wf").collectList().block())
                .extracting(WorkflowExecution::id).containsExactly(execution.id());
        assertThat(harness.engine.getStepLogs(execution.id()).collectList().block())
                .extracting(StepLog::nodeId).containsExactly("start", "work");
        StepVerifier.create(harness.engine.getExecution("nope"))
                .expectError(ExecutionNotFoundException.class)
                .verify();
        StepVerifier.create(harness.engine.getStepLogs("nope"))
                .expectError(ExecutionNotFoundException.class)
                .verify();
    }
}
