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

import org.fireflyframework.automation.core.exception.WebhookConflictException;
import org.fireflyframework.automation.core.exception.WebhookNotFoundException;
import org.fireflyframework.automation.graph.WorkflowDefinition;
import org.fireflyframework.automation.persistence.InMemoryWorkflowStore;
import org.fireflyframework.automation.persistence.WebhookAuthMode;
import org.fireflyframework.automation.persistence.WebhookBinding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class InMemoryWorkflowStoreTest {

    private InMemoryWorkflowStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryWorkflowStore();
    }

    @Test
    void save_assignsIdAndVersions() {
        WorkflowDefinition created = store.save(WorkflowDefinition.builder(null).trigger("t").build()).block();

        assertThat(created.id()).isNotBlank();
        assertThat(created.version()).isEqualTo(1);
        assertThat(created.createdAt()).isNotNull().isEqualTo(created.updatedAt());

        WorkflowDefinition updated = store.save(WorkflowDefinition.builder(created.id())
                .name("renamed").trigger("t").build()).block();

        assertThat(updated.version()).isEqualTo(2);
        assertThat(updated.name()).isEqualTo("renamed");
        assertThat(updated.createdAt()).isEqualTo(created.createdAt());
    }

    @Test
    void delete_removesDefinitionAndItsWebhooks() {
        store.save(WorkflowDefinition.builder("wf").trigger("t").build()).block();
        store.registerWebhook(WebhookBinding.create("wf", "orders", "post", WebhookAuthMode.NONE)).block();

        StepVerifier.create(store.delete("wf")).expectNext(true).verifyComplete();
        StepVerifier.create(store.delete("wf")).expectNext(false).verifyComplete();
        assertThat(store.findWebhook("/orders", "POST").block()).isEmpty();
    }

    @Test
    void webhookPaths_areNormalized() {
        WebhookBinding binding = store.registerWebhook(
                WebhookBinding.create("wf", " orders/new/ ", "post", null)).block();

        assertThat(binding.path()).isEqualTo("/orders/new");
        assertThat(binding.method()).isEqualTo("POST");
        assertThat(binding.authMode()).isEqualTo(WebhookAuthMode.NONE);
        assertThat(store.findWebhook("/orders/new/", "post").block()).isPresent();
    }

    @Test
    void webhookPathOfAnotherWorkflow_conflicts() {
        store.registerWebhook(WebhookBinding.create("wf-1", "/orders", "POST", null)).block();

        StepVerifier.create(store.registerWebhook(WebhookBinding.create("wf-2", "/orders", "POST", null)))
                .expectError(WebhookConflictException.class)
                .verify();
        StepVerifier.create(store.registerWebhook(WebhookBinding.create("wf-2", "/orders", "PUT", null)))
                .expectNextCount(1)
                .verifyComplete();
    }

    @Test
    void reRegisteringSamePath_keepsOriginalBinding() {
        WebhookBinding first = store.registerWebhook(WebhookBinding.create("wf", "/orders", "POST", null)).block();

        WebhookBinding again = store.registerWebhook(WebhookBinding.create("wf", "/orders", "POST", null)).block();

        assertThat(again.id()).isEqualTo(first.id());
    }

    @Test
    void recordTrigger_countsInvocations() {
        store.registerWebhook(WebhookBinding.create("wf", "/orders", "POST", null)).block();
        Instant at = Instant.now();

        store.recordWebhookTrigger("/orders", "POST", at).block();
        WebhookBinding after = store.recordWebhookTrigger("orders", "post", at).block();

        assertThat(after.triggerCount()).isEqualTo(2);
        assertThat(after.lastTriggeredAt()).isEqualTo(at);
        StepVerifier.create(store.recordWebhookTrigger("/missing", "POST", at))
                .expectError(WebhookNotFoundException.class)
                .verify();
    }

    @Test
    void blankPath_isRejected() {
        assertThatThrownBy(() -> WebhookBinding.create("wf", " ", "POST", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
