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

package org.fireflyframework.automation.config;

import org.fireflyframework.automation.client.ExecutionPollingPolicy;
import org.fireflyframework.automation.compiler.WorkflowCompiler;
import org.fireflyframework.automation.compiler.editor.EditorGraphMapper;
import org.fireflyframework.automation.core.observability.AutomationEvents;
import org.fireflyframework.automation.core.observability.AutomationLoggerEvents;
import org.fireflyframework.automation.core.observability.AutomationMetrics;
import org.fireflyframework.automation.core.observability.CompositeAutomationEvents;
import org.fireflyframework.automation.engine.ExecutionInspector;
import org.fireflyframework.automation.engine.ExecutionScheduler;
import org.fireflyframework.automation.engine.RecoveryService;
import org.fireflyframework.automation.engine.WorkflowEngine;
import org.fireflyframework.automation.persistence.ExecutionPersistenceProvider;
import org.fireflyframework.automation.persistence.ExecutionSerializer;
import org.fireflyframework.automation.persistence.InMemoryPersistenceProvider;
import org.fireflyframework.automation.persistence.InMemoryWorkflowStore;
import org.fireflyframework.automation.persistence.WorkflowStore;
import org.fireflyframework.automation.step.NodeExecutor;
import org.fireflyframework.automation.step.NodeExecutorRegistry;
import org.fireflyframework.automation.step.ParameterInterpolator;
import org.fireflyframework.automation.step.StepRunner;
import org.fireflyframework.automation.webhook.WebhookService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.util.ArrayList;
import java.util.List;

/**
 * Main auto-configuration for the automation engine.
 *
 * <p>Wires the compiler, node executor registry, step runner, scheduler and the
 * {@link WorkflowEngine} facade, with in-memory persistence unless another
 * provider is configured.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(AutomationProperties.class)
@ConditionalOnProperty(name = "firefly.automation.engine.enabled", havingValue = "true", matchIfMissing = true)
public class AutomationAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public WorkflowCompiler workflowCompiler() {
        return new WorkflowCompiler();
    }

    @Bean
    @ConditionalOnMissingBean
    public EditorGraphMapper editorGraphMapper() {
        return new EditorGraphMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionSerializer executionSerializer() {
        return new ExecutionSerializer();
    }

    @Bean
    @ConditionalOnMissingBean
    public ParameterInterpolator parameterInterpolator() {
        return new ParameterInterpolator(ExecutionSerializer.defaultMapper());
    }

    @Bean
    @ConditionalOnMissingBean
    public NodeExecutorRegistry nodeExecutorRegistry(ObjectProvider<NodeExecutor> executors) {
        return new NodeExecutorRegistry(executors.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public AutomationLoggerEvents automationLoggerEvents() {
        return new AutomationLoggerEvents();
    }

    /**
     * Fans lifecycle callbacks out to the logger and, when present, the metrics
     * listener. Both are {@link AutomationEvents} beans themselves, so this one is primary.
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean(name = "automationEvents")
    public AutomationEvents automationEvents(ObjectProvider<AutomationLoggerEvents> loggerEvents,
                                             ObjectProvider<AutomationMetrics> metrics) {
        List<AutomationEvents> delegates = new ArrayList<>();
        loggerEvents.ifAvailable(delegates::add);
        metrics.ifAvailable(delegates::add);
        if (delegates.size() == 1) {
            return delegates.get(0);
        }
        return new CompositeAutomationEvents(delegates);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionPersistenceProvider executionPersistenceProvider() {
        log.info("[automation] Using in-memory persistence provider (default)");
        return new InMemoryPersistenceProvider();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowStore workflowStore() {
        log.info("[automation] Using in-memory workflow store (default)");
        return new InMemoryWorkflowStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public StepRunner stepRunner(NodeExecutorRegistry registry, ExecutionPersistenceProvider persistence,
                                 ExecutionSerializer serializer, AutomationEvents events,
                                 AutomationProperties properties) {
        return new StepRunner(registry, persistence, serializer, events,
                properties.getEngine().getDefaultStepTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionScheduler executionScheduler(ExecutionPersistenceProvider persistence, WorkflowCompiler compiler,
                                                 StepRunner stepRunner, ParameterInterpolator interpolator,
                                                 AutomationEvents events, AutomationProperties properties) {
        int maxConcurrency = properties.getEngine().getMaxConcurrency();
        log.info("[automation] Scheduler initialized with max concurrency: {}",
                maxConcurrency > 0 ? maxConcurrency : "unbounded");
        return new ExecutionScheduler(persistence, compiler, stepRunner, interpolator, events, maxConcurrency);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionInspector executionInspector() {
        return new ExecutionInspector();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowEngine workflowEngine(WorkflowStore workflowStore, ExecutionPersistenceProvider persistence,
                                         WorkflowCompiler compiler, ExecutionScheduler scheduler,
                                         ExecutionInspector inspector, ExecutionSerializer serializer,
                                         AutomationEvents events) {
        log.info("[automation] Workflow engine initialized");
        return new WorkflowEngine(workflowStore, persistence, compiler, scheduler, inspector, serializer, events);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.automation.webhook.enabled", havingValue = "true", matchIfMissing = true)
    public WebhookService webhookService(WorkflowStore workflowStore, WorkflowEngine engine, AutomationEvents events) {
        return new WebhookService(workflowStore, engine, events);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.automation.recovery.enabled", havingValue = "true", matchIfMissing = true)
    public RecoveryService recoveryService(ExecutionPersistenceProvider persistence, ExecutionScheduler scheduler,
                                           AutomationProperties properties) {
        log.info("[automation] Recovery service initialized with stale threshold: {}",
                properties.getRecovery().getStaleThreshold());
        return new RecoveryService(persistence, scheduler, properties.getRecovery().getStaleThreshold(),
                properties.getPersistence().getRetention());
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionPollingPolicy executionPollingPolicy(AutomationProperties properties) {
        return properties.getPolling().toPolicy();
    }
}
