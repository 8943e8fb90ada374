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

import org.fireflyframework.automation.compiler.WorkflowCompiler;
import org.fireflyframework.automation.compiler.editor.EditorGraphMapper;
import org.fireflyframework.automation.engine.WorkflowEngine;
import org.fireflyframework.automation.rest.AutomationController;
import org.fireflyframework.automation.rest.AutomationExceptionHandler;
import org.fireflyframework.automation.webhook.WebhookController;
import org.fireflyframework.automation.webhook.WebhookService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the REST control API and webhook ingress (reactive web only).
 */
@Slf4j
@AutoConfiguration(after = AutomationAutoConfiguration.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
@ConditionalOnBean(WorkflowEngine.class)
public class AutomationRestAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.automation.rest.enabled", havingValue = "true", matchIfMissing = true)
    public AutomationController automationController(WorkflowEngine engine, WorkflowCompiler compiler,
                                                     EditorGraphMapper editorMapper) {
        log.info("[automation] REST controller initialized");
        return new AutomationController(engine, compiler, editorMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(WebhookService.class)
    public WebhookController webhookController(WebhookService webhookService) {
        log.info("[automation] Webhook ingress initialized");
        return new WebhookController(webhookService);
    }

    @Bean
    @ConditionalOnMissingBean
    public AutomationExceptionHandler automationExceptionHandler() {
        return new AutomationExceptionHandler();
    }
}
