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

package org.fireflyframework.automation.step;

import org.fireflyframework.automation.graph.NodeDefinition;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Performs the work of one node type (HTTP call, AI agent, notification...).
 *
 * <p>Implementations are registered as beans and looked up by {@link NodeDefinition#type()},
 * falling back to the node kind. A thrown exception or error signal counts as a
 * retryable failure.
 */
public interface NodeExecutor {

    /** Node type keys this executor handles. */
    Set<String> types();

    Mono<StepResult> execute(NodeDefinition node, NodeInput input);
}
