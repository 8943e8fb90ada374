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

package org.fireflyframework.automation.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.fireflyframework.automation.core.model.RetryPolicy;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A node of a workflow graph.
 *
 * @param id          unique within the workflow
 * @param name        display name, defaults to the id
 * @param kind        scheduling category
 * @param type        executor key such as {@code http-request}; defaults to the kind's wire value
 * @param position    editor coordinates, ignored by the engine
 * @param parameters  opaque configuration handed to the executor after interpolation
 * @param disabled    disabled nodes are not invoked; traversal passes through them
 * @param retryPolicy engine-applied retry policy
 * @param timeoutMs   per-attempt timeout, 0 for none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeDefinition(
        String id,
        String name,
        NodeKind kind,
        String type,
        NodePosition position,
        Map<String, Object> parameters,
        boolean disabled,
        RetryPolicy retryPolicy,
        long timeoutMs
) {
    public NodeDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        name = name != null ? name : id;
        type = type != null && !type.isBlank() ? type : kind.value();
        position = position != null ? position : NodePosition.ORIGIN;
        parameters = parameters != null ? Collections.unmodifiableMap(new HashMap<>(parameters)) : Map.of();
        retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.NO_RETRY;
        if (timeoutMs < 0) timeoutMs = 0;
    }

    public static NodeDefinition of(String id, NodeKind kind, String type, Map<String, Object> parameters) {
        return new NodeDefinition(id, null, kind, type, null, parameters, false, null, 0);
    }

    public NodeDefinition withRetryPolicy(RetryPolicy policy) {
        return new NodeDefinition(id, name, kind, type, position, parameters, disabled, policy, timeoutMs);
    }

    public NodeDefinition withDisabled(boolean value) {
        return new NodeDefinition(id, name, kind, type, position, parameters, value, retryPolicy, timeoutMs);
    }

    public NodeDefinition withTimeoutMs(long value) {
        return new NodeDefinition(id, name, kind, type, position, parameters, disabled, retryPolicy, value);
    }

    public NodeDefinition withPosition(NodePosition value) {
        return new NodeDefinition(id, name, kind, type, value, parameters, disabled, retryPolicy, timeoutMs);
    }

    @JsonIgnore
    public boolean isTrigger() {
        return kind == NodeKind.TRIGGER;
    }

    @JsonIgnore
    public boolean isWait() {
        return kind == NodeKind.WAIT;
    }

    @JsonIgnore
    public boolean isConditional() {
        return kind.isConditional();
    }
}
