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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Broad category of a node. The concrete behaviour of action and agent nodes is
 * selected by {@link NodeDefinition#type()}; kind only tells the engine how to
 * schedule the node.
 */
public enum NodeKind {
    TRIGGER("trigger"),
    ACTION("action"),
    AI_AGENT("ai-agent"),
    CONDITION("condition"),
    SWITCH("switch"),
    WAIT("wait");

    private final String value;

    NodeKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static NodeKind fromValue(String value) {
        for (NodeKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node kind: " + value);
    }

    /** Condition and switch nodes select exactly one outgoing branch. */
    public boolean isConditional() {
        return this == CONDITION || this == SWITCH;
    }

    @Override
    public String toString() {
        return value;
    }
}
