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

package org.fireflyframework.automation.compiler.editor;

import org.fireflyframework.automation.graph.NodePosition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Node as the visual editor stores it: the kind in {@code type}, the executor key and
 * label inside {@code data} next to the node's parameters.
 */
public record EditorNode(String id, String type, String nodeType, String label,
                         NodePosition position, Map<String, Object> data) {

    public EditorNode {
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }
}
