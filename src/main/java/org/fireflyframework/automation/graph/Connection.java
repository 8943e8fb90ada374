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

/**
 * One outgoing link from a node's output group to another node.
 *
 * @param targetNodeId     node the link points to
 * @param targetInputIndex input slot on the target, 0 for single-input nodes
 * @param label            optional display label
 */
public record Connection(String targetNodeId, int targetInputIndex, String label) {

    public Connection {
        if (targetNodeId == null || targetNodeId.isBlank()) {
            throw new IllegalArgumentException("targetNodeId must not be blank");
        }
        if (targetInputIndex < 0) targetInputIndex = 0;
    }

    public static Connection to(String targetNodeId) {
        return new Connection(targetNodeId, 0, null);
    }
}
