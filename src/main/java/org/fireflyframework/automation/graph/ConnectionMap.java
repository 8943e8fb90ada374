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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed connections of a workflow: {@code sourceNodeId -> branchTag -> [Connection]}.
 *
 * <p>Insertion order is preserved at every level so output groups keep the order
 * the author declared them in. The {@value #MAIN} tag is the unconditional output;
 * any other tag is a branch selected by a condition or switch node.
 */
public final class ConnectionMap {

    public static final String MAIN = "main";

    private static final ConnectionMap EMPTY = new ConnectionMap(Map.of());

    private final Map<String, Map<String, List<Connection>>> bySource;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public ConnectionMap(Map<String, Map<String, List<Connection>>> bySource) {
        Map<String, Map<String, List<Connection>>> copy = new LinkedHashMap<>();
        if (bySource != null) {
            bySource.forEach((source, groups) -> {
                Map<String, List<Connection>> groupCopy = new LinkedHashMap<>();
                if (groups != null) {
                    groups.forEach((tag, conns) -> groupCopy.put(tag, conns != null ? List.copyOf(conns) : List.of()));
                }
                copy.put(source, Collections.unmodifiableMap(groupCopy));
            });
        }
        this.bySource = Collections.unmodifiableMap(copy);
    }

    public static ConnectionMap empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonValue
    public Map<String, Map<String, List<Connection>>> asMap() {
        return bySource;
    }

    public Set<String> sources() {
        return bySource.keySet();
    }

    /** Output groups of a node keyed by branch tag, empty when the node has none. */
    public Map<String, List<Connection>> groups(String sourceNodeId) {
        return bySource.getOrDefault(sourceNodeId, Map.of());
    }

    public List<Connection> connections(String sourceNodeId, String branchTag) {
        return groups(sourceNodeId).getOrDefault(branchTag, List.of());
    }

    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>();
        bySource.forEach((source, groups) -> groups.forEach((tag, conns) -> {
            for (Connection c : conns) {
                edges.add(new Edge(source, tag, c.targetNodeId(), c.targetInputIndex(), c.label()));
            }
        }));
        return edges;
    }

    public boolean isEmpty() {
        return bySource.values().stream().allMatch(g -> g.values().stream().allMatch(List::isEmpty));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ConnectionMap other && bySource.equals(other.bySource);
    }

    @Override
    public int hashCode() {
        return bySource.hashCode();
    }

    @Override
    public String toString() {
        return "ConnectionMap" + bySource;
    }

    public static final class Builder {
        private final Map<String, Map<String, List<Connection>>> map = new LinkedHashMap<>();

        private Builder() {}

        public Builder connect(String source, String target) {
            return connect(source, MAIN, new Connection(target, 0, null));
        }

        public Builder connect(String source, String branchTag, String target) {
            return connect(source, branchTag, new Connection(target, 0, null));
        }

        public Builder connect(String source, String branchTag, Connection connection) {
            map.computeIfAbsent(source, k -> new LinkedHashMap<>())
                    .computeIfAbsent(branchTag, k -> new ArrayList<>())
                    .add(connection);
            return this;
        }

        public ConnectionMap build() {
            return new ConnectionMap(map);
        }
    }
}
