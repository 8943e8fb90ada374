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

package org.fireflyframework.automation.unit.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.automation.core.model.RetryPolicy;
import org.fireflyframework.automation.graph.Connection;
import org.fireflyframework.automation.graph.ConnectionMap;
import org.fireflyframework.automation.graph.Edge;
import org.fireflyframework.automation.graph.NodeDefinition;
import org.fireflyframework.automation.graph.NodeKind;
import org.fireflyframework.automation.graph.WorkflowDefinition;
import org.fireflyframework.automation.persistence.ExecutionSerializer;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class WorkflowDefinitionJsonTest {

    private final ObjectMapper mapper = ExecutionSerializer.defaultMapper();

    private static final String ORDERS_JSON = """
            {
              "id": "orders",
              "owner": "alice",
              "active": true,
              "nodes": [
                {"id": "start", "kind": "trigger", "type": "webhook-trigger"},
                {"id": "route", "kind": "switch", "parameters": {"value": "trigger.data.kind", "cases": ["a", "b"]}},
                {"id": "handleA", "kind": "action", "type": "http-request", "timeoutMs": 500},
                {"id": "handleB", "kind": "AI_AGENT", "type": "summarize", "disabled": true}
              ],
              "connections": {
                "start": {"main": [{"targetNodeId": "route"}]},
                "route": {
                  "b": [{"targetNodeId": "handleB", "label": "second"}],
                  "a": [{"targetNodeId": "handleA", "targetInputIndex": 0}]
                }
              }
            }
            """;

    @Test
    void parsesAuthoredJson() throws Exception {
        WorkflowDefinition definition = mapper.readValue(ORDERS_JSON, WorkflowDefinition.class);

        assertThat(definition.name()).isEqualTo("orders");
        assertThat(definition.description()).isEmpty();
        assertThat(definition.nodes()).extracting(NodeDefinition::kind)
                .containsExactly(NodeKind.TRIGGER, NodeKind.SWITCH, NodeKind.ACTION, NodeKind.AI_AGENT);

        NodeDefinition route = definition.findNode("route").orElseThrow();
        assertThat(route.type()).isEqualTo("switch");
        assertThat(route.isConditional()).isTrue();
        assertThat(route.retryPolicy()).isEqualTo(RetryPolicy.NO_RETRY);
        assertThat(definition.findNode("handleA").orElseThrow().timeoutMs()).isEqualTo(500);
        assertThat(definition.findNode("handleB").orElseThrow().disabled()).isTrue();
    }

    @Test
    void connections_keepDeclaredBranchOrder() throws Exception {
        WorkflowDefinition definition = mapper.readValue(ORDERS_JSON, WorkflowDefinition.class);

        assertThat(definition.connections().groups("route").keySet()).containsExactly("b", "a");
        assertThat(definition.connections().connections("route", "b"))
                .containsExactly(new Connection("handleB", 0, "second"));
        assertThat(definition.connections().edges()).extracting(Edge::target)
                .containsExactly("route", "handleB", "handleA");
        assertThat(definition.connections().edges().get(0).isMain()).isTrue();
    }

    @Test
    void serialization_omitsDerivedFlags() throws Exception {
        WorkflowDefinition definition = WorkflowDefinition.builder("orders")
                .trigger("start")
                .action("work", "http-request", Map.of("url", "https://example.org"))
                .connect("start", "work")
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(definition));

        JsonNode start = json.get("nodes").get(0);
        assertThat(start.get("kind").asText()).isEqualTo("trigger");
        assertThat(start.has("trigger")).isFalse();
        assertThat(start.has("conditional")).isFalse();
        assertThat(json.at("/connections/start/main/0/targetNodeId").asText()).isEqualTo("work");
        assertThat(mapper.treeToValue(json, WorkflowDefinition.class)).isEqualTo(definition);
    }

    @Test
    void unknownNodeKind_isRejected() {
        assertThatThrownBy(() -> NodeKind.fromValue("loop"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("loop");
    }

    @Test
    void connection_requiresTarget() {
        assertThatThrownBy(() -> ConnectionMap.builder().connect("a", ConnectionMap.MAIN, new Connection(" ", 0, null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new Connection("b", -3, null).targetInputIndex()).isZero();
        assertThat(ConnectionMap.empty().isEmpty()).isTrue();
        assertThat(ConnectionMap.builder().connect("a", "b").build().connections("a", ConnectionMap.MAIN))
                .containsExactly(Connection.to("b"));
    }
}
