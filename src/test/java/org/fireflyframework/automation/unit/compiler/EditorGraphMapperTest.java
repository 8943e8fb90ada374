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

package org.fireflyframework.automation.unit.compiler;

import org.fireflyframework.automation.compiler.ExecutionPlan;
import org.fireflyframework.automation.compiler.WorkflowCompiler;
import org.fireflyframework.automation.compiler.editor.EditorEdge;
import org.fireflyframework.automation.compiler.editor.EditorGraph;
import org.fireflyframework.automation.compiler.editor.EditorGraphMapper;
import org.fireflyframework.automation.compiler.editor.EditorNode;
import org.fireflyframework.automation.graph.Edge;
import org.fireflyframework.automation.graph.NodeDefinition;
import org.fireflyframework.automation.graph.NodeKind;
import org.fireflyframework.automation.graph.NodePosition;
import org.fireflyframework.automation.graph.WorkflowDefinition;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class EditorGraphMapperTest {

    private final WorkflowCompiler compiler = new WorkflowCompiler();
    private final EditorGraphMapper mapper = new EditorGraphMapper();

    @Test
    void compileThenDecompile_preservesNodesConnectionsAndBranches() {
        WorkflowDefinition original = WorkflowDefinition.builder("wf")
                .name("Orders")
                .trigger("start")
                .switchNode("route", Map.of("value", "{{trigger.data.kind}}", "cases", List.of("a", "b")))
                .action("handleA", "http-request", Map.of("url", "https://a.example"))
                .action("handleB", "http-request", Map.of("url", "https://b.example"))
                .node(NodeDefinition.of("audit", NodeKind.ACTION, "log", Map.of()).withDisabled(true))
                .connect("start", "route")
                .connect("route", "b", "handleB")
                .connect("route", "a", "handleA")
                .connect("handleA", "audit")
                .connect("handleB", "audit")
                .build();
        ExecutionPlan plan = compiler.compileOrThrow(original);

        EditorGraph editor = mapper.fromPlan(plan, original.name(), original.description());
        WorkflowDefinition restored = mapper.toDefinition(editor, "wf", null);
        ExecutionPlan replanned = compiler.compileOrThrow(restored);

        assertThat(replanned.nodes().keySet()).isEqualTo(plan.nodes().keySet());
        assertThat(new HashSet<>(replanned.edges())).isEqualTo(new HashSet<>(plan.edges()));
        assertThat(replanned.outgoing("route").keySet()).containsExactlyInAnyOrder("a", "b");
        assertThat(replanned.node("handleA").type()).isEqualTo("http-request");
        assertThat(replanned.node("handleA").parameters()).containsEntry("url", "https://a.example");
        assertThat(replanned.node("audit").disabled()).isTrue();
        assertThat(replanned.node("route").kind()).isEqualTo(NodeKind.SWITCH);
    }

    @Test
    void fromPlan_usesNullHandleForMain() {
        WorkflowDefinition def = WorkflowDefinition.builder("wf")
                .trigger("start")
                .action("a", "noop", Map.of())
                .connect("start", "a")
                .build();

        EditorGraph editor = mapper.fromPlan(compiler.compileOrThrow(def), "wf", "");

        assertThat(editor.edges()).singleElement().satisfies(e -> {
            assertThat(e.sourceHandle()).isNull();
            assertThat(e.id()).isEqualTo("start-main-a");
        });
        assertThat(editor.nodes()).extracting(EditorNode::type).containsExactly("trigger", "action");
    }

    @Test
    void toDefinition_readsTypeAndLabelFromData() {
        EditorGraph editor = new EditorGraph("Imported", "from the editor",
                List.of(
                        new EditorNode("t", "trigger", null, null, new NodePosition(0, 0),
                                Map.of("nodeType", "webhook-trigger", "label", "Incoming")),
                        new EditorNode("c", "condition", null, null, new NodePosition(100, 0),
                                Map.of("conditions", List.of()))),
                List.of(
                        new EditorEdge("e1", "t", "c", null, null, null),
                        new EditorEdge("e2", "c", "t", "loop", "2", null)));

        WorkflowDefinition def = mapper.toDefinition(editor, "imported", "alice");

        NodeDefinition trigger = def.findNode("t").orElseThrow();
        assertThat(trigger.type()).isEqualTo("webhook-trigger");
        assertThat(trigger.name()).isEqualTo("Incoming");
        assertThat(trigger.parameters()).doesNotContainKeys("nodeType", "label");
        assertThat(def.owner()).isEqualTo("alice");
        assertThat(def.connections().edges())
                .extracting(Edge::branchTag, Edge::targetInputIndex)
                .contains(tuple("main", 0), tuple("loop", 2));
    }
}
