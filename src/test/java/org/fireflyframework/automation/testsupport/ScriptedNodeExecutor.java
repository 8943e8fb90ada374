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

package org.fireflyframework.automation.testsupport;

import org.fireflyframework.automation.graph.NodeDefinition;
import org.fireflyframework.automation.step.NodeExecutor;
import org.fireflyframework.automation.step.NodeInput;
import org.fireflyframework.automation.step.StepResult;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Node executor for tests. By default a node echoes its parameters as
 * {@code {node, params}}; individual nodes can be scripted.
 */
public class ScriptedNodeExecutor implements NodeExecutor {

    public static final String TYPE = "test-action";

    private final Map<String, Function<NodeInput, Mono<StepResult>>> scripts = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final Queue<String> invocations = new ConcurrentLinkedQueue<>();
    private final Map<String, NodeInput> lastInputs = new ConcurrentHashMap<>();

    @Override
    public Set<String> types() {
        return Set.of(TYPE);
    }

    @Override
    public Mono<StepResult> execute(NodeDefinition node, NodeInput input) {
        invocations.add(node.id());
        lastInputs.put(node.id(), input);
        calls.computeIfAbsent(node.id(), k -> new AtomicInteger()).incrementAndGet();
        Function<NodeInput, Mono<StepResult>> script = scripts.get(node.id());
        if (script != null) {
            return script.apply(input);
        }
        return Mono.just(StepResult.success(Map.of("node", node.id(), "params", input.parameters())));
    }

    public ScriptedNodeExecutor script(String nodeId, Function<NodeInput, Mono<StepResult>> script) {
        scripts.put(nodeId, script);
        return this;
    }

    /** Fails retryably the first {@code failures} calls, then succeeds with {@code output}. */
    public ScriptedNodeExecutor failTimes(String nodeId, int failures, Object output) {
        AtomicInteger seen = new AtomicInteger();
        return script(nodeId, input -> seen.incrementAndGet() <= failures
                ? Mono.just(StepResult.failure("transient failure " + seen.get()))
                : Mono.just(StepResult.success(output)));
    }

    public int calls(String nodeId) {
        AtomicInteger count = calls.get(nodeId);
        return count != null ? count.get() : 0;
    }

    public List<String> invocations() {
        return List.copyOf(invocations);
    }

    public NodeInput lastInput(String nodeId) {
        return lastInputs.get(nodeId);
    }
}
