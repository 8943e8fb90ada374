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

package org.fireflyframework.automation.step.builtin;

import org.fireflyframework.automation.graph.NodeDefinition;
import org.fireflyframework.automation.step.NodeExecutor;
import org.fireflyframework.automation.step.NodeInput;
import org.fireflyframework.automation.step.ParameterInterpolator;
import org.fireflyframework.automation.step.StepResult;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Selects the outgoing branch of condition and switch nodes.
 *
 * <p>Predicate form, for both kinds:
 * <pre>{@code
 * { "conditions": [ { "field": "trigger.data.amount", "operator": "greaterThan",
 *                     "value": 100, "branch": "large" } ],
 *   "defaultBranch": "small" }
 * }</pre>
 * The first matching condition wins; with no match the default branch (or
 * {@code "default"}) is selected. Switch nodes may instead give {@code value} and a
 * list of {@code cases}; a case is either a branch tag compared to the value or a
 * {@code {value, branch}} pair.
 */
public class ConditionNodeExecutor implements NodeExecutor {

    static final String DEFAULT_BRANCH = "default";

    @Override
    public Set<String> types() {
        return Set.of("condition", "switch", "if", "router");
    }

    @Override
    public Mono<StepResult> execute(NodeDefinition node, NodeInput input) {
        return Mono.fromCallable(() -> evaluate(input));
    }

    private StepResult evaluate(NodeInput input) {
        Map<String, Object> params = input.parameters();
        String defaultBranch = params.get("defaultBranch") instanceof String s && !s.isBlank() ? s : DEFAULT_BRANCH;

        if (params.get("cases") instanceof List<?> cases) {
            return evaluateCases(resolveField(params.get("value"), input), cases, defaultBranch);
        }

        if (!(params.get("conditions") instanceof List<?> conditions)) {
            return StepResult.fatal("Condition node requires a 'conditions' or 'cases' parameter");
        }
        for (int i = 0; i < conditions.size(); i++) {
            if (!(conditions.get(i) instanceof Map<?, ?> condition)) {
                return StepResult.fatal("Condition " + i + " must be an object");
            }
            Object branchValue = condition.get("branch") != null ? condition.get("branch") : condition.get("outputBranch");
            if (!(condition.get("operator") instanceof String opName) || branchValue == null) {
                return StepResult.fatal("Condition " + i + " requires 'operator' and 'branch'");
            }
            ConditionOperator operator;
            try {
                operator = ConditionOperator.fromValue(opName);
            } catch (IllegalArgumentException e) {
                return StepResult.fatal(e.getMessage());
            }
            Object actual = resolveField(condition.get("field"), input);
            if (operator.test(actual, condition.get("value"))) {
                return selected(branchValue.toString(), true, i, actual);
            }
        }
        return selected(defaultBranch, false, -1, null);
    }

    private StepResult evaluateCases(Object actual, List<?> cases, String defaultBranch) {
        for (int i = 0; i < cases.size(); i++) {
            Object c = cases.get(i);
            if (c instanceof Map<?, ?> pair) {
                if (ConditionOperator.EQUALS.test(actual, pair.get("value")) && pair.get("branch") != null) {
                    return selected(pair.get("branch").toString(), true, i, actual);
                }
            } else if (c != null && ConditionOperator.EQUALS.test(actual, c)) {
                return selected(c.toString(), true, i, actual);
            }
        }
        return selected(defaultBranch, false, -1, actual);
    }

    private static StepResult selected(String branch, boolean matched, int index, Object value) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("branch", branch);
        output.put("matched", matched);
        if (index >= 0) output.put("matchedIndex", index);
        if (value != null) output.put("value", value);
        return StepResult.branch(branch, output);
    }

    /**
     * A field naming a {@code trigger.} or {@code steps.} path is looked up in the
     * context; any other value is taken literally.
     */
    private static Object resolveField(Object field, NodeInput input) {
        if (field instanceof String path && (path.startsWith("trigger.") || path.startsWith("steps."))) {
            return ParameterInterpolator.resolve(input.context(), path).orElse(null);
        }
        return field;
    }
}
