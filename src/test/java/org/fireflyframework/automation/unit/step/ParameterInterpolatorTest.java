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

package org.fireflyframework.automation.unit.step;

import org.fireflyframework.automation.persistence.ExecutionSerializer;
import org.fireflyframework.automation.step.ParameterInterpolator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ParameterInterpolatorTest {

    private final ParameterInterpolator interpolator = new ParameterInterpolator(ExecutionSerializer.defaultMapper());

    private final Map<String, Object> context = Map.of(
            "trigger", Map.of("type", "manual", "data", Map.of("apiUrl", "https://api.example", "amount", 150)),
            "steps", Map.of("fetch", Map.of("data", Map.of("users", List.of(
                    Map.of("name", "ada"), Map.of("name", "grace"))))));

    @Test
    void wholePlaceholder_keepsResolvedType() {
        Map<String, Object> result = interpolator.interpolate(Map.of("amount", "{{trigger.data.amount}}"), context);

        assertThat(result.get("amount")).isEqualTo(150);
    }

    @Test
    void embeddedPlaceholder_isRenderedIntoText() {
        Map<String, Object> result = interpolator.interpolate(
                Map.of("url", "{{trigger.data.apiUrl}}/users/{{steps.fetch.data.users[1].name}}"), context);

        assertThat(result.get("url")).isEqualTo("https://api.example/users/grace");
    }

    @Test
    void embeddedCollection_isRenderedAsJson() {
        Object result = interpolator.interpolateValue("first: {{steps.fetch.data.users[0]}}", context);

        assertThat(result).isEqualTo("first: {\"name\":\"ada\"}");
    }

    @Test
    void unresolvedPlaceholder_isLeftUntouched() {
        Map<String, Object> result = interpolator.interpolate(
                Map.of("a", "{{steps.missing.data}}", "b", "x-{{trigger.data.nope}}"), context);

        assertThat(result).containsEntry("a", "{{steps.missing.data}}").containsEntry("b", "x-{{trigger.data.nope}}");
    }

    @Test
    void nestedStructures_areWalked() {
        Map<String, Object> params = Map.of(
                "headers", Map.of("X-Amount", "{{trigger.data.amount}}"),
                "targets", List.of("{{steps.fetch.data.users[0].name}}", "static"));

        Map<String, Object> result = interpolator.interpolate(params, context);

        assertThat(result.get("headers")).isEqualTo(Map.of("X-Amount", 150));
        assertThat(result.get("targets")).isEqualTo(List.of("ada", "static"));
    }

    @Test
    void resolve_handlesIndexesAndMissingSegments() {
        assertThat(ParameterInterpolator.resolve(context, "steps.fetch.data.users[0].name")).contains("ada");
        assertThat(ParameterInterpolator.resolve(context, "steps.fetch.data.users[5].name")).isEmpty();
        assertThat(ParameterInterpolator.resolve(context, "trigger.data.amount[0]")).isEmpty();
        assertThat(ParameterInterpolator.resolve(context, "")).isEmpty();
    }

    @Test
    void nonStringScalars_passThrough() {
        assertThat(interpolator.interpolateValue(42, context)).isEqualTo(42);
        assertThat(interpolator.interpolateValue(true, context)).isEqualTo(true);
        assertThat(interpolator.interpolateValue(null, context)).isNull();
    }
}
