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

package org.fireflyframework.automation.unit.core;

import org.fireflyframework.automation.core.exception.TopologyValidationException;
import org.fireflyframework.automation.core.topology.TopologyBuilder;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class TopologyBuilderTest {

    record Item(String id, List<String> preds) {}

    @Test
    void buildLayers_groupsIndependentNodes() {
        List<Item> items = List.of(
                new Item("a", List.of()),
                new Item("b", List.of("a")),
                new Item("c", List.of("a")),
                new Item("d", List.of("b", "c")));

        List<List<String>> layers = TopologyBuilder.buildLayers(items, Item::id, Item::preds);

        assertThat(layers).containsExactly(List.of("a"), List.of("b", "c"), List.of("d"));
    }

    @Test
    void duplicatePredecessors_countedOnce() {
        List<Item> items = List.of(
                new Item("a", List.of()),
                new Item("b", List.of("a", "a")));

        assertThat(TopologyBuilder.topologicalOrder(items, Item::id, Item::preds)).containsExactly("a", "b");
    }

    @Test
    void cycle_rejected() {
        List<Item> items = List.of(
                new Item("a", List.of("c")),
                new Item("b", List.of("a")),
                new Item("c", List.of("b")));

        assertThatThrownBy(() -> TopologyBuilder.buildLayers(items, Item::id, Item::preds))
                .isInstanceOf(TopologyValidationException.class)
                .hasMessageContaining("Cycle detected");
    }

    @Test
    void unknownPredecessor_rejected() {
        List<Item> items = List.of(new Item("a", List.of("ghost")));

        assertThatThrownBy(() -> TopologyBuilder.validate(items, Item::id, Item::preds))
                .isInstanceOf(TopologyValidationException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void findCycle_returnsPathInEdgeOrder() {
        Map<String, List<String>> preds = new LinkedHashMap<>();
        preds.put("a", List.of("c"));
        preds.put("b", List.of("a"));
        preds.put("c", List.of("b"));

        List<String> cycle = TopologyBuilder.findCycle(preds);

        assertThat(cycle).containsExactly("a", "b", "c", "a");
    }

    @Test
    void findCycle_emptyForDag() {
        Map<String, List<String>> preds = Map.of("a", List.of(), "b", List.of("a"));
        assertThat(TopologyBuilder.findCycle(preds)).isEmpty();
    }

    @Test
    void findCycle_toleratesPredecessorsWithoutEntries() {
        Map<String, Set<String>> preds = new LinkedHashMap<>();
        preds.put("b", Set.of("a"));
        preds.put("c", Set.of("b", "external"));

        assertThat(TopologyBuilder.findCycle(preds)).isEmpty();
    }
}
