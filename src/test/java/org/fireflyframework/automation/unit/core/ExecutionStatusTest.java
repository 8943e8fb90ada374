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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.core.model.StepStatus;
import org.fireflyframework.automation.core.model.TriggerType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ExecutionStatusTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void lifecycleTransitions() {
        assertThat(ExecutionStatus.QUEUED.canTransitionTo(ExecutionStatus.RUNNING)).isTrue();
        assertThat(ExecutionStatus.QUEUED.canTransitionTo(ExecutionStatus.COMPLETED)).isFalse();
        assertThat(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.WAITING)).isTrue();
        assertThat(ExecutionStatus.WAITING.canTransitionTo(ExecutionStatus.RUNNING)).isTrue();
        assertThat(ExecutionStatus.WAITING.canTransitionTo(ExecutionStatus.CANCELLED)).isTrue();
        assertThat(ExecutionStatus.WAITING.canTransitionTo(ExecutionStatus.COMPLETED)).isFalse();
        for (ExecutionStatus next : ExecutionStatus.values()) {
            assertThat(ExecutionStatus.COMPLETED.canTransitionTo(next)).isFalse();
            assertThat(ExecutionStatus.CANCELLED.canTransitionTo(next)).isFalse();
        }
    }

    @Test
    void controlGuards() {
        assertThat(ExecutionStatus.RUNNING.canPause()).isTrue();
        assertThat(ExecutionStatus.WAITING.canPause()).isFalse();
        assertThat(ExecutionStatus.WAITING.canResume()).isTrue();
        assertThat(ExecutionStatus.RUNNING.canResume()).isFalse();
        assertThat(ExecutionStatus.RUNNING.canTerminate()).isTrue();
        assertThat(ExecutionStatus.WAITING.canTerminate()).isTrue();
        assertThat(ExecutionStatus.QUEUED.canTerminate()).isFalse();
        assertThat(ExecutionStatus.ERRORED.canTerminate()).isFalse();
    }

    @Test
    void serializesToLowerCaseWireValues() throws Exception {
        assertThat(mapper.writeValueAsString(ExecutionStatus.ERRORED)).isEqualTo("\"errored\"");
        assertThat(mapper.writeValueAsString(StepStatus.RETRYING)).isEqualTo("\"retrying\"");
        assertThat(mapper.writeValueAsString(TriggerType.WEBHOOK)).isEqualTo("\"webhook\"");
        assertThat(mapper.readValue("\"waiting\"", ExecutionStatus.class)).isEqualTo(ExecutionStatus.WAITING);
        assertThat(mapper.readValue("\"skipped\"", StepStatus.class)).isEqualTo(StepStatus.SKIPPED);
    }

    @Test
    void unknownWireValue_rejected() {
        assertThatThrownBy(() -> ExecutionStatus.fromValue("paused"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
