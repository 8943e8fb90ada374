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

import org.fireflyframework.automation.core.model.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void noRetry_allowsSingleAttempt() {
        assertThat(RetryPolicy.NO_RETRY.maxAttempts()).isEqualTo(1);
        assertThat(RetryPolicy.NO_RETRY.shouldRetry(1)).isFalse();
    }

    @Test
    void shouldRetry_untilMaxAttemptsReached() {
        RetryPolicy policy = RetryPolicy.fixed(3, Duration.ofMillis(10));
        assertThat(policy.shouldRetry(1)).isTrue();
        assertThat(policy.shouldRetry(2)).isTrue();
        assertThat(policy.shouldRetry(3)).isFalse();
    }

    @Test
    void fixedBackoff_returnsSameDelay() {
        RetryPolicy policy = RetryPolicy.fixed(4, Duration.ofMillis(250));
        assertThat(policy.isExponential()).isFalse();
        assertThat(policy.calculateDelay(0)).isEqualTo(Duration.ofMillis(250));
        assertThat(policy.calculateDelay(2)).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void exponentialBackoff_doublesAndCapsAtMaxDelay() {
        RetryPolicy policy = RetryPolicy.exponential(6, Duration.ofSeconds(1), Duration.ofSeconds(3));
        assertThat(policy.calculateDelay(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.calculateDelay(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.calculateDelay(2)).isEqualTo(Duration.ofSeconds(3));
        assertThat(policy.calculateDelay(5)).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void jitter_staysWithinBounds() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1000), Duration.ofMillis(1000), 1.0, 0.5);
        for (int i = 0; i < 50; i++) {
            assertThat(policy.calculateDelay(0).toMillis()).isBetween(500L, 1500L);
        }
    }

    @Test
    void missingMultiplier_defaultsToFixed() {
        RetryPolicy policy = new RetryPolicy(2, Duration.ofMillis(100), null, 0.0, 0.0);
        assertThat(policy.multiplier()).isEqualTo(1.0);
        assertThat(policy.maxDelay()).isEqualTo(Duration.ofMillis(100));
    }

    @Test
    void maxDelayBelowInitial_isClamped() {
        RetryPolicy policy = new RetryPolicy(2, Duration.ofSeconds(2), Duration.ofSeconds(1), 2.0, 0.0);
        assertThat(policy.maxDelay()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void invalidArguments_rejected() {
        assertThatThrownBy(() -> RetryPolicy.fixed(0, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(2, Duration.ZERO, Duration.ZERO, 0.5, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(2, Duration.ZERO, Duration.ZERO, 1.0, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
