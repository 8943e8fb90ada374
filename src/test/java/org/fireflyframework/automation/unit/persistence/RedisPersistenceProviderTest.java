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

package org.fireflyframework.automation.unit.persistence;

import org.fireflyframework.automation.core.exception.PersistenceException;
import org.fireflyframework.automation.core.model.StepStatus;
import org.fireflyframework.automation.persistence.ExecutionSerializer;
import org.fireflyframework.automation.persistence.StepLog;
import org.fireflyframework.automation.persistence.redis.RedisPersistenceProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.ReactiveHashOperations;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RedisPersistenceProviderTest {

    private static final String EXECUTION_ID = "e1";
    private static final String STEPS_KEY = "automation:steps:" + EXECUTION_ID;

    private final ExecutionSerializer serializer = new ExecutionSerializer();
    private ReactiveRedisTemplate<String, String> template;
    private ReactiveHashOperations<String, String, String> hash;
    private RedisPersistenceProvider provider;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        template = mock(ReactiveRedisTemplate.class);
        hash = mock(ReactiveHashOperations.class);
        doReturn(hash).when(template).opsForHash();
        provider = new RedisPersistenceProvider(template, serializer, "automation:", null, 2);
    }

    private String row(StepStatus status) {
        return serializer.serialize(StepLog.started(EXECUTION_ID, "work", "work", status, 1, Map.of())
                .withIdentity("row-1", 1));
    }

    private static StepLog close(StepLog row) {
        return row.status().isActive() ? row.failed(StepStatus.ERROR, StepLog.CANCELLED_MESSAGE, Instant.now()) : row;
    }

    // ── Step log updates ──────────────────────────────────────────

    @Test
    void updateStepLog_reappliesTheMutationAfterAConcurrentWrite() {
        String first = row(StepStatus.RUNNING);
        String second = row(StepStatus.RETRYING);
        when(hash.get(STEPS_KEY, "1")).thenReturn(Mono.just(first), Mono.just(second));
        doReturn(Flux.just(0L), Flux.just(1L)).when(template)
                .execute(any(RedisScript.class), anyList(), anyList());
        AtomicInteger applied = new AtomicInteger();

        StepVerifier.create(provider.updateStepLog(EXECUTION_ID, 1, r -> {
                    applied.incrementAndGet();
                    return close(r);
                }))
                .assertNext(updated -> {
                    assertThat(updated.status()).isEqualTo(StepStatus.ERROR);
                    assertThat(updated.error()).isEqualTo(StepLog.CANCELLED_MESSAGE);
                })
                .verifyComplete();

        assertThat(applied).hasValue(2);
        verify(template).execute(any(RedisScript.class), eq(List.of(STEPS_KEY)),
                argThat(args -> args.size() == 3 && "1".equals(args.get(0)) && second.equals(args.get(1))));
        verify(hash, never()).put(anyString(), anyString(), anyString());
    }

    @Test
    void updateStepLog_givesUpAfterRepeatedConflicts() {
        when(hash.get(STEPS_KEY, "1")).thenReturn(Mono.fromSupplier(() -> row(StepStatus.RUNNING)));
        doReturn(Flux.just(0L)).when(template).execute(any(RedisScript.class), anyList(), anyList());

        StepVerifier.create(provider.updateStepLog(EXECUTION_ID, 1, RedisPersistenceProviderTest::close))
                .expectError(PersistenceException.class)
                .verify();

        verify(template, times(3)).execute(any(RedisScript.class), anyList(), anyList());
    }

    @Test
    void updateStepLog_missingRowIsEmpty() {
        when(hash.get(STEPS_KEY, "9")).thenReturn(Mono.empty());

        StepVerifier.create(provider.updateStepLog(EXECUTION_ID, 9, RedisPersistenceProviderTest::close))
                .verifyComplete();

        verify(template, never()).execute(any(RedisScript.class), anyList(), anyList());
    }

    @Test
    void updateStepLog_unchangedRowIsNotWritten() {
        when(hash.get(STEPS_KEY, "1")).thenReturn(Mono.just(row(StepStatus.SUCCESS)));

        StepVerifier.create(provider.updateStepLog(EXECUTION_ID, 1, RedisPersistenceProviderTest::close))
                .assertNext(r -> assertThat(r.status()).isEqualTo(StepStatus.SUCCESS))
                .verifyComplete();

        verify(template, never()).execute(any(RedisScript.class), anyList(), anyList());
    }
}
