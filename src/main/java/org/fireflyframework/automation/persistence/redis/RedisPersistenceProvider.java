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

package org.fireflyframework.automation.persistence.redis;

import org.fireflyframework.automation.core.exception.AutomationException;
import org.fireflyframework.automation.core.exception.ExecutionNotFoundException;
import org.fireflyframework.automation.core.exception.PersistenceException;
import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.persistence.ExecutionPersistenceProvider;
import org.fireflyframework.automation.persistence.ExecutionSerializer;
import org.fireflyframework.automation.persistence.StepLog;
import org.fireflyframework.automation.persistence.WorkflowExecution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Redis-based implementation of {@link ExecutionPersistenceProvider}.
 *
 * <p>Redis key structure:
 * <ul>
 *   <li>{@code {prefix}execution:{id}} serialized execution</li>
 *   <li>{@code {prefix}revision:{id}} current revision, guarded by a compare-and-set script</li>
 *   <li>{@code {prefix}instance:{workflowId}:{instanceId}} execution id for idempotent starts</li>
 *   <li>{@code {prefix}workflow:{workflowId}} set of execution ids</li>
 *   <li>{@code {prefix}steps:{id}} hash of step logs keyed by sequence</li>
 *   <li>{@code {prefix}steps-seq:{id}} step log sequence counter</li>
 * </ul>
 *
 * <p>Updates read, mutate and write back only when the revision is unchanged; a
 * concurrent writer causes the update to be re-read and re-applied. Step log rows
 * are guarded the same way, comparing the stored row itself.
 */
@Slf4j
public class RedisPersistenceProvider implements ExecutionPersistenceProvider {

    static final RedisScript<Long> COMPARE_AND_SET = RedisScript.of(
            "local cur = redis.call('GET', KEYS[2])\n" +
            "if cur == false then return -1 end\n" +
            "if cur ~= ARGV[1] then return 0 end\n" +
            "redis.call('SET', KEYS[1], ARGV[2])\n" +
            "redis.call('SET', KEYS[2], ARGV[3])\n" +
            "return 1", Long.class);

    static final RedisScript<Long> STEP_COMPARE_AND_SET = RedisScript.of(
            "local cur = redis.call('HGET', KEYS[1], ARGV[1])\n" +
            "if cur == false then return -1 end\n" +
            "if cur ~= ARGV[2] then return 0 end\n" +
            "redis.call('HSET', KEYS[1], ARGV[1], ARGV[3])\n" +
            "return 1", Long.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ExecutionSerializer serializer;
    private final String keyPrefix;
    private final Duration keyTtl;
    private final int writeConflictRetries;

    public RedisPersistenceProvider(ReactiveRedisTemplate<String, String> redisTemplate,
                                    ExecutionSerializer serializer,
                                    String keyPrefix,
                                    Duration keyTtl,
                                    int writeConflictRetries) {
        this.redisTemplate = redisTemplate;
        this.serializer = serializer;
        this.keyPrefix = keyPrefix != null ? keyPrefix : "automation:";
        this.keyTtl = keyTtl;
        this.writeConflictRetries = Math.max(0, writeConflictRetries);
        log.info("[persistence] RedisPersistenceProvider initialized with prefix: {}", this.keyPrefix);
    }

    public RedisPersistenceProvider(ReactiveRedisTemplate<String, String> redisTemplate,
                                    ExecutionSerializer serializer) {
        this(redisTemplate, serializer, "automation:", null, 5);
    }

    @Override
    public Mono<WorkflowExecution> create(WorkflowExecution execution) {
        Mono<Boolean> reserve = execution.instanceId() == null
                ? Mono.just(true)
                : redisTemplate.opsForValue().setIfAbsent(instanceKey(execution.workflowId(), execution.instanceId()), execution.id());
        return reserve.flatMap(reserved -> {
                    if (!reserved) {
                        return findByInstanceId(execution.workflowId(), execution.instanceId())
                                .flatMap(existing -> existing.map(Mono::just)
                                        .orElseGet(() -> Mono.error(new PersistenceException(
                                                "Instance " + execution.instanceId() + " reserved but execution missing"))));
                    }
                    String json = serializer.serialize(execution);
                    return redisTemplate.opsForValue().set(executionKey(execution.id()), json)
                            .then(redisTemplate.opsForValue().set(revisionKey(execution.id()), String.valueOf(execution.revision())))
                            .then(redisTemplate.opsForSet().add(workflowKey(execution.workflowId()), execution.id()))
                            .then(expire(executionKey(execution.id()), revisionKey(execution.id())))
                            .thenReturn(execution);
                })
                .doOnSuccess(e -> log.debug("[persistence] Created execution in Redis: {}", e.id()))
                .onErrorMap(this::isRedisFailure, e -> new PersistenceException("Failed to create execution " + execution.id(), e));
    }

    @Override
    public Mono<Optional<WorkflowExecution>> findById(String executionId) {
        return redisTemplate.opsForValue().get(executionKey(executionId))
                .map(json -> Optional.of(serializer.deserializeExecution(json)))
                .defaultIfEmpty(Optional.empty())
                .onErrorMap(this::isRedisFailure, e -> new PersistenceException("Failed to read execution " + executionId, e));
    }

    @Override
    public Mono<Optional<WorkflowExecution>> findByInstanceId(String workflowId, String instanceId) {
        return redisTemplate.opsForValue().get(instanceKey(workflowId, instanceId))
                .flatMap(this::findById)
                .defaultIfEmpty(Optional.empty());
    }

    @Override
    public Mono<WorkflowExecution> update(String executionId, UnaryOperator<WorkflowExecution> mutation) {
        return Mono.defer(() -> findById(executionId).flatMap(opt -> {
                    if (opt.isEmpty()) {
                        return Mono.<WorkflowExecution>error(new ExecutionNotFoundException(executionId));
                    }
                    WorkflowExecution current = opt.get();
                    WorkflowExecution next = mutation.apply(current);
                    if (next == current) {
                        return Mono.just(current);
                    }
                    WorkflowExecution stored = next.withRevision(current.revision() + 1, Instant.now());
                    List<String> keys = List.of(executionKey(executionId), revisionKey(executionId));
                    List<String> args = List.of(String.valueOf(current.revision()), serializer.serialize(stored),
                            String.valueOf(stored.revision()));
                    return redisTemplate.execute(COMPARE_AND_SET, keys, args)
                            .next()
                            .flatMap(result -> {
                                if (result == 1L) return Mono.just(stored);
                                if (result == -1L) return Mono.error(new ExecutionNotFoundException(executionId));
                                return Mono.error(new WriteConflictException(executionId, current.revision()));
                            });
                }))
                .retryWhen(Retry.max(writeConflictRetries)
                        .filter(WriteConflictException.class::isInstance)
                        .doBeforeRetry(s -> log.debug("[persistence] Write conflict on execution {}, retrying", executionId))
                        .onRetryExhaustedThrow((retrySpec, signal) -> new PersistenceException(
                                "Gave up updating execution " + executionId + " after "
                                        + signal.totalRetries() + " write conflicts", signal.failure())))
                .onErrorMap(this::isRedisFailure, e -> new PersistenceException("Failed to update execution " + executionId, e));
    }

    @Override
    public Flux<WorkflowExecution> findByWorkflowId(String workflowId) {
        return redisTemplate.opsForSet().members(workflowKey(workflowId))
                .flatMap(this::findById)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .sort(Comparator.comparing(WorkflowExecution::startedAt, Comparator.nullsLast(Comparator.reverseOrder())));
    }

    @Override
    public Flux<WorkflowExecution> findByStatus(ExecutionStatus status) {
        return scanExecutions().filter(e -> e.status() == status);
    }

    @Override
    public Flux<WorkflowExecution> findInFlight() {
        return scanExecutions().filter(e -> e.status() != null && e.status().isActive());
    }

    @Override
    public Mono<StepLog> appendStepLog(StepLog stepLog) {
        String executionId = stepLog.executionId();
        return redisTemplate.opsForValue().increment(sequenceKey(executionId))
                .flatMap(seq -> {
                    StepLog stored = stepLog.withIdentity(
                            stepLog.id() != null ? stepLog.id() : UUID.randomUUID().toString(), seq);
                    return redisTemplate.opsForHash().put(stepsKey(executionId), String.valueOf(seq), serializer.serialize(stored))
                            .then(expire(stepsKey(executionId), sequenceKey(executionId)))
                            .thenReturn(stored);
                })
                .onErrorMap(this::isRedisFailure, e -> new PersistenceException("Failed to append step log for " + executionId, e));
    }

    @Override
    public Mono<StepLog> updateStepLog(String executionId, long sequence, UnaryOperator<StepLog> mutation) {
        String field = String.valueOf(sequence);
        List<String> keys = List.of(stepsKey(executionId));
        return Mono.defer(() -> redisTemplate.<String, String>opsForHash().get(stepsKey(executionId), field)
                        .flatMap(json -> {
                            StepLog current = serializer.deserializeStepLog(json);
                            StepLog updated = mutation.apply(current);
                            if (updated == current) {
                                return Mono.just(current);
                            }
                            List<String> args = List.of(field, json, serializer.serialize(updated));
                            return redisTemplate.execute(STEP_COMPARE_AND_SET, keys, args)
                                    .next()
                                    .flatMap(result -> {
                                        if (result == 1L) return Mono.just(updated);
                                        if (result == -1L) return Mono.<StepLog>empty();
                                        return Mono.<StepLog>error(new WriteConflictException(
                                                "Step log " + sequence + " of execution " + executionId + " changed concurrently"));
                                    });
                        }))
                .retryWhen(Retry.max(writeConflictRetries)
                        .filter(WriteConflictException.class::isInstance)
                        .doBeforeRetry(s -> log.debug("[persistence] Write conflict on step log {} of execution {}, retrying",
                                sequence, executionId))
                        .onRetryExhaustedThrow((retrySpec, signal) -> new PersistenceException(
                                "Gave up updating step log " + sequence + " of execution " + executionId + " after "
                                        + signal.totalRetries() + " write conflicts", signal.failure())))
                .onErrorMap(this::isRedisFailure, e -> new PersistenceException("Failed to update step log for " + executionId, e));
    }

    @Override
    public Flux<StepLog> findStepLogs(String executionId) {
        return redisTemplate.<String, String>opsForHash().values(stepsKey(executionId))
                .map(serializer::deserializeStepLog)
                .sort(Comparator.comparingLong(StepLog::sequence));
    }

    @Override
    public Mono<Long> cleanup(Duration olderThan) {
        Instant threshold = Instant.now().minus(olderThan);
        return scanExecutions()
                .filter(e -> e.isTerminal() && e.updatedAt() != null && e.updatedAt().isBefore(threshold))
                .flatMap(e -> {
                    Mono<Long> removeInstance = e.instanceId() != null
                            ? redisTemplate.delete(instanceKey(e.workflowId(), e.instanceId()))
                            : Mono.just(0L);
                    return redisTemplate.delete(executionKey(e.id()), revisionKey(e.id()), stepsKey(e.id()), sequenceKey(e.id()))
                            .then(removeInstance)
                            .then(redisTemplate.opsForSet().remove(workflowKey(e.workflowId()), e.id()))
                            .thenReturn(1L);
                })
                .reduce(0L, Long::sum)
                .doOnSuccess(count -> log.info("[persistence] Cleaned up {} executions older than {}", count, olderThan));
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return redisTemplate.opsForValue()
                .set(keyPrefix + "health", "ok", Duration.ofSeconds(10))
                .onErrorReturn(false);
    }

    private Flux<WorkflowExecution> scanExecutions() {
        String pattern = keyPrefix + "execution:*";
        return redisTemplate.scan(ScanOptions.scanOptions().match(pattern).build())
                .flatMap(key -> redisTemplate.opsForValue().get(key))
                .flatMap(json -> {
                    try {
                        return Mono.just(serializer.deserializeExecution(json));
                    } catch (PersistenceException e) {
                        log.warn("[persistence] Skipping unreadable execution document: {}", e.getMessage());
                        return Mono.empty();
                    }
                });
    }

    private Mono<Void> expire(String... keys) {
        if (keyTtl == null) return Mono.empty();
        return Flux.fromArray(keys).flatMap(k -> redisTemplate.expire(k, keyTtl)).then();
    }

    private boolean isRedisFailure(Throwable e) {
        return !(e instanceof AutomationException);
    }

    private String executionKey(String id) { return keyPrefix + "execution:" + id; }
    private String revisionKey(String id) { return keyPrefix + "revision:" + id; }
    private String instanceKey(String workflowId, String instanceId) { return keyPrefix + "instance:" + workflowId + ":" + instanceId; }
    private String workflowKey(String workflowId) { return keyPrefix + "workflow:" + workflowId; }
    private String stepsKey(String id) { return keyPrefix + "steps:" + id; }
    private String sequenceKey(String id) { return keyPrefix + "steps-seq:" + id; }

    static final class WriteConflictException extends RuntimeException {
        WriteConflictException(String executionId, long expectedRevision) {
            this("Revision of execution " + executionId + " changed from " + expectedRevision);
        }

        WriteConflictException(String message) {
            super(message);
        }
    }
}
