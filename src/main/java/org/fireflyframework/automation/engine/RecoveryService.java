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

package org.fireflyframework.automation.engine;

import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.persistence.ExecutionPersistenceProvider;
import org.fireflyframework.automation.persistence.WorkflowExecution;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Picks up executions left behind by a stopped process and purges old terminal ones.
 *
 * <p>A running or queued execution whose record has not changed for longer than the
 * stale threshold is handed back to the scheduler, which recomputes the ready set from
 * the persisted results. The node that was in flight runs again: its open attempt row
 * is closed as interrupted and numbering continues after it.
 */
@Slf4j
public class RecoveryService {

    static final Duration DEFAULT_RETENTION = Duration.ofDays(7);

    private final ExecutionPersistenceProvider persistence;
    private final ExecutionScheduler scheduler;
    private final Duration staleThreshold;
    private final Duration retention;

    public RecoveryService(ExecutionPersistenceProvider persistence, ExecutionScheduler scheduler,
                           Duration staleThreshold) {
        this(persistence, scheduler, staleThreshold, DEFAULT_RETENTION);
    }

    public RecoveryService(ExecutionPersistenceProvider persistence, ExecutionScheduler scheduler,
                           Duration staleThreshold, Duration retention) {
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(staleThreshold, "staleThreshold must not be null");
        if (staleThreshold.isNegative() || staleThreshold.isZero()) {
            throw new IllegalArgumentException("staleThreshold must be positive, got: " + staleThreshold);
        }
        this.staleThreshold = staleThreshold;
        this.retention = retention != null ? retention : DEFAULT_RETENTION;
    }

    public Flux<WorkflowExecution> findStaleExecutions() {
        Instant cutoff = Instant.now().minus(staleThreshold);
        return Flux.concat(persistence.findByStatus(ExecutionStatus.RUNNING),
                        persistence.findByStatus(ExecutionStatus.QUEUED))
                .filter(e -> e.updatedAt() == null || e.updatedAt().isBefore(cutoff));
    }

    /**
     * Resumes traversal of every stale running or queued execution and emits the state each
     * one reached.
     */
    public Flux<WorkflowExecution> recoverStaleExecutions() {
        return findStaleExecutions()
                .doOnNext(e -> log.info("[recovery] resuming stale execution executionId={} workflowId={}",
                        e.id(), e.workflowId()))
                .concatMap(e -> scheduler.run(e.id())
                        .onErrorResume(err -> {
                            log.error("[recovery] could not resume executionId={}", e.id(), err);
                            return Mono.empty();
                        }));
    }

    /** Purges terminal executions older than the configured retention. */
    public Mono<Long> cleanupCompletedExecutions() {
        return cleanupCompletedExecutions(retention);
    }

    public Mono<Long> cleanupCompletedExecutions(Duration olderThan) {
        return persistence.cleanup(olderThan)
                .doOnNext(count -> log.info("[recovery] cleaned up {} completed executions older than {}", count, olderThan))
                .doOnError(err -> log.error("[recovery] cleanup failed for duration {}", olderThan, err));
    }
}
