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

package org.fireflyframework.automation.client;

import java.time.Duration;

/**
 * How often a client refreshes an execution snapshot, and for how long.
 *
 * @param runningInterval delay between polls while the execution is queued or running
 * @param waitingInterval delay between polls while it waits for input
 * @param maxAttempts     polls before the client gives up and reports a timeout
 */
public record ExecutionPollingPolicy(Duration runningInterval, Duration waitingInterval, int maxAttempts) {

    private static final Duration DEFAULT_RUNNING = Duration.ofSeconds(1);
    private static final Duration DEFAULT_WAITING = Duration.ofSeconds(2);

    public static final ExecutionPollingPolicy DEFAULT =
            new ExecutionPollingPolicy(DEFAULT_RUNNING, DEFAULT_WAITING, 300);

    public ExecutionPollingPolicy {
        runningInterval = runningInterval != null ? runningInterval : DEFAULT_RUNNING;
        waitingInterval = waitingInterval != null ? waitingInterval : DEFAULT_WAITING;
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
}
