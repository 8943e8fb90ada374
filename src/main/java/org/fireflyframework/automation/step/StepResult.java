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

package org.fireflyframework.automation.step;

/**
 * What a {@link NodeExecutor} reports back for one attempt.
 *
 * <p>Executors never retry themselves. A retryable {@link Failure} is retried by the
 * engine according to the node's retry policy; a non-retryable one fails the node at once.
 */
public sealed interface StepResult permits StepResult.Success, StepResult.Failure {

    record Success(Object output, String branch) implements StepResult {}

    record Failure(String error, boolean retryable) implements StepResult {}

    static StepResult success(Object output) {
        return new Success(output, null);
    }

    /** Success of a condition or switch node that selected {@code branch}. */
    static StepResult branch(String branch, Object output) {
        return new Success(output, branch);
    }

    static StepResult failure(String error) {
        return new Failure(error, true);
    }

    static StepResult fatal(String error) {
        return new Failure(error, false);
    }
}
