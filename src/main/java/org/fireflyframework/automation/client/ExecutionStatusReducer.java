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

import org.fireflyframework.automation.persistence.WorkflowExecution;

/**
 * Folds server snapshots into a {@link ClientExecutionView}. Pure: no I/O and no
 * shared state, so several executions can be tracked side by side.
 */
public final class ExecutionStatusReducer {

    private ExecutionStatusReducer() {
    }

    /**
     * Applies one poll result. Snapshots of another execution and polls after the
     * view finished leave it unchanged.
     */
    public static ClientExecutionView reduce(ClientExecutionView view, WorkflowExecution snapshot) {
        if (view.isFinished() || snapshot == null || !view.executionId().equals(snapshot.id())) {
            return view;
        }
        int attempts = view.attempts() + 1;
        boolean timedOut = !snapshot.isTerminal() && attempts >= view.policy().maxAttempts();
        return new ClientExecutionView(view.executionId(), snapshot.status(), snapshot.currentStep(),
                snapshot.completedSteps(), snapshot.error(), attempts, timedOut, view.policy());
    }

    /** Records a failed poll; it counts towards the attempt cap but keeps the last status. */
    public static ClientExecutionView pollFailed(ClientExecutionView view) {
        if (view.isFinished()) {
            return view;
        }
        int attempts = view.attempts() + 1;
        return new ClientExecutionView(view.executionId(), view.status(), view.currentStep(),
                view.completedSteps(), view.error(), attempts, attempts >= view.policy().maxAttempts(), view.policy());
    }
}
