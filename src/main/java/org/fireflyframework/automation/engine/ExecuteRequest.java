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

import org.fireflyframework.automation.core.model.TriggerType;

/**
 * Parameters of a workflow execution.
 *
 * @param triggerType what fired the execution
 * @param payload     trigger data, addressable as {@code trigger.data}
 * @param instanceId  optional idempotency token; repeating it returns the first execution
 * @param entryNodeId optional trigger to start from, all triggers when null
 */
public record ExecuteRequest(TriggerType triggerType, Object payload, String instanceId, String entryNodeId) {

    public ExecuteRequest {
        triggerType = triggerType != null ? triggerType : TriggerType.MANUAL;
    }

    public static ExecuteRequest manual(Object payload) {
        return new ExecuteRequest(TriggerType.MANUAL, payload, null, null);
    }

    public ExecuteRequest withInstanceId(String value) {
        return new ExecuteRequest(triggerType, payload, value, entryNodeId);
    }
}
