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

package org.fireflyframework.automation.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.fireflyframework.automation.core.exception.PersistenceException;

/**
 * Serializes executions and step logs to/from JSON for durable persistence.
 */
public class ExecutionSerializer {

    private final ObjectMapper mapper;

    public ExecutionSerializer() {
        this(defaultMapper());
    }

    public ExecutionSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public String serialize(WorkflowExecution execution) {
        return write(execution, "WorkflowExecution");
    }

    public WorkflowExecution deserializeExecution(String json) {
        return read(json, WorkflowExecution.class);
    }

    public String serialize(StepLog stepLog) {
        return write(stepLog, "StepLog");
    }

    public StepLog deserializeStepLog(String json) {
        return read(json, StepLog.class);
    }

    /**
     * Converts an executor output into plain maps, lists and scalars so it can be
     * persisted and addressed by placeholder paths.
     */
    public Object normalize(Object value) {
        if (value == null) return null;
        return mapper.convertValue(value, Object.class);
    }

    private String write(Object value, String what) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize " + what, e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
