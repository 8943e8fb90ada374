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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code {{path}}} placeholders in node parameters with values from the
 * execution context.
 *
 * <p>Paths are dotted with optional list indexes, e.g.
 * {@code {{trigger.data.apiUrl}}} or {@code {{steps.fetch.data.users[0].name}}}.
 * A string that is exactly one placeholder takes the resolved value as-is; a
 * placeholder embedded in text is rendered (maps and lists as JSON). Unresolved
 * placeholders are left untouched. There is no expression evaluation.
 */
@Slf4j
public class ParameterInterpolator {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([^}]+)}}");
    private static final Pattern SEGMENT = Pattern.compile("([^.\\[\\]]+)|\\[(\\d+)]");

    private final ObjectMapper objectMapper;

    public ParameterInterpolator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> interpolate(Map<String, Object> parameters, Map<String, Object> context) {
        return (Map<String, Object>) interpolateValue(parameters, context);
    }

    public Object interpolateValue(Object value, Map<String, Object> context) {
        if (value instanceof String s) {
            return interpolateString(s, context);
        }
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (Object item : list) {
                result.add(interpolateValue(item, context));
            }
            return result;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((k, v) -> result.put(String.valueOf(k), interpolateValue(v, context)));
            return result;
        }
        return value;
    }

    private Object interpolateString(String str, Map<String, Object> context) {
        Matcher whole = PLACEHOLDER.matcher(str);
        if (whole.matches()) {
            Optional<Object> resolved = resolve(context, whole.group(1).trim());
            if (resolved.isEmpty()) {
                log.debug("[automation] Unresolved placeholder: {}", str);
            }
            return resolved.orElse(str);
        }
        Matcher m = PLACEHOLDER.matcher(str);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            Optional<Object> resolved = resolve(context, m.group(1).trim());
            String replacement = resolved.map(this::render).orElse(m.group());
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private String render(Object value) {
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return String.valueOf(value);
            }
        }
        return String.valueOf(value);
    }

    /**
     * Walks {@code path} through nested maps and lists. Empty when any segment is
     * missing or the final value is null.
     */
    public static Optional<Object> resolve(Object root, String path) {
        if (path == null || path.isBlank()) return Optional.empty();
        Object current = root;
        Matcher m = SEGMENT.matcher(path);
        while (m.find()) {
            if (current == null) return Optional.empty();
            if (m.group(2) != null) {
                if (!(current instanceof List<?> list)) return Optional.empty();
                int index = Integer.parseInt(m.group(2));
                if (index >= list.size()) return Optional.empty();
                current = list.get(index);
            } else {
                if (!(current instanceof Map<?, ?> map)) return Optional.empty();
                current = map.get(m.group(1));
            }
        }
        return Optional.ofNullable(current);
    }
}
