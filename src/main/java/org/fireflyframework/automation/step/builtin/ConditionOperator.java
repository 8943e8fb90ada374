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

package org.fireflyframework.automation.step.builtin;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Comparison operators available to condition and switch nodes.
 * Numeric operators accept numbers and numeric strings; anything else compares false.
 */
public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("notEquals"),
    CONTAINS("contains"),
    NOT_CONTAINS("notContains"),
    STARTS_WITH("startsWith"),
    ENDS_WITH("endsWith"),
    GREATER_THAN("greaterThan"),
    LESS_THAN("lessThan"),
    GREATER_THAN_OR_EQUAL("greaterThanOrEqual"),
    LESS_THAN_OR_EQUAL("lessThanOrEqual"),
    IS_EMPTY("isEmpty"),
    IS_NOT_EMPTY("isNotEmpty"),
    IS_TRUE("isTrue"),
    IS_FALSE("isFalse"),
    REGEX("regex");

    private final String value;

    ConditionOperator(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ConditionOperator fromValue(String value) {
        for (ConditionOperator op : values()) {
            if (op.value.equalsIgnoreCase(value) || op.name().equalsIgnoreCase(value)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown condition operator: " + value);
    }

    public boolean test(Object actual, Object expected) {
        return switch (this) {
            case EQUALS -> looselyEquals(actual, expected);
            case NOT_EQUALS -> !looselyEquals(actual, expected);
            case CONTAINS -> contains(actual, expected);
            case NOT_CONTAINS -> !contains(actual, expected);
            case STARTS_WITH -> actual instanceof String a && expected instanceof String e && a.startsWith(e);
            case ENDS_WITH -> actual instanceof String a && expected instanceof String e && a.endsWith(e);
            case GREATER_THAN -> compare(actual, expected, c -> c > 0);
            case LESS_THAN -> compare(actual, expected, c -> c < 0);
            case GREATER_THAN_OR_EQUAL -> compare(actual, expected, c -> c >= 0);
            case LESS_THAN_OR_EQUAL -> compare(actual, expected, c -> c <= 0);
            case IS_EMPTY -> isEmpty(actual);
            case IS_NOT_EMPTY -> !isEmpty(actual);
            case IS_TRUE -> Boolean.TRUE.equals(actual);
            case IS_FALSE -> Boolean.FALSE.equals(actual);
            case REGEX -> matches(actual, expected);
        };
    }

    private static boolean looselyEquals(Object actual, Object expected) {
        if (Objects.equals(actual, expected)) return true;
        BigDecimal a = toNumber(actual);
        BigDecimal e = toNumber(expected);
        if (a != null && e != null) return a.compareTo(e) == 0;
        return String.valueOf(actual).equals(String.valueOf(expected));
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual instanceof String a && expected instanceof String e) return a.contains(e);
        if (actual instanceof Collection<?> c) {
            return c.stream().anyMatch(item -> looselyEquals(item, expected));
        }
        return false;
    }

    private static boolean compare(Object actual, Object expected, IntPredicate check) {
        BigDecimal a = toNumber(actual);
        BigDecimal e = toNumber(expected);
        return a != null && e != null && check.test(a.compareTo(e));
    }

    private static boolean isEmpty(Object actual) {
        if (actual == null) return true;
        if (actual instanceof String s) return s.isEmpty();
        if (actual instanceof Collection<?> c) return c.isEmpty();
        if (actual instanceof Map<?, ?> m) return m.isEmpty();
        return false;
    }

    private static boolean matches(Object actual, Object expected) {
        if (!(actual instanceof String a) || !(expected instanceof String e)) return false;
        try {
            return Pattern.compile(e).matcher(a).find();
        } catch (PatternSyntaxException ex) {
            return false;
        }
    }

    static BigDecimal toNumber(Object value) {
        if (value instanceof Number n) {
            try {
                return new BigDecimal(n.toString());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return new BigDecimal(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
