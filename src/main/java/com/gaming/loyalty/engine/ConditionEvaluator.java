package com.gaming.loyalty.engine;

import com.gaming.loyalty.domain.Amounts;
import com.gaming.loyalty.player.PlayerState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Matches rule conditions against player state. A condition is a conjunction; each entry is read as
 * <ul>
 *   <li>{@code field: {min, max, equals}} range and/or equality on the field (absent field fails)</li>
 *   <li>{@code field: [a, b, ...]} membership</li>
 *   <li>{@code field_min: n} field at least n (absent field fails)</li>
 *   <li>{@code field_max: n} field at most n (absent field fails)</li>
 *   <li>{@code field: value} equality</li>
 * </ul>
 * in that order of precedence. Numbers compare by value, so {@code 3} equals {@code 3.0}.
 */
@Slf4j
@Component
public class ConditionEvaluator {

    static final String MIN_SUFFIX = "_min";
    static final String MAX_SUFFIX = "_max";

    public boolean matches(Map<String, Object> condition, PlayerState state) {
        if (condition == null) {
            return true;
        }
        for (Map.Entry<String, Object> entry : condition.entrySet()) {
            if (!matchesEntry(entry.getKey(), entry.getValue(), state)) {
                log.debug("Condition failed: key={}, expected={}", entry.getKey(), entry.getValue());
                return false;
            }
        }
        return true;
    }

    private boolean matchesEntry(String key, Object expected, PlayerState state) {
        if (expected instanceof Map) {
            Object actual = state.get(key).orElse(null);
            if (actual == null) {
                return false;
            }
            Map<?, ?> range = (Map<?, ?>) expected;
            if (range.containsKey("min") && !atLeast(actual, range.get("min"))) {
                return false;
            }
            if (range.containsKey("max") && !atMost(actual, range.get("max"))) {
                return false;
            }
            return !range.containsKey("equals") || valuesEqual(actual, range.get("equals"));
        }
        if (expected instanceof Collection) {
            Object actual = state.get(key).orElse(null);
            for (Object candidate : (Collection<?>) expected) {
                if (valuesEqual(actual, candidate)) {
                    return true;
                }
            }
            return false;
        }
        if (key.endsWith(MIN_SUFFIX)) {
            Object actual = state.get(baseKey(key, MIN_SUFFIX)).orElse(null);
            return actual != null && atLeast(actual, expected);
        }
        if (key.endsWith(MAX_SUFFIX)) {
            Object actual = state.get(baseKey(key, MAX_SUFFIX)).orElse(null);
            return actual != null && atMost(actual, expected);
        }
        return valuesEqual(state.get(key).orElse(null), expected);
    }

    private static String baseKey(String key, String suffix) {
        return key.substring(0, key.length() - suffix.length());
    }

    private static boolean atLeast(Object actual, Object bound) {
        Integer order = compare(actual, bound);
        return order != null && order >= 0;
    }

    private static boolean atMost(Object actual, Object bound) {
        Integer order = compare(actual, bound);
        return order != null && order <= 0;
    }

    /** Null when the two values are not comparable (e.g. a string against a number). */
    private static Integer compare(Object actual, Object bound) {
        BigDecimal left = numeric(actual);
        BigDecimal right = numeric(bound);
        if (left != null && right != null) {
            return left.compareTo(right);
        }
        if (actual instanceof String && bound instanceof String) {
            return ((String) actual).compareTo((String) bound);
        }
        return null;
    }

    static boolean valuesEqual(Object actual, Object expected) {
        BigDecimal left = numeric(actual);
        BigDecimal right = numeric(expected);
        if (left != null && right != null) {
            return left.compareTo(right) == 0;
        }
        return Objects.equals(actual, expected);
    }

    private static BigDecimal numeric(Object value) {
        return value instanceof Boolean ? null : Amounts.toBigDecimal(value);
    }
}
