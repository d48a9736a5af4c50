package com.gaming.loyalty.player;

import com.gaming.loyalty.domain.Amounts;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of named player attributes (numbers, strings, booleans) that rule conditions and reward
 * formulas are evaluated against. A field is either present with a value or absent; never null.
 */
public final class PlayerState {

    private final Map<String, Object> fields;

    private PlayerState(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static PlayerState of(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((name, value) -> {
                if (name != null && value != null) {
                    copy.put(name, value);
                }
            });
        }
        return new PlayerState(copy);
    }

    public static PlayerState empty() {
        return new PlayerState(new LinkedHashMap<>());
    }

    public boolean has(String name) {
        return fields.containsKey(name);
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    /** The field as a decimal, if it is present and numeric. */
    public Optional<BigDecimal> getNumber(String name) {
        Object value = fields.get(name);
        if (value instanceof Boolean) {
            return Optional.empty();
        }
        return Optional.ofNullable(Amounts.toBigDecimal(value));
    }

    public Optional<String> getString(String name) {
        Object value = fields.get(name);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    /** All numeric fields; these are the variables a reward formula may reference. */
    public Map<String, BigDecimal> numericFields() {
        Map<String, BigDecimal> numbers = new LinkedHashMap<>();
        for (String name : fields.keySet()) {
            getNumber(name).ifPresent(number -> numbers.put(name, number));
        }
        return numbers;
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    @Override
    public String toString() {
        return "PlayerState" + fields;
    }
}
