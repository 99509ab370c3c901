package com.redsched.entry;

import com.redsched.schedule.Schedule;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The static configuration of an entry. Stored under the {@code definition} field of the
 * entry record and rewritten only by an explicit save.
 *
 * <p>Payload values are held in the form the store gives back: integral numbers as
 * {@code Long}, fractional numbers as {@code Double}, nested maps and lists as unmodifiable
 * copies. A definition therefore loads back equal to the one that was saved.
 *
 * @param args   positional payload, or {@code null}
 * @param kwargs named payload, or {@code null}
 */
public record EntryDefinition(String name,
                              String task,
                              Schedule schedule,
                              List<Object> args,
                              Map<String, Object> kwargs,
                              Map<String, Object> options,
                              boolean enabled) {

    public EntryDefinition {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Entry name is required");
        }
        if (task == null || task.isEmpty()) {
            throw new IllegalArgumentException("Entry task is required: " + name);
        }
        if (schedule == null) {
            throw new IllegalArgumentException("Entry schedule is required: " + name);
        }
        args = args != null ? canonicalList(args) : null;
        kwargs = kwargs != null ? canonicalMap(kwargs) : null;
        options = options != null ? canonicalMap(options) : Map.of();
    }

    public EntryDefinition(String name, String task, Schedule schedule) {
        this(name, task, schedule, null, null, Map.of(), true);
    }

    public EntryDefinition withEnabled(boolean enabled) {
        return new EntryDefinition(name, task, schedule, args, kwargs, options, enabled);
    }

    private static Object canonical(Object value) {
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger i) {
            return i.bitLength() < Long.SIZE ? (Object) i.longValue() : i;
        }
        if (value instanceof Float || value instanceof Double || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Map<?, ?> map) {
            return canonicalMap(map);
        }
        if (value instanceof Collection<?> items) {
            return canonicalList(items);
        }
        if (value instanceof Object[] items) {
            return canonicalList(Arrays.asList(items));
        }
        return value;
    }

    private static List<Object> canonicalList(Collection<?> items) {
        List<Object> copy = new ArrayList<>(items.size());
        for (Object item : items) {
            copy.add(canonical(item));
        }
        return Collections.unmodifiableList(copy);
    }

    private static Map<String, Object> canonicalMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), canonical(v)));
        return Collections.unmodifiableMap(copy);
    }
}
