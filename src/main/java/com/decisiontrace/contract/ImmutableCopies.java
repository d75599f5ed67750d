package com.decisiontrace.contract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep, null-tolerant copies of JSON-shaped structures (maps, lists, scalars).
 * {@link Map#copyOf} is not usable here because decoded payloads may carry null values.
 */
final class ImmutableCopies {

    private ImmutableCopies() {}

    static Map<String, Object> map(Map<String, ?> source) {
        if (source == null) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(String.valueOf(key), value(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object value(Object value) {
        if (value instanceof Map<?, ?> nested) {
            Map<String, Object> copy = new LinkedHashMap<>();
            nested.forEach((key, item) -> copy.put(String.valueOf(key), value(item)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(value(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
