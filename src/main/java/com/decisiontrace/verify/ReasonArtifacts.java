package com.decisiontrace.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Finds the reason artifacts in a record's logic: reason-code objects, free-text
 * reasons, evaluated checks, evidence and rationale.
 */
final class ReasonArtifacts {

    static final List<String> REASON_KEYS = List.of("reason_codes", "reasons", "checks", "evidence", "rationale");
    static final List<String> EXPLANATION_KEYS = List.of("explain", "explanation", "detail", "message");

    private ReasonArtifacts() {}

    /**
     * One entry per artifact found, holding its explanation ("" when it has none).
     */
    static List<String> explanations(Map<String, Object> logic) {
        List<String> found = new ArrayList<>();
        if (logic == null) {
            return found;
        }
        for (String key : REASON_KEYS) {
            Object value = logic.get(key);
            if (value instanceof List<?> items) {
                for (Object item : items) {
                    found.add(explanationOf(item));
                }
            } else if (value != null) {
                found.add(explanationOf(value));
            }
        }
        return found;
    }

    private static String explanationOf(Object artifact) {
        if (artifact instanceof String text) {
            return text.strip();
        }
        if (artifact instanceof Map<?, ?> map) {
            for (String key : EXPLANATION_KEYS) {
                if (map.get(key) instanceof String text && !text.isBlank()) {
                    return text.strip();
                }
            }
        }
        return "";
    }
}
