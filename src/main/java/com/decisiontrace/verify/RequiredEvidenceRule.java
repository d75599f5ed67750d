package com.decisiontrace.verify;

import com.decisiontrace.contract.DecisionRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Checks that records of a configured decision type carry the logic keys that
 * type needs, e.g. a final plan selection naming its candidates and the
 * tie-breakers it applied. A key counts only when its value is non-empty.
 * Passes when no type is configured.
 */
public class RequiredEvidenceRule implements VerificationRule {

    public static final String NAME = "required_evidence";

    private final Map<String, List<String>> required;

    public RequiredEvidenceRule(Map<String, List<String>> required) {
        this.required = new TreeMap<>();
        required.forEach((type, keys) -> this.required.put(type, List.copyOf(keys)));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "logic carries every key its decision type requires";
    }

    @Override
    public RuleResult evaluate(VerificationInput input) {
        List<Violation> violations = new ArrayList<>();
        for (DecisionRecord record : input.distinctRecords()) {
            List<String> keys = record.decisionType() == null ? null : required.get(record.decisionType());
            if (keys == null) {
                continue;
            }
            Map<String, Object> logic = record.logic() == null ? Map.of() : record.logic();
            List<String> missing = keys.stream().filter(key -> isEmpty(logic.get(key))).toList();
            if (!missing.isEmpty()) {
                violations.add(Violation.of(record.decisionId(),
                    record.decisionType() + " logic is missing " + String.join(", ", missing)));
            }
        }
        return RuleResult.of(NAME, violations);
    }

    private static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String text) {
            return text.isBlank();
        }
        if (value instanceof Collection<?> items) {
            return items.isEmpty();
        }
        if (value instanceof Map<?, ?> entries) {
            return entries.isEmpty();
        }
        return false;
    }
}
