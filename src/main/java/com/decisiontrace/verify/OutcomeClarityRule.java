package com.decisiontrace.verify;

import com.decisiontrace.contract.DecisionRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The outcome must state what was decided: a {@code decision} or {@code status}
 * field, or a qualified status such as {@code policy_status}.
 */
public class OutcomeClarityRule implements VerificationRule {

    public static final String NAME = "outcome_clarity";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "outcome has a determinable decision or status field";
    }

    @Override
    public RuleResult evaluate(VerificationInput input) {
        List<Violation> violations = new ArrayList<>();
        for (DecisionRecord record : input.distinctRecords()) {
            Map<String, Object> outcome = record.outcome();
            if (outcome == null || outcome.isEmpty()) {
                violations.add(Violation.of(record.decisionId(), "outcome is missing"));
            } else if (!hasStatus(outcome)) {
                violations.add(Violation.of(record.decisionId(),
                    "outcome has no decision or status field among " + outcome.keySet()));
            }
        }
        return RuleResult.of(NAME, violations);
    }

    private static boolean hasStatus(Map<String, Object> outcome) {
        for (Map.Entry<String, Object> entry : outcome.entrySet()) {
            String key = entry.getKey();
            boolean statusKey = key.equals("decision") || key.equals("status") || key.endsWith("_status");
            if (statusKey && isDeterminable(entry.getValue())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isDeterminable(Object value) {
        if (value instanceof String text) {
            return !text.isBlank();
        }
        return value instanceof Boolean || value instanceof Number;
    }
}
