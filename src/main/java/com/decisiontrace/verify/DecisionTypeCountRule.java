package com.decisiontrace.verify;

import com.decisiontrace.contract.DecisionRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Checks that a run produced the expected number of decisions of each type,
 * e.g. three plan evaluations and one final selection. Passes when no
 * expectation is configured.
 */
public class DecisionTypeCountRule implements VerificationRule {

    public static final String NAME = "decision_type_counts";

    private final Map<String, Integer> expected;

    public DecisionTypeCountRule(Map<String, Integer> expected) {
        this.expected = new TreeMap<>(expected);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "each decision type occurs the expected number of times";
    }

    @Override
    public RuleResult evaluate(VerificationInput input) {
        Map<String, Integer> actual = new TreeMap<>();
        for (DecisionRecord record : input.graph().records()) {
            actual.merge(Objects.toString(record.decisionType(), ""), 1, Integer::sum);
        }

        List<Violation> violations = new ArrayList<>();
        expected.forEach((type, count) -> {
            int found = actual.getOrDefault(type, 0);
            if (found != count) {
                violations.add(Violation.of(null, "expected " + count + " " + type + " decision(s), found " + found));
            }
        });
        return RuleResult.of(NAME, violations);
    }
}
