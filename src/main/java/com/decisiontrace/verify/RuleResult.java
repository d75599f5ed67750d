package com.decisiontrace.verify;

import java.util.Comparator;
import java.util.List;

/**
 * Outcome of one rule. Violations are ordered by decision_id so repeated runs
 * over the same records give equal results.
 */
public record RuleResult(
    String rule,
    boolean passed,
    List<Violation> violations
) {

    private static final Comparator<Violation> ORDER = Comparator
        .comparing(Violation::decisionId, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(Violation::detail);

    public RuleResult {
        violations = violations.stream().sorted(ORDER).toList();
    }

    public static RuleResult of(String rule, List<Violation> violations) {
        return new RuleResult(rule, violations.isEmpty(), violations);
    }

    public List<String> violators() {
        return violations.stream()
            .map(Violation::decisionId)
            .distinct()
            .toList();
    }
}
