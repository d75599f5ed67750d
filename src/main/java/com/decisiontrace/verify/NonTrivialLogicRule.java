package com.decisiontrace.verify;

import com.decisiontrace.contract.DecisionRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * The logic must carry at least one reason artifact with an explanation,
 * e.g. {@code reason_codes: [{code, status, explain}]}.
 */
public class NonTrivialLogicRule implements VerificationRule {

    public static final String NAME = "non_trivial_logic";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "logic contains a reason artifact with a non-empty explanation";
    }

    @Override
    public RuleResult evaluate(VerificationInput input) {
        List<Violation> violations = new ArrayList<>();
        for (DecisionRecord record : input.distinctRecords()) {
            List<String> explanations = ReasonArtifacts.explanations(record.logic());
            if (explanations.isEmpty()) {
                violations.add(Violation.of(record.decisionId(),
                    "logic has no reason artifact (" + String.join(", ", ReasonArtifacts.REASON_KEYS) + ")"));
            } else if (explanations.stream().allMatch(String::isEmpty)) {
                violations.add(Violation.of(record.decisionId(),
                    "all " + explanations.size() + " reason artifact(s) have an empty explanation"));
            }
        }
        return RuleResult.of(NAME, violations);
    }
}
