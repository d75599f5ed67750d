package com.decisiontrace.verify;

import com.decisiontrace.contract.DecisionRecord;

import java.util.ArrayList;
import java.util.List;

public class ConfidenceRangeRule implements VerificationRule {

    public static final String NAME = "confidence_range";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "confidence, when present, lies within [0, 1]";
    }

    @Override
    public RuleResult evaluate(VerificationInput input) {
        List<Violation> violations = new ArrayList<>();
        for (DecisionRecord record : input.distinctRecords()) {
            Double confidence = record.confidence();
            if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
                violations.add(Violation.of(record.decisionId(), "confidence " + confidence + " is outside [0, 1]"));
            }
        }
        return RuleResult.of(NAME, violations);
    }
}
