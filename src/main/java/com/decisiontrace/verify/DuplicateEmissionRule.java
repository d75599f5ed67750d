package com.decisiontrace.verify;

import java.util.List;

public class DuplicateEmissionRule implements VerificationRule {

    public static final String NAME = "duplicate_emission";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "each record is emitted once";
    }

    @Override
    public RuleResult evaluate(VerificationInput input) {
        List<Violation> violations = input.graph().duplicates().entrySet().stream()
            .map(entry -> Violation.of(entry.getKey(), "identical record emitted " + entry.getValue() + " times"))
            .toList();
        return RuleResult.of(NAME, violations);
    }
}
