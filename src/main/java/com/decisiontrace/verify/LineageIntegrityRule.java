package com.decisiontrace.verify;

import com.decisiontrace.lineage.LineageReference;

import java.util.List;

public class LineageIntegrityRule implements VerificationRule {

    public static final String NAME = "lineage_referential_integrity";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "every lineage entry resolves to a known decision";
    }

    @Override
    public RuleResult evaluate(VerificationInput input) {
        List<Violation> violations = input.graph().danglingReferences().stream()
            .map(LineageIntegrityRule::toViolation)
            .toList();
        return RuleResult.of(NAME, violations);
    }

    private static Violation toViolation(LineageReference reference) {
        return new Violation(reference.childId(),
            "lineage entry " + reference.parentId() + " does not resolve to a known decision",
            List.of(reference.parentId()));
    }
}
