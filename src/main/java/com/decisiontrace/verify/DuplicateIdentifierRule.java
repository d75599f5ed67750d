package com.decisiontrace.verify;

import com.decisiontrace.lineage.StructuralConflict;

import java.util.List;

public class DuplicateIdentifierRule implements VerificationRule {

    public static final String NAME = "duplicate_identifiers";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "no decision_id is carried by structurally different records";
    }

    @Override
    public RuleResult evaluate(VerificationInput input) {
        List<Violation> violations = input.graph().structuralConflicts().stream()
            .map(DuplicateIdentifierRule::toViolation)
            .toList();
        return RuleResult.of(NAME, violations);
    }

    private static Violation toViolation(StructuralConflict conflict) {
        return Violation.of(conflict.decisionId(),
            conflict.variants() + " different records share this decision_id; differing fields: "
                + String.join(", ", conflict.differingFields()));
    }
}
