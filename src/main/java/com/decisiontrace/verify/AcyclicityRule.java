package com.decisiontrace.verify;

import java.util.ArrayList;
import java.util.List;

public class AcyclicityRule implements VerificationRule {

    public static final String NAME = "acyclicity";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "no decision is its own ancestor";
    }

    @Override
    public RuleResult evaluate(VerificationInput input) {
        List<Violation> violations = new ArrayList<>();
        for (List<String> cycle : input.graph().cycles()) {
            String detail = cycle.size() == 1
                ? "decision lists itself in its lineage"
                : "decision is part of lineage cycle " + cycle;
            for (String member : cycle) {
                violations.add(new Violation(member, detail, cycle));
            }
        }
        return RuleResult.of(NAME, violations);
    }
}
