package com.decisiontrace.verify;

import com.decisiontrace.contract.Actor;
import com.decisiontrace.contract.DecisionRecord;

import java.util.ArrayList;
import java.util.List;

public class ActorExplicitnessRule implements VerificationRule {

    public static final String NAME = "actor_explicitness";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "actor names an id, a name and a type";
    }

    @Override
    public RuleResult evaluate(VerificationInput input) {
        List<Violation> violations = new ArrayList<>();
        for (DecisionRecord record : input.distinctRecords()) {
            Actor actor = record.actor();
            if (actor == null) {
                violations.add(Violation.of(record.decisionId(), "actor is missing"));
                continue;
            }
            List<String> gaps = new ArrayList<>();
            if (isBlank(actor.id())) {
                gaps.add("actor.id is empty");
            }
            if (isBlank(actor.name())) {
                gaps.add("actor.name is empty");
            }
            if (isBlank(actor.type())) {
                gaps.add("actor.type is absent");
            }
            if (!gaps.isEmpty()) {
                violations.add(Violation.of(record.decisionId(), String.join("; ", gaps)));
            }
        }
        return RuleResult.of(NAME, violations);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
