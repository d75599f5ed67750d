package com.decisiontrace.verify;

import com.decisiontrace.contract.DecisionRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class SchemaCompletenessRule implements VerificationRule {

    public static final String NAME = "schema_completeness";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "decision_id, decision_type, timestamp, context, actor, logic and outcome are present and non-empty";
    }

    @Override
    public RuleResult evaluate(VerificationInput input) {
        List<Violation> violations = new ArrayList<>();
        for (DecisionRecord record : input.distinctRecords()) {
            List<String> missing = new ArrayList<>();
            if (isBlank(record.decisionId())) {
                missing.add(DecisionRecord.DECISION_ID);
            }
            if (isBlank(record.decisionType())) {
                missing.add(DecisionRecord.DECISION_TYPE);
            }
            if (record.timestamp() == null) {
                missing.add(DecisionRecord.TIMESTAMP);
            }
            if (isEmpty(record.context())) {
                missing.add(DecisionRecord.CONTEXT);
            }
            if (record.actor() == null) {
                missing.add(DecisionRecord.ACTOR);
            }
            if (isEmpty(record.logic())) {
                missing.add(DecisionRecord.LOGIC);
            }
            if (isEmpty(record.outcome())) {
                missing.add(DecisionRecord.OUTCOME);
            }
            if (!missing.isEmpty()) {
                violations.add(Violation.of(record.decisionId(), "missing or empty: " + String.join(", ", missing)));
            }
        }
        return RuleResult.of(NAME, violations);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static boolean isEmpty(Map<String, Object> value) {
        return value == null || value.isEmpty();
    }
}
