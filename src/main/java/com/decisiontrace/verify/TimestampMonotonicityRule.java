package com.decisiontrace.verify;

import com.decisiontrace.contract.DecisionRecord;
import com.decisiontrace.lineage.LineageGraph;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Along a lineage chain a decision cannot be finalized before any of its
 * ancestors. Records without a timestamp are left to schema completeness.
 */
public class TimestampMonotonicityRule implements VerificationRule {

    public static final String NAME = "timestamp_monotonicity";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "no decision is timestamped before one of its ancestors";
    }

    @Override
    public RuleResult evaluate(VerificationInput input) {
        LineageGraph graph = input.graph();
        List<Violation> violations = new ArrayList<>();
        for (DecisionRecord record : graph.records()) {
            Instant timestamp = record.timestamp();
            if (timestamp == null) {
                continue;
            }
            for (String ancestorId : graph.ancestorsOf(record.decisionId())) {
                Instant ancestorTimestamp = graph.record(ancestorId).map(DecisionRecord::timestamp).orElse(null);
                if (ancestorTimestamp != null && timestamp.isBefore(ancestorTimestamp)) {
                    violations.add(new Violation(record.decisionId(),
                        "timestamp " + timestamp + " precedes ancestor " + ancestorId + " at " + ancestorTimestamp,
                        List.of(ancestorId)));
                }
            }
        }
        return RuleResult.of(NAME, violations);
    }
}
