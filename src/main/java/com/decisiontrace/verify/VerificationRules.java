package com.decisiontrace.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class VerificationRules {

    private VerificationRules() {}

    /**
     * The canonical battery every run is certified against.
     */
    public static List<VerificationRule> canonical() {
        return List.of(
            new SchemaCompletenessRule(),
            new ActorExplicitnessRule(),
            new NonTrivialLogicRule(),
            new OutcomeClarityRule(),
            new LineageIntegrityRule(),
            new AcyclicityRule(),
            new DuplicateIdentifierRule(),
            new DuplicateEmissionRule(),
            new TimestampMonotonicityRule()
        );
    }

    /**
     * Canonical battery plus the run-specific checks: confidence range,
     * placeholder labels, expected decision counts and per-type required logic keys.
     */
    public static List<VerificationRule> standard(List<String> forbiddenPlaceholders,
                                                  Map<String, Integer> expectedCounts,
                                                  Map<String, List<String>> requiredEvidence) {
        List<VerificationRule> rules = new ArrayList<>(canonical());
        rules.add(new ConfidenceRangeRule());
        rules.add(new PlaceholderSemanticsRule(forbiddenPlaceholders));
        rules.add(new DecisionTypeCountRule(expectedCounts));
        rules.add(new RequiredEvidenceRule(requiredEvidence));
        return List.copyOf(rules);
    }
}
