package com.decisiontrace.verify;

import com.decisiontrace.lineage.LoadError;
import com.decisiontrace.lineage.StructuralConflict;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one verification pass.
 *
 * {@code passed} holds only if every rule passed and no line was excluded at load
 * time. Load errors and structural conflicts are listed apart from rule
 * violations: they describe corrupt input rather than semantic lapses.
 */
public record VerificationReport(
    boolean passed,
    int recordCount,
    List<RuleResult> results,
    List<LoadError> loadErrors,
    List<StructuralConflict> structuralConflicts
) {

    public VerificationReport {
        results = List.copyOf(results);
        loadErrors = List.copyOf(loadErrors);
        structuralConflicts = List.copyOf(structuralConflicts);
    }

    /** Rule name to its violations, in battery order; passing rules map to an empty list. */
    public Map<String, List<Violation>> violationsByRule() {
        Map<String, List<Violation>> byRule = new LinkedHashMap<>();
        for (RuleResult result : results) {
            byRule.put(result.rule(), result.violations());
        }
        return byRule;
    }

    public List<String> failedRules() {
        return results.stream()
            .filter(result -> !result.passed())
            .map(RuleResult::rule)
            .toList();
    }

    public RuleResult result(String rule) {
        return results.stream()
            .filter(result -> result.rule().equals(rule))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("no such rule in report: " + rule));
    }

    /**
     * Plain mapping for viewers and CLIs: renderable without knowing the rules.
     */
    public Map<String, Object> toView() {
        Map<String, Object> rules = new LinkedHashMap<>();
        for (RuleResult result : results) {
            rules.put(result.rule(), result.violations().stream()
                .map(violation -> {
                    Map<String, Object> detail = new LinkedHashMap<>();
                    detail.put("decision_id", violation.decisionId());
                    detail.put("detail", violation.detail());
                    detail.put("related_ids", violation.relatedIds());
                    return detail;
                })
                .toList());
        }

        Map<String, Object> view = new LinkedHashMap<>();
        view.put("passed", passed);
        view.put("record_count", recordCount);
        view.put("failed_rules", failedRules());
        view.put("rules", rules);
        view.put("load_errors", loadErrors.stream()
            .map(error -> {
                Map<String, Object> detail = new LinkedHashMap<>();
                detail.put("source", error.source());
                detail.put("line", error.lineNumber());
                detail.put("message", error.message());
                return detail;
            })
            .toList());
        view.put("structural_conflicts", structuralConflicts.stream()
            .map(conflict -> {
                Map<String, Object> detail = new LinkedHashMap<>();
                detail.put("decision_id", conflict.decisionId());
                detail.put("variants", conflict.variants());
                detail.put("differing_fields", conflict.differingFields());
                return detail;
            })
            .toList());
        return view;
    }
}
