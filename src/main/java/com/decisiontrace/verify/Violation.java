package com.decisiontrace.verify;

import java.util.List;

/**
 * One offending decision (or group of decisions) for a rule.
 *
 * @param decisionId the violator; null only for run-level findings
 * @param relatedIds other decisions involved, e.g. the missing parent or the ancestor
 */
public record Violation(
    String decisionId,
    String detail,
    List<String> relatedIds
) {

    public Violation {
        relatedIds = relatedIds == null ? List.of() : List.copyOf(relatedIds);
    }

    public static Violation of(String decisionId, String detail) {
        return new Violation(decisionId, detail, List.of());
    }
}
