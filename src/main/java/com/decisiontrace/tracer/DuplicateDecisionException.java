package com.decisiontrace.tracer;

/**
 * Thrown when a recorder scope is opened with a decision_id already used in
 * the current run. A legitimate retry must mint a new identifier.
 */
public class DuplicateDecisionException extends RuntimeException {

    private final String decisionId;

    public DuplicateDecisionException(String decisionId) {
        super("decision_id already emitted in this run: " + decisionId);
        this.decisionId = decisionId;
    }

    public String getDecisionId() {
        return decisionId;
    }
}
