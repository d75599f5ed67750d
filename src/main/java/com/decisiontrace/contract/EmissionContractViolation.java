package com.decisiontrace.contract;

/**
 * A recorder scope broke the one-action-per-scope rule: it was finalized
 * without an action payload on a normal exit, or it was given a second one.
 * Fatal to that scope; no record is emitted for it.
 */
public class EmissionContractViolation extends RuntimeException {

    private final String decisionId;

    public EmissionContractViolation(String decisionId, String message) {
        super("decision " + decisionId + ": " + message);
        this.decisionId = decisionId;
    }

    public String getDecisionId() {
        return decisionId;
    }
}
