package com.decisiontrace.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One finalized decision event, as written to a sink (one JSON line per record).
 *
 * Structured members are deep-copied into unmodifiable collections in JSON
 * shape (see {@link JsonValues}), so a record handed to an exporter can never
 * change underneath it and equals its decoded copy. Equality is full-field
 * equality, which is what duplicate and conflict detection rely on.
 *
 * Fields other than {@code decision_id} may be null on records read back from
 * a sink; completeness is judged by the verification rules, not here.
 */
@JsonPropertyOrder({
    DecisionRecord.DECISION_ID, DecisionRecord.DECISION_TYPE, DecisionRecord.TIMESTAMP,
    DecisionRecord.TENANT_ID, DecisionRecord.ENVIRONMENT, DecisionRecord.CONTEXT,
    DecisionRecord.ACTOR, DecisionRecord.LOGIC, DecisionRecord.OUTCOME,
    DecisionRecord.CONFIDENCE, DecisionRecord.LINEAGE
})
public record DecisionRecord(
    @JsonProperty(DECISION_ID) String decisionId,
    @JsonProperty(DECISION_TYPE) String decisionType,
    @JsonProperty(TIMESTAMP) Instant timestamp,
    @JsonProperty(TENANT_ID) String tenantId,
    @JsonProperty(ENVIRONMENT) String environment,
    @JsonProperty(CONTEXT) Map<String, Object> context,
    @JsonProperty(ACTOR) Actor actor,
    @JsonProperty(LOGIC) Map<String, Object> logic,
    @JsonProperty(OUTCOME) Map<String, Object> outcome,
    @JsonProperty(CONFIDENCE) Double confidence,
    @JsonProperty(LINEAGE) List<String> lineage
) {

    public static final String DECISION_ID = "decision_id";
    public static final String DECISION_TYPE = "decision_type";
    public static final String TIMESTAMP = "timestamp";
    public static final String TENANT_ID = "tenant_id";
    public static final String ENVIRONMENT = "environment";
    public static final String CONTEXT = "context";
    public static final String ACTOR = "actor";
    public static final String LOGIC = "logic";
    /** Older traces carried the reasoning under this name instead of {@link #LOGIC}. */
    public static final String EVIDENCE = "evidence";
    public static final String OUTCOME = "outcome";
    public static final String CONFIDENCE = "confidence";
    public static final String LINEAGE = "lineage";

    public DecisionRecord {
        context = JsonValues.normalize(context);
        logic = JsonValues.normalize(logic);
        outcome = JsonValues.normalize(outcome);
        lineage = lineage == null ? List.of() : List.copyOf(lineage);
    }

    public boolean isRoot() {
        return lineage.isEmpty();
    }
}
