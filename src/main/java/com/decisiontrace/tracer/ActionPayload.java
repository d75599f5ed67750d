package com.decisiontrace.tracer;

import com.decisiontrace.contract.ContractViolationException;
import com.decisiontrace.contract.JsonValues;

import java.util.List;
import java.util.Map;

/**
 * The single action a recorder scope accepts: what triggered the decision,
 * the logic behind it, what was decided, and which decisions it builds on.
 */
public record ActionPayload(
    Map<String, Object> context,
    Map<String, Object> logic,
    Map<String, Object> outcome,
    Double confidence,
    List<String> lineage
) {

    public ActionPayload {
        if (context == null) {
            throw new ContractViolationException("action context is required");
        }
        if (logic == null) {
            throw new ContractViolationException("action logic is required");
        }
        if (outcome == null) {
            throw new ContractViolationException("action outcome is required");
        }
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            throw new ContractViolationException("confidence must be within [0, 1], got " + confidence);
        }
        context = JsonValues.normalize(context);
        logic = JsonValues.normalize(logic);
        outcome = JsonValues.normalize(outcome);
        lineage = lineage == null ? List.of() : List.copyOf(lineage);
        for (String parent : lineage) {
            if (parent.isBlank()) {
                throw new ContractViolationException("lineage entries must be non-empty decision ids");
            }
        }
    }

    public static ActionPayload of(Map<String, Object> context,
                                   Map<String, Object> logic,
                                   Map<String, Object> outcome) {
        return new ActionPayload(context, logic, outcome, null, List.of());
    }

    public ActionPayload withConfidence(double value) {
        return new ActionPayload(context, logic, outcome, value, lineage);
    }

    public ActionPayload withLineage(String... parents) {
        return new ActionPayload(context, logic, outcome, confidence, List.of(parents));
    }
}
