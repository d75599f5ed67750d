package com.decisiontrace.contract;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Validates the record-shaped mapping a traced task returns before it is turned
 * into a {@link DecisionRecord}.
 *
 * Required: decision_type, context, actor, logic (or its alias evidence), outcome.
 * Optional: decision_id, lineage, confidence, tenant_id, environment. A
 * caller-supplied timestamp is ignored; records are stamped at finalization.
 */
@Component
public class RecordContractValidator {

    public static final String LOGIC_ALIAS = DecisionRecord.EVIDENCE;

    public void validate(Map<String, Object> result) {
        if (result == null) {
            throw new ContractViolationException("traced task returned no decision mapping");
        }

        Object decisionId = result.get(DecisionRecord.DECISION_ID);
        if (decisionId != null) {
            requireString(decisionId, "decision_id must be a non-empty string when provided");
        }
        requireString(result.get(DecisionRecord.DECISION_TYPE), "decision_type is required");
        requireObject(result.get(DecisionRecord.CONTEXT), "context must be an object");
        validateActor(result.get(DecisionRecord.ACTOR));
        requireObject(logicOf(result), "logic must be an object");
        requireObject(result.get(DecisionRecord.OUTCOME), "outcome must be an object");

        Object lineage = result.get(DecisionRecord.LINEAGE);
        if (lineage != null) {
            for (Object parent : requireList(lineage, "lineage must be an array of decision ids")) {
                requireString(parent, "lineage entries must be non-empty decision ids");
            }
        }

        Object confidence = result.get(DecisionRecord.CONFIDENCE);
        if (confidence != null) {
            requireConfidence(confidence);
        }

        optionalString(result.get(DecisionRecord.TENANT_ID), "tenant_id must be a string");
        optionalString(result.get(DecisionRecord.ENVIRONMENT), "environment must be a string");
    }

    /**
     * Converts a validated actor value. A bare string names an agent.
     */
    public Actor toActor(Object raw) {
        validateActor(raw);
        if (raw instanceof String name) {
            return Actor.agent(name, name);
        }
        Map<?, ?> actor = (Map<?, ?>) raw;
        return new Actor(
            stringOrNull(actor.get("id")),
            stringOrNull(actor.get("name")),
            stringOrNull(actor.get("type")));
    }

    public Object logicOf(Map<String, Object> result) {
        Object logic = result.get(DecisionRecord.LOGIC);
        return logic != null ? logic : result.get(LOGIC_ALIAS);
    }

    public void requireConfidence(Object value) {
        if (!(value instanceof Number number)) {
            throw new ContractViolationException("confidence must be a number");
        }
        double confidence = number.doubleValue();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new ContractViolationException("confidence must be within [0, 1], got " + confidence);
        }
    }

    private void validateActor(Object actor) {
        if (actor instanceof String) {
            requireString(actor, "actor must not be blank");
            return;
        }
        if (!(actor instanceof Map<?, ?> descriptor)) {
            throw new ContractViolationException("actor must be an object with id, name and type");
        }
        requireString(descriptor.get("id"), "actor.id is required");
        optionalString(descriptor.get("name"), "actor.name must be a string");
        optionalString(descriptor.get("type"), "actor.type must be a string");
    }

    private String requireString(Object value, String message) {
        if (!(value instanceof String text) || text.isBlank()) {
            throw new ContractViolationException(message);
        }
        return text;
    }

    private void optionalString(Object value, String message) {
        if (value != null && !(value instanceof String)) {
            throw new ContractViolationException(message);
        }
    }

    private Object requireObject(Object value, String message) {
        if (!(value instanceof Map<?, ?>)) {
            throw new ContractViolationException(message);
        }
        return value;
    }

    private List<?> requireList(Object value, String message) {
        if (!(value instanceof List<?> list)) {
            throw new ContractViolationException(message);
        }
        return list;
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
