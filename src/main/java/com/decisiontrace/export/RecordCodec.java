package com.decisiontrace.export;

import com.decisiontrace.contract.Actor;
import com.decisiontrace.contract.DecisionRecord;
import com.decisiontrace.contract.JsonValues;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Line-delimited JSON codec for the sink format.
 *
 * Encoding relies on the Jackson annotations of {@link DecisionRecord}; timestamps
 * are written as ISO-8601 instants. Decoding walks the JSON tree field by field so
 * a malformed line is rejected with a message naming the offending field.
 */
public class RecordCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public RecordCodec() {
        this.mapper = JsonValues.newMapper();
    }

    /**
     * @return a single JSON line without the trailing newline
     */
    public String encode(DecisionRecord record) {
        try {
            return mapper.writeValueAsString(record);
        } catch (JsonProcessingException ex) {
            throw new RecordFormatException(
                "decision " + record.decisionId() + " cannot be encoded: " + ex.getOriginalMessage(), ex);
        }
    }

    public DecisionRecord decode(String line) {
        JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException ex) {
            throw new RecordFormatException("malformed JSON: " + ex.getOriginalMessage(), ex);
        }
        if (node == null || !node.isObject()) {
            throw new RecordFormatException("line is not a JSON object");
        }

        String decisionId = text(node, DecisionRecord.DECISION_ID);
        if (decisionId == null || decisionId.isBlank()) {
            throw new RecordFormatException("decision_id is missing");
        }

        return new DecisionRecord(
            decisionId,
            text(node, DecisionRecord.DECISION_TYPE),
            timestamp(node),
            text(node, DecisionRecord.TENANT_ID),
            text(node, DecisionRecord.ENVIRONMENT),
            object(node, DecisionRecord.CONTEXT),
            actor(node),
            logic(node),
            object(node, DecisionRecord.OUTCOME),
            confidence(node),
            lineage(node)
        );
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new RecordFormatException(field + " must be a string");
        }
        return value.textValue();
    }

    private Instant timestamp(JsonNode node) {
        String raw = text(node, DecisionRecord.TIMESTAMP);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException ex) {
            throw new RecordFormatException("timestamp is not ISO-8601 with a zone offset: " + raw, ex);
        }
    }

    private Map<String, Object> object(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isObject()) {
            throw new RecordFormatException(field + " must be an object");
        }
        return mapper.convertValue(value, MAP_TYPE);
    }

    private Map<String, Object> logic(JsonNode node) {
        Map<String, Object> logic = object(node, DecisionRecord.LOGIC);
        return logic != null ? logic : object(node, DecisionRecord.EVIDENCE);
    }

    private Actor actor(JsonNode node) {
        JsonNode value = node.get(DecisionRecord.ACTOR);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            // bare actor names predate the structured descriptor; the type stays unknown
            return new Actor(value.textValue(), value.textValue(), null);
        }
        if (!value.isObject()) {
            throw new RecordFormatException("actor must be an object");
        }
        return new Actor(text(value, "id"), text(value, "name"), text(value, "type"));
    }

    private Double confidence(JsonNode node) {
        JsonNode value = node.get(DecisionRecord.CONFIDENCE);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new RecordFormatException("confidence must be a number");
        }
        return value.doubleValue();
    }

    private List<String> lineage(JsonNode node) {
        JsonNode value = node.get(DecisionRecord.LINEAGE);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new RecordFormatException("lineage must be an array");
        }
        List<String> parents = new ArrayList<>(value.size());
        for (JsonNode parent : value) {
            if (!parent.isTextual() || parent.textValue().isBlank()) {
                throw new RecordFormatException("lineage entries must be non-empty strings");
            }
            parents.add(parent.textValue());
        }
        return parents;
    }
}
