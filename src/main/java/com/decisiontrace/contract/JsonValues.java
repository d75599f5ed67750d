package com.decisiontrace.contract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;

/**
 * The JSON shape of record payloads.
 *
 * A record's maps hold exactly the value types a sink line decodes to: strings,
 * booleans, Integer or Long by magnitude, Double for fractions, nested maps and
 * lists. Payloads built in-process (Long, Float, BigDecimal, enums, Instants) are
 * written as JSON text and read back, so a record equals its replayed copy.
 */
public final class JsonValues {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final ObjectMapper MAPPER = newMapper();

    private JsonValues() {}

    /** Mapper configuration shared by record normalization and the sink codec. */
    public static ObjectMapper newMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /**
     * Unmodifiable deep copy in JSON shape; null stays null.
     *
     * @throws ContractViolationException if a value cannot be written as JSON
     */
    public static Map<String, Object> normalize(Map<String, ?> source) {
        if (source == null) {
            return null;
        }
        Map<String, Object> plain;
        try {
            plain = MAPPER.readValue(MAPPER.writeValueAsString(source), MAP_TYPE);
        } catch (JsonProcessingException ex) {
            throw new ContractViolationException("payload is not representable as JSON: " + ex.getOriginalMessage());
        }
        return ImmutableCopies.map(plain);
    }
}
