package com.decisiontrace.export;

import com.decisiontrace.TestRecords;
import com.decisiontrace.contract.Actor;
import com.decisiontrace.contract.DecisionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RecordCodecTest {

    private RecordCodec codec;

    @BeforeEach
    void setUp() {
        codec = new RecordCodec();
    }

    @Nested
    @DisplayName("Encoding")
    class Encoding {

        @Test
        void encodedRecord_isOneLineInFieldOrder() {
            String line = codec.encode(TestRecords.record("d-1", TestRecords.T0, "d-0"));

            assertFalse(line.contains("\n"));
            assertTrue(line.startsWith("{\"decision_id\":\"d-1\",\"decision_type\":\"plan_evaluation\""));
            assertTrue(line.contains("\"timestamp\":\"2026-03-01T10:00:00Z\""));
            assertTrue(line.contains("\"lineage\":[\"d-0\"]"));
        }

        @Test
        void decodeOfEncoded_isEqual() {
            DecisionRecord record = TestRecords.record("d-1", TestRecords.T0, "d-0");
            assertEquals(record, codec.decode(codec.encode(record)));
        }

        @Test
        @DisplayName("Records built from Java-typed payloads equal their decoded copy")
        void javaTypedPayload_survivesSinkRoundTrip() {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("amount", 5L);
            context.put("ratio", 1.5f);
            context.put("price", new BigDecimal("2.50"));
            context.put("unit", TimeUnit.SECONDS);
            context.put("requested_at", TestRecords.T0);
            DecisionRecord record = TestRecords.withContext(TestRecords.record("d-1", TestRecords.T0), context);

            assertEquals(record, codec.decode(codec.encode(record)));
            assertEquals(5, record.context().get("amount"));
            assertEquals(1.5, record.context().get("ratio"));
            assertEquals(2.5, record.context().get("price"));
            assertEquals("SECONDS", record.context().get("unit"));
            assertEquals("2026-03-01T10:00:00Z", record.context().get("requested_at"));
        }
    }

    @Nested
    @DisplayName("Decoding")
    class Decoding {

        @Test
        void offsetTimestamp_normalizedToInstant() {
            DecisionRecord record = codec.decode(
                "{\"decision_id\":\"d-1\",\"timestamp\":\"2026-03-01T12:00:00+02:00\"}");
            assertEquals(Instant.parse("2026-03-01T10:00:00Z"), record.timestamp());
        }

        @Test
        void missingFields_loadAsNull() {
            DecisionRecord record = codec.decode("{\"decision_id\":\"d-1\"}");
            assertNull(record.decisionType());
            assertNull(record.logic());
            assertNull(record.actor());
            assertEquals(List.of(), record.lineage());
        }

        @Test
        void bareActorName_hasNoType() {
            DecisionRecord record = codec.decode("{\"decision_id\":\"d-1\",\"actor\":\"planner\"}");
            assertEquals(new Actor("planner", "planner", null), record.actor());
        }

        @Test
        void evidenceField_readAsLogic() {
            DecisionRecord record = codec.decode(
                "{\"decision_id\":\"d-1\",\"evidence\":{\"reason_codes\":[\"BUDGET_OK\"]}}");
            assertEquals(Map.of("reason_codes", List.of("BUDGET_OK")), record.logic());
        }

        @Test
        void logicField_winsOverEvidence() {
            DecisionRecord record = codec.decode(
                "{\"decision_id\":\"d-1\",\"logic\":{\"rule\":\"a\"},\"evidence\":{\"rule\":\"b\"}}");
            assertEquals(Map.of("rule", "a"), record.logic());
        }

        @Test
        void malformedJson_rejected() {
            RecordFormatException ex = assertThrows(RecordFormatException.class,
                () -> codec.decode("{\"decision_id\":"));
            assertTrue(ex.getMessage().startsWith("malformed JSON"));
        }

        @Test
        void nonObjectLine_rejected() {
            assertThrows(RecordFormatException.class, () -> codec.decode("[1, 2]"));
        }

        @Test
        void missingDecisionId_rejected() {
            RecordFormatException ex = assertThrows(RecordFormatException.class,
                () -> codec.decode("{\"decision_type\":\"t\"}"));
            assertTrue(ex.getMessage().contains("decision_id"));
        }

        @Test
        void timestampWithoutOffset_rejected() {
            assertThrows(RecordFormatException.class,
                () -> codec.decode("{\"decision_id\":\"d-1\",\"timestamp\":\"2026-03-01T10:00:00\"}"));
        }

        @Test
        void lineageOfNumbers_rejected() {
            assertThrows(RecordFormatException.class,
                () -> codec.decode("{\"decision_id\":\"d-1\",\"lineage\":[1]}"));
        }

        @Test
        void confidenceAsText_rejected() {
            assertThrows(RecordFormatException.class,
                () -> codec.decode("{\"decision_id\":\"d-1\",\"confidence\":\"0.5\"}"));
        }
    }
}
