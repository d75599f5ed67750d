package com.decisiontrace.tracer;

import com.decisiontrace.TestRecords;
import com.decisiontrace.contract.ContractViolationException;
import com.decisiontrace.contract.DecisionRecord;
import com.decisiontrace.contract.RecordContractValidator;
import com.decisiontrace.export.InMemoryRecordExporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class DecisionInstrumentationTest {

    private InMemoryRecordExporter sink;
    private DecisionTracer tracer;
    private DecisionInstrumentation instrumentation;

    @BeforeEach
    void setUp() {
        sink = new InMemoryRecordExporter();
        tracer = new DecisionTracer(new TraceDefaults("tenant-1", "test", List.of(sink)),
            Clock.systemUTC());
        instrumentation = new DecisionInstrumentation(tracer, new RecordContractValidator());
    }

    @Nested
    @DisplayName("Wrapped tasks")
    class WrappedTasks {

        @Test
        @DisplayName("The task's return value reaches the caller unchanged")
        void returnValue_unchanged() {
            Map<String, Object> mapping = TestRecords.decisionMapping("plan_evaluation");
            TracedTask<String> task = instrumentation.wrap(orderId -> mapping);

            assertSame(mapping, task.apply("ORD-1001"));
            assertEquals(1, sink.size());
            DecisionRecord record = sink.records().get(0);
            assertEquals("plan_evaluation", record.decisionType());
            assertEquals("policy-guard", record.actor().id());
            assertEquals("tenant-1", record.tenantId());
            assertNotNull(record.decisionId());
        }

        @Test
        @DisplayName("A task that throws emits nothing")
        void failingTask_emitsNothing() {
            TracedTask<String> task = instrumentation.wrap(orderId -> {
                throw new IllegalArgumentException("unknown order " + orderId);
            });

            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> task.apply("ORD-404"));
            assertEquals("unknown order ORD-404", ex.getMessage());
            assertTrue(sink.records().isEmpty());
        }

        @Test
        @DisplayName("Wrapping a traced task again does not double-emit")
        void doubleWrap_returnsSameTask() {
            TracedTask<String> once = instrumentation.wrap(orderId -> TestRecords.decisionMapping("t"));
            Function<String, Map<String, Object>> asFunction = once;
            TracedTask<String> twice = instrumentation.wrap(asFunction, "budget-policy");

            assertSame(once, twice);
            twice.apply("ORD-1");
            assertEquals(1, sink.size());
        }

        @Test
        void malformedMapping_raisesAndEmitsNothing() {
            TracedTask<String> task = instrumentation.wrap(orderId -> Map.of("decision_type", "t"));
            assertThrows(ContractViolationException.class, () -> task.apply("ORD-1"));
            assertTrue(sink.records().isEmpty());
        }

        @Test
        void reusedDecisionId_raises() {
            Map<String, Object> mapping = TestRecords.decisionMapping("plan_evaluation");
            mapping.put("decision_id", "d-fixed");
            TracedTask<String> task = instrumentation.wrap(orderId -> mapping);

            task.apply("ORD-1");
            assertThrows(DuplicateDecisionException.class, () -> task.apply("ORD-1"));
            assertEquals(1, sink.size());
        }
    }

    @Nested
    @DisplayName("Rejected payloads")
    class RejectedPayloads {

        @Test
        @DisplayName("A payload rejected by the recorder fails the scope without a second error")
        void selfLineage_failsScopeCleanly() {
            Map<String, Object> mapping = TestRecords.decisionMapping("plan_evaluation");
            mapping.put("decision_id", "d-self");
            mapping.put("lineage", List.of("d-self"));

            ContractViolationException ex = assertThrows(ContractViolationException.class,
                () -> instrumentation.emit(mapping, null));

            assertTrue(ex.getMessage().contains("d-self"));
            assertEquals(0, ex.getSuppressed().length);
            assertTrue(sink.records().isEmpty());
            assertFalse(tracer.isClaimed("d-self"));
        }

        @Test
        void idOfRejectedPayload_canBeRetried() {
            Map<String, Object> rejected = TestRecords.decisionMapping("plan_evaluation");
            rejected.put("decision_id", "d-retry");
            rejected.put("lineage", List.of("d-retry"));
            assertThrows(ContractViolationException.class, () -> instrumentation.emit(rejected, null));

            Map<String, Object> fixed = TestRecords.decisionMapping("plan_evaluation");
            fixed.put("decision_id", "d-retry");
            assertEquals("d-retry", instrumentation.emit(fixed, null).record().decisionId());
            assertEquals(1, sink.size());
        }
    }

    @Nested
    @DisplayName("Record mapping")
    class RecordMapping {

        @Test
        void policyId_addedToContext() {
            instrumentation.wrap(orderId -> TestRecords.decisionMapping("t"), "budget-policy").apply("ORD-1");
            assertEquals("budget-policy", sink.records().get(0).context().get("policy_id"));
        }

        @Test
        void taskPolicyId_isKept() {
            Map<String, Object> mapping = TestRecords.decisionMapping("t");
            @SuppressWarnings("unchecked")
            Map<String, Object> context = (Map<String, Object>) mapping.get("context");
            context.put("policy_id", "own-policy");

            instrumentation.wrap(orderId -> mapping, "budget-policy").apply("ORD-1");
            assertEquals("own-policy", sink.records().get(0).context().get("policy_id"));
        }

        @Test
        void optionalFields_carriedOver() {
            Map<String, Object> mapping = TestRecords.decisionMapping("final_plan_selected");
            mapping.put("decision_id", "d-final");
            mapping.put("lineage", List.of("d-1", "d-2"));
            mapping.put("confidence", 0.75);
            mapping.put("environment", "staging");
            mapping.put("timestamp", "1999-01-01T00:00:00Z");

            DecisionInstrumentation.Emission emission = instrumentation.emit(mapping, null);

            DecisionRecord record = emission.record();
            assertEquals("d-final", record.decisionId());
            assertEquals(List.of("d-1", "d-2"), record.lineage());
            assertEquals(0.75, record.confidence());
            assertEquals("staging", record.environment());
            assertTrue(record.timestamp().getEpochSecond() > 946684800L, "caller timestamp is ignored");
            assertTrue(emission.delivery().fullyDelivered());
        }

        @Test
        void evidenceAlias_becomesLogic() {
            Map<String, Object> mapping = TestRecords.decisionMapping("t");
            Object logic = mapping.remove("logic");
            mapping.put("evidence", logic);

            DecisionRecord record = instrumentation.emit(mapping, null).record();
            assertEquals(logic, record.logic());
        }

        @Test
        void call_emitsAndReturns() {
            Map<String, Object> mapping = TestRecords.decisionMapping("t");
            assertSame(mapping, instrumentation.call(() -> mapping));
            assertEquals(1, sink.size());
        }
    }
}
