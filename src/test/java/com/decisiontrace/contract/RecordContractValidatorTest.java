package com.decisiontrace.contract;

import com.decisiontrace.TestRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecordContractValidatorTest {

    private RecordContractValidator validator;
    private Map<String, Object> mapping;

    @BeforeEach
    void setUp() {
        validator = new RecordContractValidator();
        mapping = TestRecords.decisionMapping("plan_evaluation");
    }

    @Nested
    @DisplayName("Required fields")
    class RequiredFields {

        @Test
        void completeMapping_passes() {
            assertDoesNotThrow(() -> validator.validate(mapping));
        }

        @Test
        void nullMapping_rejected() {
            assertThrows(ContractViolationException.class, () -> validator.validate(null));
        }

        @Test
        void missingDecisionType_rejected() {
            mapping.remove("decision_type");
            ContractViolationException ex = assertThrows(ContractViolationException.class,
                () -> validator.validate(mapping));
            assertTrue(ex.getMessage().contains("decision_type"));
        }

        @Test
        void missingOutcome_rejected() {
            mapping.remove("outcome");
            assertThrows(ContractViolationException.class, () -> validator.validate(mapping));
        }

        @Test
        void contextMustBeObject() {
            mapping.put("context", "order 1001");
            ContractViolationException ex = assertThrows(ContractViolationException.class,
                () -> validator.validate(mapping));
            assertTrue(ex.getMessage().contains("context"));
        }

        @Test
        @DisplayName("evidence is accepted in place of logic")
        void evidenceAlias_accepted() {
            Object logic = mapping.remove("logic");
            mapping.put("evidence", logic);
            assertDoesNotThrow(() -> validator.validate(mapping));
            assertEquals(logic, validator.logicOf(mapping));
        }
    }

    @Nested
    @DisplayName("Actor")
    class ActorField {

        @Test
        void bareString_namesAnAgent() {
            Actor actor = validator.toActor("planner");
            assertEquals(new Actor("planner", "planner", Actor.AGENT), actor);
        }

        @Test
        void descriptorWithoutId_rejected() {
            mapping.put("actor", Map.of("name", "Planner"));
            ContractViolationException ex = assertThrows(ContractViolationException.class,
                () -> validator.validate(mapping));
            assertTrue(ex.getMessage().contains("actor.id"));
        }

        @Test
        void blankString_rejected() {
            mapping.put("actor", "  ");
            assertThrows(ContractViolationException.class, () -> validator.validate(mapping));
        }
    }

    @Nested
    @DisplayName("Optional fields")
    class OptionalFields {

        @Test
        void confidenceOutOfRange_rejected() {
            mapping.put("confidence", 1.5);
            assertThrows(ContractViolationException.class, () -> validator.validate(mapping));
        }

        @Test
        void confidenceNotNumber_rejected() {
            mapping.put("confidence", "high");
            assertThrows(ContractViolationException.class, () -> validator.validate(mapping));
        }

        @Test
        void lineageWithBlankEntry_rejected() {
            mapping.put("lineage", List.of("d-1", ""));
            assertThrows(ContractViolationException.class, () -> validator.validate(mapping));
        }

        @Test
        void lineageNotList_rejected() {
            mapping.put("lineage", "d-1");
            assertThrows(ContractViolationException.class, () -> validator.validate(mapping));
        }

        @Test
        void blankDecisionId_rejected() {
            mapping.put("decision_id", "");
            assertThrows(ContractViolationException.class, () -> validator.validate(mapping));
        }

        @Test
        void tenantMustBeString() {
            mapping.put("tenant_id", 42);
            assertThrows(ContractViolationException.class, () -> validator.validate(mapping));
        }
    }
}
