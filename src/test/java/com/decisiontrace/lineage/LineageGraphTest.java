package com.decisiontrace.lineage;

import com.decisiontrace.TestRecords;
import com.decisiontrace.contract.DecisionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.decisiontrace.TestRecords.T0;
import static com.decisiontrace.TestRecords.record;
import static org.junit.jupiter.api.Assertions.*;

class LineageGraphTest {

    private static Instant at(int seconds) {
        return T0.plusSeconds(seconds);
    }

    @Nested
    @DisplayName("Navigation")
    class Navigation {

        private final LineageGraph graph = LineageGraph.build(List.of(
            record("c", at(3), "b"),
            record("b", at(2), "a"),
            record("a", at(1)),
            record("d", at(4), "a", "c", "a")));

        @Test
        void parentsAndChildren() {
            assertEquals(List.of("a"), graph.parentsOf("b"));
            assertEquals(List.of("a", "c"), graph.parentsOf("d"), "repeated parents collapse");
            assertEquals(List.of("b", "d"), graph.childrenOf("a"));
            assertEquals(List.of(), graph.childrenOf("d"));
            assertEquals(List.of(), graph.parentsOf("unknown"));
        }

        @Test
        void ancestors_excludeSelf() {
            assertEquals(Set.of("a", "b", "c"), graph.ancestorsOf("d"));
            assertEquals(Set.of(), graph.ancestorsOf("a"));
        }

        @Test
        void topologicalOrder_parentsFirst() {
            List<String> order = graph.topologicalOrder().stream().map(DecisionRecord::decisionId).toList();
            assertEquals(List.of("a", "b", "c", "d"), order);
        }

        @Test
        @DisplayName("Ties in topological order break by timestamp, then id")
        void topologicalOrder_tieBreak() {
            LineageGraph roots = LineageGraph.build(List.of(
                record("r1", at(5)),
                record("r2", at(1)),
                record("r0", at(5))));
            List<String> order = roots.topologicalOrder().stream().map(DecisionRecord::decisionId).toList();
            assertEquals(List.of("r2", "r0", "r1"), order);
        }

        @Test
        void lookups() {
            assertEquals(4, graph.size());
            assertTrue(graph.contains("a"));
            assertTrue(graph.record("b").isPresent());
            assertTrue(graph.record("zz").isEmpty());
            assertTrue(graph.isAcyclic());
            assertTrue(graph.danglingReferences().isEmpty());
        }
    }

    @Nested
    @DisplayName("Defects")
    class Defects {

        @Test
        void danglingParent_reported() {
            LineageGraph graph = LineageGraph.build(List.of(record("B", T0, "A")));
            assertEquals(List.of(new LineageReference("B", "A")), graph.danglingReferences());
            assertEquals(List.of(), graph.parentsOf("B"));
        }

        @Test
        void cycle_detected() {
            LineageGraph graph = LineageGraph.build(List.of(
                record("x", at(1), "y"),
                record("y", at(2), "x"),
                record("z", at(3), "x")));
            assertFalse(graph.isAcyclic());
            assertEquals(List.of(List.of("x", "y")), graph.cycles());
            assertThrows(IllegalStateException.class, graph::topologicalOrder);
        }

        @Test
        void selfCitation_isCycleOfOne() {
            LineageGraph graph = LineageGraph.build(List.of(record("s", T0, "s")));
            assertEquals(List.of(List.of("s")), graph.cycles());
        }

        @Test
        @DisplayName("Deep chains do not exhaust the stack")
        void deepChain_handled() {
            List<DecisionRecord> chain = new ArrayList<>();
            chain.add(record("n0", T0));
            for (int i = 1; i < 20_000; i++) {
                chain.add(record("n" + i, at(i), "n" + (i - 1)));
            }
            LineageGraph graph = LineageGraph.build(chain);
            assertTrue(graph.isAcyclic());
            assertEquals(19_999, graph.ancestorsOf("n19999").size());
        }

        @Test
        void identicalCopies_collapseToOneNode() {
            DecisionRecord a = record("a", T0);
            LineageGraph graph = LineageGraph.build(List.of(a, a, a));
            assertEquals(1, graph.size());
            assertEquals(Map.of("a", 3), graph.duplicates());
            assertTrue(graph.structuralConflicts().isEmpty());
        }

        @Test
        @DisplayName("Conflicting records are excluded and not reported again as dangling")
        void conflictingRecords_excluded() {
            DecisionRecord first = record("a", T0);
            DecisionRecord second = TestRecords.withConfidence(first, 0.1);
            LineageGraph graph = LineageGraph.build(List.of(first, second, record("b", at(1), "a")));

            assertFalse(graph.contains("a"));
            assertEquals(1, graph.structuralConflicts().size());
            StructuralConflict conflict = graph.structuralConflicts().get(0);
            assertEquals("a", conflict.decisionId());
            assertEquals(2, conflict.variants());
            assertEquals(List.of("confidence"), conflict.differingFields());
            assertTrue(graph.danglingReferences().isEmpty());
        }

        @Test
        void recordWithoutId_rejected() {
            DecisionRecord anonymous = record(" ", T0);
            assertThrows(IllegalArgumentException.class, () -> LineageGraph.build(List.of(anonymous)));
        }
    }

    @Nested
    @DisplayName("Scope")
    class Scope {

        @Test
        void globalScope_resolvesExternalIds() {
            LineageGraph graph = LineageGraph.build(List.of(record("b", T0, "prior-run-a")),
                LineageScope.GLOBAL, Set.of("prior-run-a"));
            assertTrue(graph.danglingReferences().isEmpty());
            assertEquals(List.of(new LineageReference("b", "prior-run-a")), graph.externalReferences());
        }

        @Test
        void runLocalScope_ignoresExternalIds() {
            LineageGraph graph = LineageGraph.build(List.of(record("b", T0, "prior-run-a")),
                LineageScope.RUN_LOCAL, Set.of("prior-run-a"));
            assertEquals(1, graph.danglingReferences().size());
            assertTrue(graph.externalReferences().isEmpty());
        }
    }
}
