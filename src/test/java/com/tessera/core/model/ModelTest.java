package com.tessera.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("WorkItem")
    class WorkItemTests {

        @Test
        @DisplayName("rejects out-of-range fields")
        void validation() {
            assertThrows(IllegalArgumentException.class, () -> new WorkItem(" ", "x", Set.of(), 3,
                    CollaborationMode.PAIR, 10, Set.of(), "execution"));
            assertThrows(IllegalArgumentException.class, () -> new WorkItem("ITEM-001", "", Set.of(), 3,
                    CollaborationMode.PAIR, 10, Set.of(), "execution"));
            assertThrows(IllegalArgumentException.class, () -> new WorkItem("ITEM-001", "x", Set.of(), 6,
                    CollaborationMode.PAIR, 10, Set.of(), "execution"));
            assertThrows(IllegalArgumentException.class, () -> new WorkItem("ITEM-001", "x", Set.of(), 3,
                    CollaborationMode.PAIR, 0, Set.of(), "execution"));
            assertThrows(IllegalArgumentException.class, () -> new WorkItem("ITEM-001", "x", Set.of(), 3,
                    null, 10, Set.of(), "execution"));
        }

        @Test
        @DisplayName("competency sets are immutable copies")
        void immutableSets() {
            var w = new WorkItem("ITEM-001", "x", new HashSet<>(Set.of("precision")), 3,
                    CollaborationMode.PAIR, 10, null, "execution");
            assertTrue(w.hasCompetency("precision"));
            assertTrue(w.dependencies().isEmpty());
            assertThrows(UnsupportedOperationException.class, () -> w.requiredCompetencies().add("x"));
        }
    }

    @Nested
    @DisplayName("Labels")
    class Labels {

        @ParameterizedTest
        @CsvSource({
                "approved, APPROVED",
                "Approved with adaptations, APPROVED_WITH_ADAPTATIONS",
                "needs adaptations, APPROVED_WITH_ADAPTATIONS",
                "requires-revision, REQUIRES_REVISION",
                "approve, APPROVED",
                "no idea, REQUIRES_REVISION"
        })
        @DisplayName("verdict labels read leniently")
        void verdicts(String label, Verdict expected) {
            assertEquals(expected, Verdict.fromLabel(label));
        }

        @ParameterizedTest
        @CsvSource({
                "TEA_nivel_1, ASD",
                "TDAH_combinado, ADHD",
                "altas_capacidades, GIFTED",
                "ninguno, TYPICAL",
                "dyslexia, OTHER"
        })
        @DisplayName("diagnostic categories map to neurotypes")
        void neurotypes(String category, Neurotype expected) {
            assertEquals(expected, Neurotype.fromDiagnosticCategory(category));
        }

        @Test
        @DisplayName("collaboration labels map to modes")
        void collaborationModes() {
            assertEquals(Optional.of(CollaborationMode.PAIR), CollaborationMode.fromLabel("in pairs"));
            assertEquals(Optional.of(CollaborationMode.GROUP), CollaborationMode.fromLabel("Team work"));
            assertEquals(Optional.of(CollaborationMode.INDIVIDUAL), CollaborationMode.fromLabel("solo"));
            assertEquals(Optional.empty(), CollaborationMode.fromLabel("whatever"));
            assertEquals(Optional.empty(), CollaborationMode.fromLabel(null));
        }
    }

    @Nested
    @DisplayName("AssignmentRecord")
    class AssignmentRecordTests {

        private final AssignmentRecord record = new AssignmentRecord(Map.of(
                "P1", List.of(new AssignmentEntry("ITEM-001", 0.7, "fit")),
                "P2", List.of(new AssignmentEntry("ITEM-002", 0.5, "fit"))));

        @Test
        @DisplayName("lookups by participant and item")
        void lookups() {
            assertEquals(2, record.totalAssigned());
            assertEquals(Optional.of("P2"), record.participantFor("ITEM-002"));
            assertEquals(Optional.empty(), record.participantFor("ITEM-009"));
            assertTrue(record.entriesFor("P9").isEmpty());
            assertTrue(AssignmentRecord.empty().isEmpty());
        }

        @Test
        @DisplayName("verify accepts a complete record")
        void verifyComplete() {
            assertDoesNotThrow(() -> record.verify(List.of("ITEM-001", "ITEM-002"), List.of("P1", "P2")));
        }

        @Test
        @DisplayName("verify names the broken invariant")
        void verifyBroken() {
            var missing = assertThrows(IllegalStateException.class,
                    () -> record.verify(List.of("ITEM-001", "ITEM-002", "ITEM-003"), List.of("P1", "P2")));
            assertTrue(missing.getMessage().contains("Assigned 2 of 3"));

            var unknown = assertThrows(IllegalStateException.class,
                    () -> record.verify(List.of("ITEM-001", "ITEM-002"), List.of("P1")));
            assertTrue(unknown.getMessage().contains("Unknown participant"));

            var twice = new AssignmentRecord(Map.of(
                    "P1", List.of(new AssignmentEntry("ITEM-001", 0.7, "fit")),
                    "P2", List.of(new AssignmentEntry("ITEM-001", 0.5, "fit"))));
            var duplicate = assertThrows(IllegalStateException.class,
                    () -> twice.verify(List.of("ITEM-001"), List.of("P1", "P2")));
            assertTrue(duplicate.getMessage().contains("assigned twice"));
        }
    }

    @Test
    @DisplayName("preference weights outside [0,1] are rejected")
    void preferenceWeights() {
        assertThrows(IllegalArgumentException.class, () -> new PreferenceWeights(1.1, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new PreferenceWeights(0, -0.1, 0));
        assertThrows(IllegalArgumentException.class, () -> new PreferenceWeights(0, 0, Double.NaN));
        assertEquals(0.0, PreferenceWeights.NEUTRAL.structure());
    }

    @Test
    @DisplayName("consensus states DECIDED and FALLBACK are terminal")
    void terminalStates() {
        assertTrue(ConsensusState.DECIDED.isTerminal());
        assertTrue(ConsensusState.FALLBACK.isTerminal());
        assertFalse(ConsensusState.COLLECTING.isTerminal());
    }
}
