package com.tessera.core.participant;

import com.tessera.core.model.Neurotype;
import com.tessera.core.model.ParticipantProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ParticipantProfileFactoryTest {

    private static ParticipantRecord raw(String id, String diagnosis, String supportLevel, String channel,
                                         String temperament, String tolerance, List<String> interests) {
        return new ParticipantRecord(id, id, diagnosis, supportLevel, List.of(channel), channel, temperament,
                tolerance, interests, null, null, null, null);
    }

    @Test
    @DisplayName("ASD participant derives structure-related support needs")
    void asdProfile() {
        ParticipantProfile p = ParticipantProfileFactory.toProfile(
                raw("P1", "TEA_nivel_1", "medium", "visual", "reflective", "medium", List.of("science", "math")));

        assertEquals(Neurotype.ASD, p.neurotype());
        assertEquals(List.of("scientific-curiosity", "precision", "analytical-thinking"), List.copyOf(p.strengths()));
        assertEquals(List.of("regular-check-ins", "visual-supports", "structured-routines", "predictable-environment"),
                List.copyOf(p.supportNeeds()));
        assertEquals(85, p.availability());
        assertEquals(List.of("visual-designer", "scientific-researcher"), p.roleHistory());
        assertEquals("visual", p.preferredChannel());
    }

    @Test
    @DisplayName("Low tolerance and impulsivity lower availability")
    void adhdProfile() {
        ParticipantProfile p = ParticipantProfileFactory.toProfile(
                raw("P2", "TDAH_combinado", "low", "kinesthetic", "impulsive", "low", List.of("sports", "experiments")));

        assertEquals(Neurotype.ADHD, p.neurotype());
        assertEquals(Set.of("movement", "experimentation"), p.strengths());
        assertEquals(Set.of("emotional-support", "graded-tasks", "hands-on-activities", "clear-instructions",
                "frequent-breaks"), p.supportNeeds());
        assertEquals(80, p.availability());
    }

    @Test
    @DisplayName("Derived availability is clamped to 100")
    void giftedProfileClamped() {
        ParticipantProfile p = ParticipantProfileFactory.toProfile(
                raw("P3", "altas_capacidades", "low", "auditory", "reflective", "high", List.of("reading")));

        assertEquals(Neurotype.GIFTED, p.neurotype());
        assertEquals(100, p.availability());
        assertTrue(p.strengths().contains("perseverance"));
        assertTrue(p.roleHistory().contains("academic-mentor"));
        assertTrue(p.supportNeeds().contains("extra-challenges"));
    }

    @Test
    @DisplayName("Explicit values win over derived ones")
    void explicitValuesWin() {
        ParticipantProfile p = ParticipantProfileFactory.toProfile(
                ParticipantRecord.explicit("X1", "Xu", "ASD", List.of("Precision"), List.of(), 72));

        assertEquals(Set.of("precision"), p.strengths());
        assertTrue(p.supportNeeds().isEmpty());
        assertEquals(72, p.availability());
        assertTrue(p.roleHistory().isEmpty());
    }

    @Test
    @DisplayName("Unknown diagnosis maps to OTHER and missing diagnosis to TYPICAL")
    void neurotypes() {
        assertEquals(Neurotype.OTHER, ParticipantProfileFactory.toProfile(
                ParticipantRecord.explicit("A", "A", "dyslexia", null, null, 90)).neurotype());
        assertEquals(Neurotype.TYPICAL, ParticipantProfileFactory.toProfile(
                ParticipantRecord.explicit("B", "B", null, null, null, 90)).neurotype());
    }

    @Test
    @DisplayName("Out of range explicit availability is rejected")
    void invalidAvailability() {
        assertThrows(IllegalArgumentException.class, () -> ParticipantProfileFactory.toProfile(
                ParticipantRecord.explicit("A", "A", null, null, null, 140)));
    }
}
