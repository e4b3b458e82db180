package com.tessera.core.assignment;

import com.tessera.core.model.Neurotype;
import com.tessera.core.model.ParticipantProfile;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LoadCapPolicyTest {

    @ParameterizedTest(name = "availability {0} -> cap {1}")
    @CsvSource({"100, 3", "90, 3", "81, 3", "80, 2", "70, 2", "69, 1", "60, 1", "0, 1"})
    void capFollowsAvailability(int availability, int expectedCap) {
        var p = new ParticipantProfile("P1", "P1", Set.of(), Set.of(), Neurotype.TYPICAL, availability, List.of(), null);
        assertEquals(expectedCap, LoadCapPolicy.capFor(p));
    }
}
