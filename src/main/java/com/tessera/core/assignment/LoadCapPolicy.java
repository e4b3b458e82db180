package com.tessera.core.assignment;

import com.tessera.core.model.ParticipantProfile;

/**
 * How many items a participant takes before the greedy pass looks elsewhere.
 * Two by default, three above 80% availability, one below 70%.
 */
public final class LoadCapPolicy {

    static final int BASE_CAP = 2;

    private LoadCapPolicy() {} // utility class

    public static int capFor(ParticipantProfile participant) {
        int availability = participant.availability();
        int cap = BASE_CAP + (availability > 80 ? 1 : 0) - (availability < 70 ? 1 : 0);
        return Math.max(1, cap);
    }
}
