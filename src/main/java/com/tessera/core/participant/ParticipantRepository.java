package com.tessera.core.participant;

import com.tessera.core.model.ParticipantProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of participant profiles, in file order. Safe for concurrent reads.
 */
public class ParticipantRepository {

    private static final Logger log = LoggerFactory.getLogger(ParticipantRepository.class);

    private final List<ParticipantProfile> profiles;
    private final Map<String, ParticipantProfile> byId;

    public ParticipantRepository(List<ParticipantProfile> profiles) {
        var index = new LinkedHashMap<String, ParticipantProfile>();
        for (ParticipantProfile profile : profiles) {
            if (index.putIfAbsent(profile.id(), profile) != null) {
                throw new IllegalArgumentException("Duplicate participant id: " + profile.id());
            }
        }
        this.profiles = List.copyOf(profiles);
        this.byId = Collections.unmodifiableMap(index);
    }

    /**
     * Builds a repository from raw records, deriving each profile.
     *
     * @throws IllegalArgumentException on duplicate ids or invalid records
     */
    public static ParticipantRepository of(List<ParticipantRecord> records) {
        var profiles = new ArrayList<ParticipantProfile>(records.size());
        for (ParticipantRecord record : records) {
            profiles.add(ParticipantProfileFactory.toProfile(record));
        }
        log.debug("Built repository of {} participants", profiles.size());
        return new ParticipantRepository(profiles);
    }

    public static ParticipantRepository empty() {
        return new ParticipantRepository(List.of());
    }

    public List<ParticipantProfile> findAll() {
        return profiles;
    }

    public Optional<ParticipantProfile> findById(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public int size() {
        return profiles.size();
    }

    public boolean isEmpty() {
        return profiles.isEmpty();
    }
}
