package com.tessera.core.participant;

import com.tessera.core.model.Neurotype;
import com.tessera.core.model.ParticipantProfile;
import com.tessera.core.normalize.FieldValues;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derives a {@link ParticipantProfile} from a {@link ParticipantRecord}.
 * <p>
 * Raw trait values are accepted in English or Spanish ("high"/"alto"/"alta").
 */
public final class ParticipantProfileFactory {

    static final int BASE_AVAILABILITY = 85;
    static final int MIN_DERIVED_AVAILABILITY = 60;
    static final int MAX_DERIVED_AVAILABILITY = 100;

    public static final String STRUCTURED_ROUTINES = "structured-routines";

    private enum Level { LOW, MEDIUM, HIGH, UNKNOWN }

    private static final Map<String, String> INTEREST_STRENGTHS = Map.ofEntries(
            Map.entry("science", "scientific-curiosity"),
            Map.entry("ciencias", "scientific-curiosity"),
            Map.entry("experiments", "experimentation"),
            Map.entry("experimentos", "experimentation"),
            Map.entry("teamwork", "collaboration"),
            Map.entry("trabajo-en-grupo", "collaboration"),
            Map.entry("trabajo-colaborativo", "collaboration"),
            Map.entry("reading", "reading-comprehension"),
            Map.entry("lectura", "reading-comprehension"),
            Map.entry("math", "precision"),
            Map.entry("matemáticas", "precision"),
            Map.entry("art", "creativity"),
            Map.entry("arte", "creativity"),
            Map.entry("drawing", "creativity"),
            Map.entry("sports", "movement"),
            Map.entry("deportes", "movement"),
            Map.entry("theatre", "improvisation"),
            Map.entry("teatro", "improvisation")
    );

    private static final Map<String, String> INTEREST_ROLES = Map.ofEntries(
            Map.entry("science", "scientific-researcher"),
            Map.entry("ciencias", "scientific-researcher"),
            Map.entry("experiments", "experimenter"),
            Map.entry("experimentos", "experimenter"),
            Map.entry("teamwork", "group-facilitator"),
            Map.entry("trabajo-colaborativo", "group-facilitator"),
            Map.entry("trabajo-en-grupo", "group-facilitator"),
            Map.entry("reading", "information-analyst"),
            Map.entry("lectura", "information-analyst")
    );

    private ParticipantProfileFactory() {} // utility class

    public static ParticipantProfile toProfile(ParticipantRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("Participant record must not be null");
        }
        Neurotype neurotype = Neurotype.fromDiagnosticCategory(record.diagnosticCategory());
        Set<String> strengths = isEmpty(record.strengths())
                ? deriveStrengths(record)
                : FieldValues.normalizeTags(new LinkedHashSet<>(record.strengths()));
        Set<String> supportNeeds = record.supportNeeds() == null
                ? deriveSupportNeeds(record, neurotype)
                : FieldValues.normalizeTags(new LinkedHashSet<>(record.supportNeeds()));
        int availability = record.availability() != null ? record.availability() : deriveAvailability(record);
        List<String> roles = isEmpty(record.roleHistory()) ? deriveRoles(record, neurotype) : record.roleHistory();
        return new ParticipantProfile(record.id(), record.name(), strengths, supportNeeds, neurotype,
                availability, roles, preferredChannel(record.preferredChannel()));
    }

    static Set<String> deriveStrengths(ParticipantRecord record) {
        var strengths = new LinkedHashSet<String>();
        for (String interest : list(record.interests())) {
            String strength = INTEREST_STRENGTHS.get(FieldValues.normalizeTag(interest));
            if (strength != null) {
                strengths.add(strength);
            }
        }
        String temperament = lower(record.temperament());
        if (temperament.startsWith("reflect") || temperament.startsWith("reflexiv")) {
            strengths.add("analytical-thinking");
        }
        if (level(record.frustrationTolerance()) == Level.HIGH) {
            strengths.add("perseverance");
        }
        return strengths;
    }

    static Set<String> deriveSupportNeeds(ParticipantRecord record, Neurotype neurotype) {
        var needs = new LinkedHashSet<String>();
        switch (level(record.supportLevel())) {
            case HIGH -> needs.add("continuous-supervision");
            case MEDIUM -> needs.add("regular-check-ins");
            default -> { }
        }
        if (level(record.frustrationTolerance()) == Level.LOW) {
            needs.add("emotional-support");
            needs.add("graded-tasks");
        }
        switch (channelOrEmpty(record.preferredChannel())) {
            case "visual" -> needs.add("visual-supports");
            case "auditory" -> needs.add("verbal-explanations");
            case "kinesthetic" -> needs.add("hands-on-activities");
            default -> { }
        }
        switch (neurotype) {
            case ASD -> {
                needs.add(STRUCTURED_ROUTINES);
                needs.add("predictable-environment");
            }
            case ADHD -> {
                needs.add("clear-instructions");
                needs.add("frequent-breaks");
            }
            case GIFTED -> {
                needs.add("extra-challenges");
                needs.add("autonomous-projects");
            }
            default -> { }
        }
        return needs;
    }

    static int deriveAvailability(ParticipantRecord record) {
        int availability = BASE_AVAILABILITY;
        switch (level(record.supportLevel())) {
            case LOW -> availability += 10;
            case HIGH -> availability -= 15;
            default -> { }
        }
        switch (level(record.frustrationTolerance())) {
            case HIGH -> availability += 5;
            case LOW -> availability -= 10;
            default -> { }
        }
        String temperament = lower(record.temperament());
        if (temperament.startsWith("impuls")) {
            availability -= 5;
        }
        return Math.max(MIN_DERIVED_AVAILABILITY, Math.min(MAX_DERIVED_AVAILABILITY, availability));
    }

    static List<String> deriveRoles(ParticipantRecord record, Neurotype neurotype) {
        var roles = new LinkedHashSet<String>();
        for (String style : list(record.learningStyle())) {
            switch (channelOrEmpty(style)) {
                case "visual" -> roles.add("visual-designer");
                case "auditory" -> roles.add("communicator");
                case "kinesthetic" -> roles.add("experimenter");
                default -> { }
            }
        }
        for (String interest : list(record.interests())) {
            String role = INTEREST_ROLES.get(FieldValues.normalizeTag(interest));
            if (role != null) {
                roles.add(role);
            }
        }
        if (neurotype == Neurotype.GIFTED) {
            roles.add("academic-mentor");
        }
        return new ArrayList<>(roles);
    }

    /**
     * Canonical channel name, or null when the value is blank or unknown.
     */
    static String channel(String value) {
        String v = lower(value);
        if (v.startsWith("visual")) {
            return "visual";
        }
        if (v.startsWith("audit")) {
            return "auditory";
        }
        if (v.startsWith("kines") || v.startsWith("kinés") || v.startsWith("cines")) {
            return "kinesthetic";
        }
        return null;
    }

    private static String channelOrEmpty(String value) {
        String canonical = channel(value);
        return canonical != null ? canonical : "";
    }

    private static String preferredChannel(String value) {
        String canonical = channel(value);
        if (canonical != null) {
            return canonical;
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Level level(String value) {
        String v = lower(value);
        if (v.startsWith("low") || v.startsWith("baj")) {
            return Level.LOW;
        }
        if (v.startsWith("med")) {
            return Level.MEDIUM;
        }
        if (v.startsWith("high") || v.startsWith("alt")) {
            return Level.HIGH;
        }
        return Level.UNKNOWN;
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private static List<String> list(List<String> value) {
        return value != null ? value : List.of();
    }

    private static boolean isEmpty(List<String> value) {
        return value == null || value.isEmpty();
    }
}
