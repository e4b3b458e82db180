package com.tessera.core.participant;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A participant as written in the participants file. Explicit strengths, support needs,
 * availability and role history win; otherwise they are derived from the raw traits.
 *
 * @param id                   unique id
 * @param name                 display name
 * @param diagnosticCategory   e.g. "TEA_nivel_1", "TDAH", "altas_capacidades", "none"
 * @param supportLevel         low / medium / high (bajo / medio / alto)
 * @param learningStyle        visual, auditory, kinesthetic
 * @param preferredChannel     visual, auditory, kinesthetic
 * @param temperament          e.g. "reflective", "impulsive"
 * @param frustrationTolerance low / medium / high
 * @param interests            free interest labels
 * @param strengths            explicit strengths
 * @param supportNeeds         explicit support needs
 * @param availability         explicit availability 0-100
 * @param roleHistory          explicit role history
 */
public record ParticipantRecord(
    String id,
    String name,
    @JsonProperty("diagnostic_category") String diagnosticCategory,
    @JsonProperty("support_level") String supportLevel,
    @JsonProperty("learning_style") List<String> learningStyle,
    @JsonProperty("preferred_channel") String preferredChannel,
    String temperament,
    @JsonProperty("frustration_tolerance") String frustrationTolerance,
    List<String> interests,
    List<String> strengths,
    @JsonProperty("support_needs") List<String> supportNeeds,
    Integer availability,
    @JsonProperty("role_history") List<String> roleHistory
) {

    /**
     * Record with only the explicit profile fields set.
     */
    public static ParticipantRecord explicit(String id, String name, String diagnosticCategory,
                                             List<String> strengths, List<String> supportNeeds,
                                             Integer availability) {
        return new ParticipantRecord(id, name, diagnosticCategory, null, null, null, null, null,
                null, strengths, supportNeeds, availability, null);
    }
}
