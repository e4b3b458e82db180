package com.tessera.core.prompt;

import com.tessera.core.consensus.ConsensusRequest;
import com.tessera.core.model.ParticipantProfile;
import com.tessera.core.model.PreferenceWeights;
import com.tessera.core.model.ProposalRole;
import com.tessera.core.model.ProposalStructure;
import com.tessera.core.model.WorkItem;
import com.tessera.core.retrieval.RankedExample;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds every prompt Tessera sends to the text service.
 */
@Component
public class PromptBuilder {

    static final String DECOMPOSITION_INSTRUCTIONS = """
            You are planning an inclusive classroom activity. Break the activity below into
            between 3 and %d atomic tasks that one participant, a pair or a small group can do.

            Write every task in exactly this format and nothing else:

            TASK 1:
            Description: <what the participant does>
            Competencies: <comma separated skills, e.g. collaboration, precision, creativity>
            Complexity: <1-5>
            Type: <individual | pair | group>
            Dependencies: <TASK numbers that must come first, or none>
            Duration: <minutes>
            Stage: <preparation | execution | reflection>
            """;

    static final String REPLAY_INSTRUCTIONS = """
            The text below was meant to list the tasks of an activity but could not be read.
            Rewrite the same tasks as JSON. Keep their meaning; do not add commentary.
            """;

    static final String OPTIMIZER_INSTRUCTIONS = """
            Assign every task below to exactly one participant. Balance the load, match tasks
            to strengths and respect each participant's support needs.
            Answer only with JSON of the form:
            {"assignments": {"<participant id>": ["task_01", "task_02"]}}
            Use the participant ids and task ids exactly as listed. Every task must appear once.
            """;

    static final String COLLABORATOR_FORMAT = """
            Answer only with JSON of the form:
            {"activity_type": "...", "stages": ["..."], "collaboration_mode": "individual|pair|group",
             "suggested_item_count": 4, "summary": "...",
             "adaptations": ["..."], "adjustments": ["..."],
             "verdict": "approved|approved_with_adaptations|requires_revision", "score": 0.0}
            """;

    public String decompositionPrompt(String intent, List<RankedExample> examples,
                                      ProposalStructure structure, int maxItems) {
        var sb = new StringBuilder();
        sb.append(String.format(DECOMPOSITION_INSTRUCTIONS, Math.max(3, maxItems)));
        sb.append("\nACTIVITY:\n").append(intent.strip()).append('\n');
        appendStructure(sb, structure);
        if (examples != null && !examples.isEmpty()) {
            sb.append("\nSIMILAR ACTIVITIES FOR REFERENCE:\n");
            for (var ranked : examples) {
                var ex = ranked.example();
                sb.append("- ").append(ex.title());
                if (!ex.description().isBlank()) {
                    sb.append(": ").append(ex.description());
                }
                if (!ex.stages().isEmpty()) {
                    sb.append(" (stages: ").append(String.join(", ", ex.stages())).append(')');
                }
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    public String replayPrompt(String intent, String previousText, String formatInstructions,
                               ProposalStructure structure) {
        var sb = new StringBuilder(REPLAY_INSTRUCTIONS);
        sb.append("\nACTIVITY:\n").append(intent.strip()).append('\n');
        appendStructure(sb, structure);
        if (previousText != null && !previousText.isBlank()) {
            sb.append("\nPREVIOUS TEXT:\n").append(previousText.strip()).append('\n');
        } else {
            sb.append("\nThere was no usable previous text; decompose the activity from scratch.\n");
        }
        sb.append('\n').append(formatInstructions);
        return sb.toString();
    }

    /**
     * @param localItems local task id ({@code task_01}, ...) to item, in batch order
     */
    public String optimizerPrompt(Map<String, WorkItem> localItems, List<ParticipantProfile> participants,
                                  PreferenceWeights weights) {
        var sb = new StringBuilder(OPTIMIZER_INSTRUCTIONS);
        sb.append("\nTASKS:\n");
        localItems.forEach((localId, item) -> sb.append("- ").append(localId).append(": ")
                .append(item.description())
                .append(" [competencies: ").append(String.join(", ", item.requiredCompetencies()))
                .append("; complexity ").append(item.complexity())
                .append("; ").append(item.collaborationMode().name().toLowerCase(Locale.ROOT))
                .append("]\n"));
        sb.append("\nPARTICIPANTS:\n");
        for (var p : participants) {
            sb.append("- ").append(p.id()).append(" (").append(p.name()).append("): strengths ")
                    .append(String.join(", ", p.strengths()))
                    .append("; support needs ").append(p.supportNeeds().isEmpty() ? "none" : String.join(", ", p.supportNeeds()))
                    .append("; availability ").append(p.availability())
                    .append('\n');
        }
        appendWeights(sb, weights);
        return sb.toString();
    }

    public String collaboratorPrompt(ProposalRole role, ConsensusRequest request) {
        var sb = new StringBuilder();
        sb.append(switch (role) {
            case STRUCTURAL -> """
                    You design classroom activities. Propose a structure for the activity below:
                    its type, ordered stages, dominant collaboration mode and how many tasks it needs.
                    """;
            case PEDAGOGICAL -> """
                    You are a specialist in inclusive pedagogy. Evaluate how the activity below serves
                    participants with different support needs. List the adaptations it requires and
                    give a verdict with a score between 0 and 1.
                    """;
            case FEASIBILITY -> """
                    You check classroom feasibility: time, materials, space and supervision. Evaluate the
                    activity below, list practical adjustments and give a verdict with a score between 0 and 1.
                    """;
        });
        sb.append("\nACTIVITY:\n").append(request.intent().strip()).append('\n');
        if (!request.participantSummary().isBlank()) {
            sb.append("\nPARTICIPANTS:\n").append(request.participantSummary().strip()).append('\n');
        }
        appendWeights(sb, request.weights());
        sb.append('\n').append(COLLABORATOR_FORMAT);
        return sb.toString();
    }

    private static void appendStructure(StringBuilder sb, ProposalStructure structure) {
        if (structure == null) {
            return;
        }
        sb.append("\nAGREED STRUCTURE:\n")
                .append("Type: ").append(structure.activityType()).append('\n');
        if (!structure.stages().isEmpty()) {
            sb.append("Stages: ").append(String.join(", ", structure.stages())).append('\n');
        }
        if (structure.collaborationMode() != null) {
            sb.append("Preferred mode: ").append(structure.collaborationMode().name().toLowerCase(Locale.ROOT)).append('\n');
        }
        if (structure.suggestedItemCount() > 0) {
            sb.append("Suggested number of tasks: ").append(structure.suggestedItemCount()).append('\n');
        }
    }

    private static void appendWeights(StringBuilder sb, PreferenceWeights weights) {
        if (weights == null || weights.equals(PreferenceWeights.NEUTRAL)) {
            return;
        }
        sb.append(String.format(Locale.ROOT, "%nPREFERENCES (0-1): structure %.1f, collaboration %.1f, flexibility %.1f%n",
                weights.structure(), weights.collaboration(), weights.flexibility()));
    }
}
