package com.tessera.core.assignment;

import com.fasterxml.jackson.databind.JsonNode;
import com.tessera.core.config.TesseraProperties;
import com.tessera.core.llm.JsonResponseReader;
import com.tessera.core.llm.TextGenerationClient;
import com.tessera.core.model.ParticipantProfile;
import com.tessera.core.model.PreferenceWeights;
import com.tessera.core.model.WorkItem;
import com.tessera.core.prompt.PromptBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Asks the text service for a full assignment. Items are presented under local ids
 * ({@code task_01}, {@code task_02}, ...) and the reply is returned with whatever ids the
 * model wrote; the engine maps them back.
 */
@Component
public class LlmAssignmentOptimizer implements AssignmentOptimizer {

    private static final Logger log = LoggerFactory.getLogger(LlmAssignmentOptimizer.class);

    private final TextGenerationClient client;
    private final JsonResponseReader reader;
    private final PromptBuilder promptBuilder;
    private final TesseraProperties properties;

    public LlmAssignmentOptimizer(TextGenerationClient client, JsonResponseReader reader,
                                  PromptBuilder promptBuilder, TesseraProperties properties) {
        this.client = client;
        this.reader = reader;
        this.promptBuilder = promptBuilder;
        this.properties = properties;
    }

    public static String localId(int ordinal) {
        return String.format("task_%02d", ordinal);
    }

    @Override
    public Map<String, List<String>> propose(List<WorkItem> items, List<ParticipantProfile> participants,
                                             PreferenceWeights weights) {
        var localItems = new LinkedHashMap<String, WorkItem>();
        for (int i = 0; i < items.size(); i++) {
            localItems.put(localId(i + 1), items.get(i));
        }
        String prompt = promptBuilder.optimizerPrompt(localItems, participants, weights);
        String reply = client.generate(prompt, properties.getGeneration().getMaxTokens(),
                properties.getGeneration().getTimeout());
        log.debug("Optimizer reply: {}", reply);
        return parse(reply);
    }

    Map<String, List<String>> parse(String reply) {
        Optional<JsonNode> tree = reader.readTree("assignment proposal", reply);
        if (tree.isEmpty() || !tree.get().isObject()) {
            log.warn("Optimizer reply had no JSON object");
            return Map.of();
        }
        JsonNode root = tree.get();
        JsonNode assignments = root.has("assignments") ? root.get("assignments")
                : root.has("asignaciones") ? root.get("asignaciones") : root;
        if (!assignments.isObject()) {
            return Map.of();
        }
        var proposal = new LinkedHashMap<String, List<String>>();
        Iterator<Map.Entry<String, JsonNode>> fields = assignments.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var ids = new ArrayList<String>();
            JsonNode value = field.getValue();
            if (value.isArray()) {
                value.forEach(node -> {
                    if (node.isValueNode() && !node.asText().isBlank()) {
                        ids.add(node.asText().trim());
                    }
                });
            } else if (value.isValueNode() && !value.asText().isBlank()) {
                ids.add(value.asText().trim());
            }
            proposal.put(field.getKey().trim(), ids);
        }
        return proposal;
    }
}
