package com.tessera.core.parser;

import com.tessera.core.llm.GenerationFailureException;
import com.tessera.core.llm.JsonResponseReader;
import com.tessera.core.llm.TextGenerationClient;
import com.tessera.core.model.CollaborationMode;
import com.tessera.core.model.WorkItemDraft;
import com.tessera.core.prompt.PromptBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.converter.BeanOutputConverter;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Asks the text service once more for the same tasks, this time against a JSON template
 * derived from {@link ReplayPayload}. The reply is read as JSON first and as strict fields
 * second. Never calls the service more than once per attempt.
 */
public class SchemaReplayStrategy implements ParsingStrategy {

    private static final Logger log = LoggerFactory.getLogger(SchemaReplayStrategy.class);

    private final TextGenerationClient client;
    private final JsonResponseReader reader;
    private final PromptBuilder promptBuilder;
    private final StrictFieldStrategy strictFallback = new StrictFieldStrategy();
    private final String formatInstructions;

    public SchemaReplayStrategy(TextGenerationClient client, JsonResponseReader reader, PromptBuilder promptBuilder) {
        this.client = client;
        this.reader = reader;
        this.promptBuilder = promptBuilder;
        this.formatInstructions = new BeanOutputConverter<>(ReplayPayload.class).getFormat();
    }

    @Override
    public String name() {
        return "schema-replay";
    }

    @Override
    public ParseConfidence confidence() {
        return ParseConfidence.REPLAY;
    }

    @Override
    public StrategyResult attempt(String rawText, ParseHints hints) {
        if (!hints.replayAllowed()) {
            return StrategyResult.failure(FailureReason.REPLAY_DISABLED, "replay not allowed for this request");
        }
        if (!hints.hasIntent()) {
            return StrategyResult.failure(FailureReason.REPLAY_UNAVAILABLE, "no intent to replay");
        }
        String prompt = promptBuilder.replayPrompt(hints.intent(), rawText, formatInstructions, hints.structureHint());
        String reply;
        try {
            reply = client.generate(prompt, hints.maxTokens(), hints.replayTimeout());
        } catch (GenerationFailureException e) {
            return StrategyResult.failure(FailureReason.GENERATION_FAILED, e.kind() + ": " + e.getMessage());
        }
        log.debug("Replay reply: {}", reply);

        List<ReplayPayload.Item> items = readItems(reply);
        if (!items.isEmpty()) {
            return StrategyResult.success(items.stream().map(SchemaReplayStrategy::toDraft).toList());
        }
        StrategyResult strict = strictFallback.attempt(reply, hints);
        if (strict.isSuccess()) {
            return strict;
        }
        return StrategyResult.failure(FailureReason.NO_MATCH, "replay reply was neither JSON nor strict fields");
    }

    private List<ReplayPayload.Item> readItems(String reply) {
        Optional<ReplayPayload> payload = reader.read("replay payload", reply, ReplayPayload.class);
        if (payload.isPresent() && payload.get().items() != null && !payload.get().items().isEmpty()) {
            return payload.get().items().stream().filter(item -> item != null).toList();
        }
        return reader.read("replay item array", reply, ReplayPayload.Item[].class)
                .map(Arrays::asList)
                .orElse(List.of())
                .stream()
                .filter(item -> item != null && item.description() != null)
                .toList();
    }

    private static WorkItemDraft toDraft(ReplayPayload.Item item) {
        CollaborationMode mode = CollaborationMode.fromLabel(item.type()).orElse(null);
        return new WorkItemDraft(
                item.id(),
                item.description(),
                item.competencies() != null ? new LinkedHashSet<>(item.competencies()) : null,
                item.complexity(),
                mode,
                item.durationMinutes(),
                item.dependencies() != null ? new LinkedHashSet<>(item.dependencies()) : null,
                item.stage());
    }
}
