package com.tessera.core.parser;

import com.tessera.core.model.WorkItemDraft;

import java.util.ArrayList;
import java.util.List;

/**
 * Last text-reading resort: every plausible line becomes a description-only draft.
 * A line is plausible with at least three words and fifteen characters once list
 * markers and markdown are stripped.
 */
public class MinimalLineStrategy implements ParsingStrategy {

    static final int MIN_WORDS = 3;
    static final int MIN_CHARS = 15;

    private final int maxItems;

    public MinimalLineStrategy(int maxItems) {
        this.maxItems = maxItems;
    }

    @Override
    public String name() {
        return "minimal-lines";
    }

    @Override
    public ParseConfidence confidence() {
        return ParseConfidence.MINIMAL;
    }

    @Override
    public StrategyResult attempt(String rawText, ParseHints hints) {
        if (rawText == null || rawText.isBlank()) {
            return StrategyResult.failure(FailureReason.EMPTY_INPUT, "no text");
        }
        List<WorkItemDraft> drafts = new ArrayList<>();
        for (String line : TextLines.lines(rawText)) {
            String plain = TextLines.plain(line);
            if (isPlausible(plain)) {
                drafts.add(WorkItemDraft.describing(plain));
                if (drafts.size() >= maxItems) {
                    break;
                }
            }
        }
        if (drafts.isEmpty()) {
            return StrategyResult.failure(FailureReason.NO_MATCH, "no plausible lines");
        }
        return StrategyResult.success(drafts);
    }

    static boolean isPlausible(String plain) {
        return plain.length() >= MIN_CHARS && TextLines.wordCount(plain) >= MIN_WORDS;
    }
}
