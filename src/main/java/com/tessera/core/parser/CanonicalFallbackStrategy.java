package com.tessera.core.parser;

import com.tessera.core.model.CollaborationMode;
import com.tessera.core.model.WorkItemDraft;
import com.tessera.core.normalize.KeywordTable;

import java.util.List;
import java.util.Set;

/**
 * Always succeeds with the same three-stage plan: prepare, carry out, reflect.
 */
public class CanonicalFallbackStrategy implements ParsingStrategy {

    static final int COMPLEXITY = 3;
    static final int DURATION_MINUTES = 30;

    private static final List<WorkItemDraft> CANONICAL = List.of(
            new WorkItemDraft("prep", "Prepare the materials and organize the space for the activity",
                    Set.of("organization"), COMPLEXITY, CollaborationMode.INDIVIDUAL, DURATION_MINUTES,
                    Set.of(), KeywordTable.STAGE_PREPARATION),
            new WorkItemDraft("exec", "Carry out the main activity together",
                    Set.of(KeywordTable.DEFAULT_COMPETENCY), COMPLEXITY, CollaborationMode.GROUP, DURATION_MINUTES,
                    Set.of("prep"), KeywordTable.STAGE_EXECUTION),
            new WorkItemDraft("reflect", "Reflect on the results and share what was learned",
                    Set.of("reflection"), COMPLEXITY, CollaborationMode.INDIVIDUAL, DURATION_MINUTES,
                    Set.of("exec"), KeywordTable.STAGE_REFLECTION)
    );

    public static List<WorkItemDraft> canonicalDrafts() {
        return CANONICAL;
    }

    @Override
    public String name() {
        return "canonical-fallback";
    }

    @Override
    public ParseConfidence confidence() {
        return ParseConfidence.FALLBACK;
    }

    @Override
    public StrategyResult attempt(String rawText, ParseHints hints) {
        return StrategyResult.success(CANONICAL);
    }
}
