package com.tessera.core.parser;

import com.tessera.core.model.ProposalStructure;

import java.time.Duration;

/**
 * Request-level inputs that some strategies need besides the raw text.
 *
 * @param intent        the original activity intent, used to re-request the text
 * @param replayAllowed whether schema replay may call the text service
 * @param replayTimeout timeout for the replay call
 * @param maxTokens     token budget for the replay call
 * @param structureHint agreed structure from consensus, may be null
 */
public record ParseHints(
    String intent,
    boolean replayAllowed,
    Duration replayTimeout,
    int maxTokens,
    ProposalStructure structureHint
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_TOKENS = 800;

    public ParseHints {
        intent = intent != null ? intent : "";
        replayTimeout = replayTimeout != null ? replayTimeout : DEFAULT_TIMEOUT;
        maxTokens = maxTokens > 0 ? maxTokens : DEFAULT_MAX_TOKENS;
    }

    /**
     * Hints for parsing text with no request behind it; replay is off.
     */
    public static ParseHints none() {
        return new ParseHints("", false, DEFAULT_TIMEOUT, DEFAULT_MAX_TOKENS, null);
    }

    public boolean hasIntent() {
        return !intent.isBlank();
    }
}
