package com.tessera.core.parser;

import com.tessera.core.metrics.TesseraMetrics;
import com.tessera.core.model.WorkItem;
import com.tessera.core.model.WorkItemDraft;
import com.tessera.core.normalize.WorkItemNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the parse chain over generated text and returns the first acceptable batch,
 * normalized. A batch is acceptable when it is non-empty and every draft has a
 * description. The chain is expected to end with a strategy that always succeeds; if it
 * does not, the canonical plan is used anyway so callers never see an empty batch.
 */
public class ResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);

    private final List<ParsingStrategy> chain;
    private final WorkItemNormalizer normalizer;
    private final TesseraMetrics metrics;
    private final int maxItems;

    public ResponseParser(List<ParsingStrategy> chain, WorkItemNormalizer normalizer,
                          TesseraMetrics metrics, int maxItems) {
        if (chain == null || chain.isEmpty()) {
            throw new IllegalArgumentException("Parse chain must contain at least one strategy");
        }
        this.chain = List.copyOf(chain);
        this.normalizer = normalizer;
        this.metrics = metrics;
        this.maxItems = Math.max(1, maxItems);
    }

    public List<ParsingStrategy> chain() {
        return chain;
    }

    public ParseResult parse(String rawText, ParseHints hints) {
        ParseHints effective = hints != null ? hints : ParseHints.none();
        log.debug("Parsing {} chars of generated text", rawText == null ? 0 : rawText.length());
        var attempts = new ArrayList<StrategyAttempt>();

        for (ParsingStrategy strategy : chain) {
            StrategyResult result;
            try {
                result = strategy.attempt(rawText, effective);
            } catch (RuntimeException e) {
                log.warn("Strategy {} threw {}: {}", strategy.name(), e.getClass().getSimpleName(), e.getMessage());
                result = StrategyResult.failure(FailureReason.INTERNAL_ERROR, e.getClass().getSimpleName());
            }
            if (result.isSuccess() && !acceptable(result.drafts())) {
                result = StrategyResult.failure(FailureReason.INVALID_ITEMS,
                        result.drafts().isEmpty() ? "no drafts" : "draft without description");
            }
            if (!result.isSuccess()) {
                log.warn("Strategy {} failed: {} ({})", strategy.name(), result.reason(), result.detail());
                attempts.add(new StrategyAttempt(strategy.name(), result.reason(), result.detail()));
                continue;
            }
            attempts.add(new StrategyAttempt(strategy.name(), null, null));
            return finish(result.drafts(), strategy.name(), strategy.confidence(), attempts);
        }

        log.warn("Parse chain exhausted without a fallback strategy, using the canonical plan");
        attempts.add(new StrategyAttempt("canonical-fallback", null, "chain exhausted"));
        return finish(CanonicalFallbackStrategy.canonicalDrafts(), "canonical-fallback",
                ParseConfidence.FALLBACK, attempts);
    }

    private ParseResult finish(List<WorkItemDraft> drafts, String strategyName, ParseConfidence confidence,
                               List<StrategyAttempt> attempts) {
        List<WorkItemDraft> capped = drafts;
        if (drafts.size() > maxItems) {
            log.warn("Strategy {} produced {} items, keeping the first {}", strategyName, drafts.size(), maxItems);
            capped = drafts.subList(0, maxItems);
        }
        List<WorkItem> items = normalizer.normalizeBatch(capped);
        log.info("Parsed {} work items with {} ({})", items.size(), strategyName, confidence);
        metrics.recordParseResult(strategyName, confidence.name());
        return new ParseResult(items, confidence, strategyName, attempts);
    }

    private static boolean acceptable(List<WorkItemDraft> drafts) {
        if (drafts.isEmpty()) {
            return false;
        }
        for (WorkItemDraft draft : drafts) {
            if (draft == null || !draft.hasDescription()) {
                return false;
            }
        }
        return true;
    }
}
