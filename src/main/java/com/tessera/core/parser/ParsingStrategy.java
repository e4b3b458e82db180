package com.tessera.core.parser;

/**
 * One link of the parse chain. Implementations report failure through
 * {@link StrategyResult} rather than by throwing.
 */
public interface ParsingStrategy {

    String name();

    ParseConfidence confidence();

    StrategyResult attempt(String rawText, ParseHints hints);
}
