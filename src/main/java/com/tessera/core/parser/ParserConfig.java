package com.tessera.core.parser;

import com.tessera.core.config.TesseraProperties;
import com.tessera.core.llm.JsonResponseReader;
import com.tessera.core.llm.TextGenerationClient;
import com.tessera.core.metrics.TesseraMetrics;
import com.tessera.core.normalize.WorkItemNormalizer;
import com.tessera.core.prompt.PromptBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the parse chain. Order matters: most trustworthy first, the always-succeeding
 * fallback last.
 */
@Configuration
public class ParserConfig {

    @Bean
    public ResponseParser responseParser(TextGenerationClient client,
                                         JsonResponseReader reader,
                                         PromptBuilder promptBuilder,
                                         WorkItemNormalizer normalizer,
                                         TesseraMetrics metrics,
                                         TesseraProperties properties) {
        int maxItems = properties.getParser().getMaxItems();
        List<ParsingStrategy> chain = List.of(
                new StrictFieldStrategy(),
                new TolerantStructuralStrategy(),
                new SchemaReplayStrategy(client, reader, promptBuilder),
                new MinimalLineStrategy(maxItems),
                new CanonicalFallbackStrategy());
        return new ResponseParser(chain, normalizer, metrics, maxItems);
    }
}
