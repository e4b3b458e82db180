package com.tessera.core.parser;

import com.tessera.core.config.TesseraProperties;
import com.tessera.core.llm.JsonResponseReader;
import com.tessera.core.llm.TextGenerationClient;
import com.tessera.core.metrics.TesseraMetrics;
import com.tessera.core.normalize.WorkItemNormalizer;
import com.tessera.core.prompt.PromptBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ParserConfigTest {

    private ResponseParser parser(int maxItems) {
        var properties = new TesseraProperties();
        properties.getParser().setMaxItems(maxItems);
        return new ParserConfig().responseParser(mock(TextGenerationClient.class), new JsonResponseReader(),
                new PromptBuilder(), new WorkItemNormalizer(), new TesseraMetrics(new SimpleMeterRegistry()),
                properties);
    }

    @Test
    @DisplayName("configured chain runs all five strategies in trust order")
    void chainOrder() {
        ParseResult result = parser(20).parse("asdf qwer", ParseHints.none());

        assertEquals(List.of("strict-fields", "tolerant-structure", "schema-replay", "minimal-lines",
                        "canonical-fallback"),
                result.attempts().stream().map(StrategyAttempt::strategyName).toList());
    }

    @Test
    @DisplayName("configured item limit caps the batch")
    void maxItems() {
        String lines = """
                1. Measure every straw carefully before cutting
                2. Cut the straws into equal pieces for the deck
                3. Tape the pieces together into triangles
                4. Test the finished bridge with a row of coins
                """;

        assertEquals(2, parser(2).parse(lines, ParseHints.none()).items().size());
    }
}
