package com.tessera.core.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonResponseReaderTest {

    record Sample(String name, int count, List<String> tags) {}

    private JsonResponseReader reader;

    @BeforeEach
    void setUp() {
        reader = new JsonResponseReader();
    }

    @Nested
    @DisplayName("extract")
    class Extract {

        @Test
        @DisplayName("strips markdown fences")
        void stripsFences() {
            assertEquals(Optional.of("{\"a\":1}"), JsonResponseReader.extract("```json\n{\"a\":1}\n```"));
            assertEquals(Optional.of("[1,2]"), JsonResponseReader.extract("```\n[1,2]\n```"));
        }

        @Test
        @DisplayName("drops prose around the JSON value")
        void dropsProse() {
            assertEquals(Optional.of("{\"a\":{\"b\":2}}"),
                    JsonResponseReader.extract("Sure! Here it is: {\"a\":{\"b\":2}} Hope that helps."));
        }

        @Test
        @DisplayName("an array before any object is read as an array")
        void arrayFirst() {
            assertEquals(Optional.of("[{\"a\":1}]"), JsonResponseReader.extract("Result: [{\"a\":1}]"));
        }

        @Test
        @DisplayName("text without JSON yields nothing")
        void noJson() {
            assertTrue(JsonResponseReader.extract(null).isEmpty());
            assertTrue(JsonResponseReader.extract("   ").isEmpty());
            assertTrue(JsonResponseReader.extract("no json here").isEmpty());
            assertTrue(JsonResponseReader.extract("} backwards {").isEmpty());
        }
    }

    @Test
    @DisplayName("read maps into records and ignores unknown properties")
    void readRecord() {
        var sample = reader.read("sample", "```json\n{\"name\":\"x\",\"count\":2,\"tags\":\"solo\",\"extra\":true}\n```",
                Sample.class);

        assertTrue(sample.isPresent());
        assertEquals("x", sample.get().name());
        assertEquals(2, sample.get().count());
        assertEquals(List.of("solo"), sample.get().tags());
    }

    @Test
    @DisplayName("read returns empty for malformed JSON")
    void readMalformed() {
        assertTrue(reader.read("sample", "{\"name\": \"x\", \"count\": }", Sample.class).isEmpty());
    }

    @Test
    @DisplayName("readTree returns the parsed tree")
    void readTree() {
        var tree = reader.readTree("tree", "Answer: {\"assignments\": {\"P1\": [\"task_01\"]}}");

        assertTrue(tree.isPresent());
        assertEquals("task_01", tree.get().path("assignments").path("P1").get(0).asText());
    }
}
