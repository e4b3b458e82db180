package com.tessera.core.participant;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tessera.core.llm.JsonResponseReader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads participant records from a JSON array.
 */
@Component
public class ParticipantFileReader {

    private static final TypeReference<List<ParticipantRecord>> RECORD_LIST = new TypeReference<>() {};

    private final JsonResponseReader reader;

    public ParticipantFileReader(JsonResponseReader reader) {
        this.reader = reader;
    }

    public List<ParticipantRecord> read(InputStream in) throws IOException {
        List<ParticipantRecord> records = reader.mapper().readValue(in, RECORD_LIST);
        return records != null ? records : List.of();
    }

    public List<ParticipantRecord> read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }
}
