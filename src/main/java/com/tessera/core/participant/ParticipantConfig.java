package com.tessera.core.participant;

import com.tessera.core.config.TesseraProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Loads the participant file once at startup.
 */
@Configuration
public class ParticipantConfig {

    private static final Logger log = LoggerFactory.getLogger(ParticipantConfig.class);

    @Bean
    public ParticipantRepository participantRepository(ResourceLoader resourceLoader,
                                                       TesseraProperties properties,
                                                       ParticipantFileReader reader) {
        Resource resource = resourceLoader.getResource(properties.getParticipants().getLocation());
        if (!resource.exists()) {
            log.warn("Participants file {} not found, starting with no participants", resource.getDescription());
            return ParticipantRepository.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            List<ParticipantRecord> records = reader.read(in);
            ParticipantRepository repository = ParticipantRepository.of(records);
            log.info("Loaded {} participants from {}", repository.size(), resource.getDescription());
            return repository;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read participants from " + resource.getDescription(), e);
        }
    }
}
