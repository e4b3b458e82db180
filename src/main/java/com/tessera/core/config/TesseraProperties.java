package com.tessera.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "tessera")
public class TesseraProperties {

    private Generation generation = new Generation();
    private Parser parser = new Parser();
    private Assignment assignment = new Assignment();
    private Consensus consensus = new Consensus();
    private Participants participants = new Participants();
    private Examples examples = new Examples();

    public static class Generation {
        private int maxTokens = 800;
        private Duration timeout = Duration.ofSeconds(60);

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Parser {
        private boolean replayEnabled = true;
        private int maxItems = 20;

        public boolean isReplayEnabled() { return replayEnabled; }
        public void setReplayEnabled(boolean replayEnabled) { this.replayEnabled = replayEnabled; }
        public int getMaxItems() { return maxItems; }
        public void setMaxItems(int maxItems) { this.maxItems = maxItems; }
    }

    public static class Assignment {
        private boolean optimizerEnabled = true;

        public boolean isOptimizerEnabled() { return optimizerEnabled; }
        public void setOptimizerEnabled(boolean optimizerEnabled) { this.optimizerEnabled = optimizerEnabled; }
    }

    public static class Consensus {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class Participants {
        private String location = "classpath:participants.json";

        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
    }

    public static class Examples {
        private String location = "classpath:examples/activity-examples.json";
        private int topK = 2;

        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
        public int getTopK() { return topK; }
        public void setTopK(int topK) { this.topK = topK; }
    }

    public Generation getGeneration() {
        return generation;
    }

    public void setGeneration(Generation generation) {
        this.generation = generation != null ? generation : new Generation();
    }

    public Parser getParser() {
        return parser;
    }

    public void setParser(Parser parser) {
        this.parser = parser != null ? parser : new Parser();
    }

    public Assignment getAssignment() {
        return assignment;
    }

    public void setAssignment(Assignment assignment) {
        this.assignment = assignment != null ? assignment : new Assignment();
    }

    public Consensus getConsensus() {
        return consensus;
    }

    public void setConsensus(Consensus consensus) {
        this.consensus = consensus != null ? consensus : new Consensus();
    }

    public Participants getParticipants() {
        return participants;
    }

    public void setParticipants(Participants participants) {
        this.participants = participants != null ? participants : new Participants();
    }

    public Examples getExamples() {
        return examples;
    }

    public void setExamples(Examples examples) {
        this.examples = examples != null ? examples : new Examples();
    }
}
