package com.tessera.dispatch.cli;

import com.tessera.core.assignment.NoParticipantsException;
import com.tessera.core.engine.PlanningEngine;
import com.tessera.core.engine.PlanningRequest;
import com.tessera.core.engine.PlanningResult;
import com.tessera.core.model.ParticipantProfile;
import com.tessera.core.model.PreferenceWeights;
import com.tessera.core.participant.ParticipantFileReader;
import com.tessera.core.participant.ParticipantRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: tessera plan "&lt;intent&gt;"
 * <p>
 * Runs one planning request and prints the work items by phase and the assignment table.
 */
@Command(name = "plan", mixinStandardHelpOptions = true,
        description = "Break an activity into work items and assign them")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Free-form activity intent")
    private String intent;

    @Option(names = {"--participants", "-p"}, description = "JSON file of participants for this run only")
    private Path participantsFile;

    @Option(names = "--structure", description = "Preference for structured work, 0-1", defaultValue = "0")
    private double structure;

    @Option(names = "--collaboration", description = "Preference for collaborative work, 0-1", defaultValue = "0")
    private double collaboration;

    @Option(names = "--flexibility", description = "Tolerance for poor fits, 0-1", defaultValue = "0")
    private double flexibility;

    @Option(names = "--no-consensus", description = "Skip the consensus round")
    private boolean noConsensus;

    @Option(names = "--timeout", description = "Per-call timeout in seconds")
    private Long timeoutSeconds;

    private final PlanningEngine planningEngine;
    private final ParticipantFileReader participantFileReader;

    public PlanCommand(PlanningEngine planningEngine, ParticipantFileReader participantFileReader) {
        this.planningEngine = planningEngine;
        this.participantFileReader = participantFileReader;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        PreferenceWeights weights;
        try {
            weights = new PreferenceWeights(structure, collaboration, flexibility);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid preference weights: " + e.getMessage());
            return 1;
        }
        if (timeoutSeconds != null && timeoutSeconds <= 0) {
            ConsoleOutput.error("Timeout must be positive");
            return 1;
        }

        List<ParticipantRecord> records = null;
        if (participantsFile != null) {
            try {
                records = participantFileReader.read(participantsFile);
            } catch (IOException e) {
                ConsoleOutput.error("Could not read participants from " + participantsFile + ": " + e.getMessage());
                return 1;
            }
        }

        PlanningResult result;
        try {
            ConsoleOutput.info(records != null
                    ? "Planning for " + records.size() + " participants from " + participantsFile + "..."
                    : "Planning for the loaded participants...");
            result = planningEngine.plan(new PlanningRequest(intent, weights, records, !noConsensus,
                    timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null));
        } catch (NoParticipantsException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid input: " + e.getMessage());
            return 1;
        }

        System.out.println();
        System.out.println("PLAN " + result.requestId());
        System.out.println("Intent: " + intent);
        if (result.consensus() != null) {
            ConsoleOutput.consensus(result.consensus());
        }
        System.out.println();

        result.phases().forEach(ConsoleOutput::phase);

        System.out.println();
        System.out.println("ASSIGNMENT (" + result.assignment().path() + "):");
        for (ParticipantProfile p : result.participants()) {
            ConsoleOutput.assignment(p, result.assignment().record().entriesFor(p.id()));
        }
        for (String note : result.assignment().notes()) {
            ConsoleOutput.warn(note);
        }

        System.out.println();
        ConsoleOutput.info(String.format("Parse confidence: %s (%s)", result.parseConfidence(), result.parseStrategy()));
        if (result.degraded()) {
            ConsoleOutput.warn("Degraded result: at least one stage fell back");
        } else {
            ConsoleOutput.success("Plan complete.");
        }
        return 0;
    }
}
