package com.tessera.dispatch.cli;

import com.tessera.core.assignment.LoadCapPolicy;
import com.tessera.core.participant.ParticipantRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: tessera participants
 */
@Command(name = "participants", mixinStandardHelpOptions = true, description = "List loaded participant profiles")
@Component
public class ParticipantsCommand implements Callable<Integer> {

    private final ParticipantRepository repository;

    public ParticipantsCommand(ParticipantRepository repository) {
        this.repository = repository;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (repository.isEmpty()) {
            ConsoleOutput.error("No participants loaded.");
            return 1;
        }
        System.out.println("PARTICIPANTS (" + repository.size() + "):");
        repository.findAll().forEach(p -> ConsoleOutput.participant(p, LoadCapPolicy.capFor(p)));
        return 0;
    }
}
