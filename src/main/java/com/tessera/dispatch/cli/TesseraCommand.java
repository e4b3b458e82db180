package com.tessera.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Tessera.
 * Routes to subcommands: plan, participants.
 */
@Command(
        name = "tessera",
        mixinStandardHelpOptions = true,
        version = "Tessera 0.1.0",
        description = "Breaks an activity into work items and assigns them to participants",
        subcommands = {
                PlanCommand.class,
                ParticipantsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TesseraCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
