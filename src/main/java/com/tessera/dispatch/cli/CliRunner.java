package com.tessera.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments, delegates to the appropriate command and keeps its exit code
 * for {@link org.springframework.boot.SpringApplication#exit}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int UNEXPECTED_FAILURE = 1;

    private final TesseraCommand tesseraCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TesseraCommand tesseraCommand, IFactory factory) {
        this.tesseraCommand = tesseraCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine(tesseraCommand, factory).execute(args);
        log.debug("Command finished with exit code {}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Command line whose unexpected failures print one error line instead of a stack trace.
     */
    static CommandLine commandLine(TesseraCommand command, IFactory factory) {
        return new CommandLine(command, factory)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    log.error("Command '{}' failed", cmd.getCommandName(), ex);
                    ConsoleOutput.error(ex.getClass().getSimpleName() + ": " + ex.getMessage());
                    return UNEXPECTED_FAILURE;
                });
    }
}
