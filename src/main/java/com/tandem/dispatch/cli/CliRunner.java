package com.tandem.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the matching subcommand.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final TandemCommand tandemCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TandemCommand tandemCommand, IFactory factory) {
        this.tandemCommand = tandemCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(tandemCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
