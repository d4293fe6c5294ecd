package com.tandem.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Tandem.
 * Routes to subcommands: run, waves.
 */
@Command(
        name = "tandem",
        mixinStandardHelpOptions = true,
        version = "Tandem 0.1.0",
        description = "Runs dependency-ordered task plans on parallel worker processes",
        subcommands = {
                RunCommand.class,
                WavesCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TandemCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
