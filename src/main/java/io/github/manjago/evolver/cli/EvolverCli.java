package io.github.manjago.evolver.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Evolver CLI - runs the bundled demo problems.
 *
 * Usage:
 *   evolver find-number 163 [options]    - Evolve a number digit by digit
 *   evolver regression [options]         - Find a function from noisy samples
 *   evolver packing [options]            - Pack random rectangles
 *   evolver info                         - Show version and default config
 */
@Command(
    name = "evolver",
    description = "Genetic algorithm engine - demo problems",
    mixinStandardHelpOptions = true,
    version = "Evolver 1.0.0",
    subcommands = {
        FindNumberCommand.class,
        RegressionCommand.class,
        PackingCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class EvolverCli implements Runnable {

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new EvolverCli())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
