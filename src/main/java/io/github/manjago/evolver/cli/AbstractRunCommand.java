package io.github.manjago.evolver.cli;

import com.typesafe.config.ConfigException;
import io.github.manjago.evolver.config.EvolutionConfig;
import io.github.manjago.evolver.config.EvolutionConfigException;
import io.github.manjago.evolver.core.EvoRng;
import io.github.manjago.evolver.core.ScoredChromosome;
import io.github.manjago.evolver.engine.GeneticAlgorithm;
import io.github.manjago.evolver.ending.EndingCriterionType;
import io.github.manjago.evolver.selection.SelectionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Options and run loop shared by the demo commands.
 *
 * Configuration starts either from the demo's own settings on top of
 * reference.conf or, when --config is given, from that HOCON file on top of
 * reference.conf. Command line options override both.
 */
abstract class AbstractRunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AbstractRunCommand.class);

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"-p", "--population"}, description = "Population size")
    private Integer populationSize;

    @Option(names = {"-m", "--mutation"}, description = "Mutation probability (0.0-1.0)")
    private Double mutationProbability;

    @Option(names = {"--selection"}, description = "Selection type: ${COMPLETION-CANDIDATES}")
    private SelectionType selectionType;

    @Option(names = {"-t", "--tournament-size"}, description = "Tournament size")
    private Integer tournamentSize;

    @Option(names = {"--ending"}, description = "Ending criterion: ${COMPLETION-CANDIDATES}")
    private EndingCriterionType endingCriterion;

    @Option(names = {"--seed"}, description = "Random seed (0 = random)")
    private Long seed;

    @Option(names = {"-q", "--quiet"}, description = "Quiet mode (no per-generation output)")
    private boolean quiet;

    /**
     * Demo settings, used when no configuration file is given.
     */
    protected abstract EvolutionConfig.Builder demoDefaults(EvolutionConfig.Builder builder);

    /**
     * Run the demo with the final configuration.
     */
    protected abstract int runDemo(EvolutionConfig config, EvoRng rng);

    @Override
    public Integer call() {
        EvolutionConfig config;
        try {
            config = buildConfig();
            config.validate();
        } catch (EvolutionConfigException | ConfigException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return 2;
        }

        if (!quiet) {
            System.out.println(config);
        }

        EvoRng rng = config.randomSeed() != 0 ? new EvoRng(config.randomSeed()) : EvoRng.shared();
        return runDemo(config, rng);
    }

    private EvolutionConfig buildConfig() {
        EvolutionConfig.Builder builder = configFile != null
                ? EvolutionConfig.fromFile(configFile).toBuilder()
                : demoDefaults(EvolutionConfig.defaults().toBuilder());

        // Override from CLI options
        if (populationSize != null) builder.populationSize(populationSize);
        if (mutationProbability != null) builder.mutationProbability(mutationProbability);
        if (selectionType != null) builder.selectionType(selectionType);
        if (tournamentSize != null) builder.tournamentSize(tournamentSize);
        if (endingCriterion != null) builder.endingCriterion(endingCriterion);
        if (seed != null) builder.randomSeed(seed);

        return builder.build();
    }

    /**
     * Run blocking, stopping gracefully on Ctrl+C.
     */
    protected <G> ScoredChromosome<G> evolve(GeneticAlgorithm<G> algorithm) {
        Thread hook = new Thread(() -> {
            if (algorithm.isRunning()) {
                System.out.println("\nStopping gracefully...");
                algorithm.stop();
            }
        });
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            algorithm.run(true, quiet ? null : System.out);
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM shutting down, hook stays registered");
            }
        }
        return algorithm.bestScored();
    }
}
