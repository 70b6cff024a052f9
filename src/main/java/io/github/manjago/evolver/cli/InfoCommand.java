package io.github.manjago.evolver.cli;

import io.github.manjago.evolver.config.EvolutionConfig;
import io.github.manjago.evolver.ending.BestScoreCriterion;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Show information about Evolver.
 */
@Command(
    name = "info",
    description = "Show version and configuration info",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println();
        System.out.println("Evolver 1.0.0 - genetic algorithm engine");
        System.out.println();

        System.out.println("Default Configuration:");
        System.out.println(EvolutionConfig.defaults());

        System.out.println("Selection types:   ROULETTE_WHEEL, STOCHASTIC_UNIVERSAL, TOURNAMENT");
        System.out.println("Ending criteria:   MAX_SCORE, BEST_SCORE (window of "
                + BestScoreCriterion.WINDOW + " generations), NEVER_STOP");
        System.out.println();

        return 0;
    }
}
