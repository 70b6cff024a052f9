package io.github.manjago.evolver.cli;

import io.github.manjago.evolver.config.EvolutionConfig;
import io.github.manjago.evolver.core.Chromosome;
import io.github.manjago.evolver.core.EvoRng;
import io.github.manjago.evolver.core.ScoredChromosome;
import io.github.manjago.evolver.demo.RegressionProblem;
import io.github.manjago.evolver.demo.Token;
import io.github.manjago.evolver.engine.GeneticAlgorithm;
import io.github.manjago.evolver.selection.SelectionType;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Find a function from noisy samples.
 *
 * Examples:
 *   evolver regression
 *   evolver regression -e "2 * x + 1" -n 0.5
 */
@Command(
    name = "regression",
    description = "Symbolic regression on noisy samples of a target function",
    mixinStandardHelpOptions = true
)
public class RegressionCommand extends AbstractRunCommand {

    @Option(names = {"-e", "--expression"}, description = "Target function, tokens separated by spaces",
            defaultValue = "3 * x - 8.5")
    private String expression;

    @Option(names = {"-n", "--noise"}, description = "Max noise added to each sample (+/-)",
            defaultValue = "1.0")
    private double noise;

    @Override
    protected EvolutionConfig.Builder demoDefaults(EvolutionConfig.Builder builder) {
        return builder
                .populationSize(300)
                .mutationProbability(0.1)
                .chromosomeSize(5, 5)
                .maxScore(RegressionProblem.PERFECT_SCORE)
                .selectionType(SelectionType.ROULETTE_WHEEL);
    }

    @Override
    protected int runDemo(EvolutionConfig config, EvoRng rng) {
        Chromosome<Token> target;
        try {
            target = RegressionProblem.parse(expression);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 2;
        }
        if (!RegressionProblem.isValid(target)) {
            System.err.println("Not a valid expression: " + expression);
            return 2;
        }

        System.out.println("Looking for f(x) = " + RegressionProblem.format(target)
                + " with noise +/-" + noise);

        RegressionProblem problem = RegressionProblem.sampling(target, noise, rng);
        ScoredChromosome<Token> best = evolve(new GeneticAlgorithm<>(problem, config, rng));
        if (best == null) {
            System.out.println("No generation was scored.");
            return 1;
        }

        System.out.println("The algorithm found: " + problem.print(best.chromosome())
                + " (score " + best.score() + ")");
        return 0;
    }
}
