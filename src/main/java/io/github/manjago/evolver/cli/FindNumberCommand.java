package io.github.manjago.evolver.cli;

import io.github.manjago.evolver.config.EvolutionConfig;
import io.github.manjago.evolver.core.EvoRng;
import io.github.manjago.evolver.core.ScoredChromosome;
import io.github.manjago.evolver.demo.FindNumberProblem;
import io.github.manjago.evolver.engine.GeneticAlgorithm;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Evolve a number digit by digit.
 *
 * Examples:
 *   evolver find-number 163
 *   evolver find-number 123456789 -p 200 -m 0.05
 */
@Command(
    name = "find-number",
    description = "Find a number digit by digit",
    mixinStandardHelpOptions = true
)
public class FindNumberCommand extends AbstractRunCommand {

    // Digits of Long.MAX_VALUE
    private static final int MAX_DIGITS = 19;

    @Parameters(index = "0", description = "Number to find")
    private String number;

    private FindNumberProblem problem;

    @Override
    protected EvolutionConfig.Builder demoDefaults(EvolutionConfig.Builder builder) {
        int digits = number.length();
        // Tournament because the score can be negative, which breaks fitness proportionate selection
        return builder
                .populationSize(100)
                .mutationProbability(0.01)
                .chromosomeSize(1, Math.max(MAX_DIGITS, digits))
                .maxScore(digits)
                .tournament(10);
    }

    @Override
    protected int runDemo(EvolutionConfig config, EvoRng rng) {
        try {
            problem = new FindNumberProblem(number, rng);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 2;
        }

        ScoredChromosome<Integer> best = evolve(new GeneticAlgorithm<>(problem, config, rng));
        if (best == null) {
            System.out.println("No generation was scored.");
            return 1;
        }

        String found = problem.print(best.chromosome());
        if (found.equals(number)) {
            System.out.println("Great! The algorithm found our objective: " + number);
            return 0;
        }
        System.out.println("The algorithm found " + found + " (score " + best.score() + ")");
        return 1;
    }
}
