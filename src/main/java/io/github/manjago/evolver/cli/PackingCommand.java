package io.github.manjago.evolver.cli;

import io.github.manjago.evolver.config.EvolutionConfig;
import io.github.manjago.evolver.core.EvoRng;
import io.github.manjago.evolver.core.ScoredChromosome;
import io.github.manjago.evolver.demo.PackingProblem;
import io.github.manjago.evolver.engine.GeneticAlgorithm;
import io.github.manjago.evolver.ending.EndingCriterionType;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Pack a random cluster of rectangles.
 *
 * Runs in the background and polls the best placement every second,
 * until the time limit is reached.
 *
 * Examples:
 *   evolver packing
 *   evolver packing --seconds 60
 */
@Command(
    name = "packing",
    description = "Pack random rectangles into the smallest bounding box",
    mixinStandardHelpOptions = true
)
public class PackingCommand extends AbstractRunCommand {

    @Option(names = {"-s", "--seconds"}, description = "Time limit in seconds", defaultValue = "30")
    private int seconds;

    @Override
    protected EvolutionConfig.Builder demoDefaults(EvolutionConfig.Builder builder) {
        return builder
                .populationSize(100)
                .mutationProbability(0.05)
                .endingCriterion(EndingCriterionType.NEVER_STOP)
                .tournament(10);
    }

    @Override
    protected int runDemo(EvolutionConfig config, EvoRng rng) {
        PackingProblem problem = PackingProblem.randomCluster(rng);
        int count = problem.rectangleCount();
        EvolutionConfig sized = config.toBuilder().chromosomeSize(count, count).build();

        System.out.println("Packing " + count + " rectangles for up to " + seconds + " seconds");

        GeneticAlgorithm<PackingProblem.Position> algorithm = new GeneticAlgorithm<>(problem, sized, rng);
        var run = algorithm.run(false);
        try {
            for (int elapsed = 0; elapsed < seconds; elapsed++) {
                if (run.await(1, TimeUnit.SECONDS)) {
                    break;
                }
                ScoredChromosome<PackingProblem.Position> best = run.best();
                if (best != null) {
                    System.out.printf("[%3ds] generation %d: %s (score %.1f)%n", elapsed + 1,
                            algorithm.getGeneration(), problem.print(best.chromosome()), best.score());
                }
            }
            run.stop();
            run.await();
        } catch (InterruptedException e) {
            run.stop();
            Thread.currentThread().interrupt();
            return 130;
        } catch (ExecutionException e) {
            System.err.println("Evolution failed: " + e.getCause());
            return 1;
        }

        ScoredChromosome<PackingProblem.Position> best = run.best();
        if (best == null) {
            return 1;
        }
        System.out.println("Best placement: " + problem.print(best.chromosome()));
        return 0;
    }
}
