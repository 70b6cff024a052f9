package io.github.manjago.evolver.core;

/**
 * The problem being optimized: how to make genes and how good a chromosome is.
 *
 * Implement this interface to plug a domain into the engine. The engine
 * never looks inside genes; it only copies them around and asks for new
 * ones during seeding and mutation.
 *
 * @param <G> gene type, treated as an immutable value
 */
public interface GeneticProblem<G> {

    /**
     * Generate a random gene.
     * Called when seeding the population and when mutating.
     */
    G randomGene();

    /**
     * Compute the fitness score of a chromosome. Higher is better.
     * Called exactly once per chromosome per generation.
     *
     * Negative scores are allowed, but roulette wheel and stochastic universal
     * selection degrade when the population total is zero or negative.
     *
     * @param chromosome chromosome to evaluate
     * @return fitness score
     */
    double score(Chromosome<G> chromosome);

    /**
     * Render a chromosome for logging. Never affects the algorithm.
     *
     * @param chromosome chromosome to render
     * @return human-readable text, empty by default
     */
    default String print(Chromosome<G> chromosome) {
        return "";
    }
}
