package io.github.manjago.evolver.core;

/**
 * A chromosome together with its fitness score.
 */
public record ScoredChromosome<G>(
    double score,
    Chromosome<G> chromosome
) {

    @Override
    public String toString() {
        return String.format("Scored[%.4f, %s]", score, chromosome);
    }
}
