package io.github.manjago.evolver.engine;

/**
 * Snapshot of one scored generation.
 */
public record GenerationStats(
    int generation,
    double bestScore,         // best of this generation
    double meanScore,
    double worstScore,
    int populationSize,
    double bestEverScore,     // best recorded in the current run
    String renderedBest       // problem.print() of the generation's best, may be empty
) {

    /**
     * Spread between best and worst score of the generation.
     */
    public double scoreRange() {
        return bestScore - worstScore;
    }

    @Override
    public String toString() {
        return String.format("Generation %d: best=%.4f mean=%.4f worst=%.4f (size %d)",
                generation, bestScore, meanScore, worstScore, populationSize);
    }
}
