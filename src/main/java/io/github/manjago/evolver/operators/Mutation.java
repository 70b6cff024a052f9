package io.github.manjago.evolver.operators;

import io.github.manjago.evolver.core.Chromosome;
import io.github.manjago.evolver.core.EvoRng;
import org.jetbrains.annotations.NotNull;

import java.util.function.Supplier;

/**
 * Segment mutation.
 *
 * With the configured probability (one draw per chromosome, not per gene)
 * a random segment [begin, end) is regenerated. begin is uniform in
 * [0, length-1] and end is uniform in [begin, length]; begin == end
 * regenerates nothing. The chromosome length never changes.
 */
public class Mutation {

    private final double probability;
    private final EvoRng rng;

    /**
     * @param probability per-chromosome mutation probability in [0, 1]
     * @param rng random source
     */
    public Mutation(double probability, @NotNull EvoRng rng) {
        if (probability < 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("Mutation probability must be in [0, 1]: " + probability);
        }
        this.probability = probability;
        this.rng = rng;
    }

    public double getProbability() {
        return probability;
    }

    /**
     * Mutate the chromosome in place.
     *
     * @param chromosome chromosome to mutate, at least one gene long
     * @param geneGenerator source of replacement genes
     * @return number of regenerated genes (0 when no mutation happened)
     */
    public <G> int mutate(@NotNull Chromosome<G> chromosome, @NotNull Supplier<? extends G> geneGenerator) {
        // Strict draw < p: probability 0 never fires, 1 always does
        if (!rng.nextBoolean(probability)) {
            return 0;
        }

        int length = chromosome.length();
        int begin = rng.nextInt(0, length - 1);
        int end = rng.nextInt(begin, length);

        for (int i = begin; i < end; i++) {
            chromosome.setGene(i, geneGenerator.get());
        }
        return end - begin;
    }
}
