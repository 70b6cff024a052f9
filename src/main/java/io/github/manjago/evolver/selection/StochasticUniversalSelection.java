package io.github.manjago.evolver.selection;

import io.github.manjago.evolver.core.Chromosome;
import io.github.manjago.evolver.core.EvoRng;
import io.github.manjago.evolver.core.PopulationStore;

import java.util.ArrayList;
import java.util.List;

/**
 * Stochastic universal sampling (SUS).
 *
 * Chooses a random count k in [1, size/10] (at least 1) and selects
 * chromosomes at k evenly spaced points of the cumulative score, starting
 * from a random offset within the first interval.
 *
 * Floating point accumulation may push the last point past the total, in
 * which case fewer than k chromosomes are returned.
 */
public final class StochasticUniversalSelection implements SelectionStrategy {

    @Override
    public <G> List<Chromosome<G>> select(PopulationStore<G> population, EvoRng rng) {
        int maxCount = Math.max(1, population.size() / 10);
        int count = rng.nextInt(1, maxCount);

        double total = population.totalScore();
        double spacing = total / count;
        double offset = rng.nextDouble(0.0, spacing);

        List<Chromosome<G>> selected = new ArrayList<>(count);

        // Non-positive total: points cannot advance, take a single sample
        if (!(spacing > 0.0) || Double.isInfinite(spacing)) {
            selected.add(population.chromosomeAtCumulativeScore(offset));
            return selected;
        }

        for (double point = offset; point <= total; point += spacing) {
            selected.add(population.chromosomeAtCumulativeScore(point));
        }
        return selected;
    }

    @Override
    public String toString() {
        return "StochasticUniversal";
    }
}
