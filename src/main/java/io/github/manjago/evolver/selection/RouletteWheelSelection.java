package io.github.manjago.evolver.selection;

import io.github.manjago.evolver.core.Chromosome;
import io.github.manjago.evolver.core.EvoRng;
import io.github.manjago.evolver.core.PopulationStore;

import java.util.List;

/**
 * Fitness proportionate selection.
 *
 * Spins the wheel once: draws a number between 0 and the total score and
 * returns the chromosome whose cumulative score slot contains it. Better
 * chromosomes own bigger slots.
 *
 * Known limitation: when the total score is zero or negative the slots no
 * longer mean anything and the pick degenerates (usually the lowest ranks
 * or the best one). Keep scores positive when using this strategy.
 */
public final class RouletteWheelSelection implements SelectionStrategy {

    @Override
    public <G> List<Chromosome<G>> select(PopulationStore<G> population, EvoRng rng) {
        double spin = rng.nextDouble(0.0, population.totalScore());
        return List.of(population.chromosomeAtCumulativeScore(spin));
    }

    @Override
    public String toString() {
        return "RouletteWheel";
    }
}
