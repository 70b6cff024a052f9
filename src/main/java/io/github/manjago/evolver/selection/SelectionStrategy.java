package io.github.manjago.evolver.selection;

import io.github.manjago.evolver.core.Chromosome;
import io.github.manjago.evolver.core.EvoRng;
import io.github.manjago.evolver.core.PopulationStore;

import java.util.List;

/**
 * Picks parents for the next generation from a scored population.
 *
 * Implementations are biased toward higher scores in different ways.
 * Selection never modifies the store; the returned chromosomes are the
 * store's own instances and must be copied before being changed.
 */
public interface SelectionStrategy {

    /**
     * Select one or more chromosomes.
     *
     * @param population scored population of the current generation, not empty
     * @param rng random source
     * @return at least one chromosome
     */
    <G> List<Chromosome<G>> select(PopulationStore<G> population, EvoRng rng);
}
