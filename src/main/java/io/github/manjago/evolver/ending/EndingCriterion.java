package io.github.manjago.evolver.ending;

import io.github.manjago.evolver.core.PopulationStore;

/**
 * Decides after each scored generation whether evolution should stop.
 *
 * Implementations may keep history between calls; {@link #reset()} is
 * invoked at the start of every run.
 */
public interface EndingCriterion {

    /**
     * Evaluate the criterion against a freshly scored generation.
     * Called exactly once per generation.
     *
     * @param population scored population, not empty
     * @return true if evolution should stop
     */
    boolean isMet(PopulationStore<?> population);

    /**
     * Forget any history from a previous run.
     */
    default void reset() {}
}
