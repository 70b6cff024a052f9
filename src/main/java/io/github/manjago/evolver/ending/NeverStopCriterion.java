package io.github.manjago.evolver.ending;

import io.github.manjago.evolver.core.PopulationStore;

/**
 * Never fires. The run continues until it is stopped from outside,
 * which suits interactive front ends that poll the best chromosome.
 */
public final class NeverStopCriterion implements EndingCriterion {

    @Override
    public boolean isMet(PopulationStore<?> population) {
        return false;
    }

    @Override
    public String toString() {
        return "NeverStop";
    }
}
