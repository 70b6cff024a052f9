package io.github.manjago.evolver.ending;

import io.github.manjago.evolver.core.PopulationStore;

/**
 * Stops as soon as the best chromosome reaches a target score.
 */
public final class MaxScoreCriterion implements EndingCriterion {

    private final double threshold;

    public MaxScoreCriterion(double threshold) {
        this.threshold = threshold;
    }

    public double getThreshold() {
        return threshold;
    }

    @Override
    public boolean isMet(PopulationStore<?> population) {
        return population.best().score() >= threshold;
    }

    @Override
    public String toString() {
        return "MaxScore[" + threshold + "]";
    }
}
