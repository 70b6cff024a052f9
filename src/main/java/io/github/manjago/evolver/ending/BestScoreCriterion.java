package io.github.manjago.evolver.ending;

import io.github.manjago.evolver.core.PopulationStore;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Stops when the best score has stopped improving.
 *
 * Keeps the best score of the last {@value #WINDOW} generations. Each call
 * appends the current best; once more than {@value #WINDOW} scores have been
 * seen the oldest is evicted and the criterion fires if no retained score
 * is greater than the oldest retained one. The earliest it can fire is the
 * 11th generation.
 */
public final class BestScoreCriterion implements EndingCriterion {

    /** Number of recent best scores monitored. */
    public static final int WINDOW = 10;

    private final Deque<Double> lastScores = new ArrayDeque<>(WINDOW + 1);

    @Override
    public boolean isMet(PopulationStore<?> population) {
        lastScores.addLast(population.best().score());

        if (lastScores.size() <= WINDOW) {
            return false;
        }
        lastScores.removeFirst();

        double oldest = lastScores.getFirst();
        for (double score : lastScores) {
            if (score > oldest) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void reset() {
        lastScores.clear();
    }

    /**
     * Number of scores currently retained.
     */
    public int historySize() {
        return lastScores.size();
    }

    @Override
    public String toString() {
        return "BestScore[window=" + WINDOW + "]";
    }
}
