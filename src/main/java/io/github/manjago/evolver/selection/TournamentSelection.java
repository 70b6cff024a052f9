package io.github.manjago.evolver.selection;

import io.github.manjago.evolver.core.Chromosome;
import io.github.manjago.evolver.core.EvoRng;
import io.github.manjago.evolver.core.PopulationStore;

import java.util.List;

/**
 * Tournament selection.
 *
 * Draws {@code tournamentSize} ranks uniformly with replacement and keeps
 * the highest-scored contestant. The first contestant drawn wins ties.
 * A tournament of size 1 is plain uniform random selection.
 */
public final class TournamentSelection implements SelectionStrategy {

    private final int tournamentSize;

    /**
     * @param tournamentSize number of contestants, at least 1
     */
    public TournamentSelection(int tournamentSize) {
        if (tournamentSize < 1) {
            throw new IllegalArgumentException("Tournament size must be at least 1: " + tournamentSize);
        }
        this.tournamentSize = tournamentSize;
    }

    public int getTournamentSize() {
        return tournamentSize;
    }

    @Override
    public <G> List<Chromosome<G>> select(PopulationStore<G> population, EvoRng rng) {
        int lastRank = population.size() - 1;

        int bestIndex = rng.nextInt(0, lastRank);
        double bestScore = population.scoreAt(bestIndex);

        for (int i = 1; i < tournamentSize; i++) {
            int contestant = rng.nextInt(0, lastRank);
            double score = population.scoreAt(contestant);
            if (score > bestScore) {
                bestIndex = contestant;
                bestScore = score;
            }
        }

        return List.of(population.chromosomeAt(bestIndex));
    }

    @Override
    public String toString() {
        return "Tournament[" + tournamentSize + "]";
    }
}
