package io.github.manjago.evolver.selection;

/**
 * How parents are chosen for recombination.
 */
public enum SelectionType {

    /** Pick one chromosome with probability proportional to its score. */
    ROULETTE_WHEEL,

    /** Pick several chromosomes at evenly spaced cumulative scores. */
    STOCHASTIC_UNIVERSAL,

    /** Pick the best of a few uniformly drawn chromosomes. */
    TOURNAMENT;

    /**
     * Build the strategy for this type.
     *
     * @param tournamentSize contestants per tournament (ignored by other types)
     */
    public SelectionStrategy createStrategy(int tournamentSize) {
        return switch (this) {
            case ROULETTE_WHEEL -> new RouletteWheelSelection();
            case STOCHASTIC_UNIVERSAL -> new StochasticUniversalSelection();
            case TOURNAMENT -> new TournamentSelection(tournamentSize);
        };
    }
}
