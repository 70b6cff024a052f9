package io.github.manjago.evolver.ending;

/**
 * How the algorithm ends.
 */
public enum EndingCriterionType {

    /** Stop when the best score reaches a threshold. */
    MAX_SCORE,

    /** Stop when the best score has not improved over the monitored window. */
    BEST_SCORE,

    /** Run until stopped from outside. */
    NEVER_STOP;

    /**
     * Build a fresh criterion for this type.
     *
     * @param maxEndScore threshold used by {@link #MAX_SCORE}
     */
    public EndingCriterion createCriterion(double maxEndScore) {
        return switch (this) {
            case MAX_SCORE -> new MaxScoreCriterion(maxEndScore);
            case BEST_SCORE -> new BestScoreCriterion();
            case NEVER_STOP -> new NeverStopCriterion();
        };
    }
}
