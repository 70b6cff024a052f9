package io.github.manjago.evolver.engine;

import io.github.manjago.evolver.config.EvolutionConfig;

/**
 * Listener for evolution events.
 *
 * Implement this interface to react to evolution events,
 * for example to log progress to a file or update a UI.
 * Listeners are called on the evolving thread and must not
 * influence the algorithm.
 */
public interface EvolutionListener {

    /**
     * Called once when a run starts, after the configuration was validated.
     *
     * @param config configuration of the run
     */
    default void onStart(EvolutionConfig config) {}

    /**
     * Called after each generation has been scored.
     *
     * @param stats statistics of the scored generation
     */
    default void onGeneration(GenerationStats stats) {}

    /**
     * Called once when a run ends.
     *
     * @param last statistics of the last scored generation (null if none was scored)
     * @param criterionMet true if the ending criterion fired, false if the run was stopped
     */
    default void onFinished(GenerationStats last, boolean criterionMet) {}

    /**
     * No-op listener that does nothing.
     */
    EvolutionListener NOOP = new EvolutionListener() {};
}
