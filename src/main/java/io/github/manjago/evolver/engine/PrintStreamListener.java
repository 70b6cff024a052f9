package io.github.manjago.evolver.engine;

import org.jetbrains.annotations.NotNull;

import java.io.PrintStream;

/**
 * Writes one line per generation and one line at the end of the run
 * to a caller supplied stream.
 */
public class PrintStreamListener implements EvolutionListener {

    private static final String PREFIX = "[evolver] ";

    private final PrintStream out;

    public PrintStreamListener(@NotNull PrintStream out) {
        this.out = out;
    }

    @Override
    public void onGeneration(GenerationStats stats) {
        out.println(PREFIX + "Generation " + stats.generation()
                + ": best fitness score is " + stats.bestScore()
                + " (" + stats.renderedBest() + ")");
        out.flush();
    }

    @Override
    public void onFinished(GenerationStats last, boolean criterionMet) {
        if (last == null) {
            out.println(PREFIX + "The algorithm was stopped before any generation was scored.");
            out.flush();
            return;
        }
        out.println(PREFIX + (criterionMet ? "The ending criterion was matched. " : "The algorithm was stopped. ")
                + "The best individual has a fitness score of " + last.bestEverScore()
                + " after " + (last.generation() + 1) + " generations.");
        out.flush();
    }
}
