package io.github.manjago.evolver.engine;

import io.github.manjago.evolver.core.ScoredChromosome;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle to one run of a {@link GeneticAlgorithm}.
 *
 * For blocking runs the handle is already done when {@code run} returns.
 * For non-blocking runs it can be used to wait for the background run or
 * to stop it. Stopping only takes effect at the next generation boundary.
 *
 * The handle is bound to its own run: once that run is over, {@link #stop()}
 * does nothing and {@link #best()} keeps returning the run's result, even
 * if the engine has been started again since.
 */
public class EvolutionRun<G> {

    private final GeneticAlgorithm.RunContext<G> run;
    private final CompletableFuture<ScoredChromosome<G>> completion;

    EvolutionRun(GeneticAlgorithm.RunContext<G> run) {
        this.run = run;
        this.completion = run.completion;
    }

    /**
     * Wait for the run to end.
     *
     * @return best chromosome of the run, or null if stopped before the first generation was scored
     * @throws ExecutionException if a problem callback failed during the run
     */
    public @Nullable ScoredChromosome<G> await() throws InterruptedException, ExecutionException {
        return completion.get();
    }

    /**
     * Wait for the run to end, at most the given time.
     *
     * @return true if the run ended in time
     * @throws ExecutionException if a problem callback failed during the run
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException, ExecutionException {
        try {
            completion.get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }

    /**
     * Request the run to stop after the current generation.
     * No effect once the run is over.
     */
    public void stop() {
        if (!completion.isDone()) {
            run.requestStop();
        }
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * Best chromosome of this run recorded so far, also while the run is in progress.
     * After a successful run this is the value {@link #await()} returns.
     */
    public @Nullable ScoredChromosome<G> best() {
        return run.bestScored();
    }

    /**
     * Completion stage of the run, for callers composing asynchronous work.
     */
    public CompletableFuture<ScoredChromosome<G>> completion() {
        return completion.copy();
    }
}
