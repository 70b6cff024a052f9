package io.github.manjago.evolver.engine;

import io.github.manjago.evolver.config.EvolutionConfig;
import io.github.manjago.evolver.core.*;
import io.github.manjago.evolver.ending.EndingCriterion;
import io.github.manjago.evolver.operators.Crossover;
import io.github.manjago.evolver.operators.Mutation;
import io.github.manjago.evolver.selection.SelectionStrategy;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main evolution engine.
 *
 * Each generation:
 * 1. Score every chromosome once and build a fresh {@link PopulationStore}
 * 2. Publish it (best chromosome, statistics, listeners)
 * 3. Check the ending criterion
 * 4. Select pairs, cross them and fill a new population
 * 5. Mutate every offspring
 *
 * A run can execute on the caller's thread (blocking) or on its own daemon
 * thread (non-blocking). Stopping is cooperative: a generation in progress
 * always completes, and the run flag is checked between generations.
 * Every run has its own flag, so the handle of a finished run cannot stop
 * a later one.
 *
 * The engine is re-entrant: every run starts from a new random population.
 * A run that fails (any exception or error from a callback) still ends
 * idle and completes its handle exceptionally.
 */
public class GeneticAlgorithm<G> {

    private static final Logger log = LoggerFactory.getLogger(GeneticAlgorithm.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final GeneticProblem<G> problem;
    private volatile EvolutionConfig config;

    // Random source; null = derive from config at run start
    private final EvoRng fixedRng;

    // Current or last run, published once its context is built (guarded by this for writes)
    private volatile RunContext<G> lastRun;

    // Event listener
    private EvolutionListener listener = EvolutionListener.NOOP;

    /**
     * Published state of the last scored generation.
     * Replaced as a whole so readers never see a partially built store.
     */
    private record Snapshot<G>(PopulationStore<G> population, ScoredChromosome<G> best) {}

    /**
     * Create engine with the random source chosen by {@link EvolutionConfig#randomSeed()}.
     */
    public GeneticAlgorithm(@NotNull GeneticProblem<G> problem, @NotNull EvolutionConfig config) {
        this.problem = problem;
        this.config = config;
        this.fixedRng = null;
    }

    /**
     * Create engine with an explicit random source.
     */
    public GeneticAlgorithm(@NotNull GeneticProblem<G> problem, @NotNull EvolutionConfig config, @NotNull EvoRng rng) {
        this.problem = problem;
        this.config = config;
        this.fixedRng = rng;
    }

    /**
     * Replace the configuration. Takes effect on the next run.
     */
    public void setConfig(@NotNull EvolutionConfig config) {
        this.config = config;
    }

    public EvolutionConfig getConfig() {
        return config;
    }

    /**
     * Set event listener for evolution events.
     */
    public void setListener(EvolutionListener listener) {
        this.listener = listener != null ? listener : EvolutionListener.NOOP;
    }

    // ========== Run / Stop ==========

    /**
     * Run without a log sink.
     *
     * @see #run(boolean, PrintStream)
     */
    public EvolutionRun<G> run(boolean blocking) {
        return run(blocking, null);
    }

    /**
     * Start a run.
     *
     * The configuration is validated on the caller's thread in both modes.
     * In blocking mode this returns when the run is over; exceptions from
     * the problem and listener callbacks propagate to the caller. In non-blocking mode
     * this returns immediately and such exceptions are reported through
     * the returned handle.
     *
     * @param blocking run on the caller's thread if true, on a new daemon thread otherwise
     * @param logSink stream receiving one line per generation, or null for none
     * @return handle to the run
     * @throws io.github.manjago.evolver.config.EvolutionConfigException if the configuration is invalid
     * @throws IllegalStateException if a run is already in progress
     */
    public EvolutionRun<G> run(boolean blocking, @Nullable PrintStream logSink) {
        EvolutionConfig cfg = this.config;
        cfg.validate();

        RunContext<G> context;

        synchronized (this) {
            RunContext<G> previous = lastRun;
            if (previous != null && !previous.completion.isDone()) {
                throw new IllegalStateException("Evolution already running");
            }

            EvoRng rng = fixedRng != null ? fixedRng
                    : cfg.randomSeed() != 0 ? new EvoRng(cfg.randomSeed())
                    : EvoRng.shared();
            context = new RunContext<>(cfg, rng, listener, logSink);
            lastRun = context;
        }

        log.info("Starting evolution ({}, population {}, {}, {})",
                blocking ? "blocking" : "non-blocking", cfg.populationSize(),
                context.selection, context.criterion);

        if (blocking) {
            evolve(context);
        } else {
            Thread thread = new Thread(() -> {
                try {
                    evolve(context);
                } catch (Throwable t) {
                    // Already reported through the completion
                    log.debug("Background evolution terminated by {}", t.toString());
                }
            }, "evolver-run-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            thread.start();
        }
        return new EvolutionRun<>(context);
    }

    /**
     * Request graceful stop of the current run. The current generation completes first.
     */
    public void stop() {
        RunContext<G> run = lastRun;
        if (run != null) {
            run.requestStop();
        }
    }

    /**
     * Check if a run is in progress and has not been asked to stop.
     */
    public boolean isRunning() {
        RunContext<G> run = lastRun;
        return run != null && run.active.get();
    }

    // ========== Evolution ==========

    /**
     * Per-run state: collaborators built from the configuration validated at
     * run start, the run flag, the published snapshot and the completion.
     * A run handle only ever talks to its own context.
     */
    static final class RunContext<G> {
        final EvolutionConfig config;
        final EvoRng rng;
        final SelectionStrategy selection;
        final EndingCriterion criterion;
        final Crossover crossover;
        final Mutation mutation;
        final List<EvolutionListener> listeners = new ArrayList<>(2);

        final AtomicBoolean active = new AtomicBoolean(true);
        final CompletableFuture<ScoredChromosome<G>> completion = new CompletableFuture<>();
        volatile Snapshot<G> snapshot;
        volatile int generation;

        RunContext(EvolutionConfig config, EvoRng rng, EvolutionListener listener, @Nullable PrintStream logSink) {
            this.config = config;
            this.rng = rng;
            this.selection = config.selectionType().createStrategy(config.tournamentSize());
            this.criterion = config.endingCriterion().createCriterion(config.maxEndScore());
            this.criterion.reset();
            this.crossover = new Crossover(rng);
            this.mutation = new Mutation(config.mutationProbability(), rng);
            this.listeners.add(listener);
            if (logSink != null) {
                this.listeners.add(new PrintStreamListener(logSink));
            }
        }

        void requestStop() {
            if (active.getAndSet(false)) {
                log.info("Stop requested at generation {}", generation);
            }
        }

        @Nullable ScoredChromosome<G> bestScored() {
            Snapshot<G> s = snapshot;
            return s != null ? s.best() : null;
        }
    }

    private void evolve(RunContext<G> ctx) {
        long startTime = System.currentTimeMillis();
        Throwable failure = null;

        try {
            ctx.listeners.forEach(l -> l.onStart(ctx.config));

            GenerationStats lastStats = null;
            boolean criterionMet = false;
            List<Chromosome<G>> population = seed(ctx);

            while (ctx.active.get()) {
                // 1. Score and publish
                PopulationStore<G> store = score(population);
                ScoredChromosome<G> best = publish(ctx, store);
                lastStats = statsOf(ctx, store, best);

                GenerationStats stats = lastStats;
                ctx.listeners.forEach(l -> l.onGeneration(stats));
                log.debug("{}", stats);

                // 2. Check ending criterion
                if (ctx.criterion.isMet(store)) {
                    criterionMet = true;
                    log.info("Ending criterion {} matched at generation {}", ctx.criterion, ctx.generation);
                    break;
                }

                // 3. Make it evolve
                population = breed(ctx, store);
                ctx.generation++;
            }

            ctx.active.set(false);
            long elapsed = System.currentTimeMillis() - startTime;
            ScoredChromosome<G> best = ctx.bestScored();
            log.info("Evolution finished after {} generations ({} ms), best score {}",
                    ctx.generation, elapsed, best != null ? best.score() : "n/a");

            GenerationStats finalStats = lastStats;
            boolean met = criterionMet;
            ctx.listeners.forEach(l -> l.onFinished(finalStats, met));
        } catch (Throwable t) {
            failure = t;
            log.error("Evolution failed at generation {}", ctx.generation, t);
            throw t;
        } finally {
            ctx.active.set(false);
            if (failure != null) {
                ctx.completion.completeExceptionally(failure);
            } else {
                ctx.completion.complete(ctx.bestScored());
            }
        }
    }

    private List<Chromosome<G>> seed(RunContext<G> ctx) {
        int size = ctx.config.populationSize();
        List<Chromosome<G>> population = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            int length = ctx.rng.nextInt(ctx.config.minChromosomeSize(), ctx.config.maxChromosomeSize());
            population.add(Chromosome.generate(length, problem::randomGene));
        }
        return population;
    }

    private PopulationStore<G> score(List<Chromosome<G>> population) {
        PopulationStore<G> store = new PopulationStore<>(population.size());
        for (Chromosome<G> chromosome : population) {
            store.insert(problem.score(chromosome), chromosome);
        }
        return store;
    }

    /**
     * Publish a fully built store and update the best of the run.
     * Ties go to the newer generation.
     */
    private ScoredChromosome<G> publish(RunContext<G> ctx, PopulationStore<G> store) {
        Snapshot<G> previous = ctx.snapshot;
        ScoredChromosome<G> candidate = store.best();
        ScoredChromosome<G> best = previous == null || candidate.score() >= previous.best().score()
                ? candidate
                : previous.best();
        ctx.snapshot = new Snapshot<>(store, best);
        return best;
    }

    private GenerationStats statsOf(RunContext<G> ctx, PopulationStore<G> store, ScoredChromosome<G> bestEver) {
        ScoredChromosome<G> best = store.best();
        return new GenerationStats(
            ctx.generation,
            best.score(),
            store.meanScore(),
            store.worst().score(),
            store.size(),
            bestEver.score(),
            problem.print(best.chromosome())
        );
    }

    /**
     * Fill a new population of exactly populationSize offspring.
     * Selection results are paired in order; an odd leftover is discarded.
     */
    private List<Chromosome<G>> breed(RunContext<G> ctx, PopulationStore<G> store) {
        int size = ctx.config.populationSize();
        List<Chromosome<G>> offspring = new ArrayList<>(size + 1);

        while (offspring.size() < size) {
            // A] Selection
            List<Chromosome<G>> selection = new ArrayList<>();
            while (selection.size() < 2) {
                selection.addAll(ctx.selection.select(store, ctx.rng));
            }

            // B] Recombination
            for (int i = 0; i + 1 < selection.size(); i += 2) {
                offspring.addAll(ctx.crossover.cross(selection.get(i), selection.get(i + 1)));
            }
        }

        if (offspring.size() > size) {
            offspring.subList(size, offspring.size()).clear();
        }

        // C] Mutation
        for (Chromosome<G> chromosome : offspring) {
            ctx.mutation.mutate(chromosome, problem::randomGene);
        }
        return offspring;
    }

    // ========== Getters ==========

    /**
     * Best chromosome recorded in the current (or last) run.
     * Safe to call from any thread while a run is in progress.
     *
     * @return best chromosome, or null before the first generation is scored
     */
    public @Nullable Chromosome<G> best() {
        ScoredChromosome<G> best = bestScored();
        return best != null ? best.chromosome() : null;
    }

    /**
     * Best chromosome of the run with its score, or null before the first generation is scored.
     */
    public @Nullable ScoredChromosome<G> bestScored() {
        RunContext<G> run = lastRun;
        return run != null ? run.bestScored() : null;
    }

    /**
     * Score of the best chromosome, or NaN before the first generation is scored.
     */
    public double bestScore() {
        ScoredChromosome<G> best = bestScored();
        return best != null ? best.score() : Double.NaN;
    }

    /**
     * Last fully scored generation, or null before the first one.
     */
    public @Nullable PopulationStore<G> currentPopulation() {
        RunContext<G> run = lastRun;
        Snapshot<G> s = run != null ? run.snapshot : null;
        return s != null ? s.population() : null;
    }

    /**
     * Number of completed generations in the current run.
     */
    public int getGeneration() {
        RunContext<G> run = lastRun;
        return run != null ? run.generation : 0;
    }

    public GeneticProblem<G> getProblem() {
        return problem;
    }
}
