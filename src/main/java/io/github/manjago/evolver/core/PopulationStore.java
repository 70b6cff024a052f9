package io.github.manjago.evolver.core;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fitness-sorted collection of scored chromosomes for one generation.
 *
 * Entries are kept in ascending score order. Equal scores keep insertion
 * order, so among ties the most recently inserted entry sorts last and is
 * the one returned by {@link #best()}.
 *
 * A store is filled by one thread and then published; it is never modified
 * after being handed to selection or to observers.
 */
public class PopulationStore<G> {

    private final List<ScoredChromosome<G>> entries;

    public PopulationStore() {
        this.entries = new ArrayList<>();
    }

    public PopulationStore(int expectedSize) {
        this.entries = new ArrayList<>(expectedSize);
    }

    /**
     * Insert an entry after every entry with a lower or equal score.
     */
    public void insert(double score, @NotNull Chromosome<G> chromosome) {
        entries.add(upperBound(score), new ScoredChromosome<>(score, chromosome));
    }

    // First index whose score is strictly greater than the given one
    private int upperBound(double score) {
        int lo = 0;
        int hi = entries.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (Double.compare(entries.get(mid).score(), score) <= 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Highest-scored entry (most recent among equal scores).
     *
     * @throws IllegalStateException if the store is empty
     */
    public @NotNull ScoredChromosome<G> best() {
        if (entries.isEmpty()) {
            throw new IllegalStateException("Population store is empty");
        }
        return entries.get(entries.size() - 1);
    }

    /**
     * Lowest-scored entry.
     *
     * @throws IllegalStateException if the store is empty
     */
    public @NotNull ScoredChromosome<G> worst() {
        if (entries.isEmpty()) {
            throw new IllegalStateException("Population store is empty");
        }
        return entries.get(0);
    }

    /**
     * Score at the given ascending rank, or 0 when the index is out of range.
     */
    public double scoreAt(int index) {
        if (index < 0 || index >= entries.size()) {
            return 0.0;
        }
        return entries.get(index).score();
    }

    /**
     * Chromosome at the given ascending rank, or the best one when the
     * index is out of range.
     */
    public @NotNull Chromosome<G> chromosomeAt(int index) {
        if (index < 0 || index >= entries.size()) {
            return best().chromosome();
        }
        return entries.get(index).chromosome();
    }

    /**
     * Walk the entries in ascending order, summing scores, and return the
     * first chromosome whose running sum reaches the threshold.
     * Returns the best chromosome when the total never reaches it.
     */
    public @NotNull Chromosome<G> chromosomeAtCumulativeScore(double threshold) {
        double cumulative = 0.0;
        for (ScoredChromosome<G> entry : entries) {
            cumulative += entry.score();
            if (threshold <= cumulative) {
                return entry.chromosome();
            }
        }
        return best().chromosome();
    }

    /**
     * Sum of all scores. May be zero or negative.
     */
    public double totalScore() {
        double sum = 0.0;
        for (ScoredChromosome<G> entry : entries) {
            sum += entry.score();
        }
        return sum;
    }

    public double meanScore() {
        return entries.isEmpty() ? 0.0 : totalScore() / entries.size();
    }

    /**
     * Read-only view of the entries in ascending score order.
     */
    public @NotNull List<ScoredChromosome<G>> entries() {
        return Collections.unmodifiableList(entries);
    }

    @Override
    public String toString() {
        return String.format("PopulationStore[size=%d, best=%s]",
                entries.size(), entries.isEmpty() ? "n/a" : String.format("%.4f", best().score()));
    }
}
