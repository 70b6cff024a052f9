package io.github.manjago.evolver.operators;

import io.github.manjago.evolver.core.Chromosome;
import io.github.manjago.evolver.core.EvoRng;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Recombination of two parents into two offspring.
 *
 * Positions 0..m-1 (m = length of the shorter parent) are split into
 * consecutive runs of random length, alternately marked "exchange" and
 * "keep", starting with an exchange run. Genes at exchanged positions are
 * swapped between the offspring. Genes past m are never touched, so each
 * offspring keeps the length of its parent.
 *
 * Example for m = 8 (E = exchange, K = keep):
 * <pre>
 *   E E K K K E K K
 * </pre>
 */
public class Crossover {

    private final EvoRng rng;

    public Crossover(@NotNull EvoRng rng) {
        this.rng = rng;
    }

    /**
     * Cross two parents. The parents are left unchanged.
     *
     * @return the two offspring, in parent order
     */
    public <G> @NotNull List<Chromosome<G>> cross(@NotNull Chromosome<G> first, @NotNull Chromosome<G> second) {
        Chromosome<G> childA = first.copy();
        Chromosome<G> childB = second.copy();

        int shortest = Math.min(childA.length(), childB.length());
        int index = 0;
        boolean exchange = true;

        while (index < shortest) {
            int next = rng.nextInt(index, shortest);
            if (exchange) {
                for (int i = index; i < next; i++) {
                    G gene = childA.gene(i);
                    childA.setGene(i, childB.gene(i));
                    childB.setGene(i, gene);
                }
            }
            exchange = !exchange;
            index = next;
        }

        return List.of(childA, childB);
    }

    /**
     * Cross a pair given as a list.
     *
     * @throws IllegalArgumentException unless exactly two parents are given
     */
    public <G> @NotNull List<Chromosome<G>> cross(@NotNull List<Chromosome<G>> parents) {
        if (parents.size() != 2) {
            throw new IllegalArgumentException("Crossover needs exactly 2 parents, got " + parents.size());
        }
        return cross(parents.get(0), parents.get(1));
    }
}
