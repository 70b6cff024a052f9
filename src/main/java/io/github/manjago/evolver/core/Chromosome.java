package io.github.manjago.evolver.core;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * An ordered sequence of genes representing one candidate solution.
 *
 * The length is fixed once the chromosome is created; only gene values
 * can be replaced. Genes are treated as immutable values and are shared
 * between copies.
 *
 * @param <G> gene type
 */
public final class Chromosome<G> {

    private final List<G> genes;

    private Chromosome(List<G> genes) {
        this.genes = genes;
    }

    /**
     * Create a chromosome holding a copy of the given genes.
     */
    public static <G> @NotNull Chromosome<G> of(@NotNull List<? extends G> genes) {
        return new Chromosome<>(new ArrayList<>(genes));
    }

    @SafeVarargs
    public static <G> @NotNull Chromosome<G> of(G... genes) {
        List<G> list = new ArrayList<>(genes.length);
        Collections.addAll(list, genes);
        return new Chromosome<>(list);
    }

    /**
     * Create a chromosome of the given length filled by the generator.
     */
    public static <G> @NotNull Chromosome<G> generate(int length, @NotNull Supplier<? extends G> generator) {
        List<G> list = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            list.add(generator.get());
        }
        return new Chromosome<>(list);
    }

    public int length() {
        return genes.size();
    }

    public G gene(int index) {
        return genes.get(index);
    }

    public void setGene(int index, G gene) {
        genes.set(index, gene);
    }

    /**
     * Read-only view of the genes.
     */
    public @NotNull List<G> genes() {
        return Collections.unmodifiableList(genes);
    }

    public @NotNull Chromosome<G> copy() {
        return new Chromosome<>(new ArrayList<>(genes));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Chromosome<?> other)) return false;
        return genes.equals(other.genes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(genes);
    }

    @Override
    public String toString() {
        return "Chromosome" + genes;
    }
}
