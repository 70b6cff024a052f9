package io.github.manjago.evolver.selection;

import io.github.manjago.evolver.core.Chromosome;
import io.github.manjago.evolver.core.EvoRng;
import io.github.manjago.evolver.core.PopulationStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static io.github.manjago.evolver.selection.SelectionTestSupport.storeOf;
import static org.junit.jupiter.api.Assertions.*;

class StochasticUniversalSelectionTest {

    private static double[] ones(int n) {
        double[] scores = new double[n];
        Arrays.fill(scores, 1.0);
        return scores;
    }

    @Test
    @DisplayName("Returns between 1 and size/10 chromosomes")
    void countWithinBounds() {
        PopulationStore<Integer> store = storeOf(ones(100));
        StochasticUniversalSelection selection = new StochasticUniversalSelection();
        EvoRng rng = new EvoRng(31);

        Set<Integer> sizes = new HashSet<>();
        for (int i = 0; i < 2000; i++) {
            int size = selection.select(store, rng).size();
            assertTrue(size >= 1 && size <= 10, "Selected " + size);
            sizes.add(size);
        }
        assertTrue(sizes.size() > 5, "Count should vary, saw " + sizes);
    }

    @Test
    @DisplayName("Small populations select one chromosome")
    void smallPopulationSelectsOne() {
        PopulationStore<Integer> store = storeOf(1, 2, 3, 4, 5);
        StochasticUniversalSelection selection = new StochasticUniversalSelection();
        EvoRng rng = new EvoRng(32);

        for (int i = 0; i < 500; i++) {
            assertEquals(1, selection.select(store, rng).size());
        }
    }

    @Test
    @DisplayName("Selected points are evenly spread over the cumulative score")
    void evenlySpread() {
        // 100 equal scores: k points spaced 100/k apart hit distinct chromosomes
        PopulationStore<Integer> store = storeOf(ones(100));
        StochasticUniversalSelection selection = new StochasticUniversalSelection();
        EvoRng rng = new EvoRng(33);

        for (int i = 0; i < 500; i++) {
            List<Chromosome<Integer>> selected = selection.select(store, rng);
            Set<Integer> distinct = new HashSet<>();
            for (Chromosome<Integer> c : selected) {
                distinct.add(c.gene(0));
            }
            assertEquals(selected.size(), distinct.size(), "Points should not collide");
        }
    }

    @Test
    @DisplayName("Zero total score still terminates with one chromosome")
    void zeroTotalTerminates() {
        PopulationStore<Integer> store = storeOf(new double[30]);
        List<Chromosome<Integer>> selected = new StochasticUniversalSelection().select(store, new EvoRng(34));

        assertEquals(1, selected.size());
    }

    @Test
    @DisplayName("Negative total score still terminates with one chromosome")
    void negativeTotalTerminates() {
        PopulationStore<Integer> store = storeOf(-1, -2, -3, -4, -5, -6, -7, -8, -9, -10, -11, -12, -13, -14, -15, -16, -17, -18, -19, -20);
        StochasticUniversalSelection selection = new StochasticUniversalSelection();
        EvoRng rng = new EvoRng(35);

        for (int i = 0; i < 100; i++) {
            assertEquals(1, selection.select(store, rng).size());
        }
    }
}
