package io.github.manjago.evolver.selection;

import io.github.manjago.evolver.core.Chromosome;
import io.github.manjago.evolver.core.EvoRng;
import io.github.manjago.evolver.core.PopulationStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.github.manjago.evolver.selection.SelectionTestSupport.histogram;
import static io.github.manjago.evolver.selection.SelectionTestSupport.storeOf;
import static org.junit.jupiter.api.Assertions.*;

class RouletteWheelSelectionTest {

    private static final int DRAWS = 20_000;

    @Test
    @DisplayName("Selection frequency is proportional to score")
    void proportionalToScore() {
        PopulationStore<Integer> store = storeOf(1, 2, 3, 4);
        Map<Integer, Integer> counts = histogram(new RouletteWheelSelection(), store, new EvoRng(21), DRAWS);

        // Expected shares 10%, 20%, 30%, 40%
        double[] expected = {0.1, 0.2, 0.3, 0.4};
        for (int gene = 0; gene < 4; gene++) {
            double share = counts.getOrDefault(gene, 0) / (double) DRAWS;
            assertEquals(expected[gene], share, 0.02, "Share of gene " + gene);
        }
    }

    @Test
    @DisplayName("Zero-scored chromosomes are practically never chosen")
    void zeroScoreNotChosen() {
        PopulationStore<Integer> store = storeOf(0, 0, 5);
        Map<Integer, Integer> counts = histogram(new RouletteWheelSelection(), store, new EvoRng(22), 5000);

        // Only a spin of exactly 0.0 lands on the zero slots
        assertTrue(counts.getOrDefault(2, 0) >= 4990);
    }

    @Test
    @DisplayName("Zero total score degenerates without failing")
    void zeroTotal() {
        PopulationStore<Integer> store = storeOf(0, 0, 0);
        List<Chromosome<Integer>> selected = new RouletteWheelSelection().select(store, new EvoRng(23));

        assertEquals(1, selected.size());
        assertEquals(0, selected.get(0).gene(0), "Spin of 0 lands on the lowest rank");
    }

    @Test
    @DisplayName("Negative total score degenerates without failing")
    void negativeTotal() {
        PopulationStore<Integer> store = storeOf(-3, -2, -1);
        RouletteWheelSelection selection = new RouletteWheelSelection();
        EvoRng rng = new EvoRng(24);

        for (int i = 0; i < 100; i++) {
            assertEquals(1, selection.select(store, rng).size());
        }
    }
}
