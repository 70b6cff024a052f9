package io.github.manjago.evolver.ending;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static io.github.manjago.evolver.ending.EndingCriterionTestSupport.population;
import static org.junit.jupiter.api.Assertions.*;

class BestScoreCriterionTest {

    private BestScoreCriterion criterion;

    @BeforeEach
    void setUp() {
        criterion = new BestScoreCriterion();
    }

    @Nested
    @DisplayName("Stagnation")
    class Stagnation {

        @Test
        @DisplayName("Constant best score fires on the 11th generation")
        void firesOnEleventh() {
            for (int call = 1; call <= 10; call++) {
                assertFalse(criterion.isMet(population(1.0, 5.0)), "Call " + call);
            }
            assertTrue(criterion.isMet(population(1.0, 5.0)));
        }

        @Test
        @DisplayName("Decreasing best scores also count as stagnation")
        void decreasingFires() {
            boolean met = false;
            for (int call = 0; call < 11; call++) {
                met = criterion.isMet(population(100.0 - call));
            }
            assertTrue(met);
        }

        @Test
        @DisplayName("Only the best score matters")
        void usesBestOnly() {
            boolean met = false;
            for (int call = 0; call < 11; call++) {
                // Worst and mean keep changing, best stays at 9
                met = criterion.isMet(population(call - 20.0, 9.0));
            }
            assertTrue(met);
        }
    }

    @Nested
    @DisplayName("Improvement")
    class Improvement {

        @Test
        @DisplayName("Strictly increasing scores never fire")
        void increasingNeverFires() {
            for (int call = 0; call < 100; call++) {
                assertFalse(criterion.isMet(population(call)));
            }
        }

        @Test
        @DisplayName("An improvement within the window keeps the run going")
        void lateImprovement() {
            for (int call = 0; call < 10; call++) {
                criterion.isMet(population(1.0));
            }
            // Window now holds nine 1.0 and the new 2.0, oldest retained is 1.0
            assertFalse(criterion.isMet(population(2.0)));
        }
    }

    @Test
    @DisplayName("History never exceeds the window")
    void boundedHistory() {
        for (int call = 0; call < 50; call++) {
            criterion.isMet(population(call));
            assertTrue(criterion.historySize() <= BestScoreCriterion.WINDOW);
        }
    }

    @Test
    @DisplayName("reset forgets previous observations")
    void reset() {
        for (int call = 0; call < 10; call++) {
            criterion.isMet(population(3.0));
        }
        criterion.reset();

        assertEquals(0, criterion.historySize());
        assertFalse(criterion.isMet(population(3.0)));
    }
}
