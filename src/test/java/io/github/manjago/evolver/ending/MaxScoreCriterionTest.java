package io.github.manjago.evolver.ending;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static io.github.manjago.evolver.ending.EndingCriterionTestSupport.population;
import static org.junit.jupiter.api.Assertions.*;

class MaxScoreCriterionTest {

    @Test
    @DisplayName("Fires when the best score reaches the threshold")
    void reachesThreshold() {
        MaxScoreCriterion criterion = new MaxScoreCriterion(10.0);

        assertFalse(criterion.isMet(population(1.0, 9.99)));
        assertTrue(criterion.isMet(population(1.0, 10.0)));
        assertTrue(criterion.isMet(population(1.0, 12.0)));
    }

    @Test
    @DisplayName("Has no memory between calls")
    void stateless() {
        MaxScoreCriterion criterion = new MaxScoreCriterion(5.0);

        assertTrue(criterion.isMet(population(6.0)));
        assertFalse(criterion.isMet(population(4.0)));
    }

    @Test
    @DisplayName("Works with negative thresholds")
    void negativeThreshold() {
        MaxScoreCriterion criterion = new MaxScoreCriterion(-2.0);

        assertFalse(criterion.isMet(population(-5.0, -3.0)));
        assertTrue(criterion.isMet(population(-5.0, -2.0)));
    }

    @Test
    @DisplayName("NeverStop never fires")
    void neverStop() {
        NeverStopCriterion criterion = new NeverStopCriterion();
        for (int i = 0; i < 100; i++) {
            assertFalse(criterion.isMet(population(1e9)));
        }
    }

    @Test
    @DisplayName("Criterion types build the matching criterion")
    void typesCreateCriteria() {
        EndingCriterion max = EndingCriterionType.MAX_SCORE.createCriterion(7.5);
        assertInstanceOf(MaxScoreCriterion.class, max);
        assertEquals(7.5, ((MaxScoreCriterion) max).getThreshold());

        assertInstanceOf(BestScoreCriterion.class, EndingCriterionType.BEST_SCORE.createCriterion(0));
        assertInstanceOf(NeverStopCriterion.class, EndingCriterionType.NEVER_STOP.createCriterion(0));
    }
}
