package in.addwise.service.bandit;

import in.addwise.domain.model.BanditState;
import in.addwise.domain.model.UcbScore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BudgetedLinUcb.
 *
 * Tests:
 * - Exploration bonus and budget/time scaling
 * - Deadline urgency
 * - Reward updates and arm selection
 * - Horizon resets and state round trip
 */
class BudgetedLinUcbTest {

    private static final double[] E0 = {1.0, 0.0, 0.0};
    private static final double[] E1 = {0.0, 1.0, 0.0};

    private BudgetedLinUcb bandit;

    @BeforeEach
    void setUp() {
        bandit = new BudgetedLinUcb(3, 1.0, 1.0, 5, 7, 5.0);
    }

    @Test
    void testFreshModelIsPureExploration() {
        UcbScore score = bandit.score(E0, null);

        assertEquals(0.0, score.pointEstimate(), 1e-12, "No observations, no estimate");
        assertEquals(1.0, score.explorationBonus(), 1e-12, "α·√(xᵀ(λI)⁻¹x) at full budget and time");
        assertEquals(0.0, score.urgencyBonus());
    }

    @Test
    void testUrgencyBonus() {
        assertEquals(2.5, bandit.score(E0, 2).urgencyBonus(), 1e-12);
        assertEquals(5.0, bandit.score(E0, 1).urgencyBonus(), 1e-12);
        assertEquals(0.0, bandit.score(E0, 0).urgencyBonus(), "Non-positive deadline adds nothing");
    }

    @Test
    void testExplorationScale() {
        assertEquals(1.0, bandit.explorationScale(), 1e-12);

        bandit.update(E1, 0.0);
        bandit.update(E1, 0.0);
        assertEquals(0.6, bandit.explorationScale(), 1e-12, "Budget 3/5 against full time");

        for (int i = 0; i < 5; i++) {
            bandit.advanceTime();
        }
        assertEquals(2.0, bandit.explorationScale(), 1e-12, "(3/5)/(2/7) caps at 2");

        bandit.advanceTime();
        bandit.advanceTime();
        assertEquals(0.1, bandit.explorationScale(), 1e-12, "No time left");
    }

    @Test
    void testUpdateMovesEstimateTowardReward() {
        bandit.update(E0, 10.0);

        UcbScore score = bandit.score(E0, null);

        // A00 = 2, b0 = 10
        assertEquals(5.0, score.pointEstimate(), 1e-9);
        assertEquals(Math.sqrt(0.5) * 0.8, score.explorationBonus(), 1e-9);
        assertEquals(4, bandit.budgetRemaining());
        assertEquals(1, bandit.observations());
    }

    @Test
    void testObserveLearnsWithoutSpendingBudget() {
        bandit.consume();
        bandit.observe(E0, 10.0);
        bandit.observe(E0, 10.0);

        // A00 = 3, b0 = 20
        assertEquals(20.0 / 3.0, bandit.score(E0, null).pointEstimate(), 1e-9);
        assertEquals(4, bandit.budgetRemaining(), "One consume, two observations");
        assertEquals(2, bandit.observations());
    }

    @Test
    void testConsumeStopsAtZero() {
        BudgetedLinUcb single = new BudgetedLinUcb(3, 1.0, 1.0, 1, 7, 5.0);
        single.consume();
        single.consume();

        assertEquals(0, single.budgetRemaining());
        assertTrue(single.select(Map.of("a", E0), null).isEmpty());
    }

    @Test
    void testSelectPrefersLearnedArm() {
        bandit = new BudgetedLinUcb(3, 1.0, 1.0, 10, 7, 5.0);
        bandit.update(E0, 20.0);
        bandit.update(E1, -5.0);

        Optional<BudgetedLinUcb.Selection> choice = bandit.select(Map.of("b", E1, "a", E0), Map.of());

        assertTrue(choice.isPresent());
        assertEquals("a", choice.get().armId());
    }

    @Test
    void testSelectTieGoesToSmallerId() {
        Optional<BudgetedLinUcb.Selection> choice = bandit.select(Map.of("zeta", E0, "alpha", E1), null);

        assertEquals("alpha", choice.orElseThrow().armId());
    }

    @Test
    void testSelectEmptyWhenBudgetExhausted() {
        BudgetedLinUcb single = new BudgetedLinUcb(3, 1.0, 1.0, 1, 7, 5.0);
        single.update(E0, 1.0);

        assertTrue(single.select(Map.of("a", E0), null).isEmpty());
        assertTrue(bandit.select(Map.of(), null).isEmpty());
    }

    @Test
    void testResetKeepsLearning() {
        bandit.update(E0, 10.0);
        double learned = bandit.score(E0, null).pointEstimate();

        bandit.resetHorizon(5, 7);

        assertEquals(learned, bandit.score(E0, null).pointEstimate(), 1e-12);
        assertEquals(5, bandit.budgetRemaining());
        assertEquals(7, bandit.timeRemaining());
        assertEquals(1, bandit.observations());
    }

    @Test
    void testStateRoundTrip() {
        bandit.update(E0, 12.0);
        bandit.update(new double[] {0.5, 0.5, 1.0}, 3.0);
        bandit.advanceTime();

        BudgetedLinUcb restored = BudgetedLinUcb.fromState(bandit.toState(), 5.0);

        UcbScore original = bandit.score(E0, 3);
        UcbScore copy = restored.score(E0, 3);
        assertEquals(original.total(), copy.total(), 1e-12);
        assertEquals(bandit.budgetRemaining(), restored.budgetRemaining());
        assertEquals(bandit.timeRemaining(), restored.timeRemaining());
    }

    @Test
    void testRejectsBadShapes() {
        assertThrows(IllegalArgumentException.class, () -> bandit.score(new double[] {1.0}, null));

        BanditState broken = new BanditState(3, 1.0, 1.0, new double[2][2], new double[3], 5, 5, 7, 7, 0L);
        assertThrows(IllegalArgumentException.class, () -> BudgetedLinUcb.fromState(broken, 5.0));
    }
}
