package in.addwise.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WeeklyBudgetTest {

    @Test
    void testConsumeAndReserve() {
        WeeklyBudget budget = WeeklyBudget.fresh(5, 1, 7);

        assertEquals(4, budget.usable());
        WeeklyBudget spent = budget.consume().consume();

        assertEquals(3, spent.remaining());
        assertEquals(2, spent.used());
        assertEquals(2, spent.usable());
    }

    @Test
    void testExhaustedBudgetCannotBeConsumed() {
        WeeklyBudget budget = WeeklyBudget.fresh(1, 0, 7).consume();

        assertTrue(budget.isExhausted());
        assertThrows(IllegalStateException.class, budget::consume);
    }

    @Test
    void testReserveAboveRemainingLeavesNothingUsable() {
        assertEquals(0, new WeeklyBudget(5, 3, 2, 7).usable());
        assertThrows(IllegalArgumentException.class, () -> new WeeklyBudget(2, 0, 3, 7));
    }
}
