package in.addwise.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CandidateTest {

    private static Candidate on(Integer... days) {
        return new Candidate("x", List.of(days), null, null, null, null, null, false);
    }

    @Test
    void testDaysSortedAndDistinct() {
        Candidate c = on(5, 1, 5);

        assertEquals(List.of(1, 5), c.occupiedDays());
        assertEquals(1, c.firstDay());
        assertEquals(5, c.lastDay());
        assertTrue(c.isMultiDay());
        assertEquals(HazardTier.MODERATE, c.hazardTier(), "Default tier");
    }

    @Test
    void testRemainingFrom() {
        Candidate c = on(1, 5);

        assertSame(c, c.remainingFrom(0));
        assertEquals(List.of(5), c.remainingFrom(2).occupiedDays());
        assertNull(c.remainingFrom(6));
    }

    @Test
    void testRejectsInvalid() {
        assertThrows(IllegalArgumentException.class, () -> on());
        assertThrows(IllegalArgumentException.class, () -> on(-1));
        assertThrows(IllegalArgumentException.class,
            () -> new Candidate(" ", List.of(1), null, null, null, null, null, false));
    }

    @Test
    void testScoredTotalCountsEveryDay() {
        ScoredCandidate sc = ScoredCandidate.of(on(1, 5), 40.0, RiskTier.SAFE);

        assertEquals(80.0, sc.totalValue(), 1e-12);
        assertTrue(sc.isSelectable());
        assertFalse(ScoredCandidate.of(on(2), 40.0, RiskTier.NO_GO).isSelectable());
    }
}
