package in.addwise.service.risk;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RiskAdaptiveUtilityTest {

    @Test
    void testThetaByScoreDifferential() {
        assertEquals(2.0, new RiskAdaptiveUtility(40, 5).theta());
        assertEquals(0.5, new RiskAdaptiveUtility(20, 5).theta());
        assertEquals(0.0, new RiskAdaptiveUtility(0, 5).theta());
        assertEquals(-1.0, new RiskAdaptiveUtility(-20, 5).theta());
        assertEquals(-2.0, new RiskAdaptiveUtility(-40, 5).theta());
    }

    @Test
    void testLastDayTakesExtremePositions() {
        assertEquals(3.0, new RiskAdaptiveUtility(40, 1).theta());
        assertEquals(-3.0, new RiskAdaptiveUtility(-40, 1).theta());
        assertEquals(0.5, new RiskAdaptiveUtility(20, 1).theta(), "Inside ±30 falls back to normal bands");
    }

    @Test
    void testAdjust() {
        RiskAdaptiveUtility leading = RiskAdaptiveUtility.of(150, 110, 4);   // θ = 2
        assertEquals(30.0 - 0.5 * 2.0 * 10.0, leading.adjust(30.0, 10.0), 1e-9);

        RiskAdaptiveUtility trailing = RiskAdaptiveUtility.of(100, 120, 4);  // θ = -1
        assertEquals(35.0, trailing.adjust(30.0, 10.0), 1e-9, "Trailing credits upside");

        assertEquals(30.0, RiskAdaptiveUtility.neutral().adjust(30.0, 10.0));
    }
}
