package in.addwise.service.snipe;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ThresholdCalculator.
 *
 * Tests:
 * - Base threshold without history
 * - Percentile schedule from P90 to P50
 * - Scarcity multipliers
 * - Option value decay
 */
class ThresholdCalculatorTest {

    private static final List<Double> HISTORY =
        Arrays.asList(10.0, 20.0, 30.0, 40.0, 50.0, 60.0, 70.0, 80.0, 90.0, 100.0);

    @Test
    void testBaseThresholdWithoutHistory() {
        ThresholdCalculator calc = new ThresholdCalculator(List.of(), 40.0, 7);

        assertEquals(40.0, calc.threshold(0, 3), 1e-12);
        assertEquals(40.0 * 0.5, calc.threshold(5, 3), 1e-12);
    }

    @Test
    void testPercentileSchedule() {
        ThresholdCalculator calc = new ThresholdCalculator(HISTORY, 40.0, 7);

        assertEquals(90.0, calc.percentileFor(0), 1e-12);
        assertEquals(50.0, calc.percentileFor(6), 1e-12);
        assertEquals(91.0, calc.threshold(0, 2), 1e-9, "P90 interpolated");
        assertEquals(55.0, calc.threshold(6, 2), 1e-9, "P50 interpolated");

        double previous = Double.MAX_VALUE;
        for (int day = 0; day < 7; day++) {
            double t = calc.threshold(day, 2);
            assertTrue(t <= previous, "Threshold declines through the horizon");
            previous = t;
        }
    }

    @Test
    void testScarcityMultipliers() {
        ThresholdCalculator calc = new ThresholdCalculator(HISTORY, 40.0, 7);

        assertEquals(91.0 * 1.2, calc.threshold(0, 1), 1e-9, "Last unit");
        assertEquals(91.0 * 0.9, calc.threshold(0, 4), 1e-9, "Plenty left");
    }

    @Test
    void testOptionValue() {
        ThresholdCalculator calc = new ThresholdCalculator(HISTORY, 40.0, 7);

        // P75 = 77.5
        assertEquals(77.5 * 4 / 5, calc.optionValue(0, 5), 1e-9);
        assertEquals(77.5 * 4 / 5 * 3 / 6, calc.optionValue(3, 5), 1e-9);
        assertEquals(0.0, calc.optionValue(6, 5), "Nothing to wait for on the last day");
        assertEquals(0.0, calc.optionValue(0, 1), "Single unit carries no option");
    }

    @Test
    void testNonFiniteHistoryIgnored() {
        ThresholdCalculator calc = new ThresholdCalculator(Arrays.asList(20.0, Double.NaN, null), 40.0, 7);

        calc.addObservation(Double.POSITIVE_INFINITY);
        calc.addObservation(30.0);

        assertEquals(List.of(20.0, 30.0), calc.history());
    }

    @Test
    void testWindowKeepsMostRecentValues() {
        ThresholdCalculator calc = new ThresholdCalculator(HISTORY, 40.0, 7, 3);

        assertEquals(List.of(80.0, 90.0, 100.0), calc.history());

        calc.addObservation(5.0);

        assertEquals(List.of(90.0, 100.0, 5.0), calc.history());
        assertEquals(90.0, calc.threshold(6, 2), 1e-9, "P50 over the window only");
        assertThrows(IllegalArgumentException.class, () -> new ThresholdCalculator(HISTORY, 40.0, 7, -1));
    }

    @Test
    void testZeroWindowKeepsEverything() {
        ThresholdCalculator calc = new ThresholdCalculator(HISTORY, 40.0, 7, 0);
        calc.addObservation(110.0);

        assertEquals(11, calc.history().size());
    }

    @Test
    void testRejectsDayOutsideHorizon() {
        ThresholdCalculator calc = new ThresholdCalculator(HISTORY, 40.0, 7);

        assertThrows(IllegalArgumentException.class, () -> calc.threshold(7, 2));
        assertThrows(IllegalArgumentException.class, () -> calc.optionValue(-1, 2));
    }
}
