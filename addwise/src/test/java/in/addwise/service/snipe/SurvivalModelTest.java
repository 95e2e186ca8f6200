package in.addwise.service.snipe;

import in.addwise.domain.model.HazardTier;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SurvivalModelTest {

    private final SurvivalModel model = new SurvivalModel(1.0);

    @Test
    void testSurvivalStartsAtOneAndDecreases() {
        for (HazardTier tier : HazardTier.values()) {
            assertEquals(1.0, model.survival(tier, 0), "survival(0) = 1 for " + tier);
            double previous = 1.0;
            for (int t = 1; t <= 7; t++) {
                double s = model.survival(tier, t);
                assertTrue(s < previous, tier + " must decrease at t=" + t);
                previous = s;
            }
        }
    }

    @Test
    void testClaimProbability() {
        assertEquals(1.0 - Math.exp(-0.45 * 2), model.claimProbability(HazardTier.ELITE, 2), 1e-12);
        assertEquals(0.0, model.claimProbability(HazardTier.ELITE, -3));
    }

    @Test
    void testLeagueActivityScalesIntensity() {
        SurvivalModel active = new SurvivalModel(1.5);

        assertEquals(0.45 * 1.5, active.intensity(HazardTier.ELITE), 1e-12);
        assertTrue(active.survival(HazardTier.LOW, 3) < model.survival(HazardTier.LOW, 3));
        assertThrows(IllegalArgumentException.class, () -> new SurvivalModel(0.0));
    }

    @Test
    void testSnipeAdjustedValue() {
        double s = model.survival(HazardTier.HIGH, 2);

        assertEquals(s * 40.0 + (1 - s) * 15.0, model.snipeAdjustedValue(HazardTier.HIGH, 2, 40.0, 15.0), 1e-12);
        assertEquals(40.0, model.snipeAdjustedValue(HazardTier.HIGH, 0, 40.0, 15.0), 1e-12);
    }
}
