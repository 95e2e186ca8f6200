package in.addwise.service.snipe;

import in.addwise.TestCandidates;
import in.addwise.domain.model.ActNowDecision;
import in.addwise.domain.model.HazardTier;
import in.addwise.domain.model.RiskTier;
import in.addwise.domain.model.ScoredCandidate;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ActNowPolicyTest {

    private final SurvivalModel survival = new SurvivalModel(1.0);
    private final ActNowPolicy policy = new ActNowPolicy(survival);

    @Test
    void testCommitDayReachedIsForced() {
        ActNowDecision d = policy.decide("a", HazardTier.MINIMAL, 30.0, 3, 3, 100.0, 40.0);

        assertTrue(d.actNow());
        assertTrue(d.forced());
        assertTrue(d.reason().startsWith("ADD NOW:"));
    }

    @Test
    void testActWhenExpectedLossExceedsOptionValue() {
        // ELITE over 3 days: claim ≈ 0.74, loss ≈ 37
        ActNowDecision d = policy.decide("hot", HazardTier.ELITE, 50.0, 0, 3, 20.0, 40.0);

        assertTrue(d.actNow());
        assertFalse(d.forced());
        assertEquals(survival.claimProbability(HazardTier.ELITE, 3) * 50.0, d.expectedLossFromWaiting(), 1e-12);
        assertTrue(d.clearsThreshold());
    }

    @Test
    void testWaitWhenOptionValueDominates() {
        // MINIMAL over 2 days: claim ≈ 0.058, loss ≈ 1.7
        ActNowDecision d = policy.decide("cold", HazardTier.MINIMAL, 30.0, 0, 2, 10.0, 40.0);

        assertFalse(d.actNow());
        assertFalse(d.clearsThreshold());
        assertTrue(d.reason().startsWith("WAIT:"));
    }

    @Test
    void testScoredPickUsesPerDayValueForThreshold() {
        ScoredCandidate twoDay = ScoredCandidate.of(TestCandidates.candidate("two", HazardTier.LOW, 2, 5),
            30.0, RiskTier.SAFE);

        ActNowDecision d = policy.decide(twoDay, 0, 1, 0.0, 40.0);

        assertEquals(60.0, d.value(), 1e-12, "Loss is taken over both days");
        assertFalse(d.clearsThreshold(), "30 per day is below 40");
    }
}
