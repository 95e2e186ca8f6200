package in.addwise.service.bandit;

import in.addwise.TestCandidates;
import in.addwise.config.EngineConfig;
import in.addwise.domain.model.Candidate;
import in.addwise.domain.model.HazardTier;
import in.addwise.domain.model.MatchupFactors;
import in.addwise.domain.model.RiskAssessment;
import in.addwise.service.risk.RiskCalculator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextFeaturesTest {

    private final RiskCalculator risk = new RiskCalculator(EngineConfig.defaults());

    @Test
    void testVectorShape() {
        Candidate c = TestCandidates.candidate("a", 1.0, 2);

        double[] x = ContextFeatures.of(c, risk.assess(c));

        assertEquals(ContextFeatures.DIMENSION, x.length);
        assertEquals(ContextFeatures.DIMENSION, ContextFeatures.NAMES.length);
        assertEquals(0.0, x[10], "Single day");
    }

    @Test
    void testMatchupFlags() {
        Candidate c = new Candidate("b", List.of(1, 5), TestCandidates.stats(1.0, 5.5), null,
            new MatchupFactors("NYY", "CIN", 1.2, 1.0, 1.2, true, true), HazardTier.HIGH, null, false);

        double[] x = ContextFeatures.of(c, risk.assess(c));

        assertEquals(-1.0, x[5]);
        assertEquals(-1.0, x[9]);
        assertEquals(1.0, x[10], "Two-day bundle");
    }

    @Test
    void testMissingStatsStayFinite() {
        Candidate c = new Candidate("c", List.of(0), null, null, null, null, null, false);
        RiskAssessment assessment = risk.assess(c);

        for (double v : ContextFeatures.of(c, assessment)) {
            assertTrue(Double.isFinite(v));
        }
    }
}
