package in.addwise.service.bandit;

import in.addwise.domain.model.Candidate;
import in.addwise.domain.model.RateStats;
import in.addwise.domain.model.RiskAssessment;

/**
 * 13-feature context vector for the shared LinUCB model.
 *
 * Every feature is centred on a league-average value and scaled to roughly
 * unit range, oriented so that larger is better.
 */
public final class ContextFeatures {

    public static final int DIMENSION = 13;

    public static final String[] NAMES = {
        "projectedValue",
        "positiveRate",
        "walkRate",
        "negativeRate",
        "groundBallRate",
        "eliteOpponent",
        "opponentPositiveRate",
        "opponentNegativeRate",
        "venue",
        "hitterFriendlyVenue",
        "multiDay",
        "sampleConfidence",
        "disasterMargin"
    };

    private static final double LEAGUE_OPP_POSITIVE_RATE = 0.22;   // K/PA
    private static final double LEAGUE_OPP_NEGATIVE_RATE = 0.027;  // HR/PA

    public static double[] of(Candidate candidate, RiskAssessment assessment) {
        RateStats s = candidate.stats() != null && candidate.stats().isComplete()
            ? candidate.stats()
            : (candidate.stats() == null ? RateStats.leagueAverage() : candidate.stats().fillMissing());

        double[] x = new double[DIMENSION];
        x[0] = (assessment.expectedValue() - 15.0) / 10.0;
        x[1] = (s.positivePer9() - 7.0) / 3.0;
        x[2] = (3.5 - s.walkPer9()) / 1.5;
        x[3] = (1.3 - s.negativePer9()) / 0.5;
        x[4] = (candidate.profile().groundBallRate() - 0.40) / 0.15;
        x[5] = candidate.matchup().eliteOpponent() ? -1.0 : 0.0;
        x[6] = (LEAGUE_OPP_POSITIVE_RATE * candidate.matchup().opponentPositiveFactor() - 0.20) / 0.05;
        x[7] = (0.030 - LEAGUE_OPP_NEGATIVE_RATE * candidate.matchup().opponentNegativeFactor()) / 0.010;
        x[8] = (1.0 - candidate.matchup().venueFactor()) / 0.20;
        x[9] = candidate.matchup().hitterFriendlyVenue() ? -1.0 : 0.0;
        x[10] = candidate.isMultiDay() ? 1.0 : 0.0;
        x[11] = Math.min(1.0, s.sampleSize() / 10.0);
        x[12] = (0.10 - assessment.disasterProbability()) / 0.10;

        for (int i = 0; i < DIMENSION; i++) {
            if (!Double.isFinite(x[i])) {
                x[i] = 0.0;
            }
        }
        return x;
    }

    private ContextFeatures() {}
}
