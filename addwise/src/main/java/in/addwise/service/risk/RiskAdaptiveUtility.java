package in.addwise.service.risk;

/**
 * Matchup-state risk preference.
 *
 * θ &gt; 0 is risk-averse (protect a lead), θ &lt; 0 risk-seeking (need
 * variance to catch up). Value is adjusted by -0.5·θ·σ, so a trailing
 * manager is credited for upside.
 */
public record RiskAdaptiveUtility(double scoreDifferential, int daysRemaining) {

    public static RiskAdaptiveUtility neutral() {
        return new RiskAdaptiveUtility(0.0, 7);
    }

    public static RiskAdaptiveUtility of(double myScore, double opponentScore, int daysRemaining) {
        return new RiskAdaptiveUtility(myScore - opponentScore, daysRemaining);
    }

    public double theta() {
        if (daysRemaining <= 1) {
            // Last day: extreme positions only
            if (scoreDifferential > 30) return 3.0;
            if (scoreDifferential < -30) return -3.0;
        }
        if (scoreDifferential > 30) return 2.0;
        if (scoreDifferential > 10) return 0.5;
        if (scoreDifferential > -10) return 0.0;
        if (scoreDifferential > -30) return -1.0;
        return -2.0;
    }

    public double adjust(double mean, double stdDev) {
        double theta = theta();
        if (theta == 0.0) {
            return mean;
        }
        return mean - 0.5 * theta * stdDev;
    }
}
