package in.addwise.domain.model;

import java.util.List;

/**
 * Complete risk assessment for one occupied period of a candidate.
 * Recomputed from current inputs every time; never cached.
 */
public record RiskAssessment(
    String candidateId,

    // Rates
    double adjustedNegativeRate,  // per 9, after adjusters + clamp
    double expectedNegativeEvents, // Poisson λ for one period

    // Value distribution (per occupied period)
    double expectedValue,
    double floorValue,
    double ceilingValue,
    double variance,

    // Risk metrics
    double disasterProbability,   // P(negative events >= threshold)
    double blowupProbability,     // P(value < 0)
    double riskScore,             // 0-100, higher = riskier
    double riskAdjustedValue,

    // Classification
    RiskTier riskTier,
    boolean hardFiltered,
    boolean lowConfidence,

    // Decision support
    String recommendation,
    List<String> warnings
) {
    public RiskAssessment {
        warnings = List.copyOf(warnings);
    }

    public double stdDev() {
        return Math.sqrt(variance);
    }

    public String getSummary() {
        return String.format("%s: EV=%.1f [%.1f to %.1f] Disaster=%.1f%% | %s",
            candidateId, expectedValue, floorValue, ceilingValue,
            disasterProbability * 100, riskTier);
    }
}
