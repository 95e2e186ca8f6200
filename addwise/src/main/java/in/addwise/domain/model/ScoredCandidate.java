package in.addwise.domain.model;

/**
 * A candidate with its finalised per-day value, ready for the optimizer.
 *
 * The objective credits {@code perDayValue} once for every day the candidate
 * occupies, so a two-day bundle at 40/day is worth 80.
 */
public record ScoredCandidate(
    Candidate candidate,
    double perDayValue,
    RiskTier riskTier,
    RiskAssessment assessment,   // nullable when scored outside the risk calculator
    UcbScore ucb
) {
    public ScoredCandidate {
        if (candidate == null) {
            throw new IllegalArgumentException("candidate is required");
        }
        if (riskTier == null) {
            riskTier = assessment != null ? assessment.riskTier() : RiskTier.MODERATE;
        }
        if (ucb == null) {
            ucb = UcbScore.none();
        }
    }

    public static ScoredCandidate of(Candidate candidate, double perDayValue, RiskTier tier) {
        return new ScoredCandidate(candidate, perDayValue, tier, null, UcbScore.none());
    }

    public String id() {
        return candidate.id();
    }

    public double totalValue() {
        return perDayValue * candidate.dayCount();
    }

    public boolean isSelectable() {
        return riskTier.isSelectable();
    }

    public ScoredCandidate restrictedTo(Candidate trimmed) {
        return new ScoredCandidate(trimmed, perDayValue, riskTier, assessment, ucb);
    }
}
