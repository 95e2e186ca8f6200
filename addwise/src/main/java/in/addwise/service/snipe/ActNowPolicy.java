package in.addwise.service.snipe;

import in.addwise.domain.model.ActNowDecision;
import in.addwise.domain.model.HazardTier;
import in.addwise.domain.model.ScoredCandidate;

/**
 * Optimal-stopping rule for a planned pick.
 *
 * Act now iff the expected loss from a competitor claiming the option
 * before it is needed exceeds the option value of keeping the unit. A pick
 * whose commit day has arrived is forced.
 */
public final class ActNowPolicy {

    private final SurvivalModel survival;

    public ActNowPolicy(SurvivalModel survival) {
        this.survival = survival;
    }

    /**
     * Expected loss uses the value of every occupied day; the threshold is
     * compared with the per-day value, the unit realised outcomes are
     * recorded in.
     */
    public ActNowDecision decide(ScoredCandidate pick, int today, int commitDay, double optionValue, double threshold) {
        ActNowDecision d = decide(pick.id(), pick.candidate().hazardTier(), pick.totalValue(),
            today, commitDay, optionValue, threshold);
        return new ActNowDecision(d.candidateId(), d.actNow(), d.forced(), d.value(), d.expectedLossFromWaiting(),
            d.optionValueOfWaiting(), pick.perDayValue() >= threshold, d.reason());
    }

    /**
     * @param value        value of the pick (all occupied days)
     * @param today        current day
     * @param commitDay    latest sensible commit day from the optimizer
     * @param optionValue  option value of waiting
     * @param threshold    acceptance threshold (reported, not gating)
     */
    public ActNowDecision decide(String candidateId, HazardTier tier, double value,
                                 int today, int commitDay, double optionValue, double threshold) {
        int daysUntilNeeded = Math.max(0, commitDay - today);
        boolean clears = value >= threshold;
        double expectedLoss = survival.claimProbability(tier, daysUntilNeeded) * value;

        if (daysUntilNeeded == 0) {
            return new ActNowDecision(candidateId, true, true, value, expectedLoss, optionValue, clears,
                String.format("ADD NOW: %s must be added today", candidateId));
        }

        boolean actNow = expectedLoss > optionValue;
        String reason = actNow
            ? String.format("ADD NOW: %s has %.0f%% snipe risk over %d days. Expected loss %.1f pts > option value %.1f pts",
                candidateId, survival.claimProbability(tier, daysUntilNeeded) * 100, daysUntilNeeded,
                expectedLoss, optionValue)
            : String.format("WAIT: %s expected loss %.1f pts <= option value %.1f pts. Safe to add on day %d",
                candidateId, expectedLoss, optionValue, commitDay);
        return new ActNowDecision(candidateId, actNow, false, value, expectedLoss, optionValue, clears, reason);
    }
}
