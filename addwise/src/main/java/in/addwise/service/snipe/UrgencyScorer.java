package in.addwise.service.snipe;

import in.addwise.domain.model.HazardTier;
import in.addwise.domain.model.ScoredCandidate;
import in.addwise.domain.model.UrgencyEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Urgency = value × hazard / max(1, days until needed).
 *
 * For ranking and display only; the optimizer never sees it.
 */
public final class UrgencyScorer {

    private static final double HIGH_CLAIM_PROBABILITY = 0.30;
    private static final double MODERATE_CLAIM_PROBABILITY = 0.15;

    private final SurvivalModel survival;

    public UrgencyScorer(SurvivalModel survival) {
        this.survival = survival;
    }

    public double score(double value, HazardTier tier, int daysUntilNeeded) {
        return value * survival.intensity(tier) / Math.max(1, daysUntilNeeded);
    }

    /**
     * Highest urgency first; ties broken by id.
     */
    public List<UrgencyEntry> rank(List<ScoredCandidate> candidates, int today) {
        List<UrgencyEntry> entries = new ArrayList<>();
        for (ScoredCandidate sc : candidates) {
            HazardTier tier = sc.candidate().hazardTier();
            int daysUntil = Math.max(0, sc.candidate().firstDay() - today);
            double claim = survival.claimProbability(tier, daysUntil);
            double urgency = score(sc.totalValue(), tier, daysUntil);
            boolean alert = tier.isAlertTier() && claim > HIGH_CLAIM_PROBABILITY;
            entries.add(new UrgencyEntry(sc.id(), urgency, claim, daysUntil, alert, reason(claim)));
        }
        entries.sort(Comparator.comparingDouble(UrgencyEntry::urgency).reversed()
            .thenComparing(UrgencyEntry::candidateId));
        return entries;
    }

    private static String reason(double claim) {
        if (claim > HIGH_CLAIM_PROBABILITY) {
            return String.format("HIGH URGENCY: %.0f%% snipe risk", claim * 100);
        }
        if (claim > MODERATE_CLAIM_PROBABILITY) {
            return String.format("MODERATE: %.0f%% snipe risk", claim * 100);
        }
        return String.format("LOW: Can wait, only %.0f%% snipe risk", claim * 100);
    }
}
