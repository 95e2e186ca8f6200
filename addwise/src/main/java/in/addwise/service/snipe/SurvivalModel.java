package in.addwise.service.snipe;

import in.addwise.domain.model.HazardTier;

/**
 * Competitor claims as a constant-hazard survival process.
 *
 * P(still available after t days) = e^(-λt), λ = tier intensity × league activity.
 */
public final class SurvivalModel {

    private final double leagueActivity;

    public SurvivalModel(double leagueActivity) {
        if (!(leagueActivity > 0) || !Double.isFinite(leagueActivity)) {
            throw new IllegalArgumentException("League activity must be positive: " + leagueActivity);
        }
        this.leagueActivity = leagueActivity;
    }

    public double intensity(HazardTier tier) {
        return tier.dailyIntensity() * leagueActivity;
    }

    /**
     * survival(0) = 1; negative days are treated as 0.
     */
    public double survival(HazardTier tier, int days) {
        if (days <= 0) {
            return 1.0;
        }
        return Math.exp(-intensity(tier) * days);
    }

    public double claimProbability(HazardTier tier, int days) {
        return 1.0 - survival(tier, days);
    }

    /**
     * EV of deferring: P(available)·value + P(sniped)·backup value.
     */
    public double snipeAdjustedValue(HazardTier tier, int days, double value, double backupValue) {
        double available = survival(tier, days);
        return available * value + (1.0 - available) * backupValue;
    }

    public double leagueActivity() {
        return leagueActivity;
    }
}
