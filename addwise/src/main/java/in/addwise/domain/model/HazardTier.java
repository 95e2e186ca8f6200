package in.addwise.domain.model;

/**
 * Snipe hazard tiers, ordered from most to least desirable.
 *
 * Each tier carries a constant daily claim intensity (λ) for the
 * exponential survival model: P(still available after t days) = e^(−λt).
 */
public enum HazardTier {
    ELITE(0.45),    // top adds, ~36% claimed per day
    HIGH(0.28),
    MODERATE(0.15),
    LOW(0.08),
    MINIMAL(0.03);  // deep streamers

    private final double dailyIntensity;

    HazardTier(double dailyIntensity) {
        this.dailyIntensity = dailyIntensity;
    }

    public double dailyIntensity() {
        return dailyIntensity;
    }

    /**
     * High-profile tiers that get flagged as snipe alerts.
     */
    public boolean isAlertTier() {
        return this == ELITE || this == HIGH;
    }
}
