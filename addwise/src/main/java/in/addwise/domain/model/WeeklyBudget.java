package in.addwise.domain.model;

/**
 * Consumable add budget for one horizon. Unused units are forfeited at the
 * horizon boundary; nothing carries over.
 */
public record WeeklyBudget(int total, int reserve, int remaining, int horizonDays) {

    public WeeklyBudget {
        if (total < 0 || reserve < 0 || remaining < 0) {
            throw new IllegalArgumentException(
                "Budget values must be non-negative: total=" + total + ", reserve=" + reserve + ", remaining=" + remaining);
        }
        if (remaining > total) {
            throw new IllegalArgumentException("Remaining " + remaining + " exceeds total " + total);
        }
        if (horizonDays <= 0) {
            throw new IllegalArgumentException("Horizon must be at least one day: " + horizonDays);
        }
    }

    public static WeeklyBudget fresh(int total, int reserve, int horizonDays) {
        return new WeeklyBudget(total, reserve, total, horizonDays);
    }

    /**
     * Units the optimizer may spend: remaining minus the held-back reserve.
     */
    public int usable() {
        return Math.max(0, remaining - reserve);
    }

    public int used() {
        return total - remaining;
    }

    public boolean isExhausted() {
        return remaining == 0;
    }

    /**
     * One unit spent. Throws rather than go negative.
     */
    public WeeklyBudget consume() {
        if (remaining == 0) {
            throw new IllegalStateException("Budget exhausted (" + total + " of " + total + " used)");
        }
        return new WeeklyBudget(total, reserve, remaining - 1, horizonDays);
    }
}
