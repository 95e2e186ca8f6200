package in.addwise.application.port.output;

import in.addwise.config.EngineConfig;
import in.addwise.domain.model.WeeklyBudget;

/**
 * Budget settings for one horizon.
 */
public record BudgetConfig(int total, int reserve, int horizonDays) {

    public BudgetConfig {
        if (total < 0 || reserve < 0 || reserve > total) {
            throw new IllegalArgumentException("Invalid budget: total=" + total + ", reserve=" + reserve);
        }
        if (horizonDays <= 0) {
            throw new IllegalArgumentException("Horizon must be at least one day: " + horizonDays);
        }
    }

    public static BudgetConfig from(EngineConfig config) {
        return new BudgetConfig(config.weeklyBudget(), config.reserve(), config.horizonDays());
    }

    public BudgetConfig withReserve(int newReserve) {
        return new BudgetConfig(total, Math.min(total, newReserve), horizonDays);
    }

    public WeeklyBudget toBudget() {
        return WeeklyBudget.fresh(total, reserve, horizonDays);
    }
}
