package in.addwise.service.snipe;

/**
 * Newsvendor-style reserve sizing.
 *
 * Critical fractile Cu/(Cu+Co): missing an emergency activation (Cu) costs
 * more than wasting a unit (Co). The emergency probability grows with the
 * number of injured and day-to-day roster members.
 */
public final class ReserveAdvisor {

    public static final double DEFAULT_COST_UNDERAGE = 15.0;
    public static final double DEFAULT_COST_OVERAGE = 5.0;
    public static final double DEFAULT_EMERGENCY_RATE = 0.3;

    private static final double PER_INJURED = 0.15;
    private static final double PER_DAY_TO_DAY = 0.20;
    private static final double MAX_EMERGENCY_PROBABILITY = 0.9;

    private final double costUnderage;
    private final double costOverage;
    private final double emergencyRate;

    public ReserveAdvisor() {
        this(DEFAULT_COST_UNDERAGE, DEFAULT_COST_OVERAGE, DEFAULT_EMERGENCY_RATE);
    }

    public ReserveAdvisor(double costUnderage, double costOverage, double emergencyRate) {
        if (costUnderage <= 0 || costOverage <= 0) {
            throw new IllegalArgumentException("Costs must be positive");
        }
        this.costUnderage = costUnderage;
        this.costOverage = costOverage;
        this.emergencyRate = emergencyRate;
    }

    public double criticalFractile() {
        return costUnderage / (costUnderage + costOverage);
    }

    public double emergencyProbability(int injured, int dayToDay) {
        double p = emergencyRate + Math.max(0, injured) * PER_INJURED + Math.max(0, dayToDay) * PER_DAY_TO_DAY;
        return Math.min(MAX_EMERGENCY_PROBABILITY, p);
    }

    /**
     * Units to hold back: 0, 1 or 2.
     */
    public int optimalReserve(int injured, int dayToDay) {
        double p = emergencyProbability(injured, dayToDay);
        if (p < 0.3) {
            return 0;
        }
        if (p < 0.6) {
            return 1;
        }
        return 2;
    }
}
