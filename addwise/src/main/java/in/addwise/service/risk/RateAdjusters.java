package in.addwise.service.risk;

import java.util.List;

/**
 * Built-in rate adjusters.
 */
public final class RateAdjusters {

    public static final double GROUND_BALL_FACTOR = 0.85;
    public static final double FLY_BALL_FACTOR = 1.15;

    /** Opponent's negative-event rate relative to league average. */
    public static RateAdjuster opponent() {
        return (rate, c) -> rate * positiveOr(c.matchup().opponentNegativeFactor(), 1.0);
    }

    /** Venue factor (1.15 = 15% more events than a neutral venue). */
    public static RateAdjuster venue() {
        return (rate, c) -> rate * positiveOr(c.matchup().venueFactor(), 1.0);
    }

    /** Ground-ball profiles suppress events, fly-ball profiles amplify them. */
    public static RateAdjuster profile() {
        return (rate, c) -> {
            if (c.profile().isGroundBall()) {
                return rate * GROUND_BALL_FACTOR;
            }
            if (c.profile().isFlyBall()) {
                return rate * FLY_BALL_FACTOR;
            }
            return rate;
        };
    }

    /**
     * opponent → venue → profile.
     */
    public static List<RateAdjuster> defaults() {
        return List.of(opponent(), venue(), profile());
    }

    private static double positiveOr(double value, double fallback) {
        return Double.isFinite(value) && value > 0 ? value : fallback;
    }

    private RateAdjusters() {}
}
