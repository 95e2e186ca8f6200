package in.addwise.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Batted-ball profile used for the profile factor and the fly-ball hard filter.
 */
public record BattedBallProfile(
    @JsonProperty("groundBallRate")
    double groundBallRate,

    @JsonProperty("flyBallRate")
    double flyBallRate
) {
    private static final double GROUND_BALL_CUTOFF = 0.47;
    private static final double FLY_BALL_CUTOFF = 0.40;

    public static BattedBallProfile neutral() {
        return new BattedBallProfile(0.43, 0.35);
    }

    public boolean isGroundBall() {
        return groundBallRate >= GROUND_BALL_CUTOFF;
    }

    public boolean isFlyBall() {
        return flyBallRate >= FLY_BALL_CUTOFF;
    }
}
