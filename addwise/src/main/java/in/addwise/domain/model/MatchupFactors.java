package in.addwise.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Opponent and venue adjustments for one candidate, already normalised to
 * league average (1.0 = neutral).
 */
public record MatchupFactors(
    @JsonProperty("opponent")
    String opponent,

    @JsonProperty("venue")
    String venue,

    @JsonProperty("opponentNegativeFactor")
    double opponentNegativeFactor,  // opp HR rate / league HR rate

    @JsonProperty("opponentPositiveFactor")
    double opponentPositiveFactor,  // opp K rate / league K rate

    @JsonProperty("venueFactor")
    double venueFactor,             // park HR factor / 100

    @JsonProperty("eliteOpponent")
    boolean eliteOpponent,

    @JsonProperty("hitterFriendlyVenue")
    boolean hitterFriendlyVenue
) {
    public static MatchupFactors neutral(String opponent, String venue) {
        return new MatchupFactors(opponent, venue, 1.0, 1.0, 1.0, false, false);
    }

    public boolean isDangerCombo() {
        return eliteOpponent && hitterFriendlyVenue;
    }
}
