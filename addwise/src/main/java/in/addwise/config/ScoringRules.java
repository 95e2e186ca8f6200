package in.addwise.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * League point values per event. Defaults are the BLJ X pitcher scoring,
 * where a single home run (-13) wipes out more than two innings.
 */
public record ScoringRules(
    @JsonProperty("perDurationUnit")
    double perDurationUnit,     // per inning pitched

    @JsonProperty("perPositiveEvent")
    double perPositiveEvent,    // per strikeout

    @JsonProperty("perWalk")
    double perWalk,

    @JsonProperty("perNegativeEvent")
    double perNegativeEvent,    // per home run

    @JsonProperty("perHit")
    double perHit
) {
    public static ScoringRules defaults() {
        return new ScoringRules(5.0, 2.0, -3.0, -13.0, -1.0);
    }

    public boolean isValid() {
        return perDurationUnit > 0 && perNegativeEvent < 0;
    }
}
