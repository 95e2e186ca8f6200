package in.addwise.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Baseline per-candidate rate statistics, expressed per nine units of
 * duration (per 9 innings).
 */
public record RateStats(
    @JsonProperty("negativePer9")
    double negativePer9,        // catastrophic events (HR/9)

    @JsonProperty("positivePer9")
    double positivePer9,        // positive events (K/9)

    @JsonProperty("walkPer9")
    double walkPer9,

    @JsonProperty("hitPer9")
    double hitPer9,

    @JsonProperty("durationPerOccurrence")
    double durationPerOccurrence, // expected innings per occupied day

    @JsonProperty("sampleSize")
    int sampleSize               // track record (starts)
) {
    /**
     * Conservative league-average stats, substituted for missing data.
     */
    public static RateStats leagueAverage() {
        return new RateStats(1.2, 8.5, 3.0, 8.5, 5.5, 0);
    }

    /**
     * True when every required field carries a usable value.
     */
    public boolean isComplete() {
        return isUsable(negativePer9) && isUsable(positivePer9) && isUsable(walkPer9)
            && isUsable(hitPer9) && isUsable(durationPerOccurrence) && durationPerOccurrence > 0;
    }

    /**
     * Replace unusable fields with the league-average value for that field.
     */
    public RateStats fillMissing() {
        RateStats avg = leagueAverage();
        return new RateStats(
            isUsable(negativePer9) ? negativePer9 : avg.negativePer9,
            isUsable(positivePer9) ? positivePer9 : avg.positivePer9,
            isUsable(walkPer9) ? walkPer9 : avg.walkPer9,
            isUsable(hitPer9) ? hitPer9 : avg.hitPer9,
            isUsable(durationPerOccurrence) && durationPerOccurrence > 0
                ? durationPerOccurrence : avg.durationPerOccurrence,
            Math.max(0, sampleSize)
        );
    }

    private static boolean isUsable(double v) {
        return Double.isFinite(v) && v >= 0;
    }
}
