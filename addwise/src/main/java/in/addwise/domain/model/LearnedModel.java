package in.addwise.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Everything the engine learns across horizons. Owned by the caller: passed
 * into the engine at construction and handed back for persistence.
 *
 * Unknown fields are ignored so snapshots written by a later season's build
 * still load.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LearnedModel(
    @JsonProperty("version")
    int version,

    @JsonProperty("bandit")
    BanditState bandit,

    @JsonProperty("posteriors")
    Map<String, PosteriorBelief> posteriors,

    @JsonProperty("valueHistory")
    List<Double> valueHistory,

    @JsonProperty("savedAtEpochMs")
    long savedAtEpochMs
) {
    public static final int CURRENT_VERSION = 1;

    public LearnedModel {
        posteriors = posteriors == null ? Map.of() : Map.copyOf(posteriors);
        valueHistory = valueHistory == null ? List.of() : List.copyOf(valueHistory);
    }

    public static LearnedModel fresh(BanditState prior) {
        return new LearnedModel(CURRENT_VERSION, prior, Map.of(), List.of(), 0L);
    }

    public LearnedModel stamped(long epochMs) {
        return new LearnedModel(version, bandit, posteriors, valueHistory, epochMs);
    }
}
