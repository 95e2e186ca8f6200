package in.addwise.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Today's advice: what to act on now, how urgent everything is, and what to
 * fall back to if a target is sniped.
 */
public record DailyRecommendation(
    int day,
    OptimizationResult plan,
    List<ActNowDecision> mustActToday,
    List<ActNowDecision> deferred,
    List<UrgencyEntry> urgencyRanking,
    Map<String, Contingency> contingencies,
    double acceptanceThreshold,
    double optionValue,
    List<EngineWarning> warnings
) {
    public DailyRecommendation {
        mustActToday = List.copyOf(mustActToday);
        deferred = List.copyOf(deferred);
        urgencyRanking = List.copyOf(urgencyRanking);
        contingencies = Map.copyOf(contingencies);
        warnings = List.copyOf(warnings);
    }

    public List<String> mustActIds() {
        return mustActToday.stream().map(ActNowDecision::candidateId).toList();
    }
}
