package in.addwise.domain.model;

import java.util.List;

/**
 * Backup plan for the case where a planned pick is sniped.
 */
public record Contingency(
    String snipedCandidateId,
    List<String> replacementIds,   // picks in the re-solved plan that were not in the primary plan
    double valueLost,              // primary total - fallback total
    OptimizationResult fallbackPlan
) {
    public Contingency {
        replacementIds = List.copyOf(replacementIds);
    }

    public boolean hasReplacement() {
        return !replacementIds.isEmpty();
    }
}
