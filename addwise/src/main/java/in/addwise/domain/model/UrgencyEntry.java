package in.addwise.domain.model;

/**
 * One row of the urgency ranking. Display and ranking only; never an
 * optimizer constraint.
 */
public record UrgencyEntry(
    String candidateId,
    double urgency,
    double claimProbability,    // 1 - survival until needed
    int daysUntilNeeded,
    boolean snipeAlert,
    String reason) {
}
