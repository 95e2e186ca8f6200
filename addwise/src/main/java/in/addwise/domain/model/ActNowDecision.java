package in.addwise.domain.model;

/**
 * "Act now vs. wait" verdict for one planned pick.
 */
public record ActNowDecision(
    String candidateId,
    boolean actNow,
    boolean forced,             // commit day is today (or already passed)
    double value,
    double expectedLossFromWaiting,
    double optionValueOfWaiting,
    boolean clearsThreshold,
    String reason) {
}
