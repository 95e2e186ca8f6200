package in.addwise.domain.model;

/**
 * Recoverable conditions surfaced to the caller instead of thrown.
 */
public enum WarningType {
    MISSING_DATA,        // stats replaced by league averages
    STALE_AVAILABILITY,  // claimed by a competitor before commit
    SOLVER_TIMEOUT,      // best feasible returned, not proven optimal
    NO_GO_OVERRIDE,      // hard-filtered candidate committed deliberately
    HARD_FILTERED        // candidate excluded as NO_GO
}
