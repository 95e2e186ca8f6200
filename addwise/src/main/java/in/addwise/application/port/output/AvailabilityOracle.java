package in.addwise.application.port.output;

/**
 * Live check that a candidate can still be claimed. Consulted only for
 * must-act-today picks, right before they are recommended.
 */
public interface AvailabilityOracle {
    /**
     * @param candidateId candidate to check
     * @return false when a competitor has already claimed it
     */
    boolean isAvailable(String candidateId);
}
