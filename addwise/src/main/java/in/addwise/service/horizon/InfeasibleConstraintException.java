package in.addwise.service.horizon;

/**
 * Thrown when existing commitments no longer fit the budget or the per-day
 * capacity. Not recoverable by re-solving: a human has to intervene.
 */
public class InfeasibleConstraintException extends RuntimeException {
    private final int day;

    public InfeasibleConstraintException(int day, String message) {
        super(String.format("[day %d] %s", day, message));
        this.day = day;
    }

    public int getDay() {
        return day;
    }
}
