package in.addwise.domain.model;

/**
 * Renewable slot ceiling for one day of the horizon.
 */
public record DailyCapacity(int day, int slots, int consumed) {

    public DailyCapacity {
        if (slots < 0) {
            throw new IllegalArgumentException("Day " + day + " slots must be non-negative: " + slots);
        }
    }

    /**
     * Free slots. Negative means existing commitments already overrun the day.
     */
    public int available() {
        return slots - consumed;
    }

    public boolean isOverrun() {
        return consumed > slots;
    }

    public DailyCapacity reserve(int count) {
        return new DailyCapacity(day, slots, consumed + count);
    }
}
