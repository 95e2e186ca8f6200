package in.addwise.domain.model;

import java.util.List;

/**
 * An accepted pick. Fixed forward: the optimizer never reconsiders it and
 * treats its budget unit and capacity as pre-consumed.
 */
public record CommittedPick(
    String candidateId,
    int commitDay,
    List<Integer> occupiedDays,
    boolean locked,
    double perDayValue,
    boolean override        // committed despite a NO_GO assessment
) {
    public CommittedPick {
        occupiedDays = List.copyOf(occupiedDays);
    }

    public boolean occupies(int day) {
        return occupiedDays.contains(day);
    }

    public int lastDay() {
        return occupiedDays.stream().mapToInt(Integer::intValue).max().orElse(commitDay);
    }

    /**
     * Completed once every occupied day is before {@code day}.
     */
    public boolean isCompleteBefore(int day) {
        return lastDay() < day;
    }

    public HistoricalPick toHistory(int completedOnDay) {
        return new HistoricalPick(candidateId, commitDay, occupiedDays, perDayValue, completedOnDay);
    }
}
