package in.addwise.domain.model;

import java.util.List;

/**
 * A committed pick whose last occupied day has passed.
 */
public record HistoricalPick(
    String candidateId,
    int commitDay,
    List<Integer> occupiedDays,
    double perDayValue,
    int completedOnDay) {
}
