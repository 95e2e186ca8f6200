package in.addwise.application.port.output;

import in.addwise.domain.model.Candidate;

import java.util.List;

/**
 * Source of the current candidate pool. Implementations fetch schedules and
 * stats from outside; the engine only reads.
 */
public interface CandidateFeed {
    /**
     * Candidates that still occupy at least one day from {@code currentDay} on.
     *
     * @param currentDay day index within the horizon (0-based)
     * @return candidates, possibly with missing stats; never null
     */
    List<Candidate> fetchCandidates(int currentDay);
}
