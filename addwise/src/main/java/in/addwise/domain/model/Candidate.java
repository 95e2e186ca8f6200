package in.addwise.domain.model;

import java.util.List;
import java.util.TreeSet;

/**
 * A schedulable option competing for one budget unit within the horizon.
 * Rebuilt from the feed on every pass; never persisted.
 *
 * A candidate occupying several days is a single bundle: it costs one
 * budget unit and must reserve capacity on each of its days.
 */
public record Candidate(
    String id,
    List<Integer> occupiedDays,   // sorted, distinct
    RateStats stats,
    BattedBallProfile profile,
    MatchupFactors matchup,
    HazardTier hazardTier,
    Double priorOutcome,          // prior-period observed value, nullable
    boolean lowConfidence
) {
    public Candidate {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Candidate id is required");
        }
        if (occupiedDays == null || occupiedDays.isEmpty()) {
            throw new IllegalArgumentException("Candidate " + id + " occupies no days");
        }
        for (Integer d : occupiedDays) {
            if (d == null || d < 0) {
                throw new IllegalArgumentException("Candidate " + id + " has invalid day " + d);
            }
        }
        occupiedDays = List.copyOf(new TreeSet<>(occupiedDays));
        if (hazardTier == null) {
            hazardTier = HazardTier.MODERATE;
        }
        if (profile == null) {
            profile = BattedBallProfile.neutral();
        }
        if (matchup == null) {
            matchup = MatchupFactors.neutral(null, null);
        }
    }

    public int firstDay() {
        return occupiedDays.get(0);
    }

    public int lastDay() {
        return occupiedDays.get(occupiedDays.size() - 1);
    }

    public int dayCount() {
        return occupiedDays.size();
    }

    public boolean isMultiDay() {
        return occupiedDays.size() > 1;
    }

    public boolean occupies(int day) {
        return occupiedDays.contains(day);
    }

    /**
     * Copy restricted to days on or after {@code day}; null when nothing remains.
     */
    public Candidate remainingFrom(int day) {
        List<Integer> remaining = occupiedDays.stream().filter(d -> d >= day).toList();
        if (remaining.isEmpty()) {
            return null;
        }
        if (remaining.size() == occupiedDays.size()) {
            return this;
        }
        return new Candidate(id, remaining, stats, profile, matchup, hazardTier, priorOutcome, lowConfidence);
    }

    public Candidate withStats(RateStats newStats, boolean markLowConfidence) {
        return new Candidate(id, occupiedDays, newStats, profile, matchup, hazardTier, priorOutcome,
            lowConfidence || markLowConfidence);
    }
}
