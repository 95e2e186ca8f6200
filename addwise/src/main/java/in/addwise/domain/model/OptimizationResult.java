package in.addwise.domain.model;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one slot optimisation pass.
 *
 * {@code solveLatency} is diagnostic only and is left out of equality, so two
 * passes over identical inputs compare equal.
 */
public record OptimizationResult(
    List<ScoredCandidate> selected,
    double totalValue,
    long scaledObjective,
    Map<String, Integer> commitDays,   // candidate id -> suggested commit day
    List<ScoredCandidate> backups,     // best unselected first
    List<String> infeasible,           // excluded before solving (NO_GO, outside horizon)
    boolean optimal,
    String solver,
    Duration solveLatency
) {
    public OptimizationResult {
        selected = List.copyOf(selected);
        commitDays = Map.copyOf(commitDays);
        backups = List.copyOf(backups);
        infeasible = List.copyOf(infeasible);
    }

    public static OptimizationResult empty(String solver, List<String> infeasible) {
        return new OptimizationResult(List.of(), 0.0, 0L, Map.of(), List.of(), infeasible, true, solver, Duration.ZERO);
    }

    public int selectedCount() {
        return selected.size();
    }

    public boolean isSelected(String candidateId) {
        return selected.stream().anyMatch(s -> s.id().equals(candidateId));
    }

    public int occupancyOn(int day) {
        return (int) selected.stream().filter(s -> s.candidate().occupies(day)).count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OptimizationResult that)) return false;
        return Double.compare(totalValue, that.totalValue) == 0
            && scaledObjective == that.scaledObjective
            && optimal == that.optimal
            && selected.equals(that.selected)
            && commitDays.equals(that.commitDays)
            && backups.equals(that.backups)
            && infeasible.equals(that.infeasible)
            && Objects.equals(solver, that.solver);
    }

    @Override
    public int hashCode() {
        return Objects.hash(selected, totalValue, scaledObjective, commitDays, backups, infeasible, optimal, solver);
    }

    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Total=%.1f, picks=%d, optimal=%s, solver=%s, %dms",
            totalValue, selected.size(), optimal, solver, solveLatency.toMillis()));
        for (ScoredCandidate s : selected) {
            sb.append(String.format("%n  %s: commit day %d -> days %s (%.1f)",
                s.id(), commitDays.getOrDefault(s.id(), 0), s.candidate().occupiedDays(), s.totalValue()));
        }
        return sb.toString();
    }
}
