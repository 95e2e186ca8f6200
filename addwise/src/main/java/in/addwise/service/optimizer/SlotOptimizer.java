package in.addwise.service.optimizer;

import in.addwise.config.EngineConfig;
import in.addwise.domain.model.OptimizationResult;
import in.addwise.domain.model.ScoredCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exact Slot Optimizer.
 *
 * One binary variable per candidate. A multi-day candidate is a bundle:
 * it costs one budget unit, needs a slot on each of its days and is worth
 * per-day value × days. Subject to:
 *   Σ x_i &lt;= usable budget
 *   Σ x_i over candidates on day d &lt;= capacity[d]   for every day d
 * Maximise Σ round(value_i × scale) · x_i.
 *
 * NO_GO candidates and candidates with days outside [currentDay, horizon)
 * are excluded before solving and listed as infeasible.
 */
public final class SlotOptimizer {
    private static final Logger log = LoggerFactory.getLogger(SlotOptimizer.class);

    private static final Comparator<ScoredCandidate> BY_VALUE_DESC =
        Comparator.comparingDouble(ScoredCandidate::totalValue).reversed()
            .thenComparing(ScoredCandidate::id);

    private final SlotSolver solver;
    private final int valueScale;
    private final int backupCount;

    public SlotOptimizer(EngineConfig config, SlotSolver solver) {
        this(solver, config.valueScale(), config.backupCount());
    }

    public SlotOptimizer(SlotSolver solver, int valueScale, int backupCount) {
        if (valueScale < 1 || backupCount < 0) {
            throw new IllegalArgumentException("Invalid optimizer settings: scale=" + valueScale + ", backups=" + backupCount);
        }
        this.solver = solver;
        this.valueScale = valueScale;
        this.backupCount = backupCount;
    }

    /**
     * @param candidates   scored candidates (any order)
     * @param usableBudget units the plan may spend
     * @param capacity     free slots per day, indexed 0..horizon-1
     * @param currentDay   first day still open
     */
    public OptimizationResult optimize(List<ScoredCandidate> candidates, int usableBudget, int[] capacity, int currentDay) {
        if (usableBudget < 0) {
            throw new IllegalArgumentException("Usable budget must be non-negative: " + usableBudget);
        }
        long start = System.nanoTime();

        List<String> infeasible = new ArrayList<>();
        List<ScoredCandidate> feasible = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        // Sorted by id so input order never changes the result
        List<ScoredCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparing(ScoredCandidate::id));

        for (ScoredCandidate sc : ordered) {
            if (!seen.add(sc.id())) {
                log.warn("[OPTIMIZER] Duplicate candidate {} ignored", sc.id());
                continue;
            }
            if (!sc.isSelectable()) {
                log.debug("[OPTIMIZER] {} excluded: NO_GO", sc.id());
                infeasible.add(sc.id());
                continue;
            }
            if (sc.candidate().firstDay() < currentDay || sc.candidate().lastDay() >= capacity.length) {
                log.debug("[OPTIMIZER] {} excluded: days {} outside {}..{}", sc.id(),
                    sc.candidate().occupiedDays(), currentDay, capacity.length - 1);
                infeasible.add(sc.id());
                continue;
            }
            feasible.add(sc);
        }

        if (feasible.isEmpty()) {
            log.info("[OPTIMIZER] No feasible candidates ({} excluded)", infeasible.size());
            return OptimizationResult.empty(solver.name(), infeasible);
        }

        SlotProblem problem = toProblem(feasible, usableBudget, capacity);
        SlotSolution solution = solver.solve(problem);

        List<ScoredCandidate> selected = new ArrayList<>();
        List<ScoredCandidate> rest = new ArrayList<>();
        for (int i = 0; i < feasible.size(); i++) {
            (solution.isChosen(i) ? selected : rest).add(feasible.get(i));
        }
        selected.sort(Comparator.comparingInt((ScoredCandidate s) -> s.candidate().firstDay())
            .thenComparing(ScoredCandidate::id));

        Map<String, Integer> commitDays = new LinkedHashMap<>();
        double total = 0.0;
        for (ScoredCandidate s : selected) {
            commitDays.put(s.id(), commitDay(s, currentDay));
            total += s.totalValue();
        }

        rest.sort(BY_VALUE_DESC);
        List<ScoredCandidate> backups = rest.subList(0, Math.min(backupCount, rest.size()));

        Duration latency = Duration.ofNanos(System.nanoTime() - start);
        OptimizationResult result = new OptimizationResult(
            selected, total, solution.objective(), commitDays, backups, infeasible,
            solution.optimal(), solver.name(), latency);

        log.info("[OPTIMIZER] {} of {} feasible selected, value={}, optimal={}, budget={}, {}ms",
            selected.size(), feasible.size(), String.format("%.1f", total), solution.optimal(),
            usableBudget, latency.toMillis());
        return result;
    }

    /**
     * Day before the first occupied day, never before today.
     */
    public static int commitDay(ScoredCandidate candidate, int currentDay) {
        return Math.max(currentDay, Math.max(0, candidate.candidate().firstDay() - 1));
    }

    public long scale(double value) {
        return Math.round(value * valueScale);
    }

    private SlotProblem toProblem(List<ScoredCandidate> feasible, int budget, int[] capacity) {
        long[] values = new long[feasible.size()];
        int[][] days = new int[feasible.size()][];
        for (int i = 0; i < feasible.size(); i++) {
            ScoredCandidate sc = feasible.get(i);
            values[i] = scale(sc.totalValue());
            days[i] = sc.candidate().occupiedDays().stream().mapToInt(Integer::intValue).toArray();
        }
        int[] free = new int[capacity.length];
        for (int d = 0; d < capacity.length; d++) {
            free[d] = Math.max(0, capacity[d]);
        }
        return new SlotProblem(values, days, budget, free);
    }

    public SlotSolver solver() {
        return solver;
    }
}
