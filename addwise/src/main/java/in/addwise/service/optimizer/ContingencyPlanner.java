package in.addwise.service.optimizer;

import in.addwise.domain.model.Contingency;
import in.addwise.domain.model.OptimizationResult;
import in.addwise.domain.model.ScoredCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pre-computes fallback plans for the planned picks most likely to be
 * sniped: each scenario re-solves the same problem without that pick.
 */
public final class ContingencyPlanner {
    private static final Logger log = LoggerFactory.getLogger(ContingencyPlanner.class);

    private final SlotOptimizer optimizer;
    private final int scenarioCount;

    public ContingencyPlanner(SlotOptimizer optimizer, int scenarioCount) {
        this.optimizer = optimizer;
        this.scenarioCount = scenarioCount;
    }

    /**
     * @return sniped id → contingency, riskiest pick first
     */
    public Map<String, Contingency> plan(OptimizationResult primary, List<ScoredCandidate> pool,
                                         int usableBudget, int[] capacity, int currentDay) {
        List<ScoredCandidate> risky = new ArrayList<>(primary.selected());
        // Enum order is highest claim intensity first
        risky.sort(Comparator.comparing((ScoredCandidate s) -> s.candidate().hazardTier())
            .thenComparing(ScoredCandidate::id));

        Map<String, Contingency> contingencies = new LinkedHashMap<>();
        for (ScoredCandidate sniped : risky.subList(0, Math.min(scenarioCount, risky.size()))) {
            List<ScoredCandidate> remaining = pool.stream()
                .filter(c -> !c.id().equals(sniped.id()))
                .toList();
            OptimizationResult fallback = optimizer.optimize(remaining, usableBudget, capacity, currentDay);

            List<String> replacements = fallback.selected().stream()
                .map(ScoredCandidate::id)
                .filter(id -> !primary.isSelected(id))
                .toList();
            double lost = primary.totalValue() - fallback.totalValue();
            contingencies.put(sniped.id(), new Contingency(sniped.id(), replacements, lost, fallback));

            log.debug("[CONTINGENCY] If {} is sniped: replace with {} (lose {})",
                sniped.id(), replacements, String.format("%.1f", lost));
        }
        return contingencies;
    }
}
