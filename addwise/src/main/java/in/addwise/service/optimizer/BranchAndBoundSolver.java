package in.addwise.service.optimizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.Comparator;
import java.util.function.LongSupplier;

/**
 * Depth-first branch-and-bound over items sorted by value.
 *
 * Bound at depth i with r units left: current value plus the r best
 * remaining values (a prefix sum, since items are sorted). Capacity is
 * ignored in the bound, which keeps it admissible. A greedy pass seeds the
 * incumbent so a timeout still has something feasible to return.
 */
public final class BranchAndBoundSolver implements SlotSolver {
    private static final Logger log = LoggerFactory.getLogger(BranchAndBoundSolver.class);

    public static final String NAME = "branch-and-bound";

    private static final int CLOCK_CHECK_INTERVAL = 1024;

    private final long timeLimitNanos;
    private final LongSupplier nanoClock;

    public BranchAndBoundSolver(Duration timeLimit) {
        this(timeLimit, System::nanoTime);
    }

    public BranchAndBoundSolver(Duration timeLimit, LongSupplier nanoClock) {
        if (timeLimit == null || timeLimit.isNegative() || timeLimit.isZero()) {
            throw new IllegalArgumentException("Time limit must be positive: " + timeLimit);
        }
        this.timeLimitNanos = timeLimit.toNanos();
        this.nanoClock = nanoClock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SlotSolution solve(SlotProblem problem) {
        int n = problem.size();
        if (n == 0 || problem.budget() == 0) {
            return SlotSolution.empty(n);
        }
        Search search = new Search(problem, nanoClock.getAsLong());
        search.run();

        if (search.timedOut) {
            log.warn("[SOLVER] Time limit of {}ms reached after {} nodes, returning best feasible (objective {})",
                Duration.ofNanos(timeLimitNanos).toMillis(), search.nodes, search.bestValue);
        }
        return new SlotSolution(search.bestChosen(), search.bestValue, !search.timedOut, search.nodes);
    }

    private final class Search {
        private final SlotProblem problem;
        private final long startNanos;

        // Items with positive value, best first. Non-positive items never improve a maximum.
        private final int[] order;
        private final long[] prefix;

        private final int[] used;
        private final boolean[] current;
        private boolean[] best;
        private long bestValue;

        private long nodes;
        private boolean timedOut;

        Search(SlotProblem problem, long startNanos) {
            this.problem = problem;
            this.startNanos = startNanos;

            Integer[] boxed = new Integer[problem.size()];
            for (int i = 0; i < boxed.length; i++) boxed[i] = i;
            Arrays.sort(boxed, Comparator.<Integer>comparingLong(problem::value).reversed()
                .thenComparingInt(Integer::intValue));
            this.order = Arrays.stream(boxed).filter(i -> problem.value(i) > 0).mapToInt(Integer::intValue).toArray();

            this.prefix = new long[order.length + 1];
            for (int k = 0; k < order.length; k++) {
                prefix[k + 1] = prefix[k] + problem.value(order[k]);
            }
            this.used = new int[problem.dayCount()];
            this.current = new boolean[problem.size()];
            this.best = new boolean[problem.size()];
        }

        void run() {
            seedGreedy();
            branch(0, problem.budget(), 0L);
        }

        private void seedGreedy() {
            boolean[] chosen = new boolean[problem.size()];
            int[] load = new int[problem.dayCount()];
            int left = problem.budget();
            long value = 0;
            for (int item : order) {
                if (left == 0) break;
                if (fits(item, load)) {
                    for (int d : problem.days(item)) load[d]++;
                    chosen[item] = true;
                    value += problem.value(item);
                    left--;
                }
            }
            best = chosen;
            bestValue = value;
        }

        private void branch(int depth, int unitsLeft, long value) {
            if (timedOut) {
                return;
            }
            if (nodes++ % CLOCK_CHECK_INTERVAL == 0 && nanoClock.getAsLong() - startNanos > timeLimitNanos) {
                timedOut = true;
                return;
            }
            if (value > bestValue) {
                bestValue = value;
                best = current.clone();
            }
            if (depth == order.length || unitsLeft == 0) {
                return;
            }
            long bound = value + prefix[Math.min(order.length, depth + unitsLeft)] - prefix[depth];
            if (bound <= bestValue) {
                return;
            }

            int item = order[depth];
            if (fits(item, used)) {
                for (int d : problem.days(item)) used[d]++;
                current[item] = true;
                branch(depth + 1, unitsLeft - 1, value + problem.value(item));
                current[item] = false;
                for (int d : problem.days(item)) used[d]--;
            }
            branch(depth + 1, unitsLeft, value);
        }

        private boolean fits(int item, int[] load) {
            for (int d : problem.days(item)) {
                if (load[d] >= problem.capacity(d)) {
                    return false;
                }
            }
            return true;
        }

        boolean[] bestChosen() {
            return best.clone();
        }
    }
}
