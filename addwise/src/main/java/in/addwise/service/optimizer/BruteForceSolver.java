package in.addwise.service.optimizer;

/**
 * Exhaustive enumeration of every subset. Reference solver for small
 * instances; always optimal.
 */
public final class BruteForceSolver implements SlotSolver {

    public static final String NAME = "brute-force";
    public static final int MAX_ITEMS = 20;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SlotSolution solve(SlotProblem problem) {
        int n = problem.size();
        if (n > MAX_ITEMS) {
            throw new IllegalArgumentException("Brute force limited to " + MAX_ITEMS + " items, got " + n);
        }
        boolean[] best = new boolean[n];
        long bestValue = 0;
        long evaluated = 0;

        boolean[] chosen = new boolean[n];
        for (int mask = 1; mask < (1 << n); mask++) {
            if (Integer.bitCount(mask) > problem.budget()) {
                continue;
            }
            for (int i = 0; i < n; i++) {
                chosen[i] = (mask & (1 << i)) != 0;
            }
            evaluated++;
            if (!problem.isFeasible(chosen)) {
                continue;
            }
            long value = problem.objective(chosen);
            if (value > bestValue) {
                bestValue = value;
                best = chosen.clone();
            }
        }
        return new SlotSolution(best, bestValue, true, evaluated);
    }
}
