package in.addwise.service.optimizer;

/**
 * Exact solver for a {@link SlotProblem}. Must never throw on a well-formed
 * problem; a solver that runs out of time returns its best feasible
 * solution with {@code optimal == false}.
 */
public interface SlotSolver {

    SlotSolution solve(SlotProblem problem);

    String name();
}
