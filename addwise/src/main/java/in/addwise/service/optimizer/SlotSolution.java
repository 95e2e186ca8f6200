package in.addwise.service.optimizer;

/**
 * Solver output: which items were chosen, their summed value, and whether
 * optimality was proven.
 */
public record SlotSolution(boolean[] chosen, long objective, boolean optimal, long nodesExplored) {

    public static SlotSolution empty(int size) {
        return new SlotSolution(new boolean[size], 0L, true, 0L);
    }

    public boolean isChosen(int item) {
        return chosen[item];
    }

    public int chosenCount() {
        int n = 0;
        for (boolean c : chosen) {
            if (c) n++;
        }
        return n;
    }
}
