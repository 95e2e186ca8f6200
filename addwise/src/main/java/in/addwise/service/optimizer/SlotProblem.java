package in.addwise.service.optimizer;

import java.util.Arrays;

/**
 * Solver-level view of one selection problem: integer item values, the
 * days each item occupies, a budget and per-day capacities.
 *
 * Item i is worth {@code values[i]} and needs one slot on every day in
 * {@code days[i]}. At most {@code budget} items may be chosen.
 */
public final class SlotProblem {

    private final long[] values;
    private final int[][] days;
    private final int budget;
    private final int[] capacity;

    public SlotProblem(long[] values, int[][] days, int budget, int[] capacity) {
        if (values.length != days.length) {
            throw new IllegalArgumentException("values and days differ in length: " + values.length + " vs " + days.length);
        }
        if (budget < 0) {
            throw new IllegalArgumentException("Budget must be non-negative: " + budget);
        }
        for (int slots : capacity) {
            if (slots < 0) {
                throw new IllegalArgumentException("Capacity must be non-negative: " + Arrays.toString(capacity));
            }
        }
        for (int i = 0; i < days.length; i++) {
            for (int d : days[i]) {
                if (d < 0 || d >= capacity.length) {
                    throw new IllegalArgumentException("Item " + i + " occupies day " + d + " outside 0.." + (capacity.length - 1));
                }
            }
        }
        this.values = values.clone();
        this.days = new int[days.length][];
        for (int i = 0; i < days.length; i++) {
            this.days[i] = days[i].clone();
        }
        this.budget = budget;
        this.capacity = capacity.clone();
    }

    public int size() {
        return values.length;
    }

    public long value(int item) {
        return values[item];
    }

    public int[] days(int item) {
        return days[item];
    }

    public int budget() {
        return budget;
    }

    public int dayCount() {
        return capacity.length;
    }

    public int capacity(int day) {
        return capacity[day];
    }

    public int[] capacityCopy() {
        return capacity.clone();
    }

    /**
     * Budget and every per-day capacity respected.
     */
    public boolean isFeasible(boolean[] chosen) {
        int count = 0;
        int[] used = new int[capacity.length];
        for (int i = 0; i < values.length; i++) {
            if (!chosen[i]) continue;
            count++;
            for (int d : days[i]) {
                if (++used[d] > capacity[d]) {
                    return false;
                }
            }
        }
        return count <= budget;
    }

    public long objective(boolean[] chosen) {
        long total = 0;
        for (int i = 0; i < values.length; i++) {
            if (chosen[i]) total += values[i];
        }
        return total;
    }
}
