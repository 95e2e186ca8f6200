package in.addwise.service.snipe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Declining acceptance threshold and the option value of holding a unit.
 *
 * Day 0 demands the 90th percentile of historical realised values, the
 * last day only the 50th. Option value decays to zero by the last day.
 */
public final class ThresholdCalculator {
    private static final Logger log = LoggerFactory.getLogger(ThresholdCalculator.class);

    private static final double OPENING_PERCENTILE = 90.0;
    private static final double CLOSING_PERCENTILE = 50.0;
    private static final double FUTURE_BEST_PERCENTILE = 75.0;

    private final List<Double> history;
    private final double baseThreshold;
    private final int horizonDays;
    private final int window;

    public ThresholdCalculator(List<Double> history, double baseThreshold, int horizonDays) {
        this(history, baseThreshold, horizonDays, 0);
    }

    /**
     * @param window most recent values kept; 0 keeps everything
     */
    public ThresholdCalculator(List<Double> history, double baseThreshold, int horizonDays, int window) {
        if (horizonDays <= 0) {
            throw new IllegalArgumentException("Horizon must be at least one day: " + horizonDays);
        }
        if (window < 0) {
            throw new IllegalArgumentException("History window must be non-negative: " + window);
        }
        this.history = new ArrayList<>();
        this.baseThreshold = baseThreshold;
        this.horizonDays = horizonDays;
        this.window = window;
        if (history != null) {
            for (Double v : history) {
                if (v != null && Double.isFinite(v)) {
                    this.history.add(v);
                }
            }
        }
        evictOldest();
    }

    public void addObservation(double value) {
        if (!Double.isFinite(value)) {
            log.warn("[THRESHOLD] Ignoring non-finite realised value");
            return;
        }
        history.add(value);
        evictOldest();
    }

    /**
     * Minimum value worth spending a unit on today.
     */
    public double threshold(int day, int unitsRemaining) {
        checkDay(day);
        if (history.isEmpty()) {
            return baseThreshold * (1.0 - day / 10.0);
        }
        double threshold = percentile(percentileFor(day));
        if (unitsRemaining <= 1) {
            threshold *= 1.2;       // last unit is precious
        } else if (unitsRemaining >= 4) {
            threshold *= 0.9;
        }
        return threshold;
    }

    /**
     * Value of keeping a unit for later: P75 × (b-1)/b × daysLeft/lastDay.
     */
    public double optionValue(int day, int unitsRemaining) {
        checkDay(day);
        int lastDay = horizonDays - 1;
        if (unitsRemaining <= 1 || day >= lastDay) {
            return 0.0;
        }
        double futureBest = history.isEmpty() ? baseThreshold : percentile(FUTURE_BEST_PERCENTILE);
        double daysLeft = lastDay - day;
        return futureBest * (unitsRemaining - 1) / unitsRemaining * daysLeft / lastDay;
    }

    double percentileFor(int day) {
        int lastDay = horizonDays - 1;
        if (lastDay == 0) {
            return CLOSING_PERCENTILE;
        }
        return OPENING_PERCENTILE - day * (OPENING_PERCENTILE - CLOSING_PERCENTILE) / lastDay;
    }

    /**
     * Linear-interpolated percentile (0-100) over the history.
     */
    double percentile(double p) {
        double[] sorted = history.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = p / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    public List<Double> history() {
        return Collections.unmodifiableList(history);
    }

    private void evictOldest() {
        if (window > 0 && history.size() > window) {
            history.subList(0, history.size() - window).clear();
        }
    }

    private void checkDay(int day) {
        if (day < 0 || day >= horizonDays) {
            throw new IllegalArgumentException("Day " + day + " outside horizon of " + horizonDays + " days");
        }
    }
}
