package in.addwise.application.port.output;

import in.addwise.config.EngineConfig;
import in.addwise.domain.model.DailyCapacity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Per-day slot ceilings: a default plus explicit per-day overrides.
 */
public record CapacityConfig(int defaultSlots, Map<Integer, Integer> overrides, int horizonDays) {

    public CapacityConfig {
        if (defaultSlots < 0 || horizonDays <= 0) {
            throw new IllegalArgumentException("Invalid capacity: slots=" + defaultSlots + ", days=" + horizonDays);
        }
        overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
        for (Map.Entry<Integer, Integer> e : overrides.entrySet()) {
            if (e.getKey() < 0 || e.getKey() >= horizonDays || e.getValue() < 0) {
                throw new IllegalArgumentException("Invalid override: day " + e.getKey() + " -> " + e.getValue());
            }
        }
    }

    public static CapacityConfig uniform(int slots, int horizonDays) {
        return new CapacityConfig(slots, Map.of(), horizonDays);
    }

    public static CapacityConfig from(EngineConfig config) {
        return uniform(config.slotsPerDay(), config.horizonDays());
    }

    public int slotsOn(int day) {
        return overrides.getOrDefault(day, defaultSlots);
    }

    public List<DailyCapacity> toDays() {
        List<DailyCapacity> days = new ArrayList<>(horizonDays);
        for (int d = 0; d < horizonDays; d++) {
            days.add(new DailyCapacity(d, slotsOn(d), 0));
        }
        return days;
    }
}
