package in.addwise.service.horizon;

import in.addwise.application.port.output.CapacityConfig;
import in.addwise.domain.model.CommittedPick;
import in.addwise.domain.model.DailyCapacity;
import in.addwise.domain.model.HistoricalPick;
import in.addwise.domain.model.WeeklyBudget;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable snapshot of one horizon. Every manager call that changes
 * anything produces a new snapshot.
 *
 * @param day         current day, 0-based; equals horizonDays once complete
 * @param droppable   completed picks whose roster spot can be released
 * @param unavailable candidates known to be claimed by someone else
 */
public record HorizonState(
    int day,
    WeeklyBudget budget,
    CapacityConfig capacity,
    List<CommittedPick> committed,
    List<HistoricalPick> history,
    Set<String> droppable,
    Set<String> unavailable,
    boolean complete
) {
    public HorizonState {
        committed = List.copyOf(committed);
        history = List.copyOf(history);
        droppable = Set.copyOf(droppable);
        unavailable = Set.copyOf(unavailable);
    }

    public static HorizonState initial(WeeklyBudget budget, CapacityConfig capacity) {
        if (budget.horizonDays() != capacity.horizonDays()) {
            throw new IllegalArgumentException("Budget horizon " + budget.horizonDays()
                + " != capacity horizon " + capacity.horizonDays());
        }
        return new HorizonState(0, budget, capacity, List.of(), List.of(), Set.of(), Set.of(), false);
    }

    public int horizonDays() {
        return budget.horizonDays();
    }

    public boolean isCommitted(String candidateId) {
        return committed.stream().anyMatch(p -> p.candidateId().equals(candidateId));
    }

    /**
     * Committed now or earlier this horizon.
     */
    public boolean isPicked(String candidateId) {
        return isCommitted(candidateId) || history.stream().anyMatch(h -> h.candidateId().equals(candidateId));
    }

    /**
     * Slots per day with committed occupancy already consumed.
     */
    public List<DailyCapacity> dailyCapacities() {
        List<DailyCapacity> days = new ArrayList<>(horizonDays());
        for (int d = 0; d < horizonDays(); d++) {
            int day = d;
            int consumed = (int) committed.stream().filter(p -> p.occupies(day)).count();
            days.add(new DailyCapacity(d, capacity.slotsOn(d), consumed));
        }
        return days;
    }

    /**
     * Free slots per day for the optimizer; days already past get none.
     */
    public int[] freeCapacity() {
        int[] free = new int[horizonDays()];
        for (DailyCapacity dc : dailyCapacities()) {
            free[dc.day()] = dc.day() < day ? 0 : Math.max(0, dc.available());
        }
        return free;
    }

    public HorizonState withCommitted(CommittedPick pick, WeeklyBudget newBudget) {
        List<CommittedPick> picks = new ArrayList<>(committed);
        picks.add(pick);
        return new HorizonState(day, newBudget, capacity, picks, history, droppable, unavailable, complete);
    }

    public HorizonState withUnavailable(String candidateId) {
        Set<String> ids = new LinkedHashSet<>(unavailable);
        ids.add(candidateId);
        return new HorizonState(day, budget, capacity, committed, history, droppable, ids, complete);
    }

    public HorizonState withBudget(WeeklyBudget newBudget) {
        return new HorizonState(day, newBudget, capacity, committed, history, droppable, unavailable, complete);
    }

    public HorizonState withCapacity(CapacityConfig newCapacity) {
        return new HorizonState(day, budget, newCapacity, committed, history, droppable, unavailable, complete);
    }

    /**
     * Next day: finished picks move to history and become droppable.
     * Advancing from the last day yields the terminal snapshot.
     */
    public HorizonState advance() {
        if (complete) {
            throw new IllegalStateException("Horizon already complete at day " + day);
        }
        int next = day + 1;
        List<CommittedPick> stillActive = new ArrayList<>();
        List<HistoricalPick> past = new ArrayList<>(history);
        Set<String> drop = new LinkedHashSet<>(droppable);
        for (CommittedPick p : committed) {
            if (p.isCompleteBefore(next)) {
                past.add(p.toHistory(next));
                drop.add(p.candidateId());
            } else {
                stillActive.add(p);
            }
        }
        return new HorizonState(next, budget, capacity, stillActive, past, drop, unavailable, next >= horizonDays());
    }
}
