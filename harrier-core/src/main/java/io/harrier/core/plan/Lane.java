package io.harrier.core.plan;

import io.harrier.api.test.RunUnit;

import java.util.List;
import java.util.Optional;

/**
 * A partition of the plan. An independent lane holds exactly one unit; an
 * ordered lane holds units that must run one at a time, in list order.
 */
public final class Lane {

    private final LaneKey key;
    private final List<RunUnit> units;

    private Lane(LaneKey key, List<RunUnit> units) {
        this.key = key;
        this.units = List.copyOf(units);
    }

    public static Lane independent(RunUnit unit) {
        return new Lane(null, List.of(unit));
    }

    public static Lane ordered(LaneKey key, List<RunUnit> units) {
        if (units.isEmpty()) {
            throw new IllegalArgumentException("Ordered lane " + key + " has no units");
        }
        return new Lane(key, units);
    }

    public boolean isOrdered() {
        return key != null;
    }

    public Optional<LaneKey> key() {
        return Optional.ofNullable(key);
    }

    public List<RunUnit> units() {
        return units;
    }

    public int size() {
        return units.size();
    }

    public String name() {
        return key != null ? key.toString() : units.get(0).id();
    }

    @Override
    public String toString() {
        return "Lane{" + name() + ", units=" + units + '}';
    }
}
