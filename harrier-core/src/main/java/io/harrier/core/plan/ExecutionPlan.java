package io.harrier.core.plan;

import io.harrier.api.test.RunUnit;

import java.util.List;

/**
 * Lanes of a run, fixed before execution starts.
 */
public record ExecutionPlan(List<Lane> lanes) {

    public ExecutionPlan {
        lanes = List.copyOf(lanes);
    }

    public int unitCount() {
        return lanes.stream().mapToInt(Lane::size).sum();
    }

    public List<RunUnit> units() {
        return lanes.stream().flatMap(lane -> lane.units().stream()).toList();
    }

    public boolean isEmpty() {
        return lanes.isEmpty();
    }
}
