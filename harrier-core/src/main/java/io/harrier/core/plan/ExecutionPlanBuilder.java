package io.harrier.core.plan;

import io.harrier.api.test.RunUnit;
import io.harrier.api.test.TestDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Partitions selected units into lanes.
 * <p>
 * Ordered tests share a lane per (project, module) sorted by source rank;
 * serial tests share a lane per (project, group) in discovery order; every
 * other unit gets its own lane. A test that is both ordered and serial is
 * treated as ordered. Lanes appear in the order of their first unit.
 */
public final class ExecutionPlanBuilder {

    private static final Logger log = LoggerFactory.getLogger(ExecutionPlanBuilder.class);

    private ExecutionPlanBuilder() {}

    public static ExecutionPlan build(List<RunUnit> units) {
        // null key marks the slot of an independent unit
        List<Object> slots = new ArrayList<>();
        Map<LaneKey, List<RunUnit>> grouped = new HashMap<>();
        Set<String> linted = new HashSet<>();

        for (RunUnit unit : units) {
            LaneKey key = laneKey(unit, linted);
            if (key == null) {
                slots.add(unit);
                continue;
            }
            List<RunUnit> members = grouped.get(key);
            if (members == null) {
                members = new ArrayList<>();
                grouped.put(key, members);
                slots.add(key);
            }
            members.add(unit);
        }

        List<Lane> lanes = new ArrayList<>(slots.size());
        for (Object slot : slots) {
            if (slot instanceof RunUnit unit) {
                lanes.add(Lane.independent(unit));
            } else {
                LaneKey key = (LaneKey) slot;
                List<RunUnit> members = grouped.get(key);
                if (key.kind() == LaneKey.Kind.ORDERED) {
                    // stable sort keeps discovery order for equal ranks
                    members.sort(Comparator.comparingLong(u -> u.test().ordering().sourceRank()));
                }
                lanes.add(Lane.ordered(key, members));
            }
        }

        ExecutionPlan plan = new ExecutionPlan(lanes);
        log.debug("Planned {} units into {} lanes ({} ordered)", plan.unitCount(), lanes.size(),
                grouped.size());
        return plan;
    }

    static LaneKey laneKey(RunUnit unit, Set<String> linted) {
        TestDescriptor test = unit.test();
        Optional<String> serialGroup = test.serialGroup();

        if (test.ordering().isOrdered()) {
            if (serialGroup.isPresent() && linted.add(test.fullName())) {
                log.warn("Test {} is both ordered and serial (group '{}'); the serial group is ignored",
                        test.fullName(), serialGroup.get());
            }
            return new LaneKey(unit.projectName(), LaneKey.Kind.ORDERED, test.ordering().moduleKey());
        }
        return serialGroup
                .map(group -> new LaneKey(unit.projectName(), LaneKey.Kind.SERIAL, group))
                .orElse(null);
    }
}
