package io.harrier.core.plan;

import io.harrier.api.test.RunUnit;
import io.harrier.api.test.TestDescriptor;
import io.harrier.api.test.TestInfo;
import io.harrier.api.test.TestOrdering;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.harrier.core.Units.*;
import static org.assertj.core.api.Assertions.assertThat;

class ExecutionPlanBuilderTest {

    @Test
    void independentUnitsShouldGetOneLaneEach() {
        var plan = ExecutionPlanBuilder.build(List.of(
                unit(plain("m", "a"), "p"),
                unit(plain("m", "b"), "p")));

        assertThat(plan.lanes()).hasSize(2);
        assertThat(plan.lanes()).noneMatch(Lane::isOrdered);
        assertThat(plan.unitCount()).isEqualTo(2);
    }

    @Test
    void orderedUnitsShouldBeSortedBySourceRank() {
        var second = ordered("flow", "second", 2);
        var first = ordered("flow", "first", 1);

        var plan = ExecutionPlanBuilder.build(List.of(unit(second, "p"), unit(first, "p")));

        assertThat(plan.lanes()).hasSize(1);
        Lane lane = plan.lanes().get(0);
        assertThat(lane.isOrdered()).isTrue();
        assertThat(lane.key()).hasValueSatisfying(k -> assertThat(k.kind()).isEqualTo(LaneKey.Kind.ORDERED));
        assertThat(lane.units()).extracting(u -> u.info().displayName()).containsExactly("first", "second");
    }

    @Test
    void orderedLanesShouldBeScopedPerProject() {
        var a = ordered("flow", "a", 1);
        var b = ordered("flow", "b", 2);

        var plan = ExecutionPlanBuilder.build(List.of(
                unit(a, "p"), unit(a, "q"), unit(b, "p"), unit(b, "q")));

        assertThat(plan.lanes()).hasSize(2);
        assertThat(plan.lanes().get(0).units()).extracting(RunUnit::id)
                .containsExactly("p::flow::a", "p::flow::b");
        assertThat(plan.lanes().get(1).units()).extracting(RunUnit::id)
                .containsExactly("q::flow::a", "q::flow::b");
    }

    @Test
    void serialGroupShouldSpanModulesAndKeepDiscoveryOrder() {
        var plan = ExecutionPlanBuilder.build(List.of(
                unit(serial("db", "users", "insert"), "p"),
                unit(plain("health", "ping"), "p"),
                unit(serial("db", "orders", "insert"), "p")));

        assertThat(plan.lanes()).hasSize(2);
        Lane serialLane = plan.lanes().get(0);
        assertThat(serialLane.key()).contains(new LaneKey("p", LaneKey.Kind.SERIAL, "db"));
        assertThat(serialLane.units()).extracting(RunUnit::id)
                .containsExactly("p::users::insert", "p::orders::insert");
    }

    @Test
    void orderedShouldWinOverSerial() {
        TestDescriptor both = new TestDescriptor(new TestInfo("flow", "both", 0, "both"),
                TestOrdering.ordered("flow", 1), "db", NOOP);
        TestDescriptor other = serial("db", "other", "x");

        var plan = ExecutionPlanBuilder.build(List.of(unit(both, "p"), unit(other, "p")));

        assertThat(plan.lanes()).hasSize(2);
        assertThat(plan.lanes().get(0).key()).contains(new LaneKey("p", LaneKey.Kind.ORDERED, "flow"));
        assertThat(plan.lanes().get(1).key()).contains(new LaneKey("p", LaneKey.Kind.SERIAL, "db"));
    }

    @Test
    void everyUnitShouldAppearExactlyOnce() {
        List<RunUnit> units = List.of(
                unit(ordered("flow", "a", 1), "p"),
                unit(serial("db", "m", "b"), "p"),
                unit(plain("m", "c"), "p"),
                unit(ordered("flow", "d", 2), "q"));

        var plan = ExecutionPlanBuilder.build(units);

        assertThat(plan.units()).containsExactlyInAnyOrderElementsOf(units);
    }

    @Test
    void emptySelectionShouldGiveEmptyPlan() {
        assertThat(ExecutionPlanBuilder.build(List.of()).isEmpty()).isTrue();
    }
}
