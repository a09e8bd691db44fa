package io.harrier.core.plan;

/**
 * Identifies an ordered lane. Lanes are always scoped to one project.
 */
public record LaneKey(String project, Kind kind, String label) {

    public enum Kind {
        /** tests of an ordered module, sorted by source rank */
        ORDERED,
        /** tests sharing a serial group, in discovery order */
        SERIAL
    }

    @Override
    public String toString() {
        return project + "/" + kind.name().toLowerCase() + ":" + label;
    }
}
