package io.harrier.api.event;

import java.time.Instant;
import java.util.List;

/**
 * @param projects names of the projects in configuration order
 * @param units    number of selected units
 * @param lanes    number of lanes in the execution plan
 */
public record RunStarted(List<String> projects, int units, int lanes, Instant timestamp) implements RunEvent {

    public RunStarted {
        projects = List.copyOf(projects);
    }
}
