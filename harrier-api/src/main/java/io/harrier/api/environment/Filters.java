package io.harrier.api.environment;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Allow-lists narrowing a run. An empty set means "everything".
 * Values match exactly or as a case-sensitive substring.
 */
public record Filters(Set<String> projects, Set<String> modules, Set<String> tests) {

    private static final Filters NONE = new Filters(Set.of(), Set.of(), Set.of());

    public Filters {
        projects = copy(projects);
        modules = copy(modules);
        tests = copy(tests);
    }

    public static Filters none() {
        return NONE;
    }

    public Filters withProjects(Collection<String> values) {
        return new Filters(copy(values), modules, tests);
    }

    public Filters withModules(Collection<String> values) {
        return new Filters(projects, copy(values), tests);
    }

    public Filters withTests(Collection<String> values) {
        return new Filters(projects, modules, copy(values));
    }

    private static Set<String> copy(Collection<String> values) {
        return values == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
