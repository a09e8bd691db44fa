package io.harrier.core.selection;

import io.harrier.api.environment.Filters;
import io.harrier.api.project.ProjectConfig;
import io.harrier.api.test.RunUnit;
import io.harrier.api.test.TestDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Narrows every test × project pair down to the units of one run.
 * <p>
 * A pair is kept when the project does not ignore the test and every
 * non-empty filter has a value equal to, or contained in, the candidate.
 * Result order is registration order, then project order, so the same input
 * always produces the same units.
 */
public final class Selection {

    private static final Logger log = LoggerFactory.getLogger(Selection.class);

    private Selection() {}

    public static List<RunUnit> select(List<TestDescriptor> tests, List<ProjectConfig> projects, Filters filters) {
        List<ProjectConfig> targets = projects.isEmpty() ? List.of(ProjectConfig.defaultProject()) : projects;
        List<RunUnit> units = new ArrayList<>();

        for (TestDescriptor test : tests) {
            for (ProjectConfig project : targets) {
                if (isIgnored(project, test)) {
                    log.debug("Skipping {} for project '{}': listed in ignore list", test.fullName(), project.name());
                    continue;
                }
                if (matches(filters.projects(), project.name())
                        && matches(filters.modules(), test.module())
                        && (matches(filters.tests(), test.displayName()) || matches(filters.tests(), test.fullName()))) {
                    units.add(new RunUnit(test, project));
                }
            }
        }

        log.debug("Selected {} of {} candidate units", units.size(), tests.size() * targets.size());
        return units;
    }

    static boolean isIgnored(ProjectConfig project, TestDescriptor test) {
        for (String ignored : project.ignoredTests()) {
            if (ignored.equals(test.displayName()) || ignored.equals(test.fullName())) {
                return true;
            }
        }
        return false;
    }

    static boolean matches(Collection<String> allowed, String candidate) {
        if (allowed.isEmpty()) {
            return true;
        }
        for (String value : allowed) {
            if (candidate.contains(value)) {
                return true;
            }
        }
        return false;
    }
}
