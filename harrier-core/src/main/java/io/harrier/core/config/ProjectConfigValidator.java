package io.harrier.core.config;

import io.harrier.api.project.ConfigInvalidException;
import io.harrier.api.project.ProjectConfig;
import io.harrier.api.project.RetryPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rejects project configurations that cannot be run, before anything is scheduled.
 */
public final class ProjectConfigValidator {

    private ProjectConfigValidator() {}

    /**
     * @throws ConfigInvalidException listing every problem found
     */
    public static void validate(List<ProjectConfig> projects) {
        List<String> problems = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (ProjectConfig project : projects) {
            String name = project.name();
            if (name.isBlank()) {
                problems.add("project name must not be blank");
            } else if (!names.add(name)) {
                problems.add("duplicate project name '" + name + "'");
            }
            validateRetry(name, project.retry(), problems);
        }

        if (!problems.isEmpty()) {
            throw new ConfigInvalidException(problems);
        }
    }

    private static void validateRetry(String project, RetryPolicy retry, List<String> problems) {
        String prefix = "project '" + project + "': retry ";
        if (retry.count() < 0) {
            problems.add(prefix + "count must not be negative (" + retry.count() + ")");
        }
        if (!(retry.factor() >= 1.0) || Double.isInfinite(retry.factor())) {
            problems.add(prefix + "factor must be a finite number >= 1.0 (" + retry.factor() + ")");
        }
        if (retry.minDelay().isNegative()) {
            problems.add(prefix + "min delay must not be negative");
        }
        if (retry.maxDelay().compareTo(retry.minDelay()) < 0) {
            problems.add(prefix + "max delay " + retry.maxDelay() + " is below min delay " + retry.minDelay());
        }
        for (Duration delay : retry.delays()) {
            if (delay.isNegative()) {
                problems.add(prefix + "delays must not be negative (" + delay + ")");
                break;
            }
        }
    }
}
