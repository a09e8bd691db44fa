package io.harrier.api.environment;

import io.harrier.api.event.EventSubscriber;
import io.harrier.api.project.ProjectConfig;
import io.harrier.api.test.TestRegistry;

import java.util.List;

/**
 * Starts runs of registered tests against configured projects.
 */
public interface TestEnvironment {

    /**
     * Validate the configuration, select and plan the units, then start executing them.
     *
     * @throws io.harrier.api.project.ConfigInvalidException if the projects cannot be used; nothing is scheduled
     */
    TestRun start(TestRegistry registry, List<ProjectConfig> projects);

    /**
     * Attach a subscriber to every run started afterwards.
     */
    TestEnvironment subscribe(EventSubscriber subscriber);

    RunOptions options();

    /**
     * Cancel the current run, if any, and release resources.
     */
    void shutdown();
}
