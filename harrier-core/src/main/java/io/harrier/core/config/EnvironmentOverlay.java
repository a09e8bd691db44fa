package io.harrier.core.config;

import io.harrier.api.project.ProjectConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Merges environment variables into project settings.
 * <p>
 * {@code HARRIER_<PROJECT>_<KEY>=value} sets {@code <key>} for one project,
 * {@code HARRIER_<KEY>=value} for every project. Keys are lower-cased.
 * Environment values override configured settings and project scoped values
 * override global ones. {@code HARRIER_CONFIG} is reserved for the path of
 * the configuration file and never becomes a setting.
 */
public final class EnvironmentOverlay {

    public static final String PREFIX = "HARRIER_";
    public static final String CONFIG_PATH_VARIABLE = "HARRIER_CONFIG";

    private static final Logger log = LoggerFactory.getLogger(EnvironmentOverlay.class);

    private EnvironmentOverlay() {}

    public static List<ProjectConfig> apply(List<ProjectConfig> projects, Map<String, String> environment) {
        List<String> projectPrefixes = projects.stream()
                .map(p -> projectPrefix(p.name()))
                .toList();

        Map<String, String> global = new TreeMap<>();
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            String key = entry.getKey();
            if (!key.startsWith(PREFIX)) {
                continue;
            }
            if (key.equals(CONFIG_PATH_VARIABLE)) {
                checkConfigPath(entry.getValue());
                continue;
            }
            if (projectPrefixes.stream().anyMatch(key::startsWith)) {
                continue;
            }
            global.put(key.substring(PREFIX.length()).toLowerCase(Locale.ROOT), entry.getValue());
        }

        List<ProjectConfig> merged = new ArrayList<>(projects.size());
        for (ProjectConfig project : projects) {
            String prefix = projectPrefix(project.name());
            Map<String, String> scoped = new TreeMap<>();
            environment.forEach((key, value) -> {
                if (key.startsWith(prefix) && key.length() > prefix.length()) {
                    scoped.put(key.substring(prefix.length()).toLowerCase(Locale.ROOT), value);
                }
            });

            if (global.isEmpty() && scoped.isEmpty()) {
                merged.add(project);
                continue;
            }
            log.debug("Project '{}': {} global and {} project settings from environment",
                    project.name(), global.size(), scoped.size());
            merged.add(project.toBuilder()
                    .settings(global)
                    .settings(scoped)
                    .build());
        }
        return merged;
    }

    static String projectPrefix(String projectName) {
        return PREFIX + projectName.toUpperCase(Locale.ROOT).replace('-', '_') + "_";
    }

    private static void checkConfigPath(String value) {
        boolean looksLikePath = value.endsWith(".toml") || value.endsWith(".json") || value.endsWith(".yaml")
                || value.endsWith(".yml") || value.contains("/") || value.contains("\\");
        if (!looksLikePath) {
            log.error("{} is reserved for the configuration file path, not a config value. "
                    + "Use HARRIER_<KEY>=value for config values instead. Got: {}={}",
                    CONFIG_PATH_VARIABLE, CONFIG_PATH_VARIABLE, value);
        }
    }
}
