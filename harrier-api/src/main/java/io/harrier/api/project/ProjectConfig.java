package io.harrier.api.project;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * A named target the tests are executed against (e.g. "staging", "production").
 * <p>
 * Immutable for the duration of a run. Arbitrary settings such as
 * {@code base_url} are exposed through typed getters; values are stored as
 * strings and converted on access. List and object values are expected to be
 * JSON encoded.
 * <pre>{@code
 * var staging = ProjectConfig.builder("staging")
 *     .setting("base_url", "https://staging.example.com")
 *     .ignore("slow_test")
 *     .retry(RetryPolicy.builder().count(3).build())
 *     .build();
 * }</pre>
 */
public final class ProjectConfig {

    public static final String DEFAULT_NAME = "default";

    private static final ObjectMapper JSON = new ObjectMapper();

    private final String name;
    private final List<String> ignoredTests;
    private final RetryPolicy retry;
    private final Map<String, String> settings;

    private ProjectConfig(Builder builder) {
        this.name = builder.name;
        this.ignoredTests = List.copyOf(builder.ignoredTests);
        this.retry = builder.retry;
        this.settings = Collections.unmodifiableMap(new LinkedHashMap<>(builder.settings));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Project used when no project is configured at all.
     */
    public static ProjectConfig defaultProject() {
        return builder(DEFAULT_NAME).build();
    }

    public String name() { return name; }
    public List<String> ignoredTests() { return ignoredTests; }
    public RetryPolicy retry() { return retry; }
    public Map<String, String> settings() { return settings; }

    public Optional<String> find(String key) {
        return Optional.ofNullable(settings.get(key));
    }

    public String getString(String key) {
        String value = settings.get(key);
        if (value == null) {
            throw ConfigValueException.notFound(key);
        }
        return value;
    }

    public String getString(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }

    public long getLong(String key) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigValueException(key, "Not an integer: " + key + "=" + value, e);
        }
    }

    /**
     * @throws ConfigValueException if the value is not an integer or does not fit in an {@code int}
     */
    public int getInt(String key) {
        long value = getLong(key);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new ConfigValueException(key, "Out of int range: " + key + "=" + value);
        }
        return (int) value;
    }

    public double getDouble(String key) {
        String value = getString(key);
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigValueException(key, "Not a number: " + key + "=" + value, e);
        }
    }

    public boolean getBoolean(String key) {
        String value = getString(key).trim();
        if (value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new ConfigValueException(key, "Not a boolean: " + key + "=" + value);
    }

    /**
     * @return the setting parsed as an ISO-8601 instant (e.g. {@code 2024-01-01T00:00:00Z})
     */
    public Instant getInstant(String key) {
        String value = getString(key);
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigValueException(key, "Not an ISO-8601 instant: " + key + "=" + value, e);
        }
    }

    /**
     * Decode a JSON array setting, e.g. {@code ["a", "b"]}.
     */
    public <T> List<T> getList(String key, Class<T> elementType) {
        JavaType type = JSON.getTypeFactory().constructCollectionType(List.class, elementType);
        return readJson(key, type);
    }

    /**
     * Decode a JSON object setting into the given type.
     */
    public <T> T getObject(String key, Class<T> type) {
        return readJson(key, JSON.getTypeFactory().constructType(type));
    }

    public <T> T getObject(String key, TypeReference<T> type) {
        return readJson(key, JSON.getTypeFactory().constructType(type));
    }

    private <T> T readJson(String key, JavaType type) {
        String value = getString(key);
        try {
            return JSON.readValue(value, type);
        } catch (JsonProcessingException e) {
            throw new ConfigValueException(key, "Cannot decode " + key + " as " + type + ": " + e.getOriginalMessage(), e);
        }
    }

    public Builder toBuilder() {
        return new Builder(name)
                .ignore(ignoredTests)
                .retry(retry)
                .settings(settings);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectConfig)) return false;
        ProjectConfig that = (ProjectConfig) o;
        return name.equals(that.name)
                && ignoredTests.equals(that.ignoredTests)
                && retry.equals(that.retry)
                && settings.equals(that.settings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, ignoredTests, retry, settings);
    }

    @Override
    public String toString() {
        return "ProjectConfig{name='" + name + "', ignoredTests=" + ignoredTests
                + ", retry=" + retry + ", settings=" + settings.keySet() + '}';
    }

    public static final class Builder {
        private final String name;
        private final List<String> ignoredTests = new ArrayList<>();
        private RetryPolicy retry = RetryPolicy.disabled();
        private final Map<String, String> settings = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder ignore(String testName) {
            ignoredTests.add(Objects.requireNonNull(testName, "testName"));
            return this;
        }

        public Builder ignore(Collection<String> testNames) {
            testNames.forEach(this::ignore);
            return this;
        }

        public Builder retry(RetryPolicy retry) {
            this.retry = Objects.requireNonNull(retry, "retry");
            return this;
        }

        public Builder setting(String key, String value) {
            settings.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder settings(Map<String, String> values) {
            values.forEach(this::setting);
            return this;
        }

        public ProjectConfig build() {
            return new ProjectConfig(this);
        }
    }
}
