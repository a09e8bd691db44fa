package io.harrier.api.project;

/**
 * A project setting is missing or cannot be converted to the requested type.
 */
public class ConfigValueException extends RuntimeException {

    private final String key;

    public ConfigValueException(String key, String message) {
        super(message);
        this.key = key;
    }

    public ConfigValueException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public static ConfigValueException notFound(String key) {
        return new ConfigValueException(key, "Config value not found: " + key);
    }

    public String key() {
        return key;
    }
}
