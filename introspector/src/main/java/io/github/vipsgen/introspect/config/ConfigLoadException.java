package io.github.vipsgen.introspect.config;

/**
 * Raised when {@code vipsgen-defaults.json} or a user override file cannot be turned into an
 * {@link IntrospectionConfig}.
 */
public class ConfigLoadException extends Exception {

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
