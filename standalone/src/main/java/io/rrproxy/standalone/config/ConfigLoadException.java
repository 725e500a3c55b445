package io.rrproxy.standalone.config;

import io.rrproxy.core.error.ConfigurationException;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML,
 * malformed environment values or a setting outside its allowed range. The
 * message names the offending key and is suitable for startup error output.
 */
public class ConfigLoadException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
