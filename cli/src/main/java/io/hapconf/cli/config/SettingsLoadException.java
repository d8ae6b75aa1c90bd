package io.hapconf.cli.config;

/**
 * Thrown when the settings file cannot be loaded: missing file, malformed YAML or an out-of-range
 * value. The message is meant to be printed as is.
 */
public class SettingsLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SettingsLoadException(String message) {
        super(message);
    }

    public SettingsLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
