package io.hapconf.core.error;

import io.hapconf.core.model.SourceLocation;
import java.util.Objects;

/**
 * One reportable message about a translation run.
 *
 * @param severity error or warning
 * @param phase    pipeline phase that produced it
 * @param message  human-readable description
 * @param location DSL location it refers to
 */
public record Diagnostic(Severity severity, TranslateException.Phase phase, String message, SourceLocation location) {

    /** Diagnostic severity. Only errors prevent output. */
    public enum Severity {
        ERROR,
        WARNING
    }

    public Diagnostic {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(phase, "phase must not be null");
        Objects.requireNonNull(message, "message must not be null");
        location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public static Diagnostic error(TranslateException.Phase phase, String message, SourceLocation location) {
        return new Diagnostic(Severity.ERROR, phase, message, location);
    }

    public static Diagnostic warning(String message, SourceLocation location) {
        return new Diagnostic(Severity.WARNING, TranslateException.Phase.VALIDATE, message, location);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /** Renders as {@code source:line:column: error: message}. */
    public String format() {
        return location + ": " + severity.name().toLowerCase(java.util.Locale.ROOT) + ": " + message;
    }
}
