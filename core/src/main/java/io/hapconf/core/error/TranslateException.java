package io.hapconf.core.error;

import io.hapconf.core.model.SourceLocation;

/**
 * Abstract base for all hapconf translation errors. Never thrown directly; use one of the
 * concrete subclasses, each bound to the pipeline {@link Phase} it belongs to.
 *
 * <p>
 * Every exception carries the {@link SourceLocation} of the offending DSL construct so the
 * caller can point the user at it. The location is {@link SourceLocation#UNKNOWN} only when no
 * construct can be blamed (for example an empty source text).
 */
public abstract class TranslateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline phase in which the error occurred. */
    public enum Phase {
        PARSE,
        BUILD,
        UNROLL,
        EXPAND,
        RESOLVE,
        VALIDATE,
        GENERATE
    }

    private final Phase phase;
    private final SourceLocation location;

    protected TranslateException(String message, Phase phase, SourceLocation location) {
        super(message);
        this.phase = phase;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    protected TranslateException(String message, Throwable cause, Phase phase, SourceLocation location) {
        super(message, cause);
        this.phase = phase;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }

    /** Where in the DSL source the error was detected. */
    public SourceLocation location() {
        return location;
    }
}
