package io.hapconf.core.error;

import io.hapconf.core.model.SourceLocation;

/**
 * Thrown when the DSL source is malformed. Parsing never recovers: the first syntax error aborts
 * the run, so there is at most one of these per translation.
 */
public final class ParseException extends TranslateException {

    private static final long serialVersionUID = 1L;

    private final String offendingToken;

    public ParseException(String message, String offendingToken, SourceLocation location) {
        super(message, Phase.PARSE, location);
        this.offendingToken = offendingToken;
    }

    /** Text of the token the parser stopped at, or {@code "<EOF>"} at end of input. */
    public String offendingToken() {
        return offendingToken;
    }
}
