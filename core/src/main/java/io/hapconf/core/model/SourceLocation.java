package io.hapconf.core.model;

import java.io.Serializable;

/**
 * Position of a construct in the DSL source: the source name (usually a file name) plus 1-based
 * line and column.
 */
public record SourceLocation(String source, int line, int column) implements Serializable {

    /** Placeholder used when no position is known. */
    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0);

    public SourceLocation {
        if (source == null || source.isEmpty()) {
            source = "<input>";
        }
    }

    @Override
    public String toString() {
        return source + ":" + line + ":" + column;
    }
}
