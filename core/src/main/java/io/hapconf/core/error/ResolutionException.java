package io.hapconf.core.error;

import io.hapconf.core.model.SourceLocation;
import java.util.List;

/**
 * Thrown when a reference cannot be resolved: an undefined or circular variable, an unset
 * environment variable without default, an arithmetic error inside an interpolation, or a loop
 * whose bounds cannot be unrolled.
 */
public final class ResolutionException extends TranslateException {

    private static final long serialVersionUID = 1L;

    private final List<String> names;

    public ResolutionException(String message, Phase phase, List<String> names, SourceLocation location) {
        super(message, phase, location);
        this.names = List.copyOf(names);
    }

    public ResolutionException(String message, Phase phase, SourceLocation location) {
        this(message, phase, List.of(), location);
    }

    public ResolutionException(String message, Throwable cause, Phase phase, SourceLocation location) {
        super(message, cause, phase, location);
        this.names = List.of();
    }

    /** The variable or loop names implicated in the failure, possibly empty. */
    public List<String> names() {
        return names;
    }
}
