package io.hapconf.core.error;

import io.hapconf.core.model.SourceLocation;
import java.util.Objects;

/**
 * A single semantic violation found by the validator.
 *
 * @param message  description naming the offending construct
 * @param location where the construct was declared
 */
public record ValidationError(String message, SourceLocation location) {

    public ValidationError {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(location, "location must not be null");
    }

    @Override
    public String toString() {
        return location + ": " + message;
    }
}
