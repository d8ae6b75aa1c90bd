package io.hapconf.core.error;

import io.hapconf.core.model.SourceLocation;
import java.util.List;

/**
 * Thrown when semantic validation finds one or more violations. Carries every violation found in
 * the pass, not only the first.
 */
public final class ValidationException extends TranslateException {

    private static final long serialVersionUID = 1L;

    private final transient List<ValidationError> errors;

    public ValidationException(List<ValidationError> errors) {
        super(summarize(errors), Phase.VALIDATE, errors.isEmpty() ? SourceLocation.UNKNOWN : errors.get(0).location());
        this.errors = List.copyOf(errors);
    }

    /** All violations, in the order they were detected. */
    public List<ValidationError> errors() {
        return errors;
    }

    private static String summarize(List<ValidationError> errors) {
        if (errors.size() == 1) {
            return "Validation failed: " + errors.get(0).message();
        }
        return "Validation failed with " + errors.size() + " errors; first: "
                + (errors.isEmpty() ? "none" : errors.get(0).message());
    }
}
