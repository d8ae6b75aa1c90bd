package io.hapconf.core.validate;

import io.hapconf.core.error.Diagnostic;
import io.hapconf.core.error.ValidationError;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of semantic validation: every error and every warning found in one pass.
 *
 * @param errors   violations that prevent output, in detection order
 * @param warnings suspicious but legal constructs, in detection order
 */
public record ValidationResult(List<ValidationError> errors, List<ValidationError> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /** Warnings as diagnostics, for reporting alongside a successful translation. */
    public List<Diagnostic> warningDiagnostics() {
        List<Diagnostic> out = new ArrayList<>(warnings.size());
        for (ValidationError w : warnings) {
            out.add(Diagnostic.warning(w.message(), w.location()));
        }
        return out;
    }
}
