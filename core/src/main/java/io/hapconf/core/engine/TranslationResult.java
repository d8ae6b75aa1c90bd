package io.hapconf.core.engine;

import io.hapconf.core.error.Diagnostic;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a successful translation.
 *
 * @param output   the generated configuration text
 * @param scripts  inline scripts to persist, in declaration order
 * @param warnings validation warnings; never errors
 */
public record TranslationResult(String output, List<ExtractedScript> scripts, List<Diagnostic> warnings) {

    public TranslationResult {
        Objects.requireNonNull(output, "output must not be null");
        scripts = List.copyOf(scripts);
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
