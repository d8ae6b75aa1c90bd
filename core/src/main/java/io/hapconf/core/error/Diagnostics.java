package io.hapconf.core.error;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable, ordered list of {@link Diagnostic}s produced by a translation or validation run.
 * Errors appear in detection order, followed by warnings.
 */
public final class Diagnostics {

    private static final Diagnostics EMPTY = new Diagnostics(List.of());

    private final List<Diagnostic> entries;

    private Diagnostics(List<Diagnostic> entries) {
        this.entries = List.copyOf(entries);
    }

    public static Diagnostics empty() {
        return EMPTY;
    }

    public static Diagnostics of(List<Diagnostic> entries) {
        return entries.isEmpty() ? EMPTY : new Diagnostics(entries);
    }

    /**
     * Converts a pipeline failure into diagnostics. A {@link ValidationException} expands into one
     * entry per violation; any other exception yields exactly one entry.
     */
    public static Diagnostics fromException(TranslateException e, List<Diagnostic> warnings) {
        List<Diagnostic> all = new ArrayList<>();
        if (e instanceof ValidationException ve) {
            for (ValidationError error : ve.errors()) {
                all.add(Diagnostic.error(e.phase(), error.message(), error.location()));
            }
        } else {
            all.add(Diagnostic.error(e.phase(), e.getMessage(), e.location()));
        }
        all.addAll(warnings);
        return new Diagnostics(all);
    }

    public List<Diagnostic> all() {
        return entries;
    }

    public List<Diagnostic> errors() {
        return entries.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return entries.stream().filter(d -> !d.isError()).toList();
    }

    public boolean hasErrors() {
        return entries.stream().anyMatch(Diagnostic::isError);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "Diagnostics" + entries;
    }
}
