package io.hapconf.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A {@code for VAR in ITERATION { ... }} construct. Appears either among the top-level sections
 * or in a server list; its body holds nodes of the same family, possibly nested loops.
 */
public record ForLoop(String variable, Iteration iteration, List<IrNode> body, SourceLocation location)
        implements SectionEntry, ServerEntry {

    public ForLoop {
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(iteration, "iteration must not be null");
        body = List.copyOf(body);
    }
}
