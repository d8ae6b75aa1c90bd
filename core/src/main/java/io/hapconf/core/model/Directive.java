package io.hapconf.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An unmodeled bare line such as {@code log "/dev/log" local0 info}, passed through verbatim
 * after interpolation.
 */
public record Directive(String name, List<Value> args, SourceLocation location) implements IrNode {

    public Directive {
        Objects.requireNonNull(name, "name must not be null");
        args = List.copyOf(args);
    }
}
