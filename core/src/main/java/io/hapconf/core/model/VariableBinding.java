package io.hapconf.core.model;

import java.util.Objects;

/** A {@code let NAME = VALUE} binding. */
public record VariableBinding(String name, Value value, SourceLocation location) implements IrNode {

    public VariableBinding {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
