package io.hapconf.core.model;

import java.util.Objects;

/** A {@code bind} line: listening address plus options such as {@code ssl} and {@code crt}. */
public record Bind(Value address, Properties properties, Properties extras, SourceLocation location)
        implements PropertyHolder {

    public Bind {
        Objects.requireNonNull(address, "address must not be null");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BIND;
    }
}
