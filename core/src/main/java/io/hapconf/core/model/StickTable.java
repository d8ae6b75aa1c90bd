package io.hapconf.core.model;

/** A {@code stick-table} declaration. */
public record StickTable(Properties properties, Properties extras, SourceLocation location) implements PropertyHolder {

    @Override
    public NodeKind kind() {
        return NodeKind.STICK_TABLE;
    }
}
