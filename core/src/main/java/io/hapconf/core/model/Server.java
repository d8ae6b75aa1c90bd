package io.hapconf.core.model;

import java.util.List;
import java.util.Objects;

/** A {@code server} inside a backend or listen section. */
public record Server(
        String name, Properties properties, Properties extras, List<String> spreads, SourceLocation location)
        implements ServerEntry, Spreadable<Server> {

    public Server {
        Objects.requireNonNull(name, "name must not be null");
        spreads = List.copyOf(spreads);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SERVER;
    }

    @Override
    public Server withProperties(Properties properties, Properties extras, List<String> spreads) {
        return new Server(name, properties, extras, spreads, location);
    }
}
