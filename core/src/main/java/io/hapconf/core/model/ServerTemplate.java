package io.hapconf.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A {@code server-template}: a pool of servers resolved at runtime from one address.
 *
 * @param prefix name prefix of the generated servers
 * @param count  number of servers, or a {@code "from-to"} id range
 */
public record ServerTemplate(
        String prefix,
        Value count,
        Properties properties,
        Properties extras,
        List<String> spreads,
        SourceLocation location)
        implements ServerEntry, Spreadable<ServerTemplate> {

    public ServerTemplate {
        Objects.requireNonNull(prefix, "prefix must not be null");
        Objects.requireNonNull(count, "count must not be null");
        spreads = List.copyOf(spreads);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SERVER_TEMPLATE;
    }

    @Override
    public ServerTemplate withProperties(Properties properties, Properties extras, List<String> spreads) {
        return new ServerTemplate(prefix, count, properties, extras, spreads, location);
    }
}
