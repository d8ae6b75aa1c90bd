package io.hapconf.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A {@code frontend} section: listening side of a proxy.
 *
 * @param routes      {@code use_backend} rules in declaration order
 * @param stickTable  optional stick table, or {@code null}
 */
public record Frontend(
        String name,
        Properties properties,
        Properties extras,
        List<String> spreads,
        List<Bind> binds,
        List<Acl> acls,
        List<RequestRule> requestRules,
        List<ResponseRule> responseRules,
        List<UseBackendRule> routes,
        StickTable stickTable,
        List<Directive> directives,
        SourceLocation location)
        implements SectionEntry, Spreadable<Frontend> {

    public Frontend {
        Objects.requireNonNull(name, "name must not be null");
        spreads = List.copyOf(spreads);
        binds = List.copyOf(binds);
        acls = List.copyOf(acls);
        requestRules = List.copyOf(requestRules);
        responseRules = List.copyOf(responseRules);
        routes = List.copyOf(routes);
        directives = List.copyOf(directives);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FRONTEND;
    }

    @Override
    public Frontend withProperties(Properties properties, Properties extras, List<String> spreads) {
        return new Frontend(
                name, properties, extras, spreads, binds, acls, requestRules, responseRules, routes, stickTable,
                directives, location);
    }
}
