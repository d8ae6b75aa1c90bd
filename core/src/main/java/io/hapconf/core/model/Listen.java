package io.hapconf.core.model;

import java.util.List;
import java.util.Objects;

/** A {@code listen} section: frontend and backend combined in one proxy. */
public record Listen(
        String name,
        Properties properties,
        Properties extras,
        List<String> spreads,
        List<Bind> binds,
        List<Acl> acls,
        List<RequestRule> requestRules,
        List<ResponseRule> responseRules,
        List<UseBackendRule> routes,
        HealthCheck healthCheck,
        StickTable stickTable,
        List<ServerEntry> servers,
        List<Directive> directives,
        SourceLocation location)
        implements SectionEntry, Spreadable<Listen> {

    public Listen {
        Objects.requireNonNull(name, "name must not be null");
        spreads = List.copyOf(spreads);
        binds = List.copyOf(binds);
        acls = List.copyOf(acls);
        requestRules = List.copyOf(requestRules);
        responseRules = List.copyOf(responseRules);
        routes = List.copyOf(routes);
        servers = List.copyOf(servers);
        directives = List.copyOf(directives);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LISTEN;
    }

    @Override
    public Listen withProperties(Properties properties, Properties extras, List<String> spreads) {
        return new Listen(
                name, properties, extras, spreads, binds, acls, requestRules, responseRules, routes, healthCheck,
                stickTable, servers, directives, location);
    }

    public Listen withServers(List<ServerEntry> newServers) {
        return new Listen(
                name, properties, extras, spreads, binds, acls, requestRules, responseRules, routes, healthCheck,
                stickTable, newServers, directives, location);
    }

    public Listen withHealthCheck(HealthCheck check) {
        return new Listen(
                name, properties, extras, spreads, binds, acls, requestRules, responseRules, routes, check,
                stickTable, servers, directives, location);
    }
}
