package io.hapconf.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A {@code backend} section: a named server pool.
 *
 * @param healthCheck optional health check, or {@code null}
 * @param stickTable  optional stick table, or {@code null}
 * @param servers     servers, server templates and server loops in declaration order
 */
public record Backend(
        String name,
        Properties properties,
        Properties extras,
        List<String> spreads,
        List<Acl> acls,
        List<RequestRule> requestRules,
        List<ResponseRule> responseRules,
        HealthCheck healthCheck,
        StickTable stickTable,
        List<ServerEntry> servers,
        List<Directive> directives,
        SourceLocation location)
        implements SectionEntry, Spreadable<Backend> {

    public Backend {
        Objects.requireNonNull(name, "name must not be null");
        spreads = List.copyOf(spreads);
        acls = List.copyOf(acls);
        requestRules = List.copyOf(requestRules);
        responseRules = List.copyOf(responseRules);
        servers = List.copyOf(servers);
        directives = List.copyOf(directives);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BACKEND;
    }

    @Override
    public Backend withProperties(Properties properties, Properties extras, List<String> spreads) {
        return new Backend(
                name, properties, extras, spreads, acls, requestRules, responseRules, healthCheck, stickTable, servers,
                directives, location);
    }

    public Backend withServers(List<ServerEntry> newServers) {
        return new Backend(
                name, properties, extras, spreads, acls, requestRules, responseRules, healthCheck, stickTable,
                newServers, directives, location);
    }

    public Backend withHealthCheck(HealthCheck check) {
        return new Backend(
                name, properties, extras, spreads, acls, requestRules, responseRules, check, stickTable, servers,
                directives, location);
    }

    /** Concrete servers only; loops and server templates are skipped. */
    public List<Server> concreteServers() {
        List<Server> result = new ArrayList<>();
        for (ServerEntry entry : servers) {
            if (entry instanceof Server server) {
                result.add(server);
            }
        }
        return result;
    }
}
