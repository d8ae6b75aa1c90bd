package io.hapconf.core.model;

import java.util.List;

/**
 * The {@code defaults} section.
 *
 * @param healthCheck optional default health check, or {@code null}
 */
public record Defaults(
        Properties properties,
        Properties extras,
        List<String> spreads,
        HealthCheck healthCheck,
        List<Directive> directives,
        SourceLocation location)
        implements Spreadable<Defaults> {

    public Defaults {
        spreads = List.copyOf(spreads);
        directives = List.copyOf(directives);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DEFAULTS;
    }

    @Override
    public Defaults withProperties(Properties properties, Properties extras, List<String> spreads) {
        return new Defaults(properties, extras, spreads, healthCheck, directives, location);
    }

    public Defaults withHealthCheck(HealthCheck check) {
        return new Defaults(properties, extras, spreads, check, directives, location);
    }
}
