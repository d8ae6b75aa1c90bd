package io.hapconf.core.model;

import java.util.List;

/** An HTTP {@code health-check} block of a defaults, backend or listen section. */
public record HealthCheck(Properties properties, Properties extras, List<String> spreads, SourceLocation location)
        implements Spreadable<HealthCheck> {

    public HealthCheck {
        spreads = List.copyOf(spreads);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.HEALTH_CHECK;
    }

    @Override
    public HealthCheck withProperties(Properties properties, Properties extras, List<String> spreads) {
        return new HealthCheck(properties, extras, spreads, location);
    }
}
