package io.hapconf.core.model;

import java.util.List;

/** The {@code global} section. */
public record GlobalSettings(
        Properties properties,
        Properties extras,
        List<String> spreads,
        List<Directive> directives,
        SourceLocation location)
        implements Spreadable<GlobalSettings> {

    public GlobalSettings {
        spreads = List.copyOf(spreads);
        directives = List.copyOf(directives);
    }

    public static GlobalSettings empty(SourceLocation location) {
        return new GlobalSettings(Properties.empty(), Properties.empty(), List.of(), List.of(), location);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.GLOBAL;
    }

    @Override
    public GlobalSettings withProperties(Properties properties, Properties extras, List<String> spreads) {
        return new GlobalSettings(properties, extras, spreads, directives, location);
    }
}
