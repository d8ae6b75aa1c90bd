package io.hapconf.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A named reusable property set, merged into nodes that spread it with {@code @name}.
 *
 * <p>
 * Properties are kept unsplit because the same template may be spread into nodes of different
 * kinds. {@code spreads} is non-empty only for an (invalid) template chain.
 */
public record Template(String name, Properties properties, List<String> spreads, SourceLocation location)
        implements IrNode {

    public Template {
        Objects.requireNonNull(name, "name must not be null");
        spreads = List.copyOf(spreads);
    }
}
