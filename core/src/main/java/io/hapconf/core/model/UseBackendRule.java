package io.hapconf.core.model;

import java.util.Objects;

/**
 * Conditional routing to a backend: {@code use_backend NAME [if|unless COND]}.
 *
 * @param condition the routing condition, or {@code null} for unconditional routing
 */
public record UseBackendRule(String backend, Condition condition, SourceLocation location) implements IrNode {

    public UseBackendRule {
        Objects.requireNonNull(backend, "backend must not be null");
    }
}
