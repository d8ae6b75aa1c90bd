package io.hapconf.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A named ACL, e.g. {@code acl is_api path_beg /api}.
 *
 * @param criterion fetch and match method, e.g. {@code path_beg} or {@code hdr(host) -i}
 * @param values    patterns to match
 */
public record Acl(String name, String criterion, List<Value> values, SourceLocation location) implements IrNode {

    public Acl {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(criterion, "criterion must not be null");
        values = List.copyOf(values);
    }
}
