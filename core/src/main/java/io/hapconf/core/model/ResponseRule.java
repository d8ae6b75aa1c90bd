package io.hapconf.core.model;

import java.util.List;
import java.util.Objects;

/** An {@code http-response} rule. */
public record ResponseRule(
        String action, List<Value> args, Properties params, Condition condition, SourceLocation location)
        implements HttpRule {

    public ResponseRule {
        Objects.requireNonNull(action, "action must not be null");
        args = List.copyOf(args);
    }

    @Override
    public String directive() {
        return "http-response";
    }
}
