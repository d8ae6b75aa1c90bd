package io.hapconf.core.model;

import java.util.List;
import java.util.Objects;

/** An {@code http-request} rule. */
public record RequestRule(
        String action, List<Value> args, Properties params, Condition condition, SourceLocation location)
        implements HttpRule {

    public RequestRule {
        Objects.requireNonNull(action, "action must not be null");
        args = List.copyOf(args);
    }

    @Override
    public String directive() {
        return "http-request";
    }
}
