package io.hapconf.core.model;

import java.util.List;
import java.util.Objects;

/** What a {@link ForLoop} iterates over. */
public sealed interface Iteration {

    /**
     * Inclusive integer range {@code from..to}. Bounds are values so that a nested loop may use
     * an outer loop variable, e.g. {@code 1..${n}}.
     */
    record Range(Value from, Value to) implements Iteration {
        public Range {
            Objects.requireNonNull(from, "from must not be null");
            Objects.requireNonNull(to, "to must not be null");
        }
    }

    /** Explicit list of items, e.g. {@code ["us-east", "eu-west"]}. */
    record Items(List<Value> items) implements Iteration {
        public Items {
            items = List.copyOf(items);
        }
    }
}
