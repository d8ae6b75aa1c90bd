package io.hapconf.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.UnaryOperator;

/**
 * A typed property value in the IR.
 *
 * <p>
 * Implementations are a sealed hierarchy. Two variants are <em>unresolved</em>: {@link
 * Interpolated} (text still containing {@code ${...}} expressions) and {@link EnvRef} (an
 * environment lookup not yet performed). Every other variant is concrete. The variable resolver
 * guarantees that no unresolved value survives into code generation.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface Value {

    /** Returns {@code true} if this value and everything nested in it is concrete. */
    boolean isResolved();

    /** Returns the plain textual form of a scalar, as it would be substituted into a string. */
    String asText();

    /** Returns the integer content of this value, if it has one. */
    default OptionalLong asLong() {
        return OptionalLong.empty();
    }

    /** Applies {@code fn} to every element of a container, or to this value for scalars. */
    default Value mapLeaves(UnaryOperator<Value> fn) {
        return fn.apply(this);
    }

    static Value str(String text) {
        return new Str(text);
    }

    static Value num(long value) {
        return new Num(value);
    }

    static Value bool(boolean value) {
        return new Bool(value);
    }

    static Value ident(String name) {
        return new Ident(name);
    }

    static Value list(List<Value> items) {
        return new ListValue(items);
    }

    // ── Implementations ──

    /** Literal string (quotes already removed, escapes decoded). */
    record Str(String text) implements Value {
        public Str {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public boolean isResolved() {
            return true;
        }

        @Override
        public String asText() {
            return text;
        }

        @Override
        public OptionalLong asLong() {
            try {
                return OptionalLong.of(Long.parseLong(text.trim()));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
    }

    /** Integer literal. */
    record Num(long value) implements Value {
        @Override
        public boolean isResolved() {
            return true;
        }

        @Override
        public String asText() {
            return Long.toString(value);
        }

        @Override
        public OptionalLong asLong() {
            return OptionalLong.of(value);
        }
    }

    /** Boolean literal; rendered by presence or absence of a keyword. */
    record Bool(boolean value) implements Value {
        @Override
        public boolean isResolved() {
            return true;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }

    /**
     * Number with a time unit, e.g. {@code 3s} or {@code 500ms}.
     *
     * @param amount magnitude, may be zero or negative before validation
     * @param unit   one of {@code us ms s m h d}
     */
    record Duration(long amount, String unit) implements Value {

        /** Recognised units, finest first. */
        public static final List<String> UNITS = List.of("us", "ms", "s", "m", "h", "d");

        public Duration {
            if (!UNITS.contains(unit)) {
                throw new IllegalArgumentException("Unknown duration unit: '" + unit + "'");
            }
        }

        /** The duration expressed in microseconds. */
        public long toMicros() {
            return amount * microsPerUnit(unit);
        }

        /** Builds a duration of {@code micros} expressed in {@code unit}, truncating. */
        public static Duration ofMicros(long micros, String unit) {
            return new Duration(micros / microsPerUnit(unit), unit);
        }

        public static long microsPerUnit(String unit) {
            switch (unit) {
                case "us":
                    return 1L;
                case "ms":
                    return 1_000L;
                case "s":
                    return 1_000_000L;
                case "m":
                    return 60_000_000L;
                case "h":
                    return 3_600_000_000L;
                case "d":
                    return 86_400_000_000L;
                default:
                    throw new IllegalArgumentException("Unknown duration unit: '" + unit + "'");
            }
        }

        @Override
        public boolean isResolved() {
            return true;
        }

        @Override
        public String asText() {
            return amount + unit;
        }
    }

    /** Bare word: enum literal, keyword or unquoted identifier. */
    record Ident(String name) implements Value {
        public Ident {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public boolean isResolved() {
            return true;
        }

        @Override
        public String asText() {
            return name;
        }

        @Override
        public OptionalLong asLong() {
            return new Str(name).asLong();
        }
    }

    /** Ordered list of values. */
    record ListValue(List<Value> items) implements Value {
        public ListValue {
            items = List.copyOf(items);
        }

        @Override
        public boolean isResolved() {
            for (Value item : items) {
                if (!item.isResolved()) return false;
            }
            return true;
        }

        @Override
        public String asText() {
            List<String> parts = new ArrayList<>(items.size());
            for (Value item : items) {
                parts.add(item.asText());
            }
            return String.join(" ", parts);
        }

        @Override
        public Value mapLeaves(UnaryOperator<Value> fn) {
            List<Value> mapped = new ArrayList<>(items.size());
            for (Value item : items) {
                mapped.add(item.mapLeaves(fn));
            }
            return new ListValue(mapped);
        }
    }

    /** Nested object with insertion-ordered keys. */
    record ObjectValue(Map<String, Value> entries) implements Value {
        public ObjectValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public boolean isResolved() {
            for (Value v : entries.values()) {
                if (!v.isResolved()) return false;
            }
            return true;
        }

        @Override
        public String asText() {
            List<String> parts = new ArrayList<>(entries.size());
            entries.forEach((k, v) -> parts.add(k + " " + v.asText()));
            return String.join(" ", parts);
        }

        @Override
        public Value mapLeaves(UnaryOperator<Value> fn) {
            Map<String, Value> mapped = new LinkedHashMap<>();
            entries.forEach((k, v) -> mapped.put(k, v.mapLeaves(fn)));
            return new ObjectValue(mapped);
        }
    }

    /**
     * Text containing one or more {@code ${expr}} interpolations. A literal dollar sign is kept
     * escaped as {@code \$} until resolution.
     */
    record Interpolated(String template) implements Value {
        public Interpolated {
            Objects.requireNonNull(template, "template must not be null");
        }

        @Override
        public boolean isResolved() {
            return false;
        }

        @Override
        public String asText() {
            return template;
        }
    }

    /**
     * Environment lookup, written {@code env("NAME")} or {@code env("NAME", default)}.
     *
     * @param variable     environment variable name
     * @param defaultValue literal used when the variable is unset, or {@code null}
     */
    record EnvRef(String variable, Value defaultValue) implements Value {
        public EnvRef {
            Objects.requireNonNull(variable, "variable must not be null");
        }

        @Override
        public boolean isResolved() {
            return false;
        }

        @Override
        public String asText() {
            return defaultValue == null
                    ? "env(\"" + variable + "\")"
                    : "env(\"" + variable + "\", " + defaultValue.asText() + ")";
        }
    }
}
