package io.hapconf.core.catalog;

import io.hapconf.core.model.Value;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The set of values a catalog property accepts. {@link #check(Value)} returns a description of the
 * violation, or empty when the value is acceptable. Containers are checked item by item.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface ValueDomain {

    /** Checks a single resolved value. */
    Optional<String> check(Value value);

    ValueDomain ANY = new Any();
    ValueDomain FLAG = new Flag();
    ValueDomain POSITIVE_DURATION = new PositiveDuration();
    ValueDomain PORT = new IntRange(1, 65535);
    ValueDomain HTTP_STATUS = new IntRange(100, 599);
    ValueDomain NON_NEGATIVE = new IntRange(0, Long.MAX_VALUE);
    ValueDomain POSITIVE = new IntRange(1, Long.MAX_VALUE);

    static ValueDomain range(long min, long max) {
        return new IntRange(min, max);
    }

    static ValueDomain oneOf(String... members) {
        return new OneOf(Set.of(members), List.of());
    }

    // ── Implementations ──

    /** Accepts anything. */
    record Any() implements ValueDomain {
        @Override
        public Optional<String> check(Value value) {
            return Optional.empty();
        }
    }

    /** Accepts booleans only. */
    record Flag() implements ValueDomain {
        @Override
        public Optional<String> check(Value value) {
            if (value instanceof Value.Bool) {
                return Optional.empty();
            }
            return Optional.of("expected true or false, got '" + value.asText() + "'");
        }
    }

    /** Integer within {@code [min, max]}; numeric strings are accepted (environment values). */
    record IntRange(long min, long max) implements ValueDomain {
        public IntRange {
            if (min > max) {
                throw new IllegalArgumentException("min must not exceed max: " + min + ">" + max);
            }
        }

        @Override
        public Optional<String> check(Value value) {
            OptionalLong n = value.asLong();
            if (n.isEmpty()) {
                return Optional.of("expected an integer, got '" + value.asText() + "'");
            }
            long v = n.getAsLong();
            if (v < min || v > max) {
                if (max == Long.MAX_VALUE) {
                    return Optional.of("value " + v + " must be at least " + min);
                }
                return Optional.of("value " + v + " is outside the range " + min + "-" + max);
            }
            return Optional.empty();
        }
    }

    /** Duration greater than zero. A bare integer counts as milliseconds, as the target reads it. */
    record PositiveDuration() implements ValueDomain {
        private static final Pattern DURATION_TEXT = Pattern.compile("(\\d+)(us|ms|s|m|h|d)");

        @Override
        public Optional<String> check(Value value) {
            if (value instanceof Value.Duration d) {
                return d.amount() > 0
                        ? Optional.empty()
                        : Optional.of("duration " + d.asText() + " must be positive");
            }
            OptionalLong n = value.asLong();
            if (n.isPresent()) {
                return n.getAsLong() > 0
                        ? Optional.empty()
                        : Optional.of("duration " + n.getAsLong() + " must be positive");
            }
            Matcher m = DURATION_TEXT.matcher(value.asText());
            if (value.isResolved() && !(value instanceof Value.ListValue) && m.matches()) {
                return Long.parseLong(m.group(1)) > 0
                        ? Optional.empty()
                        : Optional.of("duration " + value.asText() + " must be positive");
            }
            return Optional.of("expected a duration, got '" + value.asText() + "'");
        }
    }

    /**
     * Closed set of words. {@code patterns} admit parameterized members such as {@code hdr(host)}.
     */
    record OneOf(Set<String> members, List<Pattern> patterns) implements ValueDomain {
        public OneOf {
            members = Set.copyOf(members);
            patterns = List.copyOf(patterns);
        }

        @Override
        public Optional<String> check(Value value) {
            String text = value.asText();
            if (members.contains(text)) {
                return Optional.empty();
            }
            for (Pattern p : patterns) {
                if (p.matcher(text).matches()) {
                    return Optional.empty();
                }
            }
            return Optional.of("'" + text + "' is not one of " + new TreeSet<>(members));
        }
    }
}
