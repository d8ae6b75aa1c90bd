package io.hapconf.core.model;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Immutable, insertion-ordered map of property name to {@link Value}. Keys use the internal
 * {@code snake_case} spelling ({@code timeout_connect}, {@code hash_type}).
 *
 * <p>
 * Every mutator returns a new instance; the receiver is never changed.
 */
public final class Properties implements Iterable<Map.Entry<String, Value>> {

    private static final Properties EMPTY = new Properties(Map.of());

    private final Map<String, Value> entries;

    private Properties(Map<String, Value> entries) {
        this.entries = entries;
    }

    public static Properties empty() {
        return EMPTY;
    }

    public static Properties of(Map<String, Value> entries) {
        if (entries.isEmpty()) {
            return EMPTY;
        }
        return new Properties(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }

    public Optional<Value> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean has(String key) {
        return entries.containsKey(key);
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public Map<String, Value> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Returns a copy with {@code key} set to {@code value}, keeping the key's position if present. */
    public Properties with(String key, Value value) {
        Objects.requireNonNull(value, "value must not be null");
        Map<String, Value> copy = new LinkedHashMap<>(entries);
        copy.put(key, value);
        return new Properties(Collections.unmodifiableMap(copy));
    }

    public Properties without(String key) {
        if (!entries.containsKey(key)) {
            return this;
        }
        Map<String, Value> copy = new LinkedHashMap<>(entries);
        copy.remove(key);
        return copy.isEmpty() ? EMPTY : new Properties(Collections.unmodifiableMap(copy));
    }

    /**
     * Merges {@code base} underneath this map: keys present here keep their value and position,
     * keys only in {@code base} are appended in base order.
     */
    public Properties withDefaults(Properties base) {
        if (base.isEmpty()) {
            return this;
        }
        Map<String, Value> merged = new LinkedHashMap<>(entries);
        for (Map.Entry<String, Value> e : base.entries.entrySet()) {
            merged.putIfAbsent(e.getKey(), e.getValue());
        }
        return new Properties(Collections.unmodifiableMap(merged));
    }

    /** Applies {@code fn} to every value, preserving key order. */
    public Properties mapValues(UnaryOperator<Value> fn) {
        if (entries.isEmpty()) {
            return this;
        }
        Map<String, Value> mapped = new LinkedHashMap<>();
        for (Map.Entry<String, Value> e : entries.entrySet()) {
            mapped.put(e.getKey(), fn.apply(e.getValue()));
        }
        return new Properties(Collections.unmodifiableMap(mapped));
    }

    @Override
    public Iterator<Map.Entry<String, Value>> iterator() {
        return entries.entrySet().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Properties other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
