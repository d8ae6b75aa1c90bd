package io.hapconf.core.engine;

import io.hapconf.core.spi.ConfigFormat;
import io.hapconf.core.syntax.DslFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of source formats, keyed by format id. Built once at startup and handed to the {@link
 * Translator}; there is no process-wide instance. Thread-safe.
 */
public final class ParserRegistry {

    private final Map<String, ConfigFormat> formats = new ConcurrentHashMap<>();

    /** Returns a registry holding the built-in DSL format. */
    public static ParserRegistry withDefaults() {
        ParserRegistry registry = new ParserRegistry();
        registry.register(new DslFormat());
        return registry;
    }

    /**
     * Registers a format. A format with the same id is replaced.
     *
     * @throws NullPointerException if format or format.id() is null
     * @throws IllegalArgumentException if format.id() is empty
     */
    public void register(ConfigFormat format) {
        if (format == null) {
            throw new NullPointerException("format must not be null");
        }
        String id = format.id();
        if (id == null) {
            throw new NullPointerException("format id must not be null");
        }
        if (id.isEmpty()) {
            throw new IllegalArgumentException("format id must not be empty");
        }
        formats.put(id, format);
    }

    public Optional<ConfigFormat> getFormat(String formatId) {
        return Optional.ofNullable(formats.get(formatId));
    }

    /**
     * Looks up a format by id, throwing if not found.
     *
     * @throws IllegalArgumentException if no format is registered with the given id
     */
    public ConfigFormat requireFormat(String formatId) {
        return getFormat(formatId)
                .orElseThrow(() ->
                        new IllegalArgumentException("No config format registered for id: '" + formatId + "'"));
    }

    /** Finds the format handling a file name by its extension, case-insensitively. */
    public Optional<ConfigFormat> findByFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return formats.values().stream()
                .filter(f -> f.fileExtensions().contains(extension))
                .sorted((a, b) -> a.id().compareTo(b.id()))
                .findFirst();
    }

    public int size() {
        return formats.size();
    }

    public boolean hasFormat(String formatId) {
        return formats.containsKey(formatId);
    }
}
