package io.hapconf.core.engine;

import java.util.Objects;

/**
 * Tunables of one translation run.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxResolutionPasses upper bound on variable resolution passes before a cycle is reported
 *                            (default: 10)
 * @param indent              indentation of lines inside a section (default: four spaces)
 * @param scriptDirectory     relative directory for extracted Lua scripts (default: {@code lua})
 * @param format              id of the source format in the {@link ParserRegistry} (default:
 *                            {@code dsl})
 */
public record TranslatorOptions(int maxResolutionPasses, String indent, String scriptDirectory, String format) {

    /** Default options: 10 passes, four-space indent, scripts under {@code lua/}, DSL input. */
    public static final TranslatorOptions DEFAULT = new TranslatorOptions(10, "    ", "lua", "dsl");

    public TranslatorOptions {
        if (maxResolutionPasses <= 0) {
            throw new IllegalArgumentException("maxResolutionPasses must be positive, got: " + maxResolutionPasses);
        }
        Objects.requireNonNull(indent, "indent must not be null");
        if (!indent.isEmpty() && !indent.isBlank()) {
            throw new IllegalArgumentException("indent must contain only whitespace, got: '" + indent + "'");
        }
        Objects.requireNonNull(scriptDirectory, "scriptDirectory must not be null");
        if (scriptDirectory.isBlank()) {
            throw new IllegalArgumentException("scriptDirectory must not be blank");
        }
        Objects.requireNonNull(format, "format must not be null");
    }

    public TranslatorOptions withScriptDirectory(String directory) {
        return new TranslatorOptions(maxResolutionPasses, indent, directory, format);
    }

    public TranslatorOptions withFormat(String formatId) {
        return new TranslatorOptions(maxResolutionPasses, indent, scriptDirectory, formatId);
    }
}
