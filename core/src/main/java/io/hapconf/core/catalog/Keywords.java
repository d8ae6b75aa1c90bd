package io.hapconf.core.catalog;

import java.util.Set;

/** Spelling conversions between DSL keys and target keywords. */
public final class Keywords {

    /** Target keywords that really contain an underscore. */
    private static final Set<String> UNDERSCORE_KEYWORDS = Set.of("default_backend", "use_backend");

    private Keywords() {}

    /** Normalizes a DSL key to the internal form: {@code hash-type} becomes {@code hash_type}. */
    public static String normalizeKey(String key) {
        return key.replace('-', '_');
    }

    /**
     * Maps an internal key to the target keyword. Underscores become hyphens, except for keywords
     * that contain one natively; {@code timeout_x} becomes {@code timeout x} and a flattened block
     * key {@code compression.algo} becomes {@code compression algo}.
     */
    public static String toKeyword(String key) {
        if (UNDERSCORE_KEYWORDS.contains(key)) {
            return key;
        }
        if (key.startsWith("timeout_")) {
            return "timeout " + key.substring("timeout_".length()).replace('_', '-');
        }
        return key.replace('_', '-').replace('.', ' ');
    }

    /**
     * Maps an HTTP rule action to the target spelling. Lua actions ({@code lua.fn}) keep their
     * name as written.
     */
    public static String toAction(String action) {
        if (action.startsWith("lua.")) {
            return action;
        }
        return action.replace('_', '-');
    }
}
