package io.hapconf.core.spi;

import io.hapconf.core.model.Config;
import java.util.Set;

/**
 * Pluggable source format. An implementation turns source text written in one configuration
 * language into the unexpanded IR; every later pipeline stage is shared.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe.
 */
public interface ConfigFormat {

    /**
     * Returns the format identifier, e.g. {@code "dsl"}.
     *
     * @return a non-null, non-empty identifier (lowercase, no spaces)
     */
    String id();

    /** File extensions handled by this format, without the leading dot. */
    Set<String> fileExtensions();

    /**
     * Parses {@code source} and builds its IR. Loops, spreads and interpolations are left in place.
     *
     * @param source     the source text
     * @param sourceName name used in error locations, typically the file name
     * @return the unexpanded IR
     * @throws io.hapconf.core.error.ParseException if the text is malformed
     * @throws io.hapconf.core.error.BuildException if the tree has an invalid shape
     */
    Config read(String source, String sourceName);
}
