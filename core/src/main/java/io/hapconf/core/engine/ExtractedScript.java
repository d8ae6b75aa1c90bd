package io.hapconf.core.engine;

import java.util.Objects;

/**
 * An inline Lua script lifted out of the configuration, to be written beside the generated
 * output.
 *
 * @param name script name as declared
 * @param body script source, dedented
 * @param path relative path the generated {@code lua-load} line points at
 */
public record ExtractedScript(String name, String body, String path) {

    public ExtractedScript {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(path, "path must not be null");
    }
}
