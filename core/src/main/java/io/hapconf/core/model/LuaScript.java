package io.hapconf.core.model;

import java.util.Objects;

/**
 * A Lua script: either inline source that must be extracted to a file, or a file path loaded as
 * is.
 *
 * @param content Lua source for {@link LuaSource#INLINE}, a file path for {@link LuaSource#FILE}
 */
public record LuaScript(String name, LuaSource source, String content, SourceLocation location) implements IrNode {

    /** Where the script body lives. */
    public enum LuaSource {
        INLINE,
        FILE
    }

    public LuaScript {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
