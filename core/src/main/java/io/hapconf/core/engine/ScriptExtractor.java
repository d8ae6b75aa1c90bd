package io.hapconf.core.engine;

import io.hapconf.core.model.Config;
import io.hapconf.core.model.LuaScript;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lifts inline Lua scripts out of the IR. Each inline script becomes an {@link ExtractedScript}
 * and its IR node is rewritten into a file reference to {@code <scriptDirectory>/<name>.lua}.
 * File scripts ({@code load "path"}) are left untouched. Performs no I/O.
 */
public final class ScriptExtractor {

    private final String scriptDirectory;

    public ScriptExtractor(String scriptDirectory) {
        this.scriptDirectory = Objects.requireNonNull(scriptDirectory, "scriptDirectory must not be null");
    }

    /** The rewritten config and the scripts lifted out of it. */
    public record Extraction(Config config, List<ExtractedScript> scripts) {
        public Extraction {
            scripts = List.copyOf(scripts);
        }
    }

    public Extraction extract(Config config) {
        List<ExtractedScript> scripts = new ArrayList<>();
        List<LuaScript> rewritten = new ArrayList<>(config.luaScripts().size());
        for (LuaScript script : config.luaScripts()) {
            if (script.source() == LuaScript.LuaSource.INLINE) {
                String path = pathFor(script.name());
                scripts.add(new ExtractedScript(script.name(), script.content(), path));
                rewritten.add(new LuaScript(script.name(), LuaScript.LuaSource.FILE, path, script.location()));
            } else {
                rewritten.add(script);
            }
        }
        if (scripts.isEmpty()) {
            return new Extraction(config, scripts);
        }
        return new Extraction(config.withLuaScripts(rewritten), scripts);
    }

    String pathFor(String name) {
        String dir = scriptDirectory.endsWith("/")
                ? scriptDirectory.substring(0, scriptDirectory.length() - 1)
                : scriptDirectory;
        return dir + "/" + name + ".lua";
    }
}
