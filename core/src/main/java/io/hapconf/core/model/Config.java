package io.hapconf.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root of the IR. Owns every other node; cross references between nodes (backend, ACL and
 * template names) are by name only.
 *
 * @param name       config name from {@code config NAME { ... }}
 * @param properties config-level properties such as {@code version}
 * @param global     the {@code global} section, or {@code null} if absent
 * @param defaults   the {@code defaults} section, or {@code null} if absent
 * @param sections   frontends, backends, listens and section loops in declaration order
 * @param templates  reusable property sets
 * @param variables  {@code let} bindings in declaration order
 * @param luaScripts inline and file Lua scripts
 * @param location   where the config was declared
 */
public record Config(
        String name,
        Properties properties,
        GlobalSettings global,
        Defaults defaults,
        List<SectionEntry> sections,
        List<Template> templates,
        List<VariableBinding> variables,
        List<LuaScript> luaScripts,
        SourceLocation location)
        implements IrNode {

    public Config {
        Objects.requireNonNull(name, "name must not be null");
        properties = properties != null ? properties : Properties.empty();
        sections = List.copyOf(sections);
        templates = List.copyOf(templates);
        variables = List.copyOf(variables);
        luaScripts = List.copyOf(luaScripts);
    }

    public List<Frontend> frontends() {
        return ofType(Frontend.class);
    }

    public List<Backend> backends() {
        return ofType(Backend.class);
    }

    public List<Listen> listens() {
        return ofType(Listen.class);
    }

    /** Returns {@code true} while section loops remain in the tree. */
    public boolean hasLoops() {
        return sections.stream().anyMatch(ForLoop.class::isInstance);
    }

    public Config withSections(List<SectionEntry> newSections) {
        return new Config(name, properties, global, defaults, newSections, templates, variables, luaScripts, location);
    }

    public Config withGlobal(GlobalSettings newGlobal) {
        return new Config(name, properties, newGlobal, defaults, sections, templates, variables, luaScripts, location);
    }

    public Config withLuaScripts(List<LuaScript> scripts) {
        return new Config(name, properties, global, defaults, sections, templates, variables, scripts, location);
    }

    private <T> List<T> ofType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (SectionEntry entry : sections) {
            if (type.isInstance(entry)) {
                result.add(type.cast(entry));
            }
        }
        return result;
    }
}
