package io.hapconf.core.codegen;

import io.hapconf.core.catalog.Keywords;
import io.hapconf.core.catalog.PropertyCatalog;
import io.hapconf.core.catalog.PropertySpec;
import io.hapconf.core.error.InternalTranslationException;
import io.hapconf.core.model.Acl;
import io.hapconf.core.model.Backend;
import io.hapconf.core.model.Bind;
import io.hapconf.core.model.Config;
import io.hapconf.core.model.Defaults;
import io.hapconf.core.model.Directive;
import io.hapconf.core.model.Frontend;
import io.hapconf.core.model.GlobalSettings;
import io.hapconf.core.model.HealthCheck;
import io.hapconf.core.model.HttpRule;
import io.hapconf.core.model.Listen;
import io.hapconf.core.model.LuaScript;
import io.hapconf.core.model.NodeKind;
import io.hapconf.core.model.Properties;
import io.hapconf.core.model.SectionEntry;
import io.hapconf.core.model.Server;
import io.hapconf.core.model.ServerEntry;
import io.hapconf.core.model.ServerTemplate;
import io.hapconf.core.model.SourceLocation;
import io.hapconf.core.model.StickTable;
import io.hapconf.core.model.UseBackendRule;
import io.hapconf.core.model.Value;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Renders a fully resolved IR as HAProxy configuration text.
 *
 * <p>
 * Output layout is fixed: a comment header, then {@code global}, {@code defaults}, every
 * frontend, every backend and every listen section, each group in declaration order and each
 * section followed by one blank line. Within a section, modeled properties follow catalog order and
 * unmodeled ones follow declaration order.
 *
 * <p>
 * The generator is a pure function of its input. It never repairs the tree: an unresolved value,
 * a pending template spread, a remaining loop or an inline Lua script that was not extracted is a
 * broken pipeline invariant and fails with {@link InternalTranslationException}.
 *
 * <p>
 * Thread-safe.
 */
public final class HaproxyGenerator {

    /** Rule parameters rendered as their bare value. */
    private static final Set<String> BARE_PARAMS = Set.of("name", "header", "value", "fmt", "expr");

    private final PropertyCatalog catalog;
    private final String indent;

    public HaproxyGenerator(PropertyCatalog catalog, String indent) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.indent = Objects.requireNonNull(indent, "indent must not be null");
    }

    /**
     * Generates the configuration text.
     *
     * @throws InternalTranslationException if the tree still holds unresolved content
     */
    public String generate(Config config) {
        if (config.hasLoops()) {
            throw new InternalTranslationException(
                    "Unrolled loop reached the generator", config.location());
        }
        List<String> lines = new ArrayList<>();
        lines.add("# Generated HAProxy configuration: " + config.name());
        Optional<Value> version = config.properties().get("version");
        if (version.isPresent()) {
            lines.add("# Version: " + render(version.get(), config.location()));
        }
        lines.add("");

        if (config.global() != null || !config.luaScripts().isEmpty()) {
            GlobalSettings global = config.global() != null
                    ? config.global()
                    : GlobalSettings.empty(config.location());
            section(lines, "global", global(global, config.luaScripts()));
        }
        if (config.defaults() != null) {
            section(lines, "defaults", defaults(config.defaults()));
        }
        for (Frontend f : config.frontends()) {
            section(lines, "frontend " + f.name(), frontend(f));
        }
        for (Backend b : config.backends()) {
            section(lines, "backend " + b.name(), backend(b));
        }
        for (Listen l : config.listens()) {
            section(lines, "listen " + l.name(), listen(l));
        }
        return String.join("\n", lines);
    }

    private void section(List<String> out, String header, List<String> body) {
        out.add(header);
        for (String line : body) {
            out.add(indent + line);
        }
        out.add("");
    }

    // --- Sections ---

    private List<String> global(GlobalSettings g, List<LuaScript> scripts) {
        requireExpanded(g.spreads(), "global", g.location());
        List<String> body = new ArrayList<>();
        properties(body, NodeKind.GLOBAL, g.properties(), g.location(), false);
        extras(body, g.extras(), g.location());
        directives(body, g.directives());
        for (LuaScript script : scripts) {
            if (script.source() != LuaScript.LuaSource.FILE) {
                throw new InternalTranslationException(
                        "Inline Lua script '" + script.name() + "' was not extracted before generation",
                        script.location());
            }
            body.add("lua-load " + quoteIfNeeded(script.content()));
        }
        return body;
    }

    private List<String> defaults(Defaults d) {
        requireExpanded(d.spreads(), "defaults", d.location());
        List<String> body = new ArrayList<>();
        properties(body, NodeKind.DEFAULTS, d.properties(), d.location(), false);
        extras(body, d.extras(), d.location());
        directives(body, d.directives());
        healthCheck(body, d.healthCheck(), d.properties());
        properties(body, NodeKind.DEFAULTS, d.properties(), d.location(), true);
        return body;
    }

    private List<String> frontend(Frontend f) {
        requireExpanded(f.spreads(), "frontend '" + f.name() + "'", f.location());
        List<String> body = new ArrayList<>();
        for (Bind bind : f.binds()) {
            body.add(bind(bind));
        }
        properties(body, NodeKind.FRONTEND, f.properties(), f.location(), false);
        extras(body, f.extras(), f.location());
        directives(body, f.directives());
        stickTable(body, f.stickTable());
        acls(body, f.acls());
        rules(body, f.requestRules());
        rules(body, f.responseRules());
        routes(body, f.routes());
        properties(body, NodeKind.FRONTEND, f.properties(), f.location(), true);
        return body;
    }

    private List<String> backend(Backend b) {
        requireExpanded(b.spreads(), "backend '" + b.name() + "'", b.location());
        List<String> body = new ArrayList<>();
        properties(body, NodeKind.BACKEND, b.properties(), b.location(), false);
        extras(body, b.extras(), b.location());
        directives(body, b.directives());
        stickTable(body, b.stickTable());
        acls(body, b.acls());
        healthCheck(body, b.healthCheck(), b.properties());
        rules(body, b.requestRules());
        rules(body, b.responseRules());
        servers(body, b.servers());
        return body;
    }

    private List<String> listen(Listen l) {
        requireExpanded(l.spreads(), "listen '" + l.name() + "'", l.location());
        List<String> body = new ArrayList<>();
        for (Bind bind : l.binds()) {
            body.add(bind(bind));
        }
        properties(body, NodeKind.LISTEN, l.properties(), l.location(), false);
        extras(body, l.extras(), l.location());
        directives(body, l.directives());
        stickTable(body, l.stickTable());
        acls(body, l.acls());
        healthCheck(body, l.healthCheck(), l.properties());
        rules(body, l.requestRules());
        rules(body, l.responseRules());
        routes(body, l.routes());
        properties(body, NodeKind.LISTEN, l.properties(), l.location(), true);
        servers(body, l.servers());
        return body;
    }

    // --- Properties ---

    /** Appends the modeled properties of one group: regular ones, or the trailing ones. */
    private void properties(
            List<String> out, NodeKind kind, Properties props, SourceLocation location, boolean trailing) {
        for (PropertySpec spec : catalog.specsFor(kind)) {
            if (spec.trailing() != trailing) {
                continue;
            }
            Optional<Value> value = props.get(spec.key());
            if (value.isPresent()) {
                propertyLines(out, spec, value.get(), location);
            }
        }
    }

    private void propertyLines(List<String> out, PropertySpec spec, Value value, SourceLocation location) {
        switch (spec.rendering()) {
            case FLAG:
                if (isTrue(value)) {
                    out.add(spec.keyword());
                }
                break;
            case REPEATED:
                for (Value item : items(value)) {
                    out.add(spec.keyword() + " " + render(item, location));
                }
                break;
            case COMMA_JOINED:
                out.add(spec.keyword() + " " + join(value, ",", location));
                break;
            case KEYED_LINES:
                if (value instanceof Value.ObjectValue obj) {
                    for (Map.Entry<String, Value> e : obj.entries().entrySet()) {
                        out.add(spec.keyword() + " " + e.getKey() + " " + render(e.getValue(), location));
                    }
                } else {
                    for (Value item : items(value)) {
                        out.add(spec.keyword() + " " + render(item, location));
                    }
                }
                break;
            case SCALAR:
            case SPACE_JOINED:
            default:
                out.add(spec.keyword() + " " + join(value, " ", location));
        }
    }

    /** Unmodeled section keys, one line each; {@code false} flags are omitted. */
    private void extras(List<String> out, Properties extras, SourceLocation location) {
        for (Map.Entry<String, Value> e : extras) {
            String keyword = Keywords.toKeyword(e.getKey());
            Value value = e.getValue();
            if (value instanceof Value.Bool flag) {
                if (flag.value()) {
                    out.add(keyword);
                }
            } else if (value instanceof Value.ObjectValue obj) {
                for (Map.Entry<String, Value> entry : obj.entries().entrySet()) {
                    out.add(keyword + " " + Keywords.toKeyword(entry.getKey()) + " "
                            + render(entry.getValue(), location));
                }
            } else {
                out.add(keyword + " " + render(value, location));
            }
        }
    }

    /** Inline tokens for nodes rendered on a single line (servers, binds, stick tables). */
    private void inlineTokens(
            StringBuilder line, NodeKind kind, Properties props, Properties extras, SourceLocation location) {
        for (PropertySpec spec : catalog.specsFor(kind)) {
            if (spec.key().equals("address") || spec.key().equals("port")) {
                continue;
            }
            Optional<Value> value = props.get(spec.key());
            if (value.isEmpty()) {
                continue;
            }
            switch (spec.rendering()) {
                case FLAG:
                    if (isTrue(value.get())) {
                        line.append(' ').append(spec.keyword());
                    }
                    break;
                case COMMA_JOINED:
                    line.append(' ').append(spec.keyword()).append(' ').append(join(value.get(), ",", location));
                    break;
                default:
                    line.append(' ').append(spec.keyword()).append(' ').append(join(value.get(), " ", location));
            }
        }
        for (Map.Entry<String, Value> e : extras) {
            String keyword = Keywords.toKeyword(e.getKey());
            if (e.getValue() instanceof Value.Bool flag) {
                if (flag.value()) {
                    line.append(' ').append(keyword);
                }
            } else {
                line.append(' ').append(keyword).append(' ').append(render(e.getValue(), location));
            }
        }
    }

    // --- Nodes ---

    private String bind(Bind bind) {
        StringBuilder line = new StringBuilder("bind ").append(render(bind.address(), bind.location()));
        inlineTokens(line, NodeKind.BIND, bind.properties(), bind.extras(), bind.location());
        return line.toString();
    }

    private void acls(List<String> out, List<Acl> acls) {
        for (Acl acl : acls) {
            StringBuilder line = new StringBuilder("acl ").append(acl.name()).append(' ').append(acl.criterion());
            for (Value v : acl.values()) {
                line.append(' ').append(render(v, acl.location()));
            }
            out.add(line.toString());
        }
    }

    private void rules(List<String> out, List<? extends HttpRule> rules) {
        for (HttpRule rule : rules) {
            out.add(rule(rule));
        }
    }

    private String rule(HttpRule rule) {
        SourceLocation location = rule.location();
        Properties params = rule.params();
        StringBuilder line = new StringBuilder(rule.directive()).append(' ');
        String action = rule.action();
        if ((action.equals("set_var") || action.equals("unset_var") || action.equals("set-var")
                || action.equals("unset-var")) && params.has("var")) {
            line.append(Keywords.toAction(action))
                    .append('(')
                    .append(render(params.get("var").get(), location))
                    .append(')');
            params = params.without("var");
        } else {
            line.append(Keywords.toAction(action));
        }
        for (Value arg : rule.args()) {
            line.append(' ').append(render(arg, location));
        }
        for (Map.Entry<String, Value> e : params) {
            line.append(' ');
            if (!BARE_PARAMS.contains(e.getKey())) {
                line.append(e.getKey()).append(' ');
            }
            line.append(render(e.getValue(), location));
        }
        if (rule.condition() != null) {
            line.append(' ').append(rule.condition().render());
        }
        return line.toString();
    }

    private void routes(List<String> out, List<UseBackendRule> routes) {
        for (UseBackendRule route : routes) {
            String line = "use_backend " + route.backend();
            out.add(route.condition() == null ? line : line + " " + route.condition().render());
        }
    }

    private void stickTable(List<String> out, StickTable table) {
        if (table == null) {
            return;
        }
        StringBuilder line = new StringBuilder("stick-table");
        inlineTokens(line, NodeKind.STICK_TABLE, table.properties(), table.extras(), table.location());
        out.add(line.toString());
    }

    /**
     * Health-check lines. {@code option httpchk} is emitted unless the section's options already
     * carry it.
     */
    private void healthCheck(List<String> out, HealthCheck hc, Properties sectionProps) {
        if (hc == null) {
            return;
        }
        requireExpanded(hc.spreads(), "health-check", hc.location());
        SourceLocation location = hc.location();
        Properties p = hc.properties();
        boolean hasHttpchk = false;
        for (Value option : items(sectionProps.get("option").orElse(new Value.ListValue(List.of())))) {
            if (option.asText().equals("httpchk") || option.asText().startsWith("httpchk ")) {
                hasHttpchk = true;
            }
        }
        if (!hasHttpchk) {
            out.add("option httpchk");
        }

        StringBuilder send = new StringBuilder("http-check send");
        p.get("method").ifPresent(v -> send.append(" meth ").append(render(v, location)));
        p.get("uri").ifPresent(v -> send.append(" uri ").append(render(v, location)));
        p.get("version").ifPresent(v -> send.append(" ver ").append(render(v, location)));
        Optional<Value> headers = p.get("headers");
        if (headers.isPresent() && headers.get() instanceof Value.ObjectValue obj) {
            for (Map.Entry<String, Value> e : obj.entries().entrySet()) {
                send.append(" hdr ").append(e.getKey()).append(' ').append(quote(text(e.getValue(), location)));
            }
        }
        if (send.length() > "http-check send".length()) {
            out.add(send.toString());
        }

        p.get("expect_status").ifPresent(v -> out.add("http-check expect status " + render(v, location)));
        p.get("expect_rstatus").ifPresent(v -> out.add("http-check expect rstatus " + render(v, location)));
        p.get("expect_string").ifPresent(v -> out.add("http-check expect string " + render(v, location)));
        p.get("expect_rstring").ifPresent(v -> out.add("http-check expect rstring " + render(v, location)));

        for (Map.Entry<String, Value> e : hc.extras()) {
            String keyword = "http-check " + Keywords.toKeyword(e.getKey());
            if (e.getValue() instanceof Value.Bool flag) {
                if (flag.value()) {
                    out.add(keyword);
                }
            } else {
                out.add(keyword + " " + render(e.getValue(), location));
            }
        }
    }

    private void servers(List<String> out, List<ServerEntry> servers) {
        for (ServerEntry entry : servers) {
            if (entry instanceof Server s) {
                requireExpanded(s.spreads(), "server '" + s.name() + "'", s.location());
                StringBuilder line = new StringBuilder("server ")
                        .append(s.name())
                        .append(' ')
                        .append(address(s.properties(), s.location()));
                inlineTokens(line, NodeKind.SERVER, s.properties(), s.extras(), s.location());
                out.add(line.toString());
            } else if (entry instanceof ServerTemplate t) {
                requireExpanded(t.spreads(), "server-template '" + t.prefix() + "'", t.location());
                StringBuilder line = new StringBuilder("server-template ")
                        .append(t.prefix())
                        .append(' ')
                        .append(render(t.count(), t.location()))
                        .append(' ')
                        .append(address(t.properties(), t.location()));
                inlineTokens(line, NodeKind.SERVER_TEMPLATE, t.properties(), t.extras(), t.location());
                out.add(line.toString());
            } else {
                throw new InternalTranslationException("Unrolled loop reached the generator", entry.location());
            }
        }
    }

    private String address(Properties props, SourceLocation location) {
        Value address = props.get("address")
                .orElseThrow(() -> new InternalTranslationException("Server without an address", location));
        String text = render(address, location);
        Optional<Value> port = props.get("port");
        return port.isPresent() ? text + ":" + render(port.get(), location) : text;
    }

    private void directives(List<String> out, List<Directive> directives) {
        for (Directive d : directives) {
            StringBuilder line = new StringBuilder(d.name());
            for (Value arg : d.args()) {
                line.append(' ').append(render(arg, d.location()));
            }
            out.add(line.toString());
        }
    }

    // --- Values ---

    private static void requireExpanded(List<String> spreads, String what, SourceLocation location) {
        if (!spreads.isEmpty()) {
            throw new InternalTranslationException(
                    "Unexpanded template spread " + spreads + " on " + what + " reached the generator", location);
        }
    }

    private static boolean isTrue(Value value) {
        return value instanceof Value.Bool flag && flag.value();
    }

    private static List<Value> items(Value value) {
        return value instanceof Value.ListValue list ? list.items() : List.of(value);
    }

    private static String join(Value value, String separator, SourceLocation location) {
        List<String> parts = new ArrayList<>();
        for (Value item : items(value)) {
            parts.add(render(item, location));
        }
        return String.join(separator, parts);
    }

    /** Renders a concrete value as one or more target tokens. */
    static String render(Value value, SourceLocation location) {
        if (!value.isResolved()) {
            throw new InternalTranslationException(
                    "Unresolved value '" + value.asText() + "' reached the generator", location);
        }
        if (value instanceof Value.Str s) {
            return quoteIfNeeded(s.text());
        }
        if (value instanceof Value.ListValue list) {
            return join(list, " ", location);
        }
        if (value instanceof Value.ObjectValue obj) {
            List<String> parts = new ArrayList<>();
            for (Map.Entry<String, Value> e : obj.entries().entrySet()) {
                parts.add(e.getKey() + " " + render(e.getValue(), location));
            }
            return String.join(" ", parts);
        }
        return value.asText();
    }

    private static String text(Value value, SourceLocation location) {
        if (!value.isResolved()) {
            throw new InternalTranslationException(
                    "Unresolved value '" + value.asText() + "' reached the generator", location);
        }
        return value.asText();
    }

    static String quoteIfNeeded(String text) {
        if (text.isEmpty()) {
            return "\"\"";
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || c == '"') {
                return quote(text);
            }
        }
        return text;
    }

    private static String quote(String text) {
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
