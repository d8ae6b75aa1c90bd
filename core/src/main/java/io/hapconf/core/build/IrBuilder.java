package io.hapconf.core.build;

import io.hapconf.core.catalog.Keywords;
import io.hapconf.core.catalog.PropertyCatalog;
import io.hapconf.core.catalog.Rendering;
import io.hapconf.core.error.BuildException;
import io.hapconf.core.model.Acl;
import io.hapconf.core.model.Backend;
import io.hapconf.core.model.Bind;
import io.hapconf.core.model.Condition;
import io.hapconf.core.model.Config;
import io.hapconf.core.model.Defaults;
import io.hapconf.core.model.Directive;
import io.hapconf.core.model.ForLoop;
import io.hapconf.core.model.Frontend;
import io.hapconf.core.model.GlobalSettings;
import io.hapconf.core.model.HealthCheck;
import io.hapconf.core.model.IrNode;
import io.hapconf.core.model.Iteration;
import io.hapconf.core.model.Listen;
import io.hapconf.core.model.LuaScript;
import io.hapconf.core.model.NodeKind;
import io.hapconf.core.model.Properties;
import io.hapconf.core.model.RequestRule;
import io.hapconf.core.model.ResponseRule;
import io.hapconf.core.model.SectionEntry;
import io.hapconf.core.model.Server;
import io.hapconf.core.model.ServerEntry;
import io.hapconf.core.model.ServerTemplate;
import io.hapconf.core.model.SourceLocation;
import io.hapconf.core.model.StickTable;
import io.hapconf.core.model.Template;
import io.hapconf.core.model.UseBackendRule;
import io.hapconf.core.model.Value;
import io.hapconf.core.model.VariableBinding;
import io.hapconf.core.syntax.SyntaxNode;
import io.hapconf.core.syntax.Token;
import io.hapconf.core.syntax.TokenType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the immutable IR from a parsed syntax tree in one recursive traversal.
 *
 * <p>
 * Structural problems that the grammar cannot express (a server in a frontend, a block inside
 * a template, a duplicate {@code global} section) are rejected here with a {@link
 * BuildException}. Property keys the catalog does not model are kept in each node's extras map.
 *
 * <p>
 * Key normalization: keys are converted to snake_case, {@code timeout { ... }} objects and
 * blocks are flattened to {@code timeout_connect}-style keys, any other named block {@code NAME {
 * key: v }} becomes {@code NAME.key}, and {@code expect: status 200} becomes {@code expect_status:
 * 200}.
 */
public final class IrBuilder {

    private static final Map<String, String> ALIASES = Map.of(
            "cert", "crt",
            "check_interval", "inter",
            "default", "default_backend");

    private final PropertyCatalog catalog;

    public IrBuilder(PropertyCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    /**
     * Builds the IR for a {@code config} root node.
     *
     * @throws BuildException if the tree has an invalid shape
     */
    public Config build(SyntaxNode root) {
        if (!root.is("config")) {
            throw new BuildException("Expected a 'config' root node but got '" + root.rule() + "'", root.location());
        }
        Map<String, Value> configProps = new LinkedHashMap<>();
        GlobalSettings global = null;
        Defaults defaults = null;
        List<SectionEntry> sections = new ArrayList<>();
        List<Template> templates = new ArrayList<>();
        List<VariableBinding> variables = new ArrayList<>();
        List<LuaScript> luaScripts = new ArrayList<>();

        for (SyntaxNode item : root.children()) {
            switch (item.rule()) {
                case "property":
                    putProperty(configProps, item.text(), propertyValue(item), item.location());
                    break;
                case "let":
                    variables.add(new VariableBinding(item.text(), value(item.child(0)), item.location()));
                    break;
                case "template":
                    templates.add(template(item));
                    break;
                case "global":
                    if (global != null) {
                        throw new BuildException(
                                "Duplicate 'global' section; first declared at " + global.location(),
                                item.location());
                    }
                    global = global(item, luaScripts);
                    break;
                case "defaults":
                    if (defaults != null) {
                        throw new BuildException(
                                "Duplicate 'defaults' section; first declared at " + defaults.location(),
                                item.location());
                    }
                    defaults = defaults(item);
                    break;
                case "lua":
                    luaScripts.addAll(lua(item));
                    break;
                default:
                    sections.add(sectionEntry(item));
            }
        }
        return new Config(
                root.text(),
                Properties.of(configProps),
                global,
                defaults,
                sections,
                templates,
                variables,
                luaScripts,
                root.location());
    }

    // --- Sections ---

    private SectionEntry sectionEntry(SyntaxNode node) {
        switch (node.rule()) {
            case "frontend":
                return frontend(node);
            case "backend":
                return backend(node);
            case "listen":
                return listen(node);
            case "for":
                return loop(node, LoopScope.SECTIONS);
            default:
                throw new BuildException(
                        "'" + node.rule() + "' is not allowed at the top level of a config", node.location());
        }
    }

    private GlobalSettings global(SyntaxNode node, List<LuaScript> luaScripts) {
        Parts parts = collect(node, NodeKind.GLOBAL, "global");
        luaScripts.addAll(parts.lua);
        parts.rejectAllBut("global", "lua");
        return new GlobalSettings(
                parts.properties(), parts.extras(), parts.spreads, parts.directives, node.location());
    }

    private Defaults defaults(SyntaxNode node) {
        Parts parts = collect(node, NodeKind.DEFAULTS, "defaults");
        parts.rejectAllBut("defaults", "health_check");
        return new Defaults(
                parts.properties(),
                parts.extras(),
                parts.spreads,
                parts.healthCheck,
                parts.directives,
                node.location());
    }

    private Frontend frontend(SyntaxNode node) {
        String what = "frontend '" + node.text() + "'";
        Parts parts = collect(node, NodeKind.FRONTEND, what);
        parts.rejectAllBut(what, "bind", "acl", "rules", "routes", "stick_table");
        return new Frontend(
                node.text(),
                parts.properties(),
                parts.extras(),
                parts.spreads,
                parts.binds,
                parts.acls,
                parts.requestRules,
                parts.responseRules,
                parts.routes,
                parts.stickTable,
                parts.directives,
                node.location());
    }

    private Backend backend(SyntaxNode node) {
        String what = "backend '" + node.text() + "'";
        Parts parts = collect(node, NodeKind.BACKEND, what);
        parts.rejectAllBut(what, "acl", "rules", "health_check", "stick_table", "servers");
        return new Backend(
                node.text(),
                parts.properties(),
                parts.extras(),
                parts.spreads,
                parts.acls,
                parts.requestRules,
                parts.responseRules,
                parts.healthCheck,
                parts.stickTable,
                parts.servers,
                parts.directives,
                node.location());
    }

    private Listen listen(SyntaxNode node) {
        String what = "listen '" + node.text() + "'";
        Parts parts = collect(node, NodeKind.LISTEN, what);
        parts.rejectAllBut(what, "bind", "acl", "rules", "routes", "health_check", "stick_table", "servers");
        return new Listen(
                node.text(),
                parts.properties(),
                parts.extras(),
                parts.spreads,
                parts.binds,
                parts.acls,
                parts.requestRules,
                parts.responseRules,
                parts.routes,
                parts.healthCheck,
                parts.stickTable,
                parts.servers,
                parts.directives,
                node.location());
    }

    private Template template(SyntaxNode node) {
        String what = "template '" + node.text() + "'";
        Parts parts = collect(node, null, what);
        if (!parts.kinds.isEmpty()) {
            SourceLocation at = parts.firstOther != null ? parts.firstOther : node.location();
            throw new BuildException(
                    String.format(
                            "'%s' is not allowed inside %s; templates hold properties only",
                            parts.kinds.get(0),
                            what),
                    at);
        }
        return new Template(node.text(), Properties.of(parts.props), parts.spreads, node.location());
    }

    // --- Body collection ---

    /** Scope of a loop body: top-level sections or a server list. */
    private enum LoopScope {
        SECTIONS,
        SERVERS
    }

    private Parts collect(SyntaxNode node, NodeKind kind, String what) {
        Parts parts = new Parts(kind);
        for (SyntaxNode item : node.children()) {
            switch (item.rule()) {
                case "property":
                    putProperty(parts.props, item.text(), propertyValue(item), item.location());
                    break;
                case "block":
                    flattenBlock(parts.props, item);
                    break;
                case "spread":
                    parts.spreads.add(item.text());
                    break;
                case "directive":
                    if (kind == null) {
                        putProperty(parts.props, item.text(), directiveValue(item), item.location());
                    } else {
                        parts.directives.add(directive(item));
                    }
                    break;
                case "bind":
                    parts.mark("bind", item);
                    parts.binds.add(bind(item));
                    break;
                case "acl":
                    parts.mark("acl", item);
                    parts.acls.add(acl(item));
                    break;
                case "http_request":
                    parts.mark("rules", item);
                    for (SyntaxNode rule : item.children()) {
                        parts.requestRules.add(requestRule(rule));
                    }
                    break;
                case "http_response":
                    parts.mark("rules", item);
                    for (SyntaxNode rule : item.children()) {
                        parts.responseRules.add(responseRule(rule));
                    }
                    break;
                case "route":
                    parts.mark("routes", item);
                    route(item, parts);
                    break;
                case "use_backend":
                    parts.mark("routes", item);
                    parts.routes.add(useBackend(item));
                    break;
                case "health_check":
                    parts.mark("health_check", item);
                    if (parts.healthCheck != null) {
                        throw new BuildException("Duplicate 'health-check' block in " + what, item.location());
                    }
                    parts.healthCheck = healthCheck(item);
                    break;
                case "stick_table":
                    parts.mark("stick_table", item);
                    if (parts.stickTable != null) {
                        throw new BuildException("Duplicate 'stick-table' in " + what, item.location());
                    }
                    parts.stickTable = stickTable(item);
                    break;
                case "servers":
                    parts.mark("servers", item);
                    for (SyntaxNode entry : item.children()) {
                        parts.servers.add(serverEntry(entry));
                    }
                    break;
                case "server":
                case "server_template":
                    parts.mark("servers", item);
                    parts.servers.add(serverEntry(item));
                    break;
                case "for":
                    parts.mark("servers", item);
                    parts.servers.add(loop(item, LoopScope.SERVERS));
                    break;
                case "lua":
                    parts.mark("lua", item);
                    parts.lua.addAll(lua(item));
                    break;
                default:
                    throw new BuildException(
                            "Unexpected '" + item.rule() + "' in " + what, item.location());
            }
        }
        return parts;
    }

    /** Mutable accumulator for the contents of one block. */
    private final class Parts {
        final NodeKind kind;
        final Map<String, Value> props = new LinkedHashMap<>();
        final List<String> spreads = new ArrayList<>();
        final List<Directive> directives = new ArrayList<>();
        final List<Bind> binds = new ArrayList<>();
        final List<Acl> acls = new ArrayList<>();
        final List<RequestRule> requestRules = new ArrayList<>();
        final List<ResponseRule> responseRules = new ArrayList<>();
        final List<UseBackendRule> routes = new ArrayList<>();
        final List<ServerEntry> servers = new ArrayList<>();
        final List<LuaScript> lua = new ArrayList<>();
        final List<String> kinds = new ArrayList<>();
        final Map<String, SyntaxNode> firstOfKind = new LinkedHashMap<>();
        HealthCheck healthCheck;
        StickTable stickTable;
        SourceLocation firstOther;

        Parts(NodeKind kind) {
            this.kind = kind;
        }

        void mark(String group, SyntaxNode item) {
            if (!firstOfKind.containsKey(group)) {
                firstOfKind.put(group, item);
                kinds.add(displayName(item));
                if (firstOther == null) {
                    firstOther = item.location();
                }
            }
        }

        void rejectAllBut(String what, String... allowed) {
            List<String> ok = List.of(allowed);
            for (Map.Entry<String, SyntaxNode> e : firstOfKind.entrySet()) {
                if (!ok.contains(e.getKey())) {
                    SyntaxNode item = e.getValue();
                    if (e.getKey().equals("servers")) {
                        throw new BuildException(
                                String.format(
                                        "'%s' is not allowed in %s; servers must be declared inside a backend or"
                                                + " listen section",
                                        displayName(item),
                                        what),
                                item.location());
                    }
                    throw new BuildException(
                            String.format("'%s' is not allowed in %s", displayName(item), what), item.location());
                }
            }
        }

        Properties properties() {
            Map<String, Value> modeled = new LinkedHashMap<>();
            props.forEach((k, v) -> {
                if (catalog.isModeled(kind, k)) modeled.put(k, v);
            });
            return Properties.of(modeled);
        }

        Properties extras() {
            Map<String, Value> unmodeled = new LinkedHashMap<>();
            props.forEach((k, v) -> {
                if (!catalog.isModeled(kind, k)) unmodeled.put(k, v);
            });
            return Properties.of(unmodeled);
        }
    }

    private static String displayName(SyntaxNode item) {
        switch (item.rule()) {
            case "server":
                return "server " + item.text();
            case "server_template":
                return "server-template";
            case "health_check":
                return "health-check";
            case "stick_table":
                return "stick-table";
            case "http_request":
                return "http-request";
            case "http_response":
                return "http-response";
            default:
                return item.rule();
        }
    }

    // --- Servers and loops ---

    private ServerEntry serverEntry(SyntaxNode node) {
        switch (node.rule()) {
            case "server":
                return server(node);
            case "server_template":
                return serverTemplate(node);
            case "for":
                return loop(node, LoopScope.SERVERS);
            default:
                throw new BuildException(
                        "Only server, server-template and for may appear in a server list, found '"
                                + displayName(node) + "'",
                        node.location());
        }
    }

    private Server server(SyntaxNode node) {
        String what = "server '" + node.text() + "'";
        Parts parts = collect(node, NodeKind.SERVER, what);
        parts.rejectAllBut(what);
        flagsFromDirectives(parts);
        return new Server(node.text(), parts.properties(), parts.extras(), parts.spreads, node.location());
    }

    private ServerTemplate serverTemplate(SyntaxNode node) {
        String what = "server-template '" + node.text() + "'";
        SyntaxNode countNode = node.child(0);
        SyntaxNode body = new SyntaxNode(node.rule(), node.token(),
                node.children().subList(1, node.children().size()), node.location());
        Parts parts = collect(body, NodeKind.SERVER_TEMPLATE, what);
        parts.rejectAllBut(what);
        flagsFromDirectives(parts);
        return new ServerTemplate(
                node.text(), templateCount(countNode), parts.properties(), parts.extras(), parts.spreads,
                node.location());
    }

    private Value templateCount(SyntaxNode node) {
        if (node.is("range")) {
            String from = node.child(0).text();
            String to = node.child(1).text();
            String text = from + "-" + to;
            return text.contains("${") ? new Value.Interpolated(text) : Value.str(text);
        }
        return value(node);
    }

    private ForLoop loop(SyntaxNode node, LoopScope scope) {
        SyntaxNode iterNode = node.child(0);
        Iteration iteration;
        if (iterNode.is("range")) {
            iteration = new Iteration.Range(value(iterNode.child(0)), value(iterNode.child(1)));
        } else {
            List<Value> items = new ArrayList<>();
            for (SyntaxNode item : iterNode.children()) {
                items.add(value(item));
            }
            iteration = new Iteration.Items(items);
        }
        List<IrNode> body = new ArrayList<>();
        for (SyntaxNode item : node.children().subList(1, node.children().size())) {
            if (scope == LoopScope.SECTIONS) {
                body.add(sectionEntry(item));
            } else {
                body.add(serverEntry(item));
            }
        }
        return new ForLoop(node.text(), iteration, body, node.location());
    }

    /** In node bodies without directives, a bare word is a flag and a word with arguments a property. */
    private void flagsFromDirectives(Parts parts) {
        for (Directive d : parts.directives) {
            Value v = d.args().isEmpty() ? Value.bool(true) : single(d.args());
            putProperty(parts.props, d.name(), v, d.location());
        }
        parts.directives.clear();
    }

    // --- Leaf constructs ---

    private Bind bind(SyntaxNode node) {
        SyntaxNode addressNode = node.child(0);
        Value address = value(addressNode);
        Map<String, Value> props = new LinkedHashMap<>();
        for (SyntaxNode item : node.children().subList(1, node.children().size())) {
            switch (item.rule()) {
                case "flag":
                    putProperty(props, item.text(), Value.bool(true), item.location());
                    break;
                case "property":
                    putProperty(props, item.text(), propertyValue(item), item.location());
                    break;
                case "directive":
                    putProperty(props, item.text(), directiveValue(item), item.location());
                    break;
                default:
                    throw new BuildException(
                            "'" + displayName(item) + "' is not allowed in a bind block", item.location());
            }
        }
        Parts parts = new Parts(NodeKind.BIND);
        parts.props.putAll(props);
        return new Bind(address, parts.properties(), parts.extras(), node.location());
    }

    private Acl acl(SyntaxNode node) {
        List<SyntaxNode> children = node.children();
        SyntaxNode criterion = children.get(0);
        if (!criterion.is("ident") && !criterion.is("string")) {
            throw new BuildException(
                    "ACL '" + node.text() + "' must start with a fetch criterion", criterion.location());
        }
        List<Value> values = new ArrayList<>();
        for (SyntaxNode v : children.subList(1, children.size())) {
            values.add(value(v));
        }
        return new Acl(node.text(), criterion.text(), values, node.location());
    }

    private RequestRule requestRule(SyntaxNode node) {
        RuleParts p = ruleParts(node);
        return new RequestRule(node.text(), p.args, Properties.of(p.params), p.condition, node.location());
    }

    private ResponseRule responseRule(SyntaxNode node) {
        RuleParts p = ruleParts(node);
        return new ResponseRule(node.text(), p.args, Properties.of(p.params), p.condition, node.location());
    }

    private static final class RuleParts {
        final List<Value> args = new ArrayList<>();
        final Map<String, Value> params = new LinkedHashMap<>();
        Condition condition;
    }

    private RuleParts ruleParts(SyntaxNode node) {
        RuleParts p = new RuleParts();
        for (SyntaxNode part : node.children()) {
            if (part.is("param")) {
                p.params.put(part.text(), value(part.child(0)));
            } else if (part.is("condition")) {
                p.condition = condition(part);
            } else {
                p.args.add(value(part));
            }
        }
        return p;
    }

    private void route(SyntaxNode node, Parts parts) {
        for (SyntaxNode entry : node.children()) {
            if (entry.is("to")) {
                Condition cond = entry.children().isEmpty() ? null : condition(entry.child(0));
                parts.routes.add(new UseBackendRule(entry.text(), cond, entry.location()));
            } else {
                putProperty(parts.props, entry.text(), propertyValue(entry), entry.location());
            }
        }
    }

    private UseBackendRule useBackend(SyntaxNode node) {
        Condition cond = node.children().isEmpty() ? null : condition(node.child(0));
        return new UseBackendRule(node.text(), cond, node.location());
    }

    private static Condition condition(SyntaxNode node) {
        List<String> terms = new ArrayList<>();
        for (SyntaxNode term : node.children()) {
            Token t = term.token();
            terms.add(t.is(TokenType.STRING) ? "\"" + t.text() + "\"" : t.text());
        }
        return new Condition(node.text(), terms);
    }

    private HealthCheck healthCheck(SyntaxNode node) {
        Parts parts = collect(node, NodeKind.HEALTH_CHECK, "health-check");
        parts.rejectAllBut("health-check");
        flagsFromDirectives(parts);
        return new HealthCheck(parts.properties(), parts.extras(), parts.spreads, node.location());
    }

    private StickTable stickTable(SyntaxNode node) {
        Parts parts = collect(node, NodeKind.STICK_TABLE, "stick-table");
        parts.rejectAllBut("stick-table");
        flagsFromDirectives(parts);
        if (!parts.spreads.isEmpty()) {
            throw new BuildException("Template spreads are not supported in a stick-table", node.location());
        }
        return new StickTable(parts.properties(), parts.extras(), node.location());
    }

    private List<LuaScript> lua(SyntaxNode node) {
        List<LuaScript> scripts = new ArrayList<>();
        for (SyntaxNode script : node.children()) {
            if (script.is("inline")) {
                String code = script.child(0).text();
                scripts.add(new LuaScript(
                        script.text(), LuaScript.LuaSource.INLINE, dedent(code), script.location()));
            } else {
                String path = script.text();
                scripts.add(new LuaScript(fileStem(path), LuaScript.LuaSource.FILE, path, script.location()));
            }
        }
        return scripts;
    }

    private Directive directive(SyntaxNode node) {
        List<Value> args = new ArrayList<>();
        for (SyntaxNode arg : node.children()) {
            args.add(value(arg));
        }
        return new Directive(node.text(), args, node.location());
    }

    // --- Properties ---

    private Value propertyValue(SyntaxNode property) {
        List<Value> values = new ArrayList<>();
        for (SyntaxNode child : property.children()) {
            values.add(value(child));
        }
        return single(values);
    }

    private Value directiveValue(SyntaxNode directive) {
        if (directive.children().isEmpty()) {
            return Value.bool(true);
        }
        return propertyValue(directive);
    }

    private static Value single(List<Value> values) {
        return values.size() == 1 ? values.get(0) : Value.list(values);
    }

    private void flattenBlock(Map<String, Value> target, SyntaxNode block) {
        String name = Keywords.normalizeKey(block.text());
        String prefix = name.equals("timeout") ? "timeout_" : name + ".";
        for (SyntaxNode item : block.children()) {
            if (item.is("property")) {
                putProperty(target, prefix + item.text(), propertyValue(item), item.location());
            } else if (item.is("directive")) {
                putProperty(target, prefix + item.text(), directiveValue(item), item.location());
            } else {
                throw new BuildException(
                        "Only 'key: value' properties are allowed in block '" + block.text() + "'",
                        item.location());
            }
        }
    }

    /**
     * Stores a property under its normalized key. Objects under {@code timeout} are flattened,
     * {@code expect} is split into its kind, and repeated list-rendered keys accumulate.
     */
    private void putProperty(Map<String, Value> target, String rawKey, Value value, SourceLocation location) {
        String key = Keywords.normalizeKey(rawKey);
        key = ALIASES.getOrDefault(key, key);
        if (key.equals("timeout") && value instanceof Value.ObjectValue obj) {
            for (Map.Entry<String, Value> e : obj.entries().entrySet()) {
                putProperty(target, "timeout_" + e.getKey(), e.getValue(), location);
            }
            return;
        }
        if (key.equals("expect")) {
            putExpect(target, value, location);
            return;
        }
        Value existing = target.get(key);
        if (existing != null && isRepeatable(key)) {
            List<Value> merged = new ArrayList<>(asItems(existing));
            merged.addAll(asItems(value));
            target.put(key, Value.list(merged));
            return;
        }
        target.put(key, value);
    }

    private static void putExpect(Map<String, Value> target, Value value, SourceLocation location) {
        if (value instanceof Value.ListValue list
                && list.items().size() >= 2
                && list.items().get(0) instanceof Value.Ident kind) {
            List<Value> rest = list.items().subList(1, list.items().size());
            String expectKind = kind.name();
            if (!List.of("status", "string", "rstatus", "rstring").contains(expectKind)) {
                throw new BuildException(
                        "Unknown health-check expectation '" + expectKind
                                + "'; expected status, string, rstatus or rstring",
                        location);
            }
            target.put("expect_" + expectKind, single(rest));
            return;
        }
        if (value instanceof Value.Num || value instanceof Value.Interpolated) {
            target.put("expect_status", value);
            return;
        }
        throw new BuildException(
                "Health-check 'expect' must be written 'expect: status CODE' or 'expect: string TEXT', got '"
                        + value.asText() + "'",
                location);
    }

    private boolean isRepeatable(String key) {
        for (NodeKind kind : NodeKind.values()) {
            if (catalog.find(kind, key).map(s -> s.rendering() == Rendering.REPEATED).orElse(false)) {
                return true;
            }
        }
        return false;
    }

    private static List<Value> asItems(Value v) {
        return v instanceof Value.ListValue list ? list.items() : List.of(v);
    }

    // --- Values ---

    private Value value(SyntaxNode node) {
        Token t = node.token();
        switch (node.rule()) {
            case "string":
                return Value.str(t.text());
            case "istring":
                return new Value.Interpolated(t.text());
            case "number":
                try {
                    return Value.num(Long.parseLong(t.text()));
                } catch (NumberFormatException e) {
                    throw new BuildException("Number out of range: " + t.text(), node.location());
                }
            case "duration":
                return duration(t);
            case "bool":
                return Value.bool(Boolean.parseBoolean(t.text()));
            case "ident":
                return t.interpolated() ? new Value.Interpolated(t.text()) : Value.ident(t.text());
            case "list": {
                List<Value> items = new ArrayList<>();
                for (SyntaxNode child : node.children()) {
                    items.add(value(child));
                }
                return Value.list(items);
            }
            case "object": {
                Map<String, Value> entries = new LinkedHashMap<>();
                for (SyntaxNode entry : node.children()) {
                    entries.put(entry.text(), propertyValue(entry));
                }
                return new Value.ObjectValue(entries);
            }
            case "env":
                return envRef(node);
            case "range":
                throw new BuildException(
                        "A range is only allowed in a for loop or a server-template count", node.location());
            default:
                throw new BuildException("Unexpected value node '" + node.rule() + "'", node.location());
        }
    }

    private static Value duration(Token t) {
        String text = t.text();
        int split = text.length();
        while (split > 0 && Character.isLetter(text.charAt(split - 1))) {
            split--;
        }
        try {
            return new Value.Duration(Long.parseLong(text.substring(0, split)), text.substring(split));
        } catch (NumberFormatException e) {
            throw new BuildException("Duration out of range: " + text, t.location());
        }
    }

    private Value envRef(SyntaxNode node) {
        List<SyntaxNode> args = node.children();
        if (args.isEmpty() || args.size() > 2) {
            throw new BuildException(
                    "env() takes a variable name and an optional default, got " + args.size() + " arguments",
                    node.location());
        }
        SyntaxNode name = args.get(0);
        if (!name.is("string") && !name.is("ident")) {
            throw new BuildException("env() variable name must be a string", name.location());
        }
        Value defaultValue = null;
        if (args.size() == 2) {
            defaultValue = value(args.get(1));
            if (defaultValue instanceof Value.EnvRef) {
                throw new BuildException("env() default must be a literal value", args.get(1).location());
            }
        }
        return new Value.EnvRef(name.text(), defaultValue);
    }

    // --- Text helpers ---

    static String dedent(String code) {
        String[] lines = code.split("\n", -1);
        int start = 0;
        while (start < lines.length && lines[start].isBlank()) {
            start++;
        }
        int end = lines.length;
        while (end > start && lines[end - 1].isBlank()) {
            end--;
        }
        int indent = Integer.MAX_VALUE;
        for (int i = start; i < end; i++) {
            if (lines[i].isBlank()) {
                continue;
            }
            int n = 0;
            while (n < lines[i].length() && (lines[i].charAt(n) == ' ' || lines[i].charAt(n) == '\t')) {
                n++;
            }
            indent = Math.min(indent, n);
        }
        StringBuilder sb = new StringBuilder();
        for (int i = start; i < end; i++) {
            String line = lines[i];
            sb.append(line.length() >= indent ? line.substring(indent) : line.strip()).append('\n');
        }
        return sb.toString().replaceAll("[ \t]+\n", "\n");
    }

    private static String fileStem(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
