package io.hapconf.core.validate;

import io.hapconf.core.catalog.PropertyCatalog;
import io.hapconf.core.catalog.PropertySpec;
import io.hapconf.core.catalog.Rendering;
import io.hapconf.core.catalog.ValueDomain;
import io.hapconf.core.error.ValidationError;
import io.hapconf.core.error.ValidationException;
import io.hapconf.core.model.Acl;
import io.hapconf.core.model.Backend;
import io.hapconf.core.model.Bind;
import io.hapconf.core.model.Condition;
import io.hapconf.core.model.Config;
import io.hapconf.core.model.Defaults;
import io.hapconf.core.model.Frontend;
import io.hapconf.core.model.HealthCheck;
import io.hapconf.core.model.HttpRule;
import io.hapconf.core.model.Listen;
import io.hapconf.core.model.LuaScript;
import io.hapconf.core.model.PropertyHolder;
import io.hapconf.core.model.SectionEntry;
import io.hapconf.core.model.Server;
import io.hapconf.core.model.ServerEntry;
import io.hapconf.core.model.ServerTemplate;
import io.hapconf.core.model.SourceLocation;
import io.hapconf.core.model.Spreadable;
import io.hapconf.core.model.StickTable;
import io.hapconf.core.model.Template;
import io.hapconf.core.model.UseBackendRule;
import io.hapconf.core.model.Value;
import io.hapconf.core.model.VariableBinding;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks a fully resolved IR for semantic problems without changing it.
 *
 * <p>
 * All violations are collected in one pass so that the caller can report them together. The
 * checks cover named references (routing targets, ACLs in conditions, template spreads), value
 * domains from the {@link PropertyCatalog}, uniqueness of names, and mode/option compatibility.
 */
public final class SemanticValidator {

    /** ACLs the target system predefines. */
    static final Set<String> PREDEFINED_ACLS = Set.of(
            "TRUE", "FALSE", "LOCALHOST", "HTTP", "HTTP_1.0", "HTTP_1.1", "HTTP_2.0", "HTTP_CONTENT",
            "HTTP_URL_ABS", "HTTP_URL_SLASH", "HTTP_URL_STAR", "METH_CONNECT", "METH_DELETE", "METH_GET",
            "METH_HEAD", "METH_OPTIONS", "METH_POST", "METH_PUT", "METH_TRACE", "RDP_COOKIE", "REQ_CONTENT",
            "WAIT_END");

    private static final Set<String> HTTP_ONLY_OPTIONS =
            Set.of("httplog", "http-server-close", "http-keep-alive", "forwardfor", "httpchk");

    private static final Set<String> TCP_ONLY_OPTIONS = Set.of("tcplog", "tcp-check");

    private static final Pattern LUA_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.-]*");

    private static final Pattern ADDRESS_PORT = Pattern.compile(".*:(\\d+)(-\\d+)?");

    private final PropertyCatalog catalog;

    public SemanticValidator(PropertyCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    /** Validates {@code config} and returns every error and warning found. */
    public ValidationResult validate(Config config) {
        Run run = new Run(config);
        run.check();
        return new ValidationResult(run.errors, run.warnings);
    }

    /**
     * Validates {@code config} and returns it unchanged when there are no errors.
     *
     * @throws ValidationException carrying every error found
     */
    public Config requireValid(Config config) {
        ValidationResult result = validate(config);
        if (!result.isValid()) {
            throw new ValidationException(result.errors());
        }
        return config;
    }

    /** State of one validation run. */
    private final class Run {
        private final Config config;
        private final List<ValidationError> errors = new ArrayList<>();
        private final List<ValidationError> warnings = new ArrayList<>();
        private final Set<String> templateNames = new HashSet<>();
        private final Set<String> proxyNames = new HashSet<>();

        Run(Config config) {
            this.config = config;
        }

        void check() {
            checkVariables();
            checkTemplates();
            checkLua();
            collectProxies();

            String defaultMode = null;
            if (config.global() != null) {
                checkHolder(config.global(), "global");
                checkSpreads(config.global(), "global");
            }
            Defaults defaults = config.defaults();
            if (defaults != null) {
                checkHolder(defaults, "defaults");
                checkSpreads(defaults, "defaults");
                checkModeOptions(defaults, "defaults", null);
                checkDefaultBackend(defaults, "defaults");
                checkHealthCheck(defaults.healthCheck(), "defaults");
                defaultMode = text(defaults.properties().get("mode"));
            }

            Set<String> frontendNames = new HashSet<>();
            for (SectionEntry entry : config.sections()) {
                if (entry instanceof Frontend f) {
                    String what = "frontend '" + f.name() + "'";
                    if (!frontendNames.add(f.name())) {
                        error("Duplicate frontend name '" + f.name() + "'", f.location());
                    }
                    checkFrontend(f, what, defaultMode);
                } else if (entry instanceof Backend b) {
                    checkBackend(b, "backend '" + b.name() + "'", defaultMode);
                } else if (entry instanceof Listen l) {
                    checkListen(l, "listen '" + l.name() + "'", defaultMode);
                } else {
                    error("Section loop was not unrolled", entry.location());
                }
            }
        }

        // --- Top-level tables ---

        private void checkVariables() {
            Map<String, VariableBinding> seen = new HashMap<>();
            for (VariableBinding b : config.variables()) {
                VariableBinding first = seen.putIfAbsent(b.name(), b);
                if (first != null) {
                    error(String.format(
                                    "Duplicate variable '%s'; first declared at %s", b.name(), first.location()),
                            b.location());
                }
            }
        }

        private void checkTemplates() {
            Map<String, Template> seen = new HashMap<>();
            for (Template t : config.templates()) {
                Template first = seen.putIfAbsent(t.name(), t);
                if (first != null) {
                    error(String.format(
                                    "Duplicate template '%s'; first declared at %s", t.name(), first.location()),
                            t.location());
                }
                templateNames.add(t.name());
            }
            for (Template t : config.templates()) {
                for (String spread : t.spreads()) {
                    error(String.format(
                                    "Template '%s' spreads template '%s'; templates cannot spread other templates",
                                    t.name(),
                                    spread),
                            t.location());
                }
            }
        }

        private void checkLua() {
            Set<String> names = new HashSet<>();
            for (LuaScript script : config.luaScripts()) {
                if (!LUA_NAME.matcher(script.name()).matches()) {
                    error("Invalid Lua script name '" + script.name()
                            + "'; use letters, digits, '_', '.' or '-'", script.location());
                }
                if (!names.add(script.name())) {
                    error("Duplicate Lua script '" + script.name() + "'", script.location());
                }
            }
        }

        private void collectProxies() {
            Map<String, SourceLocation> seen = new HashMap<>();
            for (SectionEntry entry : config.sections()) {
                String name = null;
                SourceLocation location = null;
                if (entry instanceof Backend b) {
                    name = b.name();
                    location = b.location();
                } else if (entry instanceof Listen l) {
                    name = l.name();
                    location = l.location();
                }
                if (name == null) {
                    continue;
                }
                SourceLocation first = seen.putIfAbsent(name, location);
                if (first != null) {
                    error(String.format("Duplicate backend name '%s'; first declared at %s", name, first), location);
                }
                proxyNames.add(name);
            }
        }

        // --- Sections ---

        private void checkFrontend(Frontend f, String what, String defaultMode) {
            checkHolder(f, what);
            checkSpreads(f, what);
            checkModeOptions(f, what, defaultMode);
            checkDefaultBackend(f, what);
            checkBinds(f.binds(), what);
            checkRoutes(f.routes(), f.acls(), what);
            checkRules(f.requestRules(), f.acls(), what);
            checkRules(f.responseRules(), f.acls(), what);
            checkStickTable(f.stickTable(), what);
            if (f.binds().isEmpty()) {
                warning("Frontend '" + f.name() + "' has no bind directives", f.location());
            }
        }

        private void checkBackend(Backend b, String what, String defaultMode) {
            checkHolder(b, what);
            checkSpreads(b, what);
            checkModeOptions(b, what, defaultMode);
            checkRules(b.requestRules(), b.acls(), what);
            checkRules(b.responseRules(), b.acls(), what);
            checkHealthCheck(b.healthCheck(), what);
            checkStickTable(b.stickTable(), what);
            checkServers(b.servers(), what);
            if (b.servers().isEmpty()) {
                warning("Backend '" + b.name() + "' has no servers", b.location());
            }
        }

        private void checkListen(Listen l, String what, String defaultMode) {
            checkHolder(l, what);
            checkSpreads(l, what);
            checkModeOptions(l, what, defaultMode);
            checkDefaultBackend(l, what);
            checkBinds(l.binds(), what);
            checkRoutes(l.routes(), l.acls(), what);
            checkRules(l.requestRules(), l.acls(), what);
            checkRules(l.responseRules(), l.acls(), what);
            checkHealthCheck(l.healthCheck(), what);
            checkStickTable(l.stickTable(), what);
            checkServers(l.servers(), what);
            if (l.binds().isEmpty()) {
                warning("Listen '" + l.name() + "' has no bind directives", l.location());
            }
        }

        private void checkBinds(List<Bind> binds, String what) {
            for (Bind bind : binds) {
                String where = "bind " + bind.address().asText() + " in " + what;
                checkHolder(bind, where);
                Matcher m = ADDRESS_PORT.matcher(bind.address().asText());
                if (m.matches()) {
                    ValueDomain.PORT.check(Value.str(m.group(1)))
                            .ifPresent(problem -> error(where + ": port " + problem, bind.location()));
                }
            }
        }

        private void checkServers(List<ServerEntry> servers, String what) {
            Map<String, SourceLocation> seen = new HashMap<>();
            for (ServerEntry entry : servers) {
                String name;
                SourceLocation location;
                String where;
                if (entry instanceof Server s) {
                    name = s.name();
                    location = s.location();
                    where = "server '" + s.name() + "' in " + what;
                    if (!s.properties().has("address")) {
                        error("Server '" + s.name() + "' in " + what + " has no address", s.location());
                    }
                    checkHolder(s, where);
                    checkSpreads(s, where);
                } else if (entry instanceof ServerTemplate t) {
                    name = t.prefix();
                    location = t.location();
                    where = "server-template '" + t.prefix() + "' in " + what;
                    if (!t.properties().has("address")) {
                        error("Server-template '" + t.prefix() + "' in " + what + " has no address", t.location());
                    }
                    checkTemplateCount(t, where);
                    checkHolder(t, where);
                    checkSpreads(t, where);
                } else {
                    error("Server loop in " + what + " was not unrolled", config.location());
                    continue;
                }
                SourceLocation first = seen.putIfAbsent(name, location);
                if (first != null) {
                    error(String.format("Duplicate server name '%s' in %s; first declared at %s", name, what, first),
                            location);
                }
            }
        }

        private void checkTemplateCount(ServerTemplate t, String where) {
            String count = t.count().asText();
            if (count.matches("\\d+")) {
                ValueDomain.POSITIVE.check(t.count())
                        .ifPresent(problem -> error(where + ": count " + problem, t.location()));
            } else if (!count.matches("\\d+-\\d+")) {
                error(where + ": count must be a number or a range 'a-b', got '" + count + "'", t.location());
            }
        }

        private void checkHealthCheck(HealthCheck hc, String what) {
            if (hc == null) {
                return;
            }
            String where = "health-check in " + what;
            checkHolder(hc, where);
            checkSpreads(hc, where);
            if (hc.properties().has("method") && !hc.properties().has("uri")) {
                warning("Health check in " + what + " has a method but no uri", hc.location());
            }
        }

        private void checkStickTable(StickTable st, String what) {
            if (st != null) {
                checkHolder(st, "stick-table in " + what);
            }
        }

        // --- References ---

        private void checkSpreads(Spreadable<?> node, String what) {
            for (String spread : node.spreads()) {
                if (templateNames.contains(spread)) {
                    error("Template '" + spread + "' spread into " + what + " was not expanded", node.location());
                } else {
                    error("Unknown template '" + spread + "' spread into " + what, node.location());
                }
            }
        }

        private void checkDefaultBackend(PropertyHolder holder, String what) {
            Optional<Value> target = holder.properties().get("default_backend");
            if (target.isPresent() && !proxyNames.contains(target.get().asText())) {
                error(String.format(
                                "%s: default_backend references undefined backend '%s'",
                                capitalize(what),
                                target.get().asText()),
                        holder.location());
            }
        }

        private void checkRoutes(List<UseBackendRule> routes, List<Acl> acls, String what) {
            for (UseBackendRule route : routes) {
                if (!proxyNames.contains(route.backend())) {
                    error(String.format(
                                    "%s routes to undefined backend '%s'", capitalize(what), route.backend()),
                            route.location());
                }
                checkCondition(route.condition(), acls, what, route.location());
            }
        }

        private void checkRules(List<? extends HttpRule> rules, List<Acl> acls, String what) {
            for (HttpRule rule : rules) {
                checkCondition(rule.condition(), acls, what, rule.location());
                rule.params().get("status").ifPresent(status -> ValueDomain.HTTP_STATUS.check(status)
                        .ifPresent(problem -> error(
                                String.format("%s %s in %s: status %s", rule.directive(), rule.action(), what, problem),
                                rule.location())));
            }
        }

        private void checkCondition(Condition condition, List<Acl> acls, String what, SourceLocation location) {
            if (condition == null) {
                return;
            }
            Set<String> declared = new HashSet<>();
            for (Acl acl : acls) {
                declared.add(acl.name());
            }
            for (String name : condition.aclNames()) {
                if (!declared.contains(name) && !PREDEFINED_ACLS.contains(name)) {
                    error(String.format("%s references undefined ACL '%s'", capitalize(what), name), location);
                }
            }
        }

        // --- Values ---

        private void checkHolder(PropertyHolder holder, String what) {
            for (Map.Entry<String, Value> e : holder.properties()) {
                Optional<PropertySpec> spec = catalog.find(holder.kind(), e.getKey());
                if (spec.isEmpty()) {
                    continue;
                }
                for (String problem : problems(spec.get(), e.getValue())) {
                    error(String.format("%s: property '%s': %s", capitalize(what), e.getKey(), problem),
                            holder.location());
                }
            }
        }

        private List<String> problems(PropertySpec spec, Value value) {
            List<String> out = new ArrayList<>();
            if (spec.rendering() == Rendering.KEYED_LINES) {
                return out;
            }
            boolean itemwise = spec.rendering() == Rendering.REPEATED
                    || spec.rendering() == Rendering.SPACE_JOINED
                    || spec.rendering() == Rendering.COMMA_JOINED;
            if (itemwise && value instanceof Value.ListValue list) {
                for (Value item : list.items()) {
                    spec.domain().check(item).ifPresent(out::add);
                }
            } else {
                spec.domain().check(value).ifPresent(out::add);
            }
            return out;
        }

        private void checkModeOptions(PropertyHolder holder, String what, String defaultMode) {
            String mode = text(holder.properties().get("mode"));
            if (mode == null) {
                mode = defaultMode;
            }
            if (mode == null) {
                return;
            }
            for (String option : options(holder)) {
                if (mode.equals("tcp") && HTTP_ONLY_OPTIONS.contains(option)) {
                    error(String.format("%s: HTTP option '%s' used in TCP mode", capitalize(what), option),
                            holder.location());
                } else if (mode.equals("http") && TCP_ONLY_OPTIONS.contains(option)) {
                    warning(String.format("%s: TCP option '%s' used in HTTP mode", capitalize(what), option),
                            holder.location());
                }
            }
        }

        private List<String> options(PropertyHolder holder) {
            Optional<Value> option = holder.properties().get("option");
            if (option.isEmpty()) {
                return List.of();
            }
            List<String> names = new ArrayList<>();
            Value v = option.get();
            if (v instanceof Value.ListValue list) {
                for (Value item : list.items()) {
                    names.add(firstWord(item.asText()));
                }
            } else {
                names.add(firstWord(v.asText()));
            }
            return names;
        }

        private void error(String message, SourceLocation location) {
            errors.add(new ValidationError(message, location));
        }

        private void warning(String message, SourceLocation location) {
            warnings.add(new ValidationError(message, location));
        }
    }

    private static String text(Optional<Value> value) {
        return value.map(Value::asText).orElse(null);
    }

    private static String firstWord(String text) {
        int space = text.indexOf(' ');
        return space < 0 ? text : text.substring(0, space);
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
