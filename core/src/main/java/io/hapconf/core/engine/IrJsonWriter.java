package io.hapconf.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import io.hapconf.core.model.HttpRule;
import io.hapconf.core.model.IrNode;
import io.hapconf.core.model.Iteration;
import io.hapconf.core.model.Listen;
import io.hapconf.core.model.LuaScript;
import io.hapconf.core.model.Properties;
import io.hapconf.core.model.Server;
import io.hapconf.core.model.ServerTemplate;
import io.hapconf.core.model.StickTable;
import io.hapconf.core.model.Template;
import io.hapconf.core.model.UseBackendRule;
import io.hapconf.core.model.Value;
import io.hapconf.core.model.VariableBinding;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Serializes the IR as a JSON tree for inspection ({@code --dump-ir}). The layout is meant for
 * reading, not for parsing back: every node is an object with a {@code kind} field, values map to
 * their natural JSON type and durations to their text form.
 */
public final class IrJsonWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /** Pretty-printed JSON text of {@code config}. */
    public String write(Config config) {
        try {
            return MAPPER.writeValueAsString(toJson(config));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize IR: " + e.getOriginalMessage(), e);
        }
    }

    public ObjectNode toJson(Config config) {
        ObjectNode root = node("config");
        root.put("name", config.name());
        root.set("properties", properties(config.properties()));
        if (config.global() != null) {
            root.set("global", global(config.global()));
        }
        if (config.defaults() != null) {
            root.set("defaults", defaults(config.defaults()));
        }
        ArrayNode sections = root.putArray("sections");
        for (IrNode entry : config.sections()) {
            sections.add(entry(entry));
        }
        ArrayNode templates = root.putArray("templates");
        for (Template t : config.templates()) {
            ObjectNode n = node("template");
            n.put("name", t.name());
            n.set("properties", properties(t.properties()));
            strings(n, "spreads", t.spreads());
            templates.add(n);
        }
        ArrayNode variables = root.putArray("variables");
        for (VariableBinding b : config.variables()) {
            ObjectNode n = node("let");
            n.put("name", b.name());
            n.set("value", value(b.value()));
            variables.add(n);
        }
        ArrayNode lua = root.putArray("lua");
        for (LuaScript script : config.luaScripts()) {
            ObjectNode n = node("lua");
            n.put("name", script.name());
            n.put("source", script.source().name().toLowerCase(java.util.Locale.ROOT));
            n.put(script.source() == LuaScript.LuaSource.FILE ? "path" : "code", script.content());
            lua.add(n);
        }
        return root;
    }

    // --- Nodes ---

    private JsonNode entry(IrNode entry) {
        if (entry instanceof Frontend f) {
            ObjectNode n = holder("frontend", f.properties(), f.extras(), f.spreads());
            n.put("name", f.name());
            binds(n, f.binds());
            rulesAndAcls(n, f.acls(), f.requestRules(), f.responseRules());
            routes(n, f.routes());
            stickTable(n, f.stickTable());
            directives(n, f.directives());
            return n;
        }
        if (entry instanceof Backend b) {
            ObjectNode n = holder("backend", b.properties(), b.extras(), b.spreads());
            n.put("name", b.name());
            rulesAndAcls(n, b.acls(), b.requestRules(), b.responseRules());
            healthCheck(n, b.healthCheck());
            stickTable(n, b.stickTable());
            servers(n, b.servers());
            directives(n, b.directives());
            return n;
        }
        if (entry instanceof Listen l) {
            ObjectNode n = holder("listen", l.properties(), l.extras(), l.spreads());
            n.put("name", l.name());
            binds(n, l.binds());
            rulesAndAcls(n, l.acls(), l.requestRules(), l.responseRules());
            routes(n, l.routes());
            healthCheck(n, l.healthCheck());
            stickTable(n, l.stickTable());
            servers(n, l.servers());
            directives(n, l.directives());
            return n;
        }
        if (entry instanceof Server s) {
            ObjectNode n = holder("server", s.properties(), s.extras(), s.spreads());
            n.put("name", s.name());
            return n;
        }
        if (entry instanceof ServerTemplate t) {
            ObjectNode n = holder("server_template", t.properties(), t.extras(), t.spreads());
            n.put("prefix", t.prefix());
            n.set("count", value(t.count()));
            return n;
        }
        if (entry instanceof ForLoop loop) {
            ObjectNode n = node("for");
            n.put("variable", loop.variable());
            if (loop.iteration() instanceof Iteration.Range range) {
                n.set("from", value(range.from()));
                n.set("to", value(range.to()));
            } else if (loop.iteration() instanceof Iteration.Items items) {
                n.set("items", values(items.items()));
            }
            ArrayNode body = n.putArray("body");
            for (IrNode child : loop.body()) {
                body.add(entry(child));
            }
            return n;
        }
        ObjectNode n = node("unknown");
        n.put("type", entry.getClass().getSimpleName());
        return n;
    }

    private ObjectNode global(GlobalSettings g) {
        ObjectNode n = holder("global", g.properties(), g.extras(), g.spreads());
        directives(n, g.directives());
        return n;
    }

    private ObjectNode defaults(Defaults d) {
        ObjectNode n = holder("defaults", d.properties(), d.extras(), d.spreads());
        healthCheck(n, d.healthCheck());
        directives(n, d.directives());
        return n;
    }

    private void binds(ObjectNode parent, List<Bind> binds) {
        ArrayNode array = parent.putArray("binds");
        for (Bind bind : binds) {
            ObjectNode n = holder("bind", bind.properties(), bind.extras(), List.of());
            n.set("address", value(bind.address()));
            array.add(n);
        }
    }

    private void rulesAndAcls(
            ObjectNode parent, List<Acl> acls, List<? extends HttpRule> request, List<? extends HttpRule> response) {
        ArrayNode aclArray = parent.putArray("acls");
        for (Acl acl : acls) {
            ObjectNode n = node("acl");
            n.put("name", acl.name());
            n.put("criterion", acl.criterion());
            n.set("values", values(acl.values()));
            aclArray.add(n);
        }
        rules(parent.putArray("http_request"), request);
        rules(parent.putArray("http_response"), response);
    }

    private void rules(ArrayNode array, List<? extends HttpRule> rules) {
        for (HttpRule rule : rules) {
            ObjectNode n = node(rule.directive());
            n.put("action", rule.action());
            n.set("args", values(rule.args()));
            n.set("params", properties(rule.params()));
            condition(n, rule.condition());
            array.add(n);
        }
    }

    private void routes(ObjectNode parent, List<UseBackendRule> routes) {
        ArrayNode array = parent.putArray("use_backend");
        for (UseBackendRule route : routes) {
            ObjectNode n = node("use_backend");
            n.put("backend", route.backend());
            condition(n, route.condition());
            array.add(n);
        }
    }

    private void healthCheck(ObjectNode parent, HealthCheck hc) {
        if (hc != null) {
            parent.set("health_check", holder("health_check", hc.properties(), hc.extras(), hc.spreads()));
        }
    }

    private void stickTable(ObjectNode parent, StickTable table) {
        if (table != null) {
            parent.set("stick_table", holder("stick_table", table.properties(), table.extras(), List.of()));
        }
    }

    private void servers(ObjectNode parent, List<? extends IrNode> servers) {
        ArrayNode array = parent.putArray("servers");
        for (IrNode entry : servers) {
            array.add(entry(entry));
        }
    }

    private void directives(ObjectNode parent, List<Directive> directives) {
        ArrayNode array = parent.putArray("directives");
        for (Directive d : directives) {
            ObjectNode n = node("directive");
            n.put("name", d.name());
            n.set("args", values(d.args()));
            array.add(n);
        }
    }

    private static void condition(ObjectNode n, Condition condition) {
        if (condition != null) {
            n.put("condition", condition.render());
        }
    }

    // --- Values ---

    private ObjectNode holder(String kind, Properties properties, Properties extras, List<String> spreads) {
        ObjectNode n = node(kind);
        n.set("properties", properties(properties));
        if (!extras.isEmpty()) {
            n.set("extras", properties(extras));
        }
        if (!spreads.isEmpty()) {
            strings(n, "spreads", spreads);
        }
        return n;
    }

    private static ObjectNode node(String kind) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("kind", kind);
        return n;
    }

    private static void strings(ObjectNode parent, String field, List<String> items) {
        ArrayNode array = parent.putArray(field);
        items.forEach(array::add);
    }

    private ObjectNode properties(Properties props) {
        ObjectNode n = MAPPER.createObjectNode();
        for (Map.Entry<String, Value> e : props) {
            n.set(e.getKey(), value(e.getValue()));
        }
        return n;
    }

    private ArrayNode values(List<Value> items) {
        ArrayNode array = MAPPER.createArrayNode();
        for (Value v : items) {
            array.add(value(v));
        }
        return array;
    }

    JsonNode value(Value v) {
        if (v instanceof Value.Num num) {
            return MAPPER.getNodeFactory().numberNode(num.value());
        }
        if (v instanceof Value.Bool bool) {
            return MAPPER.getNodeFactory().booleanNode(bool.value());
        }
        if (v instanceof Value.ListValue list) {
            return values(list.items());
        }
        if (v instanceof Value.ObjectValue obj) {
            ObjectNode n = MAPPER.createObjectNode();
            obj.entries().forEach((k, item) -> n.set(k, value(item)));
            return n;
        }
        if (v instanceof Value.EnvRef ref) {
            ObjectNode n = MAPPER.createObjectNode();
            n.put("env", ref.variable());
            if (ref.defaultValue() != null) {
                n.set("default", value(ref.defaultValue()));
            }
            return n;
        }
        return MAPPER.getNodeFactory().textNode(v.asText());
    }
}
