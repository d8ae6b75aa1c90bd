package io.hapconf.core.transform;

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
import io.hapconf.core.model.Properties;
import io.hapconf.core.model.RequestRule;
import io.hapconf.core.model.ResponseRule;
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

/**
 * Copies an IR tree while passing every value and every name through overridable hooks. Nodes are
 * rebuilt, never mutated, so a failing rewrite leaves the input tree intact.
 *
 * <p>
 * Templates, variable bindings and Lua script bodies are not visited; the passes that own them
 * handle them directly.
 */
abstract class IrRewriter {

    /** Rewrites one value found at {@code location}. */
    protected abstract Value value(Value value, SourceLocation location);

    /** Rewrites a name (section, server, ACL, backend reference or condition term). */
    protected String name(String name, SourceLocation location) {
        return name;
    }

    Config rewrite(Config config) {
        return new Config(
                config.name(),
                properties(config.properties(), config.location()),
                config.global() == null ? null : global(config.global()),
                config.defaults() == null ? null : defaults(config.defaults()),
                sections(config.sections()),
                config.templates(),
                config.variables(),
                config.luaScripts(),
                config.location());
    }

    List<SectionEntry> sections(List<SectionEntry> entries) {
        List<SectionEntry> out = new ArrayList<>(entries.size());
        for (SectionEntry entry : entries) {
            out.add(section(entry));
        }
        return out;
    }

    SectionEntry section(SectionEntry entry) {
        if (entry instanceof Frontend f) {
            return frontend(f);
        }
        if (entry instanceof Backend b) {
            return backend(b);
        }
        if (entry instanceof Listen l) {
            return listen(l);
        }
        return loop((ForLoop) entry);
    }

    List<ServerEntry> servers(List<ServerEntry> entries) {
        List<ServerEntry> out = new ArrayList<>(entries.size());
        for (ServerEntry entry : entries) {
            out.add(server(entry));
        }
        return out;
    }

    ServerEntry server(ServerEntry entry) {
        if (entry instanceof Server s) {
            return new Server(
                    name(s.name(), s.location()),
                    properties(s.properties(), s.location()),
                    properties(s.extras(), s.location()),
                    s.spreads(),
                    s.location());
        }
        if (entry instanceof ServerTemplate t) {
            return new ServerTemplate(
                    name(t.prefix(), t.location()),
                    value(t.count(), t.location()),
                    properties(t.properties(), t.location()),
                    properties(t.extras(), t.location()),
                    t.spreads(),
                    t.location());
        }
        return loop((ForLoop) entry);
    }

    ForLoop loop(ForLoop loop) {
        Iteration iteration = loop.iteration();
        if (iteration instanceof Iteration.Range r) {
            iteration = new Iteration.Range(value(r.from(), loop.location()), value(r.to(), loop.location()));
        } else {
            iteration = new Iteration.Items(values(((Iteration.Items) iteration).items(), loop.location()));
        }
        List<IrNode> body = new ArrayList<>(loop.body().size());
        for (IrNode node : loop.body()) {
            body.add(node instanceof SectionEntry s ? section(s) : server((ServerEntry) node));
        }
        return new ForLoop(loop.variable(), iteration, body, loop.location());
    }

    GlobalSettings global(GlobalSettings g) {
        return new GlobalSettings(
                properties(g.properties(), g.location()),
                properties(g.extras(), g.location()),
                g.spreads(),
                directives(g.directives()),
                g.location());
    }

    Defaults defaults(Defaults d) {
        return new Defaults(
                properties(d.properties(), d.location()),
                properties(d.extras(), d.location()),
                d.spreads(),
                healthCheck(d.healthCheck()),
                directives(d.directives()),
                d.location());
    }

    Frontend frontend(Frontend f) {
        return new Frontend(
                name(f.name(), f.location()),
                properties(f.properties(), f.location()),
                properties(f.extras(), f.location()),
                f.spreads(),
                binds(f.binds()),
                acls(f.acls()),
                requestRules(f.requestRules()),
                responseRules(f.responseRules()),
                routes(f.routes()),
                stickTable(f.stickTable()),
                directives(f.directives()),
                f.location());
    }

    Backend backend(Backend b) {
        return new Backend(
                name(b.name(), b.location()),
                properties(b.properties(), b.location()),
                properties(b.extras(), b.location()),
                b.spreads(),
                acls(b.acls()),
                requestRules(b.requestRules()),
                responseRules(b.responseRules()),
                healthCheck(b.healthCheck()),
                stickTable(b.stickTable()),
                servers(b.servers()),
                directives(b.directives()),
                b.location());
    }

    Listen listen(Listen l) {
        return new Listen(
                name(l.name(), l.location()),
                properties(l.properties(), l.location()),
                properties(l.extras(), l.location()),
                l.spreads(),
                binds(l.binds()),
                acls(l.acls()),
                requestRules(l.requestRules()),
                responseRules(l.responseRules()),
                routes(l.routes()),
                healthCheck(l.healthCheck()),
                stickTable(l.stickTable()),
                servers(l.servers()),
                directives(l.directives()),
                l.location());
    }

    private HealthCheck healthCheck(HealthCheck hc) {
        if (hc == null) {
            return null;
        }
        return new HealthCheck(
                properties(hc.properties(), hc.location()),
                properties(hc.extras(), hc.location()),
                hc.spreads(),
                hc.location());
    }

    private StickTable stickTable(StickTable st) {
        if (st == null) {
            return null;
        }
        return new StickTable(
                properties(st.properties(), st.location()), properties(st.extras(), st.location()), st.location());
    }

    private List<Bind> binds(List<Bind> binds) {
        List<Bind> out = new ArrayList<>(binds.size());
        for (Bind b : binds) {
            out.add(new Bind(
                    value(b.address(), b.location()),
                    properties(b.properties(), b.location()),
                    properties(b.extras(), b.location()),
                    b.location()));
        }
        return out;
    }

    private List<Acl> acls(List<Acl> acls) {
        List<Acl> out = new ArrayList<>(acls.size());
        for (Acl a : acls) {
            out.add(new Acl(
                    name(a.name(), a.location()),
                    name(a.criterion(), a.location()),
                    values(a.values(), a.location()),
                    a.location()));
        }
        return out;
    }

    private List<RequestRule> requestRules(List<RequestRule> rules) {
        List<RequestRule> out = new ArrayList<>(rules.size());
        for (RequestRule r : rules) {
            out.add(new RequestRule(
                    r.action(),
                    values(r.args(), r.location()),
                    properties(r.params(), r.location()),
                    condition(r.condition(), r.location()),
                    r.location()));
        }
        return out;
    }

    private List<ResponseRule> responseRules(List<ResponseRule> rules) {
        List<ResponseRule> out = new ArrayList<>(rules.size());
        for (ResponseRule r : rules) {
            out.add(new ResponseRule(
                    r.action(),
                    values(r.args(), r.location()),
                    properties(r.params(), r.location()),
                    condition(r.condition(), r.location()),
                    r.location()));
        }
        return out;
    }

    private List<UseBackendRule> routes(List<UseBackendRule> routes) {
        List<UseBackendRule> out = new ArrayList<>(routes.size());
        for (UseBackendRule r : routes) {
            out.add(new UseBackendRule(
                    name(r.backend(), r.location()), condition(r.condition(), r.location()), r.location()));
        }
        return out;
    }

    private Condition condition(Condition condition, SourceLocation location) {
        if (condition == null) {
            return null;
        }
        List<String> terms = new ArrayList<>(condition.terms().size());
        for (String term : condition.terms()) {
            terms.add(name(term, location));
        }
        return condition.withTerms(terms);
    }

    private List<Directive> directives(List<Directive> directives) {
        List<Directive> out = new ArrayList<>(directives.size());
        for (Directive d : directives) {
            out.add(new Directive(d.name(), values(d.args(), d.location()), d.location()));
        }
        return out;
    }

    Properties properties(Properties properties, SourceLocation location) {
        return properties.mapValues(v -> value(v, location));
    }

    List<Value> values(List<Value> values, SourceLocation location) {
        List<Value> out = new ArrayList<>(values.size());
        for (Value v : values) {
            out.add(value(v, location));
        }
        return out;
    }
}
