package io.hapconf.core.build;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.hapconf.core.catalog.PropertyCatalog;
import io.hapconf.core.error.BuildException;
import io.hapconf.core.error.TranslateException;
import io.hapconf.core.model.Backend;
import io.hapconf.core.model.Bind;
import io.hapconf.core.model.Config;
import io.hapconf.core.model.Defaults;
import io.hapconf.core.model.ForLoop;
import io.hapconf.core.model.Frontend;
import io.hapconf.core.model.Iteration;
import io.hapconf.core.model.Listen;
import io.hapconf.core.model.LuaScript;
import io.hapconf.core.model.RequestRule;
import io.hapconf.core.model.Server;
import io.hapconf.core.model.ServerTemplate;
import io.hapconf.core.model.Template;
import io.hapconf.core.model.Value;
import io.hapconf.core.syntax.DslParser;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class IrBuilderTest {

    private final IrBuilder builder = new IrBuilder(PropertyCatalog.standard());

    private Config build(String body) {
        return builder.build(DslParser.parse("config x {\n" + body + "\n}", "t.hap"));
    }

    private Backend backend(String body) {
        return build("backend b {\n" + body + "\n}").backends().get(0);
    }

    @Nested
    @DisplayName("Sections")
    class Sections {

        @Test
        void declarationOrderKept() {
            Config config = build("backend b { }\nfrontend f { }\nlisten l { }\nbackend a { }");

            assertThat(config.name()).isEqualTo("x");
            assertThat(config.sections()).hasSize(4);
            assertThat(config.sections().get(0)).isInstanceOf(Backend.class);
            assertThat(config.sections().get(1)).isInstanceOf(Frontend.class);
            assertThat(config.sections().get(2)).isInstanceOf(Listen.class);
            assertThat(config.backends()).extracting(Backend::name).containsExactly("b", "a");
        }

        @Test
        void globalAndDefaultsOptional() {
            Config config = build("frontend f { }");
            assertThat(config.global()).isNull();
            assertThat(config.defaults()).isNull();
        }

        @Test
        void duplicateGlobalRejected() {
            assertThatThrownBy(() -> build("  global { }\n  global { }"))
                    .isInstanceOf(BuildException.class)
                    .hasMessage("Duplicate 'global' section; first declared at t.hap:2:3")
                    .satisfies(e -> {
                        BuildException be = (BuildException) e;
                        assertThat(be.phase()).isEqualTo(TranslateException.Phase.BUILD);
                        assertThat(be.location().line()).isEqualTo(3);
                    });
        }

        @Test
        void serverOutsideBackendRejected() {
            assertThatThrownBy(() -> build("frontend f {\n  server s1 address: \"10.0.0.1\"\n}"))
                    .isInstanceOf(BuildException.class)
                    .hasMessage("'server s1' is not allowed in frontend 'f'; servers must be declared inside a"
                            + " backend or listen section");
        }

        @Test
        void bindInBackendRejected() {
            assertThatThrownBy(() -> backend("bind *:80"))
                    .isInstanceOf(BuildException.class)
                    .hasMessage("'bind' is not allowed in backend 'b'");
        }

        @Test
        void duplicateHealthCheckRejected() {
            assertThatThrownBy(() -> backend("health-check { uri: /a }\nhealth-check { uri: /b }"))
                    .isInstanceOf(BuildException.class)
                    .hasMessage("Duplicate 'health-check' block in backend 'b'");
        }

        @Test
        void configLevelProperty() {
            Config config = build("version: \"2.8\"");
            assertThat(config.properties().get("version")).contains(Value.str("2.8"));
        }
    }

    @Nested
    @DisplayName("Property keys")
    class PropertyKeys {

        @Test
        void modeledAndExtrasSeparated() {
            Backend b = backend("balance: roundrobin\nhttp-reuse: safe");

            assertThat(b.properties().keys()).containsExactly("balance");
            assertThat(b.extras().keys()).containsExactly("http_reuse");
            assertThat(b.extras().get("http_reuse")).contains(Value.ident("safe"));
        }

        @Test
        void timeoutObjectFlattened() {
            Defaults d = build("defaults {\n  timeout: { connect: 5s, client: 30s }\n}").defaults();

            assertThat(d.properties().keys()).containsExactly("timeout_connect", "timeout_client");
            assertThat(d.properties().get("timeout_connect")).contains(new Value.Duration(5, "s"));
        }

        @Test
        void timeoutBlockFlattened() {
            Defaults d = build("defaults {\n  timeout {\n    http-request: 10s\n  }\n}").defaults();
            assertThat(d.properties().get("timeout_http_request")).contains(new Value.Duration(10, "s"));
        }

        @Test
        void otherBlockUsesDottedKeys() {
            Backend b = backend("compression {\n  algo: gzip\n}");
            assertThat(b.extras().get("compression.algo")).contains(Value.ident("gzip"));
        }

        @Test
        void repeatedKeysAccumulate() {
            Backend b = backend("option: httplog\noption: forwardfor");
            assertThat(b.properties().get("option"))
                    .contains(Value.list(List.of(Value.ident("httplog"), Value.ident("forwardfor"))));
        }

        @Test
        void aliasesApplied() {
            Config config = build("frontend f {\n  route {\n    default: app\n  }\n}\n"
                    + "backend b {\n  server s1 cert: \"/x.pem\" check-interval: 2s\n}");

            assertThat(config.frontends().get(0).properties().get("default_backend")).contains(Value.ident("app"));
            Server s1 = (Server) config.backends().get(0).servers().get(0);
            assertThat(s1.properties().keys()).containsExactly("crt", "inter");
        }

        @Test
        void multipleValuesBecomeList() {
            Config config = build("global {\n  log: \"/dev/log\" local0\n}");
            assertThat(config.global().properties().get("log"))
                    .contains(Value.list(List.of(Value.str("/dev/log"), Value.ident("local0"))));
        }

        @Test
        void numberOverflowRejected() {
            assertThatThrownBy(() -> build("global {\n  maxconn: 99999999999999999999\n}"))
                    .isInstanceOf(BuildException.class)
                    .hasMessage("Number out of range: 99999999999999999999");
        }

        @Test
        void rangeOutsideLoopRejected() {
            assertThatThrownBy(() -> build("global {\n  x: 1..3\n}"))
                    .isInstanceOf(BuildException.class)
                    .hasMessage("A range is only allowed in a for loop or a server-template count");
        }
    }

    @Nested
    @DisplayName("Servers and loops")
    class ServersAndLoops {

        @Test
        void bareWordsBecomeFlags() {
            Backend b = backend("server s1 {\n  address: \"10.0.0.1\"\n  check\n  backup\n}");
            Server s1 = (Server) b.servers().get(0);

            assertThat(s1.properties().keys()).containsExactly("address", "check", "backup");
            assertThat(s1.properties().get("check")).contains(Value.bool(true));
        }

        @Test
        void spreadsRecordedInOrder() {
            Backend b = backend("server s1 address: \"10.0.0.1\" @base @tls");
            assertThat(((Server) b.servers().get(0)).spreads()).containsExactly("base", "tls");
        }

        @Test
        void serverTemplateRangeCount() {
            Backend b = backend("server-template web 1..3 address: \"api.local\"");
            ServerTemplate t = (ServerTemplate) b.servers().get(0);

            assertThat(t.prefix()).isEqualTo("web");
            assertThat(t.count()).isEqualTo(Value.str("1-3"));
        }

        @Test
        void loopKeepsBoundsAsValues() {
            Backend b = backend("for i in 1..${n} {\n  server \"s${i}\" address: \"10.0.0.${i}\"\n}");
            ForLoop loop = (ForLoop) b.servers().get(0);

            assertThat(loop.variable()).isEqualTo("i");
            assertThat(loop.iteration()).isEqualTo(
                    new Iteration.Range(Value.num(1), new Value.Interpolated("${n}")));
            assertThat(loop.body()).hasSize(1);
            assertThat(((Server) loop.body().get(0)).name()).isEqualTo("s${i}");
        }

        @Test
        void topLevelLoopOverList() {
            Config config = build("for dc in [east, west] {\n  backend \"app_${dc}\" { }\n}");
            ForLoop loop = (ForLoop) config.sections().get(0);

            assertThat(loop.iteration()).isEqualTo(
                    new Iteration.Items(List.of(Value.ident("east"), Value.ident("west"))));
            assertThat(config.hasLoops()).isTrue();
        }
    }

    @Nested
    @DisplayName("Leaf constructs")
    class LeafConstructs {

        @Test
        void bindAddressAndOptions() {
            Frontend f = build("frontend f {\n  bind *:443 tfo ssl crt: \"/x.pem\"\n}").frontends().get(0);
            Bind bind = f.binds().get(0);

            assertThat(bind.address()).isEqualTo(Value.ident("*:443"));
            assertThat(bind.properties().keys()).containsExactly("ssl", "crt");
            assertThat(bind.extras().get("tfo")).contains(Value.bool(true));
        }

        @Test
        void aclCriterionAndValues() {
            Frontend f = build("frontend f {\n  acl is_api path_beg /api /v2\n}").frontends().get(0);

            assertThat(f.acls().get(0).name()).isEqualTo("is_api");
            assertThat(f.acls().get(0).criterion()).isEqualTo("path_beg");
            assertThat(f.acls().get(0).values()).containsExactly(Value.ident("/api"), Value.ident("/v2"));
        }

        @Test
        void conditionKeepsQuotedTerms() {
            Frontend f = build("frontend f {\n  use_backend api if { hdr(host) -m str \"x\" }\n}").frontends().get(0);
            assertThat(f.routes().get(0).condition().render()).isEqualTo("if { hdr(host) -m str \"x\" }");
        }

        @Test
        void requestRuleParts() {
            Frontend f = build("frontend f {\n  http-request deny status: 403 if !ok\n}").frontends().get(0);
            RequestRule rule = f.requestRules().get(0);

            assertThat(rule.action()).isEqualTo("deny");
            assertThat(rule.params().get("status")).contains(Value.num(403));
            assertThat(rule.condition().aclNames()).containsExactly("ok");
        }

        @Test
        void healthCheckExpectation() {
            Backend b = backend("health-check {\n  uri: /health\n  expect: status 200\n}");
            assertThat(b.healthCheck().properties().get("expect_status")).contains(Value.num(200));
        }

        @Test
        void bareExpectMeansStatus() {
            Backend b = backend("health-check {\n  expect: 204\n}");
            assertThat(b.healthCheck().properties().get("expect_status")).contains(Value.num(204));
        }

        @Test
        void unknownExpectationRejected() {
            assertThatThrownBy(() -> backend("health-check {\n  expect: body 1\n}"))
                    .isInstanceOf(BuildException.class)
                    .hasMessageStartingWith("Unknown health-check expectation 'body'");
        }

        @Test
        void envReferenceWithDefault() {
            Config config = build("let home = env(\"HOME\", \"/root\")");
            assertThat(config.variables().get(0).value())
                    .isEqualTo(new Value.EnvRef("HOME", Value.str("/root")));
        }

        @Test
        void envTooManyArgumentsRejected() {
            assertThatThrownBy(() -> build("let v = env(\"A\", 1, 2)"))
                    .isInstanceOf(BuildException.class)
                    .hasMessageContaining("got 3 arguments");
        }

        @Test
        void templateHoldsPropertiesOnly() {
            Template t = build("template base {\n  check\n  inter: 2s\n}").templates().get(0);
            assertThat(t.properties().keys()).containsExactly("check", "inter");

            assertThatThrownBy(() -> build("template base {\n  server s1 address: \"x\"\n}"))
                    .isInstanceOf(BuildException.class)
                    .hasMessage("'server s1' is not allowed inside template 'base'; templates hold properties only");
        }

        @Test
        void luaScriptsCollected() {
            Config config = build("global {\n  lua {\n    load \"/etc/haproxy/cors.lua\"\n  }\n}\n"
                    + "lua {\n  inline auth {\n      return 1\n  }\n}");

            assertThat(config.luaScripts()).extracting(LuaScript::name).containsExactly("cors", "auth");
            assertThat(config.luaScripts().get(0).source()).isEqualTo(LuaScript.LuaSource.FILE);
            assertThat(config.luaScripts().get(0).content()).isEqualTo("/etc/haproxy/cors.lua");
            assertThat(config.luaScripts().get(1).content()).isEqualTo("return 1\n");
        }
    }

    @Test
    void dedentRemovesCommonIndent() {
        assertThat(IrBuilder.dedent("\n    a\n      b\n    \n")).isEqualTo("a\n  b\n");
        assertThat(IrBuilder.dedent("\n  x  \n\n  y\n")).isEqualTo("x\n\ny\n");
    }
}
