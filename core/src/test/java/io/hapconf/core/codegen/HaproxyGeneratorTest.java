package io.hapconf.core.codegen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.hapconf.core.build.IrBuilder;
import io.hapconf.core.catalog.PropertyCatalog;
import io.hapconf.core.engine.ScriptExtractor;
import io.hapconf.core.error.InternalTranslationException;
import io.hapconf.core.error.TranslateException;
import io.hapconf.core.model.Config;
import io.hapconf.core.model.SourceLocation;
import io.hapconf.core.model.Value;
import io.hapconf.core.syntax.DslParser;
import io.hapconf.core.transform.LoopUnroller;
import io.hapconf.core.transform.TemplateExpander;
import io.hapconf.core.transform.VariableResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class HaproxyGeneratorTest {

    private static final PropertyCatalog CATALOG = PropertyCatalog.standard();

    private final HaproxyGenerator generator = new HaproxyGenerator(CATALOG, "    ");

    private static Config build(String body) {
        return new IrBuilder(CATALOG).build(DslParser.parse("config x {\n" + body + "\n}", "t.hap"));
    }

    private static Config prepare(String body) {
        Config config = new LoopUnroller().unroll(build(body));
        config = new TemplateExpander(CATALOG).expand(config);
        return new VariableResolver(name -> null, 10).resolve(config);
    }

    private String generate(String body) {
        return generator.generate(prepare(body));
    }

    @Nested
    @DisplayName("Layout")
    class Layout {

        @Test
        void emptyConfigIsHeaderOnly() {
            assertThat(generate("")).isEqualTo("# Generated HAProxy configuration: x\n");
        }

        @Test
        void versionInHeader() {
            assertThat(generate("version: \"2.8\""))
                    .startsWith("# Generated HAProxy configuration: x\n# Version: 2.8\n\n");
        }

        @Test
        void sectionsGroupedByKindAndPropertiesInCatalogOrder() {
            String out = generate("""
                    defaults {
                      mode: http
                    }
                    listen l {
                      bind *:9000
                      server s address: "z"
                    }
                    backend b {
                      retries: 3
                      balance: roundrobin
                      mode: http
                      server s address: "y"
                    }
                    frontend f {
                      bind *:80
                      default_backend: b
                      use_backend b if is_x
                      acl is_x path_beg /x
                    }""");

            assertThat(out).isEqualTo("""
                    # Generated HAProxy configuration: x

                    defaults
                        mode http

                    frontend f
                        bind *:80
                        acl is_x path_beg /x
                        use_backend b if is_x
                        default_backend b

                    backend b
                        mode http
                        balance roundrobin
                        retries 3
                        server s y

                    listen l
                        bind *:9000
                        server s z
                    """);
        }

        @Test
        void indentConfigurable() {
            HaproxyGenerator tabs = new HaproxyGenerator(CATALOG, "\t");
            String out = tabs.generate(prepare("backend b {\n  server s1 address: \"x\"\n}"));
            assertThat(out).contains("backend b\n\tserver s1 x\n");
        }

        @Test
        void fileScriptsLoadedFromGlobal() {
            String out = generate("lua {\n  load \"/etc/haproxy/x.lua\"\n}");
            assertThat(out).contains("global\n    lua-load /etc/haproxy/x.lua\n");
        }

        @Test
        void extractedScriptsLoadedAfterGlobalSettings() {
            Config config = prepare("""
                    global {
                      daemon: true
                    }
                    lua {
                      inline auth { return 1 }
                    }""");
            Config extracted = new ScriptExtractor("lua").extract(config).config();

            assertThat(generator.generate(extracted)).contains("global\n    daemon\n    lua-load lua/auth.lua\n");
        }
    }

    @Nested
    @DisplayName("Lines")
    class Lines {

        @Test
        void serverLineInlinesFlagsAndExtras() {
            String out = generate("""
                    backend b {
                      server s1 address: "10.0.0.1" port: 80 weight: 10 check: true on-marked-down: shutdown-sessions
                    }""");

            assertThat(out).contains("    server s1 10.0.0.1:80 check weight 10 on-marked-down shutdown-sessions\n");
        }

        @Test
        void serverTemplateCountRendered() {
            String out = generate("backend b {\n  server-template web 1..3 address: \"app.local\" port: 80\n}");
            assertThat(out).contains("    server-template web 1-3 app.local:80\n");
        }

        @Test
        void healthCheckLines() {
            String out = generate("""
                    backend b {
                      health-check {
                        method: GET
                        uri: /health
                        headers: { Host: "a.local" }
                        expect: string ok
                      }
                      server s1 address: "x"
                    }""");

            assertThat(out).contains("""
                    backend b
                        option httpchk
                        http-check send meth GET uri /health hdr Host "a.local"
                        http-check expect string ok
                        server s1 x
                    """);
        }

        @Test
        void existingHttpchkOptionNotRepeated() {
            String out = generate("""
                    backend b {
                      option: httpchk
                      health-check {
                        expect: status 200
                      }
                      server s1 address: "x"
                    }""");

            assertThat(out).contains("backend b\n    option httpchk\n    http-check expect status 200\n");
            assertThat(out).containsOnlyOnce("option httpchk");
        }

        @Test
        void stickTableAndRules() {
            String out = generate("""
                    backend b {
                      stick-table type: ip size: 100k expire: 30m store: [conn_rate, http_req_rate]
                      http-request set_var var: txn.user value: "%[req.hdr(user)]"
                      http-request deny status: 429 if { src_conn_rate gt 10 }
                      server s1 address: "x"
                    }""");

            assertThat(out).contains("""
                        stick-table type ip size 100k expire 30m store conn_rate,http_req_rate
                        http-request set-var(txn.user) %[req.hdr(user)]
                        http-request deny status 429 if { src_conn_rate gt 10 }
                        server s1 x
                    """);
        }

        @Test
        void keyedLinesFromObject() {
            String out = generate("defaults {\n  errorfile: { 503: \"/etc/503.http\", 504: \"/etc/504.http\" }\n}");
            assertThat(out).contains("    errorfile 503 /etc/503.http\n    errorfile 504 /etc/504.http\n");
        }
    }

    @Nested
    @DisplayName("Broken invariants")
    class BrokenInvariants {

        @Test
        void remainingLoop() {
            Config config = build("for i in 1..2 {\n  backend \"b${i}\" { }\n}");
            assertThatThrownBy(() -> generator.generate(config))
                    .isInstanceOf(InternalTranslationException.class)
                    .hasMessage("Unrolled loop reached the generator")
                    .satisfies(e -> assertThat(((TranslateException) e).phase())
                            .isEqualTo(TranslateException.Phase.GENERATE));
        }

        @Test
        void pendingSpread() {
            Config config = prepare("backend b {\n  @nope\n  server s1 address: \"x\"\n}");
            assertThatThrownBy(() -> generator.generate(config))
                    .isInstanceOf(InternalTranslationException.class)
                    .hasMessage("Unexpanded template spread [nope] on backend 'b' reached the generator");
        }

        @Test
        void unresolvedValue() {
            Config config = build("backend b {\n  server s1 address: \"x\" port: ${p}\n}");
            assertThatThrownBy(() -> generator.generate(config))
                    .isInstanceOf(InternalTranslationException.class)
                    .hasMessage("Unresolved value '${p}' reached the generator");
        }

        @Test
        void inlineScriptNotExtracted() {
            Config config = prepare("lua {\n  inline auth { return 1 }\n}");
            assertThatThrownBy(() -> generator.generate(config))
                    .isInstanceOf(InternalTranslationException.class)
                    .hasMessage("Inline Lua script 'auth' was not extracted before generation");
        }
    }

    @Test
    void quotingRules() {
        assertThat(HaproxyGenerator.quoteIfNeeded("plain")).isEqualTo("plain");
        assertThat(HaproxyGenerator.quoteIfNeeded("")).isEqualTo("\"\"");
        assertThat(HaproxyGenerator.quoteIfNeeded("a b")).isEqualTo("\"a b\"");
        assertThat(HaproxyGenerator.quoteIfNeeded("say \"hi\"")).isEqualTo("\"say \\\"hi\\\"\"");
    }

    @Test
    void renderValues() {
        SourceLocation at = SourceLocation.UNKNOWN;
        assertThat(HaproxyGenerator.render(new Value.Duration(30, "s"), at)).isEqualTo("30s");
        assertThat(HaproxyGenerator.render(Value.str("two words"), at)).isEqualTo("\"two words\"");
        assertThat(HaproxyGenerator.render(Value.bool(true), at)).isEqualTo("true");
    }
}
