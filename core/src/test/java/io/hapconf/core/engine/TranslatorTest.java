package io.hapconf.core.engine;

import static io.hapconf.core.TestFixtures.NO_ENV;
import static io.hapconf.core.TestFixtures.dsl;
import static io.hapconf.core.TestFixtures.env;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.hapconf.core.error.Diagnostic;
import io.hapconf.core.error.Diagnostics;
import io.hapconf.core.error.ParseException;
import io.hapconf.core.error.ResolutionException;
import io.hapconf.core.error.TranslateException;
import io.hapconf.core.error.ValidationError;
import io.hapconf.core.error.ValidationException;
import java.util.Arrays;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * End-to-end tests for {@link Translator}: DSL text in, configuration text out, through every
 * pipeline stage.
 */
@DisplayName("Translator")
class TranslatorTest {

    private Translator translator;

    @BeforeEach
    void setUp() {
        translator = new Translator();
    }

    private String translate(String source) {
        return translator.translate(source, NO_ENV).output();
    }

    private static long serverLines(String output) {
        return Arrays.stream(output.split("\n"))
                .filter(line -> line.startsWith("    server "))
                .count();
    }

    @Nested
    @DisplayName("Golden output")
    class Golden {

        @Test
        @DisplayName("minimal config renders exactly")
        void smallConfig() {
            TranslationResult result = translator.translate(dsl("small.hap"), "small.hap", NO_ENV);

            assertThat(result.output()).isEqualTo(dsl("small.cfg"));
            assertThat(result.warnings()).isEmpty();
            assertThat(result.scripts()).isEmpty();
            assertThat(result.output()).endsWith("check\n").doesNotEndWith("\n\n");
        }

        @Test
        @DisplayName("cluster with loops, templates, variables and inline Lua renders exactly")
        void webCluster() {
            TranslationResult result = translator.translate(dsl("web-cluster.hap"), "web-cluster.hap", NO_ENV);

            assertThat(result.output()).isEqualTo(dsl("web-cluster.cfg"));
            assertThat(result.hasWarnings()).isFalse();
        }

        @Test
        @DisplayName("inline Lua is extracted and referenced by lua-load")
        void inlineLuaExtracted() {
            TranslationResult result = translator.translate(dsl("web-cluster.hap"), NO_ENV);

            assertThat(result.scripts()).hasSize(1);
            ExtractedScript script = result.scripts().get(0);
            assertThat(script.name()).isEqualTo("auth");
            assertThat(script.path()).isEqualTo("lua/auth.lua");
            assertThat(script.body())
                    .isEqualTo("core.register_action(\"auth\", { \"http-req\" }, function(txn)\n"
                            + "  txn:set_var(\"req.authed\", true)\n"
                            + "end)\n");
            assertThat(result.output()).contains("    lua-load lua/auth.lua\n");
        }

        @Test
        @DisplayName("script directory and indent come from the options")
        void optionsApplied() {
            Translator custom = new Translator(
                    ParserRegistry.withDefaults(), new TranslatorOptions(10, "\t", "scripts/", "dsl"));

            TranslationResult result = custom.translate(dsl("web-cluster.hap"), NO_ENV);

            assertThat(result.scripts().get(0).path()).isEqualTo("scripts/auth.lua");
            assertThat(result.output()).contains("\tlua-load scripts/auth.lua\n");
            assertThat(result.output()).contains("\nbackend app\n\thttp-request set-header Host api.example.com\n");
        }
    }

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        @Test
        @DisplayName("same input yields byte-identical output")
        void repeatedRunsIdentical() {
            String first = translate(dsl("web-cluster.hap"));
            String second = translate(dsl("web-cluster.hap"));
            String third = new Translator().translate(dsl("web-cluster.hap"), NO_ENV).output();

            assertThat(second).isEqualTo(first);
            assertThat(third).isEqualTo(first);
        }

        @Test
        @DisplayName("sections of one kind keep declaration order")
        void declarationOrderKept() {
            String output = translate("""
                    config order {
                      backend zeta { server z1 address: "10.0.0.1" }
                      frontend fe { bind *:80 }
                      backend alpha { server a1 address: "10.0.0.2" }
                    }
                    """);

            assertThat(output.indexOf("frontend fe")).isLessThan(output.indexOf("backend zeta"));
            assertThat(output.indexOf("backend zeta")).isLessThan(output.indexOf("backend alpha"));
        }
    }

    @Nested
    @DisplayName("Loops")
    class Loops {

        @Test
        @DisplayName("a range of five produces five servers")
        void rangeCardinality() {
            String output = translate("""
                    config loops {
                      backend pool {
                        servers {
                          for i in 1..5 {
                            server "node${i}" { address: "10.0.0.${i}" port: ${8000 + i} }
                          }
                        }
                      }
                    }
                    """);

            assertThat(serverLines(output)).isEqualTo(5);
            assertThat(output)
                    .contains("    server node1 10.0.0.1:8001\n")
                    .contains("    server node5 10.0.0.5:8005\n");
        }

        @Test
        @DisplayName("an empty range produces no servers and a warning")
        void emptyRange() {
            TranslationResult result = translator.translate("""
                    config loops {
                      backend pool {
                        servers {
                          for i in [1..0] {
                            server "node${i}" { address: "10.0.0.${i}" }
                          }
                        }
                      }
                    }
                    """, NO_ENV);

            assertThat(serverLines(result.output())).isZero();
            assertThat(result.warnings())
                    .extracting(Diagnostic::message)
                    .containsExactly("Backend 'pool' has no servers");
        }

        @Test
        @DisplayName("a section loop over a list produces one section per item")
        void sectionLoop() {
            String output = translate("""
                    config regions {
                      for region in ["us", "eu"] {
                        backend "be_${region}" {
                          server s1 address: "${region}.internal" port: 80
                        }
                      }
                    }
                    """);

            assertThat(output)
                    .contains("backend be_us\n    server s1 us.internal:80\n")
                    .contains("backend be_eu\n    server s1 eu.internal:80\n");
            assertThat(output.indexOf("backend be_us")).isLessThan(output.indexOf("backend be_eu"));
        }

        @Test
        @DisplayName("nested loops multiply")
        void nestedLoops() {
            String output = translate("""
                    config grid {
                      backend pool {
                        servers {
                          for rack in [1..2] {
                            for slot in [1..3] {
                              server "r${rack}s${slot}" { address: "10.${rack}.0.${slot}" }
                            }
                          }
                        }
                      }
                    }
                    """);

            assertThat(serverLines(output)).isEqualTo(6);
            assertThat(output).contains("    server r2s3 10.2.0.3\n");
        }

        @Test
        @DisplayName("a reversed range is rejected")
        void reversedRange() {
            assertThatThrownBy(() -> translate("""
                            config loops {
                              backend pool {
                                servers {
                                  for i in [3..1] { server "n${i}" { address: "10.0.0.1" } }
                                }
                              }
                            }
                            """))
                    .isInstanceOf(ResolutionException.class)
                    .hasMessageContaining("reversed range bounds 3..1")
                    .extracting(e -> ((TranslateException) e).phase())
                    .isEqualTo(TranslateException.Phase.UNROLL);
        }

        @Test
        @DisplayName("a loop generating the same name twice is rejected")
        void duplicateGeneratedName() {
            assertThatThrownBy(() -> translate("""
                            config loops {
                              backend pool {
                                servers {
                                  for i in [1..2] { server web { address: "10.0.0.${i}" } }
                                }
                              }
                            }
                            """))
                    .isInstanceOf(ResolutionException.class)
                    .hasMessageContaining("generates the name 'web' more than once");
        }
    }

    @Nested
    @DisplayName("Templates")
    class Templates {

        @Test
        @DisplayName("local properties win over templates, later spreads over earlier ones")
        void precedence() {
            String output = translate("""
                    config t {
                      template base { weight: 10  inter: 2s }
                      template fast { inter: 1s }
                      backend b {
                        server s1 { address: "10.0.0.1" weight: 50 @base @fast }
                      }
                    }
                    """);

            assertThat(output).contains("    server s1 10.0.0.1 inter 1s weight 50\n");
        }

        @Test
        @DisplayName("an unknown template is a validation error")
        void unknownTemplate() {
            assertThatThrownBy(() -> translate("""
                            config t {
                              backend b { server s1 address: "10.0.0.1" @missing }
                            }
                            """))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Unknown template 'missing' spread into server 's1' in backend 'b'");
        }
    }

    @Nested
    @DisplayName("Variables")
    class Variables {

        @Test
        @DisplayName("bindings referring to later bindings resolve to a fixpoint")
        void forwardReferences() {
            String output = translate("""
                    config vars {
                      let host = "${prefix}.${zone}"
                      let prefix = "app"
                      let zone = "${region}.example.com"
                      let region = "eu"
                      backend b { server s1 address: "${host}" port: ${base + 1} }
                      let base = 8000
                    }
                    """);

            assertThat(output).contains("    server s1 app.eu.example.com:8001\n");
        }

        @Test
        @DisplayName("a cycle is reported with every variable in it")
        void cycle() {
            assertThatThrownBy(() -> translate("""
                            config vars {
                              let a = "${b}"
                              let b = "${a}"
                              backend x { server s1 address: "${a}" }
                            }
                            """))
                    .isInstanceOf(ResolutionException.class)
                    .hasMessageContaining("Circular variable reference")
                    .satisfies(e -> assertThat(((ResolutionException) e).names()).containsExactly("a", "b"));
        }

        @Test
        @DisplayName("a chain deeper than the pass limit fails to converge")
        void passLimit() {
            String source = """
                    config vars {
                      let a = "${b}"
                      let b = "${c}"
                      let c = 1
                      backend x { server s1 address: "10.0.0.${a}" }
                    }
                    """;
            Translator limited = new Translator(
                    ParserRegistry.withDefaults(), new TranslatorOptions(1, "    ", "lua", "dsl"));

            assertThat(translate(source)).contains("server s1 10.0.0.1\n");
            assertThatThrownBy(() -> limited.translate(source, NO_ENV))
                    .isInstanceOf(ResolutionException.class)
                    .hasMessageContaining("did not converge after 1 passes");
        }

        @Test
        @DisplayName("an undefined variable names the variable")
        void undefinedVariable() {
            assertThatThrownBy(() -> translate("""
                            config vars {
                              backend x { server s1 address: "${nowhere}" }
                            }
                            """))
                    .isInstanceOf(ResolutionException.class)
                    .hasMessageContaining("Undefined variable 'nowhere'")
                    .satisfies(e -> assertThat(((ResolutionException) e).names()).containsExactly("nowhere"));
        }

        @Test
        @DisplayName("a quoted bind address is interpolated from loop variables")
        void quotedBindAddressInLoop() {
            String output = translate("""
                    config binds {
                      for i in [1..2] {
                        frontend "fe${i}" {
                          bind "*:${8000 + i}"
                          default_backend: b
                        }
                      }
                      backend b { server s1 address: "10.0.0.1" port: 80 }
                    }
                    """);

            assertThat(output).contains("    bind *:8001\n", "    bind *:8002\n").doesNotContain("${");
        }

        @Test
        @DisplayName("a quoted bind address is interpolated from let bindings")
        void quotedBindAddressFromLet() {
            String output = translate("""
                    config binds {
                      let p = 8443
                      frontend f {
                        bind "*:${p}"
                        default_backend: b
                      }
                      backend b { server s1 address: "10.0.0.1" port: 80 }
                    }
                    """);

            assertThat(output).contains("    bind *:8443\n").doesNotContain("${");
        }

        @Test
        @DisplayName("an undefined variable in a quoted bind address is reported")
        void quotedBindAddressUndefined() {
            String source = """
                    config binds {
                      frontend f {
                        bind "*:${nope}"
                        default_backend: b
                      }
                      backend b { server s1 address: "10.0.0.1" port: 80 }
                    }
                    """;

            assertThatThrownBy(() -> translate(source))
                    .isInstanceOf(ResolutionException.class)
                    .hasMessageContaining("Undefined variable 'nope'");
            assertThat(translator.validateOnly(source, NO_ENV).all())
                    .extracting(Diagnostic::phase)
                    .containsExactly(TranslateException.Phase.RESOLVE);
        }

        @Test
        @DisplayName("env() uses the environment, then the default")
        void envLookup() {
            String source = """
                    config vars {
                      backend x { server s1 address: env("BACKEND_HOST", "127.0.0.1") port: 80 }
                    }
                    """;

            assertThat(translator.translate(source, env(Map.of("BACKEND_HOST", "10.9.9.9"))).output())
                    .contains("    server s1 10.9.9.9:80\n");
            assertThat(translate(source)).contains("    server s1 127.0.0.1:80\n");
        }

        @Test
        @DisplayName("env() without default fails when the variable is unset")
        void envMissing() {
            assertThatThrownBy(() -> translate("""
                            config vars {
                              let host = env("BACKEND_HOST")
                              backend x { server s1 address: "${host}" }
                            }
                            """))
                    .isInstanceOf(ResolutionException.class)
                    .hasMessageContaining("Environment variable 'BACKEND_HOST' is not set")
                    .extracting(e -> ((TranslateException) e).phase())
                    .isEqualTo(TranslateException.Phase.RESOLVE);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("every violation is reported at once")
        void allErrorsCollected() {
            assertThatThrownBy(() -> translator.translate(dsl("invalid-references.hap"), "invalid.hap", NO_ENV))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(e -> assertThat(((ValidationException) e).errors())
                            .extracting(ValidationError::message)
                            .containsExactly(
                                    "Frontend 'www': default_backend references undefined backend 'nowhere'",
                                    "Frontend 'www' routes to undefined backend 'missing'",
                                    "Frontend 'www' references undefined ACL 'is_admin'",
                                    "Backend 'app': HTTP option 'httplog' used in TCP mode",
                                    "Server 'a1' in backend 'app': property 'port': value 70000 is outside the"
                                            + " range 1-65535"));
        }

        @Test
        @DisplayName("a route may target a listen section")
        void routeToListen() {
            String output = translate("""
                    config l {
                      frontend fe {
                        bind *:80
                        use_backend stats
                      }
                      listen stats {
                        bind *:8404
                        server s1 address: "127.0.0.1" port: 9000
                      }
                    }
                    """);

            assertThat(output).contains("    use_backend stats\n").contains("listen stats\n    bind *:8404\n");
        }
    }

    @Nested
    @DisplayName("validateOnly")
    class ValidateOnly {

        @Test
        @DisplayName("a valid config yields no errors")
        void valid() {
            Diagnostics diagnostics = translator.validateOnly(dsl("web-cluster.hap"), NO_ENV);

            assertThat(diagnostics.hasErrors()).isFalse();
            assertThat(diagnostics.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("validation errors come first, then warnings")
        void errorsThenWarnings() {
            Diagnostics diagnostics = translator.validateOnly("""
                    config v {
                      frontend quiet { default_backend: none }
                      backend empty { mode: http }
                    }
                    """, "v.hap", NO_ENV);

            assertThat(diagnostics.errors()).hasSize(1);
            assertThat(diagnostics.warnings())
                    .extracting(Diagnostic::message)
                    .containsExactly("Frontend 'quiet' has no bind directives", "Backend 'empty' has no servers");
            assertThat(diagnostics.all().get(0).isError()).isTrue();
            assertThat(diagnostics.all().get(0).phase()).isEqualTo(TranslateException.Phase.VALIDATE);
            assertThat(diagnostics.all().get(0).location().source()).isEqualTo("v.hap");
        }

        @Test
        @DisplayName("a syntax error becomes a single diagnostic and does not throw")
        void parseErrorReported() {
            Diagnostics diagnostics = translator.validateOnly("config x {\n  frontend }\n", "x.hap", NO_ENV);

            assertThat(diagnostics.size()).isEqualTo(1);
            Diagnostic d = diagnostics.all().get(0);
            assertThat(d.phase()).isEqualTo(TranslateException.Phase.PARSE);
            assertThat(d.location().line()).isEqualTo(2);
            assertThat(d.format()).startsWith("x.hap:2:12: error: Expected frontend name");
        }

        @Test
        @DisplayName("translate throws the parse error itself")
        void translateThrowsParseError() {
            assertThatThrownBy(() -> translate("config x {\n  frontend }\n"))
                    .isInstanceOf(ParseException.class)
                    .satisfies(e -> assertThat(((ParseException) e).offendingToken()).isEqualTo("}"));
        }
    }

    @Nested
    @DisplayName("analyze")
    class Analyze {

        @Test
        @DisplayName("returns the resolved tree with inline scripts still in place")
        void returnsResolvedTree() {
            Analysis analysis = translator.analyze(dsl("web-cluster.hap"), "web-cluster.hap", NO_ENV);

            assertThat(analysis.validation().isValid()).isTrue();
            assertThat(analysis.config().backends()).hasSize(2);
            assertThat(analysis.config().backends().get(0).concreteServers()).hasSize(3);
            assertThat(analysis.config().luaScripts().get(0).source())
                    .isEqualTo(io.hapconf.core.model.LuaScript.LuaSource.INLINE);
        }
    }
}
