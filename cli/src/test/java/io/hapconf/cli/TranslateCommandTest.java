package io.hapconf.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** End-to-end runs of the command against files in a temporary directory. */
@DisplayName("hapconf command")
class TranslateCommandTest {

    private static final String WITH_SCRIPT = """
            config site {
              lua {
                inline auth {
                  return true
                }
              }
              frontend www {
                bind *:80
                default_backend: app
              }
              backend app {
                server s1 address: "10.0.0.1" port: ${port}
              }
              let port = env("APP_PORT", 8080)
            }
            """;

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private final Map<String, String> env = new HashMap<>();
    private final String[] loggingApplied = new String[2];

    private TranslateCommand command;

    @BeforeEach
    void setUp() {
        command = new TranslateCommand(
                new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8),
                env::get,
                (format, level) -> {
                    loggingApplied[0] = format;
                    loggingApplied[1] = level;
                });
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String text) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, text);
        return file;
    }

    @Nested
    @DisplayName("Translate")
    class Translate {

        @Test
        @DisplayName("Output file and extracted scripts written beside it")
        void writesOutputAndScripts() throws Exception {
            Path input = write("site.hap", WITH_SCRIPT);
            Path output = tempDir.resolve("out/haproxy.cfg");

            int status = command.run(new String[] {"-o", output.toString(), input.toString()});

            assertThat(status).isEqualTo(TranslateCommand.EXIT_OK);
            assertThat(Files.readString(output))
                    .startsWith("# Generated HAProxy configuration: site\n")
                    .contains("    lua-load lua/auth.lua\n")
                    .contains("    server s1 10.0.0.1:8080\n");
            assertThat(Files.readString(tempDir.resolve("out/lua/auth.lua"))).isEqualTo("return true\n");
            assertThat(err()).isEmpty();
        }

        @Test
        @DisplayName("Environment reaches env() lookups")
        void environmentUsed() throws Exception {
            env.put("APP_PORT", "9001");
            Path input = write("site.hap", WITH_SCRIPT);
            Path output = tempDir.resolve("haproxy.cfg");

            command.run(new String[] {"-o", output.toString(), input.toString()});

            assertThat(Files.readString(output)).contains("    server s1 10.0.0.1:9001\n");
        }

        @Test
        @DisplayName("Script directory override")
        void scriptDirOverride() throws Exception {
            Path input = write("site.hap", WITH_SCRIPT);
            Path output = tempDir.resolve("haproxy.cfg");

            command.run(new String[] {"--script-dir", "ext", "-o", output.toString(), input.toString()});

            assertThat(Files.readString(output)).contains("lua-load ext/auth.lua");
            assertThat(tempDir.resolve("ext/auth.lua")).exists();
        }

        @Test
        @DisplayName("No output file → configuration on stdout, warnings on stderr")
        void printsToStdout() throws Exception {
            Path input = write("w.hap", "config w {\n  frontend f { }\n}\n");

            int status = command.run(new String[] {input.toString()});

            assertThat(status).isEqualTo(TranslateCommand.EXIT_OK);
            assertThat(out()).startsWith("# Generated HAProxy configuration: w\n").contains("frontend f\n");
            assertThat(err()).contains("warning: Frontend 'f' has no bind directives");
        }

        @Test
        @DisplayName("Invalid source → diagnostics, exit 1, nothing written")
        void invalidSource() throws Exception {
            Path input = write("bad.hap", "config bad {\n  backend b {\n    server s1 port: 80\n  }\n}\n");
            Path output = tempDir.resolve("haproxy.cfg");

            int status = command.run(new String[] {"-o", output.toString(), input.toString()});

            assertThat(status).isEqualTo(TranslateCommand.EXIT_FAILURE);
            assertThat(err()).contains(":3:5: error: Server 's1' in backend 'b' has no address");
            assertThat(output).doesNotExist();
        }

        @Test
        @DisplayName("Parse error → one diagnostic, exit 1")
        void parseError() throws Exception {
            Path input = write("p.hap", "config p {\n");

            assertThat(command.run(new String[] {input.toString()})).isEqualTo(TranslateCommand.EXIT_FAILURE);
            assertThat(err()).contains(": error: ").doesNotContain("Usage:");
        }
    }

    @Nested
    @DisplayName("Modes")
    class Modes {

        @Test
        void validateOnlyWritesNothing() throws Exception {
            Path input = write("site.hap", WITH_SCRIPT);

            int status = command.run(new String[] {"--validate", input.toString()});

            assertThat(status).isEqualTo(TranslateCommand.EXIT_OK);
            assertThat(out()).contains("site.hap: valid (0 warning(s))");
            assertThat(tempDir.resolve("lua")).doesNotExist();
        }

        @Test
        void validateReportsErrorCount() throws Exception {
            Path input = write("bad.hap", "config bad {\n  frontend f {\n    bind *:80\n    use_backend nope\n  }\n}\n");

            int status = command.run(new String[] {"--validate", input.toString()});

            assertThat(status).isEqualTo(TranslateCommand.EXIT_FAILURE);
            assertThat(err()).contains("routes to undefined backend 'nope'").contains(": 1 error(s)");
        }

        @Test
        void dumpIrPrintsJson() throws Exception {
            Path input = write("site.hap", WITH_SCRIPT);

            int status = command.run(new String[] {"--dump-ir", input.toString()});

            assertThat(status).isEqualTo(TranslateCommand.EXIT_OK);
            assertThat(out()).contains("\"kind\" : \"config\"").contains("\"name\" : \"site\"");
        }
    }

    @Nested
    @DisplayName("Setup failures")
    class SetupFailures {

        @Test
        void usageErrorExitsTwo() {
            assertThat(command.run(new String[] {})).isEqualTo(TranslateCommand.EXIT_USAGE);
            assertThat(err()).contains("hapconf: Missing input file").contains(CliArguments.USAGE);
        }

        @Test
        void missingInputFile() {
            Path missing = tempDir.resolve("nope.hap");
            assertThat(command.run(new String[] {missing.toString()})).isEqualTo(TranslateCommand.EXIT_FAILURE);
            assertThat(err()).contains("hapconf: input file not found: ");
        }

        @Test
        void unknownFormat() throws Exception {
            Path input = write("site.hap", WITH_SCRIPT);
            assertThat(command.run(new String[] {"--format", "yaml", input.toString()}))
                    .isEqualTo(TranslateCommand.EXIT_USAGE);
            assertThat(err()).contains("hapconf: unknown format 'yaml'");
        }

        @Test
        void badSettingsFile() throws Exception {
            Path input = write("site.hap", WITH_SCRIPT);
            Path settings = write("s.yaml", "logging:\n  format: xml\n");

            assertThat(command.run(new String[] {"--settings", settings.toString(), input.toString()}))
                    .isEqualTo(TranslateCommand.EXIT_FAILURE);
            assertThat(err()).contains("logging.format must be 'text' or 'json'");
        }

        @Test
        void loggingConfiguredFromSettings() throws Exception {
            Path input = write("site.hap", WITH_SCRIPT);
            Path settings = write("s.yaml", "logging:\n  format: json\n  level: WARN\n");

            command.run(new String[] {"--settings", settings.toString(), "--validate", input.toString()});

            assertThat(loggingApplied).containsExactly("json", "WARN");
        }
    }
}
