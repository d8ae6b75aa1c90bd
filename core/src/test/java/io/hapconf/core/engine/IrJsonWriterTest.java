package io.hapconf.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hapconf.core.model.Config;
import io.hapconf.core.syntax.DslFormat;
import org.junit.jupiter.api.Test;

class IrJsonWriterTest {

    private final IrJsonWriter writer = new IrJsonWriter();

    private static Config read(String body) {
        return new DslFormat().read("config demo {\n" + body + "\n}", "t.hap");
    }

    @Test
    void sectionsAndValuesMapToJsonTypes() {
        ObjectNode root = writer.toJson(read("""
                version: "1.0"
                backend b {
                  http-reuse: safe
                  server s1 address: "10.0.0.1" port: 8080 inter: 3s check: true
                }"""));

        assertThat(root.get("kind").asText()).isEqualTo("config");
        assertThat(root.get("name").asText()).isEqualTo("demo");
        assertThat(root.at("/properties/version").asText()).isEqualTo("1.0");

        JsonNode backend = root.at("/sections/0");
        assertThat(backend.get("kind").asText()).isEqualTo("backend");
        assertThat(backend.at("/extras/http_reuse").asText()).isEqualTo("safe");

        JsonNode server = backend.at("/servers/0/properties");
        assertThat(server.get("port").isNumber()).isTrue();
        assertThat(server.get("port").asLong()).isEqualTo(8080);
        assertThat(server.get("inter").asText()).isEqualTo("3s");
        assertThat(server.get("check").isBoolean()).isTrue();
    }

    @Test
    void unexpandedConstructsShown() {
        ObjectNode root = writer.toJson(read("""
                let token = env("TOKEN", 1)
                template t {
                  check
                }
                backend b {
                  @t
                  for i in 1..3 {
                    server "s${i}" address: "x"
                  }
                }"""));

        assertThat(root.at("/variables/0/value/env").asText()).isEqualTo("TOKEN");
        assertThat(root.at("/variables/0/value/default").asLong()).isEqualTo(1);
        assertThat(root.at("/templates/0/name").asText()).isEqualTo("t");

        JsonNode backend = root.at("/sections/0");
        assertThat(backend.at("/spreads/0").asText()).isEqualTo("t");
        JsonNode loop = backend.at("/servers/0");
        assertThat(loop.get("kind").asText()).isEqualTo("for");
        assertThat(loop.get("variable").asText()).isEqualTo("i");
        assertThat(loop.get("from").asLong()).isEqualTo(1);
        assertThat(loop.get("to").asLong()).isEqualTo(3);
        assertThat(loop.at("/body/0/kind").asText()).isEqualTo("server");
    }

    @Test
    void luaScriptsListed() {
        ObjectNode root = writer.toJson(read("lua {\n  load \"/x.lua\"\n}"));
        assertThat(root.at("/lua/0/source").asText()).isEqualTo("file");
        assertThat(root.at("/lua/0/path").asText()).isEqualTo("/x.lua");
    }

    @Test
    void writtenTextIsPrettyPrintedTree() throws Exception {
        Config config = read("backend b {\n  server s1 address: \"x\"\n}");
        String text = writer.write(config);

        assertThat(text).contains("\n");
        assertThat(new ObjectMapper().readTree(text)).isEqualTo(writer.toJson(config));
    }
}
