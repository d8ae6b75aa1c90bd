package io.hapconf.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class CliArgumentsTest {

    @Test
    void inputOnly() {
        CliArguments args = CliArguments.parse(new String[] {"site.hap"});

        assertThat(args.input()).isEqualTo(Path.of("site.hap"));
        assertThat(args.output()).isNull();
        assertThat(args.settings()).isNull();
        assertThat(args.validateOnly()).isFalse();
        assertThat(args.dumpIr()).isFalse();
    }

    @Test
    void everyOption() {
        CliArguments args = CliArguments.parse(new String[] {
            "--settings", "s.yaml", "-o", "out/haproxy.cfg", "--script-dir", "scripts", "--format", "dsl",
            "--validate", "site.hap"
        });

        assertThat(args).isEqualTo(new CliArguments(
                Path.of("s.yaml"), Path.of("out/haproxy.cfg"), "scripts", true, false, "dsl", Path.of("site.hap")));
    }

    @Test
    void longOutputOption() {
        assertThat(CliArguments.parse(new String[] {"--output", "x.cfg", "a.hap"}).output())
                .isEqualTo(Path.of("x.cfg"));
    }

    @Test
    void missingInput() {
        assertThatThrownBy(() -> CliArguments.parse(new String[] {"--validate"}))
                .isInstanceOf(CliArguments.UsageException.class)
                .hasMessage("Missing input file");
    }

    @Test
    void unknownOption() {
        assertThatThrownBy(() -> CliArguments.parse(new String[] {"--watch", "a.hap"}))
                .isInstanceOf(CliArguments.UsageException.class)
                .hasMessage("Unknown option: --watch");
    }

    @Test
    void optionWithoutValue() {
        assertThatThrownBy(() -> CliArguments.parse(new String[] {"a.hap", "-o"}))
                .isInstanceOf(CliArguments.UsageException.class)
                .hasMessage("-o requires a value");
        assertThatThrownBy(() -> CliArguments.parse(new String[] {"--settings", "--validate", "a.hap"}))
                .isInstanceOf(CliArguments.UsageException.class)
                .hasMessage("--settings requires a value");
    }

    @Test
    void twoInputs() {
        assertThatThrownBy(() -> CliArguments.parse(new String[] {"a.hap", "b.hap"}))
                .isInstanceOf(CliArguments.UsageException.class)
                .hasMessage("Only one input file may be given, got 'a.hap' and 'b.hap'");
    }

    @Test
    void conflictingModes() {
        assertThatThrownBy(() -> CliArguments.parse(new String[] {"--validate", "--dump-ir", "a.hap"}))
                .isInstanceOf(CliArguments.UsageException.class)
                .hasMessage("--validate and --dump-ir cannot be combined");
    }
}
