package io.hapconf.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ValueTest {

    @Nested
    @DisplayName("Durations")
    class Durations {

        @Test
        void unitsConvertToMicros() {
            assertThat(new Value.Duration(3, "s").toMicros()).isEqualTo(3_000_000L);
            assertThat(new Value.Duration(2, "m").toMicros()).isEqualTo(120_000_000L);
            assertThat(new Value.Duration(1, "d").toMicros()).isEqualTo(86_400_000_000L);
        }

        @Test
        void ofMicrosTruncates() {
            assertThat(Value.Duration.ofMicros(1_500_000, "s")).isEqualTo(new Value.Duration(1, "s"));
            assertThat(Value.Duration.ofMicros(1_500_000, "ms")).isEqualTo(new Value.Duration(1500, "ms"));
        }

        @Test
        void unknownUnitRejected() {
            assertThatThrownBy(() -> new Value.Duration(1, "w"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Unknown duration unit: 'w'");
        }

        @Test
        void textForm() {
            assertThat(new Value.Duration(500, "ms").asText()).isEqualTo("500ms");
        }
    }

    @Test
    void integerContent() {
        assertThat(Value.num(7).asLong()).hasValue(7);
        assertThat(Value.str(" 42 ").asLong()).hasValue(42);
        assertThat(Value.ident("8080").asLong()).hasValue(8080);
        assertThat(Value.str("web").asLong()).isEmpty();
        assertThat(Value.bool(true).asLong()).isEmpty();
        assertThat(new Value.Duration(3, "s").asLong()).isEmpty();
    }

    @Test
    void resolvedOnlyWhenEveryLeafIs() {
        Value pending = new Value.Interpolated("${x}");
        assertThat(Value.list(List.of(Value.num(1), Value.str("a"))).isResolved()).isTrue();
        assertThat(Value.list(List.of(Value.num(1), pending)).isResolved()).isFalse();
        assertThat(new Value.ObjectValue(Map.of("k", pending)).isResolved()).isFalse();
        assertThat(new Value.EnvRef("HOME", null).isResolved()).isFalse();
    }

    @Test
    void containerText() {
        Map<String, Value> entries = new LinkedHashMap<>();
        entries.put("503", Value.str("/e/503"));
        entries.put("504", Value.str("/e/504"));
        assertThat(Value.list(List.of(Value.ident("h2"), Value.ident("http/1.1"))).asText()).isEqualTo("h2 http/1.1");
        assertThat(new Value.ObjectValue(entries).asText()).isEqualTo("503 /e/503 504 /e/504");
    }

    @Test
    void envReferenceText() {
        assertThat(new Value.EnvRef("PORT", null).asText()).isEqualTo("env(\"PORT\")");
        assertThat(new Value.EnvRef("PORT", Value.num(80)).asText()).isEqualTo("env(\"PORT\", 80)");
    }

    @Test
    void mapLeavesReachesNestedItems() {
        Value nested = Value.list(List.of(
                Value.num(1),
                new Value.ObjectValue(Map.of("k", Value.num(2)))));

        Value doubled = nested.mapLeaves(v -> v instanceof Value.Num n ? Value.num(n.value() * 2) : v);

        assertThat(doubled).isEqualTo(Value.list(List.of(
                Value.num(2),
                new Value.ObjectValue(Map.of("k", Value.num(4))))));
    }
}
