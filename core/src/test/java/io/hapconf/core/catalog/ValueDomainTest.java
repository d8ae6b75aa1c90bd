package io.hapconf.core.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.hapconf.core.model.Value;
import org.junit.jupiter.api.Test;

class ValueDomainTest {

    @Test
    void ranges() {
        assertThat(ValueDomain.PORT.check(Value.num(443))).isEmpty();
        assertThat(ValueDomain.PORT.check(Value.str("8080"))).isEmpty();
        assertThat(ValueDomain.PORT.check(Value.num(0))).contains("value 0 is outside the range 1-65535");
        assertThat(ValueDomain.POSITIVE.check(Value.num(0))).contains("value 0 must be at least 1");
        assertThat(ValueDomain.NON_NEGATIVE.check(Value.ident("many"))).contains("expected an integer, got 'many'");
        assertThatThrownBy(() -> ValueDomain.range(5, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void flags() {
        assertThat(ValueDomain.FLAG.check(Value.bool(false))).isEmpty();
        assertThat(ValueDomain.FLAG.check(Value.ident("yes"))).contains("expected true or false, got 'yes'");
    }

    @Test
    void durations() {
        ValueDomain d = ValueDomain.POSITIVE_DURATION;
        assertThat(d.check(new Value.Duration(5, "s"))).isEmpty();
        assertThat(d.check(Value.num(500))).isEmpty();
        assertThat(d.check(Value.str("30s"))).isEmpty();
        assertThat(d.check(new Value.Duration(0, "ms"))).contains("duration 0ms must be positive");
        assertThat(d.check(Value.num(0))).contains("duration 0 must be positive");
        assertThat(d.check(Value.str("0m"))).contains("duration 0m must be positive");
        assertThat(d.check(Value.str("soon"))).contains("expected a duration, got 'soon'");
    }

    @Test
    void closedSetsAndPatterns() {
        ValueDomain balance = PropertyCatalog.BALANCE;
        assertThat(balance.check(Value.ident("leastconn"))).isEmpty();
        assertThat(balance.check(Value.ident("hdr(host)"))).isEmpty();
        assertThat(balance.check(Value.str("url_param userid"))).isEmpty();
        assertThat(PropertyCatalog.MODE.check(Value.ident("udp")))
                .contains("'udp' is not one of [http, log, tcp]");
    }

    @Test
    void anyAcceptsEverything() {
        assertThat(ValueDomain.ANY.check(new Value.Interpolated("${x}"))).isEmpty();
    }
}
