package io.hapconf.core.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class KeywordsTest {

    @Test
    void keysNormalizedToSnakeCase() {
        assertThat(Keywords.normalizeKey("hash-type")).isEqualTo("hash_type");
    }

    @Test
    void keywordSpelling() {
        assertThat(Keywords.toKeyword("hash_type")).isEqualTo("hash-type");
        assertThat(Keywords.toKeyword("default_backend")).isEqualTo("default_backend");
        assertThat(Keywords.toKeyword("timeout_http_request")).isEqualTo("timeout http-request");
        assertThat(Keywords.toKeyword("compression.algo")).isEqualTo("compression algo");
    }

    @Test
    void actionSpelling() {
        assertThat(Keywords.toAction("set_header")).isEqualTo("set-header");
        assertThat(Keywords.toAction("lua.auth_check")).isEqualTo("lua.auth_check");
    }
}
