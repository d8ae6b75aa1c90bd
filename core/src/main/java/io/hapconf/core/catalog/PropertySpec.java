package io.hapconf.core.catalog;

import java.util.Objects;

/**
 * Catalog entry for one modeled property.
 *
 * @param key       internal snake_case key, e.g. {@code timeout_connect}
 * @param keyword   target keyword, e.g. {@code timeout connect}
 * @param rendering how the value is written
 * @param domain    accepted values
 * @param trailing  rendered after ACLs and rules instead of with the other properties
 */
public record PropertySpec(String key, String keyword, Rendering rendering, ValueDomain domain, boolean trailing) {

    public PropertySpec {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(keyword, "keyword must not be null");
        Objects.requireNonNull(rendering, "rendering must not be null");
        Objects.requireNonNull(domain, "domain must not be null");
    }
}
