package io.hapconf.core.engine;

import io.hapconf.core.model.Config;
import io.hapconf.core.validate.ValidationResult;

/**
 * The fully transformed IR of one source together with its validation outcome. Produced by
 * {@link Translator#analyze}; the IR is only safe to generate from when {@code
 * validation().isValid()}.
 */
public record Analysis(Config config, ValidationResult validation) {}
