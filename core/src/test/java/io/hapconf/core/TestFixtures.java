package io.hapconf.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.function.Function;

/** Classpath fixtures shared by the core tests. */
public final class TestFixtures {

    /** An environment with no variables set. */
    public static final Function<String, String> NO_ENV = name -> null;

    private TestFixtures() {}

    /** Reads {@code dsl/<name>} from the test classpath. */
    public static String dsl(String name) {
        String resource = "/dsl/" + name;
        try (InputStream in = TestFixtures.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing test fixture: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Function<String, String> env(Map<String, String> vars) {
        return vars::get;
    }
}
