package io.hapconf.core.syntax;

import io.hapconf.core.build.IrBuilder;
import io.hapconf.core.catalog.PropertyCatalog;
import io.hapconf.core.model.Config;
import io.hapconf.core.spi.ConfigFormat;
import java.util.Set;

/** The native block DSL ({@code .hap} / {@code .haproxy} files). */
public final class DslFormat implements ConfigFormat {

    public static final String ID = "dsl";

    private final IrBuilder builder;

    public DslFormat() {
        this(PropertyCatalog.standard());
    }

    public DslFormat(PropertyCatalog catalog) {
        this.builder = new IrBuilder(catalog);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> fileExtensions() {
        return Set.of("hap", "haproxy");
    }

    @Override
    public Config read(String source, String sourceName) {
        SyntaxNode tree = DslParser.parse(source, sourceName);
        return builder.build(tree);
    }
}
