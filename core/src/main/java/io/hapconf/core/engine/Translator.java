package io.hapconf.core.engine;

import io.hapconf.core.catalog.PropertyCatalog;
import io.hapconf.core.codegen.HaproxyGenerator;
import io.hapconf.core.error.Diagnostic;
import io.hapconf.core.error.Diagnostics;
import io.hapconf.core.error.TranslateException;
import io.hapconf.core.error.ValidationError;
import io.hapconf.core.error.ValidationException;
import io.hapconf.core.model.Config;
import io.hapconf.core.spi.ConfigFormat;
import io.hapconf.core.transform.LoopUnroller;
import io.hapconf.core.transform.TemplateExpander;
import io.hapconf.core.transform.VariableResolver;
import io.hapconf.core.validate.SemanticValidator;
import io.hapconf.core.validate.ValidationResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point of the translation pipeline.
 *
 * <p>
 * Stages run in a fixed order: parse and build the IR, unroll loops, expand templates,
 * resolve variables, validate, extract inline scripts and generate. Each stage consumes a complete
 * tree and produces a new one; nothing is shared between runs, so one instance can serve
 * concurrent callers.
 *
 * <p>
 * The environment lookup is the only outside input. It is consulted by variable resolution
 * and nowhere else, and the translator itself never touches the file system.
 */
public final class Translator {

    private static final Logger LOG = LoggerFactory.getLogger(Translator.class);

    /** MDC key carrying the source name for the duration of a run. */
    static final String MDC_SOURCE = "source";

    static final String DEFAULT_SOURCE_NAME = "<input>";

    private final ParserRegistry registry;
    private final TranslatorOptions options;
    private final PropertyCatalog catalog;

    /** Translator with the built-in DSL format and default options. */
    public Translator() {
        this(ParserRegistry.withDefaults(), TranslatorOptions.DEFAULT);
    }

    public Translator(ParserRegistry registry, TranslatorOptions options) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.catalog = PropertyCatalog.standard();
    }

    public TranslatorOptions options() {
        return options;
    }

    public TranslationResult translate(String source, Function<String, String> envLookup) {
        return translate(source, DEFAULT_SOURCE_NAME, envLookup);
    }

    /**
     * Translates DSL source into target configuration text.
     *
     * @param source     the DSL text
     * @param sourceName name used in diagnostics, usually the file name
     * @param envLookup  environment lookup; returns {@code null} for unset variables
     * @return the generated text, the extracted scripts and any validation warnings
     * @throws TranslateException on the first failing stage; a {@link ValidationException} carries
     *     every validation error found
     * @throws IllegalArgumentException if the configured format is not registered
     */
    public TranslationResult translate(String source, String sourceName, Function<String, String> envLookup) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(envLookup, "envLookup must not be null");
        MDC.put(MDC_SOURCE, sourceName);
        try {
            return translateInternal(source, sourceName, envLookup);
        } finally {
            MDC.remove(MDC_SOURCE);
        }
    }

    private TranslationResult translateInternal(
            String source, String sourceName, Function<String, String> envLookup) {
        Analysis analysis = analyzeInternal(source, sourceName, envLookup);
        ValidationResult validation = analysis.validation();
        if (!validation.isValid()) {
            LOG.warn("Translation failed: errors={}", validation.errors().size());
            throw new ValidationException(validation.errors());
        }

        ScriptExtractor.Extraction extraction =
                new ScriptExtractor(options.scriptDirectory()).extract(analysis.config());
        Config config = extraction.config();
        String output = new HaproxyGenerator(catalog, options.indent()).generate(config);
        LOG.debug("Generated: bytes={}", output.length());

        List<Diagnostic> warnings = validation.warningDiagnostics();
        LOG.info(
                "Translation complete: config={}, frontends={}, backends={}, listens={}, scripts={}, bytes={}",
                config.name(),
                config.frontends().size(),
                config.backends().size(),
                config.listens().size(),
                extraction.scripts().size(),
                output.length());
        return new TranslationResult(output, extraction.scripts(), warnings);
    }

    public Diagnostics validateOnly(String source, Function<String, String> envLookup) {
        return validateOnly(source, DEFAULT_SOURCE_NAME, envLookup);
    }

    /**
     * Runs the pipeline up to and including validation and reports everything found. Never
     * throws for problems in the source: parse, build and resolution failures come back as a
     * single error diagnostic, validation failures as one diagnostic per violation, followed by
     * the warnings.
     */
    public Diagnostics validateOnly(String source, String sourceName, Function<String, String> envLookup) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(envLookup, "envLookup must not be null");
        MDC.put(MDC_SOURCE, sourceName);
        try {
            Analysis analysis = analyzeInternal(source, sourceName, envLookup);
            ValidationResult validation = analysis.validation();
            List<Diagnostic> all = new ArrayList<>();
            for (ValidationError error : validation.errors()) {
                all.add(Diagnostic.error(TranslateException.Phase.VALIDATE, error.message(), error.location()));
            }
            all.addAll(validation.warningDiagnostics());
            LOG.info(
                    "Validation complete: config={}, errors={}, warnings={}",
                    analysis.config().name(),
                    validation.errors().size(),
                    validation.warnings().size());
            return Diagnostics.of(all);
        } catch (TranslateException e) {
            LOG.info("Validation stopped in phase {}: {}", e.phase(), e.getMessage());
            return Diagnostics.fromException(e, List.of());
        } finally {
            MDC.remove(MDC_SOURCE);
        }
    }

    /**
     * Runs every stage before generation and returns the final IR with its validation result.
     * Inline scripts are not extracted.
     *
     * @throws TranslateException if a stage before validation fails
     */
    public Analysis analyze(String source, String sourceName, Function<String, String> envLookup) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(envLookup, "envLookup must not be null");
        MDC.put(MDC_SOURCE, sourceName);
        try {
            return analyzeInternal(source, sourceName, envLookup);
        } finally {
            MDC.remove(MDC_SOURCE);
        }
    }

    private Analysis analyzeInternal(String source, String sourceName, Function<String, String> envLookup) {
        ConfigFormat format = registry.requireFormat(options.format());
        Config config = format.read(source, sourceName);
        LOG.debug(
                "Parsed: format={}, config={}, sections={}, templates={}, variables={}",
                format.id(),
                config.name(),
                config.sections().size(),
                config.templates().size(),
                config.variables().size());

        config = new LoopUnroller().unroll(config);
        config = new TemplateExpander(catalog).expand(config);
        config = new VariableResolver(envLookup, options.maxResolutionPasses()).resolve(config);

        ValidationResult validation = new SemanticValidator(catalog).validate(config);
        for (ValidationError warning : validation.warnings()) {
            LOG.warn("{}: warning: {}", warning.location(), warning.message());
        }
        LOG.debug(
                "Validated: errors={}, warnings={}",
                validation.errors().size(),
                validation.warnings().size());
        return new Analysis(config, validation);
    }
}
