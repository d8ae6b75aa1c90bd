package io.hapconf.cli;

import io.hapconf.cli.config.SettingsLoadException;
import io.hapconf.cli.config.SettingsLoader;
import io.hapconf.cli.config.TranslatorSettings;
import io.hapconf.core.engine.Analysis;
import io.hapconf.core.engine.IrJsonWriter;
import io.hapconf.core.engine.ParserRegistry;
import io.hapconf.core.engine.TranslationResult;
import io.hapconf.core.engine.Translator;
import io.hapconf.core.engine.TranslatorOptions;
import io.hapconf.core.error.Diagnostic;
import io.hapconf.core.error.Diagnostics;
import io.hapconf.core.error.TranslateException;
import io.hapconf.core.spi.ConfigFormat;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One invocation of the command-line translator. Reads the input file, runs the core translator
 * and persists the result.
 *
 * <p>
 * Exit codes: {@code 0} on success (warnings allowed), {@code 1} when the source or the
 * settings are invalid or a file cannot be read or written, {@code 2} for usage errors. Nothing is
 * written unless translation succeeded.
 */
public final class TranslateCommand {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger LOG = LoggerFactory.getLogger(TranslateCommand.class);

    private final PrintStream out;
    private final PrintStream err;
    private final Function<String, String> envLookup;
    private final BiConsumer<String, String> loggingSetup;

    /**
     * @param out          receives the configuration or IR when no output file is given
     * @param err          receives diagnostics and usage errors
     * @param envLookup    environment for settings overrides and {@code env(...)} lookups
     * @param loggingSetup applies the logging format and level from the settings
     */
    public TranslateCommand(
            PrintStream out,
            PrintStream err,
            Function<String, String> envLookup,
            BiConsumer<String, String> loggingSetup) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.err = Objects.requireNonNull(err, "err must not be null");
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
        this.loggingSetup = Objects.requireNonNull(loggingSetup, "loggingSetup must not be null");
    }

    public int run(String[] args) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (CliArguments.UsageException e) {
            err.println("hapconf: " + e.getMessage());
            err.println(CliArguments.USAGE);
            return EXIT_USAGE;
        }

        TranslatorSettings settings;
        try {
            settings = arguments.settings() != null
                    ? SettingsLoader.load(arguments.settings(), envLookup)
                    : SettingsLoader.defaults(envLookup);
        } catch (SettingsLoadException e) {
            err.println("hapconf: " + e.getMessage());
            return EXIT_FAILURE;
        }
        loggingSetup.accept(settings.loggingFormat(), settings.loggingLevel());

        ParserRegistry registry = ParserRegistry.withDefaults();
        String format = arguments.format();
        if (format == null) {
            format = registry.findByFileName(arguments.input().getFileName().toString())
                    .map(ConfigFormat::id)
                    .orElse(settings.format());
        }
        if (!registry.hasFormat(format)) {
            err.println("hapconf: unknown format '" + format + "'");
            return EXIT_USAGE;
        }
        TranslatorOptions options;
        try {
            options = settings.toOptions(arguments.scriptDir(), format);
        } catch (IllegalArgumentException e) {
            err.println("hapconf: " + e.getMessage());
            return EXIT_USAGE;
        }

        String source;
        try {
            source = Files.readString(arguments.input(), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            err.println("hapconf: input file not found: " + arguments.input());
            return EXIT_FAILURE;
        } catch (IOException e) {
            err.println("hapconf: cannot read " + arguments.input() + ": " + e.getMessage());
            return EXIT_FAILURE;
        }

        Translator translator = new Translator(registry, options);
        String sourceName = arguments.input().toString();
        LOG.debug("Running: input={}, format={}, validateOnly={}, dumpIr={}",
                sourceName, format, arguments.validateOnly(), arguments.dumpIr());
        if (arguments.validateOnly()) {
            return validate(translator, source, sourceName);
        }
        if (arguments.dumpIr()) {
            return dumpIr(translator, source, sourceName);
        }
        return translate(translator, source, sourceName, arguments.output(), options);
    }

    private int validate(Translator translator, String source, String sourceName) {
        Diagnostics diagnostics = translator.validateOnly(source, sourceName, envLookup);
        print(diagnostics.all());
        if (diagnostics.hasErrors()) {
            err.println(sourceName + ": " + diagnostics.errors().size() + " error(s)");
            return EXIT_FAILURE;
        }
        out.println(sourceName + ": valid (" + diagnostics.warnings().size() + " warning(s))");
        return EXIT_OK;
    }

    private int dumpIr(Translator translator, String source, String sourceName) {
        Analysis analysis;
        try {
            analysis = translator.analyze(source, sourceName, envLookup);
        } catch (TranslateException e) {
            print(Diagnostics.fromException(e, List.of()).all());
            return EXIT_FAILURE;
        }
        out.println(new IrJsonWriter().write(analysis.config()));
        return EXIT_OK;
    }

    private int translate(
            Translator translator, String source, String sourceName, Path output, TranslatorOptions options) {
        TranslationResult result;
        try {
            result = translator.translate(source, sourceName, envLookup);
        } catch (TranslateException e) {
            print(Diagnostics.fromException(e, List.of()).all());
            return EXIT_FAILURE;
        }
        print(result.warnings());

        Path baseDirectory = output != null && output.toAbsolutePath().getParent() != null
                ? output.toAbsolutePath().getParent()
                : Path.of("").toAbsolutePath();
        ScriptFileWriter writer = new ScriptFileWriter(baseDirectory);
        try {
            writer.writeScripts(result.scripts());
            if (output != null) {
                writer.writeOutput(output, result.output());
            } else {
                out.print(result.output());
                out.flush();
            }
        } catch (IOException e) {
            err.println("hapconf: cannot write output: " + e.getMessage());
            return EXIT_FAILURE;
        }
        LOG.debug("Scripts written under {}/{}", baseDirectory, options.scriptDirectory());
        return EXIT_OK;
    }

    private void print(List<Diagnostic> diagnostics) {
        for (Diagnostic d : diagnostics) {
            err.println(d.format());
        }
    }
}
