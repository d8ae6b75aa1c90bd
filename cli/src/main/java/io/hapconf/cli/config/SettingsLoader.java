package io.hapconf.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

/**
 * Loads {@link TranslatorSettings} from a YAML file, then overlays environment variables.
 *
 * <p>
 * File layout:
 *
 * <pre>
 * translator:
 *   max-resolution-passes: 10
 *   indent: 4
 *   format: dsl
 * scripts:
 *   directory: lua
 * logging:
 *   format: text
 *   level: WARN
 * </pre>
 *
 * <p>
 * Environment variables take precedence over the file: {@code HAPCONF_MAX_RESOLUTION_PASSES},
 * {@code HAPCONF_INDENT}, {@code HAPCONF_SCRIPT_DIR}, {@code HAPCONF_FORMAT}, {@code
 * HAPCONF_LOG_FORMAT} and {@code HAPCONF_LOG_LEVEL}. A variable counts as set only when it is
 * defined and non-blank after trimming.
 */
public final class SettingsLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private SettingsLoader() {
        // utility class
    }

    /** Settings from defaults and the process environment only. */
    public static TranslatorSettings defaults() {
        return defaults(System::getenv);
    }

    /** Settings from defaults and the given environment only. */
    public static TranslatorSettings defaults(Function<String, String> envLookup) {
        TranslatorSettings.Builder builder = TranslatorSettings.builder();
        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    public static TranslatorSettings load(Path settingsPath) {
        return load(settingsPath, System::getenv);
    }

    /**
     * Loads settings from {@code settingsPath} with overrides from {@code envLookup}.
     *
     * @throws SettingsLoadException if the file is missing, is not valid YAML or holds an invalid
     *     value
     */
    public static TranslatorSettings load(Path settingsPath, Function<String, String> envLookup) {
        if (!Files.exists(settingsPath)) {
            throw new SettingsLoadException(
                    "Settings file not found: " + settingsPath + ". Use --settings <path> to specify a settings file.");
        }
        try (InputStream in = Files.newInputStream(settingsPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToSettings(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (SettingsLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new SettingsLoadException("Failed to parse YAML settings: " + settingsPath, e);
        } catch (NumberFormatException e) {
            throw new SettingsLoadException("Invalid number in settings: " + e.getMessage(), e);
        }
    }

    private static TranslatorSettings mapToSettings(JsonNode root, Function<String, String> envLookup) {
        TranslatorSettings.Builder builder = TranslatorSettings.builder();

        JsonNode translator = root.path("translator");
        if (translator.has("max-resolution-passes")) {
            builder.maxResolutionPasses(requireInt(translator, "max-resolution-passes", "translator"));
        }
        if (translator.has("indent")) {
            builder.indentWidth(requireInt(translator, "indent", "translator"));
        }
        if (translator.has("format")) builder.format(translator.get("format").asText());

        JsonNode scripts = root.path("scripts");
        if (scripts.has("directory")) builder.scriptDirectory(scripts.get("directory").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(TranslatorSettings.Builder builder, Function<String, String> envLookup) {
        if (isSet(envLookup, "HAPCONF_MAX_RESOLUTION_PASSES")) {
            builder.maxResolutionPasses(envInt(envLookup, "HAPCONF_MAX_RESOLUTION_PASSES"));
        }
        if (isSet(envLookup, "HAPCONF_INDENT")) {
            builder.indentWidth(envInt(envLookup, "HAPCONF_INDENT"));
        }
        if (isSet(envLookup, "HAPCONF_SCRIPT_DIR")) {
            builder.scriptDirectory(envLookup.apply("HAPCONF_SCRIPT_DIR").trim());
        }
        if (isSet(envLookup, "HAPCONF_FORMAT")) {
            builder.format(envLookup.apply("HAPCONF_FORMAT").trim());
        }
        if (isSet(envLookup, "HAPCONF_LOG_FORMAT")) {
            builder.loggingFormat(envLookup.apply("HAPCONF_LOG_FORMAT").trim());
        }
        if (isSet(envLookup, "HAPCONF_LOG_LEVEL")) {
            builder.loggingLevel(envLookup.apply("HAPCONF_LOG_LEVEL").trim());
        }
    }

    // --- Helpers ---

    /** A variable is set if it is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static int envInt(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar).trim();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new SettingsLoadException(
                    "Environment variable " + envVar + " must be an integer, got: '" + value + "'", e);
        }
    }

    private static int requireInt(JsonNode node, String field, String section) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt()) {
            throw new SettingsLoadException(
                    section + "." + field + " must be an integer, got: '" + value.asText() + "'");
        }
        return value.asInt();
    }
}
