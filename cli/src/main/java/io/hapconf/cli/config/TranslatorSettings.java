package io.hapconf.cli.config;

import io.hapconf.core.engine.TranslatorOptions;

/**
 * Settings of the command-line translator, read from an optional YAML file and the environment.
 * Use {@link #builder()} to construct instances; every field has a default.
 *
 * @param maxResolutionPasses upper bound on variable resolution passes
 * @param indentWidth         spaces used to indent section bodies
 * @param scriptDirectory     directory, relative to the output, for extracted Lua scripts
 * @param format              source format id used when the input extension is not recognized
 * @param loggingFormat       {@code text} or {@code json}
 * @param loggingLevel        root log level
 */
public record TranslatorSettings(
        int maxResolutionPasses,
        int indentWidth,
        String scriptDirectory,
        String format,
        String loggingFormat,
        String loggingLevel) {

    public static Builder builder() {
        return new Builder();
    }

    /** Core options for these settings, with the script directory and format overridden. */
    public TranslatorOptions toOptions(String scriptDirectoryOverride, String formatOverride) {
        return new TranslatorOptions(
                maxResolutionPasses,
                " ".repeat(indentWidth),
                scriptDirectoryOverride != null ? scriptDirectoryOverride : scriptDirectory,
                formatOverride != null ? formatOverride : format);
    }

    public static final class Builder {
        private int maxResolutionPasses = TranslatorOptions.DEFAULT.maxResolutionPasses();
        private int indentWidth = TranslatorOptions.DEFAULT.indent().length();
        private String scriptDirectory = TranslatorOptions.DEFAULT.scriptDirectory();
        private String format = TranslatorOptions.DEFAULT.format();
        private String loggingFormat = "text";
        private String loggingLevel = "ERROR";

        Builder() {}

        public Builder maxResolutionPasses(int maxResolutionPasses) {
            this.maxResolutionPasses = maxResolutionPasses;
            return this;
        }

        public Builder indentWidth(int indentWidth) {
            this.indentWidth = indentWidth;
            return this;
        }

        public Builder scriptDirectory(String scriptDirectory) {
            this.scriptDirectory = scriptDirectory;
            return this;
        }

        public Builder format(String format) {
            this.format = format;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * @throws SettingsLoadException if a value is out of range
         */
        public TranslatorSettings build() {
            if (maxResolutionPasses <= 0) {
                throw new SettingsLoadException(
                        "translator.max-resolution-passes must be positive, got: " + maxResolutionPasses);
            }
            if (indentWidth < 0 || indentWidth > 16) {
                throw new SettingsLoadException("translator.indent must be between 0 and 16, got: " + indentWidth);
            }
            if (scriptDirectory == null || scriptDirectory.isBlank()) {
                throw new SettingsLoadException("scripts.directory must not be blank");
            }
            if (!"text".equalsIgnoreCase(loggingFormat) && !"json".equalsIgnoreCase(loggingFormat)) {
                throw new SettingsLoadException("logging.format must be 'text' or 'json', got: " + loggingFormat);
            }
            return new TranslatorSettings(
                    maxResolutionPasses, indentWidth, scriptDirectory, format, loggingFormat, loggingLevel);
        }
    }
}
