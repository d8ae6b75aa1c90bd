package io.hapconf.cli;

import io.hapconf.core.engine.ExtractedScript;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists a translation: the extracted scripts under a base directory and the configuration
 * text. Script paths are the relative paths the generated {@code lua-load} lines use, resolved
 * against the base directory.
 */
final class ScriptFileWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ScriptFileWriter.class);

    private final Path baseDirectory;

    ScriptFileWriter(Path baseDirectory) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory must not be null");
    }

    /** Writes every script, creating directories as needed, and returns the written files. */
    List<Path> writeScripts(List<ExtractedScript> scripts) throws IOException {
        List<Path> written = new ArrayList<>(scripts.size());
        for (ExtractedScript script : scripts) {
            Path target = baseDirectory.resolve(script.path()).normalize();
            if (!target.startsWith(baseDirectory.normalize())) {
                throw new IOException("Script path escapes the output directory: " + script.path());
            }
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String body = script.body().endsWith("\n") ? script.body() : script.body() + "\n";
            Files.writeString(target, body, StandardCharsets.UTF_8);
            LOG.info("Wrote script: name={}, path={}", script.name(), target);
            written.add(target);
        }
        return written;
    }

    /** Writes the configuration text to {@code output}, creating its directory if needed. */
    void writeOutput(Path output, String text) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, text, StandardCharsets.UTF_8);
        LOG.info("Wrote configuration: path={}, bytes={}", output, text.length());
    }
}
