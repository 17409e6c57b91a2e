package com.flowmodel.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads layout defaults in order: config directory file → classpath resource of the same name →
 * {@link LayoutDefaults#BUILT_IN}. Unreadable or invalid sources are skipped with a warning.
 */
public final class LayoutDefaultsLoader {

    private static final Logger log = LoggerFactory.getLogger(LayoutDefaultsLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path configDir;
    private final String fileName;

    /**
     * @param configDir directory holding the layout file; null skips the file lookup
     * @param fileName  file name, also used as classpath resource name
     */
    public LayoutDefaultsLoader(Path configDir, String fileName) {
        this.configDir = configDir;
        this.fileName = fileName;
    }

    public static LayoutDefaultsLoader forConfig(FlowModelConfig config) {
        Path dir = config.getLayoutDir() != null ? Path.of(config.getLayoutDir()) : null;
        return new LayoutDefaultsLoader(dir, config.getLayoutFile());
    }

    /** Never null: falls back to built-in values when no source is usable. */
    public LayoutDefaults load() {
        Optional<LayoutDefaults> fromFile = readLocalFile().flatMap(json -> parse(json, "file:" + configDir.resolve(fileName)));
        if (fromFile.isPresent()) {
            log.info("Layout defaults loaded from file: {}", configDir.resolve(fileName));
            return fromFile.get();
        }
        Optional<LayoutDefaults> fromClasspath = readResource().flatMap(json -> parse(json, "classpath:" + fileName));
        if (fromClasspath.isPresent()) {
            log.info("Layout defaults loaded from classpath resource: {}", fileName);
            return fromClasspath.get();
        }
        log.info("No layout defaults file found for {}; using built-in values", fileName);
        return LayoutDefaults.BUILT_IN;
    }

    public static LayoutDefaults fromJson(String json) {
        try {
            return MAPPER.readValue(json, LayoutDefaults.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Invalid layout defaults JSON", e);
        }
    }

    private Optional<LayoutDefaults> parse(String json, String source) {
        try {
            return Optional.of(fromJson(json));
        } catch (UncheckedIOException e) {
            log.warn("Failed to parse layout defaults from {}: {}", source, e.getCause().getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> readLocalFile() {
        if (configDir == null) {
            return Optional.empty();
        }
        Path file = configDir.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file));
        } catch (IOException e) {
            log.warn("Failed to read layout defaults file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> readResource() {
        try (InputStream in = LayoutDefaultsLoader.class.getClassLoader().getResourceAsStream(fileName)) {
            if (in == null) {
                return Optional.empty();
            }
            return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Failed to read layout defaults resource {}: {}", fileName, e.getMessage());
            return Optional.empty();
        }
    }
}
