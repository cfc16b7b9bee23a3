package com.exprformat.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the formatter settings (indent width, markup escaping, wrapper element) from
 * an {@code exprformat.yaml} file.
 *
 * <p>Formatting never fails because of its settings: a file that is absent, not a
 * regular readable file, empty, or rejected by the YAML binding leaves every setting
 * at {@link FormatterConfig#defaults()}, and the reason is logged.
 *
 * <pre>{@code
 * FormatterConfig config = ConfigLoader.load(Paths.get("exprformat.yaml"));
 * String text = new PlainTextRenderer(config.indentation()).render(tree);
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** File name looked up in the working directory when no settings file is named. */
    public static final String DEFAULT_FILE_NAME = "exprformat.yaml";

    private ConfigLoader() {
    }

    /**
     * Reads formatter settings from {@code configPath}.
     *
     * @param configPath settings file
     * @return the settings in the file, or the default settings when it cannot be used
     */
    public static FormatterConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return withDefaults(configPath, "no such file");
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            return withDefaults(configPath, "not a readable file");
        }

        log.debug("Reading formatter settings from {}", configPath);
        FormatterConfig config;
        try {
            config = YAML_MAPPER.readValue(configPath.toFile(), FormatterConfig.class);
        } catch (IOException e) {
            log.error("Formatter settings in {} rejected ({}); default indentation and markup apply",
                configPath, e.getMessage());
            return FormatterConfig.defaults();
        }
        if (config == null) {
            return withDefaults(configPath, "file has no settings");
        }
        log.info("Formatter settings from {}: indent width {}, escape text {}",
            configPath, config.indentWidth(), config.escapeText());
        return config;
    }

    /**
     * Reads formatter settings from {@code configPath}, or returns the default settings
     * when no path is given.
     *
     * @param configPath settings file, may be null
     * @return the settings
     */
    public static FormatterConfig loadOrDefaults(Path configPath) {
        return configPath == null ? FormatterConfig.defaults() : load(configPath);
    }

    private static FormatterConfig withDefaults(Path configPath, String reason) {
        log.warn("Ignoring formatter settings {}: {}; default indentation and markup apply", configPath, reason);
        return FormatterConfig.defaults();
    }
}
