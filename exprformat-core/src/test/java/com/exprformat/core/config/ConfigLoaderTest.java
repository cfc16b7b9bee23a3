package com.exprformat.core.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("exprformat.yaml");
        Files.writeString(configFile, """
            indent:
              width: 4

            markup:
              escapeText: true
              wrap: "pre#listing.code"
            """);

        FormatterConfig config = ConfigLoader.load(configFile);

        assertThat(config.indentWidth()).isEqualTo(4);
        assertThat(config.indentation().prefix(1)).isEqualTo("    ");
        assertThat(config.escapeText()).isTrue();
        assertThat(config.wrapSelector()).isEqualTo("pre#listing.code");
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("exprformat.yaml");
        Files.writeString(configFile, """
            markup:
              escapeText: true
            """);

        FormatterConfig config = ConfigLoader.load(configFile);

        assertThat(config.indent()).isNull();
        assertThat(config.indentWidth()).isEqualTo(2);
        assertThat(config.escapeText()).isTrue();
        assertThat(config.wrapSelector()).isNull();
    }

    @Test
    void load_unknownProperties_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("exprformat.yaml");
        Files.writeString(configFile, """
            theme: dark
            indent:
              width: 3
              tabs: false
            """);

        FormatterConfig config = ConfigLoader.load(configFile);

        assertThat(config.indentWidth()).isEqualTo(3);
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        FormatterConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(FormatterConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("exprformat.yaml");
        Files.writeString(configFile, "indent: [unclosed");

        FormatterConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(FormatterConfig.defaults());
    }

    @Test
    void load_negativeWidth_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("exprformat.yaml");
        Files.writeString(configFile, """
            indent:
              width: -1
            """);

        FormatterConfig config = ConfigLoader.load(configFile);

        assertThat(config.indentWidth()).isEqualTo(2);
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("exprformat.yaml");
        Files.writeString(configFile, "");

        FormatterConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(FormatterConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(FormatterConfig.defaults());
    }

    @Test
    void load_fileDoesNotExist_logsWarningNamingFile() {
        Logger logger = (Logger) LoggerFactory.getLogger(ConfigLoader.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        Path missing = tempDir.resolve("absent.yaml");
        try {
            ConfigLoader.load(missing);
        } finally {
            logger.detachAppender(appender);
        }

        assertThat(appender.list).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getFormattedMessage())
                .contains(missing.toString())
                .contains("no such file")
                .contains("default indentation and markup apply");
        });
    }

    @Test
    void loadOrDefaults_nullPath_returnsDefaults() {
        assertThat(ConfigLoader.loadOrDefaults(null)).isEqualTo(FormatterConfig.defaults());
    }

    @Test
    void defaults_haveTwoSpaceIndentAndNoEscaping() {
        FormatterConfig defaults = FormatterConfig.defaults();

        assertThat(defaults.indentWidth()).isEqualTo(2);
        assertThat(defaults.escapeText()).isFalse();
        assertThat(defaults.wrapSelector()).isNull();
    }
}
