package io.tfsynth.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tfsynth.standalone.writer.SchemaValidationMode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for YAML mapping and defaults in {@link ConfigLoader}. */
@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    private static final Map<String, String> NO_ENV = Map.of();

    @TempDir
    Path tempDir;

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource(name).toURI());
    }

    @Test
    @DisplayName("minimal config keeps the defaults for unset keys")
    void minimalConfig() throws Exception {
        SynthConfig config = ConfigLoader.load(fixture("config/minimal-config.yaml"), NO_ENV::get);

        assertThat(config.outdir()).isEqualTo("build/tf");
        assertThat(config.skipValidation()).isFalse();
        assertThat(config.prettyPrint()).isTrue();
        assertThat(config.schemaValidation()).isEqualTo(SchemaValidationMode.LENIENT);
        assertThat(config.loggingFormat()).isEqualTo("text");
        assertThat(config.loggingLevel()).isEqualTo("INFO");
    }

    @Test
    @DisplayName("full config maps every key")
    void fullConfig() throws Exception {
        SynthConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), NO_ENV::get);

        assertThat(config)
                .isEqualTo(SynthConfig.builder()
                        .outdir("build/full")
                        .skipValidation(true)
                        .prettyPrint(false)
                        .schemaValidation(SchemaValidationMode.STRICT)
                        .loggingFormat("json")
                        .loggingLevel("DEBUG")
                        .build());
    }

    @Test
    @DisplayName("an empty file yields the defaults")
    void emptyFile() throws IOException {
        Path file = tempDir.resolve("empty.yaml");
        Files.writeString(file, "");

        assertThat(ConfigLoader.load(file, NO_ENV::get)).isEqualTo(SynthConfig.defaults());
        assertThat(SynthConfig.defaults().outdir()).isNull();
    }

    @Test
    @DisplayName("a missing file is reported")
    void missingFile() {
        Path file = tempDir.resolve("nope.yaml");

        assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("Configuration file not found");
    }

    @Test
    @DisplayName("malformed YAML is reported with its cause")
    void malformedYaml() throws IOException {
        Path file = tempDir.resolve("bad.yaml");
        Files.writeString(file, "outdir: [unclosed\n");

        assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageStartingWith("Failed to parse YAML configuration")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("an unknown schema-validation mode is rejected")
    void unknownSchemaMode() throws IOException {
        Path file = tempDir.resolve("mode.yaml");
        Files.writeString(file, "schema-validation: paranoid\n");

        assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("'paranoid'")
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("loadOrDefaults reads tfsynth.yaml when present")
    void loadOrDefaults() throws IOException {
        assertThat(ConfigLoader.loadOrDefaults(tempDir, NO_ENV::get)).isEqualTo(SynthConfig.defaults());

        Files.writeString(tempDir.resolve("tfsynth.yaml"), "pretty-print: false\n");

        assertThat(ConfigLoader.loadOrDefaults(tempDir, NO_ENV::get).prettyPrint()).isFalse();
    }
}
