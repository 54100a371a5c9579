package io.tfsynth.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tfsynth.standalone.writer.SchemaValidationMode;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for the environment variable overlay on {@link ConfigLoader}. Variables win over YAML;
 * empty or whitespace-only values count as unset.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path fullConfigPath;

    @TempDir
    Path tempDir;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        fullConfigPath = Path.of(EnvVarOverlayTest.class
                .getClassLoader()
                .getResource("config/full-config.yaml")
                .toURI());
        envVars.clear();
    }

    @Test
    @DisplayName("CDKTF_OUTDIR overrides YAML outdir")
    void outdirOverride() {
        envVars.put("CDKTF_OUTDIR", " /tmp/out ");

        assertThat(ConfigLoader.load(fullConfigPath, envLookup()).outdir()).isEqualTo("/tmp/out");
    }

    @Test
    @DisplayName("boolean and enum overrides")
    void typedOverrides() {
        envVars.put("TFSYNTH_SKIP_VALIDATION", "false");
        envVars.put("TFSYNTH_SCHEMA_VALIDATION", "LENIENT");

        SynthConfig config = ConfigLoader.load(fullConfigPath, envLookup());

        assertThat(config.skipValidation()).isFalse();
        assertThat(config.schemaValidation()).isEqualTo(SchemaValidationMode.LENIENT);
    }

    @Test
    @DisplayName("logging overrides")
    void loggingOverrides() {
        envVars.put("TFSYNTH_LOG_FORMAT", "text");
        envVars.put("TFSYNTH_LOG_LEVEL", "WARN");

        SynthConfig config = ConfigLoader.load(fullConfigPath, envLookup());

        assertThat(config.loggingFormat()).isEqualTo("text");
        assertThat(config.loggingLevel()).isEqualTo("WARN");
    }

    @Test
    @DisplayName("blank values are ignored")
    void blankIgnored() {
        envVars.put("CDKTF_OUTDIR", "   ");
        envVars.put("TFSYNTH_LOG_LEVEL", "");

        SynthConfig config = ConfigLoader.load(fullConfigPath, envLookup());

        assertThat(config.outdir()).isEqualTo("build/full");
        assertThat(config.loggingLevel()).isEqualTo("DEBUG");
    }

    @Test
    @DisplayName("overlay applies without a config file")
    void overlayWithoutFile() {
        envVars.put("CDKTF_OUTDIR", "env-out");

        assertThat(ConfigLoader.loadOrDefaults(tempDir, envLookup()).outdir()).isEqualTo("env-out");
    }

    @Test
    @DisplayName("an invalid mode in the environment is reported")
    void invalidEnvMode() {
        envVars.put("TFSYNTH_SCHEMA_VALIDATION", "sometimes");

        assertThatThrownBy(() -> ConfigLoader.loadOrDefaults(tempDir, envLookup()))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageStartingWith("Invalid configuration in environment");
    }
}
