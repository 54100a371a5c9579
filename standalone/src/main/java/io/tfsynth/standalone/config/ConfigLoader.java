package io.tfsynth.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link SynthConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * outdir: build/tf
 * skip-validation: false
 * pretty-print: true
 * schema-validation: strict
 * logging:
 *   format: json
 *   level: DEBUG
 * </pre>
 *
 * Missing keys keep the defaults of {@link SynthConfig.Builder}. Environment variables take
 * precedence over YAML values. A variable counts as set only if it is defined and its trimmed
 * value is non-empty.
 *
 * <table>
 * <caption>Environment overlay</caption>
 * <tr><td>{@code CDKTF_OUTDIR}</td><td>outdir</td></tr>
 * <tr><td>{@code TFSYNTH_SKIP_VALIDATION}</td><td>skip-validation</td></tr>
 * <tr><td>{@code TFSYNTH_SCHEMA_VALIDATION}</td><td>schema-validation</td></tr>
 * <tr><td>{@code TFSYNTH_LOG_FORMAT}</td><td>logging.format</td></tr>
 * <tr><td>{@code TFSYNTH_LOG_LEVEL}</td><td>logging.level</td></tr>
 * </table>
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "tfsynth.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration from the given YAML file, applying overrides from {@link
     * System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or cannot be parsed
     */
    public static SynthConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration from the given YAML file, applying overrides from {@code
     * envLookup}. The lookup returns null for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing or cannot be parsed
     */
    public static SynthConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads {@value #DEFAULT_CONFIG_FILE} from {@code directory} if it exists; otherwise starts
     * from the defaults. The environment overlay applies either way.
     */
    public static SynthConfig loadOrDefaults(Path directory, Function<String, String> envLookup) {
        Path configPath = directory.resolve(DEFAULT_CONFIG_FILE);
        if (Files.exists(configPath)) {
            return load(configPath, envLookup);
        }
        try {
            return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Invalid configuration in environment: " + e.getMessage(), e);
        }
    }

    private static SynthConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        SynthConfig.Builder builder = SynthConfig.builder();

        // --- YAML mapping ---
        if (root.has("outdir")) builder.outdir(root.get("outdir").asText());
        if (root.has("skip-validation"))
            builder.skipValidation(root.get("skip-validation").asBoolean());
        if (root.has("pretty-print")) builder.prettyPrint(root.get("pretty-print").asBoolean());
        if (root.has("schema-validation"))
            builder.schemaValidation(root.get("schema-validation").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---
        envString(envLookup, "CDKTF_OUTDIR", builder::outdir);
        envBool(envLookup, "TFSYNTH_SKIP_VALIDATION", builder::skipValidation);
        envString(envLookup, "TFSYNTH_SCHEMA_VALIDATION", builder::schemaValidation);
        envString(envLookup, "TFSYNTH_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "TFSYNTH_LOG_LEVEL", builder::loggingLevel);

        return builder.build();
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
