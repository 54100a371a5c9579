package io.tfsynth.standalone;

import io.tfsynth.core.model.ConstructNode;
import io.tfsynth.core.spi.SynthesisListener;
import io.tfsynth.core.token.TokenTable;
import io.tfsynth.standalone.config.ConfigLoader;
import io.tfsynth.standalone.config.SynthConfig;
import io.tfsynth.standalone.logging.LogbackConfigurator;
import io.tfsynth.standalone.writer.AppSynthesizer;
import io.tfsynth.standalone.writer.Manifest;
import java.nio.file.Path;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for application code: synthesizes a finished construct tree to disk.
 *
 * <p>
 * Sequence:
 * <ol>
 * <li>Load {@code tfsynth.yaml} from the project directory, if present, plus the environment
 * overlay</li>
 * <li>Configure Logback from {@code logging.format} and {@code logging.level}</li>
 * <li>Validate, synthesize and write every stack with {@link AppSynthesizer}</li>
 * </ol>
 */
public final class TfSynth {

    private static final Logger LOG = LoggerFactory.getLogger(TfSynth.class);

    private TfSynth() {
        // utility class
    }

    /** Synthesizes {@code app} using the configuration of the current working directory. */
    public static Manifest synth(ConstructNode app, TokenTable tokens) {
        return synth(app, tokens, Path.of(""), System::getenv, null);
    }

    /**
     * Synthesizes {@code app}.
     *
     * @param app        the root node
     * @param tokens     the token table the tree's marker strings were created with
     * @param projectDir directory searched for {@code tfsynth.yaml}
     * @param envLookup  environment variable lookup, returning null for undefined variables
     * @param listener   optional listener, may be null
     * @return the manifest that was written
     */
    public static Manifest synth(
            ConstructNode app,
            TokenTable tokens,
            Path projectDir,
            Function<String, String> envLookup,
            SynthesisListener listener) {
        SynthConfig config = ConfigLoader.loadOrDefaults(projectDir, envLookup);
        LogbackConfigurator.configure(config);
        LOG.info(
                "Configuration loaded: projectDir={}, schemaValidation={}, skipValidation={}",
                projectDir.toAbsolutePath(),
                config.schemaValidation(),
                config.skipValidation());
        return new AppSynthesizer(config, listener).synthesize(app, tokens);
    }
}
