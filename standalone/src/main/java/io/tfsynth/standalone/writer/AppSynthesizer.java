package io.tfsynth.standalone.writer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.tfsynth.core.error.TreeValidationException;
import io.tfsynth.core.model.ConstructMetadata;
import io.tfsynth.core.model.ConstructNode;
import io.tfsynth.core.model.TerraformJson;
import io.tfsynth.core.model.ValidationError;
import io.tfsynth.core.spi.SynthesisListener;
import io.tfsynth.core.synth.StackSynthesizer;
import io.tfsynth.core.token.TokenTable;
import io.tfsynth.core.tree.ConstructTree;
import io.tfsynth.core.validate.TreeValidator;
import io.tfsynth.standalone.config.SynthConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synthesizes every stack of an app and writes the results:
 *
 * <pre>
 * &lt;outdir&gt;/manifest.json
 * &lt;outdir&gt;/stacks/&lt;stackName&gt;/cdk.tf.json
 * </pre>
 *
 * The tree is validated first unless the configuration or the app disables it; a tree with
 * errors writes nothing. Stack names are checked even when validation is disabled, since each one
 * names an output directory. Each document is checked against the output schema according to
 * {@link SynthConfig#schemaValidation()}.
 */
public final class AppSynthesizer {

    private static final Logger LOG = LoggerFactory.getLogger(AppSynthesizer.class);

    static final String MANIFEST_FILE = "manifest.json";
    static final String STACKS_DIR = "stacks";
    static final String STACK_FILE = "cdk.tf.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SynthConfig config;
    private final SynthesisListener listener;
    private final OutputSchemaValidator schemaValidator = new OutputSchemaValidator();

    public AppSynthesizer(SynthConfig config) {
        this(config, null);
    }

    /**
     * @param config   output settings
     * @param listener optional listener, may be null
     */
    public AppSynthesizer(SynthConfig config, SynthesisListener listener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.listener = listener;
    }

    /** Synthesizes an app whose tree holds no token markers. */
    public Manifest synthesize(ConstructNode app) {
        return synthesize(app, new TokenTable());
    }

    /**
     * Synthesizes every stack under {@code app} and writes the documents and the manifest.
     *
     * @param app    the root node, of kind {@code APP}
     * @param tokens the token table the tree's marker strings were created with
     * @return the manifest that was written
     * @throws IllegalArgumentException if {@code app} is not an app node
     * @throws TreeValidationException  if validation is enabled and the tree has errors
     * @throws OutputSchemaException    in strict mode, if a document fails the schema check
     * @throws OutputWriteException     if a file cannot be written
     */
    public Manifest synthesize(ConstructNode app, TokenTable tokens) {
        if (!(app.metadata() instanceof ConstructMetadata.App appMetadata)) {
            throw new IllegalArgumentException("Expected an app node, got " + app.kind() + " at " + app.constructPath());
        }
        long start = System.nanoTime();
        String outdirName = resolveOutdir(appMetadata);
        Path outdir = Path.of(outdirName);
        StackSynthesizer synthesizer = new StackSynthesizer(tokens, listener);

        List<ValidationError> errors;
        if (config.skipValidation() || appMetadata.skipValidation()) {
            // stack names still decide where files go
            LOG.debug("Validation skipped: app={}", app.constructPath());
            errors = TreeValidator.validateStackNames(app);
        } else {
            errors = TreeValidator.validateTree(app);
        }
        if (TreeValidator.hasErrors(errors)) {
            LOG.warn("App not synthesized, tree has {} validation error(s)", errors.size());
            notifyValidationFailed(app, errors);
            throw new TreeValidationException(errors);
        }

        Map<String, Manifest.StackManifest> stacks = new LinkedHashMap<>();
        for (ConstructNode stack : ConstructTree.getDescendants(app, ConstructMetadata.Kind.STACK)) {
            ConstructMetadata.Stack stackMetadata = (ConstructMetadata.Stack) stack.metadata();
            String stackName = stackMetadata.stackName();
            TerraformJson document = synthesizer.synthesizeStack(stack);
            checkSchema(stackName, stack, document);

            String workingDirectory = STACKS_DIR + "/" + stackName;
            String stackFile = workingDirectory + "/" + STACK_FILE;
            writeFile(outdir.resolve(stackFile), document.toJson(config.prettyPrint()));
            LOG.debug("Stack written: stack={}, file={}", stackName, outdir.resolve(stackFile));

            stacks.put(
                    stackName,
                    new Manifest.StackManifest(
                            stackName,
                            stack.constructPath(),
                            stackFile,
                            workingDirectory,
                            stackMetadata.dependencies()));
        }

        Manifest manifest = new Manifest(Manifest.VERSION, outdirName, stacks);
        writeManifest(outdir.resolve(MANIFEST_FILE), manifest);

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        LOG.info("App synthesized: outdir={}, stacks={}, durationMs={}", outdir, stacks.size(), durationMs);
        notifyAppSynthesized(outdirName, new ArrayList<>(stacks.keySet()), durationMs);
        return manifest;
    }

    private String resolveOutdir(ConstructMetadata.App app) {
        if (config.outdir() != null && !config.outdir().isBlank()) {
            return config.outdir();
        }
        if (app.outdir() != null && !app.outdir().isBlank()) {
            return app.outdir();
        }
        return SynthConfig.DEFAULT_OUTDIR;
    }

    private void checkSchema(String stackName, ConstructNode stack, TerraformJson document) {
        List<String> violations = schemaValidator.validate(document.toJsonNode());
        if (violations.isEmpty()) {
            return;
        }
        if (config.schemaValidation() == SchemaValidationMode.STRICT) {
            throw new OutputSchemaException(stackName, stack.path(), violations);
        }
        LOG.warn("Stack document does not conform to the output schema: stack={}, violations={}", stackName, violations);
    }

    private void writeManifest(Path target, Manifest manifest) {
        try {
            String json = MAPPER.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(manifest);
            writeFile(target, json);
        } catch (IOException e) {
            throw new OutputWriteException(target, e);
        }
    }

    private static void writeFile(Path target, String content) {
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new OutputWriteException(target, e);
        }
    }

    // --- Listener notification helpers ---

    private void notifyValidationFailed(ConstructNode app, List<ValidationError> errors) {
        if (listener == null) return;
        try {
            List<String> codes = new ArrayList<>();
            for (ValidationError error : errors) {
                codes.add(error.code().name());
            }
            listener.onValidationFailed(
                    new SynthesisListener.ValidationFailedEvent(app.constructPath(), errors.size(), codes));
        } catch (Exception e) {
            LOG.warn("SynthesisListener.onValidationFailed failed", e);
        }
    }

    private void notifyAppSynthesized(String outdir, List<String> stackNames, long durationMs) {
        if (listener == null) return;
        try {
            listener.onAppSynthesized(new SynthesisListener.AppSynthesizedEvent(outdir, stackNames, durationMs));
        } catch (Exception e) {
            LOG.warn("SynthesisListener.onAppSynthesized failed", e);
        }
    }
}
