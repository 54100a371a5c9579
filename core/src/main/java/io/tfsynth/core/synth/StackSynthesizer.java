package io.tfsynth.core.synth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tfsynth.core.error.LogicalIdCollisionException;
import io.tfsynth.core.error.TreeValidationException;
import io.tfsynth.core.logicalid.LogicalIds;
import io.tfsynth.core.model.BackendDef;
import io.tfsynth.core.model.ConditionDef;
import io.tfsynth.core.model.ConstructMetadata;
import io.tfsynth.core.model.ConstructNode;
import io.tfsynth.core.model.DataSourceDef;
import io.tfsynth.core.model.LifecycleDef;
import io.tfsynth.core.model.ModuleDef;
import io.tfsynth.core.model.OutputDef;
import io.tfsynth.core.model.ProviderDef;
import io.tfsynth.core.model.ProvisionerDef;
import io.tfsynth.core.model.ResourceDef;
import io.tfsynth.core.model.TerraformJson;
import io.tfsynth.core.model.ValidationError;
import io.tfsynth.core.model.VariableDef;
import io.tfsynth.core.spi.SynthesisListener;
import io.tfsynth.core.token.Token;
import io.tfsynth.core.token.TokenTable;
import io.tfsynth.core.validate.TreeValidator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a stack subtree into a {@link TerraformJson} document.
 *
 * <p>
 * Descendants are collected by kind in tree order (nested stacks are skipped; they synthesize
 * on their own), each element is rendered to its block, and blocks of the same kind are merged
 * under their type and logical id. Tokens are resolved through the {@link TokenTable} of this
 * synthesizer, so marker strings created with that table render to their interpolations.
 *
 * <p>
 * One instance belongs to one synthesis session and is not thread-safe.
 */
public final class StackSynthesizer {

    private static final Logger LOG = LoggerFactory.getLogger(StackSynthesizer.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final TokenTable tokens;
    private final ValueResolver values;
    private final SynthesisListener listener;

    /** Synthesizer with a fresh token table and no listener. */
    public StackSynthesizer() {
        this(new TokenTable(), null);
    }

    public StackSynthesizer(TokenTable tokens) {
        this(tokens, null);
    }

    /**
     * @param tokens   the session token table; markers embedded in the tree must come from it
     * @param listener optional listener, may be null
     */
    public StackSynthesizer(TokenTable tokens, SynthesisListener listener) {
        this.tokens = Objects.requireNonNull(tokens, "tokens must not be null");
        this.values = new ValueResolver(tokens);
        this.listener = listener;
    }

    /** The token table this synthesizer resolves markers against. */
    public TokenTable tokenTable() {
        return tokens;
    }

    /**
     * Synthesizes one stack. An empty stack yields an empty document.
     *
     * @throws LogicalIdCollisionException if two elements land on the same key of one block
     * @throws io.tfsynth.core.error.UnresolvedTokenException if the tree holds a marker from another table
     */
    public TerraformJson synthesizeStack(ConstructNode stack) {
        long start = System.nanoTime();
        String stackName = stackName(stack);

        List<Collected<ConstructMetadata.Provider>> providers = collect(stack, ConstructMetadata.Provider.class);
        List<Collected<ConstructMetadata.Resource>> resources = collect(stack, ConstructMetadata.Resource.class);
        List<Collected<ConstructMetadata.DataSource>> dataSources = collect(stack, ConstructMetadata.DataSource.class);
        List<Collected<ConstructMetadata.Module>> modules = collect(stack, ConstructMetadata.Module.class);
        List<Collected<ConstructMetadata.Variable>> variables = collect(stack, ConstructMetadata.Variable.class);
        List<Collected<ConstructMetadata.Output>> outputs = collect(stack, ConstructMetadata.Output.class);
        List<Collected<ConstructMetadata.Local>> locals = collect(stack, ConstructMetadata.Local.class);
        List<Collected<ConstructMetadata.Backend>> backends = collect(stack, ConstructMetadata.Backend.class);

        KeyTracker keys = new KeyTracker();
        ObjectNode document = NODES.objectNode();

        ObjectNode terraform = NODES.objectNode();
        ObjectNode requiredProviders = buildRequiredProviders(providers);
        if (!requiredProviders.isEmpty()) {
            terraform.set("required_providers", requiredProviders);
        }
        if (!backends.isEmpty()) {
            BackendDef backend = backends.get(0).metadata().backend();
            ObjectNode backendBlock = NODES.objectNode();
            backendBlock.set(backend.type(), values.toJson(backend.config()));
            terraform.set("backend", backendBlock);
            for (Collected<ConstructMetadata.Backend> ignored : backends.subList(1, backends.size())) {
                LOG.warn(
                        "Stack has more than one backend, ignoring: stack={}, backend={}",
                        stackName,
                        ignored.node().constructPath());
            }
        }
        putIfNotEmpty(document, TerraformJson.TERRAFORM, terraform);

        ObjectNode providerBlock = NODES.objectNode();
        for (Collected<ConstructMetadata.Provider> p : providers) {
            ProviderDef provider = p.metadata().provider();
            ArrayNode configs = providerBlock.has(provider.providerName())
                    ? (ArrayNode) providerBlock.get(provider.providerName())
                    : providerBlock.putArray(provider.providerName());
            configs.add(synthesizeProvider(provider));
        }
        putIfNotEmpty(document, TerraformJson.PROVIDER, providerBlock);

        ObjectNode resourceBlock = NODES.objectNode();
        for (Collected<ConstructMetadata.Resource> r : resources) {
            ResourceDef resource = r.metadata().resource();
            String logicalId = LogicalIds.generateLogicalId(r.node().path());
            ObjectNode byType = resourceBlock.has(resource.terraformResourceType())
                    ? (ObjectNode) resourceBlock.get(resource.terraformResourceType())
                    : resourceBlock.putObject(resource.terraformResourceType());
            keys.claim("resource." + resource.terraformResourceType() + "." + logicalId, r.node());
            byType.set(logicalId, synthesizeResource(resource));
            LOG.debug(
                    "Resource synthesized: address={}, path={}",
                    LogicalIds.generateFqn(resource.terraformResourceType(), logicalId),
                    r.node().constructPath());
        }
        putIfNotEmpty(document, TerraformJson.RESOURCE, resourceBlock);

        ObjectNode dataBlock = NODES.objectNode();
        for (Collected<ConstructMetadata.DataSource> d : dataSources) {
            DataSourceDef dataSource = d.metadata().dataSource();
            String logicalId = LogicalIds.generateLogicalId(d.node().path());
            ObjectNode byType = dataBlock.has(dataSource.terraformResourceType())
                    ? (ObjectNode) dataBlock.get(dataSource.terraformResourceType())
                    : dataBlock.putObject(dataSource.terraformResourceType());
            keys.claim("data." + dataSource.terraformResourceType() + "." + logicalId, d.node());
            byType.set(logicalId, synthesizeDataSource(dataSource));
        }
        putIfNotEmpty(document, TerraformJson.DATA, dataBlock);

        ObjectNode moduleBlock = NODES.objectNode();
        for (Collected<ConstructMetadata.Module> m : modules) {
            String logicalId = LogicalIds.generateLogicalId(m.node().path());
            keys.claim("module." + logicalId, m.node());
            moduleBlock.set(logicalId, synthesizeModule(m.metadata().module()));
        }
        putIfNotEmpty(document, TerraformJson.MODULE, moduleBlock);

        ObjectNode variableBlock = NODES.objectNode();
        for (Collected<ConstructMetadata.Variable> v : variables) {
            String logicalId = LogicalIds.generateLogicalId(v.node().path());
            keys.claim("variable." + logicalId, v.node());
            variableBlock.set(logicalId, synthesizeVariable(v.metadata().variable()));
        }
        putIfNotEmpty(document, TerraformJson.VARIABLE, variableBlock);

        ObjectNode outputBlock = NODES.objectNode();
        for (Collected<ConstructMetadata.Output> o : outputs) {
            String logicalId = LogicalIds.generateLogicalId(o.node().path());
            keys.claim("output." + logicalId, o.node());
            outputBlock.set(logicalId, synthesizeOutput(o.metadata().output()));
        }
        putIfNotEmpty(document, TerraformJson.OUTPUT, outputBlock);

        ObjectNode localsBlock = NODES.objectNode();
        for (Collected<ConstructMetadata.Local> l : locals) {
            String logicalId = LogicalIds.generateLogicalId(l.node().path());
            keys.claim("locals." + logicalId, l.node());
            localsBlock.set(logicalId, values.toJson(l.metadata().local().expression()));
        }
        putIfNotEmpty(document, TerraformJson.LOCALS, localsBlock);

        if (keys.hasCollisions()) {
            throw new LogicalIdCollisionException(stack.path(), keys.collisions());
        }

        int elementCount = providers.size() + resources.size() + dataSources.size() + modules.size()
                + variables.size() + outputs.size() + locals.size() + backends.size();
        long durationMs = (System.nanoTime() - start) / 1_000_000;
        LOG.info(
                "Stack synthesized: stack={}, providers={}, resources={}, dataSources={}, modules={}, durationMs={}",
                stackName,
                providers.size(),
                resources.size(),
                dataSources.size(),
                modules.size(),
                durationMs);
        notifyStackSynthesized(stackName, stack, elementCount, durationMs);
        return new TerraformJson(document);
    }

    /**
     * Validates {@code tree} and, only if it has no errors, synthesizes {@code stack}.
     *
     * @throws TreeValidationException carrying every validation error of the tree
     */
    public TerraformJson synthesizeValidated(ConstructNode tree, ConstructNode stack) {
        List<ValidationError> errors = TreeValidator.validateTree(tree);
        if (TreeValidator.hasErrors(errors)) {
            LOG.warn("Synthesis refused: root={}, errors={}", tree.constructPath(), errors.size());
            notifyValidationFailed(tree, errors);
            throw new TreeValidationException(errors);
        }
        return synthesizeStack(stack);
    }

    /**
     * The {@code required_providers} map: one entry per provider short name, the first provider
     * of each name deciding source and version.
     */
    static ObjectNode buildRequiredProviders(List<Collected<ConstructMetadata.Provider>> providers) {
        ObjectNode result = NODES.objectNode();
        for (Collected<ConstructMetadata.Provider> p : providers) {
            ProviderDef provider = p.metadata().provider();
            if (result.has(provider.providerName())) {
                continue;
            }
            ObjectNode entry = result.putObject(provider.providerName());
            entry.put("source", provider.terraformProviderSource());
            if (provider.version() != null) {
                entry.put("version", provider.version());
            }
        }
        return result;
    }

    /**
     * Descendants of {@code stack} whose metadata is of {@code type}, in pre-order. Does not
     * descend into nested stacks.
     */
    static <M extends ConstructMetadata> List<Collected<M>> collect(ConstructNode stack, Class<M> type) {
        List<Collected<M>> result = new ArrayList<>();
        for (ConstructNode child : stack.children()) {
            collectInto(child, type, result);
        }
        return result;
    }

    private static <M extends ConstructMetadata> void collectInto(
            ConstructNode node, Class<M> type, List<Collected<M>> out) {
        if (node.kind() == ConstructMetadata.Kind.STACK) {
            return;
        }
        if (type.isInstance(node.metadata())) {
            out.add(new Collected<>(node, type.cast(node.metadata())));
        }
        for (ConstructNode child : node.children()) {
            collectInto(child, type, out);
        }
    }

    private ObjectNode synthesizeResource(ResourceDef resource) {
        ObjectNode block = config(resource.config());
        if (resource.provider() != null) {
            block.put("provider", resource.provider());
        }
        putDependsOn(block, resource.dependsOn());
        if (resource.count() != null) {
            block.set("count", values.toJson(resource.count()));
        }
        if (resource.forEach() != null) {
            block.set("for_each", values.toJson(resource.forEach()));
        }
        if (resource.lifecycle() != null) {
            ObjectNode lifecycle = synthesizeLifecycle(resource.lifecycle());
            if (!lifecycle.isEmpty()) {
                block.set("lifecycle", lifecycle);
            }
        }
        if (resource.provisioners() != null && !resource.provisioners().isEmpty()) {
            ArrayNode provisioners = block.putArray("provisioner");
            for (ProvisionerDef provisioner : resource.provisioners()) {
                provisioners.add(synthesizeProvisioner(provisioner));
            }
        }
        return block;
    }

    private ObjectNode synthesizeLifecycle(LifecycleDef lifecycle) {
        ObjectNode block = NODES.objectNode();
        if (lifecycle.createBeforeDestroy() != null) {
            block.put("create_before_destroy", lifecycle.createBeforeDestroy());
        }
        if (lifecycle.preventDestroy() != null) {
            block.put("prevent_destroy", lifecycle.preventDestroy());
        }
        if (lifecycle.ignoreChanges() != null) {
            block.set("ignore_changes", values.toJson(lifecycle.ignoreChanges()));
        }
        if (lifecycle.replaceTriggeredBy() != null) {
            block.set("replace_triggered_by", values.renderAll(lifecycle.replaceTriggeredBy()));
        }
        if (lifecycle.precondition() != null) {
            block.set("precondition", conditions(lifecycle.precondition()));
        }
        if (lifecycle.postcondition() != null) {
            block.set("postcondition", conditions(lifecycle.postcondition()));
        }
        return block;
    }

    private ObjectNode synthesizeProvisioner(ProvisionerDef provisioner) {
        ObjectNode body = config(provisioner.config());
        if (provisioner.when() != null) {
            body.put("when", provisioner.when());
        }
        if (provisioner.onFailure() != null) {
            body.put("on_failure", provisioner.onFailure());
        }
        ObjectNode wrapper = NODES.objectNode();
        wrapper.set(provisioner.type(), body);
        return wrapper;
    }

    private ObjectNode synthesizeProvider(ProviderDef provider) {
        ObjectNode block = config(provider.config());
        if (provider.alias() != null) {
            block.put("alias", provider.alias());
        }
        return block;
    }

    private ObjectNode synthesizeDataSource(DataSourceDef dataSource) {
        ObjectNode block = config(dataSource.config());
        if (dataSource.provider() != null) {
            block.put("provider", dataSource.provider());
        }
        putDependsOn(block, dataSource.dependsOn());
        if (dataSource.count() != null) {
            block.set("count", values.toJson(dataSource.count()));
        }
        if (dataSource.forEach() != null) {
            block.set("for_each", values.toJson(dataSource.forEach()));
        }
        return block;
    }

    private ObjectNode synthesizeModule(ModuleDef module) {
        ObjectNode block = NODES.objectNode();
        block.put("source", module.source());
        if (module.version() != null) {
            block.put("version", module.version());
        }
        block.setAll(config(module.variables()));
        if (!module.providers().isEmpty()) {
            ObjectNode providers = block.putObject("providers");
            module.providers().forEach(providers::put);
        }
        putDependsOn(block, module.dependsOn());
        if (module.count() != null) {
            block.set("count", values.toJson(module.count()));
        }
        if (module.forEach() != null) {
            block.set("for_each", values.toJson(module.forEach()));
        }
        return block;
    }

    private ObjectNode synthesizeVariable(VariableDef variable) {
        ObjectNode block = NODES.objectNode();
        if (variable.type() != null) {
            block.put("type", variable.type());
        }
        if (variable.defaultValue() != null) {
            block.set("default", values.toJson(variable.defaultValue()));
        }
        if (variable.description() != null) {
            block.put("description", variable.description());
        }
        if (variable.sensitive() != null) {
            block.put("sensitive", variable.sensitive());
        }
        if (variable.nullable() != null) {
            block.put("nullable", variable.nullable());
        }
        if (variable.validation() != null && !variable.validation().isEmpty()) {
            block.set("validation", conditions(variable.validation()));
        }
        return block;
    }

    private ObjectNode synthesizeOutput(OutputDef output) {
        ObjectNode block = NODES.objectNode();
        block.set("value", values.toJson(output.value()));
        if (output.description() != null) {
            block.put("description", output.description());
        }
        if (output.sensitive() != null) {
            block.put("sensitive", output.sensitive());
        }
        putDependsOn(block, output.dependsOn());
        if (output.precondition() != null) {
            block.set("precondition", conditions(List.of(output.precondition())));
        }
        return block;
    }

    private ObjectNode config(Map<String, Object> config) {
        JsonNode resolved = values.toJson(config);
        return resolved.isObject() ? (ObjectNode) resolved : NODES.objectNode();
    }

    private void putDependsOn(ObjectNode block, List<Token> dependsOn) {
        if (dependsOn != null && !dependsOn.isEmpty()) {
            block.set("depends_on", values.renderAll(dependsOn));
        }
    }

    private ArrayNode conditions(List<ConditionDef> conditions) {
        ArrayNode array = NODES.arrayNode();
        for (ConditionDef condition : conditions) {
            ObjectNode entry = array.addObject();
            entry.put("condition", values.render(condition.condition()));
            entry.put("error_message", condition.errorMessage());
        }
        return array;
    }

    private static void putIfNotEmpty(ObjectNode document, String key, ObjectNode block) {
        if (!block.isEmpty()) {
            document.set(key, block);
        }
    }

    private static String stackName(ConstructNode stack) {
        return stack.metadata() instanceof ConstructMetadata.Stack s && s.stackName() != null
                ? s.stackName()
                : stack.id();
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged and never affect synthesis.

    private void notifyStackSynthesized(String stackName, ConstructNode stack, int elementCount, long durationMs) {
        if (listener == null) return;
        try {
            listener.onStackSynthesized(new SynthesisListener.StackSynthesizedEvent(
                    stackName, stack.constructPath(), elementCount, durationMs));
        } catch (Exception e) {
            LOG.warn("SynthesisListener.onStackSynthesized failed", e);
        }
    }

    private void notifyValidationFailed(ConstructNode tree, List<ValidationError> errors) {
        if (listener == null) return;
        try {
            List<String> codes = new ArrayList<>();
            for (ValidationError error : errors) {
                codes.add(error.code().name());
            }
            listener.onValidationFailed(
                    new SynthesisListener.ValidationFailedEvent(tree.constructPath(), errors.size(), codes));
        } catch (Exception e) {
            LOG.warn("SynthesisListener.onValidationFailed failed", e);
        }
    }

    /** A collected descendant together with its typed metadata. */
    record Collected<M extends ConstructMetadata>(ConstructNode node, M metadata) {}

    /** Records which node claimed each output key and reports keys claimed twice. */
    private static final class KeyTracker {

        private final Map<String, ConstructNode> owners = new LinkedHashMap<>();
        private final List<String> collisions = new ArrayList<>();

        void claim(String key, ConstructNode node) {
            ConstructNode owner = owners.putIfAbsent(key, node);
            if (owner != null) {
                collisions.add(key + " is produced by both " + owner.constructPath() + " and " + node.constructPath());
            }
        }

        boolean hasCollisions() {
            return !collisions.isEmpty();
        }

        List<String> collisions() {
            return collisions;
        }
    }
}
