package io.tfsynth.core.validate;

import io.tfsynth.core.logicalid.ElementAddresses;
import io.tfsynth.core.model.ConditionDef;
import io.tfsynth.core.model.ConstructMetadata;
import io.tfsynth.core.model.ConstructNode;
import io.tfsynth.core.model.DataSourceDef;
import io.tfsynth.core.model.LifecycleDef;
import io.tfsynth.core.model.ModuleDef;
import io.tfsynth.core.model.ProviderDef;
import io.tfsynth.core.model.ProvisionerDef;
import io.tfsynth.core.model.ResourceDef;
import io.tfsynth.core.model.ValidationError;
import io.tfsynth.core.model.ValidationErrorCode;
import io.tfsynth.core.model.VariableDef;
import io.tfsynth.core.token.Token;
import io.tfsynth.core.tree.ConstructTree;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a construct tree for structural problems before synthesis. Findings are returned as
 * data; nothing here throws for an invalid tree. Every check runs, so one call reports every
 * problem at once.
 */
public final class TreeValidator {

    private static final Logger LOG = LoggerFactory.getLogger(TreeValidator.class);

    private static final int MAX_PROVIDER_SOURCE_SEGMENTS = 3;

    private TreeValidator() {}

    /**
     * Validates the whole tree: per-node checks in pre-order, then duplicate sibling ids, then
     * stack names, then dependency cycles (one error per cycle).
     */
    public static List<ValidationError> validateTree(ConstructNode tree) {
        List<ValidationError> errors = new ArrayList<>();
        validateRecursive(tree, errors);
        errors.addAll(collectDuplicateIds(tree));
        errors.addAll(validateStackNames(tree));
        for (List<String> cycle : detectCircularDependencies(tree)) {
            errors.add(new ValidationError(
                    cycle,
                    "Circular dependency detected: " + String.join(" -> ", cycle),
                    ValidationErrorCode.CIRCULAR_DEPENDENCY));
        }
        if (errors.isEmpty()) {
            LOG.debug("Tree valid: root={}", tree.constructPath());
        } else {
            LOG.debug("Tree invalid: root={}, errors={}", tree.constructPath(), errors.size());
        }
        return errors;
    }

    /** Validates one node's own fields. Children are not visited. */
    public static List<ValidationError> validateNode(ConstructNode node) {
        List<ValidationError> errors = new ArrayList<>();
        List<String> path = node.path();
        if (node.id().isEmpty()) {
            errors.add(missing(path, "Node requires 'id' to be a non-empty string"));
        }
        ConstructMetadata metadata = node.metadata();
        switch (metadata.kind()) {
            case APP:
                if (isBlank(((ConstructMetadata.App) metadata).outdir())) {
                    errors.add(missing(path, "App requires 'outdir' to be a non-empty string"));
                }
                break;
            case STACK:
                if (isBlank(((ConstructMetadata.Stack) metadata).stackName())) {
                    errors.add(missing(path, "Stack requires 'stackName' to be a non-empty string"));
                }
                break;
            case RESOURCE:
                validateResource(path, ((ConstructMetadata.Resource) metadata).resource(), errors);
                break;
            case PROVIDER:
                validateProvider(path, ((ConstructMetadata.Provider) metadata).provider(), errors);
                break;
            case DATA_SOURCE:
                validateDataSource(path, ((ConstructMetadata.DataSource) metadata).dataSource(), errors);
                break;
            case VARIABLE:
                validateVariable(path, ((ConstructMetadata.Variable) metadata).variable(), errors);
                break;
            case OUTPUT:
                ConstructMetadata.Output output = (ConstructMetadata.Output) metadata;
                if (output.output().value() == null) {
                    errors.add(missing(path, "Output requires 'value'"));
                }
                validateDependsOn(path, output.output().dependsOn(), errors);
                if (output.output().precondition() != null) {
                    validateConditions(
                            path,
                            "output.precondition",
                            List.of(output.output().precondition()),
                            ValidationErrorCode.MISSING_REQUIRED_FIELD,
                            errors);
                }
                break;
            case BACKEND:
                if (isBlank(((ConstructMetadata.Backend) metadata).backend().type())) {
                    errors.add(missing(path, "Backend requires 'type' to be a non-empty string"));
                }
                break;
            case LOCAL:
                if (((ConstructMetadata.Local) metadata).local().expression() == null) {
                    errors.add(missing(path, "Local requires 'expression'"));
                }
                break;
            case MODULE:
                validateModule(path, ((ConstructMetadata.Module) metadata).module(), errors);
                break;
            default:
                errors.add(new ValidationError(
                        path, "Unknown construct kind " + metadata.kind(), ValidationErrorCode.UNKNOWN));
        }
        return errors;
    }

    /**
     * Reports siblings that share an id. The error is attached to the second occurrence and names
     * the first.
     */
    public static List<ValidationError> collectDuplicateIds(ConstructNode tree) {
        Set<List<String>> seen = new HashSet<>();
        List<ValidationError> errors = new ArrayList<>();
        collectDuplicates(tree, seen, errors);
        return errors;
    }

    /**
     * Checks the names that stacks are written under. Every stack in the tree needs its own name,
     * and a name must not contain a path separator or {@code ..}. Blank names are left to {@link
     * #validateNode}.
     */
    public static List<ValidationError> validateStackNames(ConstructNode tree) {
        Map<String, List<String>> seen = new HashMap<>();
        List<ValidationError> errors = new ArrayList<>();
        for (ConstructNode stack : ConstructTree.getDescendants(tree, ConstructMetadata.Kind.STACK)) {
            String name = ((ConstructMetadata.Stack) stack.metadata()).stackName();
            if (isBlank(name)) {
                continue;
            }
            if (name.contains("/") || name.contains("\\") || name.contains("..")) {
                errors.add(new ValidationError(
                        stack.path(),
                        "Stack name '" + name + "' must not contain '/', '\\' or '..'",
                        ValidationErrorCode.INVALID_FIELD_TYPE));
            }
            List<String> first = seen.putIfAbsent(name, stack.path());
            if (first != null) {
                errors.add(new ValidationError(
                        stack.path(),
                        "Duplicate stack name '" + name + "'. First occurrence at: " + String.join("/", first),
                        ValidationErrorCode.DUPLICATE_ID));
            }
        }
        return errors;
    }

    /**
     * Finds cycles in the explicit dependency graph. Each cycle is the list of element addresses
     * in dependency order with the first address repeated at the end, e.g. {@code [a, b, a]}.
     * Nodes already explored from an earlier start are not explored again, so a cycle is reported
     * once. References to elements outside the tree are ignored.
     */
    public static List<List<String>> detectCircularDependencies(ConstructNode tree) {
        DependencyGraph graph = DependencyGraph.build(tree);
        List<List<String>> cycles = new ArrayList<>();
        Set<List<String>> visited = new HashSet<>();
        for (List<String> key : graph.keys()) {
            if (!visited.contains(key)) {
                findCycles(key, graph, visited, new ArrayList<>(), cycles);
            }
        }
        return cycles;
    }

    /** Whether the list holds at least one error. */
    public static boolean hasErrors(List<ValidationError> errors) {
        return errors != null && !errors.isEmpty();
    }

    private static void validateRecursive(ConstructNode node, List<ValidationError> errors) {
        errors.addAll(validateNode(node));
        for (ConstructNode child : node.children()) {
            validateRecursive(child, errors);
        }
    }

    private static void validateResource(List<String> path, ResourceDef resource, List<ValidationError> errors) {
        if (isBlank(resource.terraformResourceType())) {
            errors.add(missing(path, "Resource requires 'terraformResourceType' to be a non-empty string"));
        }
        validateDependsOn(path, resource.dependsOn(), errors);
        validateIteration(path, resource.count(), resource.forEach(), errors);
        if (resource.lifecycle() != null) {
            validateLifecycle(path, resource.lifecycle(), errors);
        }
        if (resource.provisioners() != null) {
            for (ProvisionerDef provisioner : resource.provisioners()) {
                validateProvisioner(path, provisioner, errors);
            }
        }
    }

    private static void validateDataSource(List<String> path, DataSourceDef dataSource, List<ValidationError> errors) {
        if (isBlank(dataSource.terraformResourceType())) {
            errors.add(missing(path, "DataSource requires 'terraformResourceType' to be a non-empty string"));
        }
        validateDependsOn(path, dataSource.dependsOn(), errors);
        validateIteration(path, dataSource.count(), dataSource.forEach(), errors);
    }

    private static void validateProvider(List<String> path, ProviderDef provider, List<ValidationError> errors) {
        String source = provider.terraformProviderSource();
        if (isBlank(source)) {
            errors.add(missing(path, "Provider requires 'terraformProviderSource' to be a non-empty string"));
            return;
        }
        String[] segments = source.split("/", -1);
        boolean emptySegment = false;
        for (String segment : segments) {
            if (segment.isBlank()) {
                emptySegment = true;
            }
        }
        if (segments.length > MAX_PROVIDER_SOURCE_SEGMENTS || emptySegment) {
            errors.add(new ValidationError(
                    path,
                    "Provider source '" + source + "' must have the form [hostname/]namespace/type",
                    ValidationErrorCode.INVALID_PROVIDER));
        }
        if (provider.alias() != null && provider.alias().isBlank()) {
            errors.add(new ValidationError(
                    path, "Provider 'alias' must not be blank", ValidationErrorCode.INVALID_PROVIDER));
        }
    }

    private static void validateVariable(List<String> path, VariableDef variable, List<ValidationError> errors) {
        if (variable.validation() != null) {
            validateConditions(
                    path, "variable.validation", variable.validation(), ValidationErrorCode.MISSING_REQUIRED_FIELD, errors);
        }
    }

    private static void validateModule(List<String> path, ModuleDef module, List<ValidationError> errors) {
        if (isBlank(module.source())) {
            errors.add(missing(path, "Module requires 'source' to be a non-empty string"));
        }
        validateDependsOn(path, module.dependsOn(), errors);
        validateIteration(path, module.count(), module.forEach(), errors);
    }

    private static void validateLifecycle(List<String> path, LifecycleDef lifecycle, List<ValidationError> errors) {
        Object ignoreChanges = lifecycle.ignoreChanges();
        if (ignoreChanges != null) {
            if (ignoreChanges instanceof List<?> list) {
                for (Object item : list) {
                    if (!(item instanceof String)) {
                        errors.add(new ValidationError(
                                path,
                                "lifecycle.ignoreChanges list must contain only strings",
                                ValidationErrorCode.INVALID_FIELD_TYPE));
                        break;
                    }
                }
            } else if (!LifecycleDef.IGNORE_ALL.equals(ignoreChanges)) {
                errors.add(new ValidationError(
                        path,
                        "lifecycle.ignoreChanges must be 'all' or a list of strings",
                        ValidationErrorCode.INVALID_FIELD_TYPE));
            }
        }
        if (lifecycle.replaceTriggeredBy() != null && lifecycle.replaceTriggeredBy().contains(null)) {
            errors.add(new ValidationError(
                    path, "lifecycle.replaceTriggeredBy must not contain null", ValidationErrorCode.INVALID_LIFECYCLE));
        }
        if (lifecycle.precondition() != null) {
            validateConditions(
                    path, "lifecycle.precondition", lifecycle.precondition(), ValidationErrorCode.INVALID_LIFECYCLE, errors);
        }
        if (lifecycle.postcondition() != null) {
            validateConditions(
                    path, "lifecycle.postcondition", lifecycle.postcondition(), ValidationErrorCode.INVALID_LIFECYCLE, errors);
        }
    }

    private static void validateConditions(
            List<String> path,
            String field,
            List<ConditionDef> conditions,
            ValidationErrorCode code,
            List<ValidationError> errors) {
        for (ConditionDef condition : conditions) {
            if (condition == null || condition.condition() == null) {
                errors.add(new ValidationError(path, field + " requires a 'condition'", code));
            } else if (isBlank(condition.errorMessage())) {
                errors.add(new ValidationError(path, field + " requires a non-empty 'errorMessage'", code));
            }
        }
    }

    private static void validateProvisioner(List<String> path, ProvisionerDef provisioner, List<ValidationError> errors) {
        if (!ProvisionerDef.TYPES.contains(provisioner.type())) {
            errors.add(new ValidationError(
                    path,
                    "Provisioner type must be 'local-exec', 'remote-exec', or 'file', got '" + provisioner.type() + "'",
                    ValidationErrorCode.INVALID_FIELD_TYPE));
        }
        if (provisioner.when() != null && !ProvisionerDef.WHEN_VALUES.contains(provisioner.when())) {
            errors.add(new ValidationError(
                    path, "Provisioner 'when' must be 'create' or 'destroy'", ValidationErrorCode.INVALID_FIELD_TYPE));
        }
        if (provisioner.onFailure() != null && !ProvisionerDef.ON_FAILURE_VALUES.contains(provisioner.onFailure())) {
            errors.add(new ValidationError(
                    path, "Provisioner 'onFailure' must be 'continue' or 'fail'", ValidationErrorCode.INVALID_FIELD_TYPE));
        }
    }

    private static void validateIteration(List<String> path, Object count, Object forEach, List<ValidationError> errors) {
        if (count != null && !(count instanceof Number || count instanceof Token || isInterpolation(count))) {
            errors.add(new ValidationError(
                    path,
                    "'count' must be a number or a token, got " + count.getClass().getSimpleName(),
                    ValidationErrorCode.INVALID_FIELD_TYPE));
        }
        if (forEach != null
                && !(forEach instanceof Token
                        || forEach instanceof Map
                        || forEach instanceof Collection
                        || isInterpolation(forEach))) {
            errors.add(new ValidationError(
                    path,
                    "'for_each' must be a map, a collection or a token, got " + forEach.getClass().getSimpleName(),
                    ValidationErrorCode.INVALID_FIELD_TYPE));
        }
        if (count != null && forEach != null) {
            errors.add(new ValidationError(
                    path, "'count' and 'for_each' cannot be used together", ValidationErrorCode.INVALID_FIELD_TYPE));
        }
    }

    private static void validateDependsOn(List<String> path, List<Token> dependsOn, List<ValidationError> errors) {
        if (dependsOn == null) {
            return;
        }
        for (Token token : dependsOn) {
            if (token == null || token.kind() == Token.Kind.FN) {
                errors.add(new ValidationError(
                        path,
                        "dependsOn entries must reference an element, got " + (token == null ? "null" : "a function call"),
                        ValidationErrorCode.INVALID_REFERENCE));
            }
        }
    }

    // Siblings sharing an id share a path, so the path is the key.
    private static void collectDuplicates(ConstructNode node, Set<List<String>> seen, List<ValidationError> errors) {
        List<String> path = node.path();
        if (!seen.add(path)) {
            errors.add(new ValidationError(
                    path,
                    "Duplicate id '" + node.id() + "' found at same level. First occurrence at: "
                            + String.join("/", path),
                    ValidationErrorCode.DUPLICATE_ID));
        }
        for (ConstructNode child : node.children()) {
            collectDuplicates(child, seen, errors);
        }
    }

    private static void findCycles(
            List<String> key,
            DependencyGraph graph,
            Set<List<String>> visited,
            List<List<String>> stack,
            List<List<String>> cycles) {
        int onStack = stack.indexOf(key);
        if (onStack >= 0) {
            List<String> cycle = new ArrayList<>();
            for (List<String> member : stack.subList(onStack, stack.size())) {
                cycle.add(graph.address(member));
            }
            cycle.add(graph.address(key));
            cycles.add(cycle);
            return;
        }
        if (visited.contains(key)) {
            return;
        }
        stack.add(key);
        for (List<String> dependency : graph.edges(key)) {
            findCycles(dependency, graph, visited, stack, cycles);
        }
        stack.remove(stack.size() - 1);
        visited.add(key);
    }

    private static boolean isInterpolation(Object value) {
        return value instanceof String s && s.startsWith("${") && s.endsWith("}");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static ValidationError missing(List<String> path, String message) {
        return new ValidationError(path, message, ValidationErrorCode.MISSING_REQUIRED_FIELD);
    }

    /** Explicit dependency edges keyed by construct path; fqns are resolved to paths up front. */
    private static final class DependencyGraph {

        private final Map<List<String>, List<List<String>>> edges = new LinkedHashMap<>();
        private final Map<List<String>, String> addresses = new HashMap<>();

        static DependencyGraph build(ConstructNode tree) {
            Map<String, List<String>> aliases = new HashMap<>();
            Map<List<String>, List<String>> rawEdges = new LinkedHashMap<>();
            DependencyGraph graph = new DependencyGraph();
            index(tree, aliases, rawEdges, graph);
            for (Map.Entry<List<String>, List<String>> entry : rawEdges.entrySet()) {
                List<List<String>> resolved = new ArrayList<>();
                for (String fqn : entry.getValue()) {
                    List<String> target = aliases.get(fqn);
                    if (target != null) {
                        resolved.add(target);
                    }
                }
                graph.edges.put(entry.getKey(), resolved);
            }
            return graph;
        }

        private static void index(
                ConstructNode node,
                Map<String, List<String>> aliases,
                Map<List<String>, List<String>> rawEdges,
                DependencyGraph graph) {
            List<String> key = node.path();
            String address = ElementAddresses.addressOf(node).orElse(node.constructPath());
            graph.addresses.put(key, address);
            aliases.putIfAbsent(address, key);
            aliases.putIfAbsent(String.join(".", node.path()), key);
            rawEdges.put(key, DependencyExtractor.dependencies(node.metadata()));
            for (ConstructNode child : node.children()) {
                index(child, aliases, rawEdges, graph);
            }
        }

        Iterable<List<String>> keys() {
            return edges.keySet();
        }

        List<List<String>> edges(List<String> key) {
            return edges.getOrDefault(key, List.of());
        }

        String address(List<String> key) {
            return addresses.getOrDefault(key, String.join("/", key));
        }
    }
}
