package io.tfsynth.core.validate;

import io.tfsynth.core.model.ConstructMetadata;
import io.tfsynth.core.token.Token;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the explicit dependency edges of a node: the fqns of reference tokens in its {@code
 * dependsOn}, and for stacks the names of the stacks it depends on. Implicit references inside
 * configuration values are not edges.
 */
final class DependencyExtractor {

    private DependencyExtractor() {}

    static List<String> dependencies(ConstructMetadata metadata) {
        switch (metadata.kind()) {
            case RESOURCE:
                return refFqns(((ConstructMetadata.Resource) metadata).resource().dependsOn());
            case DATA_SOURCE:
                return refFqns(((ConstructMetadata.DataSource) metadata).dataSource().dependsOn());
            case OUTPUT:
                return refFqns(((ConstructMetadata.Output) metadata).output().dependsOn());
            case MODULE:
                return refFqns(((ConstructMetadata.Module) metadata).module().dependsOn());
            case STACK:
                return ((ConstructMetadata.Stack) metadata).dependencies();
            default:
                return List.of();
        }
    }

    private static List<String> refFqns(List<Token> dependsOn) {
        if (dependsOn == null) {
            return List.of();
        }
        List<String> fqns = new ArrayList<>();
        for (Token token : dependsOn) {
            if (token instanceof Token.Ref ref) {
                fqns.add(ref.fqn());
            }
        }
        return fqns;
    }
}
