package io.tfsynth.core.logicalid;

import io.tfsynth.core.model.ConstructMetadata;
import io.tfsynth.core.model.ConstructNode;
import java.util.Optional;

/**
 * Terraform addresses of tree nodes, as used by reference tokens: {@code aws_instance.web_1A2B3C4D},
 * {@code data.aws_ami.ubuntu_...}, {@code var.region}, {@code local.name}, {@code module.vpc},
 * {@code output.id}, a provider's {@code name[.alias]}, or a stack's name.
 */
public final class ElementAddresses {

    private ElementAddresses() {}

    /** The address other elements use to reference {@code node}; empty for the app and backends. */
    public static Optional<String> addressOf(ConstructNode node) {
        ConstructMetadata metadata = node.metadata();
        String id = LogicalIds.generateLogicalId(node.path());
        switch (metadata.kind()) {
            case RESOURCE:
                return Optional.of(LogicalIds.generateFqn(
                        ((ConstructMetadata.Resource) metadata).resource().terraformResourceType(), id));
            case DATA_SOURCE:
                return Optional.of("data." + LogicalIds.generateFqn(
                        ((ConstructMetadata.DataSource) metadata).dataSource().terraformResourceType(), id));
            case VARIABLE:
                return Optional.of("var." + id);
            case LOCAL:
                return Optional.of("local." + id);
            case MODULE:
                return Optional.of("module." + id);
            case OUTPUT:
                return Optional.of("output." + id);
            case PROVIDER:
                return Optional.ofNullable(((ConstructMetadata.Provider) metadata).provider().fqn());
            case STACK:
                return Optional.ofNullable(((ConstructMetadata.Stack) metadata).stackName());
            case APP:
            case BACKEND:
            default:
                return Optional.empty();
        }
    }
}
