package io.tfsynth.core.model;

import java.util.Map;

/**
 * A provider configuration.
 *
 * @param terraformProviderSource source address, e.g. {@code hashicorp/aws}
 * @param version                 version constraint, or null
 * @param alias                   alias for non-default configurations, or null
 * @param config                  provider arguments
 */
public record ProviderDef(String terraformProviderSource, String version, String alias, Map<String, Object> config) {

    public ProviderDef {
        config = ModelCollections.orderedCopy(config);
    }

    public static ProviderDef of(String terraformProviderSource, Map<String, Object> config) {
        return new ProviderDef(terraformProviderSource, null, null, config);
    }

    /** Short name: the segment after the last {@code /} of the source. */
    public String providerName() {
        if (terraformProviderSource == null) {
            return null;
        }
        int slash = terraformProviderSource.lastIndexOf('/');
        return slash < 0 ? terraformProviderSource : terraformProviderSource.substring(slash + 1);
    }

    /** The reference used by resources: {@code name} or {@code name.alias}. */
    public String fqn() {
        return alias == null ? providerName() : providerName() + "." + alias;
    }
}
