package io.tfsynth.core.model;

import io.tfsynth.core.token.Token;
import java.util.List;
import java.util.Map;

/**
 * A managed resource.
 *
 * @param terraformResourceType resource type, e.g. {@code aws_instance}
 * @param config                resource arguments; values may contain tokens
 * @param provider              provider fqn such as {@code aws.west}, or null
 * @param dependsOn             explicit dependencies (reference tokens), or null
 * @param count                 a number, a token or a token-marker string, or null
 * @param forEach               a token or a token-marker string, or null
 * @param lifecycle             lifecycle meta-argument, or null
 * @param provisioners          provisioners in declaration order, or null
 */
public record ResourceDef(
        String terraformResourceType,
        Map<String, Object> config,
        String provider,
        List<Token> dependsOn,
        Object count,
        Object forEach,
        LifecycleDef lifecycle,
        List<ProvisionerDef> provisioners) {

    public ResourceDef {
        config = ModelCollections.orderedCopy(config);
        dependsOn = ModelCollections.listCopy(dependsOn);
        provisioners = ModelCollections.listCopy(provisioners);
    }

    public static ResourceDef of(String terraformResourceType, Map<String, Object> config) {
        return new ResourceDef(terraformResourceType, config, null, null, null, null, null, null);
    }

    public static Builder builder(String terraformResourceType) {
        return new Builder(terraformResourceType);
    }

    /** Builder for {@link ResourceDef}. */
    public static final class Builder {

        private final String terraformResourceType;
        private Map<String, Object> config = Map.of();
        private String provider;
        private List<Token> dependsOn;
        private Object count;
        private Object forEach;
        private LifecycleDef lifecycle;
        private List<ProvisionerDef> provisioners;

        private Builder(String terraformResourceType) {
            this.terraformResourceType = terraformResourceType;
        }

        public Builder config(Map<String, Object> config) {
            this.config = config;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder dependsOn(List<Token> dependsOn) {
            this.dependsOn = dependsOn;
            return this;
        }

        public Builder count(Object count) {
            this.count = count;
            return this;
        }

        public Builder forEach(Object forEach) {
            this.forEach = forEach;
            return this;
        }

        public Builder lifecycle(LifecycleDef lifecycle) {
            this.lifecycle = lifecycle;
            return this;
        }

        public Builder provisioners(List<ProvisionerDef> provisioners) {
            this.provisioners = provisioners;
            return this;
        }

        public ResourceDef build() {
            return new ResourceDef(
                    terraformResourceType, config, provider, dependsOn, count, forEach, lifecycle, provisioners);
        }
    }
}
