package io.tfsynth.core.model;

import io.tfsynth.core.token.Token;
import java.util.List;
import java.util.Map;

/**
 * A data source.
 *
 * @param terraformResourceType data source type, e.g. {@code aws_ami}
 * @param config                arguments; values may contain tokens
 * @param provider              provider fqn, or null
 * @param dependsOn             explicit dependencies, or null
 * @param count                 a number or token, or null
 * @param forEach               a token, or null
 */
public record DataSourceDef(
        String terraformResourceType,
        Map<String, Object> config,
        String provider,
        List<Token> dependsOn,
        Object count,
        Object forEach) {

    public DataSourceDef {
        config = ModelCollections.orderedCopy(config);
        dependsOn = ModelCollections.listCopy(dependsOn);
    }

    public static DataSourceDef of(String terraformResourceType, Map<String, Object> config) {
        return new DataSourceDef(terraformResourceType, config, null, null, null, null);
    }

    public DataSourceDef withProvider(String newProvider) {
        return new DataSourceDef(terraformResourceType, config, newProvider, dependsOn, count, forEach);
    }

    public DataSourceDef withDependsOn(List<Token> newDependsOn) {
        return new DataSourceDef(terraformResourceType, config, provider, newDependsOn, count, forEach);
    }
}
