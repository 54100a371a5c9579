package io.tfsynth.core.model;

import io.tfsynth.core.token.Token;
import java.util.List;
import java.util.Map;

/**
 * A child module call.
 *
 * @param source    module source address
 * @param version   version constraint for registry sources, or null
 * @param providers provider mapping, module-side name to caller fqn
 * @param dependsOn explicit dependencies, or null
 * @param count     a number or token, or null
 * @param forEach   a token, or null
 * @param variables input variables passed to the module
 */
public record ModuleDef(
        String source,
        String version,
        Map<String, String> providers,
        List<Token> dependsOn,
        Object count,
        Object forEach,
        Map<String, Object> variables) {

    public ModuleDef {
        providers = ModelCollections.orderedCopy(providers);
        dependsOn = ModelCollections.listCopy(dependsOn);
        variables = ModelCollections.orderedCopy(variables);
    }

    public static ModuleDef of(String source, Map<String, Object> variables) {
        return new ModuleDef(source, null, null, null, null, null, variables);
    }
}
