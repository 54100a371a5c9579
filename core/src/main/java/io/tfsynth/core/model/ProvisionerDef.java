package io.tfsynth.core.model;

import java.util.Map;
import java.util.Set;

/**
 * A resource provisioner. {@code type}, {@code when} and {@code onFailure} are kept as the raw
 * literals supplied by the caller; the validator rejects values outside the allowed sets.
 *
 * @param type      one of {@link #TYPES}
 * @param config    provisioner arguments
 * @param when      {@code create}, {@code destroy} or null
 * @param onFailure {@code continue}, {@code fail} or null
 */
public record ProvisionerDef(String type, Map<String, Object> config, String when, String onFailure) {

    public static final Set<String> TYPES = Set.of("local-exec", "remote-exec", "file");
    public static final Set<String> WHEN_VALUES = Set.of("create", "destroy");
    public static final Set<String> ON_FAILURE_VALUES = Set.of("continue", "fail");

    public ProvisionerDef {
        config = ModelCollections.orderedCopy(config);
    }

    public static ProvisionerDef of(String type, Map<String, Object> config) {
        return new ProvisionerDef(type, config, null, null);
    }
}
