package io.tfsynth.core.model;

import java.util.Map;

/**
 * State backend of a stack.
 *
 * @param type   backend type, e.g. {@code s3}, {@code local}
 * @param config backend arguments
 */
public record BackendDef(String type, Map<String, Object> config) {

    public BackendDef {
        config = ModelCollections.orderedCopy(config);
    }
}
