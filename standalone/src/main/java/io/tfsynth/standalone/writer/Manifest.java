package io.tfsynth.standalone.writer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Content of {@code manifest.json}: which stacks were synthesized and where their documents
 * are. Paths are relative to {@code outdir}.
 *
 * @param version format version of the manifest
 * @param outdir  the output directory as configured
 * @param stacks  per-stack entries keyed by stack name, in synthesis order
 */
public record Manifest(String version, String outdir, Map<String, StackManifest> stacks) {

    public static final String VERSION = "0.0.0";

    public Manifest {
        stacks = Collections.unmodifiableMap(new LinkedHashMap<>(stacks));
    }

    /**
     * One synthesized stack.
     *
     * @param name                 stack name
     * @param constructPath        path of the stack node, joined with {@code /}
     * @param synthesizedStackPath the document, e.g. {@code stacks/dev/cdk.tf.json}
     * @param workingDirectory     directory the provisioning tool runs in for this stack
     * @param dependencies         names of stacks to deploy before this one
     */
    public record StackManifest(
            String name,
            String constructPath,
            String synthesizedStackPath,
            String workingDirectory,
            List<String> dependencies) {

        public StackManifest {
            dependencies = List.copyOf(dependencies);
        }
    }
}
