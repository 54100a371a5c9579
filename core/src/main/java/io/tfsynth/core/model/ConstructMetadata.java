package io.tfsynth.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Element-specific data attached to a {@link ConstructNode}. The variant set is closed; code that
 * needs to handle every kind switches on {@link #kind()} so that adding a kind breaks the build
 * wherever it is not handled.
 */
public sealed interface ConstructMetadata
        permits ConstructMetadata.App,
                ConstructMetadata.Stack,
                ConstructMetadata.Resource,
                ConstructMetadata.Provider,
                ConstructMetadata.DataSource,
                ConstructMetadata.Variable,
                ConstructMetadata.Output,
                ConstructMetadata.Backend,
                ConstructMetadata.Local,
                ConstructMetadata.Module {

    /** Discriminator for the metadata variants. */
    enum Kind {
        APP,
        STACK,
        RESOURCE,
        PROVIDER,
        DATA_SOURCE,
        VARIABLE,
        OUTPUT,
        BACKEND,
        LOCAL,
        MODULE
    }

    Kind kind();

    /**
     * Root of the tree.
     *
     * @param outdir         directory that synthesized stacks are written to
     * @param skipValidation when true, app-level synthesis skips {@code validateTree}
     */
    record App(String outdir, boolean skipValidation) implements ConstructMetadata {
        public App(String outdir) {
            this(outdir, false);
        }

        @Override
        public Kind kind() {
            return Kind.APP;
        }
    }

    /**
     * A deployable unit; its subtree synthesizes into one document.
     *
     * @param stackName    name of the stack, used for the output directory
     * @param dependencies names of stacks that must be deployed before this one
     */
    record Stack(String stackName, List<String> dependencies) implements ConstructMetadata {
        public Stack {
            dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        }

        public Stack(String stackName) {
            this(stackName, List.of());
        }

        @Override
        public Kind kind() {
            return Kind.STACK;
        }
    }

    record Resource(ResourceDef resource) implements ConstructMetadata {
        public Resource {
            Objects.requireNonNull(resource, "resource must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.RESOURCE;
        }
    }

    record Provider(ProviderDef provider) implements ConstructMetadata {
        public Provider {
            Objects.requireNonNull(provider, "provider must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.PROVIDER;
        }
    }

    record DataSource(DataSourceDef dataSource) implements ConstructMetadata {
        public DataSource {
            Objects.requireNonNull(dataSource, "dataSource must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.DATA_SOURCE;
        }
    }

    record Variable(VariableDef variable) implements ConstructMetadata {
        public Variable {
            Objects.requireNonNull(variable, "variable must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.VARIABLE;
        }
    }

    record Output(OutputDef output) implements ConstructMetadata {
        public Output {
            Objects.requireNonNull(output, "output must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.OUTPUT;
        }
    }

    record Backend(BackendDef backend) implements ConstructMetadata {
        public Backend {
            Objects.requireNonNull(backend, "backend must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.BACKEND;
        }
    }

    record Local(LocalDef local) implements ConstructMetadata {
        public Local {
            Objects.requireNonNull(local, "local must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.LOCAL;
        }
    }

    record Module(ModuleDef module) implements ConstructMetadata {
        public Module {
            Objects.requireNonNull(module, "module must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.MODULE;
        }
    }
}
