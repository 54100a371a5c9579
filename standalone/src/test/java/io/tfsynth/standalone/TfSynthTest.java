package io.tfsynth.standalone;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import io.tfsynth.core.model.ConstructMetadata;
import io.tfsynth.core.model.ConstructNode;
import io.tfsynth.core.model.ResourceDef;
import io.tfsynth.core.token.TokenTable;
import io.tfsynth.core.tree.ConstructTree;
import io.tfsynth.standalone.logging.RootLoggerSnapshot;
import io.tfsynth.standalone.writer.Manifest;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("TfSynth")
class TfSynthTest {

    @TempDir
    Path projectDir;

    private RootLoggerSnapshot snapshot;

    @BeforeEach
    void saveRoot() {
        snapshot = RootLoggerSnapshot.take();
    }

    @AfterEach
    void restoreRoot() {
        snapshot.restore();
    }

    private static ConstructNode app() {
        ConstructNode app = ConstructTree.createNode("app", List.of("app"), new ConstructMetadata.App("cdktf.out"));
        ConstructNode dev = ConstructTree.childOf(app, "dev", new ConstructMetadata.Stack("dev"));
        ConstructNode web = ConstructTree.childOf(
                dev, "web", new ConstructMetadata.Resource(ResourceDef.of("aws_instance", Map.of())));
        return ConstructTree.addChild(ConstructTree.addChild(app, app.path(), dev), dev.path(), web);
    }

    @Test
    @DisplayName("project config drives outdir and logging")
    void projectConfig() throws IOException {
        Path outdir = projectDir.resolve("synth");
        Files.writeString(projectDir.resolve("tfsynth.yaml"), """
                outdir: %s
                logging:
                  level: WARN
                """.formatted(outdir));

        Manifest manifest = TfSynth.synth(app(), new TokenTable(), projectDir, name -> null, null);

        assertThat(manifest.stacks()).containsOnlyKeys("dev");
        assertThat(outdir.resolve("stacks/dev/cdk.tf.json")).exists();
        assertThat(RootLoggerSnapshot.root().getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    @DisplayName("the environment overrides the project config")
    void environmentOverride() {
        Path envOut = projectDir.resolve("from-env");

        TfSynth.synth(app(), new TokenTable(), projectDir, Map.of("CDKTF_OUTDIR", envOut.toString())::get, null);

        assertThat(envOut.resolve("manifest.json")).exists();
    }
}
