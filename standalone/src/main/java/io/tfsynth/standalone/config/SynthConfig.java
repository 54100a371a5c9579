package io.tfsynth.standalone.config;

import io.tfsynth.standalone.writer.SchemaValidationMode;
import java.util.Objects;

/**
 * Settings for writing an app to disk. Use {@link #builder()}; every field has a default.
 *
 * @param outdir           output directory; null defers to the app's own {@code outdir}
 * @param skipValidation   skip tree validation before synthesis
 * @param prettyPrint      indent the written JSON documents
 * @param schemaValidation what to do when a document fails the output schema check
 * @param loggingFormat    {@code text} or {@code json}
 * @param loggingLevel     root log level
 */
public record SynthConfig(
        String outdir,
        boolean skipValidation,
        boolean prettyPrint,
        SchemaValidationMode schemaValidation,
        String loggingFormat,
        String loggingLevel) {

    /** Used when neither the configuration nor the app names an output directory. */
    public static final String DEFAULT_OUTDIR = "cdktf.out";

    public SynthConfig {
        Objects.requireNonNull(schemaValidation, "schemaValidation must not be null");
        Objects.requireNonNull(loggingFormat, "loggingFormat must not be null");
        Objects.requireNonNull(loggingLevel, "loggingLevel must not be null");
    }

    /** All defaults. */
    public static SynthConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link SynthConfig}. */
    public static final class Builder {

        private String outdir;
        private boolean skipValidation = false;
        private boolean prettyPrint = true;
        private SchemaValidationMode schemaValidation = SchemaValidationMode.LENIENT;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        private Builder() {}

        public Builder outdir(String outdir) {
            this.outdir = outdir;
            return this;
        }

        public Builder skipValidation(boolean skipValidation) {
            this.skipValidation = skipValidation;
            return this;
        }

        public Builder prettyPrint(boolean prettyPrint) {
            this.prettyPrint = prettyPrint;
            return this;
        }

        public Builder schemaValidation(SchemaValidationMode schemaValidation) {
            this.schemaValidation = schemaValidation;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the value is not {@code lenient} or {@code strict}
         */
        public Builder schemaValidation(String schemaValidation) {
            this.schemaValidation = SchemaValidationMode.parse(schemaValidation);
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public SynthConfig build() {
            return new SynthConfig(outdir, skipValidation, prettyPrint, schemaValidation, loggingFormat, loggingLevel);
        }
    }
}
