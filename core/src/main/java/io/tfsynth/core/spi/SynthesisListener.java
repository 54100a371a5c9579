package io.tfsynth.core.spi;

import java.util.List;

/**
 * Observability hooks for synthesis. Implementations bridge to whatever metrics or audit system
 * the host application uses; the core has no dependency on one.
 *
 * <p>
 * All methods receive immutable event objects. Exceptions thrown by listeners are caught and
 * logged by the caller and never affect synthesis.
 */
public interface SynthesisListener {

    /**
     * Called after a stack has been compiled into a document.
     *
     * @param event contains stackName, constructPath, elementCount, durationMs
     */
    void onStackSynthesized(StackSynthesizedEvent event);

    /**
     * Called when validated synthesis is refused because the tree has errors.
     *
     * @param event contains rootPath, errorCount, errorCodes
     */
    void onValidationFailed(ValidationFailedEvent event);

    /**
     * Called after every stack of an app has been written to the output directory.
     *
     * @param event contains outdir, stackNames, durationMs
     */
    void onAppSynthesized(AppSynthesizedEvent event);

    // --- Event records ---

    /** Event emitted when a stack document has been produced. */
    record StackSynthesizedEvent(String stackName, String constructPath, int elementCount, long durationMs) {}

    /** Event emitted when validation blocks synthesis. */
    record ValidationFailedEvent(String rootPath, int errorCount, List<String> errorCodes) {
        public ValidationFailedEvent {
            errorCodes = List.copyOf(errorCodes);
        }
    }

    /** Event emitted when an app has been written out. */
    record AppSynthesizedEvent(String outdir, List<String> stackNames, long durationMs) {
        public AppSynthesizedEvent {
            stackNames = List.copyOf(stackNames);
        }
    }
}
