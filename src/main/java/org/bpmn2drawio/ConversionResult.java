package org.bpmn2drawio;

import org.bpmn2drawio.bpmn.models.ValidationWarning;

import java.util.List;

/**
 * @param xml          the draw.io document
 * @param elementCount elements drawn
 * @param flowCount    flows drawn, after dangling ones were dropped
 * @param warnings     every recovery made on the way, in the order it happened
 * @param stage        last stage reached, {@link PipelineStage#SERIALIZED} for a complete run
 */
public record ConversionResult(
        String xml,
        int elementCount,
        int flowCount,
        List<ValidationWarning> warnings,
        PipelineStage stage
) {
    public ConversionResult {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
