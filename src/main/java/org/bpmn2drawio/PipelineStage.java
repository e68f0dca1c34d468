package org.bpmn2drawio;

/**
 * Stages of one conversion, in the only order they may run.
 */
public enum PipelineStage {
    PARSED,
    VALIDATED,
    LAID_OUT,
    STYLED,
    TRANSFORMED,
    SERIALIZED;

    /**
     * @throws IllegalStateException if {@code next} is not the stage right after this one
     */
    public PipelineStage advanceTo(PipelineStage next) {
        if (next.ordinal() != ordinal() + 1) {
            throw new IllegalStateException("Cannot move from " + this + " to " + next);
        }
        return next;
    }
}
