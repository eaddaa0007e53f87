package dev.pekelund.zuvp.processor;

/**
 * Stages a submission passes through. {@code REJECTED}, {@code INCOMPLETE} and {@code DRAFTED} are terminal.
 */
public enum PipelineStage {
    INGESTED,
    EXTRACTED,
    NORMALIZED,
    VALIDATED,
    REJECTED,
    INCOMPLETE,
    READY,
    RENDERED,
    DRAFTED
}
