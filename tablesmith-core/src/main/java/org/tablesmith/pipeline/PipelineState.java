package org.tablesmith.pipeline;

public enum PipelineState {
    RESOLVING,
    GENERATING,
    /** Terminal. */
    DONE
}
