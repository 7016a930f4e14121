package com.fringe.pipeline;

/**
 * How the wrapped phase is made continuous before post-processing.
 */
public enum UnwrapStrategy {
    /** Scale the wrapped phase only. */
    NONE,
    /** Threshold unwrap the whole height map row by row and column by column. */
    SEQUENTIAL,
    /** Threshold unwrap each tile independently. */
    TILED,
    /** Threshold unwrap each tile, then correct globally outside tiles with residual jumps. */
    TILED_WITH_GLOBAL_CORRECTION,
    /** Unwrap the phase in radians along a reliability-ordered path, then scale. */
    RELIABILITY_GUIDED;
    
    public boolean isTiled() {
        return this == TILED || this == TILED_WITH_GLOBAL_CORRECTION;
    }
}
