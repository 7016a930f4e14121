package com.fringe.pipeline;

import com.fringe.core.UnwrapParameters;
import com.fringe.trend.TrendRemover;
import com.fringe.unwrapping.SequentialThresholdUnwrapper;

import java.util.Objects;

/**
 * Factory for the standard post-processing stages.
 */
public final class PostProcessingStages {
    
    private PostProcessingStages() {}
    
    /**
     * Subtracts row and then column tilt.
     */
    public static PostProcessingStage linearTrend() {
        var remover = TrendRemover.linear();
        return remover::remove;
    }
    
    /**
     * Subtracts second-degree row and column curvature.
     */
    public static PostProcessingStage polynomialTrend() {
        var remover = TrendRemover.polynomial();
        return remover::remove;
    }
    
    /**
     * Runs the sequential threshold unwrapper again with {@code params}.
     */
    public static PostProcessingStage thresholdUnwrap(UnwrapParameters params) {
        Objects.requireNonNull(params, "params cannot be null");
        var unwrapper = new SequentialThresholdUnwrapper();
        return map -> unwrapper.unwrap(map, params);
    }
}
