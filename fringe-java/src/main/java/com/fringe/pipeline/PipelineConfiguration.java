package com.fringe.pipeline;

import com.fringe.core.UnwrapParameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Caller-owned configuration of one measurement pipeline.
 *
 * @param steps          number of phase-shifted frames per measurement
 * @param parameters     scaling, threshold and tiling parameters
 * @param strategy       unwrap strategy applied after phase calculation
 * @param stages         post-processing stages, applied in list order
 * @param parallelTiles  whether tiles are processed on the shared work-stealing pool
 */
public record PipelineConfiguration(
    int steps,
    UnwrapParameters parameters,
    UnwrapStrategy strategy,
    List<PostProcessingStage> stages,
    boolean parallelTiles
) {
    
    public static final int DEFAULT_STEPS = 3;
    
    public PipelineConfiguration {
        Objects.requireNonNull(parameters, "parameters cannot be null");
        Objects.requireNonNull(strategy, "strategy cannot be null");
        Objects.requireNonNull(stages, "stages cannot be null");
        stages = List.copyOf(stages);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Builder with the instrument defaults: three steps, default parameters, tiled unwrapping with
     * global correction and no post-processing.
     */
    public static class Builder {
        private int steps = DEFAULT_STEPS;
        private UnwrapParameters parameters = UnwrapParameters.defaults();
        private UnwrapStrategy strategy = UnwrapStrategy.TILED_WITH_GLOBAL_CORRECTION;
        private final List<PostProcessingStage> stages = new ArrayList<>();
        private boolean parallelTiles = false;
        
        public Builder steps(int steps) {
            this.steps = steps;
            return this;
        }
        
        public Builder parameters(UnwrapParameters parameters) {
            this.parameters = parameters;
            return this;
        }
        
        public Builder strategy(UnwrapStrategy strategy) {
            this.strategy = strategy;
            return this;
        }
        
        public Builder addStage(PostProcessingStage stage) {
            this.stages.add(Objects.requireNonNull(stage, "stage cannot be null"));
            return this;
        }
        
        public Builder removeLinearTrend() {
            return addStage(PostProcessingStages.linearTrend());
        }
        
        public Builder removePolynomialTrend() {
            return addStage(PostProcessingStages.polynomialTrend());
        }
        
        public Builder parallelTiles(boolean parallelTiles) {
            this.parallelTiles = parallelTiles;
            return this;
        }
        
        public PipelineConfiguration build() {
            return new PipelineConfiguration(steps, parameters, strategy, stages, parallelTiles);
        }
    }
}
