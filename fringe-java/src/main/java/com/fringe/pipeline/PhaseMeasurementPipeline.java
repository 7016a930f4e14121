package com.fringe.pipeline;

import com.fringe.core.HeightMap;
import com.fringe.core.IntensityFrame;
import com.fringe.core.TileMask;
import com.fringe.exceptions.ShapeMismatchException;
import com.fringe.exceptions.UnsupportedStepCountException;
import com.fringe.phase.HeightScaler;
import com.fringe.phase.WrappedPhaseCalculator;
import com.fringe.unwrapping.ReliabilityGuidedUnwrapper;
import com.fringe.unwrapping.SequentialThresholdUnwrapper;
import com.fringe.unwrapping.TilePartitioner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns one phase-shifted series of frames into a finished height map.
 * <p>
 * Frames go through wrapped phase calculation, height scaling, the configured unwrap strategy and
 * the configured post-processing stages in order. A pipeline holds no per-measurement state and
 * may be called from different threads, each call owning its own buffers.
 */
public class PhaseMeasurementPipeline {
    
    private static final Logger log = LoggerFactory.getLogger(PhaseMeasurementPipeline.class);
    
    private final PipelineConfiguration configuration;
    private final WrappedPhaseCalculator calculator;
    private final HeightScaler scaler;
    private final SequentialThresholdUnwrapper sequentialUnwrapper;
    private final TilePartitioner tilePartitioner;
    private final ReliabilityGuidedUnwrapper reliabilityUnwrapper;
    
    public PhaseMeasurementPipeline(PipelineConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
        this.calculator = new WrappedPhaseCalculator();
        this.scaler = new HeightScaler(configuration.parameters().wavelength());
        this.sequentialUnwrapper = new SequentialThresholdUnwrapper();
        this.tilePartitioner = new TilePartitioner(configuration.parallelTiles());
        this.reliabilityUnwrapper = new ReliabilityGuidedUnwrapper();
    }
    
    public PipelineConfiguration getConfiguration() {
        return configuration;
    }
    
    /**
     * Processes one series of frames.
     *
     * @throws UnsupportedStepCountException if the configured step count has no formula
     * @throws ShapeMismatchException if the frame count or frame dimensions are inconsistent
     */
    public MeasurementResult process(List<IntensityFrame> frames)
            throws UnsupportedStepCountException, ShapeMismatchException {
        long start = System.nanoTime();
        var params = configuration.parameters();
        
        var wrapped = calculator.compute(frames, configuration.steps());
        Optional<TileMask> mask = Optional.empty();
        HeightMap height;
        
        switch (configuration.strategy()) {
            case NONE -> height = scaler.scale(wrapped);
            case SEQUENTIAL -> height = sequentialUnwrapper.unwrap(scaler.scale(wrapped), params);
            case TILED, TILED_WITH_GLOBAL_CORRECTION -> {
                boolean global = configuration.strategy() == UnwrapStrategy.TILED_WITH_GLOBAL_CORRECTION;
                var tiled = tilePartitioner.partition(scaler.scale(wrapped), params, global);
                height = tiled.map();
                mask = Optional.of(tiled.mask());
            }
            case RELIABILITY_GUIDED -> height = scaler.scale(reliabilityUnwrapper.unwrap(wrapped));
            default -> throw new IllegalStateException("Unknown unwrap strategy: " + configuration.strategy());
        }
        
        for (var stage : configuration.stages()) {
            height = stage.apply(height);
        }
        
        long elapsed = System.nanoTime() - start;
        log.debug("Processed {} frames into {} with {} in {} us",
                  frames.size(), height, configuration.strategy(), elapsed / 1_000);
        return new MeasurementResult(height, mask, elapsed);
    }
}
