package com.fringe.pipeline;

import com.fringe.TestBase;
import com.fringe.core.HeightMap;
import com.fringe.core.UnwrapParameters;
import com.fringe.exceptions.ShapeMismatchException;
import com.fringe.exceptions.UnsupportedStepCountException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PhaseMeasurementPipeline Tests")
class PhaseMeasurementPipelineTest extends TestBase {
    
    private final UnwrapParameters params = UnwrapParameters.builder()
        .wavelength(LAMBDA)
        .threshold(THRESHOLD)
        .tileSize(16)
        .build();
    
    private HeightMap phasePlane(int width, int height, double a, double b, double c) {
        return plane(width, height, a, b, c);
    }
    
    @ParameterizedTest
    @ValueSource(ints = {3, 4, 5})
    @DisplayName("Unwrapped-free phase is scaled to height")
    void testScalingOnly(int steps) throws Exception {
        var phase = phasePlane(32, 32, 0.02, 0.03, -1.0);
        var pipeline = new PhaseMeasurementPipeline(PipelineConfiguration.builder()
            .steps(steps)
            .parameters(params)
            .strategy(UnwrapStrategy.NONE)
            .build());
        
        var result = pipeline.process(fringeSeries(phase, steps, 100.0, 60.0));
        
        for (int y = 0; y < 32; y++) {
            for (int x = 0; x < 32; x++) {
                assertEquals(phase.get(x, y) * LAMBDA / (2 * Math.PI), result.heightMap().get(x, y), 1e-6);
            }
        }
        assertTrue(result.tileMask().isEmpty());
    }
    
    @Test
    @DisplayName("Reliability unwrapping and tilt removal flatten a wrapped tilted wavefront")
    void testReliabilityUnwrapWithTrendRemoval() throws Exception {
        var phase = phasePlane(48, 40, 0.25, 0.1, 0.0);
        var pipeline = new PhaseMeasurementPipeline(PipelineConfiguration.builder()
            .steps(5)
            .parameters(params)
            .strategy(UnwrapStrategy.RELIABILITY_GUIDED)
            .removeLinearTrend()
            .build());
        
        var result = pipeline.process(fringeSeries(phase, 5, 128.0, 100.0));
        
        assertAllWithin(result.heightMap(), 0.0, 1e-6);
        assertTrue(result.elapsedNanos() >= 0);
    }
    
    @ParameterizedTest
    @EnumSource(value = UnwrapStrategy.class, names = {"TILED", "TILED_WITH_GLOBAL_CORRECTION"})
    @DisplayName("Tiled strategies expose the tile mask")
    void testTiledStrategiesReturnMask(UnwrapStrategy strategy) throws Exception {
        var phase = phasePlane(40, 24, 0.01, 0.02, 0.0);
        var pipeline = new PhaseMeasurementPipeline(PipelineConfiguration.builder()
            .parameters(params)
            .strategy(strategy)
            .parallelTiles(true)
            .build());
        
        var result = pipeline.process(fringeSeries(phase, 3, 100.0, 50.0));
        
        assertTrue(strategy.isTiled());
        
        var mask = result.tileMask().orElseThrow();
        assertEquals(3, mask.tileColumns());
        assertEquals(2, mask.tileRows());
        assertEquals(0, mask.badTileCount());
    }
    
    @Test
    @DisplayName("Sequential strategy keeps smooth phase unchanged")
    void testSequentialStrategy() throws Exception {
        var phase = phasePlane(20, 20, 0.03, -0.02, 0.5);
        var config = PipelineConfiguration.builder()
            .steps(4)
            .parameters(params)
            .strategy(UnwrapStrategy.SEQUENTIAL)
            .build();
        
        var result = new PhaseMeasurementPipeline(config).process(fringeSeries(phase, 4, 100.0, 50.0));
        
        assertEquals(phase.get(19, 19) * LAMBDA / (2 * Math.PI), result.heightMap().get(19, 19), 1e-6);
    }
    
    @Test
    @DisplayName("Curvature removal flattens a spherical wavefront")
    void testPolynomialTrendStage() throws Exception {
        var phase = paraboloid(24, 24, 0.002, 0.003, -1.0);
        var pipeline = new PhaseMeasurementPipeline(PipelineConfiguration.builder()
            .steps(4)
            .parameters(params)
            .strategy(UnwrapStrategy.NONE)
            .removePolynomialTrend()
            .build());
        
        var result = pipeline.process(fringeSeries(phase, 4, 100.0, 50.0));
        
        assertAllWithin(result.heightMap(), 0.0, 1e-6);
        assertFalse(UnwrapStrategy.NONE.isTiled());
    }
    
    @Test
    @DisplayName("Threshold unwrap stage removes a wavelength step")
    void testThresholdUnwrapStage() {
        var map = addStep(plane(10, 6, 1.0, 0.0, 0.0), 5, 0, 10, 6, LAMBDA / 2);
        
        var result = PostProcessingStages.thresholdUnwrap(params).apply(map);
        
        assertMapEquals(plane(10, 6, 1.0, 0.0, 0.0), result, 1e-9);
    }
    
    @Test
    @DisplayName("Post-processing stages run in the configured order")
    void testStageOrder() throws Exception {
        var frames = fringeSeries(constant(4, 4, 0.0), 3, 100.0, 50.0);
        var pipeline = new PhaseMeasurementPipeline(PipelineConfiguration.builder()
            .parameters(params)
            .strategy(UnwrapStrategy.NONE)
            .addStage(map -> constant(map.width(), map.height(), 1.0))
            .addStage(map -> {
                var doubled = map.copy();
                doubled.set(0, 0, map.get(0, 0) * 2 + 1);
                return doubled;
            })
            .build());
        
        var result = pipeline.process(frames).heightMap();
        
        assertEquals(3.0, result.get(0, 0));
        assertEquals(1.0, result.get(3, 3));
    }
    
    @Test
    @DisplayName("Unsupported step counts are surfaced")
    void testUnsupportedSteps() {
        var phase = constant(4, 4, 0.0);
        var pipeline = new PhaseMeasurementPipeline(PipelineConfiguration.builder().steps(6).build());
        
        assertThrows(UnsupportedStepCountException.class, () -> pipeline.process(fringeSeries(phase, 6, 1.0, 1.0)));
    }
    
    @Test
    @DisplayName("Frame count must match the configured step count")
    void testFrameCountMismatch() {
        var phase = constant(4, 4, 0.0);
        var pipeline = new PhaseMeasurementPipeline(PipelineConfiguration.builder().steps(3).build());
        
        assertThrows(ShapeMismatchException.class, () -> pipeline.process(fringeSeries(phase, 4, 1.0, 1.0)));
    }
    
    @Test
    @DisplayName("Configuration defaults and immutability")
    void testConfigurationDefaults() {
        var config = PipelineConfiguration.builder().build();
        
        assertEquals(3, config.steps());
        assertEquals(UnwrapStrategy.TILED_WITH_GLOBAL_CORRECTION, config.strategy());
        assertEquals(UnwrapParameters.defaults(), config.parameters());
        assertTrue(config.stages().isEmpty());
        assertFalse(config.parallelTiles());
        assertThrows(UnsupportedOperationException.class, () -> config.stages().add(map -> map));
        assertThrows(NullPointerException.class, () -> PipelineConfiguration.builder().strategy(null).build());
    }
    
    @Test
    @DisplayName("Stages compose with andThen")
    void testStageComposition() {
        PostProcessingStage addOne = map -> {
            var result = map.copy();
            result.set(0, 0, map.get(0, 0) + 1);
            return result;
        };
        
        var composed = addOne.andThen(PostProcessingStages.linearTrend()).andThen(addOne);
        var result = composed.apply(constant(1, 1, 0.0));
        
        assertEquals(2.0, result.get(0, 0), 1e-12);
    }
}
