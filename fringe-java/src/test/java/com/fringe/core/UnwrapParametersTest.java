package com.fringe.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UnwrapParameters Tests")
class UnwrapParametersTest {
    
    @Test
    @DisplayName("Should create parameters with instrument defaults")
    void testDefaults() {
        var params = UnwrapParameters.defaults();
        
        assertEquals(7500.0, params.wavelength());
        assertEquals(0.8, params.threshold());
        assertTrue(params.horizontal());
        assertTrue(params.vertical());
        assertEquals(32, params.tileSize());
        assertEquals(1, params.iterations());
    }
    
    @Test
    @DisplayName("Should derive jump limit and correction step from wavelength")
    void testDerivedValues() {
        var params = UnwrapParameters.builder().wavelength(750.0).threshold(0.8).build();
        
        assertEquals(300.0, params.jumpLimit(), 1e-12);
        assertEquals(375.0, params.correctionStep(), 1e-12);
    }
    
    @Test
    @DisplayName("Should create parameters with builder pattern")
    void testBuilderPattern() {
        var params = UnwrapParameters.builder()
            .wavelength(632.8)
            .threshold(0.5)
            .horizontal(false)
            .vertical(true)
            .tileSize(16)
            .iterations(3)
            .build();
        
        assertEquals(632.8, params.wavelength());
        assertEquals(0.5, params.threshold());
        assertFalse(params.horizontal());
        assertTrue(params.vertical());
        assertEquals(16, params.tileSize());
        assertEquals(3, params.iterations());
    }
    
    @ParameterizedTest
    @ValueSource(doubles = {0.0, -1.0, Double.NaN, Double.POSITIVE_INFINITY})
    @DisplayName("Should reject non-positive wavelength")
    void testWavelengthValidation(double wavelength) {
        assertThrows(IllegalArgumentException.class, () ->
            UnwrapParameters.builder().wavelength(wavelength).build()
        );
    }
    
    @ParameterizedTest
    @ValueSource(doubles = {0.0, -0.1, 1.01, Double.NaN})
    @DisplayName("Should reject threshold outside (0, 1]")
    void testThresholdValidation(double threshold) {
        assertThrows(IllegalArgumentException.class, () ->
            UnwrapParameters.builder().threshold(threshold).build()
        );
    }
    
    @Test
    @DisplayName("Should accept threshold of exactly one")
    void testThresholdUpperBound() {
        assertEquals(1.0, UnwrapParameters.builder().threshold(1.0).build().threshold());
    }
    
    @Test
    @DisplayName("Should reject invalid tile size and iterations")
    void testIntegerValidation() {
        assertThrows(IllegalArgumentException.class, () -> UnwrapParameters.builder().tileSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> UnwrapParameters.builder().iterations(0).build());
    }
    
    @Test
    @DisplayName("Copy modifiers should change only one field")
    void testWithers() {
        var base = UnwrapParameters.defaults();
        
        assertEquals(100.0, base.withWavelength(100.0).wavelength());
        assertEquals(0.3, base.withThreshold(0.3).threshold());
        assertEquals(8, base.withTileSize(8).tileSize());
        assertEquals(4, base.withIterations(4).iterations());
        
        var horizontalOnly = base.withAxes(true, false);
        assertTrue(horizontalOnly.horizontal());
        assertFalse(horizontalOnly.vertical());
        assertEquals(base.wavelength(), horizontalOnly.wavelength());
    }
}
