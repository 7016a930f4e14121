package com.fringe.unwrapping;

import com.fringe.TestBase;
import com.fringe.core.HeightMap;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReliabilityGuidedUnwrapper Tests")
class ReliabilityGuidedUnwrapperTest extends TestBase {
    
    private final ReliabilityGuidedUnwrapper unwrapper = new ReliabilityGuidedUnwrapper();
    
    private HeightMap wrapped(HeightMap phase) {
        var result = phase.copy();
        for (int y = 0; y < phase.height(); y++) {
            for (int x = 0; x < phase.width(); x++) {
                result.set(x, y, wrap(phase.get(x, y)));
            }
        }
        return result;
    }
    
    private void assertUnwrapsTo(HeightMap expected, HeightMap actual) {
        double shift = actual.get(0, 0) - expected.get(0, 0);
        assertEquals(0.0, wrap(shift), 1e-9, "global offset must be a multiple of 2 pi");
        for (int y = 0; y < expected.height(); y++) {
            for (int x = 0; x < expected.width(); x++) {
                assertEquals(expected.get(x, y) + shift, actual.get(x, y), 1e-9, "at (" + x + ", " + y + ")");
            }
        }
    }
    
    @Test
    @DisplayName("Unwraps a tilted phase plane")
    void testTiltedPlane() {
        var phase = plane(40, 30, 0.3, 0.2, -1.0);
        
        assertUnwrapsTo(phase, unwrapper.unwrap(wrapped(phase)));
    }
    
    @Test
    @DisplayName("Unwraps a curved phase surface")
    void testParaboloid() {
        var phase = new HeightMap(40, 30);
        for (int y = 0; y < 30; y++) {
            for (int x = 0; x < 40; x++) {
                double dx = x - 20;
                double dy = y - 15;
                phase.set(x, y, 0.01 * (dx * dx + dy * dy));
            }
        }
        
        assertUnwrapsTo(phase, unwrapper.unwrap(wrapped(phase)));
    }
    
    @Test
    @DisplayName("Continuous phase is left unchanged")
    void testContinuousPhase() {
        var phase = randomMap(16, 16, -0.5, 0.5);
        
        assertMapEquals(phase, unwrapper.unwrap(phase), 0.0);
    }
    
    @Test
    @DisplayName("Thin maps fall back to path order")
    void testSingleRow() {
        var phase = plane(50, 1, 0.5, 0.0, 0.0);
        
        assertUnwrapsTo(phase, unwrapper.unwrap(wrapped(phase)));
    }
    
    @Test
    @DisplayName("Wrap maps into [-pi, pi]")
    void testWrap() {
        assertEquals(0.5, ReliabilityGuidedUnwrapper.wrap(0.5 + 4 * Math.PI), 1e-12);
        assertEquals(-0.5, ReliabilityGuidedUnwrapper.wrap(-0.5 - 2 * Math.PI), 1e-12);
    }
    
    @Test
    @DisplayName("Empty and single pixel maps are returned unchanged")
    void testDegenerate() {
        assertTrue(unwrapper.unwrap(new HeightMap(0, 3)).isEmpty());
        
        var single = HeightMap.fromArray(new double[][]{{2.0}});
        assertEquals(single, unwrapper.unwrap(single));
    }
}
