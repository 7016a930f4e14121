package com.fringe.unwrapping;

import com.fringe.core.HeightMap;
import com.fringe.core.ScanAxis;
import com.fringe.core.UnwrapParameters;

import java.util.Objects;

/**
 * Removes wrap discontinuities of about half a wavelength by scanning rows and then columns and
 * accumulating a running step correction.
 * <p>
 * This is a cumulative step corrector for smoothly varying surfaces with isolated jumps of known
 * size, not a path-following unwrapper. Within one iteration the row pass always precedes the
 * column pass and feeds it. Repeating iterations resolves chained jumps.
 */
public class SequentialThresholdUnwrapper {
    
    /**
     * Unwraps with the iteration count and axes of {@code params}.
     */
    public HeightMap unwrap(HeightMap map, UnwrapParameters params) {
        Objects.requireNonNull(params, "params cannot be null");
        return unwrap(map, params, params.iterations());
    }
    
    /**
     * Unwraps with an explicit iteration count; values below one run a single iteration.
     */
    public HeightMap unwrap(HeightMap map, UnwrapParameters params, int iterations) {
        Objects.requireNonNull(map, "map cannot be null");
        Objects.requireNonNull(params, "params cannot be null");
        
        var result = map.copy();
        if (map.isEmpty()) {
            return result;
        }
        
        for (int i = 0; i < Math.max(1, iterations); i++) {
            if (params.horizontal()) {
                result = scan(result, ScanAxis.HORIZONTAL, params);
            }
            if (params.vertical()) {
                result = scan(result, ScanAxis.VERTICAL, params);
            }
        }
        return result;
    }
    
    /**
     * Single pass along one axis.
     */
    public HeightMap scan(HeightMap map, ScanAxis axis, UnwrapParameters params) {
        return RasterScan.scan(map, axis, params.jumpLimit(), params.correctionStep(), RasterScan.PixelFilter.ALL);
    }
}
