package com.fringe.unwrapping;

import com.fringe.core.HeightMap;
import com.fringe.core.ScanAxis;
import com.fringe.core.TileMask;
import com.fringe.core.UnwrapParameters;

import java.util.Objects;

/**
 * Global raster correction that only trusts jumps found outside bad tiles.
 * <p>
 * Each pass scans every row and then every column exactly like the sequential unwrapper, except
 * that a pixel inside a masked tile neither moves the running offset nor becomes the new reference
 * value. Masked pixels are still written with the offset carried into them, so a bad tile stops an
 * erroneous correction from spreading across its borders while the rest of the line stays
 * consistent. Always runs {@link #PASSES} passes over both axes.
 */
public class MaskedGlobalCorrector {
    
    public static final int PASSES = 3;
    
    public HeightMap correct(HeightMap map, TileMask mask, UnwrapParameters params) {
        Objects.requireNonNull(map, "map cannot be null");
        Objects.requireNonNull(mask, "mask cannot be null");
        Objects.requireNonNull(params, "params cannot be null");
        
        if (mask.tileColumns() != TileMask.tilesFor(map.width(), mask.tileSize())
            || mask.tileRows() != TileMask.tilesFor(map.height(), mask.tileSize())) {
            throw new IllegalArgumentException(
                String.format("%s does not cover %s", mask, map));
        }
        
        var result = map.copy();
        if (map.isEmpty()) {
            return result;
        }
        
        RasterScan.PixelFilter unmasked = (x, y) -> !mask.isBadAtPixel(x, y);
        for (int pass = 0; pass < PASSES; pass++) {
            result = RasterScan.scan(result, ScanAxis.HORIZONTAL, params.jumpLimit(), params.correctionStep(), unmasked);
            result = RasterScan.scan(result, ScanAxis.VERTICAL, params.jumpLimit(), params.correctionStep(), unmasked);
        }
        return result;
    }
}
